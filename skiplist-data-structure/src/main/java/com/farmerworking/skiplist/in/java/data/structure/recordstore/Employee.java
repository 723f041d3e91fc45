package com.farmerworking.skiplist.in.java.data.structure.recordstore;

import lombok.Value;
import lombok.With;

// Immutable: the salary index keys on salary, so a record is replaced
// rather than changed in place.
@Value
@With
public class Employee {
    int id;
    String name;
    String department;
    double salary;
}
