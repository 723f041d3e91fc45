package com.farmerworking.skiplist.in.java.data.structure.recordstore;

import com.farmerworking.skiplist.in.java.api.Options;
import com.farmerworking.skiplist.in.java.api.OrderedIndex;
import com.farmerworking.skiplist.in.java.common.Status;
import com.farmerworking.skiplist.in.java.data.structure.skiplist.SkipList;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

// Two independent indexes over the same records:
//     employees:   id     -> employee
//     salaryIndex: salary -> id
//
// The salary index holds one id per salary. When two employees share a
// salary the later one owns the slot, and the earlier one is only reachable
// by id.
public class EmployeeDatabase {
    private final Options options;
    private final OrderedIndex<Integer, Employee> employees;
    private final OrderedIndex<Double, Integer> salaryIndex;

    public EmployeeDatabase() {
        this(new Options());
    }

    public EmployeeDatabase(Options options) {
        this.options = new Options(options);
        this.employees = SkipList.naturalOrder(this.options);
        this.salaryIndex = SkipList.naturalOrder(this.options);
    }

    public void addEmployee(int id, String name, String department, double salary) {
        Employee previous = employees.search(id);
        if (previous != null) {
            dropSalaryEntry(previous);
        }

        employees.insert(id, new Employee(id, name, department, salary));
        salaryIndex.insert(salary, id);
        Options.Logger.log(options.getInfoLog(), String.format("Added employee: %s (ID: %d)", name, id));
    }

    // Returns null if no employee has this id.
    public Employee getEmployee(int id) {
        return employees.search(id);
    }

    // Returns null if no employee currently owns this salary slot.
    public Employee findBySalary(double salary) {
        Integer id = salaryIndex.search(salary);
        return id == null ? null : employees.search(id);
    }

    public Status updateSalary(int id, double newSalary) {
        Employee employee = employees.search(id);
        if (employee == null) {
            return Status.NotFound("employee", String.valueOf(id));
        }

        dropSalaryEntry(employee);
        employees.insert(id, employee.withSalary(newSalary));
        salaryIndex.insert(newSalary, id);

        Options.Logger.log(options.getInfoLog(),
                String.format("Updated salary of employee %d from %s to %s", id, employee.getSalary(), newSalary));
        return Status.OK();
    }

    public Status removeEmployee(int id) {
        Employee employee = employees.search(id);
        if (employee == null) {
            return Status.NotFound("employee", String.valueOf(id));
        }

        dropSalaryEntry(employee);
        boolean deleted = employees.delete(id);
        assert deleted;

        Options.Logger.log(options.getInfoLog(), String.format("Removed employee: %s (ID: %d)", employee.getName(), id));
        return Status.OK();
    }

    // Sorted by id.
    public List<Pair<Integer, Employee>> listAllEmployees() {
        return employees.toOrderedSequence();
    }

    // Sorted by salary.
    public List<Pair<Double, Integer>> listBySalary() {
        return salaryIndex.toOrderedSequence();
    }

    public int employeeCount() {
        return employees.size();
    }

    public String displayStructure() {
        return employees.dumpStructure();
    }

    // The slot may already belong to someone else with the same salary.
    private void dropSalaryEntry(Employee employee) {
        Integer owner = salaryIndex.search(employee.getSalary());
        if (owner != null && owner == employee.getId()) {
            salaryIndex.delete(employee.getSalary());
        }
    }
}
