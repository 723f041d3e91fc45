package com.farmerworking.skiplist.in.java.api;

import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

public interface OrderedIndex<K, V> {
    // Returns the value mapped to key, or null if key is absent.
    V search(K key);

    // Returns true iff an entry that compares equal to key is in the index.
    boolean contains(K key);

    // Map key to value. An existing entry for key keeps its position and
    // only has its value replaced.
    // REQUIRES: key != null && value != null
    void insert(K key, V value);

    // Remove the entry for key. Returns false, leaving the index untouched,
    // if no such entry exists.
    boolean delete(K key);

    // All entries in ascending key order, as of the time of the call.
    List<Pair<K, V>> toOrderedSequence();

    // Number of entries.
    int size();

    boolean isEmpty();

    // Forward cursor over the entries in ascending key order.
    // The returned iterator is not positioned; call seekToFirst() first.
    IndexIterator<K, V> iterator();

    // Per-level listing of the entries, highest level first.
    // For debugging only; the format is not stable.
    String dumpStructure();
}
