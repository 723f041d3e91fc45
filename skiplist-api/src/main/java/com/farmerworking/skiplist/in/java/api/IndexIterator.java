package com.farmerworking.skiplist.in.java.api;

public interface IndexIterator<K, V> {
    // An iterator is either positioned at a key/value pair, or
    // not valid.  This method returns true iff the iterator is valid.
    boolean valid();

    // Position at the first key in the source.  The iterator is Valid()
    // after this call iff the source is not empty.
    void seekToFirst();

    // Moves to the next entry in the source.  After this call, Valid() is
    // true iff the iterator was not positioned at the last entry in the source.
    // REQUIRES: Valid()
    void next();

    // Return the key for the current entry
    // REQUIRES: Valid()
    K key();

    // Return the value for the current entry
    // REQUIRES: Valid()
    V value();
}
