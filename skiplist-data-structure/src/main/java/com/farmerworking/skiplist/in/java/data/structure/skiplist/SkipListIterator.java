package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import com.farmerworking.skiplist.in.java.api.IndexIterator;

// note: no back links are kept, so there is no prev() or seekToLast()
class SkipListIterator<K, V> implements IndexIterator<K, V> {
    private final SkipListNode<K, V> header;
    private SkipListNode<K, V> current;

    SkipListIterator(SkipListNode<K, V> header) {
        this.header = header;
        this.current = null;
    }

    @Override
    public boolean valid() {
        return current != null;
    }

    @Override
    public void seekToFirst() {
        current = header.next(0);
    }

    @Override
    public void next() {
        assert valid();
        current = current.next(0);
    }

    @Override
    public K key() {
        assert valid();
        return current.getKey();
    }

    @Override
    public V value() {
        assert valid();
        return current.getValue();
    }
}
