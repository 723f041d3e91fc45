package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import lombok.Getter;
import lombok.Setter;

// A node owns no back-references: it is reachable only through the
// forward links of its predecessors (or the header) at each of its levels.
class SkipListNode<K, V> {
    @Getter
    private final K key;
    @Getter
    @Setter
    private V value;

    private final SkipListNode<K, V>[] forward;

    SkipListNode(K key, V value, int level) {
        this.key = key;
        this.value = value;
        this.forward = new SkipListNode[level + 1];
    }

    static <K, V> SkipListNode<K, V> header(int maxLevel) {
        return new SkipListNode<>(null, null, maxLevel);
    }

    // Highest level this node is linked at.
    int level() {
        return forward.length - 1;
    }

    SkipListNode<K, V> next(int level) {
        assert level <= level();
        return forward[level];
    }

    void setNext(int level, SkipListNode<K, V> node) {
        assert level <= level();
        forward[level] = node;
    }
}
