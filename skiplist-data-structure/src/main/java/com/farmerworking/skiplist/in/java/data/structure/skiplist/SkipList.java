package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import com.farmerworking.skiplist.in.java.api.IndexIterator;
import com.farmerworking.skiplist.in.java.api.Options;
import com.farmerworking.skiplist.in.java.api.OrderedIndex;
import com.farmerworking.skiplist.in.java.common.Status;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

// Thread safety
// -------------
//
// Writes require external synchronization, most likely a mutex.
// Reads are not safe against concurrent writes either; callers that mix
// readers and a writer must serialize them at the boundary.
//
// Invariants:
//
// (1) At every level <= currentLevel the nodes reachable from the header
// have strictly increasing keys.
//
// (2) A node linked at level i is linked at every level below i.
//
// (3) No node is linked above currentLevel. currentLevel is lowered right
// after a delete empties the top levels.
public class SkipList<K, V> implements OrderedIndex<K, V> {
    private final Comparator<? super K> comparator;
    private final Options options;
    private final Random random;
    private final int maxLevel;
    private final double probability;

    private final SkipListNode<K, V> header;
    private int currentLevel;
    private int count;

    public SkipList(Comparator<? super K> comparator) {
        this(comparator, new Options());
    }

    public SkipList(Comparator<? super K> comparator, int maxLevel, double probability) {
        this(comparator, optionsOf(maxLevel, probability));
    }

    public SkipList(Comparator<? super K> comparator, Options options) {
        Status status = validate(comparator, options);
        if (status.isNotOk()) {
            throw new IllegalArgumentException(status.toString());
        }

        this.comparator = comparator;
        this.options = sanitizeOptions(options);
        this.random = this.options.getRandom();
        this.maxLevel = this.options.getMaxLevel();
        this.probability = this.options.getProbability();

        this.header = SkipListNode.header(maxLevel);
        this.currentLevel = 0;
        this.count = 0;
    }

    public static <K extends Comparable<? super K>, V> SkipList<K, V> naturalOrder() {
        return new SkipList<K, V>(Comparator.<K>naturalOrder());
    }

    public static <K extends Comparable<? super K>, V> SkipList<K, V> naturalOrder(Options options) {
        return new SkipList<K, V>(Comparator.<K>naturalOrder(), options);
    }

    @Override
    public V search(K key) {
        Preconditions.checkNotNull(key, "key");
        SkipListNode<K, V> node = findGreaterOrEqual(key, null);
        if (node != null && comparator.compare(node.getKey(), key) == 0) {
            return node.getValue();
        } else {
            return null;
        }
    }

    @Override
    public boolean contains(K key) {
        return search(key) != null;
    }

    @Override
    public void insert(K key, V value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");

        SkipListNode<K, V>[] update = newUpdateTable();
        SkipListNode<K, V> node = findGreaterOrEqual(key, update);

        if (node != null && comparator.compare(node.getKey(), key) == 0) {
            node.setValue(value);
            return;
        }

        int level = randomLevel();
        if (level > currentLevel) {
            for (int i = currentLevel + 1; i <= level; i++) {
                update[i] = header;
            }
            Options.Logger.log(options.getInfoLog(),
                    String.format("level raised from %d to %d", currentLevel, level));
            currentLevel = level;
        }

        node = new SkipListNode<>(key, value, level);
        for (int i = 0; i <= level; i++) {
            node.setNext(i, update[i].next(i));
            update[i].setNext(i, node);
        }
        count++;
    }

    @Override
    public boolean delete(K key) {
        Preconditions.checkNotNull(key, "key");

        SkipListNode<K, V>[] update = newUpdateTable();
        SkipListNode<K, V> node = findGreaterOrEqual(key, update);

        if (node == null || comparator.compare(node.getKey(), key) != 0) {
            return false;
        }

        // membership is a prefix of levels, so the first predecessor that does
        // not point at node marks its top
        for (int i = 0; i <= currentLevel; i++) {
            if (update[i].next(i) != node) {
                break;
            }
            update[i].setNext(i, node.next(i));
        }

        int previousLevel = currentLevel;
        while (currentLevel > 0 && header.next(currentLevel) == null) {
            currentLevel--;
        }
        if (currentLevel != previousLevel) {
            Options.Logger.log(options.getInfoLog(),
                    String.format("level lowered from %d to %d", previousLevel, currentLevel));
        }

        count--;
        return true;
    }

    @Override
    public List<Pair<K, V>> toOrderedSequence() {
        List<Pair<K, V>> result = Lists.newArrayListWithCapacity(count);
        for (SkipListNode<K, V> node = header.next(0); node != null; node = node.next(0)) {
            result.add(Pair.of(node.getKey(), node.getValue()));
        }
        return result;
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public IndexIterator<K, V> iterator() {
        return new SkipListIterator<>(header);
    }

    @Override
    public String dumpStructure() {
        StringBuilder builder = new StringBuilder();
        for (int i = currentLevel; i >= 0; i--) {
            builder.append("Level ").append(i).append(":");
            for (SkipListNode<K, V> node = header.next(i); node != null; node = node.next(i)) {
                builder.append(" (").append(node.getKey()).append(", ").append(node.getValue()).append(")");
            }
            if (i > 0) {
                builder.append(System.lineSeparator());
            }
        }
        return builder.toString();
    }

    public int getCurrentLevel() {
        return currentLevel;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public double getProbability() {
        return probability;
    }

    SkipListNode<K, V> getHeader() {
        return header;
    }

    // Draws before checking the cap, so a node that tops out at maxLevel
    // still consumes one draw.
    int randomLevel() {
        int level = 0;
        while (random.nextDouble() < probability && level < maxLevel) {
            level++;
        }
        assert level >= 0 && level <= maxLevel;
        return level;
    }

    // Return the earliest node that comes at or after key.
    // Return null if there is no such node.
    //
    // If update is non-null, fills update[level] with the last node visited
    // before descending from level, for every level in [0..currentLevel].
    private SkipListNode<K, V> findGreaterOrEqual(K key, SkipListNode<K, V>[] update) {
        SkipListNode<K, V> current = header;
        for (int i = currentLevel; i >= 0; i--) {
            SkipListNode<K, V> next = current.next(i);
            while (next != null && comparator.compare(next.getKey(), key) < 0) {
                current = next;
                next = current.next(i);
            }
            if (update != null) {
                update[i] = current;
            }
        }
        return current.next(0);
    }

    private SkipListNode<K, V>[] newUpdateTable() {
        return new SkipListNode[maxLevel + 1];
    }

    static Status validate(Comparator<?> comparator, Options options) {
        if (comparator == null) {
            return Status.InvalidArgument("comparator", "must not be null");
        }
        if (options == null) {
            return Status.InvalidArgument("options", "must not be null");
        }
        if (options.getMaxLevel() < 0 || options.getMaxLevel() > Options.MAX_LEVEL_LIMIT) {
            return Status.InvalidArgument("maxLevel",
                    String.format("must be in [0, %d], got %d", Options.MAX_LEVEL_LIMIT, options.getMaxLevel()));
        }
        double probability = options.getProbability();
        if (!(probability > 0 && probability < 1)) {
            return Status.InvalidArgument("probability", String.format("must be in (0, 1), got %s", probability));
        }
        return Status.OK();
    }

    static Options sanitizeOptions(Options src) {
        Options result = new Options(src);
        if (result.getRandom() == null) {
            result.setRandom(new Random());
        }
        return result;
    }

    private static Options optionsOf(int maxLevel, double probability) {
        Options options = new Options();
        options.setMaxLevel(maxLevel);
        options.setProbability(probability);
        return options;
    }
}
