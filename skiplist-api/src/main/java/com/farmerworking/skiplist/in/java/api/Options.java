package com.farmerworking.skiplist.in.java.api;

import lombok.Data;

import java.util.Random;

@Data
public class Options {
    // Upper bound accepted for maxLevel. The header and every update table
    // hold maxLevel + 1 links, and an int count of nodes never needs more.
    public static final int MAX_LEVEL_LIMIT = 1024;

    // Highest level a node may occupy. Level 0 holds every node, so a list
    // built with maxLevel == 0 degenerates to a sorted linked list.
    // Lookups stay O(log n) on average only while n is well below
    // (1/probability)^(maxLevel+1).
    //
    // REQUIRES: 0 <= maxLevel <= MAX_LEVEL_LIMIT
    // Default: 16
    private int maxLevel = 16;

    // Probability that a node is promoted one more level when it is created.
    // Expected node height is 1/(1-probability).
    //
    // REQUIRES: 0 < probability < 1
    // Default: 0.5
    private double probability = 0.5;

    // Source of the level draws. Pass a seeded instance to make the shape of
    // the list reproducible.
    // Default: nullptr, a fresh Random is created for every list
    private Random random = null;

    // Structural events (level growth and shrink) are written here if non-null.
    // Default: nullptr
    private Logger infoLog = null;

    public Options() {}

    public Options(Options options) {
        this.maxLevel = options.maxLevel;
        this.probability = options.probability;
        this.random = options.random;
        this.infoLog = options.infoLog;
    }

    public interface Logger {
        void log(String msg, String... args);

        static void log(Logger logger, String msg, String... args) {
            if (logger != null) {
                logger.log(msg, args);
            }
        }
    }
}
