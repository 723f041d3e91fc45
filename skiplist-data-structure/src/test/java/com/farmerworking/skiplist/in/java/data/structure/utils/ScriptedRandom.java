package com.farmerworking.skiplist.in.java.data.structure.utils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

// Replays a fixed sequence of nextDouble() draws; once the script runs out
// every draw is 0.99, which never promotes for probability <= 0.99.
public class ScriptedRandom extends Random {
    private static final double PROMOTE = 0.01;
    private static final double STOP = 0.99;

    private final Deque<Double> draws = new ArrayDeque<>();

    public ScriptedRandom(double... draws) {
        for (double draw : draws) {
            this.draws.addLast(draw);
        }
    }

    // Draws that make successive inserts land on exactly the given levels.
    public static ScriptedRandom levels(int... levels) {
        ScriptedRandom random = new ScriptedRandom();
        for (int level : levels) {
            for (int i = 0; i < level; i++) {
                random.draws.addLast(PROMOTE);
            }
            random.draws.addLast(STOP);
        }
        return random;
    }

    public int remaining() {
        return draws.size();
    }

    @Override
    public double nextDouble() {
        Double draw = draws.pollFirst();
        return draw == null ? STOP : draw;
    }
}
