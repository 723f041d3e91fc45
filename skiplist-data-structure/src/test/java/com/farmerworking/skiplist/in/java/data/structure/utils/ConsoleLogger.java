package com.farmerworking.skiplist.in.java.data.structure.utils;

import com.farmerworking.skiplist.in.java.api.Options;
import com.google.gson.Gson;

// Prints to stdout and counts what it printed.
public class ConsoleLogger implements Options.Logger {
    private final Gson gson = new Gson();
    private int lines = 0;

    @Override
    public void log(String msg, String... args) {
        lines++;
        if (args != null && args.length > 0) {
            System.out.println("[skiplist] " + msg + " " + gson.toJson(args));
        } else {
            System.out.println("[skiplist] " + msg);
        }
    }

    public int lines() {
        return lines;
    }
}
