package com.farmerworking.skiplist.in.java.data.structure.logging;

import com.farmerworking.skiplist.in.java.api.Options;
import com.google.gson.Gson;
import org.slf4j.LoggerFactory;

public class LogImpl implements Options.Logger {
    private final Gson gson;
    private final org.slf4j.Logger logger;

    public LogImpl(String name) {
        this(LoggerFactory.getLogger(name));
    }

    public LogImpl(Class<?> clazz) {
        this(LoggerFactory.getLogger(clazz));
    }

    LogImpl(org.slf4j.Logger logger) {
        this.logger = logger;
        this.gson = new Gson();
    }

    @Override
    public void log(String msg, String... args) {
        if (args != null && args.length > 0) {
            this.logger.info("{}, args: {}", msg, gson.toJson(args));
        } else {
            this.logger.info(msg);
        }
    }
}
