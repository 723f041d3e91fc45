package com.farmerworking.skiplist.in.java.api;

import org.junit.Test;

import java.lang.reflect.Field;
import java.util.Random;

import static org.junit.Assert.*;

public class OptionsTest {
    @Test
    public void testDefault() {
        Options options = new Options();
        assertEquals(16, options.getMaxLevel());
        assertEquals(0.5, options.getProbability(), 0.0);
        assertNull(options.getRandom());
        assertNull(options.getInfoLog());
    }

    @Test
    public void testCopy() throws IllegalAccessException {
        Options src = new Options();

        // set
        src.setMaxLevel(4);
        src.setProbability(0.25);
        src.setRandom(new Random(301));
        src.setInfoLog(new Options.Logger() {
            @Override
            public void log(String msg, String... args) {
            }
        });

        Options dst = new Options(src);
        for(Field field : Options.class.getDeclaredFields()) {
            field.setAccessible(true);
            assertEquals(field.getName(), field.get(src), field.get(dst));
        }
    }

    @Test
    public void testNullLoggerIsIgnored() {
        Options.Logger.log((Options.Logger) null, "level raised", "0", "3");
    }

    @Test
    public void testLoggerReceivesArgs() {
        StringBuilder builder = new StringBuilder();
        Options.Logger logger = (msg, args) -> builder.append(msg).append(args.length);

        Options.Logger.log(logger, "level raised", "0", "3");
        assertEquals("level raised2", builder.toString());
    }
}
