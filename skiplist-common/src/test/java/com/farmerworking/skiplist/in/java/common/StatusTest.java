package com.farmerworking.skiplist.in.java.common;

import org.junit.Test;

import static org.junit.Assert.*;

public class StatusTest {
    @Test
    public void testOk() {
        Status status = Status.OK();
        assertTrue(status.isOk());
        assertFalse(status.isNotOk());
        assertFalse(status.isNotFound());
        assertEquals("OK", status.toString());
    }

    @Test
    public void testNotFound() {
        Status status = Status.NotFound("employee", "1008");
        assertTrue(status.isNotOk());
        assertTrue(status.isNotFound());
        assertFalse(status.isInvalidArgument());
        assertEquals("employee: 1008", status.getMessage());
        assertEquals("NotFound: employee: 1008", status.toString());
    }

    @Test
    public void testInvalidArgument() {
        Status status = Status.InvalidArgument("probability must be in (0, 1)");
        assertTrue(status.isInvalidArgument());
        assertEquals("Invalid argument: probability must be in (0, 1)", status.toString());
    }

    @Test
    public void testInvalidArgumentWithReason() {
        Status status = Status.InvalidArgument("maxLevel", "must be in [0, 1024], got -1");
        assertTrue(status.isNotOk());
        assertEquals("maxLevel: must be in [0, 1024], got -1", status.getMessage());
        assertEquals("Invalid argument: maxLevel: must be in [0, 1024], got -1", status.toString());
    }

    @Test
    public void testEmptyMessage() {
        assertEquals("NotFound", Status.NotFound("").toString());
    }

    @Test
    public void testCopy() {
        Status src = Status.NotFound("key");
        Status dst = new Status(src);
        assertTrue(dst.isNotFound());
        assertEquals(src.toString(), dst.toString());
    }
}
