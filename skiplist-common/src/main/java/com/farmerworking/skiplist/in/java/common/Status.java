package com.farmerworking.skiplist.in.java.common;

import org.apache.commons.lang3.StringUtils;

// Outcome of an index or record-store call that can miss or be misconfigured.
// A miss is an ordinary result here, so it travels as a value instead of an
// exception; callers that need to throw render it with toString().
public class Status {
    private final Code code;
    private final String message;

    public Status() {
        this(Code.kOk, null);
    }

    public Status(Status status) {
        this(status.code, status.message);
    }

    private Status(Code code, String message) {
        this.code = code;
        this.message = message;
    }

    public boolean isOk() { return code == Code.kOk; }

    public boolean isNotOk() { return code != Code.kOk; }

    // The key or record asked for is absent.
    public boolean isNotFound() { return code == Code.kNotFound; }

    // A setting was rejected at construction time.
    public boolean isInvalidArgument() { return code == Code.kInvalidArgument; }

    public String getMessage() {
        return message;
    }

    // "OK", "NotFound: employee: 1008", "Invalid argument: maxLevel: ..."
    @Override
    public String toString() {
        if (StringUtils.isEmpty(message)) {
            return code.display;
        }
        return code.display + ": " + message;
    }

    public static Status OK() {
        return new Status();
    }

    public static Status NotFound(String what) {
        return new Status(Code.kNotFound, what);
    }

    public static Status NotFound(String what, String which) {
        return new Status(Code.kNotFound, what + ": " + which);
    }

    public static Status InvalidArgument(String setting) {
        return new Status(Code.kInvalidArgument, setting);
    }

    public static Status InvalidArgument(String setting, String reason) {
        return new Status(Code.kInvalidArgument, setting + ": " + reason);
    }

    enum Code {
        kOk("OK"),
        kNotFound("NotFound"),
        kInvalidArgument("Invalid argument");

        private final String display;

        Code(String display) {
            this.display = display;
        }
    }
}
