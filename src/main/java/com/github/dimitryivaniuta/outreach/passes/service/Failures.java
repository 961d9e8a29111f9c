package com.github.dimitryivaniuta.outreach.passes.service;

/**
 * Turns exceptions into the bounded text stored in {@code error_message} columns.
 */
final class Failures {

    static final int MAX_LENGTH = 2000;

    private Failures() {
    }

    static String describe(Throwable ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = ex.getClass().getSimpleName();
        }
        return truncate(msg);
    }

    static String truncate(String msg) {
        if (msg != null && msg.length() > MAX_LENGTH) {
            return msg.substring(0, MAX_LENGTH);
        }
        return msg;
    }
}
