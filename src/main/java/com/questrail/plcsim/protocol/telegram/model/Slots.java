package com.questrail.plcsim.protocol.telegram.model;

/**
 * Fixed-width slot helpers shared by the payload views.
 */
final class Slots
{
    private Slots() {}

    /** Trimmed substring {@code [from, to)}, clamped to the data length. */
    static String field(String data, int from, int to)
    {
        int end = Math.min(to, data.length());
        if (from >= end) {
            return "";
        }
        return data.substring(from, end).strip();
    }

    /** Truncates to {@code width}, then right-pads with spaces. */
    static String pad(String value, int width)
    {
        String v = value == null ? "" : value;
        if (v.length() >= width) {
            return v.substring(0, width);
        }
        return v + " ".repeat(width - v.length());
    }
}
