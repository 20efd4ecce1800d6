package com.umitunal.taskq.cron;

import java.util.BitSet;

/**
 * One parsed field of a cron expression: the set of values it allows.
 */
final class CronField {
    private final Type type;
    private final BitSet values;
    private final boolean wildcard;

    private CronField(Type type, BitSet values, boolean wildcard) {
        this.type = type;
        this.values = values;
        this.wildcard = wildcard;
    }

    /**
     * Parse a field. Accepts {@code *}, {@code N}, {@code A-B}, any of those followed by {@code /STEP},
     * and comma-separated lists of them.
     */
    static CronField parse(Type type, String text) {
        if (text.isEmpty()) {
            throw new InvalidCronExpressionException("empty " + type.label + " field");
        }
        BitSet values = new BitSet(type.max + 1);
        for (String item : text.split(",", -1)) {
            parseItem(type, item, values);
        }
        if (type == Type.DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }
        return new CronField(type, values, text.equals("*"));
    }

    boolean matches(int value) {
        return values.get(value);
    }

    /**
     * True when the field was a bare {@code *}.
     */
    boolean isWildcard() {
        return wildcard;
    }

    Type getType() {
        return type;
    }

    private static void parseItem(Type type, String item, BitSet values) {
        if (item.isEmpty()) {
            throw new InvalidCronExpressionException("empty list item in " + type.label + " field");
        }
        String range = item;
        int step = 1;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = parseNumber(type, item.substring(slash + 1));
            if (step < 1) {
                throw new InvalidCronExpressionException("step must be positive in " + type.label + " field: " + item);
            }
        }

        int start;
        int end;
        if (range.equals("*")) {
            start = type.min;
            end = type.max;
        } else if (range.indexOf('-') > 0) {
            int dash = range.indexOf('-');
            start = parseValue(type, range.substring(0, dash));
            end = parseValue(type, range.substring(dash + 1));
            if (end < start) {
                throw new InvalidCronExpressionException("descending range in " + type.label + " field: " + item);
            }
        } else {
            start = parseValue(type, range);
            // "N/STEP" runs from N to the end of the field
            end = slash >= 0 ? type.max : start;
        }

        for (int value = start; value <= end; value += step) {
            values.set(value);
        }
    }

    private static int parseValue(Type type, String text) {
        int value = parseNumber(type, text);
        if (value < type.min || value > type.max) {
            throw new InvalidCronExpressionException(
                    type.label + " value " + value + " out of range " + type.min + "-" + type.max);
        }
        return value;
    }

    private static int parseNumber(Type type, String text) {
        if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InvalidCronExpressionException("not a number in " + type.label + " field: '" + text + "'");
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new InvalidCronExpressionException("number too large in " + type.label + " field: " + text);
        }
    }

    enum Type {
        MINUTE("minute", 0, 59),
        HOUR("hour", 0, 23),
        DAY_OF_MONTH("day-of-month", 1, 31),
        MONTH("month", 1, 12),
        DAY_OF_WEEK("day-of-week", 0, 7);   // 0 and 7 are both Sunday

        private final String label;
        private final int min;
        private final int max;

        Type(String label, int min, int max) {
            this.label = label;
            this.min = min;
            this.max = max;
        }
    }
}
