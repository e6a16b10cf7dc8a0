package com.cassandra.log.analyzer;

/**
 * Small scanning helpers shared by the schema and log message grammars.
 */
public final class TextUtil {

    private TextUtil() {
    }

    /**
     * Case-insensitive {@link String#indexOf(String, int)} that keeps offsets aligned with
     * the original text.
     */
    public static int indexOfIgnoreCase(String text, String needle, int fromIndex) {
        if (text == null || needle == null) {
            return -1;
        }
        int last = text.length() - needle.length();
        for (int i = Math.max(fromIndex, 0); i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    public static boolean startsWithIgnoreCase(String text, String prefix) {
        return text != null && text.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    /**
     * Text between the first {@code before} (matched ignoring case) and the earliest of
     * the {@code terminators} after it, or the end of the text. Null when {@code before}
     * is missing.
     */
    public static String sliceIgnoreCase(String text, String before, char... terminators) {
        int start = indexOfIgnoreCase(text, before, 0);
        if (start == -1) {
            return null;
        }
        start += before.length();
        int end = indexOfAny(text, start, terminators);
        return text.substring(start, end == -1 ? text.length() : end);
    }

    /**
     * Position of the earliest of {@code chars} at or after {@code fromIndex}, or -1.
     */
    public static int indexOfAny(String text, int fromIndex, char... chars) {
        for (int i = Math.max(fromIndex, 0); i < text.length(); i++) {
            char c = text.charAt(i);
            for (char candidate : chars) {
                if (c == candidate) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Removes every leading and trailing occurrence of {@code c}.
     */
    public static String strip(String text, char c) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == c) {
            start++;
        }
        while (end > start && text.charAt(end - 1) == c) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Position of the parenthesis closing the one at {@code openIndex}, or -1.
     */
    public static int findClosingParen(String text, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
