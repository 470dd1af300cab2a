package com.analystpilot.orchestrator.service;

import java.util.regex.Pattern;

/**
 * Client-supplied file names are untrusted; everything that reaches the disk
 * goes through {@link #sanitize}.
 */
public final class FileNames {

    private static final Pattern RESERVED = Pattern.compile("[<>:\"|?*]");

    private FileNames() {}

    /**
     * Drop any directory part, replace characters that are reserved on common
     * filesystems with {@code _}, trim spaces and dots. Never returns blank.
     */
    public static String sanitize(String filename) {
        if (filename == null) {
            return "untitled";
        }
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        name = RESERVED.matcher(name).replaceAll("_");
        name = trim(name);
        return name.isEmpty() ? "untitled" : name;
    }

    private static String trim(String s) {
        int start = 0;
        int end   = s.length();
        while (start < end && isTrimmed(s.charAt(start))) start++;
        while (end > start && isTrimmed(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    private static boolean isTrimmed(char c) {
        return c == ' ' || c == '.';
    }
}
