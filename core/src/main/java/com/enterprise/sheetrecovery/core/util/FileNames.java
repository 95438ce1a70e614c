package com.enterprise.sheetrecovery.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class FileNames {

    public static final String DEFAULT_NAME = "converted_file";

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_가-힣.\\-]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");
    private static final Pattern EXTENSION = Pattern.compile("\\.[^.]+$");

    private FileNames() {
    }

    public static String sanitize(String filename) {
        return sanitize(filename, DEFAULT_NAME);
    }

    /**
     * Replaces everything but ASCII letters, digits, Korean syllables, '.', '-' and '_' with
     * '_' and collapses underscore runs.
     */
    public static String sanitize(String filename, String fallback) {
        if (filename == null) {
            return fallback;
        }
        String sanitized = UNDERSCORE_RUN.matcher(UNSAFE.matcher(filename).replaceAll("_"))
                .replaceAll("_")
                .trim();
        return sanitized.isEmpty() ? fallback : sanitized;
    }

    public static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        return EXTENSION.matcher(filename).replaceAll("");
    }

    /**
     * Lower-cased extension without the dot, or the empty string.
     */
    public static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
