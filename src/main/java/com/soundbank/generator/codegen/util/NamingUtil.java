package com.soundbank.generator.codegen.util;

import java.util.Locale;
import java.util.Set;

/**
 * Utility for artifact file names.
 */
public class NamingUtil {

    /** Longest base name kept before truncating; leaves room for suffixes and the extension. */
    public static final int MAX_NAME_LENGTH = 120;

    private NamingUtil() {
        // Utility class
    }

    /**
     * Replaces characters most file systems reject and trims the result to a usable length.
     */
    public static String toFileName(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        String result = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").strip();
        // trailing dots are dropped on some file systems
        result = result.replaceAll("\\.+$", "");
        if (result.length() > MAX_NAME_LENGTH) {
            result = result.substring(0, MAX_NAME_LENGTH).strip() + "~";
        }
        return result.isEmpty() ? "unnamed" : result;
    }

    /**
     * Disambiguates a name by appending a number suffix. Comparison ignores case, since
     * output may land on a case-insensitive file system. The returned name is added to
     * {@code usedNames}.
     */
    public static String disambiguate(String baseName, Set<String> usedNames) {
        String candidate = baseName;
        int suffix = 2;
        while (usedNames.contains(candidate.toLowerCase(Locale.ROOT))) {
            candidate = baseName + " #" + suffix;
            suffix++;
        }
        usedNames.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }
}
