package com.raditha.exprdetect.model;

import java.util.Locale;

/**
 * Language dialect of a translation unit.
 * Only {@link #C} inputs are instrumented; {@link #CXX} inputs report zero instances.
 */
public enum Dialect {
    C,
    CXX;

    /**
     * Guess the dialect from a file name extension.
     * Anything that is not a recognised C++ extension is treated as C.
     */
    public static Dialect fromFileName(String fileName) {
        if (fileName == null) {
            return C;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return C;
        }
        String extension = fileName.substring(dot + 1);
        if (extension.equals("C")) {
            return CXX;
        }
        return switch (extension.toLowerCase(Locale.ROOT)) {
            case "cc", "cpp", "cxx", "c++", "hpp", "hh", "hxx" -> CXX;
            default -> C;
        };
    }

    /**
     * Parse a CLI/YAML value: "c", "c++"/"cxx"/"cpp".
     */
    public static Dialect fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dialect value cannot be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "c" -> C;
            case "c++", "cxx", "cpp" -> CXX;
            default -> throw new IllegalArgumentException(
                    "Invalid language: " + value + ". Must be: c or c++");
        };
    }
}
