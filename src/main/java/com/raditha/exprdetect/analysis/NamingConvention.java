package com.raditha.exprdetect.analysis;

import com.raditha.exprdetect.model.Decl;

/**
 * Reserved name prefixes of the variables that instrumentation introduces.
 * A variable is a temporary or a guard purely because of its name.
 *
 * @param temporaryPrefix prefix of the temporaries holding captured values
 * @param printedPrefix   prefix of the guards written in emit mode
 * @param checkedPrefix   prefix of the guards written in check mode
 */
public record NamingConvention(
        String temporaryPrefix,
        String printedPrefix,
        String checkedPrefix) {

    public static final String DEFAULT_TEMPORARY_PREFIX = "__cvise_expr_tmp_";
    public static final String DEFAULT_PRINTED_PREFIX = "__cvise_printed_";
    public static final String DEFAULT_CHECKED_PREFIX = "__cvise_checked_";

    public NamingConvention {
        requireNonBlank(temporaryPrefix, "temporary");
        requireNonBlank(printedPrefix, "printed");
        requireNonBlank(checkedPrefix, "checked");
    }

    public static NamingConvention defaults() {
        return new NamingConvention(DEFAULT_TEMPORARY_PREFIX, DEFAULT_PRINTED_PREFIX, DEFAULT_CHECKED_PREFIX);
    }

    public boolean isTemporary(String name) {
        return name != null && name.startsWith(temporaryPrefix);
    }

    public boolean isGuard(String name) {
        return name != null && (name.startsWith(printedPrefix) || name.startsWith(checkedPrefix));
    }

    /**
     * Temporary or guard of either mode.
     */
    public boolean isReserved(String name) {
        return isTemporary(name) || isGuard(name);
    }

    public boolean isReserved(Decl decl) {
        return decl != null && isReserved(decl.getName());
    }

    private static void requireNonBlank(String prefix, String what) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("The " + what + " variable prefix must not be empty");
        }
    }
}
