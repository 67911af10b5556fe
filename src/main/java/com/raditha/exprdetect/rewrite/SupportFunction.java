package com.raditha.exprdetect.rewrite;

import com.raditha.exprdetect.config.InstrumentMode;

/**
 * Library function that an instrumentation block calls, with the prototype to
 * prepend when the unit does not declare it and the header that would.
 */
public enum SupportFunction {
    PRINTF("printf", "int printf(const char *format, ...)", "stdio.h"),
    ABORT("abort", "void abort(void)", "stdlib.h");

    private final String functionName;
    private final String declaration;
    private final String header;

    SupportFunction(String functionName, String declaration, String header) {
        this.functionName = functionName;
        this.declaration = declaration;
        this.header = header;
    }

    public static SupportFunction forMode(InstrumentMode mode) {
        return switch (mode) {
            case EMIT -> PRINTF;
            case CHECK -> ABORT;
            case REPLACE -> throw new IllegalArgumentException("Replace mode calls no support function");
        };
    }

    public String functionName() {
        return functionName;
    }

    public String declaration() {
        return declaration;
    }

    public String header() {
        return header;
    }
}
