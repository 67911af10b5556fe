package com.raditha.exprdetect.frontend;

/**
 * The front end could not lex or parse the input.
 */
public class SourceParseException extends RuntimeException {

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
