package com.contrastsecurity.tpack.extract;

/**
 * Raised when a source file cannot be read structurally. Callers recover with a textual scan.
 */
public class ParseDegradedException extends Exception {
    private final int line;

    public ParseDegradedException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
