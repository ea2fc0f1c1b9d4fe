package com.contrastsecurity.tpack.runtime;

/**
 * A dotted capability path has no entry at one of its segments.
 */
public class ActionNotDeclaredException extends Exception {
    private final String path;
    private final String segment;

    public ActionNotDeclaredException(String path, String segment) {
        super("Action not declared: " + path + " (no '" + segment + "')");
        this.path = path;
        this.segment = segment;
    }

    public String getPath() {
        return path;
    }

    /**
     * First segment of the path that could not be found.
     */
    public String getSegment() {
        return segment;
    }
}
