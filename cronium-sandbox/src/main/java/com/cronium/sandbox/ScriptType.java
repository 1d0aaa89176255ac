package com.cronium.sandbox;

/**
 * Kinds of work an event can run.
 */
public enum ScriptType {
    BASH("cronium.sh", ".sh"),
    PYTHON("cronium.py", ".py"),
    NODEJS("cronium.js", ".js"),
    HTTP_REQUEST(null, null);

    private final String helperFile;
    private final String extension;

    ScriptType(String helperFile, String extension) {
        this.helperFile = helperFile;
        this.extension = extension;
    }

    /** Runtime helper stub copied next to the script, or null for HTTP requests. */
    public String helperFile() {
        return helperFile;
    }

    public String extension() {
        return extension;
    }

    public boolean isScript() {
        return this != HTTP_REQUEST;
    }

    public String key() {
        return name().toLowerCase();
    }

    public static ScriptType fromKey(String key) {
        if (key == null)
            return null;
        for (ScriptType t : values()) {
            if (t.name().equalsIgnoreCase(key) || t.key().equals(key))
                return t;
        }
        return null;
    }
}
