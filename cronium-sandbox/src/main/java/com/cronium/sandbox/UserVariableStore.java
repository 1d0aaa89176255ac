package com.cronium.sandbox;

import java.util.Map;

/**
 * Per-user key/value variables that scripts read and write through
 * {@code variables.json}.
 */
public interface UserVariableStore {

    Map<String, String> getVariables(String userId);

    void setVariable(String userId, String key, String value);

    void deleteVariable(String userId, String key);

    /**
     * Persist a post-run diff: upserts first, then removals.
     */
    default void apply(String userId, HandoffFiles.VariableDiff diff) {
        diff.upserts().forEach((key, value) -> setVariable(userId, key, value));
        diff.removals().forEach(key -> deleteVariable(userId, key));
    }
}
