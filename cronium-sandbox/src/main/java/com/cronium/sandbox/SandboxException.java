package com.cronium.sandbox;

import java.io.IOException;

/**
 * Raised when a sandboxed run cannot be set up or its host cannot be reached.
 * Script-level failures are reported through {@link SandboxTypes.ExecutionResult}
 * instead.
 */
public class SandboxException extends IOException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The remote host failed its connectivity check.
     */
    public static class HostUnreachableException extends SandboxException {

        public HostUnreachableException(String message) {
            super(message);
        }
    }
}
