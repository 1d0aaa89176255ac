package com.cronium.common.infra;

/**
 * Safe message extraction from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Unwrap {@code CompletionException}/{@code ExecutionException} layers
     * down to the exception that actually failed.
     */
    public static Throwable rootCause(Throwable err) {
        Throwable current = err;
        while ((current instanceof java.util.concurrent.CompletionException
                || current instanceof java.util.concurrent.ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Shorten text for log lines, appending an ellipsis when cut.
     */
    public static String preview(String text, int maxChars) {
        if (text == null)
            return "";
        if (text.length() <= maxChars)
            return text;
        return text.substring(0, Math.max(maxChars, 0)) + "...";
    }
}
