package com.cronium.engine.dispatch;

import com.cronium.common.config.CroniumConfig;
import com.cronium.common.infra.Backoff;
import com.cronium.sandbox.SandboxException;

/**
 * Retry rules for one target of a multi-target dispatch. Only runs that
 * raised an error are retried; a script that ran and failed, or timed out,
 * is final.
 */
public class TargetRetryPolicy {

    private final int maxAttempts;
    private final Backoff.Linear connectivity;
    private final Backoff.Linear other;

    public TargetRetryPolicy(CroniumConfig.DispatchConfig config) {
        CroniumConfig.DispatchConfig c = config != null ? config : new CroniumConfig.DispatchConfig();
        this.maxAttempts = Math.max(1, c.getMaxAttempts());
        this.connectivity = new Backoff.Linear(c.getConnectivityBackoffBaseMs(), c.getConnectivityBackoffStepMs());
        this.other = new Backoff.Linear(c.getScriptBackoffBaseMs(), c.getScriptBackoffStepMs());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt} (1-based) failed with
     * {@code error}.
     */
    public long delayAfter(int attempt, Throwable error) {
        return isConnectivity(error) ? connectivity.delayFor(attempt) : other.delayFor(attempt);
    }

    static boolean isConnectivity(Throwable error) {
        if (error instanceof SandboxException.HostUnreachableException)
            return true;
        String message = error != null ? error.getMessage() : null;
        return message != null
                && (message.contains("No response from server") || message.contains("not reachable"));
    }
}
