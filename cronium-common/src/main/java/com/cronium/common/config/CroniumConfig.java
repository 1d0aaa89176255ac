package com.cronium.common.config;

import lombok.Data;

/**
 * Root configuration type for Cronium.
 */
@Data
public class CroniumConfig {

    /** Scheduler settings. */
    private SchedulerConfig scheduler;

    /** Script sandbox settings. */
    private SandboxConfig sandbox;

    /** Multi-target dispatch settings. */
    private DispatchConfig dispatch;

    /** Conditional-action notification settings. */
    private NotificationsConfig notifications;

    /** Event store settings. */
    private StoreConfig store;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class SchedulerConfig {
        /** Whether timers are armed at startup. */
        private boolean enabled = true;
        /** Minimum time between two initialization passes. */
        private long initCooldownMs = 60_000;
        /** Threads used for timer callbacks. */
        private int timerThreads = 2;
        /** Threads used for event dispatch bodies. */
        private int workerThreads = 8;
        /** Zone used to evaluate recurrence rules (null = system default). */
        private String timezone;
    }

    @Data
    public static class SandboxConfig {
        /** Parent directory for per-run working directories (null = java.io.tmpdir). */
        private String workDir;
        private String bashCommand = "bash";
        private String pythonCommand = "python3";
        private String nodeCommand = "node";
        /** Default script timeout when the event carries none. */
        private long defaultTimeoutMs = 30_000;
        /** Fixed timeout for HTTP-request events. */
        private long httpTimeoutMs = 30_000;
        /** Timeout for the remote connectivity check. */
        private long connectTimeoutMs = 10_000;
        private String sshCommand = "ssh";
    }

    @Data
    public static class DispatchConfig {
        private long staggerBaseMs = 750;
        private long staggerStepMs = 250;
        private int maxAttempts = 3;
        private long connectivityBackoffBaseMs = 2_000;
        private long connectivityBackoffStepMs = 1_000;
        private long scriptBackoffBaseMs = 500;
        private long scriptBackoffStepMs = 500;
    }

    @Data
    public static class NotificationsConfig {
        /** Allow SEND_MESSAGE actions without a tool id to use the system SMTP settings. */
        private boolean defaultEmailEnabled = false;
        private SmtpConfig smtp;
        /** Server name shown in messages for local runs. */
        private String localServerName = "Local";
    }

    @Data
    public static class SmtpConfig {
        private String host;
        private int port = 587;
        private String user;
        private String password;
        private String fromEmail;
        private String fromName = "Cronium";
        private boolean startTls = true;
    }

    @Data
    public static class StoreConfig {
        /** "memory" or "file". */
        private String type = "memory";
        /** Path of the JSON document used by the file store. */
        private String path = "~/.cronium/events.json";
    }

    @Data
    public static class LoggingConfig {
        /** Maximum number of characters of script output kept in a log line. */
        private int previewChars = 200;
    }
}
