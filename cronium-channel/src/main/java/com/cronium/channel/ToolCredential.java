package com.cronium.channel;

import com.cronium.common.config.CroniumConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored credential for one notification tool: SMTP settings for email, a
 * webhook URL for Slack and Discord.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCredential {
    private Long id;
    private String name;
    private ChannelType type;
    private String webhookUrl;
    private CroniumConfig.SmtpConfig smtp;

    /** Credential backed by the system-wide SMTP settings. */
    public static ToolCredential systemEmail(CroniumConfig.SmtpConfig smtp) {
        return ToolCredential.builder()
                .name("system-smtp")
                .type(ChannelType.EMAIL)
                .smtp(smtp)
                .build();
    }
}
