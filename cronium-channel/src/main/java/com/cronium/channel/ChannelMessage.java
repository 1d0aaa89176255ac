package com.cronium.channel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An already-rendered notification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelMessage {
    /** Comma separated email recipients; ignored by webhook channels. */
    private String recipients;
    private String subject;
    private String body;
    @Builder.Default
    private boolean html = true;
}
