package com.cronium.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Follow-up effect attached to an event and gated by a trigger class.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConditionalAction {
    private Long id;
    private ActionTrigger trigger;
    private ActionEffect effect;

    // ── SEND_MESSAGE ──
    /** Message template; HTML for email, JSON or plain text for webhooks. */
    private String message;
    /** Comma separated email recipients. */
    private String emailAddresses;
    /** Subject template; a default is used when blank. */
    private String emailSubject;
    /** Credential to send with; null selects the system email channel. */
    private Long toolId;

    // ── RUN_EVENT ──
    private Long targetEventId;
}
