package com.cronium.channel.delivery;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.ToolCredential;

/**
 * One delivery mechanism. Each variant shapes its own payload.
 */
public sealed interface NotificationChannel permits EmailChannel, WebhookChannel {

    DeliveryResult deliver(ToolCredential credential, ChannelMessage message);
}
