package com.cronium.channel;

/**
 * Sends a rendered message through the tool a credential describes.
 * Implementations report delivery problems in the result and never throw
 * for them.
 */
public interface Notifier {

    DeliveryResult send(ToolCredential credential, ChannelMessage message);
}
