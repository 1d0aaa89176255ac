package com.cronium.channel;

import com.cronium.channel.delivery.DiscordChannel;
import com.cronium.channel.delivery.EmailChannel;
import com.cronium.channel.delivery.NotificationChannel;
import com.cronium.channel.delivery.SlackChannel;
import com.cronium.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default {@link Notifier}: picks the channel variant matching the
 * credential's type and turns any delivery exception into a failed result.
 */
@Slf4j
public class ChannelNotifier implements Notifier {

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);

    public ChannelNotifier(EmailChannel email, SlackChannel slack, DiscordChannel discord) {
        channels.put(ChannelType.EMAIL, email);
        channels.put(ChannelType.SLACK, slack);
        channels.put(ChannelType.DISCORD, discord);
    }

    @Override
    public DeliveryResult send(ToolCredential credential, ChannelMessage message) {
        if (credential == null || credential.getType() == null) {
            return DeliveryResult.failed("No credential type to deliver with");
        }
        NotificationChannel channel = channels.get(credential.getType());
        try {
            DeliveryResult result = channel.deliver(credential, message);
            if (result.success()) {
                log.info("Delivered {} notification via {}", credential.getType().key(),
                        credential.getName() != null ? credential.getName() : credential.getId());
            } else {
                log.warn("{} notification failed: {}", credential.getType().key(), result.error());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("{} notification threw: {}", credential.getType().key(), e.getMessage(), e);
            return DeliveryResult.failed(ErrorUtils.formatErrorMessage(e));
        }
    }
}
