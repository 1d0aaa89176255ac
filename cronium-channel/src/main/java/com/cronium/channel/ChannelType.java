package com.cronium.channel;

import java.util.Locale;

/**
 * Kind of notification tool a credential belongs to.
 */
public enum ChannelType {
    EMAIL,
    SLACK,
    DISCORD;

    public boolean isWebhook() {
        return this != EMAIL;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChannelType fromKey(String key) {
        if (key == null)
            return null;
        for (ChannelType type : values()) {
            if (type.key().equalsIgnoreCase(key.trim()))
                return type;
        }
        return null;
    }
}
