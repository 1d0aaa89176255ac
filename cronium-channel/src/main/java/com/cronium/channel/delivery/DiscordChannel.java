package com.cronium.channel.delivery;

import okhttp3.OkHttpClient;

/**
 * Discord webhook ({@code {"content": ...}}, capped at the API's message
 * length).
 */
public final class DiscordChannel extends WebhookChannel {

    public static final int TEXT_LIMIT = 2000;

    public DiscordChannel() {
        this(defaultClient());
    }

    public DiscordChannel(OkHttpClient httpClient) {
        super(httpClient);
    }

    @Override
    protected String textField() {
        return "content";
    }

    @Override
    protected int textLimit() {
        return TEXT_LIMIT;
    }
}
