package com.cronium.engine;

import com.cronium.channel.ChannelMessage;
import com.cronium.channel.DeliveryResult;
import com.cronium.channel.Notifier;
import com.cronium.channel.ToolCredential;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class RecordingNotifier implements Notifier {

    public record Sent(ToolCredential credential, ChannelMessage message) {
    }

    public final List<Sent> sent = Collections.synchronizedList(new ArrayList<>());
    public volatile DeliveryResult result = DeliveryResult.ok();

    @Override
    public DeliveryResult send(ToolCredential credential, ChannelMessage message) {
        sent.add(new Sent(credential, message));
        return result;
    }

    public List<String> bodies() {
        synchronized (sent) {
            return sent.stream().map(s -> s.message().getBody()).toList();
        }
    }
}
