package com.herzen.quiz.presentation;

import com.herzen.quiz.error.PresentationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class InMemoryChannelFeed implements PresentationChannel {
    private final Map<String, List<ChannelMessage>> feeds = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final int historyLimit;

    public InMemoryChannelFeed(@Value("${quiz.channel.history-limit:50}") int historyLimit) {
        this.historyLimit = Math.max(1, historyLimit);
    }

    @Override
    public MessageHandle send(String channelKey, String content) {
        long id = sequence.incrementAndGet();
        List<ChannelMessage> feed = feeds.computeIfAbsent(channelKey, k -> new ArrayList<>());
        synchronized (feed) {
            feed.add(new ChannelMessage(id, content, Instant.now(), null));
            while (feed.size() > historyLimit) {
                feed.remove(0);
            }
        }
        return new MessageHandle(channelKey, id);
    }

    @Override
    public void edit(MessageHandle handle, String content) {
        List<ChannelMessage> feed = feeds.get(handle.channelKey());
        if (feed == null) {
            throw new PresentationException("Unknown channel " + handle.channelKey());
        }
        synchronized (feed) {
            for (int i = 0; i < feed.size(); i++) {
                ChannelMessage message = feed.get(i);
                if (message.id() == handle.messageId()) {
                    feed.set(i, new ChannelMessage(message.id(), content, message.sentAt(), Instant.now()));
                    return;
                }
            }
        }
        throw new PresentationException("Message " + handle.messageId() + " not found in channel " + handle.channelKey());
    }

    @Override
    public void forget(String channelKey) {
        feeds.remove(channelKey);
    }

    public List<ChannelMessage> messages(String channelKey) {
        List<ChannelMessage> feed = feeds.get(channelKey);
        if (feed == null) {
            return List.of();
        }
        synchronized (feed) {
            return List.copyOf(feed);
        }
    }

    public record ChannelMessage(long id, String content, Instant sentAt, Instant editedAt) {}
}
