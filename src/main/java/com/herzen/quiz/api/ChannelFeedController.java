package com.herzen.quiz.api;

import com.herzen.quiz.presentation.InMemoryChannelFeed;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/channels")
public class ChannelFeedController {
    private final InMemoryChannelFeed feed;

    public ChannelFeedController(InMemoryChannelFeed feed) {
        this.feed = feed;
    }

    @GetMapping("/{channelKey}/messages")
    public ResponseEntity<List<InMemoryChannelFeed.ChannelMessage>> messages(@PathVariable String channelKey) {
        return ResponseEntity.ok(feed.messages(channelKey));
    }
}
