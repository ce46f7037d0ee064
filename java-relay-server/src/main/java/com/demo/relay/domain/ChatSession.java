package com.demo.relay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-participant state. Outlives any single event stream.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    public static final String DEFAULT_NICKNAME = "anonymous";

    private String id;
    private String nickname;
    private String color;
    private Instant createdAt;
    private Instant lastSeenAt;

    public String displayName() {
        return nickname != null ? nickname : DEFAULT_NICKNAME;
    }

    public Author toAuthor() {
        return Author.builder()
                .id(id)
                .nickname(displayName())
                .color(color)
                .build();
    }
}
