package com.demo.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * One event pushed to connected clients.
 *
 * Serialized as {@code {fromApp, author, kind, content, private}}. Instances are only
 * created through the static factories so that a private message never carries an author.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ChatMessage {

    boolean fromApp;

    Author author;

    MessageKind kind;

    String content;

    @JsonProperty("private")
    boolean privateMessage;

    /**
     * Public text message written by a user. Content must already be escaped.
     */
    public static ChatMessage text(Author author, String escapedContent) {
        return ChatMessage.builder()
                .fromApp(false)
                .author(author)
                .kind(MessageKind.TEXT)
                .content(escapedContent)
                .privateMessage(false)
                .build();
    }

    /**
     * Public image message; content is the blob id.
     */
    public static ChatMessage image(Author author, String blobId) {
        return ChatMessage.builder()
                .fromApp(false)
                .author(author)
                .kind(MessageKind.IMAGE)
                .content(blobId)
                .privateMessage(false)
                .build();
    }

    /**
     * Public announcement from the relay itself (joins, leaves, nickname changes).
     */
    public static ChatMessage system(String content) {
        return ChatMessage.builder()
                .fromApp(true)
                .kind(MessageKind.TEXT)
                .content(content)
                .privateMessage(false)
                .build();
    }

    /**
     * Reply addressed to exactly one session.
     */
    public static ChatMessage privateNotice(String content) {
        return ChatMessage.builder()
                .fromApp(true)
                .kind(MessageKind.TEXT)
                .content(content)
                .privateMessage(true)
                .build();
    }
}
