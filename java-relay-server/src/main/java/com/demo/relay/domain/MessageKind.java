package com.demo.relay.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {
    TEXT("text"),
    IMAGE("image");

    private final String wireName;

    MessageKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
