package com.demo.relay.domain;

import lombok.Value;

/**
 * Outcome of a successful nickname assignment. {@code previousNickname} is null when the
 * session never had one.
 */
@Value
public class NicknameChange {
    String sessionId;
    String previousNickname;
    String nickname;
    String color;
}
