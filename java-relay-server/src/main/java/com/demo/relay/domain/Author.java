package com.demo.relay.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sender identity attached to user-originated messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Author {
    private String id;
    private String nickname;
    private String color;
}
