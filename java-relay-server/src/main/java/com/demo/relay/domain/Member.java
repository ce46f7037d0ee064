package com.demo.relay.domain;

import lombok.Value;

@Value
public class Member {
    String id;
    String nickname;
}
