package com.demo.relay.domain;

public enum RateDecision {
    ALLOW,
    THROTTLE
}
