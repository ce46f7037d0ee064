package com.demo.relay.domain;

public enum SubmitOutcome {
    BROADCAST,
    COMMAND,
    THROTTLED
}
