package com.demo.relay.domain;

/**
 * Rejected client input. Reported to the requesting session only.
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }
}
