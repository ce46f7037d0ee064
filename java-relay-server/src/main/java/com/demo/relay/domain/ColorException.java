package com.demo.relay.domain;

public class ColorException extends RelayException {

    public ColorException(String message) {
        super(message);
    }
}
