package com.demo.relay.domain;

public class NicknameException extends RelayException {

    public NicknameException(String message) {
        super(message);
    }
}
