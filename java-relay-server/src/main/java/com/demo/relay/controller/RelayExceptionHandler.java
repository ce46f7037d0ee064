package com.demo.relay.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;

/**
 * Multipart parsing fails before a handler is selected, so it is mapped here rather than
 * in {@link ChatController}.
 */
@Slf4j
@RestControllerAdvice
public class RelayExceptionHandler {

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<String> handleMultipart(MultipartException e) {
        log.debug("Rejected multipart request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .contentType(MediaType.TEXT_PLAIN)
                .body("Could not parse multipart form");
    }
}
