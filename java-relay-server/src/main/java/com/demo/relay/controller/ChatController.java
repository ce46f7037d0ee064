package com.demo.relay.controller;

import com.demo.relay.domain.NicknameException;
import com.demo.relay.domain.SubmitOutcome;
import com.demo.relay.infrastructure.ContentTypeSniffer;
import com.demo.relay.service.BlobStore;
import com.demo.relay.service.ChatService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;

/**
 * Request/response side of the relay: message submission, nickname, images, join and leave.
 */
@Slf4j
@RestController
public class ChatController {

    private final ChatService chatService;
    private final BlobStore blobStore;
    private final SessionCookieResolver sessionCookieResolver;

    public ChatController(ChatService chatService,
                          BlobStore blobStore,
                          SessionCookieResolver sessionCookieResolver) {
        this.chatService = chatService;
        this.blobStore = blobStore;
        this.sessionCookieResolver = sessionCookieResolver;
    }

    /**
     * Submit message or command
     * POST /send
     */
    @PostMapping(value = "/send", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> send(@RequestParam(value = "message", required = false) String message,
                                       HttpServletRequest request,
                                       HttpServletResponse response) {
        if (message == null || message.isEmpty()) {
            return ResponseEntity.badRequest().body("Message is required");
        }

        String sessionId = sessionCookieResolver.resolve(request, response);
        SubmitOutcome outcome = chatService.submit(sessionId, message);
        if (outcome == SubmitOutcome.THROTTLED) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(ChatService.THROTTLED_TEXT);
        }
        return ResponseEntity.ok("Message sent");
    }

    /**
     * Set nickname
     * POST /set-nickname
     */
    @PostMapping(value = "/set-nickname", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> setNickname(@RequestParam(value = "nickname", required = false) String nickname,
                                              HttpServletRequest request,
                                              HttpServletResponse response) {
        String sessionId = sessionCookieResolver.resolve(request, response);
        try {
            chatService.changeNickname(sessionId, nickname);
            return ResponseEntity.ok(String.format("Nickname set to %s for session %s",
                    HtmlUtils.htmlEscape(nickname), sessionId));
        } catch (NicknameException e) {
            log.debug("Nickname rejected: sessionId={}, reason={}", sessionId, e.getMessage());
            return ResponseEntity.badRequest().body(HtmlUtils.htmlEscape(e.getMessage()));
        }
    }

    /**
     * Upload image (multipart field "image")
     * POST /upload-image
     */
    @PostMapping(value = "/upload-image", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> uploadImage(@RequestParam(value = "image", required = false) MultipartFile image,
                                              HttpServletRequest request,
                                              HttpServletResponse response) {
        if (image == null || image.isEmpty()) {
            return ResponseEntity.badRequest().body("Invalid image");
        }

        byte[] bytes;
        try {
            bytes = image.getBytes();
        } catch (IOException e) {
            log.error("Error reading uploaded image: name={}", image.getOriginalFilename(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Error reading image");
        }

        String sessionId = sessionCookieResolver.resolve(request, response);
        chatService.shareImage(sessionId, bytes);
        return ResponseEntity.ok("Image uploaded");
    }

    /**
     * Fetch image
     * GET /image/{id}
     */
    @GetMapping("/image/{id}")
    public ResponseEntity<byte[]> image(@PathVariable String id) {
        return blobStore.get(id)
                .map(bytes -> ResponseEntity.ok()
                        .contentType(ContentTypeSniffer.detect(bytes))
                        .body(bytes))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/join")
    public ResponseEntity<Void> join(HttpServletRequest request, HttpServletResponse response) {
        chatService.join(sessionCookieResolver.resolve(request, response));
        return ResponseEntity.ok().build();
    }

    /**
     * Leave signal; browsers send it as a POST beacon on unload.
     */
    @RequestMapping(value = "/leave", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Void> leave(HttpServletRequest request, HttpServletResponse response) {
        chatService.leave(sessionCookieResolver.resolve(request, response));
        return ResponseEntity.ok().build();
    }
}
