package com.demo.relay.service;

import com.demo.relay.domain.Author;
import com.demo.relay.domain.ChatMessage;
import com.demo.relay.domain.ChatSession;
import com.demo.relay.domain.NicknameChange;
import com.demo.relay.domain.RateDecision;
import com.demo.relay.domain.SubmitOutcome;
import com.demo.relay.infrastructure.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;

/**
 * Turns resolved client calls into broadcasts and private replies.
 */
@Slf4j
@Service
public class ChatService {

    public static final String THROTTLED_TEXT = "You are sending messages too quickly!";

    private final SessionStore sessionStore;
    private final RateLimiter rateLimiter;
    private final CommandProcessor commandProcessor;
    private final SessionRegistry sessionRegistry;
    private final BlobStore blobStore;
    private final MetricsService metricsService;
    private final Clock clock;

    public ChatService(SessionStore sessionStore,
                       RateLimiter rateLimiter,
                       CommandProcessor commandProcessor,
                       SessionRegistry sessionRegistry,
                       BlobStore blobStore,
                       MetricsService metricsService,
                       Clock clock) {
        this.sessionStore = sessionStore;
        this.rateLimiter = rateLimiter;
        this.commandProcessor = commandProcessor;
        this.sessionRegistry = sessionRegistry;
        this.blobStore = blobStore;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Rate-limits, then either runs a command or broadcasts the escaped text.
     */
    public SubmitOutcome submit(String sessionId, String message) {
        if (rateLimiter.admit(sessionId, clock.instant()) == RateDecision.THROTTLE) {
            metricsService.recordThrottled(sessionId);
            sessionRegistry.unicast(sessionId, ChatMessage.privateNotice(THROTTLED_TEXT));
            return SubmitOutcome.THROTTLED;
        }

        if (CommandProcessor.isCommand(message)) {
            commandProcessor.process(sessionId, message);
            return SubmitOutcome.COMMAND;
        }

        sessionRegistry.broadcast(ChatMessage.text(authorOf(sessionId), HtmlUtils.htmlEscape(message)));
        return SubmitOutcome.BROADCAST;
    }

    /**
     * @throws com.demo.relay.domain.NicknameException if the nickname is rejected
     */
    public NicknameChange changeNickname(String sessionId, String nickname) {
        NicknameChange change = sessionStore.setNickname(sessionId, nickname);
        String previous = change.getPreviousNickname() == null
                ? "no previous nicknames"
                : "previously [" + HtmlUtils.htmlEscape(change.getPreviousNickname()) + "]";
        sessionRegistry.broadcast(ChatMessage.system(String.format("client %s (%s) changed nickname to [%s]",
                sessionId, previous, HtmlUtils.htmlEscape(change.getNickname()))));
        return change;
    }

    /**
     * Stores the upload and announces it.
     *
     * @return the blob id clients fetch the image by
     */
    public String shareImage(String sessionId, byte[] bytes) {
        String blobId = blobStore.put(bytes);
        sessionRegistry.broadcast(ChatMessage.image(authorOf(sessionId), blobId));
        log.info("Image shared: sessionId={}, blobId={}, size={}", sessionId, blobId, bytes.length);
        return blobId;
    }

    public void join(String sessionId) {
        sessionRegistry.broadcast(ChatMessage.system(String.format("%s ([%s]) has joined the room",
                sessionId, HtmlUtils.htmlEscape(sessionStore.getNickname(sessionId)))));
    }

    /**
     * Ends the session's stream, then tells everyone else.
     */
    public void leave(String sessionId) {
        sessionRegistry.unregister(sessionId);
        sessionRegistry.broadcast(ChatMessage.system(String.format("[%s] (%s) has left the room",
                HtmlUtils.htmlEscape(sessionStore.getNickname(sessionId)), sessionId)));
    }

    private Author authorOf(String sessionId) {
        Author author = sessionStore.find(sessionId)
                .map(ChatSession::toAuthor)
                .orElseGet(() -> Author.builder().id(sessionId).nickname(ChatSession.DEFAULT_NICKNAME).build());
        author.setNickname(HtmlUtils.htmlEscape(author.getNickname()));
        return author;
    }
}
