package com.demo.relay.service;

import com.demo.relay.domain.ChatMessage;
import com.demo.relay.domain.ColorException;
import com.demo.relay.domain.Member;
import com.demo.relay.infrastructure.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Handles {@code ;}-prefixed commands. Every reply is a private app message to the sender;
 * only {@code ;whisper} also reaches a second session.
 */
@Slf4j
@Service
public class CommandProcessor {

    public static final String COMMAND_PREFIX = ";";

    static final String HELP_TEXT =
            "Available commands: ;help, ;members, ;whisper <username> <message>, ;color <hexcode|colorname>";
    static final String WHISPER_USAGE = "Usage: ;whisper <username> <message>";
    static final String COLOR_USAGE = "Usage: ;color <hexcode|colorname> (e.g., ;color #ff0000 or ;color red)";

    private final SessionStore sessionStore;
    private final SessionRegistry sessionRegistry;

    public CommandProcessor(SessionStore sessionStore, SessionRegistry sessionRegistry) {
        this.sessionStore = sessionStore;
        this.sessionRegistry = sessionRegistry;
    }

    public static boolean isCommand(String message) {
        return message != null && message.startsWith(COMMAND_PREFIX);
    }

    public void process(String sessionId, String rawCommand) {
        String[] tokens = rawCommand.split(" ", -1);
        String name = tokens[0].toLowerCase(Locale.ROOT);
        log.debug("Command received: sessionId={}, command={}", sessionId, name);

        switch (name) {
            case ";help":
                reply(sessionId, HELP_TEXT);
                break;

            case ";members":
                reply(sessionId, renderMembers());
                break;

            case ";whisper":
                whisper(sessionId, tokens);
                break;

            case ";color":
                color(sessionId, tokens);
                break;

            default:
                reply(sessionId, "Unknown command: " + HtmlUtils.htmlEscape(rawCommand));
        }
    }

    private String renderMembers() {
        StringBuilder members = new StringBuilder("Online members");
        for (Member member : sessionStore.listMembers()) {
            members.append(" [")
                    .append(HtmlUtils.htmlEscape(member.getNickname()))
                    .append("] (")
                    .append(HtmlUtils.htmlEscape(member.getId()))
                    .append(")");
        }
        return members.toString();
    }

    private void whisper(String sessionId, String[] tokens) {
        if (tokens.length < 3) {
            reply(sessionId, WHISPER_USAGE);
            return;
        }
        String targetNickname = tokens[1];
        String text = String.join(" ", Arrays.copyOfRange(tokens, 2, tokens.length));

        Optional<String> target = sessionStore.findByNickname(targetNickname);
        if (target.isEmpty()) {
            reply(sessionId, "User " + HtmlUtils.htmlEscape(targetNickname) + " not found");
            return;
        }

        ChatMessage whisper = ChatMessage.privateNotice(String.format("(whisper to @%s) [%s]: %s",
                HtmlUtils.htmlEscape(targetNickname),
                HtmlUtils.htmlEscape(sessionStore.getNickname(sessionId)),
                HtmlUtils.htmlEscape(text)));

        String targetId = target.get();
        sessionRegistry.unicast(targetId, whisper);
        if (!targetId.equals(sessionId)) {
            sessionRegistry.unicast(sessionId, whisper);
        }
    }

    private void color(String sessionId, String[] tokens) {
        if (tokens.length != 2) {
            reply(sessionId, COLOR_USAGE);
            return;
        }
        try {
            String color = sessionStore.setColor(sessionId, tokens[1]);
            reply(sessionId, "Your nickname color has been changed to " + color);
        } catch (ColorException e) {
            reply(sessionId, e.getMessage());
        }
    }

    private void reply(String sessionId, String text) {
        sessionRegistry.unicast(sessionId, ChatMessage.privateNotice(text));
    }
}
