package com.demo.relay.service;

import com.demo.relay.domain.ChatSession;
import com.demo.relay.domain.ColorException;
import com.demo.relay.domain.Member;
import com.demo.relay.domain.NicknameChange;
import com.demo.relay.domain.NicknameException;
import com.demo.relay.domain.ValidationResult;
import com.demo.relay.infrastructure.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Known sessions and their nickname and color. Sessions are never removed.
 *
 * Each record is mutated inside {@link ConcurrentHashMap#computeIfPresent}, so readers never
 * see a half-applied change. Nickname assignment additionally holds {@code nicknameLock} so
 * the uniqueness check and the write happen as one step across all sessions.
 */
@Slf4j
@Service
public class SessionStore {

    private final ConcurrentHashMap<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock nicknameLock = new ReentrantLock();
    private final IdGenerator idGenerator;
    private final ColorPalette colorPalette;
    private final Clock clock;

    public SessionStore(IdGenerator idGenerator, ColorPalette colorPalette, Clock clock) {
        this.idGenerator = idGenerator;
        this.colorPalette = colorPalette;
        this.clock = clock;
    }

    /**
     * Returns {@code token} if it names a known session, otherwise mints and records a new one.
     */
    public String resolve(String token) {
        Instant now = clock.instant();
        if (token != null && !token.isBlank()) {
            ChatSession known = sessions.computeIfPresent(token, (id, session) -> {
                synchronized (session) {
                    session.setLastSeenAt(now);
                }
                return session;
            });
            if (known != null) {
                return token;
            }
        }

        String id = idGenerator.sessionId();
        sessions.put(id, ChatSession.builder()
                .id(id)
                .createdAt(now)
                .lastSeenAt(now)
                .build());
        log.info("Session created: sessionId={}, known={}", id, sessions.size());
        return id;
    }

    boolean isKnown(String id) {
        return id != null && sessions.containsKey(id);
    }

    /**
     * Copy of the session, safe to read without further locking.
     */
    public Optional<ChatSession> find(String id) {
        ChatSession session = sessions.get(id);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.toBuilder().build());
        }
    }

    public String getNickname(String id) {
        return find(id).map(ChatSession::displayName).orElse(ChatSession.DEFAULT_NICKNAME);
    }

    public String getColor(String id) {
        return find(id).map(ChatSession::getColor).orElse(null);
    }

    public ValidationResult validateNickname(String nickname) {
        if (nickname == null || nickname.isEmpty()) {
            return ValidationResult.failure("Invalid nickname: empty");
        }
        if (nickname.codePoints().anyMatch(Character::isWhitespace)) {
            return ValidationResult.failure("Invalid nickname: contains whitespace");
        }
        return ValidationResult.success();
    }

    /**
     * Assigns {@code nickname} to the session, giving it a palette color if it has none.
     *
     * @throws NicknameException if the nickname is empty, has whitespace or is held by another session
     */
    public NicknameChange setNickname(String id, String nickname) {
        ValidationResult validation = validateNickname(nickname);
        if (!validation.isValid()) {
            throw new NicknameException(validation.getErrorMessage());
        }

        nicknameLock.lock();
        try {
            boolean taken = sessions.values().stream()
                    .anyMatch(other -> !other.getId().equals(id) && nickname.equals(other.getNickname()));
            if (taken) {
                throw new NicknameException("Invalid nickname: [" + nickname + "] is already taken");
            }

            String[] previous = new String[1];
            ChatSession updated = sessions.computeIfPresent(id, (key, session) -> {
                synchronized (session) {
                    previous[0] = session.getNickname();
                    session.setNickname(nickname);
                    if (session.getColor() == null) {
                        session.setColor(colorPalette.randomAutoColor(random()));
                    }
                }
                return session;
            });
            if (updated == null) {
                throw new NicknameException("Unknown session");
            }

            log.info("Nickname set: sessionId={}, previous={}, nickname={}", id, previous[0], nickname);
            return new NicknameChange(id, previous[0], nickname, updated.getColor());
        } finally {
            nicknameLock.unlock();
        }
    }

    /**
     * Sets the display color from a {@code #RRGGBB} literal or a palette name.
     *
     * @return the resolved hex color
     * @throws ColorException if {@code colorSpec} is neither
     */
    public String setColor(String id, String colorSpec) {
        String color = colorPalette.resolve(colorSpec)
                .orElseThrow(() -> new ColorException(
                        "Invalid color format. Use hexadecimal format like #ff0000 or predefined names like red"));

        ChatSession updated = sessions.computeIfPresent(id, (key, session) -> {
            synchronized (session) {
                session.setColor(color);
            }
            return session;
        });
        if (updated == null) {
            throw new ColorException("Unknown session");
        }
        log.debug("Color set: sessionId={}, color={}", id, color);
        return color;
    }

    /**
     * Snapshot of sessions that have chosen a nickname.
     */
    public List<Member> listMembers() {
        return sessions.values().stream()
                .map(session -> {
                    synchronized (session) {
                        return session.getNickname() == null ? null : new Member(session.getId(), session.getNickname());
                    }
                })
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * First session currently holding {@code nickname}, if any.
     */
    public Optional<String> findByNickname(String nickname) {
        return listMembers().stream()
                .filter(member -> member.getNickname().equals(nickname))
                .map(Member::getId)
                .findFirst();
    }

    public int size() {
        return sessions.size();
    }

    private Random random() {
        return ThreadLocalRandom.current();
    }
}
