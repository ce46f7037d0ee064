package com.demo.relay.service;

import com.demo.relay.MutableClock;
import com.demo.relay.domain.ChatSession;
import com.demo.relay.domain.ColorException;
import com.demo.relay.domain.Member;
import com.demo.relay.domain.NicknameChange;
import com.demo.relay.domain.NicknameException;
import com.demo.relay.infrastructure.IdGenerator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ColorPalette palette = new ColorPalette(List.of("#123456"), Map.of("red", "#ff0000"));
    private final SessionStore store = new SessionStore(new IdGenerator(clock), palette, clock);

    @Test
    void unknownTokenMintsNewSession() {
        String id = store.resolve("forged");

        assertNotEquals("forged", id);
        assertTrue(store.isKnown(id));
        assertFalse(store.isKnown("forged"));
    }

    @Test
    void missingTokenMintsNewSession() {
        assertTrue(store.isKnown(store.resolve(null)));
        assertEquals(1, store.size());
    }

    @Test
    void knownTokenIsReturnedAndTouched() {
        String id = store.resolve(null);
        clock.advance(Duration.ofMinutes(3));

        assertEquals(id, store.resolve(id));
        ChatSession session = store.find(id).orElseThrow();
        assertEquals(clock.instant(), session.getLastSeenAt());
        assertEquals(1, store.size());
    }

    @Test
    void newSessionIsAnonymousWithoutColor() {
        String id = store.resolve(null);

        assertEquals(ChatSession.DEFAULT_NICKNAME, store.getNickname(id));
        assertNull(store.getColor(id));
        assertTrue(store.listMembers().isEmpty());
    }

    @Test
    void setNicknameAssignsAutoColorOnce() {
        String id = store.resolve(null);

        NicknameChange first = store.setNickname(id, "alice");
        assertNull(first.getPreviousNickname());
        assertEquals("#123456", first.getColor());

        store.setColor(id, "red");
        NicknameChange second = store.setNickname(id, "alicia");
        assertEquals("alice", second.getPreviousNickname());
        assertEquals("#ff0000", second.getColor());
    }

    @Test
    void rejectsEmptyAndWhitespaceNicknames() {
        String id = store.resolve(null);

        NicknameException empty = assertThrows(NicknameException.class, () -> store.setNickname(id, ""));
        assertEquals("Invalid nickname: empty", empty.getMessage());
        NicknameException spaced = assertThrows(NicknameException.class, () -> store.setNickname(id, "a b"));
        assertEquals("Invalid nickname: contains whitespace", spaced.getMessage());
        assertThrows(NicknameException.class, () -> store.setNickname(id, "tab\tbed"));
        assertThrows(NicknameException.class, () -> store.setNickname(id, null));
    }

    @Test
    void nicknameHeldByAnotherSessionIsRejected() {
        String alice = store.resolve(null);
        String bob = store.resolve(null);
        store.setNickname(alice, "alice");

        NicknameException e = assertThrows(NicknameException.class, () -> store.setNickname(bob, "alice"));
        assertEquals("Invalid nickname: [alice] is already taken", e.getMessage());

        // re-setting your own nickname is fine
        store.setNickname(alice, "alice");
    }

    @Test
    void concurrentClaimsOnSameNicknameHaveOneWinner() throws Exception {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            ids.add(store.resolve(null));
        }
        ExecutorService pool = Executors.newFixedThreadPool(ids.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (String id : ids) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    store.setNickname(id, "popular");
                    return true;
                } catch (NicknameException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        assertEquals(1, winners);
        assertEquals(1, store.listMembers().size());
    }

    @Test
    void setColorAcceptsHexAndNamesAndRejectsGarbage() {
        String id = store.resolve(null);

        assertEquals("#00ff00", store.setColor(id, "#00FF00"));
        assertEquals("#ff0000", store.setColor(id, "Red"));
        assertThrows(ColorException.class, () -> store.setColor(id, "#12"));
        assertEquals("#ff0000", store.getColor(id));
    }

    @Test
    void membersAndLookupByNickname() {
        String alice = store.resolve(null);
        store.resolve(null);
        store.setNickname(alice, "alice");

        List<Member> members = store.listMembers();
        assertEquals(1, members.size());
        assertEquals(new Member(alice, "alice"), members.get(0));
        assertEquals(alice, store.findByNickname("alice").orElseThrow());
        assertTrue(store.findByNickname("Alice").isEmpty());
    }

    @Test
    void findReturnsDetachedCopy() {
        String id = store.resolve(null);
        store.find(id).orElseThrow().setNickname("mallory");

        assertEquals(ChatSession.DEFAULT_NICKNAME, store.getNickname(id));
    }
}
