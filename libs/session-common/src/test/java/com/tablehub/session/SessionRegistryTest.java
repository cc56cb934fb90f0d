package com.tablehub.session;

import com.tablehub.session.model.RoomSession;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void issuedTokenResolvesToItsBinding() {
        RoomSession issued = registry.issue("alice", "room-1", "RED");

        assertThat(issued.token()).isNotBlank();
        assertThat(registry.lookup(issued.token())).contains(issued);
        assertThat(issued.isSpectator()).isFalse();
        assertThat(issued.belongsTo("room-1")).isTrue();
        assertThat(issued.belongsTo("room-2")).isFalse();
    }

    @Test
    void spectatorHasNoSeat() {
        RoomSession spectator = registry.issue("bob", "room-1", null);
        assertThat(spectator.isSpectator()).isTrue();
    }

    @Test
    void reissueForSameSeatYieldsDistinctTokens() {
        RoomSession first = registry.issue("alice", "room-1", "RED");
        RoomSession second = registry.issue("alice", "room-1", "RED");

        assertThat(second.token()).isNotEqualTo(first.token());
        assertThat(registry.lookup(first.token())).isPresent();
        assertThat(registry.lookup(second.token())).isPresent();
    }

    @Test
    void revokeIsIdempotent() {
        RoomSession issued = registry.issue("alice", "room-1", "RED");

        registry.revoke(issued.token());
        registry.revoke(issued.token());

        assertThat(registry.lookup(issued.token())).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void blankOrUnknownTokenIsAbsent() {
        assertThat(registry.lookup(null)).isEmpty();
        assertThat(registry.lookup(" ")).isEmpty();
        assertThat(registry.lookup("nope")).isEmpty();
    }

    @Test
    void revokeSeatDropsEveryTokenOfThatSeatOnly() {
        RoomSession first = registry.issue("alice", "room-1", "RED");
        RoomSession reconnect = registry.issue("alice", "room-1", "RED");
        RoomSession other = registry.issue("bob", "room-1", "BLUE");
        RoomSession elsewhere = registry.issue("carol", "room-2", "RED");

        assertThat(registry.revokeSeat("room-1", "RED")).isEqualTo(2);

        assertThat(registry.lookup(first.token())).isEmpty();
        assertThat(registry.lookup(reconnect.token())).isEmpty();
        assertThat(registry.lookup(other.token())).isPresent();
        assertThat(registry.lookup(elsewhere.token())).isPresent();
        assertThat(registry.revokeSeat("room-1", null)).isZero();
    }

    @Test
    void rejectsWeakTokenSize() {
        assertThatThrownBy(() -> new SessionRegistry(8)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentIssuesNeverCollide() throws Exception {
        int threads = 8;
        int perThread = 250;
        Set<String> tokens = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            int n = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    tokens.add(registry.issue("p" + n, "room", null).token());
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(tokens).hasSize(threads * perThread);
        assertThat(registry.size()).isEqualTo(threads * perThread);
    }
}
