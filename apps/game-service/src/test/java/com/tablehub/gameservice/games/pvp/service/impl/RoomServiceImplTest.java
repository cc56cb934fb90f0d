package com.tablehub.gameservice.games.pvp.service.impl;

import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.common.error.ForbiddenException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.TokenException;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.engine.core.TurnPhase;
import com.tablehub.gameservice.games.pvp.domain.model.JoinResult;
import com.tablehub.gameservice.games.pvp.domain.model.RoomView;
import com.tablehub.gameservice.games.pvp.service.RoomService;
import com.tablehub.session.SessionRegistry;
import com.tablehub.session.model.RoomSession;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class RoomServiceImplTest {

    @Autowired
    private RoomService roomService;

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private StateStore stateStore;

    private String newRoom() {
        return roomService.createRoom("table").roomId();
    }

    private RoomSession session(JoinResult joined) {
        return sessionRegistry.lookup(joined.token()).orElseThrow();
    }

    @Test
    void createRoomHasFourEmptySeatsAndPreview() {
        RoomView view = roomService.createRoom("  ");

        assertThat(view.name()).isEqualTo("Room");
        assertThat(view.started()).isFalse();
        assertThat(view.seats()).extracting(RoomView.SeatView::color)
                .containsExactly("RED", "BLUE", "WHITE", "ORANGE");
        assertThat(view.seats()).noneMatch(RoomView.SeatView::occupied);
        assertThat(view.seats().get(0).host()).isTrue();
        assertThat(view.board().tiles()).hasSize(19);
        assertThat(roomService.listRooms()).extracting(RoomView::roomId).contains(view.roomId());
    }

    @Test
    void joinAssignsSeatsInOrderAndReconnectKeepsSeat() {
        String roomId = newRoom();

        JoinResult alice = roomService.joinRoom(roomId, "alice");
        JoinResult bob = roomService.joinRoom(roomId, "bob");
        JoinResult aliceAgain = roomService.joinRoom(roomId, " alice ");

        assertThat(alice.seatColor()).isEqualTo("RED");
        assertThat(bob.seatColor()).isEqualTo("BLUE");
        assertThat(aliceAgain.seatColor()).isEqualTo("RED");
        assertThat(aliceAgain.token()).isNotEqualTo(alice.token());
        assertThat(aliceAgain.room().you()).isEqualTo("RED");
        assertThat(roomService.roomStatus(roomId, null).seats())
                .extracting(RoomView.SeatView::userName)
                .containsExactly("alice", "bob", null, null);
    }

    @Test
    void joinValidatesInput() {
        String roomId = newRoom();
        assertThatThrownBy(() -> roomService.joinRoom(roomId, " ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> roomService.joinRoom("no-such-room", "alice")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void fifthPlayerAndLateJoinersSpectate() {
        String roomId = newRoom();
        for (String name : List.of("a", "b", "c", "d")) {
            roomService.joinRoom(roomId, name);
        }
        JoinResult fifth = roomService.joinRoom(roomId, "e");

        assertThat(fifth.spectator()).isTrue();
        assertThat(fifth.seatColor()).isNull();
    }

    @Test
    void statusDistinguishesAnonymousUnknownAndForeignTokens() {
        String roomId = newRoom();
        String otherRoom = newRoom();
        JoinResult alice = roomService.joinRoom(roomId, "alice");
        JoinResult stranger = roomService.joinRoom(otherRoom, "zed");

        assertThat(roomService.roomStatus(roomId, null).you()).isNull();
        assertThat(roomService.roomStatus(roomId, alice.token()).you()).isEqualTo("RED");
        assertThatThrownBy(() -> roomService.roomStatus(roomId, "bogus")).isInstanceOf(TokenException.class);
        assertThatThrownBy(() -> roomService.roomStatus(roomId, stranger.token())).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> roomService.requireSession(roomId, null)).isInstanceOf(TokenException.class);
    }

    @Test
    void leaveFreesSeatBeforeStart() {
        String roomId = newRoom();
        JoinResult alice = roomService.joinRoom(roomId, "alice");
        JoinResult bob = roomService.joinRoom(roomId, "bob");

        RoomView after = roomService.leaveRoom(session(bob));

        assertThat(after.seats().get(1).occupied()).isFalse();
        assertThat(sessionRegistry.lookup(bob.token())).isEmpty();
        assertThat(sessionRegistry.lookup(alice.token())).isPresent();
        assertThat(roomService.joinRoom(roomId, "carol").seatColor()).isEqualTo("BLUE");
    }

    @Test
    void startNeedsHostAndTwoPlayersThenWritesVersionZero() {
        String roomId = newRoom();
        JoinResult alice = roomService.joinRoom(roomId, "alice");

        assertThatThrownBy(() -> roomService.startRoom(session(alice))).isInstanceOf(ValidationException.class);

        JoinResult bob = roomService.joinRoom(roomId, "bob");
        assertThatThrownBy(() -> roomService.startRoom(session(bob))).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> roomService.getRoomGame(session(alice), null)).isInstanceOf(ValidationException.class);

        String gameId = roomService.startRoom(session(alice));
        assertThat(roomService.startRoom(session(alice))).isEqualTo(gameId);

        Snapshot initial = roomService.getRoomGame(session(bob), null);
        assertThat(initial.version()).isZero();
        assertThat(initial.state().getPhase()).isEqualTo(TurnPhase.ROLL);
        assertThat(initial.state().colors()).containsExactly(SeatColor.RED, SeatColor.BLUE);
        assertThat(stateStore.listEvents(gameId, GameEventTypes.GAME_CREATED)).hasSize(1);

        RoomView status = roomService.roomStatus(roomId, null);
        assertThat(status.started()).isTrue();
        assertThat(status.gameId()).isEqualTo(gameId);
        assertThat(status.latestVersion()).isZero();
        assertThat(initial.state().getBoardSeed()).isEqualTo(status.board().seed());
    }

    @Test
    void afterStartSeatedCannotLeaveAndLateJoinerSpectates() {
        String roomId = newRoom();
        JoinResult alice = roomService.joinRoom(roomId, "alice");
        roomService.joinRoom(roomId, "bob");
        roomService.startRoom(session(alice));

        assertThatThrownBy(() -> roomService.leaveRoom(session(alice))).isInstanceOf(ValidationException.class);
        assertThat(sessionRegistry.lookup(alice.token())).isPresent();

        JoinResult watcher = roomService.joinRoom(roomId, "watcher");
        assertThat(watcher.spectator()).isTrue();
        roomService.leaveRoom(session(watcher));
        assertThat(sessionRegistry.lookup(watcher.token())).isEmpty();

        JoinResult aliceBack = roomService.joinRoom(roomId, "alice");
        assertThat(aliceBack.seatColor()).isEqualTo("RED");
    }

    @Test
    void refreshBoardIsHostOnlyAndOnlyBeforeStart() {
        String roomId = newRoom();
        JoinResult alice = roomService.joinRoom(roomId, "alice");
        JoinResult bob = roomService.joinRoom(roomId, "bob");
        long before = roomService.roomStatus(roomId, null).board().seed();

        assertThatThrownBy(() -> roomService.refreshBoard(session(bob))).isInstanceOf(ForbiddenException.class);
        RoomView refreshed = roomService.refreshBoard(session(alice));
        assertThat(refreshed.board().seed()).isNotEqualTo(before);

        roomService.startRoom(session(alice));
        assertThatThrownBy(() -> roomService.refreshBoard(session(alice))).isInstanceOf(ValidationException.class);
    }

    @Test
    void concurrentJoinsNeverShareASeat() throws Exception {
        String roomId = newRoom();
        int players = 8;
        ExecutorService pool = Executors.newFixedThreadPool(players);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<JoinResult>> futures = new ArrayList<>();
        for (int i = 0; i < players; i++) {
            String name = "p" + i;
            Callable<JoinResult> join = () -> {
                go.await();
                return roomService.joinRoom(roomId, name);
            };
            futures.add(pool.submit(join));
        }
        go.countDown();
        List<String> seats = new ArrayList<>();
        int spectators = 0;
        for (Future<JoinResult> f : futures) {
            JoinResult r = f.get();
            if (r.spectator()) {
                spectators++;
            } else {
                seats.add(r.seatColor());
            }
        }
        pool.shutdown();

        assertThat(seats).containsExactlyInAnyOrder("RED", "BLUE", "WHITE", "ORANGE");
        assertThat(spectators).isEqualTo(players - 4);
        assertThat(roomService.roomStatus(roomId, null).seats()).allMatch(RoomView.SeatView::occupied);
    }

    @Test
    void staleTokenCannotEvictTheNewOccupant() {
        String roomId = newRoom();
        RoomSession first = session(roomService.joinRoom(roomId, "alice"));
        // 第二枚令牌在控制器层已校验通过，随后才轮到它取锁
        RoomSession second = session(roomService.joinRoom(roomId, "alice"));
        roomService.leaveRoom(first);
        RoomSession bob = session(roomService.joinRoom(roomId, "bob"));
        assertThat(bob.seatColor()).isEqualTo("RED");

        assertThatThrownBy(() -> roomService.leaveRoom(second)).isInstanceOf(TokenException.class);
        assertThatThrownBy(() -> roomService.refreshBoard(second)).isInstanceOf(TokenException.class);
        assertThatThrownBy(() -> roomService.startRoom(second)).isInstanceOf(TokenException.class);

        assertThat(roomService.roomStatus(roomId, null).seats().get(0).userName()).isEqualTo("bob");
        assertThat(sessionRegistry.lookup(bob.token())).isPresent();
    }

    @Test
    void sessionWhoseSeatChangedHandsIsRejectedEvenIfTokenLives() {
        String roomId = newRoom();
        RoomSession alice = session(roomService.joinRoom(roomId, "alice"));
        roomService.joinRoom(roomId, "bob");
        // 令牌仍在注册表中，但房间里 RED 已不是 alice
        RoomSession forged = new RoomSession(alice.token(), "mallory", roomId, "RED");

        assertThatThrownBy(() -> roomService.startRoom(forged)).isInstanceOf(TokenException.class);
        assertThat(roomService.roomStatus(roomId, null).started()).isFalse();
    }
}
