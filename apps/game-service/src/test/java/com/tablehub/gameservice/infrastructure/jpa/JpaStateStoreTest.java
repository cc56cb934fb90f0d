package com.tablehub.gameservice.infrastructure.jpa;

import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.common.error.ConflictException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.engine.basic.BasicRuleEngine;
import com.tablehub.gameservice.engine.basic.BoardGenerator;
import com.tablehub.gameservice.engine.core.ActionType;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Participant;
import com.tablehub.gameservice.engine.core.TurnPhase;
import com.tablehub.gameservice.infrastructure.jpa.entity.GameSnapshotEntity;
import com.tablehub.gameservice.infrastructure.jpa.repository.GameSnapshotRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.tablehub.gameservice.engine.core.SeatColor.BLUE;
import static com.tablehub.gameservice.engine.core.SeatColor.RED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({JpaStateStore.class, StateCodec.class})
class JpaStateStoreTest {

    @Autowired
    private JpaStateStore store;

    @Autowired
    private GameSnapshotRepository snapshotRepo;

    private final BasicRuleEngine engine = new BasicRuleEngine(new BoardGenerator());

    private MatchState newMatch(String gameId) {
        return engine.newMatch(gameId, List.of(Participant.human(RED), Participant.human(BLUE)), 11L);
    }

    @Test
    void appendsFormContiguousVersions() {
        String gameId = UUID.randomUUID().toString();
        MatchState s0 = newMatch(gameId);
        MatchState s1 = engine.apply(s0, GameAction.of(RED, ActionType.ROLL));
        MatchState s2 = engine.apply(s1, GameAction.of(RED, ActionType.END_TURN));

        assertThat(store.append(gameId, s0, "{\"v\":0}").version()).isZero();
        assertThat(store.append(gameId, s1, "{\"v\":1}").version()).isEqualTo(1);
        assertThat(store.append(gameId, s2, "{\"v\":2}").version()).isEqualTo(2);

        Snapshot latest = store.latest(gameId);
        assertThat(latest.version()).isEqualTo(2);
        assertThat(latest.displayProjection()).isEqualTo("{\"v\":2}");
        assertThat(latest.state().currentActor()).isEqualTo(BLUE);

        Snapshot first = store.get(gameId, 1);
        assertThat(first.state().getPhase()).isEqualTo(TurnPhase.PLAY_TURN);
        assertThat(first.state().getLastRoll()).isEqualTo(s1.getLastRoll());
        assertThat(first.state().getBoard()).isEqualTo(s0.getBoard());
        assertThat(first.state().seat(0).getResources()).containsExactly(s1.seat(0).getResources());
    }

    @Test
    void summaryTracksLatestAppend() {
        String gameId = UUID.randomUUID().toString();
        MatchState s0 = newMatch(gameId);
        store.append(gameId, s0, "{}");
        store.append(gameId, engine.apply(engine.apply(s0, GameAction.of(RED, ActionType.ROLL)),
                GameAction.of(RED, ActionType.END_TURN)), "{}");

        GameSummaryView summary = store.getSummary(gameId);

        assertThat(summary.latestVersion()).isEqualTo(1);
        assertThat(summary.seatColors()).containsExactly("RED", "BLUE");
        assertThat(summary.currentColor()).isEqualTo("BLUE");
        assertThat(summary.winner()).isNull();
        assertThat(store.listSummaries(50)).extracting(GameSummaryView::gameId).contains(gameId);
    }

    @Test
    void unknownGameOrVersionIsNotFound() {
        String gameId = UUID.randomUUID().toString();
        assertThatThrownBy(() -> store.latest(gameId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> store.getSummary(gameId)).isInstanceOf(NotFoundException.class);

        store.append(gameId, newMatch(gameId), "{}");
        assertThatThrownBy(() -> store.get(gameId, 3)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void eventsAreListedInOrderAndFilterable() {
        String gameId = UUID.randomUUID().toString();
        store.logEvent(gameId, 0, GameEventTypes.GAME_CREATED, Map.of("players", List.of("RED", "BLUE")));
        store.logEvent(gameId, 1, GameEventTypes.ACTION_APPLIED, Map.of("action", "ROLL"));
        store.logEvent(gameId, 2, GameEventTypes.ACTION_APPLIED, Map.of("action", "END_TURN"));

        List<GameEventView> all = store.listEvents(gameId, null);
        List<GameEventView> applied = store.listEvents(gameId, GameEventTypes.ACTION_APPLIED);

        assertThat(all).extracting(GameEventView::eventType).containsExactly(
                GameEventTypes.GAME_CREATED, GameEventTypes.ACTION_APPLIED, GameEventTypes.ACTION_APPLIED);
        assertThat(applied).extracting(GameEventView::version).containsExactly(1, 2);
        assertThat(applied.get(1).payload()).containsEntry("action", "END_TURN");
    }

    @Test
    void deleteRemovesEverythingAndIsIdempotent() {
        String gameId = UUID.randomUUID().toString();
        store.append(gameId, newMatch(gameId), "{}");
        store.logEvent(gameId, 0, GameEventTypes.GAME_CREATED, Map.of());

        assertThat(store.deleteGame(gameId)).isEqualTo(3);
        assertThat(store.deleteGame(gameId)).isZero();
        assertThatThrownBy(() -> store.latest(gameId)).isInstanceOf(NotFoundException.class);
        assertThat(store.listEvents(gameId, null)).isEmpty();
    }

    @Test
    void duplicateVersionSurfacesAsConflict() {
        String gameId = UUID.randomUUID().toString();
        MatchState s0 = newMatch(gameId);
        store.append(gameId, s0, "{}");
        // 模拟另一请求抢先写入了版本 1
        snapshotRepo.saveAndFlush(GameSnapshotEntity.builder()
                .gameId(gameId).version(1).stateBlob("{}").displayProjection("{}").build());

        assertThatThrownBy(() -> store.append(gameId, s0, "{}")).isInstanceOf(ConflictException.class);
    }
}
