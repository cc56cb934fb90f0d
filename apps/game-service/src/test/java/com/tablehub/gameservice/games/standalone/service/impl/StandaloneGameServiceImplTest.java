package com.tablehub.gameservice.games.standalone.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.engine.core.TurnPhase;
import com.tablehub.gameservice.games.standalone.service.StandaloneGameService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class StandaloneGameServiceImplTest {

    @Autowired
    private StandaloneGameService service;

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode action(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void createRejectsBadPlayerLists() {
        assertThatThrownBy(() -> service.createGame(List.of("HUMAN")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.createGame(List.of("HUMAN", "HUMAN", "HUMAN", "HUMAN", "HUMAN")))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.createGame(List.of("HUMAN", "WIZARD")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void createStoresVersionZeroAndListsIt() {
        String gameId = service.createGame(List.of("human", "random"));

        Snapshot initial = service.getGame(gameId, null);
        assertThat(initial.version()).isZero();
        assertThat(initial.state().getPhase()).isEqualTo(TurnPhase.ROLL);
        assertThat(service.listGames()).extracting(GameSummaryView::gameId).contains(gameId);
        assertThat(service.listEvents(gameId, GameEventTypes.GAME_CREATED)).hasSize(1);
    }

    @Test
    void tickOnHumanTurnNeedsAnAction() {
        String gameId = service.createGame(List.of("HUMAN", "CAUTIOUS"));

        assertThatThrownBy(() -> service.act(gameId, null))
                .isInstanceOf(ValidationException.class);
        assertThat(service.getGame(gameId, null).version()).isZero();
    }

    @Test
    void tickLetsBotSeatPlay() throws Exception {
        String gameId = service.createGame(List.of("HUMAN", "CAUTIOUS"));
        service.act(gameId, action("[\"RED\",\"ROLL\"]"));
        Snapshot afterEnd = service.act(gameId, action("[\"RED\",\"END_TURN\"]"));
        assertThat(afterEnd.version()).isEqualTo(2);
        assertThat(afterEnd.state().currentActor()).isEqualTo(SeatColor.BLUE);

        Snapshot botMove = service.act(gameId, null);

        assertThat(botMove.version()).isEqualTo(3);
        assertThat(botMove.state().getPhase()).isEqualTo(TurnPhase.PLAY_TURN);
        List<GameEventView> botEvents = service.listEvents(gameId, GameEventTypes.BOT_ACTION);
        assertThat(botEvents).hasSize(1);
        assertThat(botEvents.get(0).version()).isEqualTo(3);
        assertThat(botEvents.get(0).payload()).containsEntry("color", "BLUE");
    }

    @Test
    void botsAnswerAHumanOfferInOneVersion() throws Exception {
        String gameId = service.createGame(List.of("HUMAN", "CAUTIOUS", "RANDOM"));
        service.act(gameId, action("[\"RED\",\"ROLL\"]"));

        Snapshot settled = service.act(gameId,
                action("[\"RED\",\"OFFER_TRADE\",[1,0,0,0,0,0,1,0,0,0]]"));

        assertThat(settled.version()).isEqualTo(3);
        assertThat(settled.state().getPhase()).isEqualTo(TurnPhase.PLAY_TURN);
        assertThat(settled.state().getNegotiation()).isNull();
        assertThat(settled.state().getActorIndex()).isEqualTo(settled.state().getTurnIndex());
        assertThat(service.getGame(gameId, 2).state().getPhase()).isEqualTo(TurnPhase.AWAITING_RESPONSES);

        List<GameEventView> responses = service.listEvents(gameId, GameEventTypes.AUTO_TRADE_RESPONSE);
        assertThat(responses).hasSize(2);
        assertThat(responses).extracting(GameEventView::version).containsOnly(3);
        assertThat(service.listEvents(gameId, GameEventTypes.ACTION_APPLIED)).hasSize(2);
    }

    @Test
    void illegalActionWritesNothing() throws Exception {
        String gameId = service.createGame(List.of("HUMAN", "HUMAN"));

        assertThatThrownBy(() -> service.act(gameId, action("[\"RED\",\"END_TURN\"]")))
                .isInstanceOf(ValidationException.class);
        assertThat(service.getGame(gameId, null).version()).isZero();
    }

    @Test
    void deleteThenDeleteAgainIsNotFound() {
        String gameId = service.createGame(List.of("HUMAN", "RANDOM"));

        service.deleteGame(gameId);

        assertThatThrownBy(() -> service.deleteGame(gameId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getGame(gameId, null)).isInstanceOf(NotFoundException.class);
    }
}
