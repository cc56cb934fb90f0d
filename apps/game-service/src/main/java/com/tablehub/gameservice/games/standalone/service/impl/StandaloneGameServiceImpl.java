package com.tablehub.gameservice.games.standalone.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.application.turn.AdvanceResult;
import com.tablehub.gameservice.application.turn.AutoResponse;
import com.tablehub.gameservice.application.turn.TurnAdvancer;
import com.tablehub.gameservice.application.view.GameViewAssembler;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.codec.ActionCodec;
import com.tablehub.gameservice.engine.core.AgentDecider;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Participant;
import com.tablehub.gameservice.engine.core.ParticipantKind;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.engine.core.SeatState;
import com.tablehub.gameservice.engine.core.TurnPhase;
import com.tablehub.gameservice.games.standalone.config.GamesProperties;
import com.tablehub.gameservice.games.standalone.service.StandaloneGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StandaloneGameServiceImpl implements StandaloneGameService {

    private final StateStore stateStore;
    private final RuleEngine ruleEngine;
    private final AgentDecider agentDecider;
    private final ActionCodec actionCodec;
    private final TurnAdvancer turnAdvancer;
    private final GameViewAssembler viewAssembler;
    private final GamesProperties props;

    private final SecureRandom seedRnd = new SecureRandom();

    @Override
    @Transactional
    public String createGame(List<String> playerKinds) {
        if (playerKinds == null || playerKinds.size() < 2 || playerKinds.size() > SeatColor.values().length) {
            throw new ValidationException("players 需要 2~" + SeatColor.values().length + " 个");
        }
        List<Participant> participants = new ArrayList<>(playerKinds.size());
        for (int i = 0; i < playerKinds.size(); i++) {
            participants.add(new Participant(SeatColor.values()[i], parseKind(playerKinds.get(i))));
        }
        String gameId = UUID.randomUUID().toString();
        long seed = seedRnd.nextLong();
        MatchState state = ruleEngine.newMatch(gameId, participants, seed);
        Snapshot initial = stateStore.append(gameId, state, viewAssembler.project(state));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("players", participants.stream().map(p -> p.color().name() + ":" + p.kind().name()).toList());
        payload.put("boardSeed", seed);
        stateStore.logEvent(gameId, initial.version(), GameEventTypes.GAME_CREATED, payload);
        log.info("单机对局已创建: gameId={}, players={}", gameId, playerKinds);
        return gameId;
    }

    @Override
    public List<GameSummaryView> listGames() {
        return stateStore.listSummaries(props.getListLimit());
    }

    @Override
    public Snapshot getGame(String gameId, Integer version) {
        return stateStore.get(gameId, version);
    }

    @Override
    public void deleteGame(String gameId) {
        if (stateStore.deleteGame(gameId) == 0) {
            throw new NotFoundException("对局不存在: " + gameId);
        }
    }

    @Override
    public List<GameEventView> listEvents(String gameId, String eventType) {
        return stateStore.listEvents(gameId, eventType);
    }

    @Override
    @Transactional
    public Snapshot act(String gameId, JsonNode action) {
        Snapshot latest = stateStore.latest(gameId);
        MatchState state = latest.state();
        if (state.getPhase() == TurnPhase.GAME_OVER) {
            return latest;
        }

        if (action != null && !action.isNull() && !action.isMissingNode()) {
            GameAction decoded = actionCodec.decode(action);
            MatchState next = ruleEngine.apply(state, decoded);
            Snapshot saved = stateStore.append(gameId, next, viewAssembler.project(next));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("action", actionCodec.encode(decoded));
            stateStore.logEvent(gameId, saved.version(), GameEventTypes.ACTION_APPLIED, payload);
            return advance(gameId, next, saved);
        }

        // 无动作：自动座位走一步
        SeatState actor = state.seat(state.getActorIndex());
        if (actor.getKind().isBot() && !state.awaitingResponses()) {
            GameAction decided = agentDecider.decide(actor, state, ruleEngine.legalActions(state));
            MatchState next = ruleEngine.apply(state, decided);
            Snapshot saved = stateStore.append(gameId, next, viewAssembler.project(next));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("color", actor.getColor().name());
            payload.put("action", actionCodec.encode(decided));
            stateStore.logEvent(gameId, saved.version(), GameEventTypes.BOT_ACTION, payload);
            return advance(gameId, next, saved);
        }

        AdvanceResult advanced = turnAdvancer.drive(state);
        if (advanced.processed()) {
            return persistAdvance(gameId, advanced);
        }
        throw new ValidationException("等待人类座位行动，需要提交 action");
    }

    private Snapshot advance(String gameId, MatchState state, Snapshot saved) {
        AdvanceResult advanced = turnAdvancer.drive(state);
        return advanced.processed() ? persistAdvance(gameId, advanced) : saved;
    }

    private Snapshot persistAdvance(String gameId, AdvanceResult advanced) {
        Snapshot saved = stateStore.append(gameId, advanced.state(), viewAssembler.project(advanced.state()));
        for (AutoResponse r : advanced.responses()) {
            stateStore.logEvent(gameId, saved.version(), GameEventTypes.AUTO_TRADE_RESPONSE, r.toPayload());
        }
        return saved;
    }

    private static ParticipantKind parseKind(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("player 类型不能为空");
        }
        try {
            return ParticipantKind.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("未知的 player 类型: " + raw, e);
        }
    }
}
