package com.tablehub.gameservice.games.pvp.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.application.turn.AdvanceResult;
import com.tablehub.gameservice.application.turn.AutoResponse;
import com.tablehub.gameservice.application.turn.TurnAdvancer;
import com.tablehub.gameservice.application.view.GameViewAssembler;
import com.tablehub.gameservice.common.error.ConflictException;
import com.tablehub.gameservice.common.error.ForbiddenException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.codec.ActionCodec;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Negotiation;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.games.pvp.domain.entity.PvpRoom;
import com.tablehub.gameservice.games.pvp.domain.repository.PvpRoomRepository;
import com.tablehub.gameservice.games.pvp.service.ActionGateway;
import com.tablehub.session.model.RoomSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.tablehub.gameservice.games.pvp.domain.constants.RoomMessages.*;

/**
 * 动作提交流程（房间锁内）：
 * <pre>
 * 0) 空动作 -> 400；持锁后复核令牌与座位 -> 401；未开局 -> 400
 * 1) 观战者 -> 403
 * 2) 解码 -> 400
 * 3) 声明的行动方 != 令牌座位 -> 403
 * 4) 回合校验：议价中接受/拒绝须来自尚未响应的非发起方，其余动作须来自回合持有者 -> 403
 * 5) expectedVersion 与最新版本不符 -> 409（不评估动作）
 * 6) 规则引擎执行 -> 非法 400
 * 7) 追加快照、更新房间缓存版本、自动推进一次，有代答则再追加一次
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionGatewayImpl implements ActionGateway {

    private final PvpRoomRepository roomRepo;
    private final RoomLocks roomLocks;
    private final RoomSessionGuard sessionGuard;
    private final StateStore stateStore;
    private final RuleEngine ruleEngine;
    private final ActionCodec actionCodec;
    private final TurnAdvancer turnAdvancer;
    private final GameViewAssembler viewAssembler;

    @Override
    public Snapshot submitAction(RoomSession session, JsonNode action, Integer expectedVersion) {
        if (action == null || action.isNull() || action.isMissingNode()) {
            throw new ValidationException("action 不能为空");
        }
        String roomId = session.roomId();
        return roomLocks.inRoom(roomId, () -> {
            PvpRoom room = roomRepo.findForUpdate(roomId)
                    .orElseThrow(() -> new NotFoundException(format(ROOM_NOT_FOUND, roomId)));
            sessionGuard.recheck(room, session);
            if (!room.isStarted() || room.getGameId() == null) {
                throw new ValidationException(ROOM_NOT_STARTED);
            }
            if (session.isSpectator()) {
                throw new ForbiddenException(SPECTATOR_CANNOT_ACT);
            }
            GameAction decoded = actionCodec.decode(action);
            SeatColor seat = SeatColor.valueOf(session.seatColor());
            if (decoded.color() != seat) {
                throw new ForbiddenException(format(NOT_YOUR_SEAT, seat));
            }

            String gameId = room.getGameId();
            Snapshot latest = stateStore.latest(gameId);
            checkTurn(latest.state(), decoded, seat);
            if (expectedVersion != null && expectedVersion != latest.version()) {
                throw new ConflictException(format(STALE_VERSION, expectedVersion, latest.version()));
            }

            MatchState next = ruleEngine.apply(latest.state(), decoded);
            Snapshot saved = stateStore.append(gameId, next, viewAssembler.project(next));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("roomId", roomId);
            payload.put("player", session.participantName());
            payload.put("action", actionCodec.encode(decoded));
            stateStore.logEvent(gameId, saved.version(), GameEventTypes.ACTION_APPLIED, payload);

            AdvanceResult advanced = turnAdvancer.drive(next);
            if (advanced.processed()) {
                saved = stateStore.append(gameId, advanced.state(), viewAssembler.project(advanced.state()));
                for (AutoResponse r : advanced.responses()) {
                    stateStore.logEvent(gameId, saved.version(), GameEventTypes.AUTO_TRADE_RESPONSE, r.toPayload());
                }
            }

            room.setLatestVersion(saved.version());
            roomRepo.save(room);
            log.debug("动作已执行: roomId={}, gameId={}, seat={}, type={}, version={}",
                    roomId, gameId, seat, decoded.type(), saved.version());
            return saved;
        });
    }

    private static void checkTurn(MatchState state, GameAction action, SeatColor seat) {
        if (state.awaitingResponses()) {
            Negotiation n = state.getNegotiation();
            if (action.type().isTradeResponse()) {
                int idx = state.indexOf(seat);
                if (idx < 0 || idx == n.getOffererSeat() || n.responded(idx)) {
                    throw new ForbiddenException(NOT_PENDING_RESPONDER);
                }
                return;
            }
            if (seat != state.turnHolder()) {
                throw new ForbiddenException(format(NOT_YOUR_TURN, state.turnHolder()));
            }
            return;
        }
        if (seat != state.currentActor()) {
            throw new ForbiddenException(format(NOT_YOUR_TURN, state.currentActor()));
        }
    }
}
