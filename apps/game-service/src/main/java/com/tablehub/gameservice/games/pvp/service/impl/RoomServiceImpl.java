package com.tablehub.gameservice.games.pvp.service.impl;

import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.application.view.GameViewAssembler;
import com.tablehub.gameservice.common.error.ForbiddenException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.TokenException;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.basic.BoardGenerator;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Participant;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.games.pvp.config.PvpRoomProperties;
import com.tablehub.gameservice.games.pvp.domain.dto.SeatAssignment;
import com.tablehub.gameservice.games.pvp.domain.entity.PvpRoom;
import com.tablehub.gameservice.games.pvp.domain.model.BoardPreview;
import com.tablehub.gameservice.games.pvp.domain.model.JoinResult;
import com.tablehub.gameservice.games.pvp.domain.model.RoomView;
import com.tablehub.gameservice.games.pvp.domain.repository.PvpRoomRepository;
import com.tablehub.gameservice.games.pvp.service.RoomService;
import com.tablehub.session.SessionRegistry;
import com.tablehub.session.model.RoomSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.tablehub.gameservice.games.pvp.domain.constants.RoomMessages.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomServiceImpl implements RoomService {

    private final PvpRoomRepository roomRepo;
    private final RoomLocks roomLocks;
    private final RoomSessionGuard sessionGuard;
    private final SessionRegistry sessionRegistry;
    private final StateStore stateStore;
    private final RuleEngine ruleEngine;
    private final BoardGenerator boardGenerator;
    private final GameViewAssembler viewAssembler;
    private final PvpRoomProperties props;

    // --- 棋盘种子
    private final SecureRandom seedRnd = new SecureRandom();

    /** 锁内判定结果：房间 + 分到的座位（null 为观战） */
    private record Seating(PvpRoom room, SeatColor seat) {
    }

    @Override
    public RoomView createRoom(String name) {
        String roomName = StringUtils.hasText(name) ? name.trim() : DEFAULT_ROOM_NAME;
        PvpRoom room = roomRepo.save(PvpRoom.builder()
                .roomId(UUID.randomUUID().toString())
                .name(roomName)
                .seats(PvpRoom.emptySeats())
                .boardSeed(nextSeed())
                .build());
        log.info("房间已创建: roomId={}, name={}", room.getRoomId(), roomName);
        return RoomView.of(room, null, preview(room));
    }

    @Override
    public List<RoomView> listRooms() {
        return roomRepo.findRecent(PageRequest.of(0, Math.max(1, props.getListLimit()))).stream()
                .map(r -> RoomView.of(r, null, null))
                .toList();
    }

    @Override
    public JoinResult joinRoom(String roomId, String userName) {
        if (!StringUtils.hasText(userName)) {
            throw new ValidationException(USER_NAME_REQUIRED);
        }
        String name = userName.trim();
        requireRoom(roomId);

        return roomLocks.inRoom(roomId, () -> {
            PvpRoom room = lockRoom(roomId);
            // 1) 同名：重连原座位
            Optional<SeatAssignment> existing = room.seatOf(name);
            if (existing.isPresent()) {
                return new Seating(room, existing.get().getColor());
            }
            // 2) 已开局：观战
            if (room.isStarted()) {
                return new Seating(room, null);
            }
            // 3) 第一个空位；4) 满员则观战
            Optional<SeatAssignment> free = room.firstFreeSeat();
            if (free.isEmpty()) {
                return new Seating(room, null);
            }
            room.assign(free.get().getColor(), name);
            return new Seating(roomRepo.save(room), free.get().getColor());
        }, seating -> {
            String seat = seating.seat() == null ? null : seating.seat().name();
            RoomSession session = sessionRegistry.issue(name, roomId, seat);
            log.debug("加入房间: roomId={}, name={}, seat={}", roomId, name, seat);
            return new JoinResult(session.token(), seat, session.isSpectator(),
                    RoomView.of(seating.room(), session, preview(seating.room())));
        });
    }

    @Override
    public RoomView roomStatus(String roomId, String token) {
        PvpRoom room = requireRoom(roomId);
        RoomSession session = null;
        if (StringUtils.hasText(token)) {
            session = sessionRegistry.lookup(token).orElseThrow(() -> new TokenException(TOKEN_INVALID));
            if (!session.belongsTo(roomId)) {
                throw new ForbiddenException(TOKEN_OTHER_ROOM);
            }
        }
        return RoomView.of(room, session, preview(room));
    }

    @Override
    public RoomSession requireSession(String roomId, String token) {
        if (!StringUtils.hasText(token)) {
            throw new TokenException(TOKEN_MISSING);
        }
        RoomSession session = sessionRegistry.lookup(token).orElseThrow(() -> new TokenException(TOKEN_INVALID));
        if (!session.belongsTo(roomId)) {
            throw new ForbiddenException(TOKEN_OTHER_ROOM);
        }
        return session;
    }

    @Override
    public RoomView leaveRoom(RoomSession session) {
        String roomId = session.roomId();
        return roomLocks.inRoom(roomId, () -> {
            PvpRoom room = lockRoom(roomId);
            sessionGuard.recheck(room, session);
            if (!session.isSpectator()) {
                if (room.isStarted()) {
                    throw new ValidationException(CANNOT_LEAVE_IN_GAME);
                }
                room.assign(SeatColor.valueOf(session.seatColor()), null);
                room = roomRepo.save(room);
            }
            return room;
        }, room -> {
            if (session.isSpectator()) {
                sessionRegistry.revoke(session.token());
            } else {
                sessionRegistry.revokeSeat(roomId, session.seatColor());
            }
            log.debug("离开房间: roomId={}, name={}, seat={}", roomId, session.participantName(), session.seatColor());
            return RoomView.of(room, null, preview(room));
        });
    }

    @Override
    public RoomView refreshBoard(RoomSession session) {
        requireHost(session);
        PvpRoom updated = roomLocks.inRoom(session.roomId(), () -> {
            PvpRoom room = lockRoom(session.roomId());
            sessionGuard.recheck(room, session);
            if (room.isStarted()) {
                throw new ValidationException(ROOM_ALREADY_STARTED);
            }
            room.setBoardSeed(nextSeed());
            return roomRepo.save(room);
        });
        log.debug("棋盘已刷新: roomId={}, seed={}", updated.getRoomId(), updated.getBoardSeed());
        return RoomView.of(updated, session, preview(updated));
    }

    @Override
    public String startRoom(RoomSession session) {
        requireHost(session);
        String roomId = session.roomId();
        return roomLocks.inRoom(roomId, () -> {
            PvpRoom room = lockRoom(roomId);
            sessionGuard.recheck(room, session);
            if (room.isStarted() && room.getGameId() != null) {
                return room.getGameId();
            }
            if (room.occupiedCount() < props.getMinPlayersToStart()) {
                throw new ValidationException(format(NOT_ENOUGH_PLAYERS, props.getMinPlayersToStart()));
            }
            List<Participant> participants = room.getSeats().stream()
                    .filter(SeatAssignment::occupied)
                    .map(s -> Participant.human(s.getColor()))
                    .toList();
            String gameId = UUID.randomUUID().toString();
            MatchState state = ruleEngine.newMatch(gameId, participants, room.getBoardSeed());
            Snapshot initial = stateStore.append(gameId, state, viewAssembler.project(state));

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("roomId", roomId);
            payload.put("seats", participants.stream().map(p -> p.color().name()).toList());
            payload.put("boardSeed", room.getBoardSeed());
            stateStore.logEvent(gameId, initial.version(), GameEventTypes.GAME_CREATED, payload);

            room.setStarted(true);
            room.setGameId(gameId);
            room.setLatestVersion(initial.version());
            roomRepo.save(room);
            log.info("房间开局: roomId={}, gameId={}, players={}", roomId, gameId, participants.size());
            return gameId;
        });
    }

    @Override
    public Snapshot getRoomGame(RoomSession session, Integer version) {
        PvpRoom room = requireRoom(session.roomId());
        if (!room.isStarted() || room.getGameId() == null) {
            throw new ValidationException(ROOM_NOT_STARTED);
        }
        return stateStore.get(room.getGameId(), version);
    }

    // ---------------- helpers ----------------

    private PvpRoom requireRoom(String roomId) {
        return roomRepo.findByRoomId(roomId)
                .orElseThrow(() -> new NotFoundException(format(ROOM_NOT_FOUND, roomId)));
    }

    private PvpRoom lockRoom(String roomId) {
        return roomRepo.findForUpdate(roomId)
                .orElseThrow(() -> new NotFoundException(format(ROOM_NOT_FOUND, roomId)));
    }

    private static void requireHost(RoomSession session) {
        if (session.isSpectator() || !SeatColor.HOST.name().equals(session.seatColor())) {
            throw new ForbiddenException(HOST_ONLY);
        }
    }

    private BoardPreview preview(PvpRoom room) {
        return new BoardPreview(room.getBoardSeed(), boardGenerator.generate(room.getBoardSeed()));
    }

    private long nextSeed() {
        return seedRnd.nextLong();
    }
}
