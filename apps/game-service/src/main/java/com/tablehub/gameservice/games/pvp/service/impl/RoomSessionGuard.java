package com.tablehub.gameservice.games.pvp.service.impl;

import com.tablehub.gameservice.common.error.TokenException;
import com.tablehub.gameservice.games.pvp.domain.entity.PvpRoom;
import com.tablehub.session.SessionRegistry;
import com.tablehub.session.model.RoomSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.tablehub.gameservice.games.pvp.domain.constants.RoomMessages.SEAT_LOST;
import static com.tablehub.gameservice.games.pvp.domain.constants.RoomMessages.TOKEN_INVALID;

/**
 * 锁内会话复核。
 * 控制器在取锁之前校验令牌，等锁期间令牌可能已被吊销、座位可能已换人，
 * 所有修改房间 / 对局的操作在持锁并读到最新房间行后都要再过一遍。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomSessionGuard {

    private final SessionRegistry sessionRegistry;

    /**
     * @param room    持锁读取的房间
     * @param session 请求携带的会话
     * @throws TokenException 令牌已失效，或入座会话的座位已不由该玩家占用
     */
    public void recheck(PvpRoom room, RoomSession session) {
        if (sessionRegistry.lookup(session.token()).isEmpty()) {
            log.debug("锁内复核失败，令牌已吊销: roomId={}, name={}", room.getRoomId(), session.participantName());
            throw new TokenException(TOKEN_INVALID);
        }
        if (!session.isSpectator() && !room.holds(session.seatColor(), session.participantName())) {
            log.debug("锁内复核失败，座位已易主: roomId={}, name={}, seat={}",
                    room.getRoomId(), session.participantName(), session.seatColor());
            throw new TokenException(SEAT_LOST);
        }
    }
}
