package com.tablehub.gameservice.application.advice;

import com.tablehub.gameservice.application.state.GameEventTypes;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.engine.core.SeatState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 协商建议：定位请求方座位、记审计事件、转发给外部建议服务。
 * <p>
 * 请求方座位的判定顺序：
 * 1) 当前行动方是人类则取之；
 * 2) 显式传入且属于本局的颜色覆盖 1)；
 * 3) 仍未确定且本局只有一个人类座位时取该座位。
 * 事件在调用建议服务之前写入，建议服务失败也保留请求记录。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NegotiationAdviceService {

    private final StateStore stateStore;
    private final AdvisorPort advisor;

    public AdviceResult advise(String gameId, Integer version, String requestedColor, String boardImage) {
        Snapshot snapshot = stateStore.get(gameId, version);
        MatchState state = snapshot.state();

        List<String> humanColors = state.getSeats().stream()
                .filter(s -> !s.getKind().isBot())
                .map(s -> s.getColor().name())
                .toList();
        SeatState actor = state.seat(state.getActorIndex());
        String currentColor = actor.getColor().name();

        String requester = actor.getKind().isBot() ? null : currentColor;
        SeatColor requested = parseColor(requestedColor);
        if (requested != null && state.indexOf(requested) >= 0) {
            requester = requested.name();
        }
        if (requester == null && humanColors.size() == 1) {
            requester = humanColors.get(0);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requesterColor", requester);
        payload.put("humanColors", humanColors);
        payload.put("currentColor", currentColor);
        if (StringUtils.hasText(boardImage)) {
            payload.put("boardImageAttached", true);
        }
        stateStore.logEvent(gameId, snapshot.version(), GameEventTypes.NEGOTIATION_ADVICE_REQUEST, payload);
        log.info("请求协商建议: gameId={}, version={}, requester={}", gameId, snapshot.version(), requester);

        return advisor.advise(new AdviceRequest(gameId, snapshot.version(), requester, humanColors, currentColor,
                snapshot.displayProjection(), StringUtils.hasText(boardImage) ? boardImage : null));
    }

    /** 无法识别的颜色按未指定处理 */
    private static SeatColor parseColor(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return SeatColor.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.debug("忽略无法识别的 requesterColor: {}", raw);
            return null;
        }
    }
}
