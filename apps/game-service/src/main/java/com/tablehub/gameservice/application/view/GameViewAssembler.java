package com.tablehub.gameservice.application.view;

import com.alibaba.fastjson2.JSON;
import com.tablehub.gameservice.engine.codec.ActionCodec;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Negotiation;
import com.tablehub.gameservice.engine.core.Resource;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MatchState -> GameView / 投影 JSON
 */
@Component
@RequiredArgsConstructor
public class GameViewAssembler {

    private final RuleEngine ruleEngine;
    private final ActionCodec actionCodec;

    public GameView toView(MatchState s) {
        return GameView.builder()
                .gameId(s.getGameId())
                .phase(s.getPhase().name())
                .turnNumber(s.getTurnNumber())
                .turnColor(s.turnHolder().name())
                .currentColor(s.currentActor().name())
                .lastRoll(s.getLastRoll())
                .winner(s.getWinner() == null ? null : s.getWinner().name())
                .seats(s.getSeats().stream().map(GameViewAssembler::seatView).toList())
                .board(s.getBoard())
                .negotiation(negotiationView(s))
                .legalActions(ruleEngine.legalActions(s).stream().map(actionCodec::encode).toList())
                .build();
    }

    /** 写入快照的投影 JSON */
    public String project(MatchState s) {
        return JSON.toJSONString(toView(s));
    }

    private static GameView.SeatView seatView(SeatState seat) {
        return GameView.SeatView.builder()
                .color(seat.getColor().name())
                .kind(seat.getKind().name())
                .resources(counts(seat.getResources()))
                .victoryPoints(seat.getVictoryPoints())
                .build();
    }

    private static GameView.NegotiationView negotiationView(MatchState s) {
        Negotiation n = s.getNegotiation();
        if (n == null) {
            return null;
        }
        Map<String, Boolean> responses = new LinkedHashMap<>();
        for (int i = 0; i < s.getSeats().size(); i++) {
            if (n.responded(i)) {
                responses.put(s.seat(i).getColor().name(), n.getAcceptBitmap()[i]);
            }
        }
        return GameView.NegotiationView.builder()
                .offerer(s.seat(n.getOffererSeat()).getColor().name())
                .offer(counts(n.getOfferCounts()))
                .request(counts(n.getRequestCounts()))
                .responses(responses)
                .build();
    }

    private static Map<String, Integer> counts(int[] v) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (Resource r : Resource.values()) {
            m.put(r.name(), v[r.ordinal()]);
        }
        return m;
    }
}
