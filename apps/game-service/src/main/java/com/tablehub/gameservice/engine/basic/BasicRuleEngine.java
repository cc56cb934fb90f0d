package com.tablehub.gameservice.engine.basic;

import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.core.ActionType;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.Negotiation;
import com.tablehub.gameservice.engine.core.Participant;
import com.tablehub.gameservice.engine.core.Resource;
import com.tablehub.gameservice.engine.core.RuleEngine;
import com.tablehub.gameservice.engine.core.SeatState;
import com.tablehub.gameservice.engine.core.TradeOffer;
import com.tablehub.gameservice.engine.core.TradeResponse;
import com.tablehub.gameservice.engine.core.TurnPhase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * 参考规则引擎：掷骰收资源、建造得分、回合内一对多议价。
 * <pre>
 * ROLL ──掷骰──> PLAY_TURN ──OFFER_TRADE──> AWAITING_RESPONSES
 *                  │   ^                            │
 *                  │   └──全部响应 / CANCEL_TRADE ───┘
 *                  └──END_TURN──> 下一座位 ROLL
 * 任意时刻分数达到 {@link #VICTORY_POINTS_TO_WIN} 即 GAME_OVER。
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class BasicRuleEngine implements RuleEngine {

    public static final int MIN_SEATS = 2;
    public static final int MAX_SEATS = 4;
    public static final int VICTORY_POINTS_TO_WIN = 10;
    /** 开局每种资源各发 2 个 */
    public static final int STARTING_RESOURCES = 2;
    /** 建造花费：木、砖、羊、麦各 1 */
    static final int[] BUILD_COST = {1, 1, 1, 1, 0};

    private final BoardGenerator boardGenerator;

    @Override
    public MatchState newMatch(String gameId, List<Participant> participants, long boardSeed) {
        if (participants == null || participants.size() < MIN_SEATS || participants.size() > MAX_SEATS) {
            throw new ValidationException("参与人数必须在 " + MIN_SEATS + "~" + MAX_SEATS + " 之间");
        }
        MatchState s = new MatchState();
        s.setGameId(gameId);
        s.setBoardSeed(boardSeed);
        s.setBoard(boardGenerator.generate(boardSeed));
        List<SeatState> seats = new ArrayList<>(participants.size());
        for (Participant p : participants) {
            if (seats.stream().anyMatch(x -> x.getColor() == p.color())) {
                throw new ValidationException("座位颜色重复: " + p.color());
            }
            SeatState seat = new SeatState(p.color(), p.kind());
            Arrays.fill(seat.getResources(), STARTING_RESOURCES);
            seats.add(seat);
        }
        s.setSeats(seats);
        s.setTurnIndex(0);
        s.setActorIndex(0);
        s.setPhase(TurnPhase.ROLL);
        s.setTurnNumber(1);
        return s;
    }

    @Override
    public List<GameAction> legalActions(MatchState state) {
        List<GameAction> out = new ArrayList<>();
        switch (state.getPhase()) {
            case ROLL -> out.add(GameAction.of(state.turnHolder(), ActionType.ROLL));
            case PLAY_TURN -> {
                SeatState holder = state.seat(state.getTurnIndex());
                out.add(GameAction.of(holder.getColor(), ActionType.END_TURN));
                if (holder.canAfford(BUILD_COST)) {
                    out.add(GameAction.of(holder.getColor(), ActionType.BUILD));
                }
                for (Resource give : Resource.values()) {
                    if (holder.getResources()[give.ordinal()] < 1) {
                        continue;
                    }
                    for (Resource want : Resource.values()) {
                        if (want != give) {
                            out.add(TradeOffer.oneForOne(holder.getColor(), give, want));
                        }
                    }
                }
            }
            case AWAITING_RESPONSES -> {
                Negotiation n = state.getNegotiation();
                int actor = state.getActorIndex();
                SeatState seat = state.seat(actor);
                if (actor == n.getOffererSeat()) {
                    out.add(GameAction.of(seat.getColor(), ActionType.CANCEL_TRADE));
                } else if (!n.responded(actor)) {
                    out.add(GameAction.reject(seat.getColor()));
                    if (seat.canAfford(n.getRequestCounts())) {
                        out.add(GameAction.accept(seat.getColor()));
                    }
                }
            }
            case GAME_OVER -> {
            }
        }
        return out;
    }

    @Override
    public MatchState apply(MatchState state, GameAction action, boolean validate) {
        if (validate) {
            check(state, action);
        }
        MatchState next = state.copy();
        int seat = next.indexOf(action.color());
        switch (action.type()) {
            case ROLL -> roll(next);
            case BUILD -> build(next, seat);
            case END_TURN -> endTurn(next);
            case OFFER_TRADE -> {
                TradeOffer o = (TradeOffer) action;
                next.setNegotiation(Negotiation.open(next.getTurnIndex(), o.offer(), o.request(), next.getSeats().size()));
                next.setPhase(TurnPhase.AWAITING_RESPONSES);
            }
            case ACCEPT_TRADE, REJECT_TRADE -> respond(next, seat, ((TradeResponse) action).accept());
            case CANCEL_TRADE -> closeNegotiation(next);
        }
        next.setActionCount(next.getActionCount() + 1);
        return next;
    }

    // ---------------- 校验 ----------------

    private void check(MatchState state, GameAction action) {
        if (state.getPhase() == TurnPhase.GAME_OVER) {
            throw new ValidationException("对局已结束");
        }
        int seat = state.indexOf(action.color());
        if (seat < 0) {
            throw new ValidationException("该颜色不在对局中: " + action.color());
        }
        switch (action.type()) {
            case ACCEPT_TRADE, REJECT_TRADE -> {
                requirePhase(state, TurnPhase.AWAITING_RESPONSES, action);
                Negotiation n = state.getNegotiation();
                if (seat == n.getOffererSeat()) {
                    throw new ValidationException("发起方不能响应自己的报价");
                }
                if (n.responded(seat)) {
                    throw new ValidationException("已经响应过该报价");
                }
                if (action.type() == ActionType.ACCEPT_TRADE && !state.seat(seat).canAfford(n.getRequestCounts())) {
                    throw new ValidationException("资源不足，无法接受报价");
                }
            }
            case CANCEL_TRADE -> {
                requirePhase(state, TurnPhase.AWAITING_RESPONSES, action);
                if (seat != state.getNegotiation().getOffererSeat()) {
                    throw new ValidationException("只有发起方可以撤销报价");
                }
            }
            default -> {
                if (seat != state.getTurnIndex()) {
                    throw new ValidationException("未轮到该方行动（当前应为 " + state.turnHolder() + "）");
                }
                switch (action.type()) {
                    case ROLL -> requirePhase(state, TurnPhase.ROLL, action);
                    case END_TURN -> requirePhase(state, TurnPhase.PLAY_TURN, action);
                    case BUILD -> {
                        requirePhase(state, TurnPhase.PLAY_TURN, action);
                        if (!state.seat(seat).canAfford(BUILD_COST)) {
                            throw new ValidationException("资源不足，无法建造");
                        }
                    }
                    case OFFER_TRADE -> {
                        requirePhase(state, TurnPhase.PLAY_TURN, action);
                        TradeOffer o = (TradeOffer) action;
                        if (sum(o.offer()) == 0 || sum(o.request()) == 0) {
                            throw new ValidationException("报价双方都必须至少包含一个资源");
                        }
                        if (!state.seat(seat).canAfford(o.offer())) {
                            throw new ValidationException("资源不足，无法发起该报价");
                        }
                    }
                    default -> throw new ValidationException("不支持的动作: " + action.type());
                }
            }
        }
    }

    private static void requirePhase(MatchState state, TurnPhase phase, GameAction action) {
        if (state.getPhase() != phase) {
            throw new ValidationException(action.type() + " 只能在 " + phase + " 阶段执行（当前 " + state.getPhase() + "）");
        }
    }

    // ---------------- 执行 ----------------

    private void roll(MatchState s) {
        Random dice = new Random(s.getBoardSeed() * 31 + s.getActionCount());
        int roll = dice.nextInt(6) + 1 + dice.nextInt(6) + 1;
        s.setLastRoll(roll);
        s.getBoard().stream()
                .filter(t -> t.getResource() != null && t.getNumber() != null && t.getNumber() == roll)
                .forEach(t -> s.getSeats().forEach(seat -> seat.getResources()[t.getResource().ordinal()]++));
        s.setPhase(TurnPhase.PLAY_TURN);
    }

    private void build(MatchState s, int seat) {
        SeatState st = s.seat(seat);
        st.add(BUILD_COST, -1);
        st.setVictoryPoints(st.getVictoryPoints() + 1);
        if (st.getVictoryPoints() >= VICTORY_POINTS_TO_WIN) {
            s.setWinner(st.getColor());
            s.setPhase(TurnPhase.GAME_OVER);
        }
    }

    private void endTurn(MatchState s) {
        int next = (s.getTurnIndex() + 1) % s.getSeats().size();
        s.setTurnIndex(next);
        s.setActorIndex(next);
        s.setPhase(TurnPhase.ROLL);
        s.setTurnNumber(s.getTurnNumber() + 1);
        s.setLastRoll(null);
    }

    private void respond(MatchState s, int seat, boolean accept) {
        Negotiation n = s.getNegotiation();
        // 未校验的强制拒绝可能落在议价之外，此时无事可做
        if (n == null || seat < 0 || seat == n.getOffererSeat()) {
            return;
        }
        n.record(seat, accept);
        if (n.complete()) {
            settle(s, n);
        }
    }

    /** 与发起方之后第一个接受者成交；无人接受则直接关闭 */
    private void settle(MatchState s, Negotiation n) {
        int size = s.getSeats().size();
        SeatState offerer = s.seat(n.getOffererSeat());
        for (int k = 1; k < size; k++) {
            int idx = (n.getOffererSeat() + k) % size;
            SeatState acceptor = s.seat(idx);
            if (n.getAcceptBitmap()[idx]
                    && acceptor.canAfford(n.getRequestCounts())
                    && offerer.canAfford(n.getOfferCounts())) {
                offerer.add(n.getOfferCounts(), -1);
                offerer.add(n.getRequestCounts(), 1);
                acceptor.add(n.getOfferCounts(), 1);
                acceptor.add(n.getRequestCounts(), -1);
                break;
            }
        }
        closeNegotiation(s);
    }

    private void closeNegotiation(MatchState s) {
        s.setNegotiation(null);
        s.setPhase(TurnPhase.PLAY_TURN);
        s.setActorIndex(s.getTurnIndex());
    }

    private static int sum(int[] v) {
        int t = 0;
        for (int x : v) {
            t += x;
        }
        return t;
    }
}
