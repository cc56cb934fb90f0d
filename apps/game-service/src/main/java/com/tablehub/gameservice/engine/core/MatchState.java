package com.tablehub.gameservice.engine.core;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局完整状态（快照中的 stateBlob 即其序列化结果）。
 * <p>
 * turnIndex 为持有回合的座位；actorIndex 为当前掌控行动的座位，
 * 议价期间自动推进会把控制权临时切到响应方。
 * 必须可 copy：规则引擎每次 apply 都在副本上执行，失败时原状态不受影响。
 */
@Data
@NoArgsConstructor
public class MatchState {
    private String gameId;
    private long boardSeed;
    private List<BoardTile> board = new ArrayList<>();
    private List<SeatState> seats = new ArrayList<>();
    private int turnIndex;
    private int actorIndex;
    private TurnPhase phase = TurnPhase.ROLL;
    /** 仅在 AWAITING_RESPONSES 时非空 */
    private Negotiation negotiation;
    private SeatColor winner;
    private int turnNumber = 1;
    /** 已执行的动作数 */
    private int actionCount;
    private Integer lastRoll;

    public SeatState seat(int index) {
        return seats.get(index);
    }

    /** 颜色 -> 座位下标；不在对局中返回 -1 */
    public int indexOf(SeatColor color) {
        for (int i = 0; i < seats.size(); i++) {
            if (seats.get(i).getColor() == color) {
                return i;
            }
        }
        return -1;
    }

    public SeatColor currentActor() {
        return seats.get(actorIndex).getColor();
    }

    public SeatColor turnHolder() {
        return seats.get(turnIndex).getColor();
    }

    public boolean awaitingResponses() {
        return phase == TurnPhase.AWAITING_RESPONSES && negotiation != null;
    }

    public List<SeatColor> colors() {
        List<SeatColor> out = new ArrayList<>(seats.size());
        for (SeatState s : seats) {
            out.add(s.getColor());
        }
        return out;
    }

    /** 深拷贝 */
    public MatchState copy() {
        MatchState c = new MatchState();
        c.setGameId(gameId);
        c.setBoardSeed(boardSeed);
        List<BoardTile> tiles = new ArrayList<>(board.size());
        for (BoardTile t : board) {
            tiles.add(new BoardTile(t.getX(), t.getY(), t.getZ(), t.getResource(), t.getNumber()));
        }
        c.setBoard(tiles);
        List<SeatState> seatCopies = new ArrayList<>(seats.size());
        for (SeatState s : seats) {
            seatCopies.add(s.copy());
        }
        c.setSeats(seatCopies);
        c.setTurnIndex(turnIndex);
        c.setActorIndex(actorIndex);
        c.setPhase(phase);
        c.setNegotiation(negotiation == null ? null : negotiation.copy());
        c.setWinner(winner);
        c.setTurnNumber(turnNumber);
        c.setActionCount(actionCount);
        c.setLastRoll(lastRoll);
        return c;
    }
}
