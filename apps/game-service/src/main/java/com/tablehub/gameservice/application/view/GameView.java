package com.tablehub.gameservice.application.view;

import com.tablehub.gameservice.engine.core.BoardTile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 客户端可见的对局投影（快照 displayProjection 的结构）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameView {

    private String gameId;
    private String phase;
    private int turnNumber;
    /** 持有回合的座位 */
    private String turnColor;
    /** 当前掌控行动的座位 */
    private String currentColor;
    private Integer lastRoll;
    private String winner;
    private List<SeatView> seats;
    private List<BoardTile> board;
    /** 未在议价时为 null */
    private NegotiationView negotiation;
    /** 当前行动方可执行的动作，线上格式 [color, type, value] */
    private List<List<Object>> legalActions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SeatView {
        private String color;
        private String kind;
        private Map<String, Integer> resources;
        private int victoryPoints;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NegotiationView {
        private String offerer;
        private Map<String, Integer> offer;
        private Map<String, Integer> request;
        /** 已响应座位 -> 是否接受 */
        private Map<String, Boolean> responses;
    }
}
