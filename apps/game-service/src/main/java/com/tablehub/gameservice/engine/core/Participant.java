package com.tablehub.gameservice.engine.core;

/**
 * 开局时的座位描述：颜色 + 控制方。
 */
public record Participant(SeatColor color, ParticipantKind kind) {

    public static Participant human(SeatColor color) {
        return new Participant(color, ParticipantKind.HUMAN);
    }
}
