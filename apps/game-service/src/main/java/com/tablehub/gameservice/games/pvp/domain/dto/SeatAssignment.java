package com.tablehub.gameservice.games.pvp.domain.dto;

import com.tablehub.gameservice.engine.core.SeatColor;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 房间座位：颜色固定，userName 为空表示空位。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeatAssignment {
    private SeatColor color;
    private String userName;

    public boolean occupied() {
        return userName != null && !userName.isBlank();
    }

    public static SeatAssignment empty(SeatColor color) {
        return new SeatAssignment(color, null);
    }
}
