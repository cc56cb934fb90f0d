package com.tablehub.gameservice.engine.core;

/**
 * 座位颜色，声明顺序即规范座次；第一个座位（RED）为房主位。
 */
public enum SeatColor {
    RED,
    BLUE,
    WHITE,
    ORANGE;

    /** 房主座位 */
    public static final SeatColor HOST = RED;

    public boolean isHost() {
        return this == HOST;
    }
}
