package com.tablehub.gameservice.engine.core;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局内单个座位的状态。
 */
@Data
@NoArgsConstructor
public class SeatState {
    /** 座位颜色 */
    private SeatColor color;
    /** 控制方 */
    private ParticipantKind kind;
    /** 资源向量，下标见 {@link Resource} */
    private int[] resources = new int[Resource.COUNT];
    /** 分数 */
    private int victoryPoints;

    public SeatState(SeatColor color, ParticipantKind kind) {
        this.color = color;
        this.kind = kind;
    }

    /** 是否持有 counts 所列的全部资源 */
    public boolean canAfford(int[] counts) {
        for (int i = 0; i < Resource.COUNT; i++) {
            if (resources[i] < counts[i]) {
                return false;
            }
        }
        return true;
    }

    /** 资源增减（delta 可为负） */
    public void add(int[] counts, int sign) {
        for (int i = 0; i < Resource.COUNT; i++) {
            resources[i] += sign * counts[i];
        }
    }

    public SeatState copy() {
        SeatState c = new SeatState(color, kind);
        c.setResources(resources.clone());
        c.setVictoryPoints(victoryPoints);
        return c;
    }
}
