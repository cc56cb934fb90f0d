package com.tablehub.gameservice.engine.core;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 棋盘地块（立方坐标 x/y/z）。沙漠地块 resource 与 number 均为 null。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoardTile {
    private int x;
    private int y;
    private int z;
    private Resource resource;
    private Integer number;
}
