package com.tablehub.gameservice.games.pvp.domain.model;

import com.tablehub.gameservice.engine.core.BoardTile;

import java.util.List;

/**
 * 开局前的棋盘预览：由房间种子确定性生成。
 */
public record BoardPreview(long seed, List<BoardTile> tiles) {
}
