package com.tablehub.gameservice.application.state;

import com.tablehub.gameservice.engine.core.MatchState;

import java.time.OffsetDateTime;

/**
 * 不可变快照：某对局在某版本的完整状态与展示投影。
 */
public record Snapshot(String gameId,
                       int version,
                       MatchState state,
                       String displayProjection,
                       OffsetDateTime createdAt) {
}
