package com.tablehub.gameservice.application.state;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 对局摘要：latestVersion 恒等于已存快照的最大版本。
 */
public record GameSummaryView(String gameId,
                              int latestVersion,
                              List<String> seatColors,
                              String currentColor,
                              String winner,
                              OffsetDateTime createdAt,
                              OffsetDateTime updatedAt) {
}
