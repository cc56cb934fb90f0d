package com.tablehub.gameservice.application.view;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.tablehub.gameservice.application.state.Snapshot;

/**
 * HTTP / STOMP 返回的快照：版本号 + 投影原文（不再二次序列化）。
 */
public record SnapshotView(String gameId, int version, @JsonRawValue String game) {

    public static SnapshotView of(Snapshot snapshot) {
        return new SnapshotView(snapshot.gameId(), snapshot.version(), snapshot.displayProjection());
    }
}
