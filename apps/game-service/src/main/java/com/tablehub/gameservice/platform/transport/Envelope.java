package com.tablehub.gameservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（房间广播通用）
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / roomId / payload / ts / version
 *
 * 用法示例：
 *   Envelope<RoomView>     msg = Envelope.room(roomId, view);
 *   Envelope<SnapshotView> st  = Envelope.state(roomId, snapshot, version);
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** 消息类别：ROOM=房间座位变化，STATE=对局新快照 */
    public enum Kind { ROOM, STATE }

    private final Kind kind;
    private final String roomId;
    private final T payload;
    private final long ts;         // 服务器时间戳（ms）
    private final long version;    // STATE 时为快照版本，ROOM 时为 -1

    private Envelope(Kind kind, String roomId, T payload, long ts, long version) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.payload = payload;
        this.ts = ts;
        this.version = version;
    }

    /** 房间视图广播 */
    public static <T> Envelope<T> room(String roomId, T payload) {
        return new Envelope<>(Kind.ROOM, roomId, payload, Instant.now().toEpochMilli(), -1);
    }

    /** 对局快照广播 */
    public static <T> Envelope<T> state(String roomId, T payload, long version) {
        return new Envelope<>(Kind.STATE, roomId, payload, Instant.now().toEpochMilli(), version);
    }

    // Getters（不可变，Jackson 按 getter 序列化）
    public Kind getKind()     { return kind; }
    public String getRoomId() { return roomId; }
    public T getPayload()     { return payload; }
    public long getTs()       { return ts; }
    public long getVersion()  { return version; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", roomId='" + roomId + '\'' +
                ", ts=" + ts +
                ", version=" + version +
                '}';
    }
}
