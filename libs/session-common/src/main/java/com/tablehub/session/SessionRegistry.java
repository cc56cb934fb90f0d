package com.tablehub.session;

import com.tablehub.session.model.RoomSession;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 房间会话注册表（进程内）。
 *
 * 职责：
 * - 签发 / 查询 / 吊销房间令牌（token -> RoomSession）；
 * - 三个操作共用一把互斥锁，令牌表是跨请求共享的可变状态。
 *
 * 约束：
 * - 不做持久化：进程重启后所有令牌失效，而房间本身仍在数据库中；
 * - 令牌不过期，只能显式吊销。
 */
@Slf4j
public class SessionRegistry {

    /** 默认令牌熵：18 字节 = 144bit */
    public static final int DEFAULT_TOKEN_BYTES = 18;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, RoomSession> sessions = new HashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final int tokenBytes;

    public SessionRegistry() {
        this(DEFAULT_TOKEN_BYTES);
    }

    public SessionRegistry(int tokenBytes) {
        if (tokenBytes < 16) {
            throw new IllegalArgumentException("tokenBytes must be >= 16");
        }
        this.tokenBytes = tokenBytes;
    }

    /**
     * 签发令牌。
     *
     * @param participantName 玩家名
     * @param roomId          房间ID
     * @param seatColor       座位颜色；null 表示观战
     * @return 新会话（含令牌）
     */
    public RoomSession issue(String participantName, String roomId, String seatColor) {
        Objects.requireNonNull(participantName, "participantName must not be null");
        Objects.requireNonNull(roomId, "roomId must not be null");
        lock.lock();
        try {
            String token = nextToken();
            while (sessions.containsKey(token)) {
                token = nextToken();
            }
            RoomSession session = new RoomSession(token, participantName, roomId, seatColor);
            sessions.put(token, session);
            log.debug("签发房间令牌: roomId={}, name={}, seat={}", roomId, participantName, seatColor);
            return session;
        } finally {
            lock.unlock();
        }
    }

    /** 查询令牌；空令牌或未知令牌返回 empty */
    public Optional<RoomSession> lookup(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(token));
        } finally {
            lock.unlock();
        }
    }

    /** 吊销令牌（幂等） */
    public void revoke(String token) {
        if (token == null) {
            return;
        }
        lock.lock();
        try {
            RoomSession removed = sessions.remove(token);
            if (removed != null) {
                log.debug("吊销房间令牌: roomId={}, name={}", removed.roomId(), removed.participantName());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 吊销某房间某座位上的全部令牌（重连会为同一座位签发多枚令牌）。
     *
     * @return 吊销数量
     */
    public int revokeSeat(String roomId, String seatColor) {
        if (roomId == null || seatColor == null) {
            return 0;
        }
        lock.lock();
        try {
            int before = sessions.size();
            sessions.values().removeIf(s -> s.belongsTo(roomId) && seatColor.equals(s.seatColor()));
            int removed = before - sessions.size();
            if (removed > 0) {
                log.debug("吊销座位令牌: roomId={}, seat={}, count={}", roomId, seatColor, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /** 当前存活令牌数 */
    public int size() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    private String nextToken() {
        byte[] buf = new byte[tokenBytes];
        random.nextBytes(buf);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buf);
    }
}
