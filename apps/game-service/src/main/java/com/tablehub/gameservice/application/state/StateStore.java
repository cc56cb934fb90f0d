package com.tablehub.gameservice.application.state;

import com.tablehub.gameservice.engine.core.MatchState;

import java.util.List;
import java.util.Map;

/**
 * 对局状态版本库（持久化端口）。
 * <p>
 * 每个 gameId 的快照版本从 0 开始、每次成功追加恰好 +1，快照不可变；
 * 摘要（latestVersion 等）与快照在同一事务内更新。
 * 本端口不做跨调用加锁：同一对局的追加顺序由调用方保证（房间锁）。
 */
public interface StateStore {

    /**
     * 追加快照，返回带新版本号的快照。
     *
     * @param displayProjection 客户端可见投影（JSON）
     * @throws com.tablehub.gameservice.common.error.ConflictException 同一版本被并发写入
     * @throws com.tablehub.gameservice.common.error.InternalException 持久化失败
     */
    Snapshot append(String gameId, MatchState state, String displayProjection);

    /**
     * 读取快照。
     *
     * @param version null 表示最新版本
     * @throws com.tablehub.gameservice.common.error.NotFoundException 对局或版本不存在
     */
    Snapshot get(String gameId, Integer version);

    default Snapshot latest(String gameId) {
        return get(gameId, null);
    }

    GameSummaryView getSummary(String gameId);

    /** 按最近更新时间倒序 */
    List<GameSummaryView> listSummaries(int limit);

    /**
     * 删除对局的全部快照、摘要与事件；幂等。
     *
     * @return 删除的行数，0 表示原本就不存在
     */
    int deleteGame(String gameId);

    void logEvent(String gameId, Integer version, String eventType, Map<String, Object> payload);

    /** 按写入顺序；eventType 为空则不过滤 */
    List<GameEventView> listEvents(String gameId, String eventType);
}
