package com.tablehub.gameservice.games.standalone.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.state.Snapshot;

import java.util.List;

/**
 * 不经过房间的对局（座位可混合人类与自动代理）。
 * <p>
 * 注意：同一对局的并发修改不加锁，两个请求同时追加时后者以 409 失败。
 */
public interface StandaloneGameService {

    /**
     * 创建对局。
     *
     * @param playerKinds 2~4 个 HUMAN / RANDOM / CAUTIOUS，按座次依次取色
     * @return 对局ID
     */
    String createGame(List<String> playerKinds);

    List<GameSummaryView> listGames();

    /** version 为 null 时取最新 */
    Snapshot getGame(String gameId, Integer version);

    /** 删除对局；不存在时 404 */
    void deleteGame(String gameId);

    List<GameEventView> listEvents(String gameId, String eventType);

    /**
     * 推进对局：带动作则执行该动作；不带动作则让当前自动座位走一步（或代答议价），
     * 轮到人类且无动作时 400。已结束的对局原样返回当前快照。
     */
    Snapshot act(String gameId, JsonNode action);
}
