package com.tablehub.gameservice.games.pvp.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.session.model.RoomSession;

/**
 * 房间对局的动作入口（乐观并发）。
 */
public interface ActionGateway {

    /**
     * 提交动作。
     *
     * @param action          线上格式 [color, type, value]
     * @param expectedVersion 客户端读到的版本；非空且不等于当前最新版本时直接 409，不评估动作
     * @return 最新快照（可能已包含自动代答）
     */
    Snapshot submitAction(RoomSession session, JsonNode action, Integer expectedVersion);
}
