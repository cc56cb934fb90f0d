package com.tablehub.gameservice.games.pvp.service;

import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.games.pvp.domain.model.JoinResult;
import com.tablehub.gameservice.games.pvp.domain.model.RoomView;
import com.tablehub.session.model.RoomSession;

import java.util.List;

/**
 * 多人房间：座位分配、开局与会话管理。
 * 除创建外，所有修改操作都在该房间的排他锁内完成（含提交）。
 */
public interface RoomService {

    /** 创建房间；名字为空时用默认名，四个空座位，随机棋盘种子 */
    RoomView createRoom(String name);

    /** 最近创建的房间 */
    List<RoomView> listRooms();

    /**
     * 加入房间：同名即重连（新令牌、同一座位）；已开局则观战；否则占第一个空位；满员观战。
     */
    JoinResult joinRoom(String roomId, String userName);

    /**
     * 房间状态。token 为空返回匿名视图；未知令牌 401；其他房间的令牌 403。
     */
    RoomView roomStatus(String roomId, String token);

    /** 解析令牌：缺失 / 未知 401，不属于该房间 403 */
    RoomSession requireSession(String roomId, String token);

    /** 离开房间：开局后入座玩家不能离开；否则清空座位并吊销令牌 */
    RoomView leaveRoom(RoomSession session);

    /** 房主重新生成棋盘种子（开局前） */
    RoomView refreshBoard(RoomSession session);

    /** 房主开局，返回对局ID；已开局时幂等返回已有ID */
    String startRoom(RoomSession session);

    /**
     * 读取房间绑定对局的快照。
     *
     * @param version null 为最新
     */
    Snapshot getRoomGame(RoomSession session, Integer version);
}
