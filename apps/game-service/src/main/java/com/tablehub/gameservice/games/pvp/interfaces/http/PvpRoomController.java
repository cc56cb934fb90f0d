package com.tablehub.gameservice.games.pvp.interfaces.http;

import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.view.SnapshotView;
import com.tablehub.gameservice.common.VersionParam;
import com.tablehub.gameservice.games.pvp.domain.model.JoinResult;
import com.tablehub.gameservice.games.pvp.domain.model.RoomView;
import com.tablehub.gameservice.games.pvp.interfaces.http.dto.CreateRoomRequest;
import com.tablehub.gameservice.games.pvp.interfaces.http.dto.JoinRoomRequest;
import com.tablehub.gameservice.games.pvp.interfaces.http.dto.StartRoomResponse;
import com.tablehub.gameservice.games.pvp.interfaces.http.dto.SubmitActionRequest;
import com.tablehub.gameservice.games.pvp.service.ActionGateway;
import com.tablehub.gameservice.games.pvp.service.RoomService;
import com.tablehub.gameservice.platform.ws.RoomBroadcaster;
import com.tablehub.session.model.RoomSession;
import com.tablehub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 多人房间 HTTP 接口。
 * 令牌通过请求头 X-PVP-Token 传递（加入房间时签发）。
 * 每次成功修改后把房间视图 / 新快照广播到 /topic/pvp.room.{roomId}。
 */
@Slf4j
@RestController
@RequestMapping("/api/pvp/rooms")
@RequiredArgsConstructor
public class PvpRoomController {

    public static final String TOKEN_HEADER = "X-PVP-Token";

    private final RoomService roomService;
    private final ActionGateway actionGateway;
    private final RoomBroadcaster broadcaster;

    /**
     * 创建房间（请求体可省略）
     */
    @PostMapping
    public ResponseEntity<ApiResponse<RoomView>> create(@RequestBody(required = false) CreateRoomRequest req) {
        RoomView view = roomService.createRoom(req == null ? null : req.getRoomName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(view));
    }

    @GetMapping
    public ApiResponse<List<RoomView>> list() {
        return ApiResponse.success(roomService.listRooms());
    }

    /**
     * 加入房间：返回令牌、座位与是否观战
     */
    @PostMapping("/{roomId}/join")
    public ApiResponse<JoinResult> join(@PathVariable String roomId,
                                        @RequestBody(required = false) JoinRoomRequest req) {
        JoinResult result = roomService.joinRoom(roomId, req == null ? null : req.getUserName());
        broadcaster.room(roomId, roomService.roomStatus(roomId, null));
        return ApiResponse.success(result);
    }

    /**
     * 房间状态；带令牌时标记调用方座位
     */
    @GetMapping("/{roomId}/status")
    public ApiResponse<RoomView> status(@PathVariable String roomId,
                                        @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        return ApiResponse.success(roomService.roomStatus(roomId, token));
    }

    @PostMapping("/{roomId}/leave")
    public ApiResponse<RoomView> leave(@PathVariable String roomId,
                                       @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        RoomSession session = roomService.requireSession(roomId, token);
        RoomView view = roomService.leaveRoom(session);
        broadcaster.room(roomId, view);
        return ApiResponse.success(view);
    }

    /**
     * 房主刷新棋盘（开局前）
     */
    @PostMapping("/{roomId}/board")
    public ApiResponse<RoomView> refreshBoard(@PathVariable String roomId,
                                              @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        RoomSession session = roomService.requireSession(roomId, token);
        RoomView view = roomService.refreshBoard(session);
        broadcaster.room(roomId, roomService.roomStatus(roomId, null));
        return ApiResponse.success(view);
    }

    /**
     * 房主开局
     */
    @PostMapping("/{roomId}/start")
    public ApiResponse<StartRoomResponse> start(@PathVariable String roomId,
                                                @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        RoomSession session = roomService.requireSession(roomId, token);
        String gameId = roomService.startRoom(session);
        broadcaster.room(roomId, roomService.roomStatus(roomId, null));
        Snapshot initial = roomService.getRoomGame(session, null);
        broadcaster.state(roomId, SnapshotView.of(initial), initial.version());
        return ApiResponse.success(new StartRoomResponse(gameId));
    }

    /**
     * 读取对局快照：state=latest（默认）或版本号
     */
    @GetMapping("/{roomId}/game")
    public ApiResponse<SnapshotView> game(@PathVariable String roomId,
                                          @RequestParam(name = "state", defaultValue = "latest") String state,
                                          @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        RoomSession session = roomService.requireSession(roomId, token);
        Snapshot snapshot = roomService.getRoomGame(session, VersionParam.parse(state));
        return ApiResponse.success(SnapshotView.of(snapshot));
    }

    /**
     * 提交动作：{"action": [color, type, value], "expectedVersion": n}
     */
    @PostMapping("/{roomId}/action")
    public ApiResponse<SnapshotView> act(@PathVariable String roomId,
                                         @RequestBody(required = false) SubmitActionRequest req,
                                         @RequestHeader(value = TOKEN_HEADER, required = false) String token) {
        RoomSession session = roomService.requireSession(roomId, token);
        Snapshot snapshot = actionGateway.submitAction(session,
                req == null ? null : req.getAction(),
                req == null ? null : req.getExpectedVersion());
        SnapshotView view = SnapshotView.of(snapshot);
        broadcaster.state(roomId, view, snapshot.version());
        return ApiResponse.success(view);
    }
}
