package com.tablehub.gameservice.games.standalone.interfaces.http;

import com.tablehub.gameservice.application.advice.AdviceResult;
import com.tablehub.gameservice.application.advice.NegotiationAdviceService;
import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.view.SnapshotView;
import com.tablehub.gameservice.common.VersionParam;
import com.tablehub.gameservice.games.standalone.interfaces.http.dto.ActRequest;
import com.tablehub.gameservice.games.standalone.interfaces.http.dto.CreateGameRequest;
import com.tablehub.gameservice.games.standalone.interfaces.http.dto.CreateGameResponse;
import com.tablehub.gameservice.games.standalone.interfaces.http.dto.DeleteGameResponse;
import com.tablehub.gameservice.games.standalone.interfaces.http.dto.NegotiationAdviceRequest;
import com.tablehub.gameservice.games.standalone.service.StandaloneGameService;
import com.tablehub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 单机对局 HTTP 接口
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    private final StandaloneGameService gameService;
    private final NegotiationAdviceService adviceService;

    @PostMapping
    public ApiResponse<CreateGameResponse> create(@RequestBody(required = false) CreateGameRequest req) {
        String gameId = gameService.createGame(req == null ? null : req.getPlayers());
        return ApiResponse.success(new CreateGameResponse(gameId));
    }

    @GetMapping
    public ApiResponse<List<GameSummaryView>> list() {
        return ApiResponse.success(gameService.listGames());
    }

    /**
     * 读取快照：states/latest 或 states/{n}
     */
    @GetMapping("/{gameId}/states/{state}")
    public ApiResponse<SnapshotView> state(@PathVariable String gameId, @PathVariable String state) {
        return ApiResponse.success(SnapshotView.of(gameService.getGame(gameId, VersionParam.parse(state))));
    }

    @DeleteMapping("/{gameId}")
    public ApiResponse<DeleteGameResponse> delete(@PathVariable String gameId) {
        gameService.deleteGame(gameId);
        return ApiResponse.success(new DeleteGameResponse(true, gameId));
    }

    @GetMapping("/{gameId}/events")
    public ApiResponse<List<GameEventView>> events(@PathVariable String gameId,
                                                   @RequestParam(name = "eventType", required = false) String eventType) {
        return ApiResponse.success(gameService.listEvents(gameId, eventType));
    }

    /**
     * 推进对局（请求体可省略）
     */
    @PostMapping("/{gameId}/actions")
    public ApiResponse<SnapshotView> act(@PathVariable String gameId,
                                         @RequestBody(required = false) ActRequest req) {
        return ApiResponse.success(SnapshotView.of(gameService.act(gameId, req == null ? null : req.getAction())));
    }

    /**
     * 针对某一版本请求协商建议；建议服务不可用时 503
     */
    @PostMapping("/{gameId}/states/{state}/negotiation-advice")
    public ApiResponse<AdviceResult> negotiationAdvice(@PathVariable String gameId, @PathVariable String state,
                                                       @RequestBody(required = false) NegotiationAdviceRequest req) {
        return ApiResponse.success(adviceService.advise(gameId, VersionParam.parse(state),
                req == null ? null : req.getRequesterColor(),
                req == null ? null : req.getBoardImage()));
    }
}
