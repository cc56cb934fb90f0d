package com.tablehub.gameservice.infrastructure.jpa;

import com.tablehub.gameservice.application.state.GameEventView;
import com.tablehub.gameservice.application.state.GameSummaryView;
import com.tablehub.gameservice.application.state.Snapshot;
import com.tablehub.gameservice.application.state.StateStore;
import com.tablehub.gameservice.common.error.ConflictException;
import com.tablehub.gameservice.common.error.InternalException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.engine.core.MatchState;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.infrastructure.jpa.entity.GameEventEntity;
import com.tablehub.gameservice.infrastructure.jpa.entity.GameSnapshotEntity;
import com.tablehub.gameservice.infrastructure.jpa.entity.GameSummaryEntity;
import com.tablehub.gameservice.infrastructure.jpa.repository.GameEventRepository;
import com.tablehub.gameservice.infrastructure.jpa.repository.GameSnapshotRepository;
import com.tablehub.gameservice.infrastructure.jpa.repository.GameSummaryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Spring Data JPA 的状态版本库。
 * <p>
 * 追加：读摘要得到下一版本 -> 插入快照 -> 更新摘要，同一事务；
 * (game_id, version) 唯一约束兜底并发写入，违反时抛 {@link ConflictException}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaStateStore implements StateStore {

    private final GameSnapshotRepository snapshotRepo;
    private final GameSummaryRepository summaryRepo;
    private final GameEventRepository eventRepo;
    private final StateCodec codec;

    @Override
    @Transactional
    public Snapshot append(String gameId, MatchState state, String displayProjection) {
        try {
            GameSummaryEntity summary = summaryRepo.findByGameId(gameId).orElse(null);
            int version = summary == null ? 0 : summary.getLatestVersion() + 1;

            GameSnapshotEntity saved = snapshotRepo.saveAndFlush(GameSnapshotEntity.builder()
                    .gameId(gameId)
                    .version(version)
                    .stateBlob(codec.encode(state))
                    .displayProjection(displayProjection)
                    .build());

            if (summary == null) {
                summary = GameSummaryEntity.builder()
                        .gameId(gameId)
                        .seatColors(state.colors().stream().map(SeatColor::name).toList())
                        .build();
            }
            summary.setLatestVersion(version);
            summary.setCurrentColor(state.currentActor().name());
            summary.setWinner(state.getWinner() == null ? null : state.getWinner().name());
            summaryRepo.saveAndFlush(summary);

            log.debug("快照已追加: gameId={}, version={}", gameId, version);
            return new Snapshot(gameId, version, state, displayProjection, saved.getCreatedAt());
        } catch (DataIntegrityViolationException e) {
            log.warn("快照版本冲突: gameId={}", gameId);
            throw new ConflictException("对局状态已被并发修改，请刷新后重试", e);
        } catch (DataAccessException e) {
            throw new InternalException("快照写入失败: gameId=" + gameId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Snapshot get(String gameId, Integer version) {
        int v;
        if (version == null) {
            v = summaryRepo.findByGameId(gameId)
                    .orElseThrow(() -> new NotFoundException("对局不存在: " + gameId))
                    .getLatestVersion();
        } else {
            v = version;
        }
        GameSnapshotEntity e = snapshotRepo.findByGameIdAndVersion(gameId, v)
                .orElseThrow(() -> new NotFoundException("快照不存在: gameId=" + gameId + ", version=" + v));
        return new Snapshot(e.getGameId(), e.getVersion(), codec.decode(e.getStateBlob()),
                e.getDisplayProjection(), e.getCreatedAt());
    }

    @Override
    @Transactional(readOnly = true)
    public GameSummaryView getSummary(String gameId) {
        return summaryRepo.findByGameId(gameId)
                .map(JpaStateStore::toView)
                .orElseThrow(() -> new NotFoundException("对局不存在: " + gameId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<GameSummaryView> listSummaries(int limit) {
        return summaryRepo.findRecent(PageRequest.of(0, Math.max(1, limit))).stream()
                .map(JpaStateStore::toView)
                .toList();
    }

    @Override
    @Transactional
    public int deleteGame(String gameId) {
        try {
            int removed = eventRepo.deleteByGameId(gameId)
                    + snapshotRepo.deleteByGameId(gameId)
                    + summaryRepo.deleteByGameId(gameId);
            if (removed > 0) {
                log.info("对局已删除: gameId={}, rows={}", gameId, removed);
            }
            return removed;
        } catch (DataAccessException e) {
            throw new InternalException("删除对局失败: gameId=" + gameId, e);
        }
    }

    @Override
    @Transactional
    public void logEvent(String gameId, Integer version, String eventType, Map<String, Object> payload) {
        try {
            eventRepo.save(GameEventEntity.builder()
                    .gameId(gameId)
                    .version(version)
                    .eventType(eventType)
                    .payload(payload == null ? new HashMap<>() : new HashMap<>(payload))
                    .build());
        } catch (DataAccessException e) {
            throw new InternalException("事件写入失败: gameId=" + gameId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<GameEventView> listEvents(String gameId, String eventType) {
        List<GameEventEntity> rows = StringUtils.hasText(eventType)
                ? eventRepo.findByGameIdAndEventTypeOrderByIdAsc(gameId, eventType)
                : eventRepo.findByGameIdOrderByIdAsc(gameId);
        return rows.stream()
                .map(e -> new GameEventView(e.getId(), e.getGameId(), e.getVersion(), e.getEventType(),
                        e.getPayload(), e.getCreatedAt()))
                .toList();
    }

    private static GameSummaryView toView(GameSummaryEntity e) {
        return new GameSummaryView(e.getGameId(), e.getLatestVersion(), List.copyOf(e.getSeatColors()),
                e.getCurrentColor(), e.getWinner(), e.getCreatedAt(), e.getUpdatedAt());
    }
}
