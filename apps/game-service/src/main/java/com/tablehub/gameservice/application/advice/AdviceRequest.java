package com.tablehub.gameservice.application.advice;

import java.util.List;

/**
 * 发给建议服务的上下文。
 *
 * @param game       该版本快照的客户端投影（JSON 文本）
 * @param boardImage 客户端截取的棋盘图片（data URL），可为 null
 */
public record AdviceRequest(String gameId,
                            int version,
                            String requesterColor,
                            List<String> humanColors,
                            String currentColor,
                            String game,
                            String boardImage) {
}
