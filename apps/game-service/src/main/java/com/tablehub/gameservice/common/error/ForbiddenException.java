package com.tablehub.gameservice.common.error;

/**
 * 身份有效但无权执行：观战者操作、非当前行动方、非房主、令牌不属于该房间（HTTP 403）。
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
