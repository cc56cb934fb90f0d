package com.tablehub.gameservice.common.error;

/**
 * 乐观并发冲突：客户端持有的版本已过期，或并发追加撞上同一版本号（HTTP 409）。
 * 继承 IllegalStateException，沿用“状态冲突 = 409”的全局映射。
 */
public class ConflictException extends IllegalStateException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
