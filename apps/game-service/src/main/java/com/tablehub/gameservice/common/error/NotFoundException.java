package com.tablehub.gameservice.common.error;

/**
 * 房间 / 对局 / 版本不存在（HTTP 404）。
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
