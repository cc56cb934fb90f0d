package com.tablehub.gameservice.common.error;

/**
 * 房间令牌缺失或无效（HTTP 401）。
 */
public class TokenException extends RuntimeException {

    public TokenException(String message) {
        super(message);
    }
}
