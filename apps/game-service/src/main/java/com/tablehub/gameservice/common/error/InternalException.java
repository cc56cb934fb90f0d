package com.tablehub.gameservice.common.error;

/**
 * 存储或规则引擎 / 决策器故障（HTTP 500）。
 */
public class InternalException extends RuntimeException {

    public InternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
