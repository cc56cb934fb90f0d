package com.tablehub.gameservice.common.error;

/**
 * 输入格式错误或动作不合法（HTTP 400）。
 * 继承 IllegalArgumentException，沿用“参数非法 = 400”的全局映射。
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
