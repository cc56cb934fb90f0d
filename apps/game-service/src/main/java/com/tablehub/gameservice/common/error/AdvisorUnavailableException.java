package com.tablehub.gameservice.common.error;

/**
 * 外部协商建议服务不可用：未配置、连接失败或对端 5xx 网关类错误（HTTP 503）。
 */
public class AdvisorUnavailableException extends RuntimeException {

    public AdvisorUnavailableException(String message) {
        super(message);
    }

    public AdvisorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
