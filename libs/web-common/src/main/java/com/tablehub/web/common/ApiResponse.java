package com.tablehub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应外壳：code / message / data。
 * <p>
 * code 与 HTTP 状态码保持一致：
 * 200 成功；400 参数或动作非法；401 令牌缺失/无效；403 无权操作；
 * 404 资源不存在；409 版本冲突；500 存储或引擎故障；503 外部建议服务不可用。
 *
 * @param <T> data 类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;

    /** 成功（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /** 成功（自定义提示 + 数据） */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    /** 通用失败 */
    public static <T> ApiResponse<T> fail(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return fail(400, message);
    }

    public static <T> ApiResponse<T> unauthorized(String message) {
        return fail(401, message);
    }

    public static <T> ApiResponse<T> forbidden(String message) {
        return fail(403, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return fail(404, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return fail(409, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return fail(500, message);
    }

    public static <T> ApiResponse<T> unavailable(String message) {
        return fail(503, message);
    }

    /** 便于调用方（测试/网关）判断是否成功 */
    public boolean isSuccess() {
        return code == OK;
    }
}
