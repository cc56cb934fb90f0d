package com.tablehub.gameservice.common;

import com.tablehub.gameservice.common.error.AdvisorUnavailableException;
import com.tablehub.gameservice.common.error.ForbiddenException;
import com.tablehub.gameservice.common.error.InternalException;
import com.tablehub.gameservice.common.error.NotFoundException;
import com.tablehub.gameservice.common.error.TokenException;
import com.tablehub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 * <p>
 * 错误分类与状态码：
 * ValidationException / IllegalArgumentException -> 400，
 * TokenException -> 401，ForbiddenException -> 403，NotFoundException -> 404，
 * ConflictException / IllegalStateException -> 409，InternalException -> 500，
 * AdvisorUnavailableException -> 503。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 参数不合法 / 动作不合法（含 ValidationException）。
     * @return HTTP 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /** @return HTTP 401 */
    @ExceptionHandler(TokenException.class)
    public ResponseEntity<ApiResponse<Object>> unauthorized(TokenException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ApiResponse.unauthorized(e.getMessage()));
    }

    /** @return HTTP 403 */
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ApiResponse<Object>> forbidden(ForbiddenException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ApiResponse.forbidden(e.getMessage()));
    }

    /** @return HTTP 404 */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> notFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    /**
     * 业务状态冲突（含 ConflictException：版本过期、并发追加）。
     * @return HTTP 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 存储 / 引擎故障：记录完整堆栈，对外只给摘要。
     * @return HTTP 500
     */
    @ExceptionHandler(InternalException.class)
    public ResponseEntity<ApiResponse<Object>> internal(InternalException e) {
        log.error("服务内部错误: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError(e.getMessage()));
    }

    /**
     * 外部建议服务不可用。
     * @return HTTP 503
     */
    @ExceptionHandler(AdvisorUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> unavailable(AdvisorUnavailableException e) {
        log.warn("协商建议服务不可用: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.unavailable(e.getMessage()));
    }
}
