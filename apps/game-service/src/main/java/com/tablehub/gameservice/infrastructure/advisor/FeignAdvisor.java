package com.tablehub.gameservice.infrastructure.advisor;

import com.tablehub.gameservice.application.advice.AdviceRequest;
import com.tablehub.gameservice.application.advice.AdviceResult;
import com.tablehub.gameservice.application.advice.AdvisorPort;
import com.tablehub.gameservice.common.error.AdvisorUnavailableException;
import com.tablehub.gameservice.common.error.InternalException;
import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

/**
 * 基于 Feign 的建议服务适配。
 * 连接失败 / 超时 / 502 / 503 / 504 视为不可用（503），其余错误视为内部故障（500）。
 */
@Slf4j
@RequiredArgsConstructor
public class FeignAdvisor implements AdvisorPort {

    private static final Set<Integer> UNAVAILABLE_STATUS = Set.of(502, 503, 504);

    private final NegotiationAdvisorClient client;

    @Override
    public AdviceResult advise(AdviceRequest request) {
        AdviceResult result;
        try {
            result = client.advise(request);
        } catch (RetryableException e) {
            log.warn("建议服务连接失败: gameId={}, err={}", request.gameId(), e.getMessage());
            throw new AdvisorUnavailableException("协商建议服务暂不可用", e);
        } catch (FeignException e) {
            if (e.status() < 0 || UNAVAILABLE_STATUS.contains(e.status())) {
                log.warn("建议服务不可用: gameId={}, status={}", request.gameId(), e.status());
                throw new AdvisorUnavailableException("协商建议服务暂不可用", e);
            }
            throw new InternalException("协商建议服务调用失败: status=" + e.status(), e);
        }
        if (result == null || result.advice() == null) {
            throw new InternalException("协商建议服务返回空结果", null);
        }
        return result;
    }
}
