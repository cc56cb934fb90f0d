package com.tablehub.gameservice.infrastructure.advisor;

import com.tablehub.gameservice.application.advice.AdviceRequest;
import com.tablehub.gameservice.application.advice.AdviceResult;
import com.tablehub.gameservice.application.advice.AdvisorPort;
import com.tablehub.gameservice.common.error.AdvisorUnavailableException;

/**
 * 未配置 tablehub.advisor.url 时的占位实现：一律 503。
 */
public class UnconfiguredAdvisor implements AdvisorPort {

    @Override
    public AdviceResult advise(AdviceRequest request) {
        throw new AdvisorUnavailableException("未配置协商建议服务（tablehub.advisor.url）");
    }
}
