package com.tablehub.gameservice.application.advice;

/**
 * 协商建议提供方（外部服务）。
 * 实现方在不可用时抛 AdvisorUnavailableException，其余故障抛 InternalException。
 */
public interface AdvisorPort {

    AdviceResult advise(AdviceRequest request);
}
