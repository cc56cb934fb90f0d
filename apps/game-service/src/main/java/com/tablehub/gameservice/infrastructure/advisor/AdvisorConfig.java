package com.tablehub.gameservice.infrastructure.advisor;

import com.tablehub.gameservice.application.advice.AdvisorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 建议服务装配：tablehub.advisor.url 非空则注册 Feign Client 并走远程调用，否则退化为 503 占位实现。
 */
@Slf4j
@Configuration
public class AdvisorConfig {

    @Configuration
    @ConditionalOnExpression("!'${tablehub.advisor.url:}'.isBlank()")
    @EnableFeignClients(clients = NegotiationAdvisorClient.class)
    static class RemoteAdvisorClients {
    }

    @Bean
    public AdvisorPort advisorPort(ObjectProvider<NegotiationAdvisorClient> client) {
        NegotiationAdvisorClient remote = client.getIfAvailable();
        if (remote == null) {
            log.info("未配置协商建议服务，建议接口将返回 503");
            return new UnconfiguredAdvisor();
        }
        return new FeignAdvisor(remote);
    }
}
