package com.tablehub.gameservice.infrastructure.advisor;

import com.tablehub.gameservice.application.advice.AdviceRequest;
import com.tablehub.gameservice.application.advice.AdviceResult;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 调用外部协商建议服务。
 * 仅在配置了 tablehub.advisor.url 时注册（见 AdvisorConfig）。
 */
@FeignClient(name = "negotiation-advisor", url = "${tablehub.advisor.url}")
public interface NegotiationAdvisorClient {

    @PostMapping("/advice")
    AdviceResult advise(@RequestBody AdviceRequest request);
}
