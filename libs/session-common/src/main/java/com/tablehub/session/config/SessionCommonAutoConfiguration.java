package com.tablehub.session.config;

import com.tablehub.session.SessionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * session-common 自动配置入口。
 *
 * 引入本模块即获得一个进程级 {@link SessionRegistry} Bean，
 * 生命周期跟随 ApplicationContext；业务侧可自行声明同类型 Bean 覆盖。
 */
@AutoConfiguration
public class SessionCommonAutoConfiguration {

    /**
     * 会话注册表。
     *
     * @param tokenBytes 令牌随机字节数（tablehub.session.token-bytes，默认 18）
     */
    @Bean
    @ConditionalOnMissingBean
    public SessionRegistry sessionRegistry(
            @Value("${tablehub.session.token-bytes:" + SessionRegistry.DEFAULT_TOKEN_BYTES + "}") int tokenBytes) {
        return new SessionRegistry(tokenBytes);
    }
}
