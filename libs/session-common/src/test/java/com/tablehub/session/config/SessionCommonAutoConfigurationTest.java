package com.tablehub.session.config;

import com.tablehub.session.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class SessionCommonAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SessionCommonAutoConfiguration.class));

    @Test
    void registersRegistryByDefault() {
        runner.run(ctx -> assertThat(ctx).hasSingleBean(SessionRegistry.class));
    }

    @Test
    void backsOffWhenApplicationDeclaresItsOwn() {
        SessionRegistry custom = new SessionRegistry(32);
        runner.withBean(SessionRegistry.class, () -> custom)
                .run(ctx -> assertThat(ctx.getBean(SessionRegistry.class)).isSameAs(custom));
    }

    @Test
    void weakTokenSizeFailsStartup() {
        runner.withPropertyValues("tablehub.session.token-bytes=4")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
