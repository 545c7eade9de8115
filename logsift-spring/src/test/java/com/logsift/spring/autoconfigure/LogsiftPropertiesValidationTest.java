package com.logsift.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.logsift.core.time.TimeExpressionParser;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;

class LogsiftPropertiesValidationTest {

    @Configuration
    @ImportAutoConfiguration(LogsiftAutoConfiguration.class)
    static class HostConfig {}

    @Test
    void rejectsNonPositiveMinimumSpan() {
        assertThatThrownBy(() -> start("logsift.time.min-span-seconds=0").close())
                .hasRootCauseInstanceOf(BindValidationException.class);
    }

    @Test
    void rejectsZeroOverFetchFactor() {
        assertThatThrownBy(() -> start("logsift.sampling.over-fetch-factor=0").close())
                .hasRootCauseInstanceOf(BindValidationException.class);
    }

    @Test
    void canBeSwitchedOff() {
        try (ConfigurableApplicationContext context = start("logsift.enabled=false")) {
            assertThat(context.getBeansOfType(TimeExpressionParser.class)).isEmpty();
        }
    }

    private static ConfigurableApplicationContext start(String property) {
        return new SpringApplicationBuilder(HostConfig.class)
                .web(WebApplicationType.NONE)
                .properties(property)
                .run();
    }
}
