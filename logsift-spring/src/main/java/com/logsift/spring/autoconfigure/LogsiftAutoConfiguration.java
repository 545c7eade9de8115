package com.logsift.spring.autoconfigure;

import com.logsift.core.pattern.PatternNormalizer;
import com.logsift.core.sampling.Sampler;
import com.logsift.core.time.TimeExpressionParser;
import com.logsift.spring.search.LogSearchPlanner;
import com.logsift.spring.search.SearchWindowResolver;
import com.logsift.spring.search.TraceSearchPlanner;
import java.time.Clock;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(LogsiftProperties.class)
@ConditionalOnProperty(prefix = "logsift", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LogsiftAutoConfiguration {

    /** Local-zone clock: "today" and "3d@11:45" are resolved in the zone of the running process. */
    @Bean
    @ConditionalOnMissingBean
    public Clock logsiftClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeExpressionParser timeExpressionParser(Clock clock) {
        return new TimeExpressionParser(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternNormalizer patternNormalizer(LogsiftProperties properties) {
        return PatternNormalizer.withMaxLength(properties.getPattern().getMaxLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public Sampler sampler(PatternNormalizer patternNormalizer) {
        return new Sampler(patternNormalizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchWindowResolver searchWindowResolver(TimeExpressionParser parser, LogsiftProperties properties) {
        return new SearchWindowResolver(parser, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public LogSearchPlanner logSearchPlanner(
            SearchWindowResolver windowResolver, Sampler sampler, LogsiftProperties properties) {
        return new LogSearchPlanner(windowResolver, sampler, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceSearchPlanner traceSearchPlanner(SearchWindowResolver windowResolver, LogsiftProperties properties) {
        return new TraceSearchPlanner(windowResolver, properties);
    }
}
