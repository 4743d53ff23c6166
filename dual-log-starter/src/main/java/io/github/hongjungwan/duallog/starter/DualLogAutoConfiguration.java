package io.github.hongjungwan.duallog.starter;

import io.github.hongjungwan.duallog.api.LogPipeline;
import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.api.redaction.RedactionRule;
import io.github.hongjungwan.duallog.core.internal.DefaultLogPipeline;
import io.github.hongjungwan.duallog.core.internal.LogDoctor;
import io.github.hongjungwan.duallog.core.internal.Slf4jConsoleSink;
import io.github.hongjungwan.duallog.spi.ConsoleSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * DualLog Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(DualLogProperties.class)
@ConditionalOnProperty(prefix = "dual-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DualLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DualLogConfig dualLogConfig(DualLogProperties properties) {
        DualLogConfig.DualLogConfigBuilder builder = DualLogConfig.builder()
                .logDirectory(properties.getDirectory())
                .baseFileName(properties.getBaseFileName())
                .fileExtension(properties.getFileExtension())
                .minimumLevel(properties.getMinimumLevel())
                .maxFileSizeBytes(properties.getMaxFileSize().toBytes())
                .maxArchiveFiles(properties.getMaxArchiveFiles())
                .bufferSizeThreshold(properties.getBufferSize())
                .maxFlushInterval(properties.getFlushInterval())
                .queueCapacity(properties.getQueueCapacity())
                .stackTraceMaxFrames(properties.getStackTraceMaxFrames())
                .consoleEnabled(properties.getConsole().isEnabled())
                .consoleQueueCapacity(properties.getConsole().getQueueCapacity())
                .redactionEnabled(properties.getRedaction().isEnabled())
                .additionalRedactionRules(toRules(properties.getRedaction().getRules()))
                .operationTimeout(properties.getOperationTimeout());
        if (StringUtils.hasText(properties.getZoneId())) {
            builder.zoneId(ZoneId.of(properties.getZoneId()));
        }
        return builder.build().validate();
    }

    private static List<RedactionRule> toRules(List<DualLogProperties.RuleProperties> rules) {
        return rules.stream()
                .map(rule -> rule.isCaseInsensitive()
                        ? RedactionRule.caseInsensitive(rule.getName(), rule.getPattern(), rule.getReplacement())
                        : RedactionRule.of(rule.getName(), rule.getPattern(), rule.getReplacement()))
                .toList();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsoleSink dualLogConsoleSink() {
        return new Slf4jConsoleSink();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public LogPipeline logPipeline(DualLogConfig config, ConsoleSink consoleSink) {
        return new DefaultLogPipeline(config, consoleSink, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public LogDoctor logDoctor(DualLogConfig config) {
        return new LogDoctor(config);
    }

    @Bean
    public DualLogLifecycle dualLogLifecycle(LogDoctor doctor, LogPipeline pipeline) {
        return new DualLogLifecycle(doctor, pipeline);
    }

    /**
     * 파이프라인 시작 및 종료 시 flush 를 관리하는 SmartLifecycle 구현체.
     */
    static class DualLogLifecycle implements SmartLifecycle {

        private final LogDoctor doctor;
        private final LogPipeline pipeline;
        private volatile boolean running = false;

        DualLogLifecycle(LogDoctor doctor, LogPipeline pipeline) {
            this.doctor = doctor;
            this.pipeline = pipeline;
        }

        @Override
        public void start() {
            log.info("Starting DualLog pipeline...");

            LogDoctor.DiagnosticReport report = doctor.diagnose();
            if (report.hasFailures()) {
                log.warn("Diagnostic failures detected - persisted log lines may be lost");
            }

            pipeline.start();

            running = true;
            log.info("DualLog pipeline started. Writing to {}", pipeline.getLogFileLocation());
        }

        @Override
        public void stop() {
            log.info("Stopping DualLog pipeline...");

            pipeline.forceFlush();

            running = false;
            log.info("DualLog pipeline stopped");
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
