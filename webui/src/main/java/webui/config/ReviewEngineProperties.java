package webui.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import review.EngineConfig;

import java.time.Duration;

/**
 * Настройки движка ревью из {@code application.properties} (префикс {@code review.engine}).
 * Незаданные значения берутся из {@link EngineConfig}.
 */
@ConfigurationProperties("review.engine")
public record ReviewEngineProperties(
    Integer maxConcurrentReviews,
    Integer queueCapacity,
    Duration analysisTimeout,
    Duration sessionTtl,
    Duration evictionInterval,
    Integer maxFiles,
    DataSize maxFileSize
) {

    public EngineConfig toEngineConfig() {
        EngineConfig.Builder builder = EngineConfig.builder();
        if (maxConcurrentReviews != null) {
            builder.maxConcurrentReviews(maxConcurrentReviews);
        }
        if (queueCapacity != null) {
            builder.queueCapacity(queueCapacity);
        }
        if (analysisTimeout != null) {
            builder.analysisTimeout(analysisTimeout);
        }
        if (sessionTtl != null) {
            builder.sessionTtl(sessionTtl);
        }
        if (evictionInterval != null) {
            builder.evictionInterval(evictionInterval);
        }
        if (maxFiles != null) {
            builder.maxFiles(maxFiles);
        }
        if (maxFileSize != null) {
            builder.maxFileSize(maxFileSize.toBytes());
        }
        return builder.build();
    }
}
