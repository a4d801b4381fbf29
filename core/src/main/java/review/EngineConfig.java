package review;

import java.time.Duration;
import java.util.Objects;

/**
 * Ограничения и таймауты {@link ReviewEngine}.
 */
public final class EngineConfig {
    public static final int DEFAULT_MAX_CONCURRENT_REVIEWS = 5;
    public static final int DEFAULT_QUEUE_CAPACITY = 50;
    public static final Duration DEFAULT_ANALYSIS_TIMEOUT = Duration.ofMinutes(10);
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_EVICTION_INTERVAL = Duration.ofMinutes(1);
    public static final int DEFAULT_MAX_FILES = 50;
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    private final int maxConcurrentReviews;
    private final int queueCapacity;
    private final Duration analysisTimeout;
    private final Duration sessionTtl;
    private final Duration evictionInterval;
    private final int maxFiles;
    private final long maxFileSize;

    private EngineConfig(Builder builder) {
        if (builder.maxConcurrentReviews < 1) {
            throw new IllegalArgumentException("maxConcurrentReviews must be >= 1");
        }
        if (builder.queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity must be >= 0");
        }
        if (builder.maxFiles < 1) {
            throw new IllegalArgumentException("maxFiles must be >= 1");
        }
        if (builder.maxFileSize < 1) {
            throw new IllegalArgumentException("maxFileSize must be >= 1");
        }
        this.maxConcurrentReviews = builder.maxConcurrentReviews;
        this.queueCapacity = builder.queueCapacity;
        this.analysisTimeout = requireNonNegative(builder.analysisTimeout, "analysisTimeout");
        this.sessionTtl = requireNonNegative(builder.sessionTtl, "sessionTtl");
        this.evictionInterval = Objects.requireNonNull(builder.evictionInterval, "evictionInterval cannot be null");
        if (evictionInterval.isNegative() || evictionInterval.isZero()) {
            throw new IllegalArgumentException("evictionInterval must be positive");
        }
        this.maxFiles = builder.maxFiles;
        this.maxFileSize = builder.maxFileSize;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " cannot be negative");
        }
        return value;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxConcurrentReviews() {
        return maxConcurrentReviews;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    /**
     * Ноль отключает таймаут.
     */
    public Duration getAnalysisTimeout() {
        return analysisTimeout;
    }

    /**
     * Время хранения завершенных сессий. Ноль отключает удаление.
     */
    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public Duration getEvictionInterval() {
        return evictionInterval;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "maxConcurrentReviews=" + maxConcurrentReviews +
                ", queueCapacity=" + queueCapacity +
                ", analysisTimeout=" + analysisTimeout +
                ", sessionTtl=" + sessionTtl +
                ", maxFiles=" + maxFiles +
                ", maxFileSize=" + maxFileSize +
                '}';
    }

    public static final class Builder {
        private int maxConcurrentReviews = DEFAULT_MAX_CONCURRENT_REVIEWS;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private Duration analysisTimeout = DEFAULT_ANALYSIS_TIMEOUT;
        private Duration sessionTtl = DEFAULT_SESSION_TTL;
        private Duration evictionInterval = DEFAULT_EVICTION_INTERVAL;
        private int maxFiles = DEFAULT_MAX_FILES;
        private long maxFileSize = DEFAULT_MAX_FILE_SIZE;

        private Builder() {
        }

        public Builder maxConcurrentReviews(int maxConcurrentReviews) {
            this.maxConcurrentReviews = maxConcurrentReviews;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder analysisTimeout(Duration analysisTimeout) {
            this.analysisTimeout = analysisTimeout;
            return this;
        }

        public Builder sessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
            return this;
        }

        public Builder evictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
            return this;
        }

        public Builder maxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder maxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
