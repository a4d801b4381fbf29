package review;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewResult;
import model.SourceFile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Точка входа для асинхронного ревью.
 *
 * <p>{@link #submit} проверяет пакет, регистрирует сессию, передает {@link ReviewJobRunner}
 * в ограниченный пул обработчиков и сразу возвращает id сессии. Клиент опрашивает
 * {@link #getStatus} и после завершения получает результат через {@link #getResult}.
 * Планировщик следит за таймаутом сессий и удаляет завершенные сессии по истечении TTL.
 *
 * <p>Пример:
 * <pre>
 * try (ReviewEngine engine = new ReviewEngine(new RuleBasedCodeAnalyzer(), EngineConfig.defaults())) {
 *     String id = engine.submit(batch, ReviewConfig.empty());
 *     while (!engine.getStatus(id).isTerminal()) {
 *         Thread.sleep(100);
 *     }
 *     ReviewResult result = engine.getResult(id);
 * }
 * </pre>
 */
public final class ReviewEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ReviewEngine.class.getName());

    static final String CANCELLED_MESSAGE = "Review cancelled by request";

    private final CodeAnalyzer analyzer;
    private final EngineConfig config;
    private final SessionStore sessionStore;
    private final ResultStore resultStore;
    private final Clock clock;

    private final ThreadPoolExecutor workers;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Map<String, ReviewJobRunner> runners = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    public ReviewEngine(CodeAnalyzer analyzer, EngineConfig config) {
        this(analyzer, config, new SessionStore(), new ResultStore(), Clock.systemUTC());
    }

    public ReviewEngine(CodeAnalyzer analyzer, EngineConfig config,
                        SessionStore sessionStore, ResultStore resultStore, Clock clock) {
        this.analyzer = Objects.requireNonNull(analyzer, "Analyzer cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.sessionStore = Objects.requireNonNull(sessionStore, "Session store cannot be null");
        this.resultStore = Objects.requireNonNull(resultStore, "Result store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");

        BlockingQueue<Runnable> queue = config.getQueueCapacity() > 0
            ? new ArrayBlockingQueue<>(config.getQueueCapacity())
            : new SynchronousQueue<>();
        this.workers = new ThreadPoolExecutor(
            config.getMaxConcurrentReviews(), config.getMaxConcurrentReviews(),
            0L, TimeUnit.MILLISECONDS, queue,
            namedThreadFactory("review-worker"),
            new ThreadPoolExecutor.AbortPolicy());

        this.scheduler = new ScheduledThreadPoolExecutor(1, namedThreadFactory("review-scheduler"));
        this.scheduler.setRemoveOnCancelPolicy(true);

        Duration ttl = config.getSessionTtl();
        if (!ttl.isZero()) {
            long interval = config.getEvictionInterval().toMillis();
            scheduler.scheduleWithFixedDelay(this::evictSafely, interval, interval, TimeUnit.MILLISECONDS);
        }

        logger.info("Review engine started: analyzer=" + analyzer.getName() + ", " + config);
    }

    /**
     * Регистрирует слушателя, получающего снимок сессии после каждого изменения состояния.
     */
    public void addListener(SessionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Запускает ревью пакета в фоне.
     *
     * @return id новой сессии
     * @throws InputRejectedException если пакет пуст или превышает ограничения
     * @throws CapacityExceededException если все обработчики заняты и очередь заполнена
     */
    public String submit(ReviewBatch batch, ReviewConfig reviewConfig) {
        validate(batch);

        ReviewSession session = new ReviewSession(reviewConfig, batch.size(), clock);
        String sessionId = session.getId();

        ReviewJobRunner runner = new ReviewJobRunner(session, batch, analyzer, resultStore, clock,
            this::publish, () -> finished(sessionId));

        sessionStore.put(sessionId, session);
        runners.put(sessionId, runner);
        try {
            workers.execute(runner);
        } catch (RejectedExecutionException e) {
            runners.remove(sessionId);
            sessionStore.remove(sessionId);
            logger.warning("Review rejected, engine at capacity: files=" + batch.size());
            throw new CapacityExceededException(config.getMaxConcurrentReviews(), config.getQueueCapacity());
        }

        scheduleTimeout(session);

        logger.info("Review submitted: session=" + sessionId + ", files=" + batch.size());
        return sessionId;
    }

    private void validate(ReviewBatch batch) {
        if (batch == null || batch.isEmpty()) {
            throw new InputRejectedException("No files provided");
        }
        if (batch.size() > config.getMaxFiles()) {
            throw new InputRejectedException(String.format("Too many files: %d (max %d)",
                batch.size(), config.getMaxFiles()));
        }
        for (SourceFile file : batch) {
            if (file.getSizeBytes() > config.getMaxFileSize()) {
                throw new InputRejectedException(String.format("File %s is too large: %d bytes (max %d)",
                    file.getPath(), file.getSizeBytes(), config.getMaxFileSize()));
            }
        }
    }

    private void scheduleTimeout(ReviewSession session) {
        Duration timeout = config.getAnalysisTimeout();
        if (timeout.isZero()) {
            return;
        }
        String sessionId = session.getId();
        try {
            ScheduledFuture<?> future = scheduler.schedule(
                () -> terminate(sessionId, "Review timed out after " + formatDuration(timeout)),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
            timeouts.put(sessionId, future);
            if (session.isTerminal()) {
                cancelTimeout(sessionId);
            }
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Timeout not scheduled for session " + sessionId, e);
        }
    }

    /**
     * @throws SessionNotFoundException если id неизвестен
     */
    public SessionSnapshot getStatus(String sessionId) {
        return sessionStore.get(sessionId).snapshot();
    }

    /**
     * Результат завершенной сессии.
     *
     * @throws SessionNotFoundException если id неизвестен или сессия еще не завершена
     */
    public ReviewResult getResult(String sessionId) {
        ReviewSession session = sessionStore.get(sessionId);
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new SessionNotFoundException(sessionId, "Results not found for session: " + sessionId);
        }
        return resultStore.get(sessionId);
    }

    /**
     * Отменяет незавершенную сессию.
     *
     * @return false если сессия уже завершена
     * @throws SessionNotFoundException если id неизвестен
     */
    public boolean cancel(String sessionId) {
        sessionStore.get(sessionId);
        return terminate(sessionId, CANCELLED_MESSAGE);
    }

    private boolean terminate(String sessionId, String reason) {
        ReviewSession session = sessionStore.find(sessionId).orElse(null);
        if (session == null || !session.fail(reason)) {
            return false;
        }
        logger.warning("Review terminated: session=" + sessionId + ": " + reason);
        ReviewJobRunner runner = runners.get(sessionId);
        if (runner != null) {
            runner.interrupt();
        }
        cancelTimeout(sessionId);
        publish(session.snapshot());
        return true;
    }

    private void finished(String sessionId) {
        runners.remove(sessionId);
        cancelTimeout(sessionId);
    }

    private void cancelTimeout(String sessionId) {
        ScheduledFuture<?> future = timeouts.remove(sessionId);
        if (future != null) {
            future.cancel(false);
        }
    }

    /**
     * Удаляет завершенные сессии с истекшим TTL вместе с их результатами.
     *
     * @return число удаленных сессий
     */
    public int evictExpiredSessions() {
        Duration ttl = config.getSessionTtl();
        if (ttl.isZero()) {
            return 0;
        }
        Instant now = clock.instant();
        int evicted = 0;
        for (ReviewSession session : sessionStore.values()) {
            Instant completedAt = session.getCompletedAt();
            if (session.isTerminal() && completedAt != null && !completedAt.plus(ttl).isAfter(now)) {
                sessionStore.remove(session.getId());
                resultStore.remove(session.getId());
                evicted++;
            }
        }
        if (evicted > 0) {
            logger.info("Evicted " + evicted + " expired session(s)");
        }
        return evicted;
    }

    private void evictSafely() {
        try {
            evictExpiredSessions();
        } catch (RuntimeException e) {
            // исключение отменило бы периодическую задачу
            logger.log(Level.SEVERE, "Session eviction failed", e);
        }
    }

    private void publish(SessionSnapshot snapshot) {
        for (SessionListener listener : listeners) {
            try {
                listener.onSessionUpdate(snapshot);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Session listener failed for session " + snapshot.sessionId(), e);
            }
        }
    }

    /**
     * Число незавершенных сессий.
     */
    public int activeSessionCount() {
        return (int) sessionStore.values().stream().filter(s -> !s.isTerminal()).count();
    }

    public int sessionCount() {
        return sessionStore.size();
    }

    public String getAnalyzerName() {
        return analyzer.getName();
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Прекращает прием ревью и ждет выполняющиеся до 60 секунд.
     */
    @Override
    public void close() {
        logger.info("Shutting down review engine...");
        workers.shutdown();
        scheduler.shutdown();
        try {
            if (!workers.awaitTermination(60, TimeUnit.SECONDS)) {
                workers.shutdownNow();
                if (!workers.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.severe("Review workers did not terminate");
                }
            }
            scheduler.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Review engine shutdown complete");
    }

    private static String formatDuration(Duration duration) {
        if (duration.toMillis() % 1000 != 0) {
            return duration.toMillis() + " ms";
        }
        return duration.getSeconds() + " seconds";
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
