package review;

import model.ReviewBatch;
import model.ReviewResult;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Проводит одну сессию через initializing → running → completed | failed.
 *
 * <p>Прогресс фазы {@code i} из {@code n} (с единицы) записывается только после выполнения
 * фазы как {@code round(i * 100 / n)}; первая запись переводит сессию в running.
 * Результат сохраняется и сессия завершается в одной критической секции сессии, поэтому
 * статус {@code completed} всегда виден вместе с результатом. Любое исключение переводит
 * сессию в failed и не выходит за пределы потока обработчика.
 */
public final class ReviewJobRunner implements Runnable {
    private static final Logger logger = Logger.getLogger(ReviewJobRunner.class.getName());

    private final ReviewSession session;
    private final ReviewBatch batch;
    private final CodeAnalyzer analyzer;
    private final ResultStore resultStore;
    private final Clock clock;
    private final Consumer<SessionSnapshot> updates;
    private final Runnable onFinished;

    private final Object workerLock = new Object();
    private Thread worker;

    public ReviewJobRunner(ReviewSession session, ReviewBatch batch, CodeAnalyzer analyzer,
                           ResultStore resultStore, Clock clock,
                           Consumer<SessionSnapshot> updates, Runnable onFinished) {
        this.session = Objects.requireNonNull(session, "Session cannot be null");
        this.batch = Objects.requireNonNull(batch, "Batch cannot be null");
        this.analyzer = Objects.requireNonNull(analyzer, "Analyzer cannot be null");
        this.resultStore = Objects.requireNonNull(resultStore, "Result store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.updates = updates != null ? updates : snapshot -> { };
        this.onFinished = onFinished != null ? onFinished : () -> { };
    }

    public ReviewSession getSession() {
        return session;
    }

    @Override
    public void run() {
        String sessionId = session.getId();
        synchronized (workerLock) {
            worker = Thread.currentThread();
        }
        try {
            if (session.isTerminal()) {
                logger.fine("Session " + sessionId + " was terminated before it started");
                return;
            }
            logger.info("Review started: session=" + sessionId + ", files=" + batch.size()
                + ", analyzer=" + analyzer.getName());
            publish();

            execute(sessionId);
        } catch (Exception e) {
            String message = describe(e);
            logger.log(Level.SEVERE, "Review failed: session=" + sessionId + ": " + message, e);
            if (session.fail(message)) {
                publish();
            }
        } finally {
            if (!session.isTerminal()) {
                logger.severe("Review worker exited without a terminal state: session=" + sessionId);
                session.fail("Review worker terminated unexpectedly");
                publish();
            }
            synchronized (workerLock) {
                worker = null;
                // сброс позднего прерывания, чтобы оно не попало в следующую задачу пула
                Thread.interrupted();
            }
            onFinished.run();
        }
    }

    private void execute(String sessionId) throws AnalysisException {
        AnalysisContext context = new AnalysisContext(sessionId, batch, session.getConfig(), clock,
            session::isTerminal);

        List<String> phases = List.copyOf(analyzer.getPhases(batch, session.getConfig()));
        int total = phases.size();

        for (int i = 0; i < total; i++) {
            if (context.isCancelled()) {
                logger.info("Review stopped before phase " + (i + 1) + ": session=" + sessionId);
                return;
            }
            String label = phases.get(i);
            logger.fine("Session " + sessionId + " phase " + (i + 1) + "/" + total + ": " + label);

            analyzer.runPhase(i, context);

            int progress = (int) Math.round((i + 1) * 100.0 / total);
            if (!session.updateProgress(progress, label)) {
                logger.info("Review stopped after phase " + (i + 1) + ": session=" + sessionId);
                return;
            }
            publish();
            Thread.yield();
        }

        if (context.isCancelled()) {
            return;
        }

        ReviewResult result = analyzer.buildResult(context);
        if (result == null) {
            throw new AnalysisException("Analyzer " + analyzer.getName() + " returned no result");
        }
        if (!sessionId.equals(result.getSessionId())) {
            throw new AnalysisException("Analyzer " + analyzer.getName()
                + " returned a result for session " + result.getSessionId());
        }

        if (session.complete(() -> resultStore.put(sessionId, result))) {
            logger.info("Review completed: session=" + sessionId + ", issues="
                + result.getIssues().size() + ", score=" + result.getMetrics().getQualityScore());
            publish();
        } else {
            logger.info("Discarding result of terminated session " + sessionId);
        }
    }

    /**
     * Прерывает поток обработчика, если задача сейчас выполняется.
     */
    public void interrupt() {
        synchronized (workerLock) {
            if (worker != null) {
                worker.interrupt();
            }
        }
    }

    private void publish() {
        updates.accept(session.snapshot());
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getName() : message;
    }
}
