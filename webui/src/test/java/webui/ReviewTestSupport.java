package webui;

import report.ArchiveBuilder;
import report.HtmlReporter;
import review.CodeAnalyzer;
import review.EngineConfig;
import review.ResultStore;
import review.ReviewEngine;
import review.SessionSnapshot;
import review.SessionStore;
import webui.service.ReviewService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

public final class ReviewTestSupport {
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-02T15:04:05Z"), ZoneOffset.UTC);

    public static final String VULNERABLE_PY = "def run(user_input):\n    return eval(user_input)\n";

    private ReviewTestSupport() {
    }

    public static ReviewEngine engine(CodeAnalyzer analyzer) {
        EngineConfig config = EngineConfig.builder()
            .maxConcurrentReviews(2)
            .queueCapacity(4)
            .maxFiles(5)
            .analysisTimeout(Duration.ofSeconds(30))
            .sessionTtl(Duration.ZERO)
            .build();
        return new ReviewEngine(analyzer, config, new SessionStore(), new ResultStore(), CLOCK);
    }

    public static ReviewService service(ReviewEngine engine) {
        return new ReviewService(engine, new HtmlReporter(CLOCK), new ArchiveBuilder(CLOCK), CLOCK);
    }

    public static SessionSnapshot awaitTerminal(ReviewService service, String sessionId) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        SessionSnapshot snapshot = service.getStatus(sessionId);
        while (!snapshot.isTerminal()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Session did not finish: " + snapshot);
            }
            Thread.sleep(10);
            snapshot = service.getStatus(sessionId);
        }
        return snapshot;
    }
}
