package webui;

import model.ReviewBatch;
import model.ReviewConfig;
import model.ReviewResult;
import review.AnalysisContext;
import review.AnalysisException;
import review.CodeAnalyzer;
import rules.RuleBasedCodeAnalyzer;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Анализатор на правилах, первая фаза которого ждет вызова {@link #release()} или прерывания потока.
 */
public class GatedAnalyzer implements CodeAnalyzer {
    private final CodeAnalyzer delegate = new RuleBasedCodeAnalyzer();
    private final CountDownLatch gate = new CountDownLatch(1);
    private final CountDownLatch started = new CountDownLatch(1);

    public void release() {
        gate.countDown();
    }

    /**
     * Ждет, пока обработчик войдет в первую фазу.
     */
    public void awaitStarted() throws InterruptedException {
        if (!started.await(10, TimeUnit.SECONDS)) {
            throw new AssertionError("Gated phase was never entered");
        }
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public List<String> getPhases(ReviewBatch batch, ReviewConfig config) {
        return delegate.getPhases(batch, config);
    }

    @Override
    public void runPhase(int index, AnalysisContext context) throws AnalysisException {
        if (index == 0) {
            started.countDown();
            try {
                if (!gate.await(30, TimeUnit.SECONDS)) {
                    throw new AnalysisException("Gate was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AnalysisException("Interrupted while gated", e);
            }
        }
        delegate.runPhase(index, context);
    }

    @Override
    public ReviewResult buildResult(AnalysisContext context) throws AnalysisException {
        return delegate.buildResult(context);
    }
}
