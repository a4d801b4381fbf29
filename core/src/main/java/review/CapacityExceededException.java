package review;

/**
 * Пул обработчиков и его очередь заполнены.
 */
public class CapacityExceededException extends RuntimeException {

    private final int maxConcurrentReviews;
    private final int queueCapacity;

    public CapacityExceededException(int maxConcurrentReviews, int queueCapacity) {
        super(String.format("Review capacity exceeded (%d running, %d queued)",
            maxConcurrentReviews, queueCapacity));
        this.maxConcurrentReviews = maxConcurrentReviews;
        this.queueCapacity = queueCapacity;
    }

    public int getMaxConcurrentReviews() {
        return maxConcurrentReviews;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }
}
