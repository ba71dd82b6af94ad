package im.arun.docingest.scheduler;

/**
 * Terminal state of one unit handed to {@link BoundedWorkScheduler}.
 */
public final class WorkOutcome<T, R> {
    private final T unit;
    private final R result;
    private final Throwable error;
    private final boolean attempted;

    private WorkOutcome(T unit, R result, Throwable error, boolean attempted) {
        this.unit = unit;
        this.result = result;
        this.error = error;
        this.attempted = attempted;
    }

    static <T, R> WorkOutcome<T, R> completed(T unit, R result) {
        return new WorkOutcome<>(unit, result, null, true);
    }

    static <T, R> WorkOutcome<T, R> failed(T unit, Throwable error) {
        return new WorkOutcome<>(unit, null, error, true);
    }

    static <T, R> WorkOutcome<T, R> notAttempted(T unit) {
        return new WorkOutcome<>(unit, null, null, false);
    }

    public T getUnit() {
        return unit;
    }

    public R getResult() {
        return result;
    }

    public Throwable getError() {
        return error;
    }

    /**
     * False when the unit was never pulled because the run was cancelled.
     */
    public boolean isAttempted() {
        return attempted;
    }

    public boolean isCompleted() {
        return attempted && error == null;
    }
}
