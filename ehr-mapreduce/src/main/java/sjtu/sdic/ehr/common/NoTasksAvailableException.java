package sjtu.sdic.ehr.common;

/**
 * Thrown by a lease on an empty pool. Pools are never refilled, so once thrown
 * it will be thrown for every later lease on the same pool.
 *
 * <p>Remote callers get it from {@code MasterClient}, it is up to them whether
 * to retry or to treat the phase as handed out.
 *
 * Created by Cachhe on 2019/5/3.
 */
public class NoTasksAvailableException extends MapReduceException {
    private final JobPhase phase;

    public NoTasksAvailableException(JobPhase phase) {
        super(String.format("no more %s tasks", phase.kind()));
        this.phase = phase;
    }

    public JobPhase getPhase() {
        return phase;
    }
}
