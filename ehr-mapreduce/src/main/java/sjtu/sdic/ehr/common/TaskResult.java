package sjtu.sdic.ehr.common;

/**
 * What a task reports once it stops, written exactly once to the result
 * channel of its phase.
 *
 * Created by Cachhe on 2019/4/22.
 */
public class TaskResult {
    public final DoTaskArgs args;
    public final Throwable error; // null on success

    private TaskResult(DoTaskArgs args, Throwable error) {
        this.args = args;
        this.error = error;
    }

    public static TaskResult ok(DoTaskArgs args) {
        return new TaskResult(args, null);
    }

    public static TaskResult failed(DoTaskArgs args, Throwable error) {
        return new TaskResult(args, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
