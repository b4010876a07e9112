package sjtu.sdic.ehr.common;

/**
 * DoTaskArgs holds the arguments that are passed to a task when
 * it is scheduled.
 *
 * Created by Cachhe on 2019/4/23.
 */
public class DoTaskArgs {
    public String file; // only for map, the input partition
    public JobPhase phase; // are we in mapPhase or reducePhase?
    public int taskNum; // this task's index in the current phase

    // numOtherPhase is the total number of tasks in other phase; reducers
    // need this to know how many intermediate files to collect.
    public int numOtherPhase;

    public DoTaskArgs(String file, JobPhase phase, int taskNum, int numOtherPhase) {
        this.file = file;
        this.phase = phase;
        this.taskNum = taskNum;
        this.numOtherPhase = numOtherPhase;
    }

    @Override
    public String toString() {
        return String.format("%s task #%d on file %s (nios: %d)", phase, taskNum, file, numOtherPhase);
    }
}
