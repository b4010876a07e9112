package sjtu.sdic.ehr.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import sjtu.sdic.ehr.common.Channel;
import sjtu.sdic.ehr.common.DoTaskArgs;
import sjtu.sdic.ehr.common.JobPhase;
import sjtu.sdic.ehr.common.MapReduceException;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.TaskResult;
import sjtu.sdic.ehr.common.Utils;

/** Created by Cachhe on 2019/4/22. */
public class Scheduler {

  /**
   * schedule() starts every task of the given phase (mapPhase or reducePhase) on its own thread
   * and waits for all of them to stop. Each task reports exactly once on the phase's result
   * channel. Only when every task has reported are the results looked at: if any of them failed,
   * the phase fails and the next phase must not start.
   *
   * @param conf the run
   * @param phase MAP or REDUCE
   * @throws MapReduceException if a task failed, caused by that task's error
   */
  public static void schedule(RunConfig conf, JobPhase phase) {
    final List<DoTaskArgs> tasks = tasksOf(conf, phase);
    System.out.println(
        String.format(
            "Schedule: %d %s tasks (%d I/Os)", tasks.size(), phase, tasks.get(0).numOtherPhase));

    final Channel<TaskResult> results = new Channel<>();
    final List<Thread> threads = new ArrayList<>();
    for (DoTaskArgs arg : tasks) {
      Thread t = new Thread(() -> report(results, run(conf, arg)), phase.kind() + "-" + arg.taskNum);
      t.start();
      threads.add(t);
    }

    // the barrier: every task has written its result once all threads are joined
    for (Thread t : threads) {
      try {
        t.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new MapReduceException(String.format("Schedule: interrupted waiting for %s", phase), e);
      }
    }

    check(phase, results, tasks.size());
    System.out.println(String.format("Schedule: %s done", phase));
  }

  /**
   * sequential runs the tasks of a phase one after the other on the calling thread, with the
   * same failure policy as {@link #schedule(RunConfig, JobPhase)}.
   */
  public static void sequential(RunConfig conf, JobPhase phase) {
    final List<DoTaskArgs> tasks = tasksOf(conf, phase);
    final Channel<TaskResult> results = new Channel<>();
    for (DoTaskArgs arg : tasks) {
      report(results, run(conf, arg));
    }
    check(phase, results, tasks.size());
  }

  /**
   * doTask runs one map or reduce task on the calling thread.
   *
   * @throws IOException on any I/O failure of the task
   */
  public static void doTask(RunConfig conf, DoTaskArgs arg) throws IOException {
    switch (arg.phase) {
      case MAP_PHASE:
        Mapper.doMap(conf, arg.taskNum, arg.file);
        break;
      case REDUCE_PHASE:
        Reducer.doReduce(conf, arg.taskNum, arg.numOtherPhase);
        break;
    }
  }

  private static List<DoTaskArgs> tasksOf(RunConfig conf, JobPhase phase) {
    final List<DoTaskArgs> tasks = new ArrayList<>();
    switch (phase) {
      case MAP_PHASE:
        for (int i = 0; i < conf.nMap; i++) {
          tasks.add(new DoTaskArgs(conf.files.get(i), phase, i, conf.nReduce));
        }
        break;
      case REDUCE_PHASE:
        for (int i = 0; i < conf.nReduce; i++) {
          tasks.add(new DoTaskArgs(null, phase, i, conf.nMap));
        }
        break;
    }
    return tasks;
  }

  private static TaskResult run(RunConfig conf, DoTaskArgs arg) {
    Utils.debug(String.format("given %s", arg));
    try {
      doTask(conf, arg);
    } catch (IOException | RuntimeException e) {
      System.err.println(String.format("%s failed: %s", arg, e));
      return TaskResult.failed(arg, e);
    }
    System.out.println(String.format("%s task #%d done", arg.phase, arg.taskNum));
    return TaskResult.ok(arg);
  }

  private static void report(Channel<TaskResult> results, TaskResult result) {
    try {
      results.write(result);
    } catch (InterruptedException e) {
      // unbounded queue, put() never waits
      Thread.currentThread().interrupt();
    }
  }

  private static void check(JobPhase phase, Channel<TaskResult> results, int nTasks) {
    final List<TaskResult> reported = results.drain();
    TaskResult failure = null;
    for (TaskResult r : reported) {
      if (!r.isOk() && (failure == null || r.args.taskNum < failure.args.taskNum)) {
        failure = r;
      }
    }

    if (failure != null) {
      throw new MapReduceException(
          String.format("%s failed: %s", failure.args, failure.error.getMessage()), failure.error);
    }
    if (reported.size() != nTasks) {
      throw new MapReduceException(
          String.format("Schedule: only %d of %d %s tasks reported", reported.size(), nTasks, phase));
    }
  }
}
