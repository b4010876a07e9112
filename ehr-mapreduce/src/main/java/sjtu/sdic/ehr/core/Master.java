package sjtu.sdic.ehr.core;

import com.alipay.sofa.rpc.config.ProviderConfig;
import com.alipay.sofa.rpc.config.ServerConfig;
import sjtu.sdic.ehr.common.Category;
import sjtu.sdic.ehr.common.CompletionGate;
import sjtu.sdic.ehr.common.Func;
import sjtu.sdic.ehr.common.JobPhase;
import sjtu.sdic.ehr.common.MRConfig;
import sjtu.sdic.ehr.common.MapReduceException;
import sjtu.sdic.ehr.common.MasterState;
import sjtu.sdic.ehr.common.NoTasksAvailableException;
import sjtu.sdic.ehr.common.RunConfig;
import sjtu.sdic.ehr.common.Utils;
import sjtu.sdic.ehr.rpc.Call;
import sjtu.sdic.ehr.rpc.MasterClient;
import sjtu.sdic.ehr.rpc.MasterRpcService;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static sjtu.sdic.ehr.common.Utils.debug;

/**
 * Master holds all the state that the master needs to keep track of: the
 * leasable map and reduce pools, the completion gate and the RPC server
 * that exposes them.
 *
 * Created by Cachhe on 2019/4/19.
 */
public class Master implements MasterRpcService {
    public static final String DONE_REPLY = "All tasks are done";

    private final Lock lock;

    public final String address; // unique id of the exported service
    public final RunConfig conf;
    private final MRConfig config;

    private final TaskPool mapTasks;
    private final TaskPool reduceTasks;
    private final CompletionGate doneGate;
    private MasterState state; // protected by the lock

    private ProviderConfig<MasterRpcService> rpc;
    private boolean isExported;

    private Master(RunConfig conf, MRConfig config) {
        this.address = config.getAddress();
        this.conf = conf;
        this.config = config;
        lock = new ReentrantLock();
        mapTasks = new TaskPool(JobPhase.MAP_PHASE, conf.nMap);
        reduceTasks = new TaskPool(JobPhase.REDUCE_PHASE, conf.nReduce);
        doneGate = new CompletionGate();
        state = MasterState.INITIALIZED;
    }

    /**
     * create a master for the run and start serving its RPC methods
     *
     * @param conf the run
     * @param config where to listen
     * @return master instance
     */
    public static Master makeMaster(RunConfig conf, MRConfig config) {
        Master mr = new Master(conf, config);
        mr.startRPCServer();
        return mr;
    }

    /**
     * parallel runs every task of a phase on its own thread, see
     * {@link Scheduler#schedule(RunConfig, JobPhase)}.
     */
    public void parallel() {
        run(jobPhase -> {
            Scheduler.schedule(conf, jobPhase);
            return null;
        }, aVoid -> {
            notifyDone();
            return null;
        });
    }

    /**
     * Sequential runs map and reduce tasks sequentially, waiting for each task to
     * complete before running the next.
     */
    public void sequential() {
        run(jobPhase -> {
            Scheduler.sequential(conf, jobPhase);
            return null;
        }, aVoid -> {
            notifyDone();
            return null;
        });
    }

    /**
     * run executes the map phase, then the reduce phase, then the finish step,
     * and returns once the completion gate has fired.
     * <p>
     * Each call to {@code schedule} is a barrier: it returns only after every
     * task of the phase has stopped, and throws if any of them failed. A failure
     * ends the run right there, the reduce phase never starts after a failed map
     * phase and done is never signaled.
     * <p>
     * Note that this implementation assumes a shared file system.
     *
     * @param schedule schedule function called to schedule map and reduce tasks
     * @param finish finish function called when all tasks are done, expected to signal done
     * @throws MapReduceException if a phase failed
     */
    public void run(Func<Void, JobPhase> schedule, Func<Void, Void> finish) {
        prepare();
        System.out.println(String.format("%s: Starting Map/Reduce on %d partitions", address, conf.nMap));

        schedule.func(JobPhase.MAP_PHASE);
        schedule.func(JobPhase.REDUCE_PHASE);
        finish.func(null);
        mWait();

        System.out.println(String.format("%s: Map/Reduce task completed", address));
    }

    /**
     * call done on ourselves through the RPC surface
     */
    public void notifyDone() {
        try (MasterClient client = Call.connect(config)) {
            System.out.println(client.done());
        }
    }

    @Override
    public int assignMapTask(int args) {
        return lease(mapTasks);
    }

    @Override
    public int assignReduceTask(int args) {
        return lease(reduceTasks);
    }

    @Override
    public String done(int args) {
        try {
            lock.lock();
            state = MasterState.COMPLETED;
        } finally {
            lock.unlock();
        }
        if (!doneGate.fire())
            debug("Done: already fired");
        return DONE_REPLY;
    }

    /**
     * mWait blocks until done has been called, with no deadline.
     */
    public void mWait() {
        try {
            doneGate.await(); // this will block the current thread
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MapReduceException(String.format("%s: interrupted waiting for done", address), e);
        }
    }

    /**
     * mWait blocks until done has been called or the timeout elapses.
     *
     * @return whether done was called in time
     */
    public boolean mWait(long timeout, TimeUnit unit) {
        try {
            return doneGate.await(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return doneGate.isFired();
        }
    }

    public MasterState getState() {
        try {
            lock.lock();
            return state;
        } finally {
            lock.unlock();
        }
    }

    public TaskPool getMapTasks() {
        return mapTasks;
    }

    public TaskPool getReduceTasks() {
        return reduceTasks;
    }

    /**
     * stop serving RPC methods
     */
    public void shutdown() {
        debug("Shutdown: master server");
        if (isExported && rpc != null) {
            rpc.unExport();
            isExported = false;
        }
    }

    public void removeFile(String n) {
        File file = new File(n);
        if (file.exists() && !file.delete())
            System.err.println(String.format("CleanupFiles: can't remove %s", n));
    }

    /**
     * remove the intermediate files and reports of this run
     */
    public void cleanupFiles() {
        for (int i = 0; i < conf.nMap; i++) {
            for (Category c : Category.values()) {
                removeFile(conf.intermediateName(c, i));
            }
        }
        for (int i = 0; i < conf.nReduce; i++) {
            removeFile(conf.reportName(i));
        }
    }

    private int lease(TaskPool pool) {
        touch();
        try {
            int task = pool.lease();
            debug(String.format("Assign: %s task %d", pool.getPhase().kind(), task));
            return task;
        } catch (NoTasksAvailableException e) {
            debug(String.format("Assign: %s", e.getMessage()));
            return NO_TASK;
        }
    }

    private void touch() {
        try {
            lock.lock();
            if (state == MasterState.INITIALIZED)
                state = MasterState.LEASING;
        } finally {
            lock.unlock();
        }
    }

    private void prepare() {
        try {
            Files.createDirectories(Paths.get(conf.workDir));
        } catch (IOException e) {
            throw new MapReduceException(String.format("can't create work dir %s", conf.workDir), e);
        }
        // a report left by an earlier run must not pass for this run's output
        for (int i = 0; i < conf.nReduce; i++) {
            removeFile(conf.reportName(i));
        }
    }

    private void startRPCServer() {
        if (isExported)
            return;

        if (rpc == null) {
            // start RPC server
            ServerConfig serverConfig = new ServerConfig()
                    .setProtocol("bolt") // Set a protocol, which is bolt by default
                    .setPort(config.getServerPort()) // set a port, which is 12200 by default
                    .setDaemon(true); // daemon thread

            rpc = new ProviderConfig<MasterRpcService>()
                    .setInterfaceId(MasterRpcService.class.getName()) // Specify the interface
                    .setUniqueId(address)
                    .setRef(this) // Specify the implementation
                    .setServer(serverConfig); // Specify the server
        }
        rpc.export();
        isExported = true;
        Utils.debug(String.format("Master %s listening on %s:%d", address, config.getServerHost(), config.getServerPort()));
    }
}
