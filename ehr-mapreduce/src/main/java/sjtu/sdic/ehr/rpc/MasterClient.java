package sjtu.sdic.ehr.rpc;

import com.alipay.sofa.rpc.config.ConsumerConfig;
import sjtu.sdic.ehr.common.JobPhase;
import sjtu.sdic.ehr.common.NoTasksAvailableException;

/**
 * Caller side of the lease and done protocol. Releases its service reference on
 * {@link #close()}.
 *
 * Created by Cachhe on 2019/5/4.
 */
public class MasterClient implements AutoCloseable {
    private final ConsumerConfig<MasterRpcService> consumerConfig;
    private final MasterRpcService service;

    MasterClient(ConsumerConfig<MasterRpcService> consumerConfig) {
        this.consumerConfig = consumerConfig;
        this.service = consumerConfig.refer();
    }

    /**
     * @return the leased map task
     * @throws NoTasksAvailableException if all map tasks have been leased
     */
    public int assignMapTask() {
        return leased(JobPhase.MAP_PHASE, service.assignMapTask(0));
    }

    /**
     * @return the leased reduce task
     * @throws NoTasksAvailableException if all reduce tasks have been leased
     */
    public int assignReduceTask() {
        return leased(JobPhase.REDUCE_PHASE, service.assignReduceTask(0));
    }

    public String done() {
        return service.done(0);
    }

    @Override
    public void close() {
        consumerConfig.unRefer();
    }

    private static int leased(JobPhase phase, int task) {
        if (task == MasterRpcService.NO_TASK)
            throw new NoTasksAvailableException(phase);
        return task;
    }
}
