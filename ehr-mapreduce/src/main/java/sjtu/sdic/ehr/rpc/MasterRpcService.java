package sjtu.sdic.ehr.rpc;

/**
 * These are all RPC methods of a Master. The int argument of each call is ignored.
 * <p>
 * Only plain values cross the wire: an empty pool is answered with {@link #NO_TASK}
 * and turned back into a typed error by {@link MasterClient}.
 *
 * Created by Cachhe on 2019/4/21.
 */
public interface MasterRpcService {
    int NO_TASK = -1;

    /**
     * lease the next map task
     *
     * @return map task index, or {@link #NO_TASK} if all map tasks have been leased
     */
    int assignMapTask(int args);

    /**
     * lease the next reduce task
     *
     * @return reduce task index, or {@link #NO_TASK} if all reduce tasks have been leased
     */
    int assignReduceTask(int args);

    /**
     * mark the run complete. Safe to call more than once, later calls don't block
     * and don't fire anything again.
     *
     * @return acknowledgment
     */
    String done(int args);
}
