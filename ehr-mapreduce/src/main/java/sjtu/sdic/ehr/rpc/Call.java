package sjtu.sdic.ehr.rpc;

import com.alipay.sofa.rpc.config.ConsumerConfig;
import sjtu.sdic.ehr.common.MRConfig;


/**
 * Created by Cachhe on 2019/4/22.
 */
public class Call {
    public static final int TIMEOUT_MS = 3000;

    /**
     * connect to the master with specified address. The returned client holds a
     * reference to the service and must be closed.
     *
     * @param config where the master listens and its address
     * @return client of the master's RPC service
     */
    public static MasterClient connect(MRConfig config) {
        return new MasterClient(masterConsumer(config));
    }

    /**
     * describe the consumer side of the master's RPC service, not yet referred
     */
    public static ConsumerConfig<MasterRpcService> masterConsumer(MRConfig config) {
        return new ConsumerConfig<MasterRpcService>()
                .setInterfaceId(MasterRpcService.class.getName()) // Specify the interface
                .setUniqueId(config.getAddress())
                .setProtocol("bolt") // Specify the protocol
                .setProxy("jdk")
                .setTimeout(TIMEOUT_MS)
                .setDirectUrl("bolt://" + config.getServerHost() + ":" + config.getServerPort())
                .setRepeatedReferLimit(-1);
    }
}
