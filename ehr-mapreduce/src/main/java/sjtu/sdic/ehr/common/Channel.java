package sjtu.sdic.ehr.common;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * An unbounded channel. Task threads write their result once, the
 * scheduler drains it after the phase barrier.
 *
 * Created by Cachhe on 2019/4/19.
 */
public class Channel<T> {
    private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();

    /**
     * put a value to this channel, never blocks since the channel is unbounded
     *
     * @throws InterruptedException if interrupted while putting
     */
    public void write(T t) throws InterruptedException {
        queue.put(t);
    }

    /**
     * take every value currently in the channel
     *
     * @return values in write order
     */
    public List<T> drain() {
        List<T> values = new ArrayList<>();
        queue.drainTo(values);
        return values;
    }
}
