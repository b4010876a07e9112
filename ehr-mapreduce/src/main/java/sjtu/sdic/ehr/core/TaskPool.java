package sjtu.sdic.ehr.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import sjtu.sdic.ehr.common.JobPhase;
import sjtu.sdic.ehr.common.NoTasksAvailableException;

/**
 * A finite set of task indices, each handed out at most once. Leased indices
 * are never returned to the pool, a lost task is not leased again.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class TaskPool {
    private final JobPhase phase;
    private final int size;

    private final Lock lock = new ReentrantLock();
    // protected by the lock
    private final Deque<Integer> available;
    private final Set<Integer> leased;

    /**
     * @param phase which tasks this pool holds
     * @param size number of tasks, indices are 0 to size - 1
     */
    public TaskPool(JobPhase phase, int size) {
        if (size < 0)
            throw new IllegalArgumentException("negative pool size " + size);
        this.phase = phase;
        this.size = size;
        this.available = new ArrayDeque<>(size);
        this.leased = new HashSet<>();
        for (int i = 0; i < size; i++) {
            available.add(i);
        }
    }

    /**
     * take the next available index
     *
     * @return task index
     * @throws NoTasksAvailableException if every index has been leased
     */
    public int lease() {
        try {
            lock.lock();
            Integer task = available.pollFirst();
            if (task == null)
                throw new NoTasksAvailableException(phase);
            leased.add(task);
            return task;
        } finally {
            lock.unlock();
        }
    }

    public int remaining() {
        try {
            lock.lock();
            return available.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLeased(int task) {
        try {
            lock.lock();
            return leased.contains(task);
        } finally {
            lock.unlock();
        }
    }

    public boolean isExhausted() {
        return remaining() == 0;
    }

    public int size() {
        return size;
    }

    public JobPhase getPhase() {
        return phase;
    }
}
