package sjtu.sdic.ehr.common;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A one-shot signal. It goes from unset to fired once and stays fired; every
 * waiter, past or future, is released by that single transition.
 *
 * Created by Cachhe on 2019/5/2.
 */
public class CompletionGate {
    private final Lock lock = new ReentrantLock();
    private final Condition firedCond = lock.newCondition(); // signals when fire() flips the gate
    private boolean fired; // protected by lock

    /**
     * fire the gate, never blocks
     *
     * @return true if this call fired it, false if it had already been fired
     */
    public boolean fire() {
        try {
            lock.lock();
            if (fired)
                return false;
            fired = true;
            firedCond.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFired() {
        try {
            lock.lock();
            return fired;
        } finally {
            lock.unlock();
        }
    }

    /**
     * block until the gate fires, with no deadline
     *
     * @throws InterruptedException interruptedException
     */
    public void await() throws InterruptedException {
        try {
            lock.lock();
            while (!fired) {
                firedCond.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * block until the gate fires or the deadline passes
     *
     * @return whether the gate fired
     * @throws InterruptedException interruptedException
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        try {
            lock.lock();
            while (!fired) {
                if (nanos <= 0)
                    return false;
                nanos = firedCond.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
