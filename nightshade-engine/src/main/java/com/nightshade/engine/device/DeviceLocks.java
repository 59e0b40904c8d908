package com.nightshade.engine.device;

import com.nightshade.device.DeviceType;
import com.nightshade.engine.control.CancellationReason;
import com.nightshade.engine.control.CancellationToken;
import com.nightshade.engine.control.ExecutionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per device capability. Two nodes that need the same device never hold it at the
 * same time, even inside a parallel group. Locks are taken in {@link DeviceType} declaration order,
 * so concurrent acquisitions cannot deadlock.
 */
public final class DeviceLocks {

    private static final Logger log = LoggerFactory.getLogger(DeviceLocks.class);

    private final Map<DeviceType, ReentrantLock> locks = new EnumMap<>(DeviceType.class);

    public DeviceLocks() {
        for (DeviceType type : DeviceType.values()) {
            locks.put(type, new ReentrantLock(true));
        }
    }

    /**
     * Blocks until every device in {@code devices} is held, polling {@code token} between attempts.
     *
     * @throws ExecutionCancelledException if the token is cancelled while waiting
     */
    public Lease acquire(Set<DeviceType> devices, CancellationToken token, String nodeId, Duration poll) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        if (devices.isEmpty()) return new Lease(held);
        long pollMillis = Math.max(1, poll.toMillis());
        try {
            for (DeviceType type : EnumSet.copyOf(devices)) {
                ReentrantLock lock = locks.get(type);
                boolean waited = false;
                while (!lock.tryLock(pollMillis, TimeUnit.MILLISECONDS)) {
                    if (!waited && log.isDebugEnabled()) {
                        log.debug("Device busy, waiting | device={} | nodeId={}", type, nodeId);
                    }
                    waited = true;
                    if (token.isCancelled()) {
                        release(held);
                        throw new ExecutionCancelledException(token.reason(), nodeId, false);
                    }
                }
                held.push(lock);
            }
        } catch (InterruptedException e) {
            release(held);
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(CancellationReason.STOP, nodeId, false);
        }
        return new Lease(held);
    }

    private static void release(Deque<ReentrantLock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }

    /** Held device locks; closing releases them in reverse order. Close on the acquiring thread. */
    public static final class Lease implements AutoCloseable {

        private final Deque<ReentrantLock> held;

        private Lease(Deque<ReentrantLock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
