package dao.subnet.settle.integration;

import dao.subnet.settle.config.SchedulerProperties;
import dao.subnet.settle.model.CommitmentEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of commitment events waiting to be settled, drained by a single worker.
 */
@Component
public class CommitmentEventQueue {

    private final Deque<CommitmentEvent> pending = new ArrayDeque<>();
    private final int capacity;

    public CommitmentEventQueue(SchedulerProperties schedulerProps) {
        this.capacity = schedulerProps.getCommitments().getQueueCapacity();
    }

    /**
     * @return false when the queue is full
     */
    public synchronized boolean offer(CommitmentEvent event) {
        if (pending.size() >= capacity) return false;
        pending.addLast(event);
        return true;
    }

    public synchronized CommitmentEvent poll() {
        return pending.pollFirst();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }
}
