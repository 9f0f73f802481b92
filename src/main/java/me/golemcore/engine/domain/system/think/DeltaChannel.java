package me.golemcore.engine.domain.system.think;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.LlmDelta;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Bounded hand-off between a streaming model call and the thread that turns its
 * deltas into events. The producer blocks when the consumer falls behind.
 *
 * <p>
 * {@link #close()} enqueues the end marker at most once and must be called when
 * the producer finishes, whether it succeeded, failed or was cancelled. The
 * consumer drains until it sees the marker.
 */
@Slf4j
public class DeltaChannel {

    private static final LlmDelta END = new LlmDelta(LlmDelta.Kind.TEXT, null, null);

    private final BlockingQueue<LlmDelta> queue;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean abandoned = new AtomicBoolean();
    private final AtomicInteger endMarkersReceived = new AtomicInteger();

    public DeltaChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /**
     * Producer side. Deltas published after close are dropped.
     */
    public void publish(LlmDelta delta) {
        if (delta == null) {
            return;
        }
        if (closed.get()) {
            log.trace("[Think] Dropping delta published after end of stream");
            return;
        }
        try {
            queue.put(delta);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Think] Producer interrupted while publishing a delta");
        }
    }

    /**
     * Marks the end of the stream. Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true) || abandoned.get()) {
            return;
        }
        try {
            queue.put(END);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Think] Interrupted while signalling end of stream, forcing the marker in");
            forceEnd();
        }
    }

    /**
     * Consumer side: hands every delta to {@code onDelta} in arrival order until
     * the end marker arrives.
     *
     * @return true if the end marker was reached, false if the consumer thread was
     *         interrupted first
     */
    public boolean drain(Consumer<LlmDelta> onDelta) {
        while (true) {
            LlmDelta delta;
            try {
                delta = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon();
                return false;
            }
            if (delta == END) {
                endMarkersReceived.incrementAndGet();
                return true;
            }
            onDelta.accept(delta);
        }
    }

    /**
     * Called by a consumer that stops draining early. Unblocks the producer and
     * drops anything still queued.
     */
    public void abandon() {
        abandoned.set(true);
        closed.set(true);
        queue.clear();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getEndMarkersReceived() {
        return endMarkersReceived.get();
    }

    private void forceEnd() {
        while (!queue.offer(END)) {
            queue.poll();
        }
    }
}
