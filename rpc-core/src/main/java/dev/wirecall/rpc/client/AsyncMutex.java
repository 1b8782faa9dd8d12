package dev.wirecall.rpc.client;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * Mutual exclusion for reactive pipelines. Waiting for the lock is a subscription that completes
 * later, never a blocked thread. Waiters are served in arrival order.
 */
public final class AsyncMutex {

    private final Deque<Permit> waiters = new ArrayDeque<>();
    private boolean locked;

    /**
     * Run {@code body} while holding the lock. The lock is released when the body completes, fails
     * or is cancelled.
     */
    public <T> Mono<T> withLock(Supplier<? extends Mono<T>> body) {
        return Mono.usingWhen(acquire(), permit -> body.get(),
            permit -> Mono.fromRunnable(permit::release),
            (permit, error) -> Mono.fromRunnable(permit::release),
            permit -> Mono.fromRunnable(permit::release));
    }

    /**
     * Wait for the lock. The emitted permit must be released exactly once; cancelling before the
     * permit is emitted gives up the place in the queue.
     */
    public Mono<Permit> acquire() {
        return Mono.create(sink -> {
            Permit permit = new Permit(sink);
            boolean granted;
            synchronized (this) {
                granted = !locked;
                if (granted) {
                    locked = true;
                    permit.granted = true;
                } else {
                    waiters.addLast(permit);
                }
            }
            sink.onCancel(() -> cancel(permit));
            if (granted) {
                sink.success(permit);
            }
        });
    }

    public synchronized boolean isLocked() {
        return locked;
    }

    public synchronized int queueLength() {
        return waiters.size();
    }

    private void handOff() {
        Permit next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                locked = false;
                return;
            }
            next.granted = true;
        }
        next.sink.success(next);
    }

    private void cancel(Permit permit) {
        synchronized (this) {
            if (!permit.granted) {
                waiters.remove(permit);
                return;
            }
        }
        // granted while the cancellation was in flight
        permit.release();
    }

    /**
     * Ownership of the lock.
     */
    public final class Permit {

        private final MonoSink<Permit> sink;
        private final AtomicBoolean released = new AtomicBoolean();
        private boolean granted;

        private Permit(MonoSink<Permit> sink) {
            this.sink = sink;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                handOff();
            }
        }
    }
}
