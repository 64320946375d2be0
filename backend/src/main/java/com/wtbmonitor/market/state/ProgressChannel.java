package com.wtbmonitor.market.state;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Single-consumer queue of progress messages from a running scrape. Producers publish from any thread;
 * exactly one consumer drains until {@link #close()} is called.
 */
public class ProgressChannel {
    private static final String END_OF_STREAM = new String("<end-of-stream>");

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public void publish(String message) {
        if (message == null || closed.get()) {
            return;
        }
        queue.offer(message);
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(END_OF_STREAM);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Blocks until the channel is closed and every message published before the close was delivered.
     */
    public void drain(Consumer<String> consumer) throws InterruptedException {
        while (true) {
            String message = queue.take();
            if (message == END_OF_STREAM) {
                return;
            }
            consumer.accept(message);
        }
    }
}
