package com.example.sheetsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * Bounded single-consumer outbound queue of one connection. A consumer that falls
 * {@code capacity} messages behind is cut off: the channel completes after draining
 * what it holds and {@code onOverflow} runs. Offering never blocks the caller.
 */
public class ConnectionChannel {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionChannel.class);

    private final String connectionId;
    private final Sinks.Many<ChannelMessage> sink;
    private final Runnable onOverflow;
    private boolean closed;

    public ConnectionChannel(String connectionId, int capacity, Runnable onOverflow) {
        this.connectionId = connectionId;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(Queues.<ChannelMessage>get(capacity).get());
        this.onOverflow = onOverflow;
    }

    /**
     * @return false if the message was not queued (channel closed, cancelled or full)
     */
    public boolean offer(ChannelMessage message) {
        boolean overflowed;
        synchronized (this) {
            if (closed) return false;
            Sinks.EmitResult result = sink.tryEmitNext(message);
            if (result.isSuccess()) return true;
            // a full queue reports FAIL_ZERO_SUBSCRIBER until the stream is subscribed
            overflowed = result == Sinks.EmitResult.FAIL_OVERFLOW
                    || result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER;
            logger.debug("Channel {} refused {}: {}", connectionId, message.getType(), result);
            closed = true;
            sink.tryEmitComplete();
        }
        if (overflowed) {
            logger.warn("Connection {} is not keeping up, disconnecting", connectionId);
            onOverflow.run();
        }
        return false;
    }

    public Flux<ChannelMessage> asFlux() {
        return sink.asFlux();
    }

    public synchronized void close() {
        if (closed) return;
        closed = true;
        sink.tryEmitComplete();
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
