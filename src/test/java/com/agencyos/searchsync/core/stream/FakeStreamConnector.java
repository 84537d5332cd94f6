package com.agencyos.searchsync.core.stream;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.net.ConnectException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Scripted connector. Each {@link #connect} call takes the next step of the script; once the script
 * is used up every attempt is refused.
 */
public class FakeStreamConnector implements StreamConnector {

    private final Scheduler clock;
    private final Deque<Optional<FakeStreamChannel>> script = new ArrayDeque<>();
    private final List<Long> attemptTimes = new CopyOnWriteArrayList<>();
    private final List<FakeStreamChannel> channels = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> lostCallbacks = new CopyOnWriteArrayList<>();
    private volatile boolean shutdown;

    /**
     * @param clock scheduler whose clock stamps each attempt
     */
    public FakeStreamConnector(Scheduler clock) {
        this.clock = clock;
    }

    public synchronized FakeStreamConnector thenAccept() {
        return thenAccept(new FakeStreamChannel());
    }

    public synchronized FakeStreamConnector thenAccept(FakeStreamChannel channel) {
        script.add(Optional.of(channel));
        return this;
    }

    public synchronized FakeStreamConnector thenRefuse(int times) {
        for (int i = 0; i < times; i++) {
            script.add(Optional.empty());
        }
        return this;
    }

    @Override
    public Mono<StreamChannel> connect(Consumer<Throwable> onConnectionLost) {
        return Mono.defer(() -> {
            attemptTimes.add(clock.now(TimeUnit.MILLISECONDS));
            Optional<FakeStreamChannel> step;
            synchronized (this) {
                step = script.poll();
            }
            if (step != null && step.isPresent()) {
                FakeStreamChannel ch = step.get();
                channels.add(ch);
                lostCallbacks.add(onConnectionLost);
                return Mono.just(ch);
            }
            return Mono.error(new ConnectException("Connection refused"));
        });
    }

    /**
     * Simulates a transport failure on the most recently accepted channel.
     */
    public void dropLatest(Throwable cause) {
        lostCallbacks.get(lostCallbacks.size() - 1).accept(cause);
    }

    /**
     * Fires the lost callback of the n-th accepted channel (0-based).
     */
    public void drop(int index, Throwable cause) {
        lostCallbacks.get(index).accept(cause);
    }

    @Override
    public void shutdown() {
        shutdown = true;
    }

    public List<Long> attemptTimes() {
        return attemptTimes;
    }

    public int attempts() {
        return attemptTimes.size();
    }

    public List<FakeStreamChannel> channels() {
        return channels;
    }

    public boolean isShutdown() {
        return shutdown;
    }
}
