package com.chatbridge.streaming;

import org.reactivestreams.Subscription;
import reactor.core.Disposable;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Operators;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fails a source with {@link TimeoutException} when it stays silent for longer than the idle window
 * while items are requested. The clock is stopped whenever no demand is pending, so a slow consumer
 * never counts as backend silence.
 */
final class IdleTimeout {

    private IdleTimeout() {
    }

    static <T> Flux<T> apply(Flux<T> source, Duration idle, Scheduler timer) {
        return Flux.create(sink -> new Relay<>(sink, idle, timer).start(source));
    }

    private static final class Relay<T> extends BaseSubscriber<T> {

        private final FluxSink<T> sink;
        private final Duration idle;
        private final Scheduler timer;

        private long pending;
        private long unsent;
        private boolean subscribed;
        private boolean done;
        private Disposable armed;

        Relay(FluxSink<T> sink, Duration idle, Scheduler timer) {
            this.sink = sink;
            this.idle = idle;
            this.timer = timer;
        }

        void start(Flux<T> source) {
            sink.onDispose(this::shutdown);
            sink.onRequest(this::demand);
            source.subscribe(this);
        }

        @Override
        protected void hookOnSubscribe(Subscription subscription) {
            long early;
            synchronized (this) {
                subscribed = true;
                early = unsent;
                unsent = 0;
            }
            if (early > 0) {
                subscription.request(early);
            }
        }

        @Override
        protected void hookOnNext(T value) {
            synchronized (this) {
                if (done) {
                    return;
                }
                if (pending != Long.MAX_VALUE) {
                    pending--;
                }
                disarm();
                if (pending > 0) {
                    arm();
                }
            }
            sink.next(value);
        }

        @Override
        protected void hookOnComplete() {
            if (finish()) {
                sink.complete();
            }
        }

        @Override
        protected void hookOnError(Throwable error) {
            if (finish()) {
                sink.error(error);
            }
        }

        private void demand(long n) {
            synchronized (this) {
                if (done) {
                    return;
                }
                boolean idleBefore = pending == 0;
                pending = Operators.addCap(pending, n);
                if (idleBefore) {
                    arm();
                }
                if (!subscribed) {
                    unsent = Operators.addCap(unsent, n);
                    return;
                }
            }
            request(n);
        }

        private void expired(Disposable[] token) {
            synchronized (this) {
                if (done || armed == null || armed != token[0]) {
                    return;
                }
                done = true;
                armed = null;
            }
            cancel();
            sink.error(new TimeoutException("No item within " + idle.toMillis() + " ms"));
        }

        private synchronized boolean finish() {
            if (done) {
                return false;
            }
            done = true;
            disarm();
            return true;
        }

        private void shutdown() {
            synchronized (this) {
                done = true;
                disarm();
            }
            cancel();
        }

        private void arm() {
            Disposable[] token = new Disposable[1];
            token[0] = timer.schedule(() -> expired(token), idle.toMillis(), TimeUnit.MILLISECONDS);
            armed = token[0];
        }

        private void disarm() {
            if (armed != null) {
                armed.dispose();
                armed = null;
            }
        }
    }
}
