package io.generativeai.http.spi;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes a blocking {@link InputStream} as byte chunks.
 *
 * <p>Reads run on the supplied executor, one chunk per unit of demand. Cancelling closes the stream,
 * which unblocks a pending read.
 */
final class InputStreamPublisher implements Flow.Publisher<List<ByteBuffer>> {

    static final int CHUNK_SIZE = 8192;

    private final InputStream in;
    private final Runnable onClose;
    private final Executor executor;
    private final Duration timeout;
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    InputStreamPublisher(InputStream in, Runnable onClose, Executor executor, Duration timeout) {
        this.in = Objects.requireNonNull(in, "in");
        this.onClose = Objects.requireNonNull(onClose, "onClose");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = timeout;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super List<ByteBuffer>> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        if (!subscribed.compareAndSet(false, true)) {
            subscriber.onSubscribe(new Flow.Subscription() {
                @Override public void request(long n) {}
                @Override public void cancel() {}
            });
            subscriber.onError(new IllegalStateException("body already subscribed"));
            return;
        }
        Sub sub = new Sub(subscriber);
        subscriber.onSubscribe(sub);
        try {
            executor.execute(sub);
        } catch (RejectedExecutionException e) {
            sub.fail(new HttpClientException("Cannot schedule body read", e));
        }
    }

    private final class Sub implements Flow.Subscription, Runnable {
        private final Flow.Subscriber<? super List<ByteBuffer>> sub;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private long demand;

        Sub(Flow.Subscriber<? super List<ByteBuffer>> sub) {
            this.sub = sub;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                fail(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            synchronized (this) {
                long sum = demand + n;
                demand = sum < 0 ? Long.MAX_VALUE : sum;
                notifyAll();
            }
        }

        @Override
        public void cancel() {
            if (done.compareAndSet(false, true)) {
                release();
            }
        }

        @Override
        public void run() {
            byte[] buf = new byte[CHUNK_SIZE];
            try {
                while (awaitDemand()) {
                    int n = in.read(buf);
                    if (done.get()) return;
                    if (n < 0) {
                        if (done.compareAndSet(false, true)) {
                            release();
                            sub.onComplete();
                        }
                        return;
                    }
                    if (n == 0) continue;
                    synchronized (this) {
                        demand--;
                    }
                    byte[] chunk = new byte[n];
                    System.arraycopy(buf, 0, chunk, 0, n);
                    sub.onNext(List.of(ByteBuffer.wrap(chunk)));
                }
            } catch (IOException e) {
                fail(HttpClientException.translate(e, timeout));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(new HttpClientException("Body read interrupted", e));
            }
        }

        private synchronized boolean awaitDemand() throws InterruptedException {
            while (demand == 0 && !done.get()) {
                wait();
            }
            return !done.get();
        }

        void fail(Throwable error) {
            if (done.compareAndSet(false, true)) {
                release();
                sub.onError(error);
            }
        }

        private void release() {
            synchronized (this) {
                notifyAll();
            }
            onClose.run();
        }
    }
}
