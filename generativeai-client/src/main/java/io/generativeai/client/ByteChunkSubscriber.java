package io.generativeai.client;

import io.generativeai.core.GenerativeAIException.ClientException;
import io.generativeai.core.GenerativeAIException.RequestTimeoutException;
import io.generativeai.core.GenerativeAIException;
import io.generativeai.http.spi.HttpTimeoutException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Pull-side adapter over a response body publisher.
 *
 * <p>Requests one batch of buffers at a time and only when the previous batch has been handed out, so the
 * transport never runs ahead of the consumer. Every wait is bounded by the call's {@link Deadline}.
 */
final class ByteChunkSubscriber implements Flow.Subscriber<List<ByteBuffer>> {

    private static final Object COMPLETE = new Object();
    private static final Object CANCELLED = new Object();

    private final LinkedBlockingQueue<Object> signals = new LinkedBlockingQueue<>();
    private volatile Flow.Subscription subscription;
    private volatile boolean cancelled;
    private Iterator<ByteBuffer> batch;
    private volatile boolean finished;

    @Override
    public void onSubscribe(Flow.Subscription s) {
        if (subscription != null) {
            s.cancel();
            return;
        }
        subscription = s;
        if (cancelled) {
            s.cancel();
        } else {
            s.request(1);
        }
    }

    @Override
    public void onNext(List<ByteBuffer> item) {
        signals.add(item);
    }

    @Override
    public void onError(Throwable throwable) {
        signals.add(throwable);
    }

    @Override
    public void onComplete() {
        signals.add(COMPLETE);
    }

    /**
     * Returns the next non-empty buffer, or {@code null} once the body has ended or been cancelled.
     *
     * @throws RequestTimeoutException when the deadline passes first; the body is cancelled
     * @throws ClientException on a transport failure or interruption
     */
    ByteBuffer poll(Deadline deadline) {
        while (true) {
            if (cancelled) return null;
            if (batch != null) {
                while (batch.hasNext()) {
                    ByteBuffer buffer = batch.next();
                    if (buffer.hasRemaining()) return buffer;
                }
                batch = null;
                subscription.request(1);
            }
            if (finished) return null;

            Object signal = await(deadline);
            if (signal == CANCELLED) return null;
            if (signal == COMPLETE) {
                finished = true;
                return null;
            }
            if (signal instanceof Throwable) {
                finished = true;
                throw translate((Throwable) signal, deadline);
            }
            @SuppressWarnings("unchecked")
            List<ByteBuffer> next = (List<ByteBuffer>) signal;
            batch = next.iterator();
        }
    }

    /** Reads the remainder of the body into memory. */
    byte[] readAll(Deadline deadline) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer buffer;
        while ((buffer = poll(deadline)) != null) {
            if (buffer.hasArray()) {
                out.write(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
                buffer.position(buffer.limit());
            } else {
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                out.write(bytes, 0, bytes.length);
            }
        }
        return out.toByteArray();
    }

    /**
     * Stops the body; pending and future signals are ignored. Safe to call from another thread, where it
     * releases a reader blocked in {@link #poll(Deadline)}.
     */
    void cancel() {
        cancelled = true;
        finished = true;
        signals.add(CANCELLED);
        Flow.Subscription s = subscription;
        if (s != null) s.cancel();
    }

    private Object await(Deadline deadline) {
        Object signal;
        try {
            signal = signals.poll(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            cancel();
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted while reading the response body", e);
        }
        if (signal == null) {
            cancel();
            throw new RequestTimeoutException("Response body not completed within " + deadline.timeout());
        }
        return signal;
    }

    private static GenerativeAIException translate(Throwable error, Deadline deadline) {
        if (error instanceof GenerativeAIException) {
            return (GenerativeAIException) error;
        }
        if (error instanceof HttpTimeoutException) {
            return new RequestTimeoutException("Response body not completed within " + deadline.timeout(), error);
        }
        return new ClientException("Failed to read the response body: " + error.getMessage(), error);
    }
}
