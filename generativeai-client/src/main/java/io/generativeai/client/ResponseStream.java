package io.generativeai.client;

import io.generativeai.core.GenerativeAIException;
import io.generativeai.core.GenerativeAIException.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily decoded sequence of streamed responses.
 *
 * <p>Elements are read from the network only as {@link #hasNext()} asks for them, each wait bounded by the
 * call's deadline, including elements already buffered. A stream is single-pass and not thread-safe, except
 * that {@link #close()} may be called from another thread to release a blocked reader. Closing it, or any
 * failure while reading, aborts the underlying HTTP exchange; use try-with-resources when not draining it.
 *
 * <pre>{@code
 * try (ResponseStream<GenerateContentResponse> stream = client.generateContentStream(request)) {
 *     stream.forEachRemaining(r -> System.out.print(r.text()));
 * }
 * }</pre>
 *
 * @param <T> element type
 */
public final class ResponseStream<T> implements Iterator<T>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResponseStream.class);

    /** Turns the bytes of one element into a validated value. */
    @FunctionalInterface
    interface ElementDecoder<T> {
        T decode(byte[] element);
    }

    private final ByteChunkSubscriber body;
    private final StreamDecoder framing;
    private final ElementDecoder<T> decoder;
    private final Deadline deadline;
    private final String description;

    private ByteBuffer current;
    private T next;
    private volatile boolean done;
    private volatile boolean closed;
    private int count;

    ResponseStream(ByteChunkSubscriber body, StreamDecoder framing, ElementDecoder<T> decoder, Deadline deadline, String description) {
        this.body = body;
        this.framing = framing;
        this.decoder = decoder;
        this.deadline = deadline;
        this.description = description;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (done) return false;
        try {
            next = advance();
        } catch (GenerativeAIException e) {
            close();
            throw e;
        }
        return next != null;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        T value = next;
        next = null;
        return value;
    }

    /**
     * Returns a sequential stream over the remaining elements; closing it closes this response stream.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    /** Aborts the exchange if it is still running. Idempotent. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        done = true;
        next = null;
        body.cancel();
    }

    private T advance() {
        while (true) {
            if (closed) return null;
            if (current != null && current.hasRemaining()) {
                byte[] element = framing.next(current);
                if (element != null) {
                    if (deadline.expired()) {
                        close();
                        throw new RequestTimeoutException(description + " not completed within " + deadline.timeout());
                    }
                    count++;
                    return decoder.decode(element);
                }
                continue;
            }
            current = body.poll(deadline);
            if (current == null) {
                if (closed) return null;
                framing.finish();
                done = true;
                closed = true;
                log.debug("{} completed with {} element(s)", description, count);
                return null;
            }
        }
    }
}
