package io.generativeai.http.spi;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Flow;

/**
 * Wraps a body publisher so failures reach the subscriber as {@link HttpClientException}.
 */
final class TranslatingPublisher implements Flow.Publisher<List<ByteBuffer>> {

    private final Flow.Publisher<List<ByteBuffer>> delegate;
    private final Duration timeout;

    TranslatingPublisher(Flow.Publisher<List<ByteBuffer>> delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
    }

    @Override
    public void subscribe(Flow.Subscriber<? super List<ByteBuffer>> subscriber) {
        delegate.subscribe(new Flow.Subscriber<List<ByteBuffer>>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscriber.onSubscribe(subscription);
            }

            @Override
            public void onNext(List<ByteBuffer> item) {
                subscriber.onNext(item);
            }

            @Override
            public void onError(Throwable throwable) {
                subscriber.onError(HttpClientException.translate(throwable, timeout));
            }

            @Override
            public void onComplete() {
                subscriber.onComplete();
            }
        });
    }
}
