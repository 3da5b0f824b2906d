package com.delta.webcrawler.crawl.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Collects a response body up to {@code cap} bytes. Once the cap is crossed the subscription is
 * cancelled and the body completes as truncated, so an oversized body is never buffered in full.
 */
final class CappedBodySubscriber implements HttpResponse.BodySubscriber<CappedBodySubscriber.Body> {

    record Body(byte[] bytes, boolean truncated) {
    }

    private final long cap;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CompletableFuture<Body> result = new CompletableFuture<>();
    private Flow.Subscription subscription;

    CappedBodySubscriber(long cap) {
        this.cap = Math.max(0L, cap);
    }

    /**
     * A 2xx response whose declared length already exceeds the cap is cut off at the first chunk.
     * Error responses are only capped; their size never turns them into a too-large failure.
     */
    static HttpResponse.BodyHandler<Body> handler(long cap) {
        return responseInfo -> {
            int status = responseInfo.statusCode();
            long declaredLength = responseInfo.headers().firstValueAsLong("Content-Length").orElse(-1L);
            boolean successful = status >= 200 && status < 300;
            return new CappedBodySubscriber(successful && declaredLength > cap ? 0L : cap);
        };
    }

    @Override
    public CompletionStage<Body> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        if (this.subscription != null) {
            subscription.cancel();
            return;
        }
        this.subscription = subscription;
        subscription.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        if (result.isDone()) {
            return;
        }
        for (ByteBuffer item : items) {
            int room = (int) Math.min(Integer.MAX_VALUE - 8L, cap - buffer.size());
            if (item.remaining() > room) {
                byte[] part = new byte[room];
                item.get(part);
                buffer.writeBytes(part);
                subscription.cancel();
                result.complete(new Body(buffer.toByteArray(), true));
                return;
            }
            byte[] chunk = new byte[item.remaining()];
            item.get(chunk);
            buffer.writeBytes(chunk);
        }
        subscription.request(1);
    }

    @Override
    public void onError(Throwable throwable) {
        result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
        result.complete(new Body(buffer.toByteArray(), false));
    }
}
