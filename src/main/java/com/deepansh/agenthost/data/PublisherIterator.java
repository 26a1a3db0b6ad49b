package com.deepansh.agenthost.data;

import com.deepansh.agenthost.exception.AgentException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Adapts a push source to a blocking pull iterator. Subscribes lazily on the first
 * {@link #hasNext()} so that an unread container never starts the publisher.
 */
public final class PublisherIterator implements Iterator<Object> {

    private static final Object COMPLETE = new Object();

    private final Flow.Publisher<?> publisher;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private boolean subscribed;
    private Object next;
    private boolean done;

    public PublisherIterator(Flow.Publisher<?> publisher) {
        this.publisher = publisher;
    }

    @Override
    public boolean hasNext() {
        if (done) {
            return false;
        }
        if (next != null) {
            return true;
        }
        subscribeOnce();
        Object item = take();
        if (item == COMPLETE) {
            done = true;
            return false;
        }
        if (item instanceof Failure failure) {
            done = true;
            throw new AgentException("stream source failed: " + failure.error().getMessage(), failure.error());
        }
        next = item;
        return true;
    }

    @Override
    public Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Object item = next;
        next = null;
        return item;
    }

    private void subscribeOnce() {
        if (subscribed) {
            return;
        }
        subscribed = true;
        publisher.subscribe(new Flow.Subscriber<Object>() {
            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(Object item) {
                if (item != null) {
                    queue.add(item);
                }
            }

            @Override
            public void onError(Throwable throwable) {
                queue.add(new Failure(throwable));
            }

            @Override
            public void onComplete() {
                queue.add(COMPLETE);
            }
        });
    }

    private Object take() {
        try {
            return queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("stream read aborted", e);
        }
    }

    private record Failure(Throwable error) {
    }
}
