package dev.idbroker.transport;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide, fire-once shutdown broadcast. Subscribers are notified exactly once, including
 * those that subscribe after the signal has fired.
 */
public final class ShutdownSignal {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShutdownSignal.class);

    private final AtomicBoolean fired = new AtomicBoolean();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();

    public void subscribe(Runnable subscriber) {
        Subscription subscription = new Subscription(subscriber);
        subscribers.add(subscription);
        if (fired.get()) {
            subscription.notifyOnce();
        }
    }

    public void fire() {
        if (!fired.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutdown signal fired, notifying {} subscriber(s)", subscribers.size());
        latch.countDown();
        for (Subscription subscription : subscribers) {
            subscription.notifyOnce();
        }
    }

    public boolean isFired() {
        return fired.get();
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static final class Subscription {

        private final Runnable subscriber;
        private final AtomicBoolean notified = new AtomicBoolean();

        Subscription(Runnable subscriber) {
            this.subscriber = subscriber;
        }

        void notifyOnce() {
            if (!notified.compareAndSet(false, true)) {
                return;
            }
            try {
                subscriber.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Shutdown subscriber failed", e);
            }
        }
    }
}
