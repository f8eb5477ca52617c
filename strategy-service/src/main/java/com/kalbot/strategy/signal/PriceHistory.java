package com.kalbot.strategy.signal;

import com.kalbot.strategy.model.PriceSample;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Optional;

/**
 * BTC spot samples retained for one momentum window.
 *
 * <p>Samples are stamped when the price arrives, which may be later than the cycle clock that
 * queries them. Retention therefore runs one extra window behind the newest sample: the newest
 * sample at or before {@code latest - 2 * window} plus everything after it. Any lookup at
 * {@code now - window} with {@code now >= latest - window} still finds its reference.
 */
public class PriceHistory {

    private final Duration window;
    private final Duration retention;
    private final LinkedList<PriceSample> samples = new LinkedList<>();

    public PriceHistory(long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0");
        }
        this.window = Duration.ofSeconds(windowSeconds);
        this.retention = window.multipliedBy(2);
    }

    public long windowSeconds() {
        return window.getSeconds();
    }

    /**
     * Appends a sample; samples without a positive price are ignored.
     */
    public void add(PriceSample sample) {
        if (sample == null || sample.time() == null || sample.price() == null || sample.price().signum() <= 0) {
            return;
        }
        PriceSample last = samples.peekLast();
        if (last != null && sample.time().isBefore(last.time())) {
            return;
        }
        samples.addLast(sample);
        prune(sample.time().minus(retention));
    }

    void prune(Instant cutoff) {
        while (samples.size() >= 2 && !samples.get(1).time().isAfter(cutoff)) {
            samples.removeFirst();
        }
    }

    public Optional<PriceSample> latest() {
        return Optional.ofNullable(samples.peekLast());
    }

    /**
     * Newest sample taken at or before {@code cutoff}.
     */
    public Optional<PriceSample> atOrBefore(Instant cutoff) {
        Iterator<PriceSample> it = samples.descendingIterator();
        while (it.hasNext()) {
            PriceSample sample = it.next();
            if (!sample.time().isAfter(cutoff)) {
                return Optional.of(sample);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return samples.size();
    }
}
