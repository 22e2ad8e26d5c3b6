package com.ryuqq.hustle.testkit;

import com.ryuqq.hustle.core.retry.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays without blocking.
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    /**
     * Returns the requested delays in call order.
     *
     * @return snapshot of recorded delays
     */
    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    /**
     * Returns the number of sleep calls.
     *
     * @return sleep call count
     */
    public int count() {
        return sleeps.size();
    }

    /**
     * Returns the sum of all requested delays.
     *
     * @return total requested delay
     */
    public Duration total() {
        Duration total = Duration.ZERO;
        for (Duration sleep : sleeps) {
            total = total.plus(sleep);
        }
        return total;
    }

    /**
     * Clears recorded delays.
     */
    public void clear() {
        sleeps.clear();
    }
}
