package com.williamcallahan.keycoordinator.support;

import com.williamcallahan.keycoordinator.service.retry.Sleeper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested delays and advances an optional test clock instead of blocking.
 */
public final class RecordingSleeper implements Sleeper {
    private final List<Duration> sleeps = new ArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public synchronized List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }
}
