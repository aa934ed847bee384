package net.littleredcomputer.refactor;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/** Counts the steps of a phase and logs the rate now and then. */
final class Progress {
    private static final Logger log = LogManager.getFormatterLogger(Progress.class);

    private final String name;
    private final int total;
    private final Duration logInterval;
    private final Stopwatch stopwatch = Stopwatch.createStarted();
    private Instant lastLogTime = Instant.now();
    private long count;
    private long lastCount;

    Progress(String name, int total, Duration logInterval) {
        this.name = name;
        this.total = total;
        this.logInterval = logInterval;
    }

    void step(Supplier<String> s) {
        ++count;
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (count - lastCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d/%d %s %.0f/sec %s", name, count, total, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastCount = count;
    }

    void done() {
        log.info("%s %d/%d done in %s", name, count, total, stopwatch);
    }
}
