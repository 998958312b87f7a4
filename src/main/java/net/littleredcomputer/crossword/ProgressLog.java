package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Rate-limited progress reporting for long searches.
 */
class ProgressLog {
    private static final Logger log = LogManager.getFormatterLogger(ProgressLog.class);
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private long lastStepCount;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    ProgressLog(String name) {
        this.name = name;
    }

    void setLogInterval(Duration interval) { logInterval = interval; }

    void start(long stepCount) {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    Stopwatch elapsed() { return stopwatch; }

    void maybeReport(long stepCount, Supplier<String> s) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(tween.toMillis(), 1);
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %s", name, stepCount, stopwatch, perSec, s.get()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
