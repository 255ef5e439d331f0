package org.janelia.piv.util;

/**
 * Tracks elapsed time for a process and supports periodic progress logging.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    public static final long DEFAULT_LOG_INTERVAL = 5000;

    private final long logInterval;
    private final long start;
    private long lastLogTime;

    public ProcessTimer() {
        this(DEFAULT_LOG_INTERVAL);
    }

    /**
     * @param  logInterval  minimum number of milliseconds between {@link #isLogDue} true results.
     */
    public ProcessTimer(final long logInterval) {
        this.logInterval = logInterval;
        this.start = System.currentTimeMillis();
        this.lastLogTime = this.start;
    }

    /**
     * @return true if the log interval has passed since the last time this method returned true
     *         (or since the timer was created).
     */
    public synchronized boolean isLogDue() {
        final long now = System.currentTimeMillis();
        final boolean isDue = (now - lastLogTime) > logInterval;
        if (isDue) {
            lastLogTime = now;
        }
        return isDue;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedMilliseconds() / 1000;
        final long hours = totalSeconds / 3600;
        final long minutes = (totalSeconds / 60) % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
