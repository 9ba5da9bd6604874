package org.janelia.pixel.util;

/**
 * Utility to track elapsed processing time.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long totalMilliseconds = getElapsedMilliseconds();
        final long totalSeconds = totalMilliseconds / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = totalMilliseconds % 1000;
        return minutes + " minutes, " + seconds + " seconds, " + milliseconds + " milliseconds";
    }
}
