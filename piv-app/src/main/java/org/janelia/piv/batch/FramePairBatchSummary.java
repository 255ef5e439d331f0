package org.janelia.piv.batch;

import java.io.Serializable;

/**
 * Summary of a completed batch run.
 *
 * @author Eric Trautman
 */
public class FramePairBatchSummary
        implements Serializable {

    private final int numberOfPairs;
    private final int numberOfThreads;
    private final long elapsedMilliseconds;

    public FramePairBatchSummary(final int numberOfPairs,
                                 final int numberOfThreads,
                                 final long elapsedMilliseconds) {
        this.numberOfPairs = numberOfPairs;
        this.numberOfThreads = numberOfThreads;
        this.elapsedMilliseconds = elapsedMilliseconds;
    }

    public int getNumberOfPairs() {
        return numberOfPairs;
    }

    public int getNumberOfThreads() {
        return numberOfThreads;
    }

    public long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    @Override
    public String toString() {
        return "{numberOfPairs: " + numberOfPairs +
               ", numberOfThreads: " + numberOfThreads +
               ", elapsedMilliseconds: " + elapsedMilliseconds + '}';
    }
}
