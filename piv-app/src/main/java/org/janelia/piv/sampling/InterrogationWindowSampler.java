package org.janelia.piv.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects a subset of interrogation windows for display on top of a map of interrogation points.
 *
 * The windows of a typical grid overlap, so showing all of them hides the layout.
 * The {@link Method#STANDARD} method picks a staggered subset and
 * the {@link Method#RANDOM} method picks windows at random.
 *
 * @author Eric Trautman
 */
public class InterrogationWindowSampler {

    public enum Method {
        /** Uniformly picked windows: every (skip + 1)th column, offset by one on odd rows. */
        STANDARD,
        /** (columns * rows) / (skip + 1) randomly picked windows, repeats allowed. */
        RANDOM
    }

    /**
     * Interrogation points and the windows picked for display.
     */
    public static class Sampling {

        private final int numberOfPoints;
        private final List<InterrogationWindow> windows;

        public Sampling(final int numberOfPoints,
                        final List<InterrogationWindow> windows) {
            this.numberOfPoints = numberOfPoints;
            this.windows = Collections.unmodifiableList(windows);
        }

        public int getNumberOfPoints() {
            return numberOfPoints;
        }

        public List<InterrogationWindow> getWindows() {
            return windows;
        }

        /**
         * @return true if only the interrogation points should be shown.
         */
        public boolean isPointsOnly() {
            return windows.isEmpty();
        }
    }

    private final double[] columnCenters;
    private final double[] rowCenters;
    private final double windowSize;

    /**
     * @param  columnCenters  x coordinates of window centers for each grid column.
     * @param  rowCenters     y coordinates of window centers for each grid row.
     * @param  windowSize     interrogation window size in pixels.
     */
    public InterrogationWindowSampler(final double[] columnCenters,
                                      final double[] rowCenters,
                                      final double windowSize) {
        if ((columnCenters == null) || (rowCenters == null)) {
            throw new IllegalArgumentException("column and row centers must be specified");
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0, but is " + windowSize);
        }
        this.columnCenters = columnCenters.clone();
        this.rowCenters = rowCenters.clone();
        this.windowSize = windowSize;
    }

    public int getNumberOfPoints() {
        return columnCenters.length * rowCenters.length;
    }

    /**
     * @param  skip    number of windows to skip on a row (0 or 1 is typical for STANDARD, use -1 to show no windows).
     * @param  method  selection method.
     * @param  random  random source for the {@link Method#RANDOM} method (ignored otherwise).
     *
     * @return the selected windows (empty if skip is negative or larger than the number of points).
     *
     * @throws IllegalArgumentException
     *   if method is null or random is null for the RANDOM method.
     */
    public Sampling sample(final int skip,
                           final Method method,
                           final Random random)
            throws IllegalArgumentException {

        if (method == null) {
            throw new IllegalArgumentException("method must be specified (STANDARD or RANDOM)");
        }

        final int numberOfPoints = getNumberOfPoints();
        final List<InterrogationWindow> windows = new ArrayList<>();

        if ((skip < 0) || (skip + 1 > numberOfPoints)) {

            LOG.debug("sample: skip {} excludes all windows, only showing {} points", skip, numberOfPoints);

        } else if (method == Method.STANDARD) {

            final int step = skip + 1;
            for (int column = 0; column < columnCenters.length; column++) {
                for (int row = 0; row < rowCenters.length; row++) {
                    final boolean include;
                    if (row % 2 == 0) {
                        include = (column % step == 0);
                    } else {
                        include = (column % step == 1) || (skip == 0);
                    }
                    if (include) {
                        windows.add(buildWindow(column, row));
                    }
                }
            }

        } else {

            if (random == null) {
                throw new IllegalArgumentException("random source must be specified for the RANDOM method");
            }

            final int numberOfWindows = numberOfPoints / (skip + 1);
            for (int i = 0; i < numberOfWindows; i++) {
                final int column = random.nextInt(columnCenters.length);
                final int row = random.nextInt(rowCenters.length);
                windows.add(buildWindow(column, row));
            }

        }

        return new Sampling(numberOfPoints, windows);
    }

    private InterrogationWindow buildWindow(final int column,
                                            final int row) {
        return new InterrogationWindow(column, row, columnCenters[column], rowCenters[row], windowSize);
    }

    private static final Logger LOG = LoggerFactory.getLogger(InterrogationWindowSampler.class);
}
