package org.janelia.piv.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when one or more frame pairs could not be processed.
 * Identifies every failed pair so that those pairs can be isolated and re-run.
 *
 * @author Eric Trautman
 */
public class FramePairProcessingException
        extends IllegalStateException {

    /**
     * A single pair that failed along with the reason it failed.
     */
    public static class Failure {

        private final FramePair pair;
        private final Throwable cause;

        public Failure(final FramePair pair,
                       final Throwable cause) {
            this.pair = pair;
            this.cause = cause;
        }

        public FramePair getPair() {
            return pair;
        }

        public Throwable getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return pair + " failed with " + cause;
        }
    }

    private final int totalNumberOfPairs;
    private final transient List<Failure> failures;

    public FramePairProcessingException(final int totalNumberOfPairs,
                                        final List<Failure> failures) {
        super(buildMessage(totalNumberOfPairs, sortByIndex(failures)),
              failures.size() == 1 ? failures.get(0).getCause() : null);

        this.totalNumberOfPairs = totalNumberOfPairs;
        this.failures = Collections.unmodifiableList(sortByIndex(failures));

        if (this.failures.size() > 1) {
            this.failures.stream()
                    .filter(failure -> failure.getCause() != null)
                    .forEach(failure -> addSuppressed(failure.getCause()));
        }
    }

    /**
     * Constructs an exception for a batch that was stopped before all pairs could be processed.
     */
    public FramePairProcessingException(final int totalNumberOfPairs,
                                        final String message,
                                        final Throwable cause) {
        super(message, cause);
        this.totalNumberOfPairs = totalNumberOfPairs;
        this.failures = Collections.emptyList();
    }

    public int getTotalNumberOfPairs() {
        return totalNumberOfPairs;
    }

    /**
     * @return failures sorted by pair index.
     */
    public List<Failure> getFailures() {
        return failures;
    }

    public List<Integer> getFailedIndexes() {
        return failures.stream().map(f -> f.getPair().getIndex()).collect(Collectors.toList());
    }

    private static List<Failure> sortByIndex(final List<Failure> failures) {
        final List<Failure> sortedList = new ArrayList<>(failures);
        sortedList.sort(Comparator.comparingInt(f -> f.getPair().getIndex()));
        return sortedList;
    }

    private static String buildMessage(final int totalNumberOfPairs,
                                       final List<Failure> sortedFailures) {
        final StringBuilder sb = new StringBuilder();
        sb.append(sortedFailures.size()).append(" out of ").append(totalNumberOfPairs)
                .append(" frame pairs failed to process, failed indexes are ")
                .append(sortedFailures.stream()
                                .map(f -> String.valueOf(f.getPair().getIndex()))
                                .collect(Collectors.joining(", ", "[", "]")));
        for (final Failure failure : sortedFailures) {
            sb.append("\n  ").append(failure);
        }
        return sb.toString();
    }
}
