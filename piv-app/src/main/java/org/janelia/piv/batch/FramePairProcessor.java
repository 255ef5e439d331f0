package org.janelia.piv.batch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.piv.util.FileSetFinder;
import org.janelia.piv.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and processes large sets of frame pairs from conventional double pulse PIV acquisitions.
 *
 * First and second frames are found with separate glob patterns (e.g. "img_*_a.png" and "img_*_b.png").
 * Each set of matches is sorted by full path and the two sets are then paired by position,
 * so the patterns must enumerate corresponding frames in the same relative order.
 * Pairs are discovered once at construction time.
 *
 * Example:
 * <pre>
 *     final FramePairProcessor processor =
 *             new FramePairProcessor(Paths.get("/data/run_1"), "img_*_a.png", "img_*_b.png");
 *     processor.run(pair -> derive(pair, outputDir.resolve(pair.getOutputFileName("result_", "txt"))), 8);
 * </pre>
 *
 * @author Eric Trautman
 */
public class FramePairProcessor {

    public enum State {
        /** Pairs have been discovered and validated. */
        CONSTRUCTED,
        /** {@link #run} has been called at least once. */
        COMPLETED
    }

    private final Path baseDirectory;
    private final List<Path> filesA;
    private final List<Path> filesB;
    private final List<FramePair> framePairs;
    private volatile State state;

    /**
     * @param  baseDirectory  directory containing the frame files.
     * @param  patternA       glob pattern matching first frames (relative to baseDirectory).
     * @param  patternB       glob pattern matching second frames (relative to baseDirectory).
     *
     * @throws NoFilesFoundException
     *   if either pattern does not match any files.
     *
     * @throws MismatchedCountException
     *   if the patterns match a different number of files.
     *
     * @throws UncheckedIOException
     *   if the base directory cannot be read.
     */
    public FramePairProcessor(final Path baseDirectory,
                              final String patternA,
                              final String patternB)
            throws NoFilesFoundException, MismatchedCountException, UncheckedIOException {

        final FileSetFinder finder = new FileSetFinder(baseDirectory);
        this.baseDirectory = finder.getBaseDirectory();

        try {
            this.filesA = Collections.unmodifiableList(finder.find(patternA));
            this.filesB = Collections.unmodifiableList(finder.find(patternB));
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to read frame files from " + this.baseDirectory, e);
        }

        if (filesA.isEmpty() || filesB.isEmpty()) {
            throw new NoFilesFoundException(this.baseDirectory, patternA, patternB);
        }

        if (filesA.size() != filesB.size()) {
            throw new MismatchedCountException(filesA.size(), filesB.size());
        }

        final List<FramePair> pairs = new ArrayList<>(filesA.size());
        for (int i = 0; i < filesA.size(); i++) {
            pairs.add(new FramePair(filesA.get(i), filesB.get(i), i));
        }
        this.framePairs = Collections.unmodifiableList(pairs);
        this.state = State.CONSTRUCTED;

        LOG.info("FramePairProcessor: found {} frame pairs in {}", framePairs.size(), this.baseDirectory);
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public List<Path> getFilesA() {
        return filesA;
    }

    public List<Path> getFilesB() {
        return filesB;
    }

    /**
     * @return all pairs in index order.
     */
    public List<FramePair> getFramePairs() {
        return framePairs;
    }

    public int getNumberOfPairs() {
        return framePairs.size();
    }

    public State getState() {
        return state;
    }

    /**
     * Applies the specified function to every frame pair.
     *
     * With a single thread, pairs are processed in index order within the calling thread
     * and processing stops at the first failure (use this for debugging).
     * With multiple threads, pairs are processed by a fixed size pool in no particular order,
     * every pair is attempted, and all failures are reported together once the batch is done.
     *
     * @param  function         work to perform for each pair.
     * @param  numberOfThreads  number of pairs to process concurrently.
     *
     * @return summary of the completed batch.
     *
     * @throws IllegalArgumentException
     *   if numberOfThreads is less than 1.
     *
     * @throws FramePairProcessingException
     *   if any pair fails to process or the calling thread is interrupted while waiting.
     */
    public FramePairBatchSummary run(final FramePairFunction function,
                                     final int numberOfThreads)
            throws IllegalArgumentException, FramePairProcessingException {

        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be > 0, but is " + numberOfThreads);
        }

        LOG.info("run: entry, processing {} pairs with {} thread(s)", framePairs.size(), numberOfThreads);

        final ProcessTimer processTimer = new ProcessTimer();
        state = State.COMPLETED;

        if (numberOfThreads == 1) {
            runSequentially(function, processTimer);
        } else {
            runInParallel(function, numberOfThreads, processTimer);
        }

        final FramePairBatchSummary summary =
                new FramePairBatchSummary(framePairs.size(), numberOfThreads, processTimer.getElapsedMilliseconds());

        LOG.info("run: exit, processed {} pairs in {}", framePairs.size(), processTimer);

        return summary;
    }

    private void runSequentially(final FramePairFunction function,
                                 final ProcessTimer processTimer)
            throws FramePairProcessingException {

        for (final FramePair pair : framePairs) {
            try {
                function.process(pair);
            } catch (final Throwable e) {
                LOG.error("runSequentially: failed to process pair " + pair, e);
                throw new FramePairProcessingException(framePairs.size(),
                                                       Collections.singletonList(
                                                               new FramePairProcessingException.Failure(pair, e)));
            }

            if (processTimer.isLogDue()) {
                LOG.info("runSequentially: processed {} of {} pairs", pair.getIndex() + 1, framePairs.size());
            }
        }
    }

    private void runInParallel(final FramePairFunction function,
                               final int numberOfThreads,
                               final ProcessTimer processTimer)
            throws FramePairProcessingException {

        final AtomicInteger processedCount = new AtomicInteger(0);
        final List<Callable<Void>> workers = new ArrayList<>(framePairs.size());
        for (final FramePair pair : framePairs) {
            workers.add(() -> {
                function.process(pair);
                final int count = processedCount.incrementAndGet();
                if (processTimer.isLogDue()) {
                    LOG.info("runInParallel: processed {} of {} pairs", count, framePairs.size());
                }
                return null;
            });
        }

        final List<FramePairProcessingException.Failure> failures = new ArrayList<>();

        final ExecutorService executorService = Executors.newFixedThreadPool(numberOfThreads);
        try {

            final List<Future<Void>> futures = executorService.invokeAll(workers);

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (final ExecutionException e) {
                    final FramePair pair = framePairs.get(i);
                    LOG.error("runInParallel: failed to process pair " + pair, e.getCause());
                    failures.add(new FramePairProcessingException.Failure(pair, e.getCause()));
                }
            }

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FramePairProcessingException(framePairs.size(),
                                                   "interrupted after processing " + processedCount.get() +
                                                   " of " + framePairs.size() + " pairs",
                                                   e);
        } finally {
            executorService.shutdownNow();
        }

        if (! failures.isEmpty()) {
            throw new FramePairProcessingException(framePairs.size(), failures);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FramePairProcessor.class);
}
