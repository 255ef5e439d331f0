package org.janelia.piv.batch;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.janelia.piv.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FramePairProcessor} class.
 *
 * @author Eric Trautman
 */
public class FramePairProcessorTest {

    private Path testDirectory;

    @Before
    public void setUp() throws Exception {
        testDirectory = Files.createTempDirectory("frame_pair_processor_test_");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory.toFile());
    }

    @Test
    public void testPairingByPosition() throws Exception {

        // create out of order to make sure discovery sorts
        createFiles("img_001_b.png", "img_000_a.png", "img_001_a.png", "img_000_b.png", "notes.txt");

        final FramePairProcessor processor = new FramePairProcessor(testDirectory, "img_*_a.png", "img_*_b.png");

        final List<FramePair> expectedPairs = Arrays.asList(
                new FramePair(testDirectory.resolve("img_000_a.png"), testDirectory.resolve("img_000_b.png"), 0),
                new FramePair(testDirectory.resolve("img_001_a.png"), testDirectory.resolve("img_001_b.png"), 1));

        Assert.assertEquals("invalid number of pairs", 2, processor.getNumberOfPairs());
        Assert.assertEquals("invalid pairs", expectedPairs, processor.getFramePairs());
        Assert.assertEquals("invalid number of first frames", 2, processor.getFilesA().size());
        Assert.assertEquals("invalid number of second frames", 2, processor.getFilesB().size());
        Assert.assertEquals("invalid state", FramePairProcessor.State.CONSTRUCTED, processor.getState());

        for (final FramePair pair : processor.getFramePairs()) {
            Assert.assertTrue("path should be absolute for " + pair, pair.getPathA().isAbsolute());
        }
    }

    @Test
    public void testDiscoveryIsDeterministic() throws Exception {

        createFiles("c_a.tif", "a_a.tif", "b_a.tif", "b_b.tif", "c_b.tif", "a_b.tif");

        final FramePairProcessor first = new FramePairProcessor(testDirectory, "*_a.tif", "*_b.tif");
        final FramePairProcessor second = new FramePairProcessor(testDirectory, "*_a.tif", "*_b.tif");

        Assert.assertEquals("pairs should be identical", first.getFramePairs(), second.getFramePairs());
        Assert.assertEquals("first pair should come from lexicographically smallest path",
                            testDirectory.resolve("a_a.tif"), first.getFramePairs().get(0).getPathA());
    }

    @Test
    public void testMismatchedCount() throws Exception {

        createFiles("img_000_a.png", "img_001_a.png", "img_000_b.png", "img_001_b.png", "img_002_b.png");

        try {
            new FramePairProcessor(testDirectory, "img_*_a.png", "img_*_b.png");
            Assert.fail("mismatched counts should cause exception");
        } catch (final MismatchedCountException e) {
            Assert.assertEquals("invalid first frame count", 2, e.getCountA());
            Assert.assertEquals("invalid second frame count", 3, e.getCountB());
        }
    }

    @Test(expected = NoFilesFoundException.class)
    public void testNoFilesFound() throws Exception {
        createFiles("img_000_a.png", "img_000_b.png");
        new FramePairProcessor(testDirectory, "*.bmp", "*.jpg");
    }

    @Test(expected = NoFilesFoundException.class)
    public void testNoSecondFramesFound() throws Exception {
        createFiles("img_000_a.png", "img_001_a.png");
        new FramePairProcessor(testDirectory, "img_*_a.png", "img_*_b.png");
    }

    @Test(expected = NoFilesFoundException.class)
    public void testMissingDirectory() {
        new FramePairProcessor(testDirectory.resolve("missing"), "*_a.png", "*_b.png");
    }

    @Test
    public void testSymbolicLinkLoopOutsidePatternIsIgnored() throws Exception {

        Files.createDirectories(testDirectory.resolve("run_1"));
        createFiles("run_1/f_000_a.tif", "run_1/f_000_b.tif");
        Files.createSymbolicLink(testDirectory.resolve("zz_loop"), testDirectory);

        final FramePairProcessor processor = new FramePairProcessor(testDirectory, "run_*/*_a.tif", "run_*/*_b.tif");

        Assert.assertEquals("invalid pairs",
                            Collections.singletonList(new FramePair(testDirectory.resolve("run_1/f_000_a.tif"),
                                                                    testDirectory.resolve("run_1/f_000_b.tif"),
                                                                    0)),
                            processor.getFramePairs());
    }

    @Test
    public void testSequentialRunOrder() throws Exception {

        final FramePairProcessor processor = buildProcessor(6);

        final List<Integer> processedIndexes = new ArrayList<>();
        final Thread callingThread = Thread.currentThread();

        final FramePairBatchSummary summary = processor.run(pair -> {
            Assert.assertSame("sequential run should use calling thread", callingThread, Thread.currentThread());
            processedIndexes.add(pair.getIndex());
        }, 1);

        Assert.assertEquals("pairs should be processed in index order",
                            Arrays.asList(0, 1, 2, 3, 4, 5), processedIndexes);
        Assert.assertEquals("invalid summary pair count", 6, summary.getNumberOfPairs());
        Assert.assertEquals("invalid summary thread count", 1, summary.getNumberOfThreads());
        Assert.assertEquals("invalid state", FramePairProcessor.State.COMPLETED, processor.getState());
    }

    @Test
    public void testSequentialRunStopsAtFirstFailure() throws Exception {

        final FramePairProcessor processor = buildProcessor(5);

        final List<Integer> processedIndexes = new ArrayList<>();
        final IllegalStateException failure = new IllegalStateException("bad frame");

        try {
            processor.run(pair -> {
                processedIndexes.add(pair.getIndex());
                if (pair.getIndex() == 1) {
                    throw failure;
                }
            }, 1);
            Assert.fail("failure should have been propagated");
        } catch (final FramePairProcessingException e) {
            Assert.assertEquals("invalid failed indexes", Collections.singletonList(1), e.getFailedIndexes());
            Assert.assertSame("original exception should be the cause", failure, e.getCause());
            Assert.assertEquals("failed pair should be identified",
                                processor.getFramePairs().get(1), e.getFailures().get(0).getPair());
        }

        Assert.assertEquals("processing should stop after failure", Arrays.asList(0, 1), processedIndexes);
        Assert.assertEquals("failed run should still complete processor",
                            FramePairProcessor.State.COMPLETED, processor.getState());
    }

    @Test
    public void testSequentialRunIdentifiesPairForErrors() throws Exception {

        final FramePairProcessor processor = buildProcessor(3);

        try {
            processor.run(pair -> {
                if (pair.getIndex() == 2) {
                    throw new AssertionError("corrupt frame");
                }
            }, 1);
            Assert.fail("error should have been propagated");
        } catch (final FramePairProcessingException e) {
            Assert.assertEquals("invalid failed indexes", Collections.singletonList(2), e.getFailedIndexes());
            Assert.assertTrue("cause should be original error", e.getCause() instanceof AssertionError);
        }
    }

    @Test
    public void testParallelRunProcessesEachPairOnce() throws Exception {

        final int numberOfPairs = 40;
        final FramePairProcessor processor = buildProcessor(numberOfPairs);

        final Map<Integer, AtomicInteger> indexToCount = new ConcurrentHashMap<>();
        final Map<String, Boolean> threadNames = new ConcurrentHashMap<>();

        final FramePairBatchSummary summary = processor.run(pair -> {
            indexToCount.computeIfAbsent(pair.getIndex(), k -> new AtomicInteger(0)).incrementAndGet();
            threadNames.put(Thread.currentThread().getName(), true);
        }, 4);

        Assert.assertEquals("every pair should be processed", numberOfPairs, indexToCount.size());
        for (int i = 0; i < numberOfPairs; i++) {
            Assert.assertEquals("pair " + i + " should be processed exactly once", 1, indexToCount.get(i).get());
        }
        Assert.assertTrue("too many threads used: " + threadNames.keySet(), threadNames.size() <= 4);
        Assert.assertEquals("invalid summary thread count", 4, summary.getNumberOfThreads());
    }

    @Test
    public void testParallelRunReportsFailuresAfterCompletingOtherPairs() throws Exception {

        final FramePairProcessor processor = buildProcessor(5);

        final Map<Integer, Boolean> completedIndexes = new ConcurrentHashMap<>();

        try {
            processor.run(pair -> {
                if (pair.getIndex() == 1) {
                    throw new IOException("failed to read " + pair.getPathA());
                }
                completedIndexes.put(pair.getIndex(), true);
            }, 3);
            Assert.fail("failure should have been reported");
        } catch (final FramePairProcessingException e) {
            Assert.assertEquals("invalid failed indexes", Collections.singletonList(1), e.getFailedIndexes());
            Assert.assertTrue("message should name failed index: " + e.getMessage(),
                              e.getMessage().contains("failed indexes are [1]"));
            Assert.assertTrue("cause should be original exception", e.getCause() instanceof IOException);
            Assert.assertEquals("invalid total pair count", 5, e.getTotalNumberOfPairs());
        }

        Assert.assertEquals("other pairs should complete",
                            new ArrayList<>(Arrays.asList(0, 2, 3, 4)), sorted(completedIndexes.keySet()));
    }

    @Test
    public void testParallelRunReportsAllFailures() throws Exception {

        final FramePairProcessor processor = buildProcessor(8);

        try {
            processor.run(pair -> {
                if ((pair.getIndex() == 6) || (pair.getIndex() == 2)) {
                    throw new IllegalArgumentException("bad pair " + pair.getIndex());
                }
            }, 3);
            Assert.fail("failures should have been reported");
        } catch (final FramePairProcessingException e) {
            Assert.assertEquals("failed indexes should be sorted", Arrays.asList(2, 6), e.getFailedIndexes());
            Assert.assertEquals("each failure should be suppressed", 2, e.getSuppressed().length);
        }
    }

    @Test
    public void testInterruptedParallelRun() throws Exception {

        final FramePairProcessor processor = buildProcessor(4);

        final CountDownLatch startedLatch = new CountDownLatch(1);
        final AtomicReference<Throwable> thrown = new AtomicReference<>();
        final AtomicBoolean interruptFlagRestored = new AtomicBoolean(false);

        final Thread runThread = new Thread(() -> {
            try {
                processor.run(pair -> {
                    startedLatch.countDown();
                    Thread.sleep(60_000);
                }, 2);
            } catch (final Throwable t) {
                thrown.set(t);
                interruptFlagRestored.set(Thread.currentThread().isInterrupted());
            }
        });

        runThread.start();
        Assert.assertTrue("workers never started", startedLatch.await(10, TimeUnit.SECONDS));

        runThread.interrupt();
        runThread.join(10_000);

        Assert.assertFalse("run should finish after interrupt", runThread.isAlive());
        Assert.assertTrue("invalid exception: " + thrown.get(),
                          thrown.get() instanceof FramePairProcessingException);
        Assert.assertTrue("message should mention interrupt: " + thrown.get().getMessage(),
                          thrown.get().getMessage().startsWith("interrupted after processing"));
        Assert.assertTrue("interrupt flag should be restored", interruptFlagRestored.get());
    }

    @Test
    public void testRunCanBeRepeated() throws Exception {

        final FramePairProcessor processor = buildProcessor(3);

        final List<Integer> processedIndexes = Collections.synchronizedList(new ArrayList<>());
        processor.run(pair -> processedIndexes.add(pair.getIndex()), 1);
        processor.run(pair -> processedIndexes.add(pair.getIndex()), 2);

        Assert.assertEquals("second run should replay all pairs", 6, processedIndexes.size());
        Assert.assertEquals("invalid pairs after replay",
                            Arrays.asList(0, 0, 1, 1, 2, 2), sorted(processedIndexes));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidNumberOfThreads() throws Exception {
        buildProcessor(2).run(pair -> {}, 0);
    }

    @Test
    public void testOutputFileName() {
        final FramePair pair = new FramePair(testDirectory.resolve("a.png"), testDirectory.resolve("b.png"), 7);
        Assert.assertEquals("invalid output file name", "result_0007.txt", pair.getOutputFileName("result_", "txt"));
    }

    private FramePairProcessor buildProcessor(final int numberOfPairs)
            throws IOException {
        for (int i = 0; i < numberOfPairs; i++) {
            createFiles(String.format("frame_%03d_a.png", i), String.format("frame_%03d_b.png", i));
        }
        return new FramePairProcessor(testDirectory, "frame_*_a.png", "frame_*_b.png");
    }

    private void createFiles(final String... names)
            throws IOException {
        for (final String name : names) {
            final File file = testDirectory.resolve(name).toFile();
            if (! file.createNewFile()) {
                throw new IOException("failed to create " + file);
            }
        }
    }

    private static List<Integer> sorted(final Collection<Integer> values) {
        final List<Integer> list = new ArrayList<>(values);
        Collections.sort(list);
        return list;
    }
}
