package org.janelia.piv.client;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.piv.batch.FramePairBatchSummary;
import org.janelia.piv.client.parameter.CommandLineParameters;
import org.janelia.piv.image.FrameImageUtil;
import org.janelia.piv.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FrameNegativeClient} class.
 *
 * @author Eric Trautman
 */
public class FrameNegativeClientTest {

    private Path testDirectory;

    @Before
    public void setUp() throws Exception {
        testDirectory = Files.createTempDirectory("frame_negative_client_test_");
    }

    @After
    public void tearDown() {
        FileUtil.deleteRecursive(testDirectory.toFile());
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new FrameNegativeClient.Parameters());
    }

    @Test
    public void testWriteNegatives() throws Exception {

        final File dataDirectory = new File(testDirectory.toFile(), "frames");
        final File outputDirectory = new File(testDirectory.toFile(), "negatives");

        for (int i = 0; i < 3; i++) {
            FrameImageUtil.saveImage(buildFrame(i * 10),
                                     new File(dataDirectory, String.format("exp1_%03d_a.tif", i)).getAbsolutePath());
            FrameImageUtil.saveImage(buildFrame(i * 10 + 5),
                                     new File(dataDirectory, String.format("exp1_%03d_b.tif", i)).getAbsolutePath());
        }

        final FrameNegativeClient.Parameters parameters = new FrameNegativeClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--dataDirectory", dataDirectory.getAbsolutePath(),
                "--patternA", "exp1_*_a.tif",
                "--patternB", "exp1_*_b.tif",
                "--numberOfThreads", "2",
                "--outputDirectory", outputDirectory.getAbsolutePath(),
                "--format", "tif"
        }, FrameNegativeClient.class, false);

        Assert.assertTrue("parameters should be parsed", parsed);

        final FramePairBatchSummary summary = new FrameNegativeClient(parameters).writeNegatives();

        Assert.assertEquals("invalid number of pairs processed", 3, summary.getNumberOfPairs());

        final ImageProcessor negativeB1 =
                FrameImageUtil.readImage(new File(outputDirectory, "negative_b_0001.tif").getAbsolutePath());
        Assert.assertEquals("invalid negative value", 255 - 15, negativeB1.get(0));

        for (int i = 0; i < 3; i++) {
            for (final String prefix : new String[] { "negative_a_", "negative_b_" }) {
                final File negativeFile = new File(outputDirectory, String.format("%s%04d.tif", prefix, i));
                Assert.assertTrue(negativeFile + " should exist", negativeFile.exists());
            }
        }
    }

    private static ByteProcessor buildFrame(final int value) {
        final ByteProcessor frame = new ByteProcessor(8, 8);
        frame.setValue(value);
        frame.fill();
        return frame;
    }

    public static void main(final String[] args) {

        final String[] effectiveArgs = (args != null) && (args.length > 0) ? args : new String[] {
                "--dataDirectory", "/tmp/piv/exp1",
                "--patternA", "exp1_*_a.bmp",
                "--patternB", "exp1_*_b.bmp",
                "--numberOfThreads", "4",
                "--outputDirectory", "/tmp/piv/exp1_negatives"
        };

        FrameNegativeClient.main(effectiveArgs);
    }
}
