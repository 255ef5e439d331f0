package org.janelia.piv.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;

import org.janelia.piv.batch.FramePair;
import org.janelia.piv.batch.FramePairBatchSummary;
import org.janelia.piv.batch.FramePairProcessor;
import org.janelia.piv.client.parameter.CommandLineParameters;
import org.janelia.piv.client.parameter.FramePairParameters;
import org.janelia.piv.image.FrameImageUtil;
import org.janelia.piv.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for writing negatives of frame pairs (useful as dark-on-light backgrounds for vector plots).
 *
 * @author Eric Trautman
 */
public class FrameNegativeClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public FramePairParameters framePairs = new FramePairParameters();

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for negative images",
                required = true)
        public String outputDirectory;

        @Parameter(
                names = "--format",
                description = "Format for negative images (png, tif, jpg, ...)")
        public String format = "png";
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final FrameNegativeClient client = new FrameNegativeClient(parameters);
                client.writeNegatives();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final File outputDirectory;

    FrameNegativeClient(final Parameters parameters) {
        this.parameters = parameters;
        this.outputDirectory = new File(parameters.outputDirectory).getAbsoluteFile();
    }

    FramePairBatchSummary writeNegatives() {

        FileUtil.ensureWritableDirectory(outputDirectory);

        final FramePairProcessor processor = parameters.framePairs.buildProcessor();
        return processor.run(this::writeNegativesForPair, parameters.framePairs.numberOfThreads);
    }

    private void writeNegativesForPair(final FramePair pair)
            throws IOException {

        LOG.debug("writeNegativesForPair: entry, pair={}", pair);

        writeNegative(pair.getPathA().toString(), pair.getOutputFileName("negative_a_", parameters.format));
        writeNegative(pair.getPathB().toString(), pair.getOutputFileName("negative_b_", parameters.format));
    }

    private void writeNegative(final String sourcePath,
                               final String targetName)
            throws IOException {
        final ImageProcessor source = FrameImageUtil.readImage(sourcePath, true);
        final File targetFile = new File(outputDirectory, targetName);
        FrameImageUtil.saveImage(FrameImageUtil.negative(source), targetFile.getAbsolutePath());
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameNegativeClient.class);
}
