package org.janelia.piv.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.piv.client.parameter.CommandLineParameters;
import org.janelia.piv.flow.FlowField;
import org.janelia.piv.flow.FlowFieldReader;
import org.janelia.piv.util.FileSetFinder;
import org.janelia.piv.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for summarizing the number of total and invalid vectors in saved flow field files.
 *
 * @author Eric Trautman
 */
public class FlowFieldSummaryClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--dataDirectory",
                description = "Directory containing flow field files",
                required = true)
        public String dataDirectory;

        @Parameter(
                names = "--pattern",
                description = "Glob pattern (relative to dataDirectory) for flow field files")
        public String pattern = "*.txt";

        @Parameter(
                names = "--summaryFile",
                description = "If specified, write JSON summary to this file")
        public String summaryFile;
    }

    public static class FileSummary implements Serializable {

        private final String path;
        private final int vectorCount;
        private final int invalidCount;

        public FileSummary(final String path,
                           final FlowField flowField) {
            this.path = path;
            this.vectorCount = flowField.size();
            this.invalidCount = flowField.getInvalidCount();
        }

        public String getPath() {
            return path;
        }

        public int getVectorCount() {
            return vectorCount;
        }

        public int getInvalidCount() {
            return invalidCount;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final FlowFieldSummaryClient client = new FlowFieldSummaryClient(parameters);
                client.summarize();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    FlowFieldSummaryClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    List<FileSummary> summarize()
            throws IOException {

        final FileSetFinder finder = new FileSetFinder(Paths.get(parameters.dataDirectory));
        final List<Path> flowFieldPaths = finder.find(parameters.pattern);

        if (flowFieldPaths.isEmpty()) {
            throw new IllegalArgumentException("no flow field files matching '" + parameters.pattern +
                                               "' were found in " + finder.getBaseDirectory());
        }

        final FlowFieldReader reader = new FlowFieldReader();
        final List<FileSummary> summaryList = new ArrayList<>(flowFieldPaths.size());
        int totalVectors = 0;
        int totalInvalid = 0;
        for (final Path path : flowFieldPaths) {
            final FileSummary summary = new FileSummary(path.toString(), reader.load(path.toString()));
            LOG.info("summarize: {} has {} vectors, {} wrong vectors",
                     path, summary.getVectorCount(), summary.getInvalidCount());
            totalVectors += summary.getVectorCount();
            totalInvalid += summary.getInvalidCount();
            summaryList.add(summary);
        }

        LOG.info("summarize: {} files have {} vectors, {} wrong vectors",
                 summaryList.size(), totalVectors, totalInvalid);

        if (parameters.summaryFile != null) {
            FileUtil.saveJsonFile(parameters.summaryFile, summaryList);
        }

        return summaryList;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FlowFieldSummaryClient.class);
}
