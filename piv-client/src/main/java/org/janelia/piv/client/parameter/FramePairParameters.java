package org.janelia.piv.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Paths;

import org.janelia.piv.batch.FramePairProcessor;

/**
 * Parameters for locating and processing frame pairs.
 *
 * @author Eric Trautman
 */
public class FramePairParameters
        implements Serializable {

    @Parameter(
            names = "--dataDirectory",
            description = "Directory containing frame images",
            required = true)
    public String dataDirectory;

    @Parameter(
            names = "--patternA",
            description = "Glob pattern (relative to dataDirectory) for first frames, e.g. 'img_*_a.png'",
            required = true)
    public String patternA;

    @Parameter(
            names = "--patternB",
            description = "Glob pattern (relative to dataDirectory) for second frames, e.g. 'img_*_b.png'",
            required = true)
    public String patternB;

    @Parameter(
            names = "--numberOfThreads",
            description = "Number of frame pairs to process concurrently (use 1 for debugging)")
    public Integer numberOfThreads = 1;

    public FramePairProcessor buildProcessor() {
        return new FramePairProcessor(Paths.get(dataDirectory), patternA, patternB);
    }

}
