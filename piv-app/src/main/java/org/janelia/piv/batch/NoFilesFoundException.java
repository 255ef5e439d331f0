package org.janelia.piv.batch;

import java.nio.file.Path;

/**
 * Thrown when no frame files match the specified patterns.
 *
 * @author Eric Trautman
 */
public class NoFilesFoundException
        extends FramePairDiscoveryException {

    private final transient Path directory;

    public NoFilesFoundException(final Path directory,
                                 final String patternA,
                                 final String patternB) {
        super("No frame files were found in " + directory + " for patterns '" + patternA + "' and '" +
              patternB + "'.  Please check the directory and file name patterns.");
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
