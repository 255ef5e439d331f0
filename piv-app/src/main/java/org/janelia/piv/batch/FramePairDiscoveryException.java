package org.janelia.piv.batch;

/**
 * Base class for problems found while discovering and pairing frame files.
 * Raised before any pair is processed.
 *
 * @author Eric Trautman
 */
public abstract class FramePairDiscoveryException
        extends IllegalArgumentException {

    protected FramePairDiscoveryException(final String message) {
        super(message);
    }

}
