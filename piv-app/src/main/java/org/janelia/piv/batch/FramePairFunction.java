package org.janelia.piv.batch;

/**
 * Work to be performed for one frame pair (e.g. load both frames,
 * derive a flow field, and write it to a file named after the pair's index).
 *
 * Implementations used with more than one thread must be thread safe.
 *
 * @author Eric Trautman
 */
@FunctionalInterface
public interface FramePairFunction {

    /**
     * @param  pair  pair to process.
     *
     * @throws Exception
     *   if processing fails for any reason.
     */
    void process(final FramePair pair) throws Exception;

}
