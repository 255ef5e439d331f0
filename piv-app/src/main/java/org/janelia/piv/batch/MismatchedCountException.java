package org.janelia.piv.batch;

/**
 * Thrown when the first and second frame patterns match a different number of files.
 *
 * @author Eric Trautman
 */
public class MismatchedCountException
        extends FramePairDiscoveryException {

    private final int countA;
    private final int countB;

    public MismatchedCountException(final int countA,
                                    final int countB) {
        super("There should be an equal number of first and second frame files, but found " +
              countA + " first frame and " + countB + " second frame files.");
        this.countA = countA;
        this.countB = countB;
    }

    public int getCountA() {
        return countA;
    }

    public int getCountB() {
        return countB;
    }
}
