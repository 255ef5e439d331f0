package org.janelia.piv.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable pair of frame paths along with the zero-based index
 * the pair was assigned during discovery.
 *
 * Per-pair functions should derive any output names from {@link #getIndex()}
 * (see {@link #getOutputFileName}) since pairs may complete in any order
 * when processed in parallel.
 *
 * @author Eric Trautman
 */
public class FramePair {

    private final Path pathA;
    private final Path pathB;
    private final int index;

    public FramePair(final Path pathA,
                     final Path pathB,
                     final int index) {
        if ((pathA == null) || (pathB == null)) {
            throw new IllegalArgumentException("both frame paths must be specified");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, but is " + index);
        }
        this.pathA = pathA;
        this.pathB = pathB;
        this.index = index;
    }

    public Path getPathA() {
        return pathA;
    }

    public Path getPathB() {
        return pathB;
    }

    public int getIndex() {
        return index;
    }

    /**
     * @return file name for this pair's output (e.g. result_0007.txt for prefix "result_", extension "txt").
     */
    public String getOutputFileName(final String prefix,
                                    final String extension) {
        return String.format("%s%04d.%s", prefix, index, extension);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final FramePair that = (FramePair) o;
        return (index == that.index) && pathA.equals(that.pathA) && pathB.equals(that.pathB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pathA, pathB, index);
    }

    @Override
    public String toString() {
        return "{index: " + index + ", pathA: '" + pathA + "', pathB: '" + pathB + "'}";
    }
}
