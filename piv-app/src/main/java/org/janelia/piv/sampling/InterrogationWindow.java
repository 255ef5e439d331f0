package org.janelia.piv.sampling;

import java.io.Serializable;

/**
 * Square interrogation window identified by its grid position.
 *
 * @author Eric Trautman
 */
public class InterrogationWindow
        implements Serializable {

    private final int column;
    private final int row;
    private final double minX;
    private final double minY;
    private final double size;

    public InterrogationWindow(final int column,
                               final int row,
                               final double centerX,
                               final double centerY,
                               final double size) {
        this.column = column;
        this.row = row;
        this.minX = centerX - (size / 2.0);
        this.minY = centerY - (size / 2.0);
        this.size = size;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public double getMinX() {
        return minX;
    }

    public double getMinY() {
        return minY;
    }

    public double getSize() {
        return size;
    }

    public double getCenterX() {
        return minX + (size / 2.0);
    }

    public double getCenterY() {
        return minY + (size / 2.0);
    }

    @Override
    public String toString() {
        return "{column: " + column + ", row: " + row + ", minX: " + minX + ", minY: " + minY + ", size: " + size + '}';
    }
}
