package org.janelia.piv.flow;

import java.io.Serializable;

/**
 * Vectors derived for a frame pair: interrogation window centers (x, y),
 * velocity components (u, v), and a mask flagging invalid vectors.
 * Two dimensional grids are stored in row major order.
 *
 * @author Eric Trautman
 */
public class FlowField
        implements Serializable {

    private final double[] x;
    private final double[] y;
    private final double[] u;
    private final double[] v;
    private final boolean[] mask;

    /**
     * @param  x     x coordinates of interrogation window centers in pixels.
     * @param  y     y coordinates of interrogation window centers in pixels.
     * @param  u     u velocity components in pixels/second.
     * @param  v     v velocity components in pixels/second.
     * @param  mask  true for each invalid vector.
     *
     * @throws IllegalArgumentException
     *   if any array is missing or the arrays have different lengths.
     */
    public FlowField(final double[] x,
                     final double[] y,
                     final double[] u,
                     final double[] v,
                     final boolean[] mask)
            throws IllegalArgumentException {

        if ((x == null) || (y == null) || (u == null) || (v == null) || (mask == null)) {
            throw new IllegalArgumentException("x, y, u, v, and mask must all be specified");
        }

        final int n = x.length;
        if ((y.length != n) || (u.length != n) || (v.length != n) || (mask.length != n)) {
            throw new IllegalArgumentException(
                    "x, y, u, v, and mask must have the same length but have lengths " +
                    n + ", " + y.length + ", " + u.length + ", " + v.length + ", and " + mask.length);
        }

        this.x = x.clone();
        this.y = y.clone();
        this.u = u.clone();
        this.v = v.clone();
        this.mask = mask.clone();
    }

    /**
     * Flattens two dimensional grids (e.g. from a meshgrid of window centers) in row major order.
     */
    public static FlowField fromGrids(final double[][] x,
                                      final double[][] y,
                                      final double[][] u,
                                      final double[][] v,
                                      final boolean[][] mask)
            throws IllegalArgumentException {

        if ((x == null) || (y == null) || (u == null) || (v == null) || (mask == null)) {
            throw new IllegalArgumentException("x, y, u, v, and mask must all be specified");
        }

        return new FlowField(flatten(x), flatten(y), flatten(u), flatten(v), flatten(mask));
    }

    public int size() {
        return x.length;
    }

    public double getX(final int i) {
        return x[i];
    }

    public double getY(final int i) {
        return y[i];
    }

    public double getU(final int i) {
        return u[i];
    }

    public double getV(final int i) {
        return v[i];
    }

    public boolean isInvalid(final int i) {
        return mask[i];
    }

    public int getInvalidCount() {
        int count = 0;
        for (final boolean invalid : mask) {
            if (invalid) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "{size: " + size() + ", invalidCount: " + getInvalidCount() + '}';
    }

    private static double[] flatten(final double[][] grid) {
        int n = 0;
        for (final double[] row : grid) {
            n += row.length;
        }
        final double[] values = new double[n];
        int i = 0;
        for (final double[] row : grid) {
            System.arraycopy(row, 0, values, i, row.length);
            i += row.length;
        }
        return values;
    }

    private static boolean[] flatten(final boolean[][] grid) {
        int n = 0;
        for (final boolean[] row : grid) {
            n += row.length;
        }
        final boolean[] values = new boolean[n];
        int i = 0;
        for (final boolean[] row : grid) {
            System.arraycopy(row, 0, values, i, row.length);
            i += row.length;
        }
        return values;
    }
}
