package org.janelia.piv.sampling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link InterrogationWindowSampler} class.
 *
 * @author Eric Trautman
 */
public class InterrogationWindowSamplerTest {

    private static final double[] COLUMN_CENTERS = { 16, 32, 48, 64 };
    private static final double[] ROW_CENTERS = { 16, 32, 48 };

    private final InterrogationWindowSampler sampler =
            new InterrogationWindowSampler(COLUMN_CENTERS, ROW_CENTERS, 32);

    @Test
    public void testStandardWithoutSkipIncludesAllWindows() {

        final InterrogationWindowSampler.Sampling sampling =
                sampler.sample(0, InterrogationWindowSampler.Method.STANDARD, null);

        Assert.assertEquals("invalid number of points", 12, sampling.getNumberOfPoints());
        Assert.assertEquals("every window should be included", 12, sampling.getWindows().size());

        final InterrogationWindow first = sampling.getWindows().get(0);
        Assert.assertEquals("invalid minX", 0.0, first.getMinX(), 0.0);
        Assert.assertEquals("invalid minY", 0.0, first.getMinY(), 0.0);
        Assert.assertEquals("invalid size", 32.0, first.getSize(), 0.0);
        Assert.assertEquals("invalid centerX", 16.0, first.getCenterX(), 0.0);
    }

    @Test
    public void testStandardWithSkipStaggersRows() {

        final InterrogationWindowSampler.Sampling sampling =
                sampler.sample(1, InterrogationWindowSampler.Method.STANDARD, null);

        final List<String> columnRowList = new ArrayList<>();
        for (final InterrogationWindow window : sampling.getWindows()) {
            columnRowList.add(window.getColumn() + "," + window.getRow());
        }

        // even rows use even columns, odd rows use odd columns
        Assert.assertEquals("invalid windows",
                            Arrays.asList("0,0", "0,2", "1,1", "2,0", "2,2", "3,1"),
                            columnRowList);
    }

    @Test
    public void testSkipOutsideRangeShowsPointsOnly() {
        Assert.assertTrue("negative skip should show points only",
                          sampler.sample(-1, InterrogationWindowSampler.Method.STANDARD, null).isPointsOnly());
        Assert.assertTrue("skip beyond number of points should show points only",
                          sampler.sample(12, InterrogationWindowSampler.Method.RANDOM, new Random(1)).isPointsOnly());
        Assert.assertFalse("skip within range should show windows",
                           sampler.sample(11, InterrogationWindowSampler.Method.RANDOM, new Random(1)).isPointsOnly());
    }

    @Test
    public void testRandomIsReproducibleWithSeed() {

        final InterrogationWindowSampler.Sampling first =
                sampler.sample(2, InterrogationWindowSampler.Method.RANDOM, new Random(42));
        final InterrogationWindowSampler.Sampling second =
                sampler.sample(2, InterrogationWindowSampler.Method.RANDOM, new Random(42));

        Assert.assertEquals("invalid number of random windows", 4, first.getWindows().size());
        for (int i = 0; i < first.getWindows().size(); i++) {
            Assert.assertEquals("column differs for window " + i,
                                first.getWindows().get(i).getColumn(), second.getWindows().get(i).getColumn());
            Assert.assertEquals("row differs for window " + i,
                                first.getWindows().get(i).getRow(), second.getWindows().get(i).getRow());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRandomRequiresRandomSource() {
        sampler.sample(0, InterrogationWindowSampler.Method.RANDOM, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMethodIsRequired() {
        sampler.sample(0, null, new Random(1));
    }

}
