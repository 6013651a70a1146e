package org.conceptoriented.pivot.context;

import static org.junit.Assert.*;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class AccumulatorTests {

    @BeforeClass
    public static void setUpClass() {
    }

    @Before
    public void setUp() {
    }

    @Test
    public void sumTest()
    {
        Accumulator doubles = Accumulator.create(AggType.SUM, DType.FLOAT64);
        assertNull(doubles.getValue());
        doubles.add(1.5);
        doubles.add(2.0);
        doubles.applyDelta(0.5);
        assertEquals(4.0, doubles.getValue());
        doubles.retract(2.0);
        assertEquals(2.0, doubles.getValue());
        doubles.retract(2.0);
        assertNull(doubles.getValue());

        Accumulator longs = Accumulator.create(AggType.SUM, DType.INT32);
        longs.add(3L);
        longs.add(4L);
        assertEquals(7L, longs.getValue());

        Accumulator bools = Accumulator.create(AggType.SUM, DType.BOOL);
        bools.add(true);
        bools.add(false);
        bools.add(true);
        assertEquals(2L, bools.getValue());
    }

    @Test
    public void meanTest()
    {
        Accumulator mean = Accumulator.create(AggType.MEAN, DType.INT64);
        assertNull(mean.getValue());
        mean.add(1L);
        mean.add(4L);
        assertEquals(2.5, mean.getValue());
        mean.applyDelta(2L);
        assertEquals(3.5, mean.getValue());

        Accumulator wmean = Accumulator.create(AggType.WEIGHTED_MEAN, DType.FLOAT64);
        wmean.add(new Object[] { 2.0, 1L });
        wmean.add(new Object[] { 5.0, 2L });
        assertEquals(4.0, wmean.getValue());
        wmean.retract(new Object[] { 5.0, 2L });
        assertEquals(2.0, wmean.getValue());
        assertFalse(wmean.isAdditive());

        Accumulator zero = Accumulator.create(AggType.WEIGHTED_MEAN, DType.FLOAT64);
        zero.add(new Object[] { 2.0, 0L });
        assertNull(zero.getValue());
    }

    @Test
    public void orderStatisticsTest()
    {
        Accumulator min = Accumulator.create(AggType.MIN, DType.FLOAT64);
        Accumulator max = Accumulator.create(AggType.MAX, DType.FLOAT64);
        for(double v : new double[] { 3.0, 1.0, 3.0, 7.0 }) {
            min.add(v);
            max.add(v);
        }
        assertEquals(1.0, min.getValue());
        assertEquals(7.0, max.getValue());

        min.retract(1.0);
        max.retract(7.0);
        assertEquals(3.0, min.getValue());
        assertEquals(3.0, max.getValue());

        // Duplicates are kept
        max.retract(3.0);
        assertEquals(3.0, max.getValue());
    }

    @Test
    public void distinctTest()
    {
        Accumulator distinct = Accumulator.create(AggType.DISTINCT_COUNT, DType.STR);
        Accumulator unique = Accumulator.create(AggType.UNIQUE, DType.STR);
        Accumulator count = Accumulator.create(AggType.COUNT, DType.STR);
        assertEquals(0L, distinct.getValue());
        assertNull(unique.getValue());

        for(String s : new String[] { "x", "x", "y" }) {
            distinct.add(s);
            unique.add(s);
            count.add(s);
        }
        assertEquals(2L, distinct.getValue());
        assertNull(unique.getValue());
        assertEquals(3L, count.getValue());

        distinct.retract("y");
        unique.retract("y");
        assertEquals(1L, distinct.getValue());
        assertEquals("x", unique.getValue());
    }

    @Test(expected = DcFault.class)
    public void retractUnknownTest()
    {
        Accumulator min = Accumulator.create(AggType.MIN, DType.INT64);
        min.add(1L);
        min.retract(2L);
    }

    @Test(expected = DcFault.class)
    public void notAdditiveTest()
    {
        Accumulator max = Accumulator.create(AggType.MAX, DType.INT64);
        max.applyDelta(1L);
    }
}
