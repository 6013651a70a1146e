package org.conceptoriented.pivot.gnode;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcColumnKind;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.EngineConfig;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.junit.Before;
import org.junit.Test;

public class ComputationTests {

    Gnode gnode;

    @Before
    public void setUp() {
        Schema schema = new Schema().addColumn("price", DType.FLOAT64).addColumn("qty", DType.INT32).addColumn("name", DType.STR);
        gnode = new Gnode("orders", schema, DType.INT64, EngineConfig.defaults());
        gnode.init();
    }

    Object[] row(long key, Op op, Object price, Object qty, Object name) {
        return new Object[] { key, op.getValue(), price, qty, name };
    }

    @Test
    public void returnTypeTest()
    {
        assertEquals(DType.INT64, Computation.getReturnType(Computation.Method.ADD, DType.INT32, DType.INT64));
        assertEquals(DType.FLOAT64, Computation.getReturnType(Computation.Method.ADD, DType.INT32, DType.FLOAT64));
        assertEquals(DType.FLOAT64, Computation.getReturnType(Computation.Method.DIVIDE, DType.INT32, DType.INT32));
        assertNull(Computation.getReturnType(Computation.Method.ADD, DType.STR, DType.INT32));

        ComputedFunction divide = Computation.getFunction(Computation.Method.DIVIDE, DType.INT64, DType.INT64);
        assertEquals(2.5, divide.compute(new Object[] { 5L, 2L }));
        assertNull(divide.compute(new Object[] { 5L, 0L }));
    }

    @Test(expected = DcFault.class)
    public void missingComputationTest()
    {
        Computation.getFunction(Computation.Method.MULTIPLY, DType.STR, DType.STR);
    }

    @Test
    public void formulaTest() throws DcError
    {
        FormulaFunction f = new FormulaFunction("[price] * [qty] + 1");
        assertEquals(Arrays.asList("price", "qty"), f.getParams());
        assertEquals(7.0, f.compute(new Object[] { 2.0, 3L }));
        assertNull(new FormulaFunction("[a] / [b]").compute(new Object[] { 1.0, 0.0 }));

        try {
            new FormulaFunction("[price] * ");
            fail();
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.PARSE_ERROR, e.code);
        }
    }

    @Test
    public void computedColumnTest() throws DcError
    {
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(1, Op.INSERT, 2.0, 3, "a"), row(2, Op.INSERT, 1.5, 2, "b")));

        // Added columns are evaluated for existing rows
        gnode.addComputedColumns(Arrays.asList(
                ComputedColumn.formula("total", "[price] * [qty]"),
                ComputedColumn.computation("more", Computation.Method.ADD, "qty", "qty")));
        assertEquals(6.0, gnode.getState().getValue(1L, "total"));
        assertEquals(4L, gnode.getState().getValue(2L, "more"));
        assertEquals(DType.INT64, gnode.getDataSchema().getType("more"));
        assertEquals(DcColumnKind.CALC, gnode.getColumnKind("total"));
        assertEquals(DcColumnKind.USER, gnode.getColumnKind("price"));
        assertEquals(DcColumnKind.INTERNAL, gnode.getColumnKind(Schema.PKEY));

        // Changed inputs recompute the column and its transition
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(1, Op.UPDATE, GnodeTests.UNSET, 5, GnodeTests.UNSET)));
        assertEquals(10.0, gnode.getState().getValue(1L, "total"));
        assertEquals(ValueTransition.NEQ_TT, GnodeTests.transition(gnode, "total", 0));
        assertEquals(4.0, gnode.getOutputTable(PortRole.DELTA).getColumn("total").getValue(0));

        // Unrelated changes keep the value
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(2, Op.UPDATE, GnodeTests.UNSET, GnodeTests.UNSET, "c")));
        assertEquals(ValueTransition.EQ_TT, GnodeTests.transition(gnode, "total", 0));
        assertEquals(3.0, gnode.getState().getValue(2L, "total"));

        // Invalid input gives an invalid output
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(2, Op.UPDATE, null, GnodeTests.UNSET, GnodeTests.UNSET)));
        assertNull(gnode.getState().getValue(2L, "total"));
        assertEquals(ValueTransition.NEQ_TF, GnodeTests.transition(gnode, "total", 0));

        // New rows
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(3, Op.INSERT, 1.0, 1, "d")));
        assertEquals(1.0, gnode.getState().getValue(3L, "total"));
        assertEquals(ValueTransition.NEQ_FT, GnodeTests.transition(gnode, "total", 0));
    }

    @Test
    public void customFunctionTest() throws DcError
    {
        gnode.addComputedColumns(Collections.singletonList(
                ComputedColumn.of("upper", DType.STR, Collections.singletonList("name"), args -> args[0].toString().toUpperCase())));
        gnode.sendAndProcess(GnodeTests.fragment(gnode, row(1, Op.INSERT, 1.0, 1, "abc")));
        assertEquals("ABC", gnode.getState().getValue(1L, "upper"));

        Table current = gnode.getOutputTable(PortRole.CURRENT);
        assertEquals("ABC", current.getColumn("upper").getValue(0));
    }

    @Test
    public void bindErrorTest() throws DcError
    {
        try {
            gnode.addComputedColumns(Collections.singletonList(ComputedColumn.formula("x", "[missing] + 1")));
            fail();
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.BIND_ERROR, e.code);
        }
        try {
            gnode.addComputedColumns(Collections.singletonList(ComputedColumn.formula("x", "[name] + 1")));
            fail();
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.BIND_ERROR, e.code);
        }
        try {
            gnode.addComputedColumns(Collections.singletonList(ComputedColumn.formula("price", "[qty] + 1")));
            fail();
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }
        assertEquals(3, gnode.getDataSchema().size());
    }
}
