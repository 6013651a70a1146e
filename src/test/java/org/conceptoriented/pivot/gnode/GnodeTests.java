package org.conceptoriented.pivot.gnode;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.EngineConfig;
import org.conceptoriented.pivot.core.FaultPolicy;
import org.conceptoriented.pivot.core.LongColumn;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class GnodeTests {

    // Marks a cell which is not written by a fragment row
    static final Object UNSET = new Object();

    @BeforeClass
    public static void setUpClass() {
    }

    Gnode gnode;

    @Before
    public void setUp() {
        gnode = newGnode(EngineConfig.defaults());
    }

    static Gnode newGnode(EngineConfig config) {
        Schema schema = new Schema().addColumn("id", DType.INT32).addColumn("category", DType.STR).addColumn("amount", DType.FLOAT64);
        Gnode g = new Gnode("sales", schema, DType.INT32, config);
        g.init();
        return g;
    }

    /**
     * Fragment with the input schema. Each row is key, op and then the values of the output columns.
     */
    static Table fragment(Gnode g, Object[]... rows) {
        Schema schema = g.getInputSchema();
        Table t = new Table("fragment", schema);
        t.setSize(rows.length);
        List<String> columns = g.getOutputSchema().getColumns();
        for(int r = 0; r < rows.length; r++) {
            t.getColumn(Schema.PKEY).setValue(r, rows[r][0]);
            t.getColumn(Schema.OP).setValue(r, ((Number)rows[r][1]).longValue());
            for(int c = 0; c < columns.size(); c++) {
                Object v = rows[r][c + 2];
                if(v != UNSET) t.getColumn(columns.get(c)).setValue(r, v);
            }
        }
        return t;
    }

    static Object[] insert(long id, String category, Double amount) {
        return new Object[] { id, Op.INSERT.getValue(), id, category, amount };
    }

    static Object[] delete(long id) {
        return new Object[] { id, Op.DELETE.getValue(), UNSET, UNSET, UNSET };
    }

    void loadSales() throws DcError {
        gnode.sendAndProcess(fragment(gnode, insert(1, "A", 10.0), insert(2, "A", 5.0), insert(3, "B", 7.0)));
    }

    static ValueTransition transition(Gnode g, String column, int row) {
        LongColumn c = (LongColumn)g.getOutputTable(PortRole.TRANSITIONS).getColumn(column);
        return ValueTransition.fromValue(c.getLong(row));
    }

    @Test
    public void insertTest() throws DcError
    {
        ProcessResult res = gnode.sendAndProcess(fragment(gnode, insert(1, "A", 10.0), insert(2, "A", 5.0), insert(3, "B", 7.0)));

        assertTrue(res.shouldNotify());
        assertEquals(3, gnode.size());
        assertEquals(Arrays.asList(1L, 2L, 3L), gnode.getPkeys());
        assertEquals(10.0, gnode.getState().getValue(1L, "amount"));
        assertEquals("B", gnode.getState().getValue(3L, "category"));
        assertEquals(3L, gnode.getState().getValue(3L, Schema.OKEY));

        assertEquals(ValueTransition.NEQ_FT, transition(gnode, "amount", 0));
        assertEquals(Boolean.TRUE, gnode.getOutputTable(PortRole.EXISTED).getColumn(Schema.EXISTED).getValue(0));
    }

    @Test
    public void updateDeltaTest() throws DcError
    {
        loadSales();

        gnode.sendAndProcess(fragment(gnode, new Object[] { 1L, Op.UPDATE.getValue(), UNSET, UNSET, 20.0 }));

        Table delta = gnode.getOutputTable(PortRole.DELTA);
        assertEquals(1, delta.getSize());
        assertEquals(10.0, delta.getColumn("amount").getValue(0));
        assertEquals(10.0, gnode.getOutputTable(PortRole.PREV).getColumn("amount").getValue(0));
        assertEquals(20.0, gnode.getOutputTable(PortRole.CURRENT).getColumn("amount").getValue(0));
        assertEquals(ValueTransition.NEQ_TT, transition(gnode, "amount", 0));

        // Not written cells keep their values
        assertEquals(ValueTransition.EQ_TT, transition(gnode, "category", 0));
        assertEquals("A", gnode.getState().getValue(1L, "category"));
    }

    @Test
    public void idempotenceTest() throws DcError
    {
        loadSales();
        Table before = gnode.getTable();

        ProcessResult res = gnode.sendAndProcess(fragment(gnode, insert(1, "A", 10.0), insert(2, "A", 5.0), insert(3, "B", 7.0)));

        assertFalse(res.shouldNotify());
        for(int i = 0; i < 3; i++) {
            assertEquals(ValueTransition.EQ_TT, transition(gnode, "amount", i));
            assertEquals(ValueTransition.EQ_TT, transition(gnode, "category", i));
        }
        Table after = gnode.getTable();
        for(int i = 0; i < 3; i++) {
            assertEquals(before.getRecord(i), after.getRecord(i));
        }
    }

    @Test
    public void insertDeleteInverseTest() throws DcError
    {
        loadSales();

        ProcessResult res = gnode.sendAndProcess(fragment(gnode, delete(1), delete(2), delete(3)));

        assertTrue(res.shouldNotify());
        assertEquals(0, gnode.size());
        assertTrue(gnode.getPkeys().isEmpty());
        assertEquals(ValueTransition.NEQ_TDF, transition(gnode, "amount", 0));
        assertEquals(-10.0, gnode.getOutputTable(PortRole.DELTA).getColumn("amount").getValue(0));

        // Deleting a missing key changes nothing
        res = gnode.sendAndProcess(fragment(gnode, delete(5)));
        assertFalse(res.shouldNotify());
        assertEquals(Boolean.FALSE, gnode.getOutputTable(PortRole.EXISTED).getColumn(Schema.EXISTED).getValue(0));
    }

    @Test
    public void deltaAdditivityTest() throws DcError
    {
        loadSales();
        double sum = 0.0;
        double[] amounts = { 12.5, 3.0, 3.0, 40.0, -2.0 };
        for(double a : amounts) {
            gnode.sendAndProcess(fragment(gnode, new Object[] { 2L, Op.UPDATE.getValue(), UNSET, UNSET, a }));
            sum += (Double)gnode.getOutputTable(PortRole.DELTA).getColumn("amount").getValue(0);
        }
        assertEquals(-2.0 - 5.0, sum, 1e-9);
    }

    @Test
    public void orderSensitivityTest() throws DcError
    {
        loadSales();

        // Delete and re-insert in one batch: the row is reset, cells not written again are null
        gnode.sendAndProcess(fragment(gnode, delete(1), new Object[] { 1L, Op.INSERT.getValue(), 1L, UNSET, 8.0 }));
        assertTrue(gnode.hasPkey(1L));
        assertNull(gnode.getState().getValue(1L, "category"));
        assertEquals(8.0, gnode.getState().getValue(1L, "amount"));
        assertEquals(ValueTransition.NEQ_TDT, transition(gnode, "amount", 0));
        assertEquals(ValueTransition.NEQ_TF, transition(gnode, "category", 0));

        // Insert and then delete in one batch: the key is gone
        gnode.sendAndProcess(fragment(gnode, insert(2, "C", 1.0), delete(2)));
        assertFalse(gnode.hasPkey(2L));

        // Later writes win
        gnode.sendAndProcess(fragment(gnode, insert(3, "B", 1.0), insert(3, "D", 2.0)));
        assertEquals("D", gnode.getState().getValue(3L, "category"));
        assertEquals(2.0, gnode.getState().getValue(3L, "amount"));
        assertEquals(1, gnode.getOutputTable(PortRole.FLATTENED).getSize());
    }

    @Test
    public void clearTest() throws DcError
    {
        loadSales();

        gnode.sendAndProcess(fragment(gnode, new Object[] { 3L, Op.CLEAR.getValue(), UNSET, UNSET, UNSET }));

        assertTrue(gnode.hasPkey(3L));
        assertNull(gnode.getState().getValue(3L, "amount"));
        assertNull(gnode.getState().getValue(3L, "category"));
        assertEquals(ValueTransition.NEQ_TF, transition(gnode, "amount", 0));
        assertEquals(-7.0, gnode.getOutputTable(PortRole.DELTA).getColumn("amount").getValue(0));
    }

    @Test
    public void nullValueTest() throws DcError
    {
        loadSales();

        gnode.sendAndProcess(fragment(gnode, new Object[] { 2L, Op.UPDATE.getValue(), UNSET, UNSET, null }));
        assertNull(gnode.getState().getValue(2L, "amount"));
        assertEquals(ValueTransition.NEQ_TF, transition(gnode, "amount", 0));

        gnode.sendAndProcess(fragment(gnode, new Object[] { 2L, Op.UPDATE.getValue(), UNSET, UNSET, 6.0 }));
        assertEquals(ValueTransition.NVEQ_FT, transition(gnode, "amount", 0));
        assertEquals(6.0, gnode.getOutputTable(PortRole.DELTA).getColumn("amount").getValue(0));
    }

    @Test
    public void unknownOpReportTest() throws DcError
    {
        loadSales();

        try {
            gnode.sendAndProcess(fragment(gnode, new Object[] { 1L, 7, UNSET, UNSET, 1.0 }));
            fail("Unknown operation must fail the batch");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.FAULT, e.code);
            assertEquals("Unknown OP", e.description);
        }
        assertEquals(GnodeStatus.FAILED, gnode.getStatus());

        try {
            gnode.sendAndProcess(fragment(gnode, insert(4, "A", 1.0)));
            fail("Failed gnode must reject batches");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_STATE, e.code);
        }

        gnode.reset();
        assertEquals(GnodeStatus.IDLE, gnode.getStatus());
        assertEquals(0, gnode.size());
        gnode.sendAndProcess(fragment(gnode, insert(4, "A", 1.0)));
        assertEquals(1, gnode.size());
    }

    @Test(expected = DcFault.class)
    public void unknownOpAbortTest() throws DcError
    {
        Gnode g = newGnode(EngineConfig.defaults().setFaultPolicy(FaultPolicy.ABORT));
        g.sendAndProcess(fragment(g, new Object[] { 1L, 9, UNSET, UNSET, UNSET }));
    }

    @Test(expected = DcFault.class)
    public void schemaMismatchTest() throws DcError
    {
        Table t = new Table("fragment", new Schema().addColumn("id", DType.INT32));
        gnode.send(0, t);
    }

    @Test
    public void portsTest() throws DcError
    {
        int port = gnode.makeInputPort();
        assertEquals(1, port);

        gnode.send(port, fragment(gnode, insert(1, "A", 1.0)));
        gnode.send(0, fragment(gnode, insert(1, "A", 2.0)));
        gnode.send(port, fragment(gnode, insert(2, "B", 3.0)));

        List<ProcessResult> results = gnode.processAll();
        assertEquals(2, results.size());
        assertEquals(0, results.get(0).getPortId());
        assertEquals(1, results.get(1).getPortId());

        // Port 1 was processed last
        assertEquals(1.0, gnode.getState().getValue(1L, "amount"));
        assertEquals(2, gnode.size());

        ProcessResult empty = gnode.process(port);
        assertFalse(empty.shouldNotify());

        try {
            gnode.send(5, fragment(gnode, insert(1, "A", 1.0)));
            fail();
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }
    }

    @Test
    public void parallelDiffTest() throws DcError
    {
        Gnode parallel = newGnode(EngineConfig.defaults().setDiffParallelism(4));
        Gnode sequential = newGnode(EngineConfig.defaults().setDiffParallelism(1));
        for(Gnode g : Arrays.asList(parallel, sequential)) {
            g.sendAndProcess(fragment(g, insert(1, "A", 10.0), insert(2, "A", 5.0), insert(3, "B", 7.0)));
            g.sendAndProcess(fragment(g, new Object[] { 1L, Op.UPDATE.getValue(), UNSET, "C", 11.0 }, delete(2), insert(4, "D", 4.0)));
        }
        assertEquals(sequential.getPkeys(), parallel.getPkeys());
        Table a = sequential.getTable();
        Table b = parallel.getTable();
        for(int i = 0; i < a.getSize(); i++) {
            assertEquals(a.getRecord(i), b.getRecord(i));
        }
        for(String c : Arrays.asList("id", "category", "amount")) {
            Column ta = sequential.getOutputTable(PortRole.TRANSITIONS).getColumn(c);
            Column tb = parallel.getOutputTable(PortRole.TRANSITIONS).getColumn(c);
            for(int i = 0; i < ta.size(); i++) {
                assertEquals(ta.getValue(i), tb.getValue(i));
            }
        }
        parallel.close();
        sequential.close();
    }

    @Test
    public void promoteColumnTest() throws DcError
    {
        loadSales();
        gnode.promoteColumn("id", DType.INT64);
        assertEquals(DType.INT64, gnode.getOutputSchema().getType("id"));
        assertEquals(2L, gnode.getState().getValue(2L, "id"));

        gnode.promoteColumn("amount", DType.STR);
        assertEquals("10.0", gnode.getState().getValue(1L, "amount"));

        gnode.sendAndProcess(fragment(gnode, new Object[] { 1L, Op.UPDATE.getValue(), UNSET, UNSET, "n/a" }));
        assertEquals("n/a", gnode.getState().getValue(1L, "amount"));
    }

    @Test
    public void keyTypeTest() throws DcError
    {
        loadSales();

        // Keys of an INT32 key column are found in any integral box
        assertTrue(gnode.hasPkey(1));
        assertTrue(gnode.hasPkey(1L));
        assertTrue(gnode.hasPkey((short)3));
        assertFalse(gnode.hasPkey(4));
        assertTrue(gnode.hasPkeys(Arrays.asList(1, 2L)));
        assertFalse(gnode.hasPkeys(Arrays.asList(1, 4)));

        assertEquals(10.0, gnode.getState().getValue(1, "amount"));
        assertEquals("B", gnode.getState().getRecord(3).get("category"));
        assertTrue(gnode.getState().lookup(2).exists());
        assertNull(gnode.getState().getValue(4, "amount"));
    }

    @Test
    public void fragmentKeptTest() throws DcError
    {
        Table single = fragment(gnode, insert(1, "A", 10.0), insert(2, "A", 5.0));
        gnode.sendAndProcess(single);
        assertEquals(2, single.getSize());
        assertEquals(2L, single.getColumn(Schema.PKEY).getValue(1));

        // Several queued fragments are concatenated without touching the originals
        Table first = fragment(gnode, insert(3, "B", 7.0));
        Table second = fragment(gnode, delete(1));
        gnode.send(0, first);
        gnode.send(0, second);
        gnode.process(0);
        assertEquals(1, first.getSize());
        assertEquals(1, second.getSize());
        assertEquals(7.0, first.getColumn("amount").getValue(0));
        assertEquals(2, gnode.size());
    }

    @Test
    public void deltaOverflowTest() throws DcError
    {
        Schema schema = new Schema().addColumn("id", DType.INT32).addColumn("big", DType.INT64);
        Gnode g = new Gnode("big", schema, DType.INT32, EngineConfig.defaults());
        g.init();

        g.sendAndProcess(fragment(g, new Object[] { 1L, Op.INSERT.getValue(), 1L, Long.MAX_VALUE }));
        assertEquals(Long.MAX_VALUE, g.getOutputTable(PortRole.DELTA).getColumn("big").getValue(0));

        // The difference does not fit into a long
        g.sendAndProcess(fragment(g, new Object[] { 1L, Op.UPDATE.getValue(), UNSET, Long.MIN_VALUE }));
        assertEquals(ValueTransition.NEQ_TT, transition(g, "big", 0));
        assertNull(g.getOutputTable(PortRole.DELTA).getColumn("big").getValue(0));
        assertEquals(Long.MIN_VALUE, g.getState().getValue(1, "big"));

        g.sendAndProcess(fragment(g, new Object[] { 1L, Op.UPDATE.getValue(), UNSET, Long.MIN_VALUE + 5 }));
        assertEquals(5L, g.getOutputTable(PortRole.DELTA).getColumn("big").getValue(0));
        g.close();
    }
}
