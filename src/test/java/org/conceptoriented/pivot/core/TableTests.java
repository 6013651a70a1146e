package org.conceptoriented.pivot.core;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class TableTests {

    @BeforeClass
    public static void setUpClass() {
    }

    @Before
    public void setUp() {
    }

    @Test
    public void cellStateTest()
    {
        Column column = DType.FLOAT64.newColumn("amount");
        column.setSize(3);
        column.setValue(0, 1.5);
        column.setNull(1);

        assertEquals(CellState.VALID, column.getState(0));
        assertEquals(CellState.NULL, column.getState(1));
        assertEquals(CellState.UNSET, column.getState(2));
        assertTrue(column.isSet(1));
        assertFalse(column.isSet(2));
        assertEquals(2, column.getNullCount());
        assertNull(column.getValue(1));

        // Invalid cells are equal to each other only
        assertTrue(column.cellEquals(1, column, 2));
        assertFalse(column.cellEquals(0, column, 1));

        column.unset(0);
        assertEquals(CellState.UNSET, column.getState(0));
    }

    @Test
    public void vocabularyTest()
    {
        StringColumn column = new StringColumn("name");
        column.setSize(3);
        column.setValue(0, "a");
        column.setValue(1, "a");
        column.setValue(2, "b");
        assertEquals(2, column.getRefCount("a"));
        assertEquals(2, column.getPayloadCount());

        column.copyCell(2, column, 0);
        assertEquals(3, column.getRefCount("a"));
        assertEquals(0, column.getRefCount("b"));
        assertEquals(1, column.getPayloadCount());

        column.setSize(1);
        assertEquals(1, column.getRefCount("a"));
        assertEquals("a", column.getValue(0));
    }

    @Test
    public void promoteTest()
    {
        Table table = new Table("t", new Schema().addColumn("x", DType.INT32).addColumn("s", DType.STR));
        table.setSize(3);
        table.getColumn("x").setValue(0, 1L);
        table.getColumn("x").setNull(1);

        Column promoted = table.promoteColumn("x", DType.FLOAT64, 3, false);
        assertEquals(DType.FLOAT64, promoted.getDType());
        assertEquals(1.0, promoted.getValue(0));
        assertEquals(CellState.NULL, promoted.getState(1));
        assertEquals(CellState.UNSET, promoted.getState(2));
        assertEquals(Arrays.asList("x", "s"), table.getColumnNames());

        promoted = table.promoteColumn("x", DType.STR, 1, true);
        assertEquals("1.0", promoted.getValue(0));
        assertEquals("", promoted.getValue(2));
    }

    @Test(expected = DcFault.class)
    public void narrowingTest()
    {
        Table table = new Table("t", new Schema().addColumn("x", DType.FLOAT64));
        table.promoteColumn("x", DType.INT64, 0, false);
    }

    @Test
    public void recordsTest() throws DcError
    {
        Schema schema = new Schema().addColumn("id", DType.INT64).addColumn("day", DType.DATE);
        Table a = new Table("a", schema);
        a.appendRecord(Record.of("id", 1L, "day", java.time.LocalDate.of(2024, 2, 29)));
        Table b = new Table("b", schema);
        b.appendRecord(Record.of("id", 2L));

        Table all = Table.concat("all", schema, Arrays.asList(a, b));
        assertEquals(2, all.getSize());
        assertEquals(java.time.LocalDate.of(2024, 2, 29), all.getRecord(0).get("day"));
        assertEquals(2L, all.getRecord(1).get("id"));
        assertEquals(CellState.UNSET, all.getColumn("day").getState(1));

        Record r = Record.fromJson("{`id`:3, `day`:null}".replace('`', '"'));
        assertTrue(r.has("day"));
        assertNull(r.get("day"));
        assertEquals(Arrays.asList("id", "day"), new java.util.ArrayList<>(r.getNames()));
        assertEquals("{`id`:3, `day`:null}".replace('`', '"'), r.toJson());
    }

    @Test
    public void schemaTest() throws DcError
    {
        Schema schema = Schema.fromJson("{`id`:`integer`, `price`:`float`, `when`:`datetime`}".replace('`', '"'));
        assertEquals(DType.INT32, schema.getType("id"));
        assertEquals(DType.TIME, schema.getType("when"));
        assertEquals("float", schema.toTypeNames().get("price"));
        assertTrue(Schema.isInternal(Schema.OKEY));

        // Physical type names are read back unchanged
        assertEquals("{`id`:`int32`, `price`:`float64`, `when`:`time`}".replace('`', '"'), schema.toJson());
        assertEquals(schema, Schema.fromJson(schema.toJson()));

        try {
            DType.fromName("decimal");
            fail("Unknown type accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.UNSUPPORTED_TYPE, e.code);
            assertEquals("{`code`:23, `message`: `Unknown type name.`, `description`: `Type 'decimal' is not supported.`}".replace('`', '"'), e.toJson());
        }
    }
}
