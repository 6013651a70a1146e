package org.conceptoriented.pivot.view;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.conceptoriented.pivot.context.FilterOp;
import org.conceptoriented.pivot.context.SortOrder;
import org.conceptoriented.pivot.context.SortSpec;
import org.conceptoriented.pivot.context.StepDelta;
import org.conceptoriented.pivot.context.RowDelta;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Range;
import org.conceptoriented.pivot.core.Record;
import org.conceptoriented.pivot.ingest.Dataset;
import org.conceptoriented.pivot.ingest.DatasetOptions;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class ViewTests {

    @BeforeClass
    public static void setUpClass() {
    }

    Dataset dataset;

    @Before
    public void setUp() throws DcError {
        List<Record> records = Arrays.asList(
                Record.of("id", 1, "category", "A", "amount", 10.0),
                Record.of("id", 2, "category", "A", "amount", 5.0),
                Record.of("id", 3, "category", "B", "amount", 7.0));
        dataset = Dataset.fromRecords(records, new DatasetOptions().setIndex("id"));
    }

    @Test
    public void rowPivotTest() throws DcError
    {
        View view = dataset.view(new ViewConfig().setRowPivots("category").setColumns("amount"));

        assertEquals(1, view.sides());
        assertEquals(3, view.numRows());
        assertEquals(1, view.numColumns());
        assertEquals(Arrays.asList("amount"), view.columnNames());

        DataSlice slice = view.getData(0, 3);
        assertEquals(Arrays.asList("A"), slice.getRowPath(1));
        assertEquals(Arrays.asList(22.0, 15.0, 7.0), slice.getColumn("amount"));

        dataset.update(Arrays.asList(Record.of("id", 1, "amount", 20.0)));
        slice = view.getData(0, 3);
        assertEquals(Arrays.asList(32.0, 25.0, 7.0), slice.getColumn("amount"));

        dataset.remove(2);
        slice = view.getData(0, 3);
        assertEquals(Arrays.asList(27.0, 20.0, 7.0), slice.getColumn("amount"));

        // Category was not part of the update
        assertEquals("A", dataset.getRecord(1).get("category"));
    }

    @Test
    public void columnOnlyTest() throws DcError
    {
        dataset.update(Arrays.asList(Record.of("id", 1, "amount", 20.0)));
        dataset.remove(2);

        View view = dataset.view(new ViewConfig().setColumnPivots("category").setColumns("amount"));
        assertEquals(2, view.sides());

        // One row per record, the total row is not shown
        assertEquals(2, view.numRows());
        assertEquals(Arrays.asList("A|amount", "B|amount"), view.columnNames());
        assertEquals(Arrays.asList(Arrays.asList((Object)"A", "amount"), Arrays.asList((Object)"B", "amount")), view.columnPaths());

        DataSlice slice = view.getData(0, 2);
        assertEquals(Arrays.asList(20.0, null), slice.getColumn("A|amount"));
        assertEquals(Arrays.asList(null, 7.0), slice.getColumn("B|amount"));
    }

    @Test
    public void flatTest() throws DcError
    {
        View view = dataset.view(new ViewConfig()
                .addFilter("amount", FilterOp.GT, 6)
                .addSort("amount", SortOrder.ASC));

        assertEquals(0, view.sides());
        assertEquals(2, view.numRows());
        assertEquals(Arrays.asList("id", "category", "amount"), view.columnNames());

        DataSlice slice = view.getData(0, 10);
        assertEquals(2, slice.getRowCount());
        assertEquals(Arrays.asList(7.0, 10.0), slice.getColumn("amount"));
        assertEquals("B", slice.get(0, 1));

        slice = view.getData(new Range(1, 2), new Range(2, 3));
        assertEquals(Arrays.asList("amount"), slice.getColumnNames());
        assertEquals(10.0, slice.get(0, 0));
    }

    @Test
    public void schemaTest() throws DcError
    {
        View view = dataset.view(new ViewConfig()
                .setRowPivots("category")
                .setColumns("category", "amount", "id")
                .setAggregate("amount", "avg")
                .setAggregate("id", "count"));

        Map<String, String> schema = view.schema();
        assertEquals(Arrays.asList("category", "amount", "id"), new ArrayList<>(schema.keySet()));
        assertEquals("integer", schema.get("category"));
        assertEquals("float", schema.get("amount"));
        assertEquals("integer", schema.get("id"));

        DataSlice slice = view.getData(1, 2);
        assertEquals(2L, slice.get(0, 0));
        assertEquals(7.5, slice.get(0, 1));
        assertEquals(2L, slice.get(0, 2));
    }

    @Test
    public void hiddenSortTest() throws DcError
    {
        dataset.update(Arrays.asList(Record.of("id", 4, "category", "C", "amount", 1.0)));
        View view = dataset.view(new ViewConfig()
                .setRowPivots("category")
                .setColumns("id")
                .setAggregate("id", "count")
                .addSort("amount", SortOrder.DESC));

        // The sort aggregate is not visible
        assertEquals(1, view.numColumns());
        assertEquals(Collections.singleton("id"), view.schema().keySet());

        assertEquals(Arrays.asList("C"), view.getRowPath(3));
        assertEquals(Arrays.asList("A"), view.getRowPath(1));

        view.sortBy(Arrays.asList(new SortSpec("category", SortOrder.DESC)));
        assertEquals(Arrays.asList("C"), view.getRowPath(1));

        try {
            view.sortBy(Arrays.asList(new SortSpec("nothing", SortOrder.DESC)));
            fail("Unknown sort column accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }
    }

    @Test
    public void expandTest() throws DcError
    {
        dataset.update(Arrays.asList(Record.of("id", 4, "category", "B", "amount", 1.0)));
        View view = dataset.view(new ViewConfig().setRowPivots("category", "id").setColumns("amount").setRowExpandDepth(1));

        assertEquals(3, view.numRows());
        assertFalse(view.getRowExpanded(1));
        assertEquals(2, view.expand(1));
        assertEquals(Arrays.asList("A", 1L), view.getRowPath(2));
        assertEquals(2, view.getRowDepth(2));
        assertEquals(2, view.collapse(1));

        view.setDepth(2);
        assertEquals(7, view.numRows());
    }

    @Test
    public void columnPivotTest() throws DcError
    {
        View view = dataset.view(new ViewConfig().setRowPivots("category").setColumnPivots("id").setColumns("amount"));
        assertEquals(Arrays.asList("1|amount", "2|amount", "3|amount"), view.columnNames());

        view.columnSortBy(Arrays.asList(new SortSpec("amount", SortOrder.COL_DESC)));
        assertEquals(Arrays.asList("1|amount", "3|amount", "2|amount"), view.columnNames());

        view.setColumnDepth(0);
        assertEquals(Arrays.asList("amount"), view.columnNames());
    }

    @Test
    public void deltaTest() throws DcError
    {
        View view = dataset.view(new ViewConfig().setRowPivots("category").setColumns("amount"));
        view.getStepDelta();
        view.getRowDelta();

        List<Integer> notified = new ArrayList<>();
        view.onUpdate((v, port) -> notified.add(port));

        dataset.update(Arrays.asList(Record.of("id", 3, "amount", 8.0)));
        assertEquals(Arrays.asList(0), notified);

        StepDelta step = view.getStepDelta();
        assertFalse(step.isRowsChanged());
        assertEquals(2, step.getCells().size());
        assertEquals(2, step.getCells().get(1).getRow());
        assertEquals(8.0, step.getCells().get(1).getNewValue());

        RowDelta rows = view.getRowDelta();
        assertEquals(Arrays.asList(0, 2), rows.getRows());
        assertEquals(Arrays.asList((Object)23.0, 8.0), rows.getData());

        // A failing listener does not stop the others
        view.onUpdate((v, port) -> { throw new IllegalStateException("listener failure"); });
        dataset.update(Arrays.asList(Record.of("id", 3, "amount", 9.0)));
        assertEquals(2, notified.size());
    }

    @Test
    public void staleTest() throws DcError
    {
        View view = dataset.view(new ViewConfig().setRowPivots("category"));
        View other = dataset.view(new ViewConfig());
        assertFalse(view.isStale());

        view.delete();
        assertTrue(view.isStale());
        try {
            view.numRows();
            fail("Deleted view used");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.STALE_VIEW, e.code);
        }

        dataset.getGnode().reset();
        assertTrue(other.isStale());
        try {
            other.getData(0, 1);
            fail("View of a reset table used");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.STALE_VIEW, e.code);
        }
    }

    @Test
    public void invalidConfigTest() throws DcError
    {
        try {
            dataset.view(new ViewConfig().setRowPivots("nothing"));
            fail("Unknown pivot accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.UNKNOWN_COLUMN, e.code);
        }

        try {
            dataset.view(new ViewConfig().setRowPivots("id").setColumns("category").setAggregate("category", "sum"));
            fail("Sum of strings accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }

        try {
            dataset.view(new ViewConfig().setRowPivots("id").setColumns("amount").setWeightedMean("amount", "category"));
            fail("String weight accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.INVALID_CONFIG, e.code);
        }

        View view = dataset.view(new ViewConfig().setRowPivots("category").setColumns("amount").setWeightedMean("amount", "id"));
        // (10 * 1 + 5 * 2) / 3
        assertEquals(20.0 / 3, (Double)view.getData(1, 2).get(0, 0), 1e-9);
    }

    @Test
    public void fromJsonTest() throws DcError
    {
        ViewConfig config = ViewConfig.fromJson("{`row_pivots`:[`category`], `columns`:[`amount`,`id`], `aggregates`:{`amount`:[`weighted mean`,`id`], `id`:`distinct count`}, `filter`:[[`amount`,`>=`,6]], `sort`:[[`amount`,`desc`]], `row_expand_depth`:1}".replace('`', '"'));
        assertEquals(Arrays.asList("category"), config.getRowPivots());
        assertEquals(Arrays.asList("amount", "id"), config.getColumns());
        assertEquals("id", config.getAggregates().get("amount").getRight());
        assertEquals(6L, config.getFilters().get(0).getOperand());
        assertEquals(SortOrder.DESC, config.getSorts().get(0).getOrder());
        assertEquals(Integer.valueOf(1), config.getRowExpandDepth());

        View view = dataset.view(config);
        assertEquals(3, view.numRows());
        assertEquals(Arrays.asList(10.0, 7.0), view.getData(1, 3).getColumn("amount"));

        try {
            ViewConfig.fromJson("{`row_pivots`:".replace('`', '"'));
            fail("Broken JSON accepted");
        }
        catch(DcError e) {
            assertEquals(DcErrorCode.PARSE_ERROR, e.code);
        }
    }

    @Test
    public void toColumnsTest() throws DcError
    {
        View view = dataset.view(new ViewConfig().setRowPivots("category").setColumns("amount"));
        dataset.update(Arrays.asList(Record.of("id", 4, "category", "C")));

        Map<String, ColumnVector> columns = view.toColumns(new Range(0, 10));
        ColumnVector amount = columns.get("amount");
        assertEquals(4, amount.size());
        assertEquals(1, amount.getNullCount());
        assertFalse(amount.isValid(3));

        String json = view.getData(0, 2).toJson(true);
        assertTrue(json.contains(DataSlice.ROW_PATH));
    }
}
