package org.conceptoriented.pivot.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.apache.commons.lang3.tuple.Pair;
import org.conceptoriented.pivot.context.AggSpec;
import org.conceptoriented.pivot.context.AggType;
import org.conceptoriented.pivot.context.CellDelta;
import org.conceptoriented.pivot.context.Context;
import org.conceptoriented.pivot.context.ContextConfig;
import org.conceptoriented.pivot.context.Ctx0;
import org.conceptoriented.pivot.context.Ctx1;
import org.conceptoriented.pivot.context.Ctx2;
import org.conceptoriented.pivot.context.Filter;
import org.conceptoriented.pivot.context.Header;
import org.conceptoriented.pivot.context.PivotContext;
import org.conceptoriented.pivot.context.RowDelta;
import org.conceptoriented.pivot.context.SortSpec;
import org.conceptoriented.pivot.context.StepDelta;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcError;
import org.conceptoriented.pivot.core.DcErrorCode;
import org.conceptoriented.pivot.core.Range;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.gnode.Gnode;
import org.jboss.logging.Logger;

/**
 * Consumer handle of a context registered on a gnode. 
 * It translates view coordinates to context coordinates: the synthetic total row of column-only views 
 * and the hidden sort and header columns are not visible. 
 * A view becomes stale when its context is unregistered or the gnode is reset.
 */
public class View {
	private static final Logger LOG = Logger.getLogger(View.class);

	private final String name;
	public String getName() {
		return name;
	}

	private final Gnode gnode;
	private final long generation;

	private final ViewConfig config;
	public ViewConfig getConfig() {
		return config.copy();
	}

	private final Context context;
	public Context getContext() {
		return context;
	}

	private final String separator;

	// Rows of the context before the first visible row
	private final int rowOffset;

	// Aggregates which only take part in sorting
	private final Set<String> hiddenSorts;

	private final List<UpdateListener> listeners = new CopyOnWriteArrayList<>();

	private boolean deleted;

	private void check() throws DcError {
		if(deleted || !gnode.isRegistered(name, generation)) {
			throw new DcError(DcErrorCode.STALE_VIEW, "View is stale.", "View '" + name + "' was deleted or its table was reset.");
		}
	}

	public boolean isStale() {
		return deleted || !gnode.isRegistered(name, generation);
	}

	//
	// Shape
	//

	public int sides() {
		return context.sides();
	}

	public int numRows() throws DcError {
		synchronized(gnode) {
			check();
			return Math.max(0, context.getRowCount() - rowOffset);
		}
	}

	public int numColumns() throws DcError {
		synchronized(gnode) {
			check();
			return projection().size();
		}
	}

	// Visible context columns
	private List<Integer> projection() {
		int n = context.getColumnCount();
		if(context.sides() == 0) {
			List<Integer> all = new ArrayList<>(n);
			for(int c = 0; c < n; c++) all.add(c);
			return all;
		}
		List<AggSpec> aggs = context.getAggregates();
		PivotContext pivot = (PivotContext)context;
		List<Integer> visible = new ArrayList<>();
		for(int c = 0; c < n; c++) {
			if(hiddenSorts.contains(aggs.get(c % aggs.size()).getName())) continue;
			if(pivot.isHeaderColumn(c)) continue;
			visible.add(c);
		}
		return visible;
	}

	/**
	 * Column name to canonical type name. Aggregated columns report the type of their aggregate values.
	 */
	public Map<String, String> schema() throws DcError {
		synchronized(gnode) {
			check();
			Map<String, String> schema = new LinkedHashMap<>();
			List<String> names = context.getColumnNames();
			for(int k = 0; k < names.size(); k++) {
				if(hiddenSorts.contains(names.get(k))) continue;
				schema.put(names.get(k), context.getColumnDType(k).getTypeName());
			}
			return schema;
		}
	}

	public List<List<Object>> columnPaths() throws DcError {
		synchronized(gnode) {
			check();
			List<List<Object>> paths = new ArrayList<>();
			for(int c : projection()) {
				paths.add(columnPath(c));
			}
			return paths;
		}
	}

	public List<String> columnNames() throws DcError {
		synchronized(gnode) {
			check();
			List<String> names = new ArrayList<>();
			for(int c : projection()) {
				names.add(columnName(c));
			}
			return names;
		}
	}

	private List<Object> columnPath(int c) {
		List<String> names = context.getColumnNames();
		List<Object> path = new ArrayList<>(context.getColumnPath(c));
		path.add(names.get(c % names.size()));
		return path;
	}

	private String columnName(int c) {
		return columnPath(c).stream().map(String::valueOf).collect(Collectors.joining(separator));
	}

	//
	// Data
	//

	public DataSlice getData(int startRow, int endRow) throws DcError {
		return getData(new Range(startRow, endRow), new Range(0, Integer.MAX_VALUE));
	}

	public DataSlice getData(Range rows, Range columns) throws DcError {
		synchronized(gnode) {
			check();
			List<Integer> proj = projection();
			Range r = rows.clamp(Math.max(0, context.getRowCount() - rowOffset));
			Range c = columns.clamp(proj.size());
			int n = context.getColumnCount();

			List<String> names = new ArrayList<>();
			for(int col = c.start; col < c.end; col++) {
				names.add(columnName(proj.get(col)));
			}

			List<List<Object>> rowPaths = new ArrayList<>();
			List<Object> values = new ArrayList<>();
			for(int row = r.start; row < r.end; row++) {
				int cr = row + rowOffset;
				rowPaths.add(context.getRowPath(cr));
				List<Object> data = context.getData(cr, cr + 1, 0, n);
				for(int col = c.start; col < c.end; col++) {
					values.add(data.get(proj.get(col)));
				}
			}
			return new DataSlice(r, names, rowPaths, values);
		}
	}

	/**
	 * Visible columns of a row range in columnar form. Columns of object type cannot be extracted.
	 */
	public Map<String, ColumnVector> toColumns(Range rows) throws DcError {
		synchronized(gnode) {
			check();
			List<Integer> proj = projection();
			for(int c : proj) {
				if(context.getColumnDType(c) == DType.OBJECT) {
					throw new DcError(DcErrorCode.UNSUPPORTED_TYPE, "Unsupported type.", "Column '" + columnName(c) + "' of type object cannot be serialized.");
				}
			}

			Range r = rows.clamp(Math.max(0, context.getRowCount() - rowOffset));
			int n = context.getColumnCount();
			List<List<Object>> columns = new ArrayList<>();
			proj.forEach(c -> columns.add(new ArrayList<>()));
			for(int row = r.start; row < r.end; row++) {
				int cr = row + rowOffset;
				List<Object> data = context.getData(cr, cr + 1, 0, n);
				for(int i = 0; i < proj.size(); i++) {
					columns.get(i).add(data.get(proj.get(i)));
				}
			}

			Map<String, ColumnVector> result = new LinkedHashMap<>();
			for(int i = 0; i < proj.size(); i++) {
				String columnName = columnName(proj.get(i));
				result.put(columnName, new ColumnVector(columnName, context.getColumnDType(proj.get(i)), columns.get(i)));
			}
			return result;
		}
	}

	public List<Object> getRowPath(int row) throws DcError {
		synchronized(gnode) {
			check();
			return context.getRowPath(row + rowOffset);
		}
	}

	//
	// Layout
	//

	public int expand(int row) throws DcError {
		synchronized(gnode) {
			check();
			return context.open(Header.ROW, row + rowOffset);
		}
	}

	public int collapse(int row) throws DcError {
		synchronized(gnode) {
			check();
			return context.close(Header.ROW, row + rowOffset);
		}
	}

	public void setDepth(int depth) throws DcError {
		synchronized(gnode) {
			check();
			context.setDepth(Header.ROW, depth);
		}
	}

	public void setColumnDepth(int depth) throws DcError {
		synchronized(gnode) {
			check();
			context.setDepth(Header.COLUMN, depth);
		}
	}

	public boolean getRowExpanded(int row) throws DcError {
		synchronized(gnode) {
			check();
			return context.isRowExpanded(row + rowOffset);
		}
	}

	public int getRowDepth(int row) throws DcError {
		synchronized(gnode) {
			check();
			return context.getRowDepth(row + rowOffset);
		}
	}

	public void sortBy(List<SortSpec> sorts) throws DcError {
		synchronized(gnode) {
			check();
			checkSorts(sorts);
			context.sortBy(sorts);
		}
	}

	public void columnSortBy(List<SortSpec> sorts) throws DcError {
		synchronized(gnode) {
			check();
			checkSorts(sorts);
			context.columnSortBy(sorts);
		}
	}

	private void checkSorts(List<SortSpec> sorts) throws DcError {
		Set<String> known = new LinkedHashSet<>(context.getColumnNames());
		known.addAll(config.getRowPivots());
		known.addAll(config.getColumnPivots());
		for(SortSpec s : sorts) {
			if(!known.contains(s.getColumn())) {
				throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid sort.", "Column '" + s.getColumn() + "' is not part of the view.");
			}
		}
	}

	//
	// Changes
	//

	public StepDelta getStepDelta() throws DcError {
		synchronized(gnode) {
			check();
			List<Integer> proj = projection();
			Map<Integer, Integer> inverse = new HashMap<>();
			for(int i = 0; i < proj.size(); i++) inverse.put(proj.get(i), i);

			StepDelta delta = context.getStepDelta(0, Integer.MAX_VALUE);
			List<CellDelta> cells = new ArrayList<>();
			for(CellDelta cd : delta.getCells()) {
				int row = cd.getRow() - rowOffset;
				Integer col = inverse.get(cd.getColumn());
				if(row < 0 || col == null) continue;
				cells.add(new CellDelta(row, col, cd.getOldValue(), cd.getNewValue()));
			}
			return new StepDelta(delta.isRowsChanged(), delta.isColumnsChanged(), cells);
		}
	}

	public RowDelta getRowDelta() throws DcError {
		synchronized(gnode) {
			check();
			List<Integer> proj = projection();
			int n = context.getColumnCount();
			RowDelta delta = context.getRowDelta();
			List<Integer> rows = new ArrayList<>();
			List<Object> data = new ArrayList<>();
			for(int i = 0; i < delta.getRows().size(); i++) {
				int row = delta.getRows().get(i) - rowOffset;
				if(row < 0) continue;
				rows.add(row);
				for(int c : proj) {
					data.add(delta.getData().get(i * n + c));
				}
			}
			return new RowDelta(rows, data);
		}
	}

	//
	// Listeners
	//

	public void onUpdate(UpdateListener listener) throws DcError {
		check();
		listeners.add(listener);
	}

	public void removeUpdate(UpdateListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Inform listeners that a batch from the port has been processed.
	 */
	public void fireUpdate(int portId) {
		if(isStale()) return;
		for(UpdateListener l : listeners) {
			try {
				l.onUpdate(this, portId);
			}
			catch(RuntimeException e) {
				LOG.errorf(e, "Update listener of view '%s' failed", name);
			}
		}
	}

	/**
	 * Unregister the context. The view cannot be used afterwards.
	 */
	public void delete() {
		synchronized(gnode) {
			if(deleted) return;
			deleted = true;
			listeners.clear();
			gnode.unregisterContext(name);
		}
	}

	@Override
	public String toString() {
		return "[" + name + "]";
	}

	//
	// Creation
	//

	/**
	 * Resolve the configuration against the data schema of the gnode, create the context and register it.
	 */
	public static View create(Gnode gnode, String name, ViewConfig config) throws DcError {
		synchronized(gnode) {
			Schema schema = gnode.getDataSchema();

			for(String p : config.getRowPivots()) checkPivot(schema, p, "Row pivot");
			for(String p : config.getColumnPivots()) checkPivot(schema, p, "Column pivot");
			List<String> columns = new ArrayList<>(config.getColumns() != null ? config.getColumns() : schema.getColumns());
			for(String c : columns) checkColumn(schema, c, "Column");
			for(String c : config.getAggregates().keySet()) checkColumn(schema, c, "Aggregate column");
			for(SortSpec s : config.getSorts()) checkColumn(schema, s.getColumn(), "Sort column");

			Filter filter = new Filter(config.getFilters(), config.getFilterOp()).bind(schema);

			Context context;
			Set<String> hidden = new LinkedHashSet<>();
			if(config.getSides() == 0) {
				ContextConfig cc = new ContextConfig(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), columns, filter, config.getSorts());
				context = new Ctx0(cc);
			}
			else {
				List<AggSpec> aggs = new ArrayList<>();
				for(String c : columns) {
					aggs.add(resolveAggregate(schema, c, config));
				}
				for(SortSpec s : config.getSorts()) {
					String c = s.getColumn();
					if(columns.contains(c) || hidden.contains(c) || config.getRowPivots().contains(c) || config.getColumnPivots().contains(c)) continue;
					aggs.add(resolveAggregate(schema, c, config));
					hidden.add(c);
				}
				if(aggs.isEmpty()) {
					throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid view configuration.", "A pivoted view needs at least one column.");
				}

				List<String> rowPivots = config.isColumnOnly() ? Collections.singletonList(Schema.OKEY) : config.getRowPivots();
				ContextConfig cc = new ContextConfig(rowPivots, config.getColumnPivots(), aggs, columns, filter, config.getSorts());

				int defaultDepth = gnode.getConfig().getDefaultExpandDepth();
				if(config.getSides() == 1) {
					context = new Ctx1(cc);
				}
				else {
					Integer columnDepth = config.getColumnExpandDepth();
					context = new Ctx2(cc, columnDepth != null ? columnDepth : defaultDepth);
				}
				Integer rowDepth = config.getRowExpandDepth();
				if(rowDepth != null || defaultDepth >= 0) {
					context.setDepth(Header.ROW, rowDepth != null ? rowDepth : defaultDepth);
				}
			}

			gnode.registerContext(name, context);
			LOG.debugf("View '%s' created on '%s' with %d sides", name, gnode.getName(), context.sides());
			return new View(name, gnode, config, context, hidden);
		}
	}

	// Rows can also be pivoted by the primary key
	private static void checkPivot(Schema schema, String column, String role) throws DcError {
		if(Schema.OKEY.equals(column) || Schema.PKEY.equals(column)) return;
		checkColumn(schema, column, role);
	}

	private static void checkColumn(Schema schema, String column, String role) throws DcError {
		if(!schema.hasColumn(column)) {
			throw new DcError(DcErrorCode.UNKNOWN_COLUMN, "Unknown column.", role + " '" + column + "' not found.");
		}
	}

	private static AggSpec resolveAggregate(Schema schema, String column, ViewConfig config) throws DcError {
		DType dtype = schema.getType(column);
		Pair<String, String> agg = config.getAggregates().get(column);
		AggType type = agg == null ? AggType.getDefault(dtype) : AggType.fromName(agg.getLeft());

		if(type.requiresNumeric() && !dtype.isNumeric()) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid aggregate.", "Aggregate '" + type.getName() + "' requires a numeric column but '" + column + "' is " + dtype.getTypeName() + ".");
		}
		if(type != AggType.WEIGHTED_MEAN) {
			return new AggSpec(column, type, column);
		}

		String weight = agg.getRight();
		if(weight == null) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid aggregate.", "Weighted mean of '" + column + "' needs a weight column.");
		}
		checkColumn(schema, weight, "Weight column");
		if(!schema.getType(weight).isNumeric()) {
			throw new DcError(DcErrorCode.INVALID_CONFIG, "Invalid aggregate.", "Weight column '" + weight + "' is not numeric.");
		}
		return new AggSpec(column, type, column, weight);
	}

	private View(String name, Gnode gnode, ViewConfig config, Context context, Set<String> hiddenSorts) {
		this.name = name;
		this.gnode = gnode;
		this.generation = gnode.getGeneration();
		this.config = config.copy();
		this.context = context;
		this.separator = gnode.getConfig().getSeparator();
		this.rowOffset = config.isColumnOnly() ? 1 : 0;
		this.hiddenSorts = Collections.unmodifiableSet(hiddenSorts);
	}
}
