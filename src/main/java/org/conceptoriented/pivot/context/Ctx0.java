package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.conceptoriented.pivot.core.Column;
import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.Schema;
import org.conceptoriented.pivot.core.Table;
import org.conceptoriented.pivot.core.Values;
import org.conceptoriented.pivot.gnode.GnodeState;
import org.conceptoriented.pivot.gnode.NotifyFrame;

/**
 * Flat context: the filtered live rows in sort order. Values are read from the gnode state.
 */
public class Ctx0 implements Context {

	private final ContextConfig config;
	private GnodeState state;

	private List<SortSpec> sorts;

	private final Map<Object, Entry> members = new HashMap<>();
	private TreeSet<Entry> ordered;

	// Cached positions of the ordered members
	private List<Object> rows;
	private Map<Object, Integer> positions;

	// Values of the changed rows before their first change since the last read. Null for rows which were not members.
	private final Map<Object, Object[]> stepBefore = new LinkedHashMap<>();
	private final Set<Object> touched = new LinkedHashSet<>();
	private boolean rowsChanged;

	private static final class Entry {
		final Object pkey;
		final Object[] sortValues;
		Entry(Object pkey, Object[] sortValues) {
			this.pkey = pkey;
			this.sortValues = sortValues;
		}
	}

	@Override
	public int sides() {
		return 0;
	}

	@Override
	public void init(GnodeState state) {
		this.state = state;
	}

	@Override
	public void reset() {
		members.clear();
		ordered.clear();
		stepBefore.clear();
		touched.clear();
		rowsChanged = true;
		rows = null;
	}

	//
	// Notification
	//

	@Override
	public void notify(Table snapshot) {
		Column pkeys = snapshot.getColumn(Schema.PKEY);
		for(int row = 0; row < snapshot.getSize(); row++) {
			Object pkey = pkeys.getValue(row);
			if(config.getFilter().matches(snapshot, row)) {
				add(pkey, snapshot, row);
			}
		}
		rows = null;
	}

	@Override
	public void notify(NotifyFrame frame) {
		Table current = frame.getCurrent();
		for(int i = 0; i < frame.size(); i++) {
			Object pkey = frame.getPkey(i);
			Entry old = members.get(pkey);
			boolean memberNow = frame.existsNow(i) && config.getFilter().matches(current, i);
			if(old == null && !memberNow) continue;

			if(!stepBefore.containsKey(pkey)) {
				stepBefore.put(pkey, old == null ? null : values(frame.getPrev(), i, pkey));
			}
			touched.add(pkey);

			if(old != null) {
				ordered.remove(old);
				members.remove(pkey);
			}
			Entry now = memberNow ? add(pkey, current, i) : null;
			if(old == null || now == null || !Arrays.equals(old.sortValues, now.sortValues)) {
				rowsChanged = true;
			}
			if(now == null) {
				// Rows which are not members are never reported
				touched.remove(pkey);
				if(stepBefore.get(pkey) == null) stepBefore.remove(pkey);
			}
		}
		rows = null;
	}

	private Entry add(Object pkey, Table table, int row) {
		Object[] sortValues = new Object[sorts.size()];
		for(int s = 0; s < sortValues.length; s++) {
			sortValues[s] = value(table, row, pkey, sorts.get(s).getColumn());
		}
		Entry e = new Entry(pkey, sortValues);
		if(members.put(pkey, e) != null) {
			throw new DcFault("Key " + pkey + " is already a member of the context.");
		}
		ordered.add(e);
		return e;
	}

	private static Object value(Table table, int row, Object pkey, String column) {
		if(Schema.PKEY.equals(column) || Schema.OKEY.equals(column)) return pkey;
		return table.getColumn(column).getValue(row);
	}

	private Object[] values(Table table, int row, Object pkey) {
		List<String> columns = config.getColumns();
		Object[] values = new Object[columns.size()];
		for(int c = 0; c < values.length; c++) {
			values[c] = value(table, row, pkey, columns.get(c));
		}
		return values;
	}

	private Object[] currentValues(Object pkey) {
		List<String> columns = config.getColumns();
		Object[] values = new Object[columns.size()];
		for(int c = 0; c < values.length; c++) {
			values[c] = state.getValue(pkey, columns.get(c));
		}
		return values;
	}

	//
	// Order
	//

	private TreeSet<Entry> newOrder() {
		List<SortSpec> active = sorts;
		Comparator<Entry> cmp = (a, b) -> {
			for(int s = 0; s < active.size(); s++) {
				SortOrder order = active.get(s).getOrder();
				if(order.isNone() || order.isColumnSort()) continue;
				int c = order.compare(a.sortValues[s], b.sortValues[s]);
				if(c != 0) return c;
			}
			return Values.compare(a.pkey, b.pkey);
		};
		return new TreeSet<>(cmp);
	}

	private void ensureRows() {
		if(rows != null) return;
		rows = new ArrayList<>(ordered.size());
		positions = new HashMap<>();
		for(Entry e : ordered) {
			positions.put(e.pkey, rows.size());
			rows.add(e.pkey);
		}
	}

	@Override
	public void sortBy(List<SortSpec> sorts) {
		this.sorts = new ArrayList<>(sorts);
		ordered = newOrder();
		List<Object> pkeys = new ArrayList<>(members.keySet());
		members.clear();
		for(Object pkey : pkeys) {
			Object[] sortValues = new Object[this.sorts.size()];
			for(int s = 0; s < sortValues.length; s++) {
				sortValues[s] = state.getValue(pkey, this.sorts.get(s).getColumn());
			}
			Entry e = new Entry(pkey, sortValues);
			members.put(pkey, e);
			ordered.add(e);
		}
		rowsChanged = true;
		rows = null;
	}

	@Override
	public void columnSortBy(List<SortSpec> sorts) {
	}

	/**
	 * Primary key of a row.
	 */
	public Object getPkey(int row) {
		ensureRows();
		return row >= 0 && row < rows.size() ? rows.get(row) : null;
	}

	//
	// Read
	//

	@Override
	public int getRowCount() {
		return members.size();
	}

	@Override
	public int getColumnCount() {
		return config.getColumns().size();
	}

	@Override
	public List<Object> getRowPath(int row) {
		return Collections.emptyList();
	}

	@Override
	public List<Object> getColumnPath(int column) {
		return Collections.emptyList();
	}

	@Override
	public List<Object> getData(int startRow, int endRow, int startCol, int endCol) {
		ensureRows();
		List<String> columns = config.getColumns();
		int rowEnd = Math.min(endRow, rows.size());
		int colEnd = Math.min(endCol, columns.size());
		List<Object> data = new ArrayList<>();
		for(int r = Math.max(0, startRow); r < rowEnd; r++) {
			Object pkey = rows.get(r);
			for(int c = Math.max(0, startCol); c < colEnd; c++) {
				data.add(state.getValue(pkey, columns.get(c)));
			}
		}
		return data;
	}

	@Override
	public DType getColumnDType(int column) {
		return state.getTable().getColumn(config.getColumns().get(column)).getDType();
	}

	@Override
	public List<AggSpec> getAggregates() {
		return Collections.emptyList();
	}

	@Override
	public List<String> getColumnNames() {
		return config.getColumns();
	}

	// Flat rows have no hierarchy

	@Override
	public int open(Header header, int idx) {
		return 0;
	}

	@Override
	public int close(Header header, int idx) {
		return 0;
	}

	@Override
	public void setDepth(Header header, int depth) {
	}

	@Override
	public int getRowDepth(int row) {
		return 0;
	}

	@Override
	public boolean isRowExpanded(int row) {
		return false;
	}

	//
	// Changes
	//

	@Override
	public StepDelta getStepDelta(int bidx, int eidx) {
		ensureRows();
		List<CellDelta> cells = new ArrayList<>();
		for(Map.Entry<Object, Object[]> e : stepBefore.entrySet()) {
			Integer r = positions.get(e.getKey());
			if(r == null || r < bidx || r >= eidx) continue;
			Object[] before = e.getValue();
			Object[] after = currentValues(e.getKey());
			for(int c = 0; c < after.length; c++) {
				Object o = before == null ? null : before[c];
				if(!Values.equal(o, after[c])) {
					cells.add(new CellDelta(r, c, o, after[c]));
				}
			}
		}
		cells.sort(Comparator.comparingInt(CellDelta::getRow).thenComparingInt(CellDelta::getColumn));

		StepDelta delta = new StepDelta(rowsChanged, false, cells);
		stepBefore.clear();
		rowsChanged = false;
		return delta;
	}

	@Override
	public RowDelta getRowDelta() {
		ensureRows();
		TreeSet<Integer> changed = new TreeSet<>();
		for(Object pkey : touched) {
			Integer r = positions.get(pkey);
			if(r != null) changed.add(r);
		}
		touched.clear();

		List<Object> data = new ArrayList<>();
		for(int r : changed) {
			data.addAll(getData(r, r + 1, 0, getColumnCount()));
		}
		return new RowDelta(new ArrayList<>(changed), data);
	}

	int getPendingCells() {
		return stepBefore.size();
	}
	int getPendingRows() {
		return touched.size();
	}

	@Override
	public String toString() {
		return "[ctx0 " + config.getColumns() + "]";
	}

	public Ctx0(ContextConfig config) {
		this.config = config;
		this.sorts = new ArrayList<>(config.getSorts());
		this.ordered = newOrder();
	}
}
