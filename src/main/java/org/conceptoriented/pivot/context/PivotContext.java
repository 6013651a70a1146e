package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
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
import org.conceptoriented.pivot.gnode.ValueTransition;

/**
 * Aggregates over a row pivot tree and a column pivot tree. 
 * Every member row contributes to the cells of all pairs of its row ancestors and column ancestors. 
 * Without column pivots the column tree consists of its root only.
 */
public abstract class PivotContext implements Context {

	protected final ContextConfig config;
	protected final List<AggSpec> aggs;
	protected GnodeState state;

	private DType[] inputTypes;

	protected final AggTree rows = new AggTree();
	protected final AggTree columns = new AggTree();

	protected final Traversal rowTraversal;
	protected final Traversal columnTraversal;

	private List<SortSpec> sorts;
	private List<SortSpec> columnSorts = new ArrayList<>();

	// Row and column leaf of every member key
	private final Map<Object, Member> members = new HashMap<>();

	private final Map<Long, Cell> cells = new HashMap<>();

	// Visible column tree nodes, each contributes one column per aggregate
	private final List<TreeNode> groups = new ArrayList<>();
	private final Map<Integer, Integer> groupPositions = new HashMap<>();
	private boolean layoutDirty = true;

	// Changes since the last read
	private final Map<Long, Object[]> stepBefore = new HashMap<>();
	private final Set<Integer> touchedRows = new HashSet<>();
	private boolean orderChanged;

	private static final class Member {
		final TreeNode row;
		final TreeNode column;
		Member(TreeNode row, TreeNode column) {
			this.row = row;
			this.column = column;
		}
	}

	private static final class Cell {
		final Accumulator[] accs;
		int count;
		Cell(Accumulator[] accs) {
			this.accs = accs;
		}
	}

	private interface RowSource {
		Object get(String column);
	}

	//
	// Binding
	//

	@Override
	public void init(GnodeState state) {
		this.state = state;
		resolveTypes();
	}

	private void resolveTypes() {
		inputTypes = new DType[aggs.size()];
		for(int k = 0; k < aggs.size(); k++) {
			Column c = state.getTable().getColumn(aggs.get(k).getColumn());
			if(c == null) {
				throw new DcFault("Aggregate column '" + aggs.get(k).getColumn() + "' not found in state.");
			}
			inputTypes[k] = c.getDType();
		}
	}

	@Override
	public void reset() {
		rows.clear();
		columns.clear();
		members.clear();
		cells.clear();
		stepBefore.clear();
		touchedRows.clear();
		orderChanged = true;
		layoutDirty = true;
		if(state != null) resolveTypes();
	}

	//
	// Notification
	//

	@Override
	public void notify(Table snapshot) {
		Column pkeys = snapshot.getColumn(Schema.PKEY);
		for(int row = 0; row < snapshot.getSize(); row++) {
			Object pkey = pkeys.getValue(row);
			if(members.containsKey(pkey)) {
				throw new DcFault("Key " + pkey + " is already a member of the context.");
			}
			if(config.getFilter().matches(snapshot, row)) {
				addMember(pkey, source(snapshot, row, pkey));
			}
		}
		layoutDirty = true;
	}

	@Override
	public void notify(NotifyFrame frame) {
		Table current = frame.getCurrent();
		Table prev = frame.getPrev();
		for(int i = 0; i < frame.size(); i++) {
			Object pkey = frame.getPkey(i);
			Member old = members.get(pkey);
			boolean memberNow = frame.existsNow(i) && config.getFilter().matches(current, i);
			RowSource cur = source(current, i, pkey);

			if(old != null && memberNow && isOnPath(old.row, config.getRowPivots(), cur) && isOnPath(old.column, config.getColumnPivots(), cur)) {
				applyTransitions(old, frame, i);
				continue;
			}
			if(old != null) {
				removeMember(pkey, old, source(prev, i, pkey));
			}
			if(memberNow) {
				addMember(pkey, cur);
			}
		}
		layoutDirty = true;
	}

	private static RowSource source(Table table, int row, Object pkey) {
		return column -> {
			if(Schema.OKEY.equals(column) || Schema.PKEY.equals(column)) return pkey;
			return table.getColumn(column).getValue(row);
		};
	}

	private static List<Object> path(List<String> pivots, RowSource src) {
		List<Object> path = new ArrayList<>(pivots.size());
		for(String p : pivots) path.add(src.get(p));
		return path;
	}

	private static boolean isOnPath(TreeNode leaf, List<String> pivots, RowSource src) {
		TreeNode n = leaf;
		for(int d = pivots.size() - 1; d >= 0; d--) {
			if(!Values.equal(n.getValue(), src.get(pivots.get(d)))) return false;
			n = n.getParent();
		}
		return true;
	}

	// Aggregated value of the row or null if it does not contribute
	private Object contribution(int k, RowSource src) {
		AggSpec spec = aggs.get(k);
		Object v = src.get(spec.getColumn());
		if(spec.getWeight() == null || v == null) return v;
		Object w = src.get(spec.getWeight());
		return w == null ? null : new Object[] { v, w };
	}

	private void addMember(Object pkey, RowSource src) {
		TreeNode r = rows.getOrCreate(path(config.getRowPivots(), src));
		TreeNode c = columns.getOrCreate(path(config.getColumnPivots(), src));
		rows.addMember(r);
		columns.addMember(c);
		members.put(pkey, new Member(r, c));

		Object[] values = new Object[aggs.size()];
		for(int k = 0; k < values.length; k++) values[k] = contribution(k, src);

		for(TreeNode rn : r.getLineage()) {
			for(TreeNode cn : c.getLineage()) {
				Cell cell = touch(rn, cn, true);
				cell.count++;
				for(int k = 0; k < values.length; k++) {
					if(values[k] != null) cell.accs[k].add(values[k]);
				}
			}
		}
	}

	private void removeMember(Object pkey, Member m, RowSource src) {
		Object[] values = new Object[aggs.size()];
		for(int k = 0; k < values.length; k++) values[k] = contribution(k, src);

		for(TreeNode rn : m.row.getLineage()) {
			for(TreeNode cn : m.column.getLineage()) {
				Cell cell = touch(rn, cn, false);
				if(cell == null) {
					throw new DcFault("Missing aggregate cell for member " + pkey + ".");
				}
				for(int k = 0; k < values.length; k++) {
					if(values[k] != null) cell.accs[k].retract(values[k]);
				}
				cell.count--;
				if(cell.count == 0) {
					long key = key(rn, cn);
					cells.remove(key);
					// A cell created and removed since the last read has no change to report
					if(stepBefore.get(key) == null) stepBefore.remove(key);
				}
			}
		}

		members.remove(pkey);
		List<Integer> removed = new ArrayList<>();
		rows.removeMember(m.row, removed);
		rowTraversal.forget(removed);
		touchedRows.removeAll(removed);
		removed.clear();
		columns.removeMember(m.column, removed);
		columnTraversal.forget(removed);
	}

	private void applyTransitions(Member m, NotifyFrame frame, int i) {
		List<TreeNode> rowLineage = null;
		List<TreeNode> columnLineage = null;

		for(int k = 0; k < aggs.size(); k++) {
			AggSpec spec = aggs.get(k);
			ValueTransition t = frame.getTransition(spec.getColumn(), i);
			ValueTransition tw = spec.getWeight() == null ? ValueTransition.EQ_FF : frame.getTransition(spec.getWeight(), i);
			if(!t.isChange() && !tw.isChange()) continue;

			if(rowLineage == null) {
				rowLineage = m.row.getLineage();
				columnLineage = m.column.getLineage();
			}

			Object pkey = frame.getPkey(i);
			Object before = contribution(k, source(frame.getPrev(), i, pkey));
			Object after = contribution(k, source(frame.getCurrent(), i, pkey));
			Object delta = spec.getWeight() == null ? frame.getDelta().getColumn(spec.getColumn()).getValue(i) : null;

			for(TreeNode rn : rowLineage) {
				for(TreeNode cn : columnLineage) {
					Accumulator acc = touch(rn, cn, false).accs[k];
					if(spec.getWeight() != null) {
						if(before != null) acc.retract(before);
						if(after != null) acc.add(after);
					}
					else if(t == ValueTransition.NEQ_TT && acc.isAdditive() && delta != null) {
						acc.applyDelta(delta);
					}
					else {
						if(t.retractsPrevious()) acc.retract(before);
						if(t.addsCurrent()) acc.add(after);
					}
				}
			}
		}
	}

	private static long key(TreeNode row, TreeNode column) {
		return ((long)row.getId() << 32) | (column.getId() & 0xFFFFFFFFL);
	}

	// Remember the values of the cell before its first change since the last read
	private Cell touch(TreeNode rn, TreeNode cn, boolean create) {
		long key = key(rn, cn);
		Cell cell = cells.get(key);
		if(!stepBefore.containsKey(key)) {
			stepBefore.put(key, cell == null ? null : displayValues(rn, cn));
		}
		touchedRows.add(rn.getId());
		if(cell == null && create) {
			Accumulator[] accs = new Accumulator[aggs.size()];
			for(int k = 0; k < accs.length; k++) {
				accs[k] = Accumulator.create(aggs.get(k).getType(), inputTypes[k]);
			}
			cell = new Cell(accs);
			cells.put(key, cell);
		}
		return cell;
	}

	//
	// Values
	//

	private Object rawValue(TreeNode rn, TreeNode cn, int k) {
		Cell cell = cells.get(key(rn, cn));
		return cell == null ? null : cell.accs[k].getValue();
	}

	protected Object cellValue(TreeNode rn, TreeNode cn, int k) {
		Object raw = rawValue(rn, cn, k);
		switch(aggs.get(k).getType()) {
		case PCT_SUM_PARENT:
			return percent(raw, rawValue(rn.isRoot() ? rn : rn.getParent(), cn, k));
		case PCT_SUM_GRAND_TOTAL:
			return percent(raw, rawValue(rows.getRoot(), cn, k));
		default:
			return raw;
		}
	}

	private static Object percent(Object value, Object total) {
		if(value == null || total == null) return null;
		double t = Values.toDouble(total);
		if(t == 0.0) return null;
		return Values.toDouble(value) / t * 100.0;
	}

	private Object[] displayValues(TreeNode rn, TreeNode cn) {
		if(!cells.containsKey(key(rn, cn))) return null;
		Object[] values = new Object[aggs.size()];
		for(int k = 0; k < values.length; k++) values[k] = cellValue(rn, cn, k);
		return values;
	}

	//
	// Layout
	//

	protected void ensureLayout() {
		if(!layoutDirty) return;
		rowTraversal.rebuild(rows.getRoot(), this::orderedRowChildren);

		groups.clear();
		groupPositions.clear();
		visitColumn(columns.getRoot(), sides() == 2 && hasRowSort());
		layoutDirty = false;
	}

	private void visitColumn(TreeNode node, boolean headers) {
		if(!columnTraversal.isExpanded(node)) {
			addGroup(node);
			return;
		}
		if(headers && !node.isRoot()) addGroup(node);
		for(TreeNode child : orderedColumnChildren(node)) {
			visitColumn(child, headers);
		}
	}

	private void addGroup(TreeNode node) {
		groupPositions.put(node.getId(), groups.size());
		groups.add(node);
	}

	private boolean hasRowSort() {
		return sorts.stream().anyMatch(s -> !s.getOrder().isNone() && !s.getOrder().isColumnSort() && !config.getColumnPivots().contains(s.getColumn()));
	}

	/**
	 * Whether the column belongs to an expanded column node shown inline because rows are sorted.
	 */
	public boolean isHeaderColumn(int column) {
		ensureLayout();
		TreeNode node = getGroup(column);
		return node != null && columnTraversal.isExpanded(node);
	}

	private List<TreeNode> orderedRowChildren(TreeNode parent) {
		List<TreeNode> children = new ArrayList<>(parent.getChildren());
		List<String> pivots = config.getRowPivots();
		String level = parent.getDepth() < pivots.size() ? pivots.get(parent.getDepth()) : null;

		Comparator<TreeNode> cmp = null;
		for(SortSpec s : sorts) {
			SortOrder order = s.getOrder();
			if(order.isNone() || order.isColumnSort()) continue;
			Comparator<TreeNode> c = null;
			if(s.getColumn().equals(level)) {
				c = (a, b) -> order.compare(a.getValue(), b.getValue());
			}
			else {
				int k = config.getAggIndex(s.getColumn());
				if(k >= 0) {
					TreeNode total = columns.getRoot();
					c = (a, b) -> order.compare(cellValue(a, total, k), cellValue(b, total, k));
				}
			}
			if(c != null) cmp = cmp == null ? c : cmp.thenComparing(c);
		}
		Comparator<TreeNode> byValue = (a, b) -> Values.compare(a.getValue(), b.getValue());
		children.sort(cmp == null ? byValue : cmp.thenComparing(byValue));
		return children;
	}

	private List<TreeNode> orderedColumnChildren(TreeNode parent) {
		List<TreeNode> children = new ArrayList<>(parent.getChildren());
		List<String> pivots = config.getColumnPivots();
		String level = parent.getDepth() < pivots.size() ? pivots.get(parent.getDepth()) : null;

		List<SortSpec> specs = new ArrayList<>(columnSorts);
		specs.addAll(sorts);

		Comparator<TreeNode> cmp = null;
		for(SortSpec s : specs) {
			SortOrder order = s.getOrder();
			if(order.isNone()) continue;
			Comparator<TreeNode> c = null;
			if(s.getColumn().equals(level)) {
				c = (a, b) -> order.compare(a.getValue(), b.getValue());
			}
			else if(order.isColumnSort() || columnSorts.contains(s)) {
				int k = config.getAggIndex(s.getColumn());
				if(k >= 0) {
					TreeNode total = rows.getRoot();
					c = (a, b) -> order.compare(cellValue(total, a, k), cellValue(total, b, k));
				}
			}
			if(c != null) cmp = cmp == null ? c : cmp.thenComparing(c);
		}
		Comparator<TreeNode> byValue = (a, b) -> Values.compare(a.getValue(), b.getValue());
		children.sort(cmp == null ? byValue : cmp.thenComparing(byValue));
		return children;
	}

	@Override
	public void sortBy(List<SortSpec> sorts) {
		this.sorts = new ArrayList<>(sorts);
		orderChanged = true;
		layoutDirty = true;
	}

	/**
	 * Order the children of column nodes. Specs referring to an aggregate compare its values in the total row.
	 */
	@Override
	public void columnSortBy(List<SortSpec> sorts) {
		this.columnSorts = new ArrayList<>(sorts);
		layoutDirty = true;
	}

	public List<SortSpec> getSorts() {
		return Collections.unmodifiableList(sorts);
	}

	@Override
	public int open(Header header, int idx) {
		ensureLayout();
		if(header == Header.ROW) {
			TreeNode node = rowTraversal.get(idx);
			if(node == null || !node.hasChildren() || rowTraversal.isExpanded(node)) return 0;
			int before = rowTraversal.size();
			rowTraversal.open(node);
			layoutDirty = true;
			ensureLayout();
			return rowTraversal.size() - before;
		}
		TreeNode node = getGroup(idx);
		if(sides() < 2 || node == null || !node.hasChildren() || columnTraversal.isExpanded(node)) return 0;
		int before = getColumnCount();
		columnTraversal.open(node);
		layoutDirty = true;
		ensureLayout();
		return getColumnCount() - before;
	}

	@Override
	public int close(Header header, int idx) {
		ensureLayout();
		if(header == Header.ROW) {
			TreeNode node = rowTraversal.get(idx);
			if(node == null || !rowTraversal.isExpanded(node)) return 0;
			int before = rowTraversal.size();
			rowTraversal.close(node);
			layoutDirty = true;
			ensureLayout();
			return before - rowTraversal.size();
		}
		TreeNode node = getGroup(idx);
		if(sides() < 2 || node == null || !columnTraversal.isExpanded(node)) return 0;
		int before = getColumnCount();
		columnTraversal.close(node);
		layoutDirty = true;
		ensureLayout();
		return before - getColumnCount();
	}

	@Override
	public void setDepth(Header header, int depth) {
		if(header == Header.ROW) {
			rowTraversal.setDepth(depth);
		}
		else if(sides() == 2) {
			columnTraversal.setDepth(depth);
		}
		layoutDirty = true;
	}

	private TreeNode getGroup(int column) {
		int g = column / Math.max(1, aggs.size());
		return g >= 0 && g < groups.size() ? groups.get(g) : null;
	}

	//
	// Read
	//

	@Override
	public int getRowCount() {
		ensureLayout();
		return rowTraversal.size();
	}

	@Override
	public int getColumnCount() {
		ensureLayout();
		return groups.size() * aggs.size();
	}

	@Override
	public List<Object> getRowPath(int row) {
		ensureLayout();
		TreeNode node = rowTraversal.get(row);
		return node == null ? Collections.emptyList() : node.getPath();
	}

	@Override
	public List<Object> getColumnPath(int column) {
		ensureLayout();
		TreeNode node = getGroup(column);
		return node == null ? Collections.emptyList() : node.getPath();
	}

	@Override
	public int getRowDepth(int row) {
		ensureLayout();
		TreeNode node = rowTraversal.get(row);
		return node == null ? 0 : node.getDepth();
	}

	@Override
	public boolean isRowExpanded(int row) {
		ensureLayout();
		TreeNode node = rowTraversal.get(row);
		return node != null && rowTraversal.isExpanded(node);
	}

	@Override
	public List<Object> getData(int startRow, int endRow, int startCol, int endCol) {
		ensureLayout();
		int nAggs = aggs.size();
		int rowEnd = Math.min(endRow, rowTraversal.size());
		int colEnd = Math.min(endCol, groups.size() * nAggs);
		List<Object> data = new ArrayList<>();
		for(int r = Math.max(0, startRow); r < rowEnd; r++) {
			TreeNode rn = rowTraversal.get(r);
			for(int c = Math.max(0, startCol); c < colEnd; c++) {
				data.add(cellValue(rn, groups.get(c / nAggs), c % nAggs));
			}
		}
		return data;
	}

	@Override
	public DType getColumnDType(int column) {
		int k = column % aggs.size();
		return aggs.get(k).getType().getOutputType(inputTypes[k]);
	}

	@Override
	public List<AggSpec> getAggregates() {
		return aggs;
	}

	@Override
	public List<String> getColumnNames() {
		List<String> names = new ArrayList<>();
		aggs.forEach(a -> names.add(a.getName()));
		return names;
	}

	/**
	 * Aggregate value for a row path and a column path or null if no row contributes to it.
	 */
	public Object getValue(List<Object> rowPath, List<Object> columnPath, String aggregate) {
		int k = config.getAggIndex(aggregate);
		TreeNode rn = rows.find(canonicalPath(config.getRowPivots(), rowPath));
		TreeNode cn = columns.find(canonicalPath(config.getColumnPivots(), columnPath));
		if(k < 0 || rn == null || cn == null) return null;
		return cellValue(rn, cn, k);
	}

	// Path values in the form the pivot columns return them
	private List<Object> canonicalPath(List<String> pivots, List<Object> path) {
		List<Object> canonical = new ArrayList<>(path.size());
		for(int d = 0; d < path.size(); d++) {
			Column c = state != null && d < pivots.size() ? state.getTable().getColumn(pivots.get(d)) : null;
			canonical.add(c == null ? path.get(d) : Values.canonical(path.get(d), c.getDType()));
		}
		return canonical;
	}

	public int getMemberCount() {
		return members.size();
	}

	//
	// Changes
	//

	@Override
	public StepDelta getStepDelta(int bidx, int eidx) {
		ensureLayout();
		int nAggs = aggs.size();
		TreeSet<CellDelta> changed = new TreeSet<>(Comparator.comparingInt(CellDelta::getRow).thenComparingInt(CellDelta::getColumn));
		for(Map.Entry<Long, Object[]> e : stepBefore.entrySet()) {
			int rowId = (int)(e.getKey() >>> 32);
			int colId = (int)(long)e.getKey();
			int r = rowTraversal.indexOf(rowId);
			Integer g = groupPositions.get(colId);
			if(r < bidx || r >= eidx || g == null) continue;

			Object[] before = e.getValue();
			Object[] after = displayValues(rows.getNode(rowId), columns.getNode(colId));
			for(int k = 0; k < nAggs; k++) {
				Object o = before == null ? null : before[k];
				Object n = after == null ? null : after[k];
				if(!Values.equal(o, n)) {
					changed.add(new CellDelta(r, g * nAggs + k, o, n));
				}
			}
		}

		StepDelta delta = new StepDelta(rows.isStructureChanged() || orderChanged, columns.isStructureChanged(), new ArrayList<>(changed));
		stepBefore.clear();
		rows.clearStructureChanged();
		columns.clearStructureChanged();
		orderChanged = false;
		return delta;
	}

	@Override
	public RowDelta getRowDelta() {
		ensureLayout();
		TreeSet<Integer> changed = new TreeSet<>();
		for(int id : touchedRows) {
			int r = rowTraversal.indexOf(id);
			if(r >= 0) changed.add(r);
		}
		touchedRows.clear();

		int columnCount = getColumnCount();
		List<Object> data = new ArrayList<>();
		for(int r : changed) {
			data.addAll(getData(r, r + 1, 0, columnCount));
		}
		return new RowDelta(new ArrayList<>(changed), data);
	}

	/**
	 * Number of cells and rows remembered for the next step and row deltas.
	 */
	int getPendingCells() {
		return stepBefore.size();
	}
	int getPendingRows() {
		return touchedRows.size();
	}

	@Override
	public String toString() {
		return "[ctx" + sides() + " " + config.getRowPivots() + " x " + config.getColumnPivots() + "]";
	}

	protected PivotContext(ContextConfig config, int columnDepth) {
		this.config = config;
		this.aggs = config.getAggregates();
		this.sorts = new ArrayList<>(config.getSorts());
		this.rowTraversal = new Traversal(config.getRowPivots().size());
		this.columnTraversal = new Traversal(columnDepth);
	}
}
