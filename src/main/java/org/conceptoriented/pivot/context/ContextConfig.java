package org.conceptoriented.pivot.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolved configuration of a context. Column names refer to the state schema.
 */
public final class ContextConfig {

	private final List<String> rowPivots;
	public List<String> getRowPivots() {
		return rowPivots;
	}

	private final List<String> columnPivots;
	public List<String> getColumnPivots() {
		return columnPivots;
	}

	// Pivoted contexts
	private final List<AggSpec> aggregates;
	public List<AggSpec> getAggregates() {
		return aggregates;
	}

	// Flat contexts
	private final List<String> columns;
	public List<String> getColumns() {
		return columns;
	}

	private final Filter filter;
	public Filter getFilter() {
		return filter;
	}

	private final List<SortSpec> sorts;
	public List<SortSpec> getSorts() {
		return sorts;
	}

	public int getAggIndex(String name) {
		for(int k = 0; k < aggregates.size(); k++) {
			if(aggregates.get(k).getName().equals(name)) return k;
		}
		return -1;
	}

	public ContextConfig(List<String> rowPivots, List<String> columnPivots, List<AggSpec> aggregates, List<String> columns, Filter filter, List<SortSpec> sorts) {
		this.rowPivots = Collections.unmodifiableList(new ArrayList<>(rowPivots));
		this.columnPivots = Collections.unmodifiableList(new ArrayList<>(columnPivots));
		this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
		this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
		this.filter = filter == null ? Filter.ALL : filter;
		this.sorts = Collections.unmodifiableList(new ArrayList<>(sorts));
	}
}
