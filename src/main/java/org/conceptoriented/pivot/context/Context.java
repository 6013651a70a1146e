package org.conceptoriented.pivot.context;

import java.util.List;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.Table;
import org.conceptoriented.pivot.gnode.GnodeState;
import org.conceptoriented.pivot.gnode.NotifyFrame;

/**
 * Derived structure maintained incrementally from the batches processed by a gnode. 
 * Coordinates (row and column indexes) stay stable between notifications and change only 
 * as a result of notify, open, close, setDepth or sortBy.
 */
public interface Context {

	/**
	 * 0 for flat contexts, 1 for row pivots, 2 for row and column pivots.
	 */
	int sides();

	/**
	 * Bind to the state of the owning gnode. The state is not owned by the context.
	 */
	void init(GnodeState state);

	/**
	 * Initial load from a snapshot of all live rows.
	 */
	void notify(Table snapshot);

	/**
	 * Apply one processed batch.
	 */
	void notify(NotifyFrame frame);

	/**
	 * Drop all derived data. The context stays bound to its state.
	 */
	void reset();

	//
	// Read
	//

	int getRowCount();

	int getColumnCount();

	List<Object> getRowPath(int row);

	/**
	 * Pivot values of the column from the root to the leaf followed by nothing: the aggregate name is added by the consumer.
	 */
	List<Object> getColumnPath(int column);

	/**
	 * Values of the window in row-major order.
	 */
	List<Object> getData(int startRow, int endRow, int startCol, int endCol);

	DType getColumnDType(int column);

	/**
	 * Aggregates of pivoted contexts. Empty for flat contexts.
	 */
	List<AggSpec> getAggregates();

	/**
	 * Names of the value columns: aggregate names or, for flat contexts, source column names.
	 */
	List<String> getColumnNames();

	//
	// Layout
	//

	void sortBy(List<SortSpec> sorts);

	/**
	 * Order of the column axis. Only two-sided contexts have one.
	 */
	void columnSortBy(List<SortSpec> sorts);

	int open(Header header, int idx);

	int close(Header header, int idx);

	void setDepth(Header header, int depth);

	int getRowDepth(int row);

	boolean isRowExpanded(int row);

	//
	// Changes since the last read
	//

	StepDelta getStepDelta(int bidx, int eidx);

	RowDelta getRowDelta();
}
