package org.conceptoriented.pivot.context;

/**
 * Sort by a column: a source column for flat contexts, a pivot column or an aggregate name for pivoted ones.
 */
public final class SortSpec {

	private final String column;
	public String getColumn() {
		return column;
	}

	private final SortOrder order;
	public SortOrder getOrder() {
		return order;
	}

	@Override
	public String toString() {
		return "[" + column + " " + order.getName() + "]";
	}

	public SortSpec(String column, SortOrder order) {
		this.column = column;
		this.order = order;
	}
}
