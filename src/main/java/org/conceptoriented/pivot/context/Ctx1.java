package org.conceptoriented.pivot.context;

/**
 * Context with row pivots only. Each aggregate produces one column.
 */
public class Ctx1 extends PivotContext {

	@Override
	public int sides() {
		return 1;
	}

	public Ctx1(ContextConfig config) {
		super(config, 0);
		if(!config.getColumnPivots().isEmpty()) {
			throw new IllegalArgumentException("One-sided context cannot have column pivots.");
		}
	}
}
