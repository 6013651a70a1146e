package org.conceptoriented.pivot.context;

/**
 * Context with row and column pivots. Every visible column tree node contributes one column per aggregate. 
 * If rows are sorted, expanded column nodes are shown as well and carry the totals of their subtree.
 */
public class Ctx2 extends PivotContext {

	@Override
	public int sides() {
		return 2;
	}

	public Ctx2(ContextConfig config) {
		this(config, -1);
	}

	/**
	 * @param columnDepth automatic expansion depth of the column tree, negative for unlimited
	 */
	public Ctx2(ContextConfig config, int columnDepth) {
		super(config, columnDepth);
	}
}
