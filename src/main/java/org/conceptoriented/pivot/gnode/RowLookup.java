package org.conceptoriented.pivot.gnode;

/**
 * Result of resolving a primary key against the state.
 */
public final class RowLookup {

	public static final RowLookup ABSENT = new RowLookup(false, -1);

	private final boolean exists;
	public boolean exists() {
		return exists;
	}

	private final int index;
	public int getIndex() {
		return index;
	}

	@Override
	public String toString() {
		return exists ? "[" + index + "]" : "[absent]";
	}

	public RowLookup(boolean exists, int index) {
		this.exists = exists;
		this.index = index;
	}
}
