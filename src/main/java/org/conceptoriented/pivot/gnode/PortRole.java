package org.conceptoriented.pivot.gnode;

public enum PortRole {
	INPUT,
	FLATTENED,
	DELTA,
	PREV,
	CURRENT,
	TRANSITIONS,
	EXISTED,
	;

	public boolean isOutput() {
		return this != INPUT;
	}
}
