package org.conceptoriented.pivot.core;

/**
 * A cell either holds a value, was explicitly set to null, or was never written (partial update).
 */
public enum CellState {
	VALID,
	NULL,
	UNSET,
}
