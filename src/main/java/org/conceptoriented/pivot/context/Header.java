package org.conceptoriented.pivot.context;

/**
 * Axis of a pivot tree.
 */
public enum Header {
	ROW,
	COLUMN,
}
