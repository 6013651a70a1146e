package org.conceptoriented.pivot.core;

/**
 * Columns whose cell payloads are shared and released when the last cell referencing them is dropped.
 */
public interface RefCounted {
	/**
	 * Number of cells of this column which currently reference the payload.
	 */
	int getRefCount(Object payload);

	/**
	 * Number of distinct payloads currently referenced.
	 */
	int getPayloadCount();
}
