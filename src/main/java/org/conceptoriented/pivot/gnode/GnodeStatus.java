package org.conceptoriented.pivot.gnode;

public enum GnodeStatus {
	UNINITIALIZED,
	IDLE,
	PROCESSING,
	FAILED, // Reset is required
}
