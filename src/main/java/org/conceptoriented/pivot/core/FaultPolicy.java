package org.conceptoriented.pivot.core;

/**
 * What the processing boundary does with an internal fault.
 */
public enum FaultPolicy {
	/**
	 * Rethrow the fault. The caller is expected to terminate.
	 */
	ABORT,
	/**
	 * Mark the component as failed and report the fault as an error. The component has to be reset before use.
	 */
	REPORT,
}
