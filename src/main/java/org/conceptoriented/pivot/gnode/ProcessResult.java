package org.conceptoriented.pivot.gnode;

import org.conceptoriented.pivot.core.Table;

/**
 * Outcome of processing one input port.
 */
public class ProcessResult {

	private final int portId;
	public int getPortId() {
		return portId;
	}

	// One row per key touched by the batch. Valid until the next batch is processed.
	private final Table flattened;
	public Table getFlattened() {
		return flattened;
	}

	private final boolean shouldNotify;
	public boolean shouldNotify() {
		return shouldNotify;
	}

	@Override
	public String toString() {
		return "[port " + portId + ": " + (flattened == null ? 0 : flattened.getSize()) + " rows, notify=" + shouldNotify + "]";
	}

	public ProcessResult(int portId, Table flattened, boolean shouldNotify) {
		this.portId = portId;
		this.flattened = flattened;
		this.shouldNotify = shouldNotify;
	}
}
