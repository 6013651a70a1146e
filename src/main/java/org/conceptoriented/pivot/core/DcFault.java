package org.conceptoriented.pivot.core;

/**
 * Internal invariant violation. Unlike {@link DcError} it is not recoverable: the component that raised it 
 * has to be reset before it can be used again.
 */
public class DcFault extends Error {
	private static final long serialVersionUID = 1L;

	public DcFault(String message) {
		super(message);
	}

	public DcFault(String message, Throwable cause) {
		super(message, cause);
	}
}
