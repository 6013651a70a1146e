package org.conceptoriented.pivot.gnode;

/**
 * Operation of one fragment row. Codes are stored in the <code>psp_op</code> column.
 */
public enum Op {
	INSERT(0),
	UPDATE(1),
	DELETE(2),
	CLEAR(3),
	;

	private final int value;

	public int getValue() {
		return value;
	}

	/**
	 * Null for codes which do not denote an operation.
	 */
	public static Op fromValue(long value) {
		for(Op op : Op.values()) {
			if(op.value == value) {
				return op;
			}
		}
		return null;
	}

	private Op(int value) {
		this.value = value;
	}
}
