package org.conceptoriented.pivot.core;

public enum DcColumnKind {
	NONE, // Not a column of the table

	USER, // Values are provided by the user
	CALC, // Calculated from other columns of the same row
	INTERNAL, // Maintained by the engine (key, operation)
	;
}
