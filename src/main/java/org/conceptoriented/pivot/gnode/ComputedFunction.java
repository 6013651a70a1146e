package org.conceptoriented.pivot.gnode;

/**
 * Computes one output value from the values of the input columns of one row. 
 * It is never called with null arguments: a row with an invalid input gets an invalid output.
 */
@FunctionalInterface
public interface ComputedFunction {
	Object compute(Object[] args);
}
