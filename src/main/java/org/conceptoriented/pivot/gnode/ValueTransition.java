package org.conceptoriented.pivot.gnode;

/**
 * Classification of how one cell changed in one processing step. 
 * <p>
 * Names read as: EQ (unchanged) or NEQ (changed), then previous and current validity (T/F). 
 * TD means that the row was deleted in the step, NVEQ means that a previously invalid cell of a live row became valid.
 */
public enum ValueTransition {
	EQ_FF,
	EQ_TT,
	NEQ_FT,
	NEQ_TF,
	NEQ_TT,
	NEQ_TDF,
	NEQ_TDT,
	NVEQ_FT,
	;

	/**
	 * @param rowPreExisted the key was live before this step
	 * @param reset the key was deleted and then written again within this step
	 * @param prevValid the stored cell was valid (false if the row did not pre-exist)
	 * @param curValid the resolved current cell is valid
	 * @param equal previous and current values are equal (only meaningful if both are valid)
	 */
	public static ValueTransition calc(boolean rowPreExisted, boolean reset, boolean prevValid, boolean curValid, boolean equal) {
		if(reset) {
			if(prevValid && curValid) return NEQ_TDT;
			if(prevValid) return NEQ_TF;
			if(curValid) return NEQ_FT;
			return EQ_FF;
		}
		if(!rowPreExisted) {
			return curValid ? NEQ_FT : EQ_FF;
		}
		if(prevValid && curValid) {
			return equal ? EQ_TT : NEQ_TT;
		}
		if(prevValid) return NEQ_TF;
		if(curValid) return NVEQ_FT;
		return EQ_FF;
	}

	/**
	 * Transition of a cell of a live row which is deleted in this step.
	 */
	public static ValueTransition calcDelete(boolean prevValid) {
		return prevValid ? NEQ_TDF : EQ_FF;
	}

	public boolean isChange() {
		return this != EQ_FF && this != EQ_TT;
	}

	/**
	 * The previous value has to be removed from aggregates.
	 */
	public boolean retractsPrevious() {
		return this == NEQ_TF || this == NEQ_TDF || this == NEQ_TT || this == NEQ_TDT;
	}

	/**
	 * The current value has to be added to aggregates.
	 */
	public boolean addsCurrent() {
		return this == NEQ_FT || this == NVEQ_FT || this == NEQ_TT || this == NEQ_TDT;
	}

	public static ValueTransition fromValue(long value) {
		return values()[(int)value];
	}
}
