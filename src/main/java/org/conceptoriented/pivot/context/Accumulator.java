package org.conceptoriented.pivot.context;

import org.conceptoriented.pivot.core.DType;
import org.conceptoriented.pivot.core.DcFault;
import org.conceptoriented.pivot.core.Values;

import com.google.common.collect.Multiset;
import com.google.common.collect.TreeMultiset;

/**
 * Incrementally maintained aggregate. Every added value can be retracted later so that 
 * the result is the same as if it had never been added. Invalid (null) values are never passed.
 */
public abstract class Accumulator {

	public abstract void add(Object value);

	public abstract void retract(Object value);

	/**
	 * Additive aggregates can apply a change of one contributing value as a difference.
	 */
	public boolean isAdditive() {
		return false;
	}

	public void applyDelta(Object delta) {
		throw new DcFault(getClass().getSimpleName() + " is not additive.");
	}

	/**
	 * Null if there are no contributions.
	 */
	public abstract Object getValue();

	public static Accumulator create(AggType type, DType input) {
		switch(type) {
		case SUM:
		case PCT_SUM_PARENT:
		case PCT_SUM_GRAND_TOTAL:
			return new SumAccumulator(input.isIntegral() || input == DType.BOOL);
		case COUNT: return new CountAccumulator();
		case MEAN: return new MeanAccumulator();
		case WEIGHTED_MEAN: return new WeightedMeanAccumulator();
		case MIN:
		case MAX:
		case DISTINCT_COUNT:
		case UNIQUE:
		case ANY:
			return new MultisetAccumulator(type);
		default:
			throw new DcFault("No accumulator for aggregate " + type + ".");
		}
	}
}

class SumAccumulator extends Accumulator {
	private final boolean integral;
	private long longSum;
	private double doubleSum;
	private int count;

	@Override
	public void add(Object value) {
		if(integral) longSum += toLong(value);
		else doubleSum += Values.toDouble(value);
		count++;
	}

	@Override
	public void retract(Object value) {
		if(integral) longSum -= toLong(value);
		else doubleSum -= Values.toDouble(value);
		count--;
	}

	@Override
	public boolean isAdditive() {
		return true;
	}

	@Override
	public void applyDelta(Object delta) {
		if(integral) longSum += toLong(delta);
		else doubleSum += Values.toDouble(delta);
	}

	@Override
	public Object getValue() {
		if(count <= 0) return null;
		return integral ? (Object)longSum : (Object)doubleSum;
	}

	private static long toLong(Object value) {
		if(value instanceof Boolean) return ((Boolean)value) ? 1L : 0L;
		return ((Number)value).longValue();
	}

	SumAccumulator(boolean integral) {
		this.integral = integral;
	}
}

class CountAccumulator extends Accumulator {
	private long count;

	@Override
	public void add(Object value) {
		count++;
	}

	@Override
	public void retract(Object value) {
		count--;
	}

	@Override
	public Object getValue() {
		return count;
	}
}

class MeanAccumulator extends Accumulator {
	private double sum;
	private long count;

	@Override
	public void add(Object value) {
		sum += Values.toDouble(value);
		count++;
	}

	@Override
	public void retract(Object value) {
		sum -= Values.toDouble(value);
		count--;
	}

	@Override
	public boolean isAdditive() {
		return true;
	}

	@Override
	public void applyDelta(Object delta) {
		sum += Values.toDouble(delta);
	}

	@Override
	public Object getValue() {
		if(count <= 0) return null;
		return sum / count;
	}
}

/**
 * Values are pairs of value and weight.
 */
class WeightedMeanAccumulator extends Accumulator {
	private double weightedSum;
	private double weights;
	private long count;

	@Override
	public void add(Object value) {
		Object[] pair = (Object[])value;
		double w = Values.toDouble(pair[1]);
		weightedSum += Values.toDouble(pair[0]) * w;
		weights += w;
		count++;
	}

	@Override
	public void retract(Object value) {
		Object[] pair = (Object[])value;
		double w = Values.toDouble(pair[1]);
		weightedSum -= Values.toDouble(pair[0]) * w;
		weights -= w;
		count--;
	}

	@Override
	public Object getValue() {
		if(count <= 0 || weights == 0.0) return null;
		return weightedSum / weights;
	}
}

/**
 * Keeps all contributing values so that order statistics survive retraction.
 */
class MultisetAccumulator extends Accumulator {
	private final AggType type;
	private final TreeMultiset<Object> values = TreeMultiset.create(Values.ORDER);

	@Override
	public void add(Object value) {
		values.add(value);
	}

	@Override
	public void retract(Object value) {
		if(!values.remove(value)) {
			throw new DcFault("Value " + value + " retracted from " + type.getName() + " but never added.");
		}
	}

	@Override
	public Object getValue() {
		switch(type) {
		case DISTINCT_COUNT:
			return (long)values.elementSet().size();
		case MIN:
		case ANY: {
			Multiset.Entry<Object> e = values.firstEntry();
			return e == null ? null : e.getElement();
		}
		case MAX: {
			Multiset.Entry<Object> e = values.lastEntry();
			return e == null ? null : e.getElement();
		}
		case UNIQUE:
			return values.elementSet().size() == 1 ? values.firstEntry().getElement() : null;
		default:
			throw new DcFault("Unexpected aggregate " + type + ".");
		}
	}

	MultisetAccumulator(AggType type) {
		this.type = type;
	}
}
