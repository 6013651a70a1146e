package org.conceptoriented.pivot.core;

/**
 * Half-open interval of row (or column) indexes.
 */
public class Range {

    public int start;
    public int end;

	public int getLength() {
		return end - start;
	}

	public boolean contains(int index) {
		return index >= start && index < end;
	}

	/**
	 * Intersect this range with [0, size) so that it can be used to access a structure of the specified size.
	 */
	public Range clamp(int size) {
		int s = Math.max(0, Math.min(this.start, size));
		int e = Math.max(s, Math.min(this.end, size));
		return new Range(s, e);
	}

	@Override
    public String toString() {
      return String.format("[%s, %s)", start, end);
    }

    @Override
    public boolean equals(Object other) {
        if (other == this) {
            return true;
        }

        if (!(other instanceof Range)){
            return false;
        }

        Range other_ = (Range)other;

        return other_.start == this.start && other_.end == this.end;
    }

    @Override
    public int hashCode() {
    	return Integer.hashCode(start) ^ Integer.hashCode(end);
    }

    public Range(Range range) {
        super();
        this.start = range.start;
        this.end = range.end;
      }

    public Range(int start, int end) {
        super();
        this.start = start;
        this.end = end;
      }

    public Range() {
        this(0,0);
      }
}
