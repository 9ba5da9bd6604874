package org.janelia.pixel.parallel;

/**
 * Half-open range [min, max) of row indices processed as one unit of work.
 *
 * @author Eric Trautman
 */
public class RowInterval {

    private final int min;
    private final int max;

    public RowInterval(final int min,
                       final int max)
            throws IllegalArgumentException {
        if (max < min) {
            throw new IllegalArgumentException("max " + max + " must not be less than min " + min);
        }
        this.min = min;
        this.max = max;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    public int getHeight() {
        return max - min;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final RowInterval that = (RowInterval) o;
        return (min == that.min) && (max == that.max);
    }

    @Override
    public int hashCode() {
        return (31 * min) + max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + ")";
    }
}
