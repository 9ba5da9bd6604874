package org.janelia.pixel.color;

/**
 * Mutable four component (red, green, blue, alpha) floating point colour.
 * Components are nominally in [0, 1] but intermediate convolution results may exceed that range.
 *
 * Instances are deliberately light-weight so that they can be reused as scratch space
 * inside per-pixel loops.
 *
 * @author Eric Trautman
 */
public class ColorVector {

    public float r;
    public float g;
    public float b;
    public float a;

    public ColorVector() {
        this(0f, 0f, 0f, 0f);
    }

    public ColorVector(final float r,
                       final float g,
                       final float b,
                       final float a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
    }

    public ColorVector set(final float r,
                           final float g,
                           final float b,
                           final float a) {
        this.r = r;
        this.g = g;
        this.b = b;
        this.a = a;
        return this;
    }

    public ColorVector set(final ColorVector other) {
        return set(other.r, other.g, other.b, other.a);
    }

    /**
     * Adds {@code weight * other} to this vector (all four components).
     *
     * @return this vector.
     */
    public ColorVector addWeighted(final float weight,
                                   final ColorVector other) {
        r += weight * other.r;
        g += weight * other.g;
        b += weight * other.b;
        a += weight * other.a;
        return this;
    }

    /**
     * Replaces this vector with the component-wise magnitude {@code sqrt(x*x + y*y)}.
     *
     * @return this vector.
     */
    public ColorVector setMagnitude(final ColorVector x,
                                    final ColorVector y) {
        r = (float) Math.sqrt((x.r * x.r) + (y.r * y.r));
        g = (float) Math.sqrt((x.g * x.g) + (y.g * y.g));
        b = (float) Math.sqrt((x.b * x.b) + (y.b * y.b));
        a = (float) Math.sqrt((x.a * x.a) + (y.a * y.a));
        return this;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof ColorVector)) {
            return false;
        }
        final ColorVector that = (ColorVector) o;
        return (Float.compare(that.r, r) == 0) &&
               (Float.compare(that.g, g) == 0) &&
               (Float.compare(that.b, b) == 0) &&
               (Float.compare(that.a, a) == 0);
    }

    @Override
    public int hashCode() {
        int result = Float.hashCode(r);
        result = 31 * result + Float.hashCode(g);
        result = 31 * result + Float.hashCode(b);
        result = 31 * result + Float.hashCode(a);
        return result;
    }

    @Override
    public String toString() {
        return "[" + r + ", " + g + ", " + b + ", " + a + "]";
    }
}
