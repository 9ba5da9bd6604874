package org.janelia.pixel.color;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ColorVectorUtils} class.
 */
public class ColorVectorUtilsTest {

    @Test
    public void testPremultiplyRoundTrip() {
        final float[] alphas = { 1.0f, 0.75f, 0.5f, 0.1f, 0.003f };
        for (final float alpha : alphas) {
            final ColorVector original = new ColorVector(0.2f, 0.6f, 0.95f, alpha);
            final ColorVector color = new ColorVector().set(original);

            ColorVectorUtils.premultiply(color);
            Assert.assertEquals("alpha changed by premultiply", alpha, color.a, 0.0f);
            Assert.assertEquals("red not premultiplied", original.r * alpha, color.r, 1.0e-7f);

            ColorVectorUtils.unPremultiply(color);
            Assert.assertEquals("invalid red after round trip for alpha " + alpha, original.r, color.r, 1.0e-5f);
            Assert.assertEquals("invalid green after round trip for alpha " + alpha, original.g, color.g, 1.0e-5f);
            Assert.assertEquals("invalid blue after round trip for alpha " + alpha, original.b, color.b, 1.0e-5f);
            Assert.assertEquals("alpha changed by unPremultiply", alpha, color.a, 0.0f);
        }
    }

    @Test
    public void testUnPremultiplyWithZeroAlpha() {
        final ColorVector color = new ColorVector(0.3f, 0.4f, 0.5f, 0.0f);
        ColorVectorUtils.unPremultiply(color);
        Assert.assertEquals("zero alpha should leave color unchanged",
                            new ColorVector(0.3f, 0.4f, 0.5f, 0.0f), color);

        final ColorVector tinyAlpha = new ColorVector(0.3f, 0.4f, 0.5f, 1.0e-9f);
        ColorVectorUtils.unPremultiply(tinyAlpha);
        Assert.assertEquals("near zero alpha should leave red unchanged", 0.3f, tinyAlpha.r, 0.0f);
    }

    @Test
    public void testSetMagnitude() {
        final ColorVector x = new ColorVector(3f, 0f, -6f, 1f);
        final ColorVector y = new ColorVector(4f, 2f, 8f, 0f);
        final ColorVector magnitude = new ColorVector().setMagnitude(x, y);
        Assert.assertEquals("invalid magnitude", new ColorVector(5f, 2f, 10f, 1f), magnitude);
    }

}
