package org.janelia.pixel.convolution;

/**
 * Describes how alpha premultiplication is applied for a convolution pass.
 *
 * @author Eric Trautman
 */
public enum ConvolutionPassType {

    /** Complete convolution: samples are premultiplied and the result is unpremultiplied. */
    SINGLE(true, true),

    /** First stage of a two stage convolution: samples are premultiplied and the result is left premultiplied. */
    FIRST(true, false),

    /** Second stage of a two stage convolution: samples are already premultiplied, the result is unpremultiplied. */
    SECOND(false, true);

    private final boolean premultiplySamples;
    private final boolean unPremultiplyResult;

    ConvolutionPassType(final boolean premultiplySamples,
                        final boolean unPremultiplyResult) {
        this.premultiplySamples = premultiplySamples;
        this.unPremultiplyResult = unPremultiplyResult;
    }

    public boolean isPremultiplySamples() {
        return premultiplySamples;
    }

    public boolean isUnPremultiplyResult() {
        return unPremultiplyResult;
    }
}
