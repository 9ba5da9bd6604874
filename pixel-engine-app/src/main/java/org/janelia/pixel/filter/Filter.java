package org.janelia.pixel.filter;

import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Map;

/**
 * Common interface for all filter implementations.
 *
 * @author Eric Trautman
 */
public interface Filter extends Serializable {

    /**
     * Initialize this filter's parameters.
     *
     * @param  params  parameters to use.
     *
     * @throws IllegalArgumentException
     *   if a required parameter is missing or invalid.
     */
    void init(final Map<String, String> params)
            throws IllegalArgumentException;

    /**
     * @return map of this filter's parameters (suitable for specification serialization).
     */
    Map<String, String> toParametersMap();

    /**
     * Apply this filter.
     *
     * @param  ip     pixels to process.
     * @param  scale  current render scale.
     *
     * @return filtered image (the specified processor when filtering happens in place).
     */
    ImageProcessor process(final ImageProcessor ip,
                           final double scale);


    // Utility methods for parameter parsing ...

    static String getStringParameter(final String parameterName,
                                     final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = params == null ? null : params.get(parameterName);
        if (valueString == null) {
            throw new IllegalArgumentException("'" + parameterName + "' is not defined");
        }
        return valueString;
    }

    static Integer getIntegerParameter(final String parameterName,
                                       final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Integer.parseInt(valueString.trim());
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    static Double getDoubleParameter(final String parameterName,
                                     final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Double.parseDouble(valueString.trim());
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    static float[] getFloatArrayParameter(final String parameterName,
                                          final Map<String, String> params)
            throws IllegalArgumentException {
        final String[] values = getStringParameter(parameterName, params).split(",");
        final float[] floats = new float[values.length];
        try {
            for (int i = 0; i < values.length; i++) {
                floats[i] = Float.parseFloat(values[i].trim());
            }
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
        return floats;
    }

}
