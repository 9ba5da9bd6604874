package org.janelia.pixel.filter;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.transform.CropProcessor;

/**
 * Crops an image to a rectangle specified in processor coordinates.
 * The result is a new processor; the original is left unchanged.
 *
 * @author Eric Trautman
 */
public class CropFilter implements Filter {

    private Rectangle rectangle;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public CropFilter() {
        this(new Rectangle(0, 0, 1, 1));
    }

    public CropFilter(final Rectangle rectangle) {
        this.rectangle = new Rectangle(rectangle);
    }

    public Rectangle getRectangle() {
        return new Rectangle(rectangle);
    }

    @Override
    public void init(final Map<String, String> params)
            throws IllegalArgumentException {
        this.rectangle = new Rectangle(Filter.getIntegerParameter("x", params),
                                       Filter.getIntegerParameter("y", params),
                                       Filter.getIntegerParameter("width", params),
                                       Filter.getIntegerParameter("height", params));
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("x", String.valueOf(rectangle.x));
        map.put("y", String.valueOf(rectangle.y));
        map.put("width", String.valueOf(rectangle.width));
        map.put("height", String.valueOf(rectangle.height));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final double scale) {
        final ColorProcessor cp = ImageProcessorBuffers.toColorProcessor(ip);
        final Image cropped = new CropProcessor(ImageProcessorBuffers.toImageCopy(cp), rectangle).apply();
        return ImageProcessorBuffers.toColorProcessor(cropped);
    }
}
