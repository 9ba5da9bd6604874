package org.janelia.pixel.filter;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.util.HashMap;
import java.util.Map;

import org.janelia.pixel.kernel.DenseMatrix;
import org.janelia.pixel.kernel.KernelMatrices;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FilterSpec} class.
 *
 * @author Eric Trautman
 */
public class FilterSpecTest {

    @Test
    public void testJsonProcessing() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("sigma", "2.5");
        final FilterSpec filterSpec = new FilterSpec(GaussianBlurFilter.class.getName(), parameters);

        final String json = filterSpec.toJson();
        Assert.assertNotNull("json not generated", json);

        final FilterSpec parsedSpec = FilterSpec.fromJson(json);
        Assert.assertEquals("bad class name after parse", GaussianBlurFilter.class.getName(),
                            parsedSpec.getClassName());

        final Filter filter = parsedSpec.buildInstance();
        Assert.assertTrue("invalid filter type built", filter instanceof GaussianBlurFilter);
        Assert.assertEquals("invalid sigma", 2.5, ((GaussianBlurFilter) filter).getSigma(), 0.0);
    }

    @Test
    public void testFilterParameterRoundTrip() {
        final Filter[] filters = {
                new ConvolutionFilter(KernelMatrices.LAPLACIAN_3X3),
                new GaussianBlurFilter(0.75),
                new EdgeDetectionFilter(KernelMatrices.EdgeOperator.SCHARR),
                new CropFilter(new Rectangle(1, 2, 3, 4)),
                new CompositeFilter(new CropFilter(new Rectangle(0, 0, 2, 2)), new GaussianBlurFilter(1.5))
        };

        for (final Filter filter : filters) {
            final FilterSpec parsedSpec = FilterSpec.fromJson(FilterSpec.forFilter(filter).toJson());
            final Filter rebuiltFilter = parsedSpec.buildInstance();
            Assert.assertEquals("parameters differ for " + filter.getClass().getSimpleName(),
                                filter.toParametersMap(), rebuiltFilter.toParametersMap());
        }

        final ConvolutionFilter rebuiltConvolution = (ConvolutionFilter)
                FilterSpec.forFilter(new ConvolutionFilter(KernelMatrices.LAPLACIAN_3X3)).buildInstance();
        Assert.assertEquals("kernel differs", KernelMatrices.LAPLACIAN_3X3, rebuiltConvolution.getKernel());
    }

    @Test
    public void testCompositeFilter() {
        final ColorProcessor cp = new ColorProcessor(10, 8);
        for (int y = 0; y < cp.getHeight(); y++) {
            for (int x = 0; x < cp.getWidth(); x++) {
                cp.set(x, y, (x * 20) << 16 | (y * 30));
            }
        }

        final CompositeFilter filter = new CompositeFilter(new CropFilter(new Rectangle(2, 1, 6, 5)),
                                                           new GaussianBlurFilter(1.0));
        final ImageProcessor result = filter.process(cp, 1.0);

        Assert.assertEquals("invalid width", 6, result.getWidth());
        Assert.assertEquals("invalid height", 5, result.getHeight());
        Assert.assertTrue("result should be RGB", result instanceof ColorProcessor);

        // right edge of the crop is clamped, so blurring pulls its red value down from 140
        final int edgePixel = result.get(5, 2);
        Assert.assertEquals("alpha should be opaque", 0xff, (edgePixel >>> 24) & 0xff);
        final int red = (edgePixel >> 16) & 0xff;
        Assert.assertTrue("edge should be blurred but red is " + red, (red > 120) && (red < 140));
    }

    @Test
    public void testCropLeavesInputUnchanged() {
        final ColorProcessor cp = new ColorProcessor(4, 4);
        final int[] pixels = (int[]) cp.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = 0x102030 + i;
        }
        final int[] originalPixels = pixels.clone();

        final ImageProcessor result = new CropFilter(new Rectangle(1, 1, 2, 2)).process(cp, 1.0);

        Assert.assertArrayEquals("input pixels changed", originalPixels, (int[]) cp.getPixels());
        Assert.assertEquals("cropped pixel should be marked opaque", 0xff000000 | originalPixels[5], result.get(0, 0));
    }

    @Test
    public void testInitFromParameters() {
        final Map<String, String> cropParameters = new HashMap<>();
        cropParameters.put("x", "3");
        cropParameters.put("y", " 4");
        cropParameters.put("width", "5 ");
        cropParameters.put("height", "6");
        final CropFilter cropFilter = new CropFilter();
        cropFilter.init(cropParameters);
        Assert.assertEquals("invalid crop rectangle", new Rectangle(3, 4, 5, 6), cropFilter.getRectangle());

        final CompositeFilter compositeFilter = (CompositeFilter) FilterSpec.forFilter(
                new CompositeFilter(cropFilter, new GaussianBlurFilter(2.0))).buildInstance();
        Assert.assertEquals("invalid number of filters", 2, compositeFilter.getFilters().size());
        Assert.assertEquals("invalid first filter rectangle",
                            new Rectangle(3, 4, 5, 6),
                            ((CropFilter) compositeFilter.getFilters().get(0)).getRectangle());
        Assert.assertEquals("invalid second filter sigma",
                            2.0, ((GaussianBlurFilter) compositeFilter.getFilters().get(1)).getSigma(), 0.0);
    }

    @Test
    public void testGrayProcessorIsConverted() {
        final ByteProcessor bp = new ByteProcessor(6, 6);
        bp.setValue(200);
        bp.fill();

        final ImageProcessor result = new ConvolutionFilter(KernelMatrices.box(3)).process(bp, 1.0);

        Assert.assertTrue("result should be RGB", result instanceof ColorProcessor);
        Assert.assertEquals("uniform gray should be unchanged", 0xffc8c8c8, result.get(2, 2));
    }

    @Test
    public void testConvolutionFilterInit() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("rows", "1");
        parameters.put("columns", "3");
        parameters.put("kernel", "0.25, 0.5, 0.25");

        final ConvolutionFilter filter = new ConvolutionFilter();
        filter.init(parameters);

        Assert.assertEquals("invalid kernel",
                            new DenseMatrix(1, 3, new float[] { 0.25f, 0.5f, 0.25f }),
                            filter.getKernel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidKernelSize() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("rows", "2");
        parameters.put("columns", "2");
        parameters.put("kernel", "1, 2, 3");
        new ConvolutionFilter().init(parameters);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidOperator() {
        final Map<String, String> parameters = new HashMap<>();
        parameters.put("operator", "ROBERTS");
        new EdgeDetectionFilter().init(parameters);
    }

    @Test
    public void testSimpleClassName() {
        final FilterSpec filterSpec = FilterSpec.fromJson(
                "{ \"className\": \"EdgeDetectionFilter\", \"parameters\": { \"operator\": \"prewitt\" } }");

        final Filter filter = filterSpec.buildInstance();

        Assert.assertTrue("invalid filter type built", filter instanceof EdgeDetectionFilter);
        Assert.assertEquals("invalid operator",
                            KernelMatrices.EdgeOperator.PREWITT, ((EdgeDetectionFilter) filter).getOperator());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingClass() {
        new FilterSpec("org.janelia.pixel.filter.MissingFilter", new HashMap<>()).buildInstance();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFilterClass() {
        new FilterSpec(String.class.getName(), new HashMap<>()).buildInstance();
    }

}
