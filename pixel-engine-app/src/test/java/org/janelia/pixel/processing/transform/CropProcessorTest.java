package org.janelia.pixel.processing.transform;

import java.awt.Rectangle;
import java.util.Arrays;

import org.janelia.pixel.buffer.ArgbPixelBuffer;
import org.janelia.pixel.processing.Image;
import org.janelia.pixel.processing.ImageFrame;
import org.janelia.pixel.processing.Metadata;
import org.janelia.pixel.processing.ProcessingConfiguration;
import org.janelia.pixel.processing.TransformProcessor;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CropProcessor} class.
 *
 * @author Eric Trautman
 */
public class CropProcessorTest {

    @Test
    public void testFullCropCopiesAllPixels() {
        final ArgbPixelBuffer pixels = buildPatternBuffer(7, 5);
        final Image source = new Image(pixels);

        final CropProcessor processor = new CropProcessor(source, source.getBounds());
        Assert.assertEquals("invalid initial state", TransformProcessor.State.CREATED, processor.getState());

        final Image destination = processor.apply();

        Assert.assertEquals("invalid final state", TransformProcessor.State.APPLIED, processor.getState());
        final ArgbPixelBuffer destinationPixels = (ArgbPixelBuffer) destination.getRootFrame().getPixels();
        Assert.assertNotSame("destination should have its own buffer", pixels, destinationPixels);
        Assert.assertArrayEquals("pixels should match", pixels.getPixels(), destinationPixels.getPixels());
    }

    @Test
    public void testCrop() {
        final ArgbPixelBuffer pixels = buildPatternBuffer(10, 12);
        final Image source = new Image(new ProcessingConfiguration(4, 1),
                                       new Metadata(),
                                       Arrays.asList(new ImageFrame(pixels)));
        final Rectangle cropRectangle = new Rectangle(2, 3, 4, 5);

        final CropProcessor processor = new CropProcessor(source, cropRectangle);
        Assert.assertEquals("invalid crop rectangle", cropRectangle, processor.getCropRectangle());

        final Image destination = processor.apply();

        Assert.assertEquals("invalid width", 4, destination.getWidth());
        Assert.assertEquals("invalid height", 5, destination.getHeight());
        Assert.assertSame("configuration should be kept", source.getConfiguration(), destination.getConfiguration());

        final ArgbPixelBuffer destinationPixels = (ArgbPixelBuffer) destination.getRootFrame().getPixels();
        for (int y = 0; y < cropRectangle.height; y++) {
            for (int x = 0; x < cropRectangle.width; x++) {
                Assert.assertEquals("invalid pixel (" + x + ", " + y + ")",
                                    pixels.get(x + cropRectangle.x, y + cropRectangle.y),
                                    destinationPixels.get(x, y));
            }
        }
    }

    @Test
    public void testMetadataIsCopied() {
        final Metadata imageMetadata = new Metadata();
        imageMetadata.put("title", "source");
        final Metadata frameMetadata = new Metadata();
        frameMetadata.put("delay", "100");
        final Image source = new Image(null,
                                       imageMetadata,
                                       Arrays.asList(new ImageFrame(buildPatternBuffer(6, 6), frameMetadata)));

        final Image destination = new CropProcessor(source, new Rectangle(1, 1, 3, 3)).apply();

        Assert.assertEquals("image metadata not copied", "source", destination.getMetadata().get("title"));
        Assert.assertEquals("frame metadata not copied",
                            "100", destination.getRootFrame().getMetadata().get("delay"));

        destination.getMetadata().put("title", "destination");
        destination.getRootFrame().getMetadata().put("delay", "200");

        Assert.assertEquals("source image metadata changed", "source", imageMetadata.get("title"));
        Assert.assertEquals("source frame metadata changed", "100", frameMetadata.get("delay"));
    }

    @Test
    public void testMultipleFrames() {
        final ArgbPixelBuffer first = buildPatternBuffer(8, 8);
        final ArgbPixelBuffer second = new ArgbPixelBuffer(8, 8);
        Arrays.fill(second.getPixels(), 0xff00ff00);
        final Image source = new Image(new ProcessingConfiguration(2, 1),
                                       new Metadata(),
                                       Arrays.asList(new ImageFrame(first), new ImageFrame(second)));

        final Image destination = new CropProcessor(source, new Rectangle(4, 0, 4, 8)).apply();

        Assert.assertEquals("invalid frame count", 2, destination.getFrames().size());
        final ArgbPixelBuffer firstCrop = (ArgbPixelBuffer) destination.getFrames().get(0).getPixels();
        final ArgbPixelBuffer secondCrop = (ArgbPixelBuffer) destination.getFrames().get(1).getPixels();
        Assert.assertEquals("invalid first frame pixel", first.get(5, 7), firstCrop.get(1, 7));
        Assert.assertEquals("invalid second frame pixel", 0xff00ff00, secondCrop.get(3, 2));
    }

    @Test
    public void testInvalidRectangles() {
        final Image source = new Image(buildPatternBuffer(5, 5));
        final Rectangle[] invalidRectangles = {
                null,
                new Rectangle(0, 0, 0, 3),
                new Rectangle(0, 0, 3, -1),
                new Rectangle(-1, 0, 3, 3),
                new Rectangle(3, 3, 3, 3),
        };
        for (final Rectangle rectangle : invalidRectangles) {
            try {
                new CropProcessor(source, rectangle);
                Assert.fail("exception should have been thrown for crop rectangle " + rectangle);
            } catch (final IllegalArgumentException e) {
                Assert.assertNotNull("missing message", e.getMessage());
            }
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondApplyFails() {
        final CropProcessor processor = new CropProcessor(new Image(buildPatternBuffer(4, 4)),
                                                          new Rectangle(0, 0, 2, 2));
        processor.apply();
        processor.apply();
    }

    private static ArgbPixelBuffer buildPatternBuffer(final int width,
                                                      final int height) {
        final ArgbPixelBuffer buffer = new ArgbPixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                buffer.set(x, y, 0xff000000 | (x << 16) | (y << 8) | ((x + y) & 0xff));
            }
        }
        return buffer;
    }

}
