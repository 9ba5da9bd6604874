package org.janelia.pixel.processing;

import java.util.ArrayList;
import java.util.List;

import org.janelia.pixel.buffer.ArgbPixelBuffer;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TransformProcessor} class.
 */
public class TransformProcessorTest {

    @Test
    public void testFailedDestinationIsNotRetried() {
        final CountingProcessor processor = new CountingProcessor(new Image(new ArgbPixelBuffer(4, 4)), 1, true);

        try {
            processor.apply();
            Assert.fail("first apply should have failed");
        } catch (final IllegalArgumentException e) {
            Assert.assertEquals("invalid state after failure", TransformProcessor.State.FAILED, processor.getState());
        }

        try {
            processor.apply();
            Assert.fail("second apply should have been rejected");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("destination should only be created once", 1, processor.createDestinationCount);
        }
    }

    @Test
    public void testFrameCountMismatchIsNotRetried() {
        final CountingProcessor processor = new CountingProcessor(new Image(new ArgbPixelBuffer(4, 4)), 2, false);

        try {
            processor.apply();
            Assert.fail("frame count mismatch should have been detected");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("invalid state after failure", TransformProcessor.State.FAILED, processor.getState());
        }

        try {
            processor.apply();
            Assert.fail("second apply should have been rejected");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("destination should only be created once", 1, processor.createDestinationCount);
            Assert.assertEquals("no frame should have been applied", 0, processor.frameApplyCount);
        }
    }

    @Test
    public void testSuccessfulApply() {
        final CountingProcessor processor = new CountingProcessor(new Image(new ArgbPixelBuffer(4, 4)), 1, false);

        final Image destination = processor.apply();

        Assert.assertNotNull("destination not returned", destination);
        Assert.assertEquals("invalid state", TransformProcessor.State.APPLIED, processor.getState());
        Assert.assertEquals("invalid frame apply count", 1, processor.frameApplyCount);
    }

    private static class CountingProcessor
            extends TransformProcessor {

        private final int destinationFrameCount;
        private final boolean failOnCreate;
        private int createDestinationCount;
        private int frameApplyCount;

        CountingProcessor(final Image source,
                          final int destinationFrameCount,
                          final boolean failOnCreate) {
            super(source, source.getBounds());
            this.destinationFrameCount = destinationFrameCount;
            this.failOnCreate = failOnCreate;
        }

        @Override
        protected Image createDestination() {
            createDestinationCount++;
            if (failOnCreate) {
                throw new IllegalArgumentException("destination cannot be created");
            }
            final List<ImageFrame> frames = new ArrayList<>();
            for (int i = 0; i < destinationFrameCount; i++) {
                frames.add(getSource().getRootFrame().createCompatible(2, 2));
            }
            return new Image(getSource().getConfiguration(), new Metadata(), frames);
        }

        @Override
        protected void onFrameApply(final ImageFrame source,
                                    final ImageFrame destination) {
            frameApplyCount++;
        }
    }
}
