package org.janelia.pixel.processing;

import java.util.Arrays;

import org.janelia.pixel.buffer.ArgbPixelBuffer;
import org.janelia.pixel.parallel.ParallelExecutionSettings;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ProcessingConfiguration} class.
 */
public class ProcessingConfigurationTest {

    private final ProcessingConfiguration originalDefault = ProcessingConfiguration.getDefault();

    @After
    public void tearDown() {
        ProcessingConfiguration.setDefault(originalDefault);
    }

    @Test
    public void testJsonProcessing() {
        final ProcessingConfiguration configuration = new ProcessingConfiguration(3, 512);

        final String json = configuration.toJson();
        Assert.assertNotNull("json not generated", json);

        final ProcessingConfiguration parsedConfiguration = ProcessingConfiguration.fromJson(json);
        Assert.assertEquals("invalid maxDegreeOfParallelism", 3, parsedConfiguration.getMaxDegreeOfParallelism());
        Assert.assertEquals("invalid minimumPixelsPerTask", 512, parsedConfiguration.getMinimumPixelsPerTask());
    }

    @Test
    public void testDefaults() {
        final ProcessingConfiguration configuration = ProcessingConfiguration.fromJson("{}");
        Assert.assertEquals("invalid default maxDegreeOfParallelism",
                            Runtime.getRuntime().availableProcessors(),
                            configuration.getMaxDegreeOfParallelism());
        Assert.assertEquals("invalid default minimumPixelsPerTask",
                            ParallelExecutionSettings.DEFAULT_MINIMUM_PIXELS_PER_TASK,
                            configuration.getMinimumPixelsPerTask());

        final ParallelExecutionSettings settings = new ProcessingConfiguration(2, 64).toParallelSettings();
        Assert.assertEquals("invalid settings parallelism", 2, settings.getMaxDegreeOfParallelism());
        Assert.assertEquals("invalid settings minimum", 64, settings.getMinimumPixelsPerTask());
    }

    @Test
    public void testSetDefault() {
        final ProcessingConfiguration configuration = new ProcessingConfiguration(1, 16);
        ProcessingConfiguration.setDefault(configuration);

        final Image image = new Image(new ArgbPixelBuffer(2, 2));
        Assert.assertSame("default configuration not used", configuration, image.getConfiguration());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDefault() {
        ProcessingConfiguration.setDefault(new ProcessingConfiguration(0, 16));
    }

    @Test
    public void testNonPositiveValuesAreRejected() {
        final Integer[][] invalidValues = { { 0, null }, { -2, 16 }, { null, 0 }, { 4, -1 } };
        for (final Integer[] values : invalidValues) {
            try {
                new ProcessingConfiguration(values[0], values[1]);
                Assert.fail("constructor should reject " + Arrays.toString(values));
            } catch (final IllegalArgumentException e) {
                Assert.assertNotNull("missing message", e.getMessage());
            }
        }

        final String[] invalidJson = {
                "{ \"maxDegreeOfParallelism\": 0 }",
                "{ \"minimumPixelsPerTask\": -5 }"
        };
        for (final String json : invalidJson) {
            try {
                ProcessingConfiguration.fromJson(json);
                Assert.fail("fromJson should reject " + json);
            } catch (final IllegalArgumentException e) {
                Assert.assertTrue("message should name the invalid value: " + e.getMessage(),
                                  e.getMessage().contains("must be positive"));
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidJson() {
        ProcessingConfiguration.fromJson("{ \"maxDegreeOfParallelism\": ");
    }

}
