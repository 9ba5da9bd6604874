package org.janelia.pixel.processing;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive properties attached to an {@link Image} or one of its {@link ImageFrame frames}.
 *
 * @author Eric Trautman
 */
public class Metadata
        implements Serializable {

    private final Map<String, String> properties;

    public Metadata() {
        this(null);
    }

    public Metadata(final Map<String, String> properties) {
        this.properties = properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties);
    }

    public String get(final String key) {
        return properties.get(key);
    }

    public void put(final String key,
                    final String value) {
        properties.put(key, value);
    }

    /**
     * @return independent copy of this metadata.
     */
    public Metadata deepClone() {
        return new Metadata(properties);
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
