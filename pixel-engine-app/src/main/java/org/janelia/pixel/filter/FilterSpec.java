/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.pixel.filter;

import java.io.Reader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.pixel.json.JsonUtils;

/**
 * JSON form of a {@link Filter}: the filter's class plus the string parameters passed to {@link Filter#init}.
 *
 * Class names without a package (e.g. "GaussianBlurFilter") are resolved
 * relative to this package, so hand written specifications can stay short:
 * <pre>
 *   { "className": "GaussianBlurFilter", "parameters": { "sigma": "2.0" } }
 * </pre>
 *
 * @author Eric Trautman
 */
public class FilterSpec {

    private final String className;
    private final Map<String, String> parameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FilterSpec() {
        this.className = null;
        this.parameters = null;
    }

    /**
     * @param  className   simple or fully qualified name of a {@link Filter} implementation.
     * @param  parameters  values passed to the filter's init method (copied).
     */
    public FilterSpec(final String className,
                      final Map<String, String> parameters) {
        this.className = className;
        this.parameters = parameters == null ? null : new LinkedHashMap<>(parameters);
    }

    public String getClassName() {
        return className;
    }

    /**
     * @return the filter parameters (empty if none were specified).
     */
    public Map<String, String> getParameters() {
        return parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(parameters);
    }

    /**
     * @return new filter instance initialized with this specification's parameters.
     *
     * @throws IllegalArgumentException
     *   if the class cannot be resolved, is not a filter, cannot be instantiated,
     *   or rejects the parameters.
     */
    public Filter buildInstance()
            throws IllegalArgumentException {

        final Class<? extends Filter> filterClass = resolveFilterClass();

        final Filter filter;
        try {
            filter = filterClass.getDeclaredConstructor().newInstance();
        } catch (final ReflectiveOperationException e) {
            throw new IllegalArgumentException("failed to create instance of filter class '" +
                                               filterClass.getName() + "'", e);
        }

        filter.init(new LinkedHashMap<>(getParameters()));

        return filter;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static FilterSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static FilterSpec fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @return specification that rebuilds an equivalent filter.
     */
    public static FilterSpec forFilter(final Filter filter) {
        return new FilterSpec(filter.getClass().getName(), filter.toParametersMap());
    }

    private Class<? extends Filter> resolveFilterClass()
            throws IllegalArgumentException {

        if ((className == null) || className.trim().isEmpty()) {
            throw new IllegalArgumentException("no className defined for filter spec");
        }

        final String trimmedName = className.trim();
        final String qualifiedName = trimmedName.indexOf('.') < 0 ?
                                     Filter.class.getPackage().getName() + "." + trimmedName : trimmedName;

        final Class<?> clazz;
        try {
            clazz = Class.forName(qualifiedName);
        } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("filter class '" + className + "' cannot be found", e);
        }

        if (! Filter.class.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("class '" + qualifiedName + "' does not implement the '" +
                                               Filter.class.getName() + "' interface");
        }

        return clazz.asSubclass(Filter.class);
    }

    private static final JsonUtils.Helper<FilterSpec> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, FilterSpec.class);
}
