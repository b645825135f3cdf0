package com.autoprof.orchestrator.batch;

import com.autoprof.orchestrator.engine.Options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands batch options into one {@link Options} per image.
 *
 * A list-valued option contributes its i-th entry to image i; a scalar option
 * is copied verbatim into every image's options.
 */
public final class OptionsBroadcaster {

    private OptionsBroadcaster() {}

    /**
     * @param options batch options
     * @param count   number of images in the batch
     * @return {@code count} options, in image order. When no option is
     *         list-valued the same instance is returned for every image.
     * @throws IllegalArgumentException if a list-valued option does not have
     *         exactly {@code count} entries
     */
    public static List<Options> broadcast(Options options, int count) {
        if (!options.hasListValues()) {
            return Collections.nCopies(count, options);
        }

        options.asMap().forEach((key, value) -> {
            if (value instanceof List && ((List<?>) value).size() != count) {
                throw new IllegalArgumentException(
                        "Option '" + key + "' has " + ((List<?>) value).size()
                        + " entries but the batch has " + count + " images");
            }
        });

        List<Options> perImage = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : options.asMap().entrySet()) {
                Object value = e.getValue();
                values.put(e.getKey(), value instanceof List ? ((List<?>) value).get(i) : value);
            }
            perImage.add(Options.of(values));
        }
        return perImage;
    }
}
