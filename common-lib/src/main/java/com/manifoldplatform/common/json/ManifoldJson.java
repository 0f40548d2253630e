package com.manifoldplatform.common.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manifoldplatform.common.exception.MalformedSeriesException;
import com.manifoldplatform.common.model.ManifoldInterpretation;
import com.manifoldplatform.common.model.ManifoldMetrics;

import java.util.Map;

/**
 * Converts snapshots to and from plain maps keyed by their wire names.
 * Scalars round-trip exactly; arrays become {@code List<Double>} in the map form.
 */
public final class ManifoldJson {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ManifoldJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static Map<String, Object> toMap(ManifoldMetrics metrics) {
        return MAPPER.convertValue(metrics, MAP_TYPE);
    }

    public static Map<String, Object> toMap(ManifoldInterpretation interpretation) {
        return MAPPER.convertValue(interpretation, MAP_TYPE);
    }

    public static ManifoldMetrics metricsFromMap(Map<String, ?> map) {
        return fromMap(map, ManifoldMetrics.class);
    }

    public static ManifoldInterpretation interpretationFromMap(Map<String, ?> map) {
        return fromMap(map, ManifoldInterpretation.class);
    }

    private static <T> T fromMap(Map<String, ?> map, Class<T> type) {
        try {
            return MAPPER.convertValue(map, type);
        } catch (IllegalArgumentException e) {
            throw new MalformedSeriesException("json", "cannot read " + type.getSimpleName() + ": " + e.getMessage());
        }
    }
}
