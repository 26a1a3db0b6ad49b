package com.deepansh.agenthost.response;

import com.deepansh.agenthost.exception.HandlerContractException;

import java.util.List;
import java.util.Map;

/**
 * Metadata must be a plain JSON object: string keys, values that are strings,
 * finite numbers, booleans, null, lists or nested maps of the same.
 */
public final class MetadataValidator {

    private MetadataValidator() {
    }

    public static Map<String, Object> requireJsonObject(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (entry.getKey() == null) {
                throw new HandlerContractException("metadata keys must not be null");
            }
            requireJsonValue(entry.getKey(), entry.getValue());
        }
        return metadata;
    }

    private static void requireJsonValue(String path, Object value) {
        if ((value instanceof Double d && !Double.isFinite(d)) || (value instanceof Float f && !Float.isFinite(f))) {
            throw new HandlerContractException("metadata value at '" + path + "' is not a finite number: " + value);
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                requireJsonValue(path + "[" + i + "]", list.get(i));
            }
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new HandlerContractException("metadata key under '" + path + "' is not a string");
                }
                requireJsonValue(path + "." + key, entry.getValue());
            }
            return;
        }
        throw new HandlerContractException("metadata value at '" + path + "' is not JSON compatible: "
                + value.getClass().getSimpleName());
    }
}
