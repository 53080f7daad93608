package com.payment.stripe.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.TypeFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes typed inputs into flat form fields and decodes typed outputs from JSON.
 * Both directions share one {@link ObjectMapper}, so field names, enum ids and timestamps
 * agree between what is sent and what is read back.
 */
public class WireCodec {

    private final ObjectMapper mapper;

    public WireCodec() {
        this(defaultMapper());
    }

    public WireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** The mapper configuration the Stripe wire format needs: snake_case, epoch seconds, nulls dropped. */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .registerModule(new EpochSecondsModule());
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public TypeFactory getTypeFactory() {
        return mapper.getTypeFactory();
    }

    /**
     * Flattens {@code value} into form fields. Nested objects become {@code parent[child]},
     * list elements {@code parent[0]}, and absent values produce no key at all.
     */
    public Map<String, String> encodeForm(Object value) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (value == null) {
            return fields;
        }
        JsonNode root = mapper.valueToTree(value);
        if (!root.isObject()) {
            throw new IllegalArgumentException("Only objects can be form encoded, got " + root.getNodeType());
        }
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            flatten(entry.getKey(), entry.getValue(), fields);
        }
        return fields;
    }

    private void flatten(String key, JsonNode node, Map<String, String> fields) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> child = it.next();
                flatten(key + "[" + child.getKey() + "]", child.getValue(), fields);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(key + "[" + i + "]", node.get(i), fields);
            }
        } else {
            fields.put(key, node.asText());
        }
    }

    public <T> T decode(String json, Class<T> type) throws DecodeException {
        return decode(json, mapper.constructType(type));
    }

    public <T> T decode(String json, TypeReference<T> type) throws DecodeException {
        return decode(json, mapper.constructType(type));
    }

    public <T> T decode(String json, JavaType type) throws DecodeException {
        if (json == null || json.isBlank()) {
            throw new DecodeException("Empty body cannot be decoded as " + type.toCanonical(), null);
        }
        T value;
        try {
            value = mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Could not decode " + type.toCanonical() + ": " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new DecodeException("JSON null cannot be decoded as " + type.toCanonical(), null);
        }
        return value;
    }

    public String encodeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not encode " + value.getClass().getSimpleName(), e);
        }
    }
}
