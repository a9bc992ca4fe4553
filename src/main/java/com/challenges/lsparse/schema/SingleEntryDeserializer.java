package com.challenges.lsparse.schema;

import com.challenges.lsparse.schema.NodeSchema.SingleEntrySchema;
import com.challenges.lsparse.schema.NodeSchema.ValueSchema;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Reads {@code {key: value}} into an attribute or hash entry. The object must hold exactly one field.
 */
final class SingleEntryDeserializer<T extends SingleEntrySchema> extends JsonDeserializer<T> {
    private final Class<T> entryType;
    private final BiFunction<String, ValueSchema, T> factory;

    SingleEntryDeserializer(Class<T> entryType, BiFunction<String, ValueSchema, T> factory) {
        this.entryType = entryType;
        this.factory = factory;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = ctxt.readTree(p);
        if (!tree.isObject() || tree.size() != 1) {
            return ctxt.reportInputMismatch(entryType,
                "%s must be an object with exactly one name-value pair, got %s",
                entryType.getSimpleName(), tree);
        }
        Map.Entry<String, JsonNode> field = tree.fields().next();
        if (field.getValue().isNull()) {
            return ctxt.reportInputMismatch(entryType, "Value of '%s' must not be null", field.getKey());
        }
        ValueSchema value = ctxt.readTreeAsValue(field.getValue(), ValueSchema.class);
        return factory.apply(field.getKey(), value);
    }
}
