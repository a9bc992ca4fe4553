package com.challenges.lsparse.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks the variant of a union by the field names present in the object. Exactly one
 * variant's identifying field must be present; the object is then bound to that variant,
 * which rejects any further unknown fields.
 */
final class KeyedUnionDeserializer<T> extends JsonDeserializer<T> {
    private final Class<T> unionType;
    private final Map<String, Class<? extends T>> variants;

    KeyedUnionDeserializer(Class<T> unionType, Map<String, Class<? extends T>> variants) {
        this.unionType = unionType;
        this.variants = variants;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = ctxt.readTree(p);
        if (!tree.isObject()) {
            return ctxt.reportInputMismatch(unionType,
                "Expected JSON object for %s, got %s", unionType.getSimpleName(), tree.getNodeType());
        }

        List<String> matches = variants.keySet().stream()
            .filter(tree::has)
            .collect(Collectors.toList());
        if (matches.isEmpty()) {
            return ctxt.reportInputMismatch(unionType,
                "No %s variant matches fields %s; expected one of %s",
                unionType.getSimpleName(), fieldNames(tree), variants.keySet());
        }
        if (matches.size() > 1) {
            return ctxt.reportInputMismatch(unionType,
                "Ambiguous %s: fields %s identify more than one variant", unionType.getSimpleName(), matches);
        }
        return ctxt.readTreeAsValue(tree, variants.get(matches.get(0)));
    }

    private static List<String> fieldNames(JsonNode tree) {
        List<String> names = new ArrayList<>();
        tree.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
