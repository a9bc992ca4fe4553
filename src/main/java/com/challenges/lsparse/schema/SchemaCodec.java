package com.challenges.lsparse.schema;

import com.challenges.lsparse.schema.NodeSchema.ArraySchema;
import com.challenges.lsparse.schema.NodeSchema.AttributeSchema;
import com.challenges.lsparse.schema.NodeSchema.BareWordSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanSchema;
import com.challenges.lsparse.schema.NodeSchema.BranchSchema;
import com.challenges.lsparse.schema.NodeSchema.CompareExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.ConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.ConfigSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseIfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.HashEntrySchema;
import com.challenges.lsparse.schema.NodeSchema.HashSchema;
import com.challenges.lsparse.schema.NodeSchema.IfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.InExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.MethodCallSchema;
import com.challenges.lsparse.schema.NodeSchema.NegativeExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NotInExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NumberSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginSectionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexpSchema;
import com.challenges.lsparse.schema.NodeSchema.SelectorSchema;
import com.challenges.lsparse.schema.NodeSchema.StatementSchema;
import com.challenges.lsparse.schema.NodeSchema.StringSchema;
import com.challenges.lsparse.schema.NodeSchema.ValueSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates structural data against the typed form and moves it between the typed form,
 * plain maps and lists, and JSON text.
 *
 * <p>Validation is strict: unknown fields, missing required fields and scalar coercions
 * (a number where a string is expected, {@code "true"} for a boolean) are all rejected.
 */
public class SchemaCodec {
    private static final Logger log = LoggerFactory.getLogger(SchemaCodec.class);

    static final Map<String, Class<? extends ValueSchema>> VALUE_VARIANTS = valueVariants();
    static final Map<String, Class<? extends StatementSchema>> STATEMENT_VARIANTS = statementVariants();
    static final Map<String, Class<? extends ConditionSchema>> CONDITION_VARIANTS = conditionVariants();
    static final Map<String, Class<? extends NodeSchema>> NODE_VARIANTS = nodeVariants();

    private final ObjectMapper mapper;

    public SchemaCodec() {
        this.mapper = createMapper();
    }

    private static ObjectMapper createMapper() {
        SimpleModule module = new SimpleModule("lsparse-schema");
        module.addDeserializer(ValueSchema.class, new KeyedUnionDeserializer<>(ValueSchema.class, VALUE_VARIANTS));
        module.addDeserializer(StatementSchema.class,
            new KeyedUnionDeserializer<>(StatementSchema.class, STATEMENT_VARIANTS));
        module.addDeserializer(ConditionSchema.class,
            new KeyedUnionDeserializer<>(ConditionSchema.class, CONDITION_VARIANTS));
        module.addDeserializer(NodeSchema.class, new KeyedUnionDeserializer<>(NodeSchema.class, NODE_VARIANTS));

        SingleEntrySerializer entrySerializer = new SingleEntrySerializer();
        module.addSerializer(AttributeSchema.class, entrySerializer);
        module.addSerializer(HashEntrySchema.class, entrySerializer);
        module.addDeserializer(AttributeSchema.class,
            new SingleEntryDeserializer<>(AttributeSchema.class, AttributeSchema::new));
        module.addDeserializer(HashEntrySchema.class,
            new SingleEntryDeserializer<>(HashEntrySchema.class, HashEntrySchema::new));

        return JsonMapper.builder()
            .addModule(module)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .withCoercionConfig(LogicalType.Textual, config -> config
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail))
            .build();
    }

    /**
     * Validates plain structural data (maps, lists, strings, numbers, booleans) as {@code type}.
     */
    public <T extends NodeSchema> T validate(Object raw, Class<T> type) {
        if (raw == null) {
            throw new SchemaValidationException("Cannot validate null as " + type.getSimpleName());
        }
        try {
            return mapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /** Validates plain structural data as whichever node variant its field name identifies. */
    public NodeSchema validate(Object raw) {
        return validate(raw, NodeSchema.class);
    }

    /**
     * The plain map and list form of {@code schema}: JSON objects become {@link Map}s, arrays
     * become lists, and integers are {@link Long} unless they do not fit, in which case they
     * stay {@link BigInteger}.
     */
    public Object toNeutral(NodeSchema schema) {
        try {
            return normalize(mapper.convertValue(schema, Object.class));
        } catch (IllegalArgumentException e) {
            throw new SchemaValidationException(
                "Cannot convert " + schema.getClass().getSimpleName() + " to plain data: " + e.getMessage(), e);
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> map = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, item) -> map.put(key, normalize(item)));
            return map;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<>();
            for (Object item : (List<?>) value) {
                list.add(normalize(item));
            }
            return list;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64) {
            return ((BigInteger) value).longValue();
        }
        return value;
    }

    public String writeJson(NodeSchema schema) {
        try {
            return mapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public <T extends NodeSchema> T readJson(String json, Class<T> type) {
        try {
            T schema = mapper.readValue(json, type);
            if (schema == null) {
                throw new SchemaValidationException("Expected " + type.getSimpleName() + " but JSON was null");
            }
            log.debug("Read {} from {} characters of JSON", schema.getClass().getSimpleName(), json.length());
            return schema;
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException("Invalid " + type.getSimpleName() + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    public NodeSchema readJson(String json) {
        return readJson(json, NodeSchema.class);
    }

    // ==================== Variant tables ====================

    private static Map<String, Class<? extends ValueSchema>> valueVariants() {
        Map<String, Class<? extends ValueSchema>> variants = new LinkedHashMap<>();
        variants.put("ls_string", StringSchema.class);
        variants.put("ls_bare_word", BareWordSchema.class);
        variants.put("number", NumberSchema.class);
        variants.put("boolean", BooleanSchema.class);
        variants.put("regexp", RegexpSchema.class);
        variants.put("selector_node", SelectorSchema.class);
        variants.put("method_call", MethodCallSchema.class);
        variants.put("array", ArraySchema.class);
        variants.put("hash", HashSchema.class);
        variants.put("plugin", PluginSchema.class);
        variants.put("compare_expression", CompareExpressionSchema.class);
        variants.put("regex_expression", RegexExpressionSchema.class);
        variants.put("in_expression", InExpressionSchema.class);
        variants.put("not_in_expression", NotInExpressionSchema.class);
        variants.put("negative_expression", NegativeExpressionSchema.class);
        variants.put("boolean_expression", BooleanExpressionSchema.class);
        return Collections.unmodifiableMap(variants);
    }

    private static Map<String, Class<? extends StatementSchema>> statementVariants() {
        Map<String, Class<? extends StatementSchema>> variants = new LinkedHashMap<>();
        variants.put("plugin", PluginSchema.class);
        variants.put("branch", BranchSchema.class);
        return Collections.unmodifiableMap(variants);
    }

    private static Map<String, Class<? extends ConditionSchema>> conditionVariants() {
        Map<String, Class<? extends ConditionSchema>> variants = new LinkedHashMap<>();
        variants.put("if_condition", IfConditionSchema.class);
        variants.put("else_if_condition", ElseIfConditionSchema.class);
        variants.put("else_condition", ElseConditionSchema.class);
        return Collections.unmodifiableMap(variants);
    }

    private static Map<String, Class<? extends NodeSchema>> nodeVariants() {
        Map<String, Class<? extends NodeSchema>> variants = new LinkedHashMap<>();
        variants.putAll(valueVariants());
        variants.putAll(statementVariants());
        variants.putAll(conditionVariants());
        variants.put("plugin_section", PluginSectionSchema.class);
        variants.put("config", ConfigSchema.class);
        return Collections.unmodifiableMap(variants);
    }
}
