package com.challenges.lsparse.schema;

import com.challenges.lsparse.ast.BooleanOperator;
import com.challenges.lsparse.ast.ComparisonOperator;
import com.challenges.lsparse.ast.MembershipOperator;
import com.challenges.lsparse.ast.Node.NegativeExpression;
import com.challenges.lsparse.ast.RegexOperator;
import com.challenges.lsparse.ast.SectionType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed structural form of a syntax tree node.
 *
 * <p>Every variant serializes to a JSON object with exactly one field, and the field name
 * identifies the variant: {@code {"ls_string": "\"a\""}}, {@code {"plugin": {...}}}. Attributes
 * and hash entries are the exception: they are written as {@code {name: value}} and only appear
 * where the enclosing variant expects them.
 */
public sealed interface NodeSchema {

    <R> R accept(SchemaVisitor<R> visitor);

    /** Anything that can stand as a value, an operand or a condition. */
    sealed interface ValueSchema extends NodeSchema {}

    /** Plugin or branch inside a section or conditional body. */
    sealed interface StatementSchema extends NodeSchema {}

    sealed interface ConditionSchema extends NodeSchema {}

    /** A {@code name => value} pair written as a single-field object. */
    sealed interface SingleEntrySchema extends NodeSchema {
        String key();

        ValueSchema value();
    }

    // ==================== Literals ====================

    record StringSchema(@JsonProperty(value = "ls_string", required = true) String lsString)
            implements ValueSchema {
        public StringSchema {
            Objects.requireNonNull(lsString, "ls_string");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BareWordSchema(@JsonProperty(value = "ls_bare_word", required = true) String lsBareWord)
            implements ValueSchema {
        public BareWordSchema {
            Objects.requireNonNull(lsBareWord, "ls_bare_word");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record NumberSchema(@JsonProperty(value = "number", required = true) Number number) implements ValueSchema {
        public NumberSchema {
            Objects.requireNonNull(number, "number");
            if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
                number = number.longValue();
            } else if (number instanceof Float) {
                number = number.doubleValue();
            } else if (number instanceof BigInteger && ((BigInteger) number).bitLength() < 64) {
                number = number.longValue();
            }
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BooleanSchema(@JsonProperty(value = "boolean", required = true) Boolean value) implements ValueSchema {
        public BooleanSchema {
            Objects.requireNonNull(value, "boolean");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RegexpSchema(@JsonProperty(value = "regexp", required = true) String regexp) implements ValueSchema {
        public RegexpSchema {
            Objects.requireNonNull(regexp, "regexp");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record SelectorSchema(@JsonProperty(value = "selector_node", required = true) String selectorNode)
            implements ValueSchema {
        public SelectorSchema {
            Objects.requireNonNull(selectorNode, "selector_node");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record MethodCallData(@JsonProperty(value = "method_name", required = true) String methodName,
                          @JsonProperty("arguments") List<ValueSchema> arguments) {
        public MethodCallData {
            Objects.requireNonNull(methodName, "method_name");
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
        }
    }

    record MethodCallSchema(@JsonProperty(value = "method_call", required = true) MethodCallData methodCall)
            implements ValueSchema {
        public MethodCallSchema {
            Objects.requireNonNull(methodCall, "method_call");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ==================== Collections ====================

    record ArraySchema(@JsonProperty(value = "array", required = true) List<ValueSchema> array)
            implements ValueSchema {
        public ArraySchema {
            Objects.requireNonNull(array, "array");
            array = List.copyOf(array);
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Keys are hash-key lexemes: a quoted string, a bare word or a number. */
    record HashSchema(@JsonProperty(value = "hash", required = true) Map<String, ValueSchema> hash)
            implements ValueSchema {
        public HashSchema {
            Objects.requireNonNull(hash, "hash");
            hash.forEach((key, value) -> Objects.requireNonNull(value, "hash value for " + key));
            hash = Collections.unmodifiableMap(new LinkedHashMap<>(hash));
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record HashEntrySchema(String key, ValueSchema value) implements SingleEntrySchema {
        public HashEntrySchema {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record AttributeSchema(String name, ValueSchema value) implements SingleEntrySchema {
        public AttributeSchema {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String key() {
            return name;
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record PluginData(@JsonProperty(value = "plugin_name", required = true) String pluginName,
                      @JsonProperty("attributes") List<AttributeSchema> attributes) {
        public PluginData {
            Objects.requireNonNull(pluginName, "plugin_name");
            attributes = attributes == null ? List.of() : List.copyOf(attributes);
        }
    }

    record PluginSchema(@JsonProperty(value = "plugin", required = true) PluginData plugin)
            implements ValueSchema, StatementSchema {
        public PluginSchema {
            Objects.requireNonNull(plugin, "plugin");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ==================== Expressions ====================

    record CompareData(@JsonProperty(value = "left", required = true) ValueSchema left,
                       @JsonProperty(value = "operator", required = true) String operator,
                       @JsonProperty(value = "right", required = true) ValueSchema right) {
        public CompareData {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            ComparisonOperator.fromSymbol(Objects.requireNonNull(operator, "operator"));
        }
    }

    record CompareExpressionSchema(
            @JsonProperty(value = "compare_expression", required = true) CompareData compareExpression)
            implements ValueSchema {
        public CompareExpressionSchema {
            Objects.requireNonNull(compareExpression, "compare_expression");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RegexData(@JsonProperty(value = "left", required = true) ValueSchema left,
                     @JsonProperty(value = "operator", required = true) String operator,
                     @JsonProperty(value = "pattern", required = true) ValueSchema pattern) {
        public RegexData {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(pattern, "pattern");
            RegexOperator.fromSymbol(Objects.requireNonNull(operator, "operator"));
        }
    }

    record RegexExpressionSchema(
            @JsonProperty(value = "regex_expression", required = true) RegexData regexExpression)
            implements ValueSchema {
        public RegexExpressionSchema {
            Objects.requireNonNull(regexExpression, "regex_expression");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Payload shared by both membership variants. A missing operator takes the variant's own. */
    record MembershipData(@JsonProperty(value = "value", required = true) ValueSchema value,
                          @JsonProperty("operator") String operator,
                          @JsonProperty(value = "collection", required = true) ValueSchema collection) {
        public MembershipData {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(collection, "collection");
        }

        MembershipData withDefaultOperator(MembershipOperator expected) {
            if (operator == null) {
                return new MembershipData(value, expected.symbol(), collection);
            }
            if (!operator.equals(expected.symbol())) {
                throw new IllegalArgumentException(
                    "Operator must be '" + expected.symbol() + "', got '" + operator + "'");
            }
            return this;
        }
    }

    record InExpressionSchema(@JsonProperty(value = "in_expression", required = true) MembershipData inExpression)
            implements ValueSchema {
        public InExpressionSchema {
            inExpression = Objects.requireNonNull(inExpression, "in_expression")
                .withDefaultOperator(MembershipOperator.IN);
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record NotInExpressionSchema(
            @JsonProperty(value = "not_in_expression", required = true) MembershipData notInExpression)
            implements ValueSchema {
        public NotInExpressionSchema {
            notInExpression = Objects.requireNonNull(notInExpression, "not_in_expression")
                .withDefaultOperator(MembershipOperator.NOT_IN);
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record NegativeData(@JsonProperty(value = "operator", required = true) String operator,
                        @JsonProperty(value = "expression", required = true) ValueSchema expression) {
        public NegativeData {
            Objects.requireNonNull(expression, "expression");
            if (!NegativeExpression.OPERATOR.equals(operator)) {
                throw new IllegalArgumentException("Negation operator must be '!', got '" + operator + "'");
            }
        }
    }

    record NegativeExpressionSchema(
            @JsonProperty(value = "negative_expression", required = true) NegativeData negativeExpression)
            implements ValueSchema {
        public NegativeExpressionSchema {
            Objects.requireNonNull(negativeExpression, "negative_expression");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BooleanData(@JsonProperty(value = "left", required = true) ValueSchema left,
                       @JsonProperty(value = "operator", required = true) String operator,
                       @JsonProperty(value = "right", required = true) ValueSchema right) {
        public BooleanData {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            BooleanOperator.fromSymbol(Objects.requireNonNull(operator, "operator"));
        }
    }

    record BooleanExpressionSchema(
            @JsonProperty(value = "boolean_expression", required = true) BooleanData booleanExpression)
            implements ValueSchema {
        public BooleanExpressionSchema {
            Objects.requireNonNull(booleanExpression, "boolean_expression");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ==================== Conditionals ====================

    record ConditionData(@JsonProperty(value = "expr", required = true) ValueSchema expr,
                         @JsonProperty("body") List<StatementSchema> body) {
        public ConditionData {
            Objects.requireNonNull(expr, "expr");
            body = body == null ? List.of() : List.copyOf(body);
        }
    }

    record IfConditionSchema(@JsonProperty(value = "if_condition", required = true) ConditionData ifCondition)
            implements ConditionSchema {
        public IfConditionSchema {
            Objects.requireNonNull(ifCondition, "if_condition");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ElseIfConditionSchema(
            @JsonProperty(value = "else_if_condition", required = true) ConditionData elseIfCondition)
            implements ConditionSchema {
        public ElseIfConditionSchema {
            Objects.requireNonNull(elseIfCondition, "else_if_condition");
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ElseConditionSchema(
            @JsonProperty(value = "else_condition", required = true) List<StatementSchema> elseCondition)
            implements ConditionSchema {
        public ElseConditionSchema {
            Objects.requireNonNull(elseCondition, "else_condition");
            elseCondition = List.copyOf(elseCondition);
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BranchSchema(@JsonProperty(value = "branch", required = true) List<ConditionSchema> branch)
            implements StatementSchema {
        public BranchSchema {
            Objects.requireNonNull(branch, "branch");
            branch = List.copyOf(branch);
            if (branch.isEmpty() || !(branch.get(0) instanceof IfConditionSchema)) {
                throw new IllegalArgumentException("A branch must start with an if_condition");
            }
            for (int i = 1; i < branch.size(); i++) {
                if (branch.get(i) instanceof IfConditionSchema) {
                    throw new IllegalArgumentException("Only the first condition of a branch may be an if_condition");
                }
                if (branch.get(i) instanceof ElseConditionSchema && i != branch.size() - 1) {
                    throw new IllegalArgumentException("An else_condition must be the last condition of a branch");
                }
            }
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ==================== Sections ====================

    /** Holds a single entry keyed by the section kind: {@code {"filter": [...]}}. */
    record PluginSectionSchema(
            @JsonProperty(value = "plugin_section", required = true) Map<String, List<StatementSchema>> pluginSection)
            implements NodeSchema {
        public PluginSectionSchema {
            Objects.requireNonNull(pluginSection, "plugin_section");
            if (pluginSection.size() != 1) {
                throw new IllegalArgumentException(
                    "plugin_section must have exactly one of input, filter or output, got " + pluginSection.keySet());
            }
            Map.Entry<String, List<StatementSchema>> entry = pluginSection.entrySet().iterator().next();
            SectionType.fromKeyword(entry.getKey());
            Objects.requireNonNull(entry.getValue(), "plugin_section body");
            pluginSection = Map.of(entry.getKey(), List.copyOf(entry.getValue()));
        }

        public static PluginSectionSchema of(SectionType type, List<StatementSchema> body) {
            return new PluginSectionSchema(Map.of(type.keyword(), body));
        }

        public SectionType sectionType() {
            return SectionType.fromKeyword(pluginSection.keySet().iterator().next());
        }

        public List<StatementSchema> body() {
            return pluginSection.values().iterator().next();
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ConfigSchema(@JsonProperty(value = "config", required = true) List<PluginSectionSchema> config)
            implements NodeSchema {
        public ConfigSchema {
            Objects.requireNonNull(config, "config");
            config = List.copyOf(config);
            if (config.isEmpty()) {
                throw new IllegalArgumentException("A configuration needs at least one plugin_section");
            }
        }

        @Override
        public <R> R accept(SchemaVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
