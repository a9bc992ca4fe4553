package com.challenges.lsparse.schema;

import com.challenges.lsparse.ast.BooleanOperator;
import com.challenges.lsparse.ast.ComparisonOperator;
import com.challenges.lsparse.ast.MembershipOperator;
import com.challenges.lsparse.ast.Node;
import com.challenges.lsparse.ast.Node.ArrayNode;
import com.challenges.lsparse.ast.Node.Attribute;
import com.challenges.lsparse.ast.Node.BareWord;
import com.challenges.lsparse.ast.Node.BooleanExpression;
import com.challenges.lsparse.ast.Node.BooleanLiteral;
import com.challenges.lsparse.ast.Node.Branch;
import com.challenges.lsparse.ast.Node.CompareExpression;
import com.challenges.lsparse.ast.Node.Condition;
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.ast.Node.ElseCondition;
import com.challenges.lsparse.ast.Node.ElseIfCondition;
import com.challenges.lsparse.ast.Node.Expression;
import com.challenges.lsparse.ast.Node.HashEntry;
import com.challenges.lsparse.ast.Node.HashKey;
import com.challenges.lsparse.ast.Node.HashNode;
import com.challenges.lsparse.ast.Node.IfCondition;
import com.challenges.lsparse.ast.Node.MembershipExpression;
import com.challenges.lsparse.ast.Node.MethodCall;
import com.challenges.lsparse.ast.Node.Name;
import com.challenges.lsparse.ast.Node.NegativeExpression;
import com.challenges.lsparse.ast.Node.NumberLiteral;
import com.challenges.lsparse.ast.Node.Plugin;
import com.challenges.lsparse.ast.Node.PluginSection;
import com.challenges.lsparse.ast.Node.RValue;
import com.challenges.lsparse.ast.Node.RegexExpression;
import com.challenges.lsparse.ast.Node.RegexLiteral;
import com.challenges.lsparse.ast.Node.Selector;
import com.challenges.lsparse.ast.Node.Statement;
import com.challenges.lsparse.ast.Node.StringLiteral;
import com.challenges.lsparse.ast.Node.Value;
import com.challenges.lsparse.ast.NodeVisitor;
import com.challenges.lsparse.ast.RegexOperator;
import com.challenges.lsparse.ast.StructuralInvariantException;
import com.challenges.lsparse.parser.ConfigParser;
import com.challenges.lsparse.parser.ConfigSyntaxException;
import com.challenges.lsparse.parser.Rule;
import com.challenges.lsparse.schema.NodeSchema.ArraySchema;
import com.challenges.lsparse.schema.NodeSchema.AttributeSchema;
import com.challenges.lsparse.schema.NodeSchema.BareWordSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanData;
import com.challenges.lsparse.schema.NodeSchema.BooleanExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanSchema;
import com.challenges.lsparse.schema.NodeSchema.BranchSchema;
import com.challenges.lsparse.schema.NodeSchema.CompareData;
import com.challenges.lsparse.schema.NodeSchema.CompareExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.ConditionData;
import com.challenges.lsparse.schema.NodeSchema.ConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.ConfigSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseIfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.HashEntrySchema;
import com.challenges.lsparse.schema.NodeSchema.HashSchema;
import com.challenges.lsparse.schema.NodeSchema.IfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.InExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.MembershipData;
import com.challenges.lsparse.schema.NodeSchema.MethodCallData;
import com.challenges.lsparse.schema.NodeSchema.MethodCallSchema;
import com.challenges.lsparse.schema.NodeSchema.NegativeData;
import com.challenges.lsparse.schema.NodeSchema.NegativeExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NotInExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NumberSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginData;
import com.challenges.lsparse.schema.NodeSchema.PluginSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginSectionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexData;
import com.challenges.lsparse.schema.NodeSchema.RegexExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexpSchema;
import com.challenges.lsparse.schema.NodeSchema.SelectorSchema;
import com.challenges.lsparse.schema.NodeSchema.StatementSchema;
import com.challenges.lsparse.schema.NodeSchema.StringSchema;
import com.challenges.lsparse.schema.NodeSchema.ValueSchema;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts syntax trees to their typed structural form and back.
 *
 * <p>Rebuilt trees carry no source provenance. Explicit parentheses around boolean
 * expressions are not part of the typed form; the printer re-derives the parentheses that
 * precedence requires.
 */
public class SchemaConverter {
    private static final Logger log = LoggerFactory.getLogger(SchemaConverter.class);

    private final ConfigParser parser;

    public SchemaConverter() {
        this(new ConfigParser());
    }

    public SchemaConverter(ConfigParser parser) {
        this.parser = parser;
    }

    public NodeSchema toTyped(Node node) {
        return node.accept(new TypedBuilder());
    }

    public ConfigSchema toTyped(Config config) {
        return (ConfigSchema) toTyped((Node) config);
    }

    /**
     * Rebuilds the tree a typed form describes.
     *
     * @throws SchemaValidationException if the typed form describes a tree the grammar cannot produce
     */
    public Node fromTyped(NodeSchema schema) {
        try {
            Node node = schema.accept(new TreeBuilder());
            log.debug("Rebuilt {} from typed form", node.getClass().getSimpleName());
            return node;
        } catch (StructuralInvariantException | IllegalArgumentException e) {
            throw new SchemaValidationException(e.getMessage(), e);
        }
    }

    public Config fromTyped(ConfigSchema schema) {
        return (Config) fromTyped((NodeSchema) schema);
    }

    // ==================== Tree to typed form ====================

    private static final class TypedBuilder implements NodeVisitor<NodeSchema> {

        private ValueSchema value(Node node) {
            return (ValueSchema) node.accept(this);
        }

        private List<ValueSchema> values(ImmutableList<? extends Node> nodes) {
            return nodes.collect(this::value).castToList();
        }

        private List<StatementSchema> statements(ImmutableList<Statement> nodes) {
            return nodes.collect(node -> (StatementSchema) node.accept(this)).castToList();
        }

        @Override
        public NodeSchema visit(StringLiteral node) {
            return new StringSchema(node.lexeme());
        }

        @Override
        public NodeSchema visit(BareWord node) {
            return new BareWordSchema(node.value());
        }

        @Override
        public NodeSchema visit(NumberLiteral node) {
            return new NumberSchema(node.value());
        }

        @Override
        public NodeSchema visit(BooleanLiteral node) {
            return new BooleanSchema(node.value());
        }

        @Override
        public NodeSchema visit(RegexLiteral node) {
            return new RegexpSchema(node.lexeme());
        }

        @Override
        public NodeSchema visit(Selector node) {
            return new SelectorSchema(node.raw());
        }

        @Override
        public NodeSchema visit(MethodCall node) {
            return new MethodCallSchema(new MethodCallData(node.name(), values(node.arguments())));
        }

        @Override
        public NodeSchema visit(ArrayNode node) {
            return new ArraySchema(values(node.elements()));
        }

        /** Later entries win when two keys share a lexeme. */
        @Override
        public NodeSchema visit(HashNode node) {
            Map<String, ValueSchema> hash = new LinkedHashMap<>();
            for (HashEntry entry : node.entries()) {
                if (hash.put(entry.key().lexeme(), value(entry.value())) != null) {
                    log.debug("Duplicate hash key {} collapsed in typed form", entry.key().lexeme());
                }
            }
            return new HashSchema(hash);
        }

        @Override
        public NodeSchema visit(HashEntry node) {
            return new HashEntrySchema(node.key().lexeme(), value(node.value()));
        }

        @Override
        public NodeSchema visit(Attribute node) {
            return new AttributeSchema(node.name().lexeme(), value(node.value()));
        }

        @Override
        public NodeSchema visit(Plugin node) {
            List<AttributeSchema> attributes = node.attributes()
                .collect(attribute -> (AttributeSchema) attribute.accept(this))
                .castToList();
            return new PluginSchema(new PluginData(node.name(), attributes));
        }

        @Override
        public NodeSchema visit(CompareExpression node) {
            return new CompareExpressionSchema(
                new CompareData(value(node.left()), node.operator().symbol(), value(node.right())));
        }

        @Override
        public NodeSchema visit(RegexExpression node) {
            return new RegexExpressionSchema(
                new RegexData(value(node.left()), node.operator().symbol(), value(node.pattern())));
        }

        @Override
        public NodeSchema visit(MembershipExpression node) {
            MembershipData data = new MembershipData(
                value(node.value()), node.operator().symbol(), value(node.collection()));
            return node.operator() == MembershipOperator.IN
                ? new InExpressionSchema(data)
                : new NotInExpressionSchema(data);
        }

        @Override
        public NodeSchema visit(NegativeExpression node) {
            return new NegativeExpressionSchema(
                new NegativeData(NegativeExpression.OPERATOR, value(node.expression())));
        }

        @Override
        public NodeSchema visit(BooleanExpression node) {
            return new BooleanExpressionSchema(
                new BooleanData(value(node.left()), node.operator().symbol(), value(node.right())));
        }

        @Override
        public NodeSchema visit(IfCondition node) {
            return new IfConditionSchema(new ConditionData(value(node.expression()), statements(node.body())));
        }

        @Override
        public NodeSchema visit(ElseIfCondition node) {
            return new ElseIfConditionSchema(new ConditionData(value(node.expression()), statements(node.body())));
        }

        @Override
        public NodeSchema visit(ElseCondition node) {
            return new ElseConditionSchema(statements(node.body()));
        }

        @Override
        public NodeSchema visit(Branch node) {
            List<ConditionSchema> conditions = node.conditions()
                .collect(condition -> (ConditionSchema) condition.accept(this))
                .castToList();
            return new BranchSchema(conditions);
        }

        @Override
        public NodeSchema visit(PluginSection node) {
            return PluginSectionSchema.of(node.type(), statements(node.body()));
        }

        @Override
        public NodeSchema visit(Config node) {
            List<PluginSectionSchema> sections = node.sections()
                .collect(section -> (PluginSectionSchema) section.accept(this))
                .castToList();
            return new ConfigSchema(sections);
        }
    }

    // ==================== Typed form to tree ====================

    private final class TreeBuilder implements SchemaVisitor<Node> {

        private <T extends Node> T narrow(NodeSchema schema, Class<T> type, String role) {
            Node node = schema.accept(this);
            if (!type.isInstance(node)) {
                throw new SchemaValidationException(
                    role + " cannot be " + node.getClass().getSimpleName());
            }
            return type.cast(node);
        }

        private <S extends NodeSchema, T extends Node> ImmutableList<T> all(
                List<S> schemas, Function<S, T> converter) {
            return Lists.immutable.fromStream(schemas.stream().map(converter));
        }

        private Value value(NodeSchema schema) {
            return narrow(schema, Value.class, "A value");
        }

        private RValue operand(NodeSchema schema) {
            return narrow(schema, RValue.class, "An expression operand");
        }

        private Expression condition(NodeSchema schema) {
            return narrow(schema, Expression.class, "A condition");
        }

        private ImmutableList<Statement> body(List<StatementSchema> schemas) {
            return all(schemas, schema -> narrow(schema, Statement.class, "A body element"));
        }

        private <T extends Node> T parseFragment(String text, Rule rule, Class<T> type, String role) {
            try {
                return type.cast(parser.parse(text, rule));
            } catch (ConfigSyntaxException e) {
                throw new SchemaValidationException("Invalid " + role + " '" + text + "': " + e.getMessage(), e);
            }
        }

        // Lexemes are checked against the grammar, then rebuilt without a span.

        private HashKey hashKey(String text) {
            HashKey key = parseFragment(text, Rule.HASH_KEY, HashKey.class, "hash key");
            if (key instanceof StringLiteral) {
                return new StringLiteral(key.lexeme());
            }
            if (key instanceof NumberLiteral) {
                return new NumberLiteral(key.lexeme());
            }
            return new BareWord(key.lexeme());
        }

        private Name name(String text, String role) {
            Name name = parseFragment(text, Rule.NAME, Name.class, role);
            if (name instanceof StringLiteral) {
                return new StringLiteral(name.lexeme());
            }
            return new BareWord(name.lexeme());
        }

        @Override
        public Node visit(StringSchema schema) {
            StringLiteral string = parseFragment(schema.lsString(), Rule.STRING, StringLiteral.class, "string");
            return new StringLiteral(string.lexeme());
        }

        @Override
        public Node visit(BareWordSchema schema) {
            BareWord word = parseFragment(schema.lsBareWord(), Rule.BAREWORD, BareWord.class, "bare word");
            return new BareWord(word.value());
        }

        @Override
        public Node visit(NumberSchema schema) {
            return NumberLiteral.of(schema.number());
        }

        @Override
        public Node visit(BooleanSchema schema) {
            return new BooleanLiteral(schema.value());
        }

        @Override
        public Node visit(RegexpSchema schema) {
            RegexLiteral regex = parseFragment(schema.regexp(), Rule.REGEXP, RegexLiteral.class, "regex");
            return new RegexLiteral(regex.lexeme());
        }

        @Override
        public Node visit(SelectorSchema schema) {
            Selector selector = parseFragment(schema.selectorNode(), Rule.SELECTOR, Selector.class, "selector");
            return new Selector(selector.raw());
        }

        @Override
        public Node visit(MethodCallSchema schema) {
            MethodCallData call = schema.methodCall();
            return new MethodCall(call.methodName(), all(call.arguments(), this::operand));
        }

        @Override
        public Node visit(ArraySchema schema) {
            return new ArrayNode(all(schema.array(), this::value));
        }

        @Override
        public Node visit(HashSchema schema) {
            ImmutableList<HashEntry> entries = Lists.immutable.fromStream(schema.hash().entrySet().stream()
                .map(entry -> new HashEntry(hashKey(entry.getKey()), value(entry.getValue()))));
            return new HashNode(entries);
        }

        @Override
        public Node visit(HashEntrySchema schema) {
            return new HashEntry(hashKey(schema.key()), value(schema.value()));
        }

        @Override
        public Node visit(AttributeSchema schema) {
            return new Attribute(name(schema.name(), "attribute name"), value(schema.value()));
        }

        @Override
        public Node visit(PluginSchema schema) {
            PluginData plugin = schema.plugin();
            Name name = name(plugin.pluginName(), "plugin name");
            ImmutableList<Attribute> attributes = all(plugin.attributes(), attribute -> (Attribute) visit(attribute));
            return new Plugin(name.lexeme(), attributes);
        }

        @Override
        public Node visit(CompareExpressionSchema schema) {
            CompareData data = schema.compareExpression();
            return new CompareExpression(
                operand(data.left()), ComparisonOperator.fromSymbol(data.operator()), operand(data.right()));
        }

        @Override
        public Node visit(RegexExpressionSchema schema) {
            RegexData data = schema.regexExpression();
            return new RegexExpression(
                operand(data.left()), RegexOperator.fromSymbol(data.operator()), operand(data.pattern()));
        }

        @Override
        public Node visit(InExpressionSchema schema) {
            MembershipData data = schema.inExpression();
            return new MembershipExpression(
                operand(data.value()), MembershipOperator.IN, operand(data.collection()));
        }

        @Override
        public Node visit(NotInExpressionSchema schema) {
            MembershipData data = schema.notInExpression();
            return new MembershipExpression(
                operand(data.value()), MembershipOperator.NOT_IN, operand(data.collection()));
        }

        @Override
        public Node visit(NegativeExpressionSchema schema) {
            return new NegativeExpression(condition(schema.negativeExpression().expression()));
        }

        @Override
        public Node visit(BooleanExpressionSchema schema) {
            BooleanData data = schema.booleanExpression();
            return new BooleanExpression(
                condition(data.left()), BooleanOperator.fromSymbol(data.operator()), condition(data.right()));
        }

        @Override
        public Node visit(IfConditionSchema schema) {
            ConditionData data = schema.ifCondition();
            return new IfCondition(condition(data.expr()), body(data.body()));
        }

        @Override
        public Node visit(ElseIfConditionSchema schema) {
            ConditionData data = schema.elseIfCondition();
            return new ElseIfCondition(condition(data.expr()), body(data.body()));
        }

        @Override
        public Node visit(ElseConditionSchema schema) {
            return new ElseCondition(body(schema.elseCondition()));
        }

        @Override
        public Node visit(BranchSchema schema) {
            return new Branch(all(schema.branch(), condition -> narrow(condition, Condition.class, "A branch member")));
        }

        @Override
        public Node visit(PluginSectionSchema schema) {
            return new PluginSection(schema.sectionType(), body(schema.body()));
        }

        @Override
        public Node visit(ConfigSchema schema) {
            return new Config(all(schema.config(), section -> (PluginSection) visit(section)));
        }
    }
}
