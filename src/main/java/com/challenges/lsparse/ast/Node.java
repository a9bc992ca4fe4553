package com.challenges.lsparse.ast;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Syntax tree of a Logstash pipeline configuration.
 *
 * <p>Nodes are immutable. A node produced by the parser carries the {@link SourceSpan}
 * it was read from; nodes built by hand or rebuilt from the structural form carry none.
 */
public sealed interface Node {

    SourceSpan span();

    <R> R accept(NodeVisitor<R> visitor);

    default ImmutableList<Node> children() {
        return Lists.immutable.empty();
    }

    /**
     * The exact text this node was parsed from, sliced lazily from the original source.
     */
    default Optional<String> sourceText() {
        SourceSpan span = span();
        return span == null ? Optional.empty() : Optional.of(span.text());
    }

    /**
     * All descendants in depth-first pre-order, excluding this node. Each call starts a fresh walk.
     */
    default Stream<Node> traverse() {
        return children().castToList().stream()
            .flatMap(child -> Stream.concat(Stream.of(child), child.traverse()));
    }

    // Operand unions

    /** Attribute, array element and hash values. */
    sealed interface Value extends Node {}

    /** Anything usable as a condition. */
    sealed interface Expression extends Node {}

    /** Operands of comparison, regex and membership expressions. */
    sealed interface RValue extends Expression {}

    sealed interface HashKey extends Node {
        String lexeme();
    }

    /** Plugin and attribute names. */
    sealed interface Name extends Node {
        String lexeme();
    }

    /** Members of a plugin section or conditional body. */
    sealed interface Statement extends Node {}

    sealed interface Condition extends Node {
        ImmutableList<Statement> body();
    }

    // Literals

    record StringLiteral(String lexeme, String value, SourceSpan span)
            implements Value, RValue, HashKey, Name {
        public StringLiteral {
            Objects.requireNonNull(lexeme, "lexeme");
            Objects.requireNonNull(value, "value");
        }

        public StringLiteral(String lexeme, SourceSpan span) {
            this(lexeme, Lexemes.unquote(lexeme), span);
        }

        public StringLiteral(String lexeme) {
            this(lexeme, null);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BareWord(String value, SourceSpan span) implements Value, HashKey, Name {
        private static final Pattern NAME_CHARS = Pattern.compile("[A-Za-z0-9_-]+");

        public BareWord {
            Objects.requireNonNull(value, "value");
            if (!NAME_CHARS.matcher(value).matches()) {
                throw new StructuralInvariantException("Invalid bare word: '" + value + "'");
            }
        }

        public BareWord(String value) {
            this(value, null);
        }

        @Override
        public String lexeme() {
            return value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record NumberLiteral(String lexeme, Number value, SourceSpan span) implements Value, RValue, HashKey {
        public NumberLiteral {
            Objects.requireNonNull(lexeme, "lexeme");
            Objects.requireNonNull(value, "value");
        }

        public NumberLiteral(String lexeme, SourceSpan span) {
            this(lexeme, Lexemes.parseNumber(lexeme), span);
        }

        public NumberLiteral(String lexeme) {
            this(lexeme, (SourceSpan) null);
        }

        public static NumberLiteral of(Number value) {
            return new NumberLiteral(Lexemes.formatNumber(value), value, null);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record BooleanLiteral(boolean value, SourceSpan span) implements Value {
        public BooleanLiteral(boolean value) {
            this(value, null);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RegexLiteral(String lexeme, String pattern, SourceSpan span) implements RValue {
        public RegexLiteral {
            Objects.requireNonNull(lexeme, "lexeme");
            Objects.requireNonNull(pattern, "pattern");
        }

        public RegexLiteral(String lexeme, SourceSpan span) {
            this(lexeme, Lexemes.regexPattern(lexeme), span);
        }

        public RegexLiteral(String lexeme) {
            this(lexeme, null);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Field reference such as {@code [request][status]}, kept exactly as written. */
    record Selector(String raw, SourceSpan span) implements RValue {
        public Selector {
            Objects.requireNonNull(raw, "raw");
            if (raw.length() < 3 || raw.charAt(0) != '[' || raw.charAt(raw.length() - 1) != ']') {
                throw new StructuralInvariantException("Invalid selector: '" + raw + "'");
            }
        }

        public Selector(String raw) {
            this(raw, null);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record MethodCall(String name, ImmutableList<RValue> arguments, SourceSpan span) implements RValue {
        private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

        public MethodCall {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(arguments, "arguments");
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new StructuralInvariantException("Invalid method name: '" + name + "'");
            }
        }

        public MethodCall(String name, ImmutableList<RValue> arguments) {
            this(name, arguments, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(arguments);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // Collections

    record ArrayNode(ImmutableList<Value> elements, SourceSpan span) implements Value, RValue {
        public ArrayNode {
            Objects.requireNonNull(elements, "elements");
        }

        public ArrayNode(ImmutableList<Value> elements) {
            this(elements, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(elements);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record HashEntry(HashKey key, Value value, SourceSpan span) implements Node {
        public HashEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        public HashEntry(HashKey key, Value value) {
            this(key, value, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(key, value);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record HashNode(ImmutableList<HashEntry> entries, SourceSpan span) implements Value {
        public HashNode {
            Objects.requireNonNull(entries, "entries");
        }

        public HashNode(ImmutableList<HashEntry> entries) {
            this(entries, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(entries);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Attribute(Name name, Value value, SourceSpan span) implements Node {
        public Attribute {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        public Attribute(Name name, Value value) {
            this(name, value, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(name, value);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** A plugin block. The name is kept as written, quotes included. */
    record Plugin(String name, ImmutableList<Attribute> attributes, SourceSpan span) implements Value, Statement {
        public Plugin {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(attributes, "attributes");
            if (name.isEmpty()) {
                throw new StructuralInvariantException("Plugin name must not be empty");
            }
        }

        public Plugin(String name, ImmutableList<Attribute> attributes) {
            this(name, attributes, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(attributes);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // Expressions

    record CompareExpression(RValue left, ComparisonOperator operator, RValue right, SourceSpan span)
            implements Expression {
        public CompareExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        public CompareExpression(RValue left, ComparisonOperator operator, RValue right) {
            this(left, operator, right, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(left, right);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RegexExpression(RValue left, RegexOperator operator, RValue pattern, SourceSpan span)
            implements Expression {
        public RegexExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(pattern, "pattern");
            if (!(pattern instanceof StringLiteral) && !(pattern instanceof RegexLiteral)) {
                throw new StructuralInvariantException(
                    "Regex pattern must be a string or regex literal, got " + pattern.getClass().getSimpleName());
            }
        }

        public RegexExpression(RValue left, RegexOperator operator, RValue pattern) {
            this(left, operator, pattern, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(left, pattern);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record MembershipExpression(RValue value, MembershipOperator operator, RValue collection, SourceSpan span)
            implements Expression {
        public MembershipExpression {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(collection, "collection");
        }

        public MembershipExpression(RValue value, MembershipOperator operator, RValue collection) {
            this(value, operator, collection, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(value, collection);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Logical negation, written {@code !}. */
    record NegativeExpression(Expression expression, SourceSpan span) implements Expression {
        public static final String OPERATOR = "!";

        public NegativeExpression {
            Objects.requireNonNull(expression, "expression");
        }

        public NegativeExpression(Expression expression) {
            this(expression, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(expression);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Binary boolean connective. {@code explicitParens} records that the source wrapped this
     * expression in parentheses; the printer keeps them even where precedence does not need them.
     */
    record BooleanExpression(Expression left, BooleanOperator operator, Expression right,
                             boolean explicitParens, SourceSpan span) implements Expression {
        public BooleanExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        public BooleanExpression(Expression left, BooleanOperator operator, Expression right) {
            this(left, operator, right, false, null);
        }

        public BooleanExpression withExplicitParens(SourceSpan parenthesizedSpan) {
            return new BooleanExpression(left, operator, right, true, parenthesizedSpan);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(left, right);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // Conditionals

    record IfCondition(Expression expression, ImmutableList<Statement> body, SourceSpan span) implements Condition {
        public IfCondition {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(body, "body");
        }

        public IfCondition(Expression expression, ImmutableList<Statement> body) {
            this(expression, body, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(expression).newWithAll(body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ElseIfCondition(Expression expression, ImmutableList<Statement> body, SourceSpan span)
            implements Condition {
        public ElseIfCondition {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(body, "body");
        }

        public ElseIfCondition(Expression expression, ImmutableList<Statement> body) {
            this(expression, body, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>of(expression).newWithAll(body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ElseCondition(ImmutableList<Statement> body, SourceSpan span) implements Condition {
        public ElseCondition {
            Objects.requireNonNull(body, "body");
        }

        public ElseCondition(ImmutableList<Statement> body) {
            this(body, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * An {@code if} chain: one if-condition, any number of else-if conditions, and an optional
     * trailing else-condition.
     */
    record Branch(ImmutableList<Condition> conditions, SourceSpan span) implements Statement {
        public Branch {
            Objects.requireNonNull(conditions, "conditions");
            if (conditions.isEmpty() || !(conditions.get(0) instanceof IfCondition)) {
                throw new StructuralInvariantException("A branch must start with an if condition");
            }
            for (int i = 1; i < conditions.size(); i++) {
                Condition condition = conditions.get(i);
                if (condition instanceof IfCondition) {
                    throw new StructuralInvariantException("Only the first condition of a branch may be an if condition");
                }
                if (condition instanceof ElseCondition && i != conditions.size() - 1) {
                    throw new StructuralInvariantException("An else condition must be the last condition of a branch");
                }
            }
        }

        public Branch(ImmutableList<Condition> conditions) {
            this(conditions, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(conditions);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // Sections

    record PluginSection(SectionType type, ImmutableList<Statement> body, SourceSpan span) implements Node {
        public PluginSection {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(body, "body");
        }

        public PluginSection(SectionType type, ImmutableList<Statement> body) {
            this(type, body, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(body);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record Config(ImmutableList<PluginSection> sections, SourceSpan span) implements Node {
        public Config {
            Objects.requireNonNull(sections, "sections");
            if (sections.isEmpty()) {
                throw new StructuralInvariantException("A configuration needs at least one plugin section");
            }
        }

        public Config(ImmutableList<PluginSection> sections) {
            this(sections, null);
        }

        @Override
        public ImmutableList<Node> children() {
            return Lists.immutable.<Node>withAll(sections);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
