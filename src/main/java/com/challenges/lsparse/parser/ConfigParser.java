package com.challenges.lsparse.parser;

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
import com.challenges.lsparse.ast.RegexOperator;
import com.challenges.lsparse.ast.SectionType;
import com.challenges.lsparse.ast.SourceSpan;
import com.challenges.lsparse.ast.StructuralInvariantException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the Logstash pipeline configuration language.
 *
 * <p>Alternatives are tried in a fixed order and the first match wins. Whitespace and
 * {@code #} comments may appear between any two tokens. On failure the error reports the
 * farthest position any alternative reached. Input nested more than 256 levels deep (parentheses,
 * arrays, hashes, plugin values, method calls and conditionals together) is rejected with a
 * syntax error.
 */
public class ConfigParser {
    private static final Logger log = LoggerFactory.getLogger(ConfigParser.class);

    public Config parse(String text) {
        return (Config) parse(text, Rule.CONFIG);
    }

    /**
     * Parses {@code text} as a single instance of {@code rule}. The whole text must be consumed,
     * apart from surrounding whitespace and comments.
     */
    public Node parse(String text, Rule rule) {
        Grammar grammar = new Grammar(text);
        grammar.skip();
        Node node = grammar.rule(rule);
        if (node == null) {
            throw grammar.error();
        }
        grammar.skip();
        if (!grammar.atEnd()) {
            grammar.expect("end of input");
            throw grammar.error();
        }
        log.debug("Parsed {} from {} characters", rule, text.length());
        return node;
    }

    /**
     * One parse over one source text. Every rule method either returns its node with the
     * position advanced past it, or returns {@code null} with the position unchanged.
     */
    private static final class Grammar {
        private static final int MAX_NESTING = 256;

        private final String src;
        private int pos;
        private int farthest;
        private int depth;
        private final Set<String> expected = new LinkedHashSet<>();

        Grammar(String src) {
            this.src = src;
        }

        Node rule(Rule rule) {
            return switch (rule) {
                case CONFIG -> config();
                case PLUGIN_SECTION -> pluginSection();
                case PLUGIN -> plugin();
                case ATTRIBUTE -> attribute();
                case BRANCH -> branch();
                case CONDITION -> condition(1);
                case EXPRESSION -> expression();
                case RVALUE -> rvalue();
                case VALUE -> value();
                case ARRAY -> array();
                case HASH -> hash();
                case HASH_KEY -> hashKey();
                case NAME -> name();
                case STRING -> string();
                case NUMBER -> number();
                case BAREWORD -> bareWord();
                case SELECTOR -> selector();
                case REGEXP -> regexp();
                case METHOD_CALL -> methodCall();
                case BOOLEAN -> booleanLiteral();
            };
        }

        // ==================== Structure ====================

        Config config() {
            int start = pos;
            int end = pos;
            MutableList<PluginSection> sections = Lists.mutable.empty();
            PluginSection section;
            while ((section = pluginSection()) != null) {
                sections.add(section);
                end = pos;
                skip();
            }
            if (sections.isEmpty()) {
                pos = start;
                return null;
            }
            return new Config(sections.toImmutable(), new SourceSpan(src, start, end));
        }

        PluginSection pluginSection() {
            int start = pos;
            SectionType type = null;
            for (SectionType candidate : SectionType.values()) {
                if (keyword(candidate.keyword())) {
                    type = candidate;
                    break;
                }
            }
            if (type == null) {
                return null;
            }
            skip();
            MutableList<Statement> body = block();
            if (body == null) {
                pos = start;
                return null;
            }
            return new PluginSection(type, body.toImmutable(), span(start));
        }

        /** {@code "{" (branch | plugin)* "}"} */
        MutableList<Statement> block() {
            int start = pos;
            if (!literal("{")) {
                return null;
            }
            skip();
            MutableList<Statement> body = Lists.mutable.empty();
            Statement statement;
            while ((statement = statement()) != null) {
                body.add(statement);
                skip();
            }
            if (!literal("}")) {
                pos = start;
                return null;
            }
            return body;
        }

        Statement statement() {
            return this.<Statement>nested(() -> {
                Branch branch = branch();
                if (branch != null) {
                    return branch;
                }
                return plugin();
            });
        }

        Plugin plugin() {
            int start = pos;
            Name name = name();
            if (name == null) {
                return null;
            }
            skip();
            if (!literal("{")) {
                pos = start;
                return null;
            }
            skip();
            MutableList<Attribute> attributes = Lists.mutable.empty();
            Attribute attribute;
            while ((attribute = attribute()) != null) {
                attributes.add(attribute);
                skip();
            }
            if (!literal("}")) {
                pos = start;
                return null;
            }
            return new Plugin(name.lexeme(), attributes.toImmutable(), span(start));
        }

        Attribute attribute() {
            int start = pos;
            Name name = name();
            if (name == null) {
                return null;
            }
            skip();
            if (!literal("=>")) {
                pos = start;
                return null;
            }
            skip();
            Value value = value();
            if (value == null) {
                pos = start;
                return null;
            }
            return new Attribute(name, value, span(start));
        }

        // ==================== Branches ====================

        Branch branch() {
            int start = pos;
            if (!keyword("if")) {
                return null;
            }
            Condition first = conditionalBlock(start, true);
            if (first == null) {
                pos = start;
                return null;
            }
            MutableList<Condition> conditions = Lists.mutable.with(first);
            while (true) {
                int save = pos;
                skip();
                int elseStart = pos;
                if (!keyword("else")) {
                    pos = save;
                    break;
                }
                int afterElse = pos;
                skip();
                if (keyword("if")) {
                    Condition elseIf = conditionalBlock(elseStart, false);
                    if (elseIf == null) {
                        pos = save;
                        break;
                    }
                    conditions.add(elseIf);
                    continue;
                }
                pos = afterElse;
                skip();
                MutableList<Statement> body = block();
                if (body == null) {
                    pos = save;
                    break;
                }
                conditions.add(new ElseCondition(body.toImmutable(), span(elseStart)));
                break;
            }
            return new Branch(conditions.toImmutable(), span(start));
        }

        /** Parses {@code condition block} after an {@code if} keyword. */
        Condition conditionalBlock(int start, boolean first) {
            skip();
            Expression expression = condition(1);
            if (expression == null) {
                return null;
            }
            skip();
            MutableList<Statement> body = block();
            if (body == null) {
                return null;
            }
            return first
                ? new IfCondition(expression, body.toImmutable(), span(start))
                : new ElseIfCondition(expression, body.toImmutable(), span(start));
        }

        // ==================== Conditions ====================

        /**
         * Precedence climbing over the boolean operators. Each level is left-associative.
         */
        Expression condition(int minPrecedence) {
            return nested(() -> climb(minPrecedence));
        }

        private Expression climb(int minPrecedence) {
            int start = pos;
            Expression left = expression();
            if (left == null) {
                return null;
            }
            while (true) {
                int save = pos;
                skip();
                BooleanOperator operator = booleanOperator();
                if (operator == null || operator.precedence() < minPrecedence) {
                    pos = save;
                    break;
                }
                skip();
                Expression right = condition(operator.precedence() + 1);
                if (right == null) {
                    pos = save;
                    break;
                }
                left = new BooleanExpression(left, operator, right, false, span(start));
            }
            return left;
        }

        BooleanOperator booleanOperator() {
            for (BooleanOperator operator : BooleanOperator.values()) {
                if (keyword(operator.symbol())) {
                    return operator;
                }
            }
            return null;
        }

        Expression expression() {
            int start = pos;
            if (literal("(")) {
                skip();
                Expression inner = condition(1);
                if (inner != null) {
                    skip();
                    if (literal(")")) {
                        if (inner instanceof BooleanExpression) {
                            return ((BooleanExpression) inner).withExplicitParens(span(start));
                        }
                        return inner;
                    }
                }
                pos = start;
            }

            NegativeExpression negative = negativeExpression();
            if (negative != null) {
                return negative;
            }

            RValue left = rvalue();
            if (left == null) {
                return null;
            }
            int afterLeft = pos;
            skip();

            if (keyword("in")) {
                RValue collection = operand(this::rvalue);
                if (collection != null) {
                    return new MembershipExpression(left, MembershipOperator.IN, collection, span(start));
                }
            }
            pos = afterLeft;
            skip();
            if (keyword("not")) {
                skip();
                if (keyword("in")) {
                    RValue collection = operand(this::rvalue);
                    if (collection != null) {
                        return new MembershipExpression(left, MembershipOperator.NOT_IN, collection, span(start));
                    }
                }
            }
            pos = afterLeft;
            skip();
            for (ComparisonOperator operator : ComparisonOperator.values()) {
                if (literal(operator.symbol())) {
                    RValue right = operand(this::rvalue);
                    if (right != null) {
                        return new CompareExpression(left, operator, right, span(start));
                    }
                    break;
                }
            }
            pos = afterLeft;
            skip();
            for (RegexOperator operator : RegexOperator.values()) {
                if (literal(operator.symbol())) {
                    RValue pattern = operand(this::regexPattern);
                    if (pattern != null) {
                        return new RegexExpression(left, operator, pattern, span(start));
                    }
                    break;
                }
            }
            pos = afterLeft;
            return left;
        }

        /** Skips whitespace and parses the right-hand operand of a binary expression. */
        RValue operand(Supplier<RValue> rule) {
            skip();
            return rule.get();
        }

        RValue regexPattern() {
            StringLiteral string = string();
            if (string != null) {
                return string;
            }
            return regexp();
        }

        NegativeExpression negativeExpression() {
            int start = pos;
            if (!literal("!")) {
                return null;
            }
            skip();
            int afterBang = pos;
            if (literal("(")) {
                skip();
                Expression inner = condition(1);
                if (inner != null) {
                    skip();
                    if (literal(")")) {
                        return new NegativeExpression(inner, span(start));
                    }
                }
                pos = afterBang;
            }
            Selector selector = selector();
            if (selector != null) {
                return new NegativeExpression(selector, span(start));
            }
            pos = start;
            return null;
        }

        // ==================== Values ====================

        Value value() {
            return nested(this::anyValue);
        }

        private Value anyValue() {
            Plugin plugin = plugin();
            if (plugin != null) {
                return plugin;
            }
            BooleanLiteral bool = booleanLiteral();
            if (bool != null) {
                return bool;
            }
            BareWord bareWord = bareWord();
            if (bareWord != null) {
                return bareWord;
            }
            StringLiteral string = string();
            if (string != null) {
                return string;
            }
            NumberLiteral number = number();
            if (number != null) {
                return number;
            }
            ArrayNode array = array();
            if (array != null) {
                return array;
            }
            return hash();
        }

        RValue rvalue() {
            return nested(this::anyRValue);
        }

        private RValue anyRValue() {
            StringLiteral string = string();
            if (string != null) {
                return string;
            }
            NumberLiteral number = number();
            if (number != null) {
                return number;
            }
            Selector selector = selector();
            if (selector != null) {
                return selector;
            }
            ArrayNode array = array();
            if (array != null) {
                return array;
            }
            MethodCall call = methodCall();
            if (call != null) {
                return call;
            }
            return regexp();
        }

        ArrayNode array() {
            int start = pos;
            if (!literal("[")) {
                return null;
            }
            skip();
            MutableList<Value> elements = Lists.mutable.empty();
            Value first = value();
            if (first != null) {
                elements.add(first);
                while (true) {
                    int save = pos;
                    skip();
                    if (!literal(",")) {
                        pos = save;
                        break;
                    }
                    skip();
                    Value next = value();
                    if (next == null) {
                        pos = start;
                        return null;
                    }
                    elements.add(next);
                }
            }
            skip();
            if (!literal("]")) {
                pos = start;
                return null;
            }
            return new ArrayNode(elements.toImmutable(), span(start));
        }

        HashNode hash() {
            int start = pos;
            if (!literal("{")) {
                return null;
            }
            skip();
            MutableList<HashEntry> entries = Lists.mutable.empty();
            HashEntry entry;
            while ((entry = hashEntry()) != null) {
                entries.add(entry);
                skip();
            }
            if (!literal("}")) {
                pos = start;
                return null;
            }
            return new HashNode(entries.toImmutable(), span(start));
        }

        HashEntry hashEntry() {
            int start = pos;
            HashKey key = hashKey();
            if (key == null) {
                return null;
            }
            skip();
            if (!literal("=>")) {
                pos = start;
                return null;
            }
            skip();
            Value value = value();
            if (value == null) {
                pos = start;
                return null;
            }
            return new HashEntry(key, value, span(start));
        }

        HashKey hashKey() {
            NumberLiteral number = number();
            if (number != null) {
                return number;
            }
            BareWord bareWord = bareWord();
            if (bareWord != null) {
                return bareWord;
            }
            return string();
        }

        MethodCall methodCall() {
            int start = pos;
            int end = scanIdentifier(pos, 1);
            if (end < 0) {
                expect("method name");
                return null;
            }
            String name = src.substring(pos, end);
            pos = end;
            skip();
            if (!literal("(")) {
                pos = start;
                return null;
            }
            skip();
            MutableList<RValue> arguments = Lists.mutable.empty();
            RValue first = rvalue();
            if (first != null) {
                arguments.add(first);
                while (true) {
                    int save = pos;
                    skip();
                    if (!literal(",")) {
                        pos = save;
                        break;
                    }
                    skip();
                    RValue next = rvalue();
                    if (next == null) {
                        pos = start;
                        return null;
                    }
                    arguments.add(next);
                }
            }
            skip();
            if (!literal(")")) {
                pos = start;
                return null;
            }
            return new MethodCall(name, arguments.toImmutable(), span(start));
        }

        // ==================== Tokens ====================

        Name name() {
            int end = pos;
            while (end < src.length() && isNameChar(src.charAt(end))) {
                end++;
            }
            if (end > pos) {
                int start = pos;
                pos = end;
                return new BareWord(src.substring(start, end), span(start));
            }
            expect("name");
            return string();
        }

        /** {@code [A-Za-z_][A-Za-z0-9_]+}; a single character is not a bare word. */
        BareWord bareWord() {
            int end = scanIdentifier(pos, 2);
            if (end < 0) {
                expect("bareword");
                return null;
            }
            int start = pos;
            pos = end;
            return new BareWord(src.substring(start, end), span(start));
        }

        BooleanLiteral booleanLiteral() {
            int start = pos;
            if (keyword("true")) {
                return new BooleanLiteral(true, span(start));
            }
            if (keyword("false")) {
                return new BooleanLiteral(false, span(start));
            }
            return null;
        }

        StringLiteral string() {
            if (atEnd() || (peek() != '"' && peek() != '\'')) {
                expect("string");
                return null;
            }
            char quote = peek();
            int i = pos + 1;
            while (i < src.length()) {
                char c = src.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == quote) {
                    int start = pos;
                    pos = i + 1;
                    try {
                        return new StringLiteral(src.substring(start, pos), span(start));
                    } catch (StructuralInvariantException e) {
                        throw new ConfigSyntaxException(src, start, "valid string literal (" + e.getMessage() + ")");
                    }
                } else {
                    i++;
                }
            }
            expect("closing " + quote);
            return null;
        }

        /** {@code -?[0-9]+(\.[0-9]*)?([eE][+-]?[0-9]+)?} */
        NumberLiteral number() {
            int i = pos;
            if (i < src.length() && src.charAt(i) == '-') {
                i++;
            }
            int digitsStart = i;
            while (i < src.length() && isDigit(src.charAt(i))) {
                i++;
            }
            if (i == digitsStart) {
                expect("number");
                return null;
            }
            if (i < src.length() && src.charAt(i) == '.') {
                i++;
                while (i < src.length() && isDigit(src.charAt(i))) {
                    i++;
                }
            }
            if (i < src.length() && (src.charAt(i) == 'e' || src.charAt(i) == 'E')) {
                int j = i + 1;
                if (j < src.length() && (src.charAt(j) == '+' || src.charAt(j) == '-')) {
                    j++;
                }
                int expStart = j;
                while (j < src.length() && isDigit(src.charAt(j))) {
                    j++;
                }
                if (j > expStart) {
                    i = j;
                }
            }
            int start = pos;
            pos = i;
            return new NumberLiteral(src.substring(start, i), span(start));
        }

        /** One or more adjacent {@code [...]} elements whose contents hold no brackets or commas. */
        Selector selector() {
            int i = pos;
            while (i < src.length() && src.charAt(i) == '[') {
                int j = i + 1;
                while (j < src.length() && src.charAt(j) != ']' && src.charAt(j) != '[' && src.charAt(j) != ',') {
                    j++;
                }
                if (j == i + 1 || j >= src.length() || src.charAt(j) != ']') {
                    break;
                }
                i = j + 1;
            }
            if (i == pos) {
                expect("selector");
                return null;
            }
            int start = pos;
            pos = i;
            return new Selector(src.substring(start, i), span(start));
        }

        RegexLiteral regexp() {
            if (atEnd() || peek() != '/') {
                expect("regexp");
                return null;
            }
            int i = pos + 1;
            while (i < src.length() && src.charAt(i) != '\n') {
                char c = src.charAt(i);
                if (c == '\\' && i + 1 < src.length() && src.charAt(i + 1) == '/') {
                    i += 2;
                } else if (c == '/') {
                    int start = pos;
                    pos = i + 1;
                    return new RegexLiteral(src.substring(start, pos), span(start));
                } else {
                    i++;
                }
            }
            expect("closing /");
            return null;
        }

        // ==================== Lexical helpers ====================

        void skip() {
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                    pos++;
                } else if (c == '#') {
                    while (pos < src.length() && src.charAt(pos) != '\n') {
                        pos++;
                    }
                } else {
                    break;
                }
            }
        }

        boolean literal(String token) {
            if (src.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            expect("'" + token + "'");
            return false;
        }

        /** Matches {@code word} only when it is not immediately followed by another word character. */
        boolean keyword(String word) {
            int end = pos + word.length();
            if (src.startsWith(word, pos) && (end >= src.length() || !isWordChar(src.charAt(end)))) {
                pos = end;
                return true;
            }
            expect("'" + word + "'");
            return false;
        }

        /** End of an identifier of at least {@code minLength} characters starting at {@code from}, or -1. */
        int scanIdentifier(int from, int minLength) {
            if (from >= src.length() || !isIdentifierStart(src.charAt(from))) {
                return -1;
            }
            int end = from + 1;
            while (end < src.length() && isWordChar(src.charAt(end))) {
                end++;
            }
            return end - from >= minLength ? end : -1;
        }

        boolean atEnd() {
            return pos >= src.length();
        }

        /** Runs a rule that may recurse, failing once the input nests too deeply. */
        <T> T nested(Supplier<T> rule) {
            if (depth == MAX_NESTING) {
                throw new ConfigSyntaxException(src, pos, "at most " + MAX_NESTING + " levels of nesting");
            }
            depth++;
            try {
                return rule.get();
            } finally {
                depth--;
            }
        }

        char peek() {
            return src.charAt(pos);
        }

        SourceSpan span(int start) {
            return new SourceSpan(src, start, pos);
        }

        void expect(String what) {
            if (pos > farthest) {
                farthest = pos;
                expected.clear();
            }
            if (pos == farthest) {
                expected.add(what);
            }
        }

        ConfigSyntaxException error() {
            String what;
            if (expected.isEmpty()) {
                what = "plugin section";
            } else if (expected.size() == 1) {
                what = expected.iterator().next();
            } else {
                what = "one of " + String.join(", ", expected);
            }
            return new ConfigSyntaxException(src, farthest, what);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
        }

        private static boolean isWordChar(char c) {
            return isIdentifierStart(c) || isDigit(c);
        }

        private static boolean isNameChar(char c) {
            return isWordChar(c) || c == '-';
        }
    }
}
