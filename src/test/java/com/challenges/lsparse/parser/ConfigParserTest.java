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
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.ast.Node.ElseCondition;
import com.challenges.lsparse.ast.Node.ElseIfCondition;
import com.challenges.lsparse.ast.Node.HashEntry;
import com.challenges.lsparse.ast.Node.HashNode;
import com.challenges.lsparse.ast.Node.IfCondition;
import com.challenges.lsparse.ast.Node.MembershipExpression;
import com.challenges.lsparse.ast.Node.MethodCall;
import com.challenges.lsparse.ast.Node.NegativeExpression;
import com.challenges.lsparse.ast.Node.NumberLiteral;
import com.challenges.lsparse.ast.Node.Plugin;
import com.challenges.lsparse.ast.Node.PluginSection;
import com.challenges.lsparse.ast.Node.RegexExpression;
import com.challenges.lsparse.ast.Node.RegexLiteral;
import com.challenges.lsparse.ast.Node.Selector;
import com.challenges.lsparse.ast.Node.StringLiteral;
import com.challenges.lsparse.ast.RegexOperator;
import com.challenges.lsparse.ast.SectionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    // ==================== Sections and plugins ====================

    @Test
    public void testGrokScenario() {
        Config config = parser.parse("filter { grok { match => { \"message\" => \"%{PATTERN}\" } } }");

        assertEquals(1, config.sections().size());
        PluginSection section = config.sections().get(0);
        assertEquals(SectionType.FILTER, section.type());
        assertEquals(1, section.body().size());

        assertTrue(section.body().get(0) instanceof Plugin);
        Plugin grok = (Plugin) section.body().get(0);
        assertEquals("grok", grok.name());
        assertEquals(1, grok.attributes().size());

        Attribute match = grok.attributes().get(0);
        assertTrue(match.name() instanceof BareWord);
        assertEquals("match", match.name().lexeme());
        assertTrue(match.value() instanceof HashNode);

        HashEntry entry = ((HashNode) match.value()).entries().get(0);
        assertTrue(entry.key() instanceof StringLiteral);
        assertEquals("\"message\"", entry.key().lexeme());
        assertEquals("message", ((StringLiteral) entry.key()).value());
        assertEquals("%{PATTERN}", ((StringLiteral) entry.value()).value());
    }

    @Test
    public void testMultipleSectionsWithComments() {
        String text = "# leading comment\n"
            + "input {\n"
            + "  stdin { } # trailing comment\n"
            + "}\n"
            + "\n"
            + "output {\n"
            + "  # before plugin\n"
            + "  stdout { codec => rubydebug }\n"
            + "}\n";
        Config config = parser.parse(text);

        assertEquals(2, config.sections().size());
        assertEquals(SectionType.INPUT, config.sections().get(0).type());
        assertEquals(SectionType.OUTPUT, config.sections().get(1).type());

        Plugin stdout = (Plugin) config.sections().get(1).body().get(0);
        assertEquals("stdout", stdout.name());
        assertTrue(stdout.attributes().get(0).value() instanceof BareWord);
    }

    @Test
    public void testEmptySectionsAndPlugins() {
        Config config = parser.parse("filter {}");
        assertTrue(config.sections().get(0).body().isEmpty());

        Config withPlugin = parser.parse("output { null {} }");
        Plugin plugin = (Plugin) withPlugin.sections().get(0).body().get(0);
        assertEquals("null", plugin.name());
        assertTrue(plugin.attributes().isEmpty());
    }

    @Test
    public void testValueKinds() {
        Config config = parser.parse("input { generator {\n"
            + "  count => 3\n"
            + "  ratio => -1.5\n"
            + "  enabled => true\n"
            + "  message => 'it\\'s here'\n"
            + "  lines => [\"a\", 'b', 42]\n"
            + "  mode => plain\n"
            + "  codec => json { charset => \"UTF-8\" }\n"
            + "} }");
        Plugin generator = (Plugin) config.sections().get(0).body().get(0);
        assertEquals(7, generator.attributes().size());

        NumberLiteral count = (NumberLiteral) generator.attributes().get(0).value();
        assertEquals(3L, count.value());

        NumberLiteral ratio = (NumberLiteral) generator.attributes().get(1).value();
        assertEquals("-1.5", ratio.lexeme());
        assertEquals(-1.5, ratio.value());

        assertTrue(((BooleanLiteral) generator.attributes().get(2).value()).value());

        StringLiteral message = (StringLiteral) generator.attributes().get(3).value();
        assertEquals("'it\\'s here'", message.lexeme());
        assertEquals("it's here", message.value());

        ArrayNode lines = (ArrayNode) generator.attributes().get(4).value();
        assertEquals(3, lines.elements().size());
        assertTrue(lines.elements().get(2) instanceof NumberLiteral);

        assertEquals("plain", ((BareWord) generator.attributes().get(5).value()).value());

        Plugin codec = (Plugin) generator.attributes().get(6).value();
        assertEquals("json", codec.name());
    }

    @Test
    public void testBooleanKeywordPrefixIsBareWord() {
        Config config = parser.parse("filter { mutate { flag => trueish } }");
        Plugin mutate = (Plugin) config.sections().get(0).body().get(0);
        assertTrue(mutate.attributes().get(0).value() instanceof BareWord);
    }

    @Test
    public void testQuotedAndDashedNames() {
        Config config = parser.parse("filter { \"my-plugin\" { \"key name\" => 1 dashed-key => 2 } }");
        Plugin plugin = (Plugin) config.sections().get(0).body().get(0);
        assertEquals("\"my-plugin\"", plugin.name());
        assertTrue(plugin.attributes().get(0).name() instanceof StringLiteral);
        assertEquals("dashed-key", plugin.attributes().get(1).name().lexeme());
    }

    // ==================== Branches ====================

    @Test
    public void testIfElseIfElse() {
        Config config = parser.parse("filter {\n"
            + "  if [type] == \"apache\" {\n"
            + "    grok { }\n"
            + "  } else if [type] in [\"a\", \"b\"] {\n"
            + "    drop { }\n"
            + "  } else {\n"
            + "    mutate { }\n"
            + "  }\n"
            + "}");
        assertTrue(config.sections().get(0).body().get(0) instanceof Branch);
        Branch branch = (Branch) config.sections().get(0).body().get(0);

        assertEquals(3, branch.conditions().size());
        assertTrue(branch.conditions().get(0) instanceof IfCondition);
        assertTrue(branch.conditions().get(1) instanceof ElseIfCondition);
        assertTrue(branch.conditions().get(2) instanceof ElseCondition);

        IfCondition first = (IfCondition) branch.conditions().get(0);
        assertTrue(first.expression() instanceof CompareExpression);
        assertEquals(ComparisonOperator.EQ, ((CompareExpression) first.expression()).operator());

        ElseIfCondition second = (ElseIfCondition) branch.conditions().get(1);
        MembershipExpression in = (MembershipExpression) second.expression();
        assertEquals(MembershipOperator.IN, in.operator());
        assertTrue(in.collection() instanceof ArrayNode);
    }

    @Test
    public void testCommentBetweenElseAndIf() {
        Config config = parser.parse("filter { if [a] { x {} } else # note\n if [b] { y {} } }");
        Branch branch = (Branch) config.sections().get(0).body().get(0);
        assertEquals(2, branch.conditions().size());
        assertTrue(branch.conditions().get(1) instanceof ElseIfCondition);
    }

    @Test
    public void testNestedBranch() {
        Config config = parser.parse("filter { if [a] { if [b] { drop {} } } }");
        IfCondition outer = (IfCondition) ((Branch) config.sections().get(0).body().get(0)).conditions().get(0);
        assertTrue(outer.body().get(0) instanceof Branch);
    }

    // ==================== Conditions ====================

    @Test
    public void testAndBindsTighterThanOr() {
        Node node = parser.parse("[a] or [b] and [c]", Rule.CONDITION);

        assertTrue(node instanceof BooleanExpression);
        BooleanExpression or = (BooleanExpression) node;
        assertEquals(BooleanOperator.OR, or.operator());
        assertTrue(or.left() instanceof Selector);
        assertTrue(or.right() instanceof BooleanExpression);
        assertEquals(BooleanOperator.AND, ((BooleanExpression) or.right()).operator());
        assertFalse(or.explicitParens());
    }

    @Test
    public void testXorSitsBetweenAndOr() {
        BooleanExpression top = (BooleanExpression) parser.parse("[a] xor [b] nand [c] or [d]", Rule.CONDITION);
        assertEquals(BooleanOperator.OR, top.operator());

        BooleanExpression xor = (BooleanExpression) top.left();
        assertEquals(BooleanOperator.XOR, xor.operator());
        assertEquals(BooleanOperator.NAND, ((BooleanExpression) xor.right()).operator());
    }

    @Test
    public void testSameLevelIsLeftAssociative() {
        BooleanExpression top = (BooleanExpression) parser.parse("[a] and [b] and [c]", Rule.CONDITION);
        assertTrue(top.left() instanceof BooleanExpression);
        assertTrue(top.right() instanceof Selector);
    }

    @Test
    public void testExplicitParensAreRecorded() {
        BooleanExpression and = (BooleanExpression) parser.parse("([a] or [b]) and [c]", Rule.CONDITION);

        assertEquals(BooleanOperator.AND, and.operator());
        BooleanExpression or = (BooleanExpression) and.left();
        assertEquals(BooleanOperator.OR, or.operator());
        assertTrue(or.explicitParens());
        assertEquals("([a] or [b])", or.sourceText().orElseThrow());
    }

    @Test
    public void testParensAroundNonBooleanAreDropped() {
        Node node = parser.parse("([a] == 1)", Rule.CONDITION);
        assertTrue(node instanceof CompareExpression);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "[a] not in [1,2]",
        "[a] not  in [1,2]",
        "[a] not # comment\n in [1,2]"
    })
    public void testNotInTokenization(String text) {
        Node node = parser.parse(text, Rule.CONDITION);

        assertTrue(node instanceof MembershipExpression);
        MembershipExpression notIn = (MembershipExpression) node;
        assertEquals(MembershipOperator.NOT_IN, notIn.operator());
        assertEquals("[a]", ((Selector) notIn.value()).raw());
        assertEquals(2, ((ArrayNode) notIn.collection()).elements().size());
    }

    @Test
    public void testNegation() {
        NegativeExpression selector = (NegativeExpression) parser.parse("![tag]", Rule.CONDITION);
        assertTrue(selector.expression() instanceof Selector);

        NegativeExpression grouped = (NegativeExpression) parser.parse("!(\"x\" in [tags])", Rule.CONDITION);
        assertTrue(grouped.expression() instanceof MembershipExpression);
    }

    @Test
    public void testRegexExpression() {
        RegexExpression match = (RegexExpression) parser.parse("[msg] =~ /err\\/or/", Rule.CONDITION);
        assertEquals(RegexOperator.MATCH, match.operator());
        RegexLiteral pattern = (RegexLiteral) match.pattern();
        assertEquals("/err\\/or/", pattern.lexeme());
        assertEquals("err/or", pattern.pattern());

        RegexExpression noMatch = (RegexExpression) parser.parse("[msg] !~ \"^x\"", Rule.CONDITION);
        assertEquals(RegexOperator.NOT_MATCH, noMatch.operator());
        assertTrue(noMatch.pattern() instanceof StringLiteral);
    }

    @Test
    public void testComparisonOperators() {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            CompareExpression compare = (CompareExpression) parser.parse(
                "[status] " + operator.symbol() + " 200", Rule.CONDITION);
            assertEquals(operator, compare.operator());
        }
    }

    @Test
    public void testMethodCallOperand() {
        CompareExpression compare = (CompareExpression) parser.parse("len([a], \"x\") > 1", Rule.CONDITION);
        assertTrue(compare.left() instanceof MethodCall);
        MethodCall call = (MethodCall) compare.left();
        assertEquals("len", call.name());
        assertEquals(2, call.arguments().size());
    }

    @Test
    public void testSingleElementArrayOperandIsSelector() {
        CompareExpression compare = (CompareExpression) parser.parse("[\"a\"] == [b]", Rule.CONDITION);
        assertTrue(compare.left() instanceof Selector);
        assertEquals("[\"a\"]", ((Selector) compare.left()).raw());
    }

    @Test
    public void testNestedSelector() {
        Selector selector = (Selector) parser.parse("[@metadata][index]", Rule.SELECTOR);
        assertEquals("[@metadata][index]", selector.raw());
    }

    // ==================== Fragments ====================

    @Test
    public void testFragmentRules() {
        assertTrue(parser.parse("[1, 2, 3]", Rule.ARRAY) instanceof ArrayNode);
        assertTrue(parser.parse("{ a1 => 1 }", Rule.HASH) instanceof HashNode);
        assertTrue(parser.parse("\"key\"", Rule.HASH_KEY) instanceof StringLiteral);
        assertTrue(parser.parse("12", Rule.HASH_KEY) instanceof NumberLiteral);
        assertTrue(parser.parse("x", Rule.NAME) instanceof BareWord);
        assertTrue(parser.parse("  false  ", Rule.BOOLEAN) instanceof BooleanLiteral);
        assertTrue(parser.parse("stdout { }", Rule.PLUGIN) instanceof Plugin);
        assertTrue(parser.parse("codec => json", Rule.ATTRIBUTE) instanceof Attribute);
        assertTrue(parser.parse("if [a] { }", Rule.BRANCH) instanceof Branch);
        assertTrue(parser.parse("output { }", Rule.PLUGIN_SECTION) instanceof PluginSection);
        assertTrue(parser.parse("/a+/", Rule.REGEXP) instanceof RegexLiteral);
        assertTrue(parser.parse("now()", Rule.METHOD_CALL) instanceof MethodCall);
        assertTrue(parser.parse("[a]", Rule.RVALUE) instanceof Selector);
        assertTrue(parser.parse("[a] == 1", Rule.EXPRESSION) instanceof CompareExpression);
    }

    @Test
    public void testFragmentMustBeConsumedEntirely() {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("a b", Rule.NAME));
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("[a] and [b]", Rule.EXPRESSION));
    }

    // ==================== Errors ====================

    @Test
    public void testSingleCharacterBareWordIsRejected() {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("filter { mutate { x => a } }"));
        assertNotNull(parser.parse("filter { mutate { x => ab } }"));
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("a", Rule.BAREWORD));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   \n\t", "# only a comment\n"})
    public void testConfigWithoutSectionsIsRejected(String text) {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse(text));
    }

    @Test
    public void testUnknownSectionIsRejected() {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("pipeline { }"));
    }

    @Test
    public void testErrorReportsFarthestPosition() {
        String text = "filter {\n  grok {\n    match => \n  }\n}";
        ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class, () -> parser.parse(text));

        assertEquals(4, e.line());
        assertEquals(3, e.column());
        assertEquals(text.indexOf("  }") + 2, e.offset());
        assertTrue(e.getMessage().startsWith("Syntax error at line 4, column 3"));
    }

    @Test
    public void testUnterminatedString() {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("filter { mutate { a => \"open } }"));
    }

    @Test
    public void testInvalidEscapeIsSyntaxError() {
        assertThrows(ConfigSyntaxException.class, () -> parser.parse("\"\\xZZ\"", Rule.STRING));
    }

    @Test
    public void testDeeplyNestedParenthesesAreSyntaxError() {
        String condition = "(".repeat(3000) + "[a]" + ")".repeat(3000);
        ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class,
            () -> parser.parse(condition, Rule.CONDITION));
        assertTrue(e.getMessage().contains("expected at most 256 levels of nesting"));
        assertEquals(1, e.line());
    }

    @ParameterizedTest
    @ValueSource(strings = {"array", "hash", "branch", "negation"})
    public void testDeeplyNestedStructureIsSyntaxError(String kind) {
        String text = switch (kind) {
            case "array" -> "filter { x { a1 => " + "[".repeat(3000) + "]".repeat(3000) + " } }";
            case "hash" -> "filter { x { a1 => " + "{ k1 => ".repeat(3000) + "1" + " }".repeat(3000) + " } }";
            case "branch" -> "filter { " + "if [a] { ".repeat(3000) + "}".repeat(3000) + " }";
            default -> "filter { if " + "!(".repeat(3000) + "[a]" + ")".repeat(3000) + " { } }";
        };
        assertThrows(ConfigSyntaxException.class, () -> parser.parse(text));
    }

    @Test
    public void testModerateNestingParses() {
        Node condition = parser.parse("(".repeat(100) + "[a] == 1" + ")".repeat(100), Rule.CONDITION);
        assertTrue(condition instanceof CompareExpression);

        Node value = parser.parse("[".repeat(100) + "]".repeat(100), Rule.VALUE);
        assertTrue(value instanceof ArrayNode);
    }

    // ==================== Provenance ====================

    @Test
    public void testSpansCoverExactSource() {
        String pluginText = "grok { match => { \"message\" => \"%{PATTERN}\" } }";
        Config config = parser.parse("filter {\n  " + pluginText + "\n}\n");

        Plugin grok = (Plugin) config.sections().get(0).body().get(0);
        assertEquals(pluginText, grok.sourceText().orElseThrow());
        assertEquals("match => { \"message\" => \"%{PATTERN}\" }",
            grok.attributes().get(0).sourceText().orElseThrow());
        assertEquals("filter {\n  " + pluginText + "\n}", config.sourceText().orElseThrow());
    }

    @Test
    public void testParsingTwiceGivesEqualTrees() {
        String text = "filter { if [a] == 1 { drop {} } }";
        assertEquals(parser.parse(text), parser.parse(text));
    }
}
