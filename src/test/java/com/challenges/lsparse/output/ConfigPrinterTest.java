package com.challenges.lsparse.output;

import com.challenges.lsparse.ast.BooleanOperator;
import com.challenges.lsparse.ast.Node.BooleanExpression;
import com.challenges.lsparse.ast.Node.Selector;
import com.challenges.lsparse.parser.ConfigParser;
import com.challenges.lsparse.parser.Rule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigPrinterTest {

    private final ConfigParser parser = new ConfigParser();
    private final ConfigPrinter printer = new ConfigPrinter();

    private String reformat(String text) {
        return printer.toText(parser.parse(text));
    }

    // ==================== Layout ====================

    @Test
    public void testGrokScenario() {
        String expected = "filter {\n"
            + "  grok {\n"
            + "    match => {\n"
            + "      \"message\" => \"%{PATTERN}\"\n"
            + "    }\n"
            + "  }\n"
            + "}\n";
        assertEquals(expected, reformat("filter { grok { match => { \"message\" => \"%{PATTERN}\" } } }"));
    }

    @Test
    public void testSectionsAndStatementsSeparatedByBlankLines() {
        String expected = "input {\n"
            + "  stdin {\n"
            + "  }\n"
            + "\n"
            + "  beats {\n"
            + "    port => 5044\n"
            + "  }\n"
            + "}\n"
            + "\n"
            + "output {\n"
            + "  stdout {\n"
            + "    codec => rubydebug\n"
            + "  }\n"
            + "}\n";
        assertEquals(expected, reformat(
            "input { stdin {} beats { port => 5044 } } # comment\noutput { stdout { codec => rubydebug } }"));
    }

    @Test
    public void testElseFollowsClosingBrace() {
        String expected = "filter {\n"
            + "  if [a] == 1 {\n"
            + "    drop {\n"
            + "    }\n"
            + "  } else if [b] {\n"
            + "    mutate {\n"
            + "      x => 1\n"
            + "    }\n"
            + "  } else {\n"
            + "    noop {\n"
            + "    }\n"
            + "  }\n"
            + "}\n";
        assertEquals(expected, reformat(
            "filter { if [a]==1 { drop {} }\nelse if [b] { mutate { x => 1 } } else { noop {} } }"));
    }

    @Test
    public void testPluginValueKeepsBraceOnNameLine() {
        String expected = "output {\n"
            + "  elasticsearch {\n"
            + "    hosts => [\"localhost:9200\", \"other:9200\"]\n"
            + "    codec => json {\n"
            + "      charset => \"UTF-8\"\n"
            + "    }\n"
            + "  }\n"
            + "}\n";
        assertEquals(expected, reformat("output { elasticsearch { hosts => [ \"localhost:9200\",\"other:9200\" ] "
            + "codec => json { charset => \"UTF-8\" } } }"));
    }

    @Test
    public void testLiteralsKeepTheirLexemes() {
        String expected = "filter {\n"
            + "  mutate {\n"
            + "    ratio => 1.50\n"
            + "    quoted => 'single'\n"
            + "    flag => false\n"
            + "  }\n"
            + "}\n";
        assertEquals(expected, reformat("filter{mutate{ratio=>1.50 quoted=>'single' flag=>false}}"));
    }

    @Test
    public void testIndentedFragment() {
        assertEquals("    stdout {\n    }", printer.toText(parser.parse("stdout {}", Rule.PLUGIN), 4));
    }

    // ==================== Conditions ====================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "[a] not  in [1,2]           | [a] not in [1, 2]",
        "[a] in [\"x\",\"y\"]        | [a] in [\"x\", \"y\"]",
        "![tag]                      | ![tag]",
        "!( [a]==1 )                 | !([a] == 1)",
        "[msg] =~ /foo\\/bar/        | [msg] =~ /foo\\/bar/",
        "[msg] !~ \"^x\"             | [msg] !~ \"^x\"",
        "([a] or [b]) and [c]        | ([a] or [b]) and [c]",
        "[a] or [b] and [c]          | [a] or [b] and [c]",
        "(([a] and [b])) or [c]      | ([a] and [b]) or [c]",
        "len([a],\"x\") > 1          | len([a], \"x\") > 1",
        "[a][b] <= -2                | [a][b] <= -2"
    })
    public void testConditionRendering(String input, String expected) {
        assertEquals(expected, printer.toText(parser.parse(input, Rule.CONDITION)));
    }

    @Test
    public void testPrecedenceAddsParensWhenNeeded() {
        BooleanExpression or = new BooleanExpression(new Selector("[a]"), BooleanOperator.OR, new Selector("[b]"));
        BooleanExpression and = new BooleanExpression(or, BooleanOperator.AND, new Selector("[c]"));
        assertEquals("([a] or [b]) and [c]", printer.toText(and));

        BooleanExpression lower = new BooleanExpression(new Selector("[a]"), BooleanOperator.AND, new Selector("[b]"));
        BooleanExpression top = new BooleanExpression(lower, BooleanOperator.OR, new Selector("[c]"));
        assertEquals("[a] and [b] or [c]", printer.toText(top));
    }

    @Test
    public void testRightNestedSameLevelKeepsGrouping() {
        BooleanExpression inner = new BooleanExpression(new Selector("[b]"), BooleanOperator.OR, new Selector("[c]"));
        BooleanExpression outer = new BooleanExpression(new Selector("[a]"), BooleanOperator.OR, inner);
        assertEquals("[a] or ([b] or [c])", printer.toText(outer));

        BooleanExpression left = new BooleanExpression(new Selector("[a]"), BooleanOperator.OR, new Selector("[b]"));
        BooleanExpression chained = new BooleanExpression(left, BooleanOperator.OR, new Selector("[c]"));
        assertEquals("[a] or [b] or [c]", printer.toText(chained));
    }

    @Test
    public void testPrintedConditionParsesBack() {
        String text = "[a] xor ([b] or [c]) and !([d] in [e])";
        String printed = printer.toText(parser.parse(text, Rule.CONDITION));
        assertEquals(printed, printer.toText(parser.parse(printed, Rule.CONDITION)));
    }
}
