package com.challenges.lsparse;

import com.challenges.lsparse.ast.Node;
import com.challenges.lsparse.ast.Node.Attribute;
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.ast.Node.HashEntry;
import com.challenges.lsparse.ast.Node.HashNode;
import com.challenges.lsparse.ast.Node.Plugin;
import com.challenges.lsparse.parser.ConfigSyntaxException;
import com.challenges.lsparse.parser.Rule;
import com.challenges.lsparse.schema.NodeSchema.AttributeSchema;
import com.challenges.lsparse.schema.NodeSchema.HashEntrySchema;
import com.challenges.lsparse.schema.SchemaValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class LogstashParserTest {

    private final LogstashParser parser = new LogstashParser();

    static Stream<String> pipelines() {
        String apache = "# Apache access log pipeline\n"
            + "input {\n"
            + "  beats {\n"
            + "    port => 5044\n"
            + "    ssl => false\n"
            + "  }\n"
            + "  file {\n"
            + "    path => [\"/var/log/apache/*.log\", \"/var/log/nginx/*.log\"]\n"
            + "    start_position => \"beginning\"\n"
            + "    codec => multiline {\n"
            + "      pattern => \"^\\s\"\n"
            + "      what => \"previous\"\n"
            + "    }\n"
            + "  }\n"
            + "}\n"
            + "\n"
            + "filter {\n"
            + "  if [type] == \"apache\" and [source] =~ /access/ {\n"
            + "    grok {\n"
            + "      match => { \"message\" => \"%{COMBINEDAPACHELOG}\" }\n"
            + "      add_tag => [ \"parsed\" ]\n"
            + "    }\n"
            + "    date {\n"
            + "      match => [ \"timestamp\", \"dd/MMM/yyyy:HH:mm:ss Z\" ]\n"
            + "    }\n"
            + "  } else if \"_grokparsefailure\" in [tags] or ![response] {\n"
            + "    drop { }\n"
            + "  } else if [status] not in [200, 304] {\n"
            + "    mutate {\n"
            + "      add_field => { \"alert\" => true }\n"
            + "      remove_field => [ \"headers\" ]\n"
            + "    }\n"
            + "  } else {\n"
            + "    # nothing to do\n"
            + "    noop { }\n"
            + "  }\n"
            + "}\n"
            + "\n"
            + "output {\n"
            + "  if [@metadata][index] {\n"
            + "    elasticsearch {\n"
            + "      hosts => [\"localhost:9200\"]\n"
            + "      index => \"%{[@metadata][index]}-%{+YYYY.MM.dd}\"\n"
            + "    }\n"
            + "  }\n"
            + "  stdout { codec => rubydebug }\n"
            + "}\n";
        String nested = "filter {\n"
            + "  if ([a] == 1 or [b] == 2) and !([c] in [\"x\", \"y\"]) {\n"
            + "    if [d] {\n"
            + "      mutate { add_tag => [\"d\"] }\n"
            + "    }\n"
            + "  }\n"
            + "}\n";
        String generator = "input { generator { count => 3 message => 'single quoted' } } output { null {} }";
        String bigNumbers = "filter { x { c => 12345678901234567890 d => [-98765432109876543210, 7] } }";
        return Stream.of(apache, nested, generator, bigNumbers);
    }

    // ==================== Round trips ====================

    @ParameterizedTest
    @MethodSource("pipelines")
    public void testPrintedTextParsesToSameStructure(String text) {
        Config original = parser.parse(text);
        String printed = parser.toText(original);
        Config reparsed = parser.parse(printed);

        assertEquals(parser.toNeutral(original), parser.toNeutral(reparsed));
        assertEquals(printed, parser.toText(reparsed));
    }

    @ParameterizedTest
    @MethodSource("pipelines")
    public void testJsonRoundTrip(String text) {
        Config original = parser.parse(text);
        Config rebuilt = parser.configFromJson(parser.toJson(original));

        assertEquals(parser.toNeutral(original), parser.toNeutral(rebuilt));
        assertEquals(parser.toText(original), parser.toText(rebuilt));
    }

    @ParameterizedTest
    @MethodSource("pipelines")
    public void testNeutralRoundTrip(String text) {
        Config original = parser.parse(text);
        Object neutral = parser.toNeutral(original);

        assertEquals(neutral, parser.toNeutral(parser.configFromNeutral(neutral)));
        assertTrue(parser.fromNeutral(neutral) instanceof Config);
    }

    @Test
    public void testTypedFormOfApachePipeline() {
        Config config = parser.parse(pipelines().findFirst().orElseThrow());
        assertEquals(3, parser.toTyped(config).config().size());
        assertEquals(config.sections().size(), parser.fromTyped(parser.toTyped(config)).sections().size());
    }

    // ==================== Fragments ====================

    @Test
    public void testFragments() {
        Node plugin = parser.parse("stdout { codec => rubydebug }", Rule.PLUGIN);
        assertTrue(plugin instanceof Plugin);

        Object neutral = parser.toNeutral(plugin);
        assertTrue(neutral instanceof Map);
        assertTrue(parser.fromNeutral(neutral) instanceof Plugin);
        assertTrue(parser.fromJson(parser.toJson(plugin)) instanceof Plugin);
    }

    @Test
    public void testIntegerBeyondLongKeepsItsValue() {
        Config config = parser.parse("filter { x { c => 12345678901234567890 n => 5 } }");

        @SuppressWarnings("unchecked")
        Map<String, Object> plugin = (Map<String, Object>) ((Map<String, Object>) parser.toNeutral(
            config.sections().get(0).body().get(0))).get("plugin");
        List<?> attributes = (List<?>) plugin.get("attributes");
        assertEquals(Map.of("c", Map.of("number", new BigInteger("12345678901234567890"))), attributes.get(0));
        assertEquals(Map.of("n", Map.of("number", 5L)), attributes.get(1));

        assertTrue(parser.toJson(config).contains("12345678901234567890"));
        assertTrue(parser.toText(parser.configFromJson(parser.toJson(config))).contains("c => 12345678901234567890"));
    }

    @Test
    public void testAttributeAndHashEntryNeutralFormReadBack() {
        Node attribute = parser.parse("a1 => 1", Rule.ATTRIBUTE);
        Object neutral = parser.toNeutral(attribute);
        assertEquals(Map.of("a1", Map.of("number", 1L)), neutral);

        Node rebuilt = parser.fromNeutral(neutral, AttributeSchema.class);
        assertTrue(rebuilt instanceof Attribute);
        assertEquals("a1 => 1\n", parser.toText(rebuilt));
        assertThrows(SchemaValidationException.class, () -> parser.fromNeutral(neutral));

        Node entry = ((HashNode) parser.parse("{ \"k\" => [1] }", Rule.VALUE)).entries().get(0);
        Node rebuiltEntry = parser.fromNeutral(parser.toNeutral(entry), HashEntrySchema.class);
        assertTrue(rebuiltEntry instanceof HashEntry);
        assertEquals(parser.toNeutral(entry), parser.toNeutral(rebuiltEntry));
    }

    // ==================== Errors ====================

    @ParameterizedTest
    @ValueSource(strings = {"", "  \n ", "# just a comment\n   # another\n"})
    public void testBlankTextIsRejected(String text) {
        ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class, () -> parser.parse(text));
        assertEquals(text.length(), e.offset());
        assertEquals(text.split("\n", -1).length, e.line());
        assertTrue(e.column() > 0);
        assertEquals("Configuration text is empty", e.getMessage());
    }

    @Test
    public void testSyntaxErrorCarriesPosition() {
        ConfigSyntaxException e = assertThrows(ConfigSyntaxException.class,
            () -> parser.parse("input {\n  stdin {\n}"));
        assertTrue(e.line() > 0);
        assertTrue(e.getMessage().startsWith("Syntax error at line"));
    }

    @Test
    public void testInvalidNeutralDataIsRejected() {
        assertThrows(SchemaValidationException.class,
            () -> parser.configFromNeutral(Map.of("config", List.of())));
        assertThrows(SchemaValidationException.class,
            () -> parser.fromJson("{\"plugin\": {\"plugin_name\": \"bad name\"}}"));
    }
}
