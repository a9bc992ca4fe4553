package com.challenges.lsparse;

import com.challenges.lsparse.ast.Node;
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.output.ConfigPrinter;
import com.challenges.lsparse.parser.ConfigParser;
import com.challenges.lsparse.parser.ConfigSyntaxException;
import com.challenges.lsparse.parser.Rule;
import com.challenges.lsparse.schema.NodeSchema;
import com.challenges.lsparse.schema.NodeSchema.ConfigSchema;
import com.challenges.lsparse.schema.SchemaCodec;
import com.challenges.lsparse.schema.SchemaConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for reading, writing and converting Logstash pipeline configurations.
 *
 * <p>Instances hold no per-call state and may be shared.
 */
public class LogstashParser {
    private static final Logger log = LoggerFactory.getLogger(LogstashParser.class);

    private final ConfigParser parser;
    private final ConfigPrinter printer;
    private final SchemaConverter converter;
    private final SchemaCodec codec;

    public LogstashParser() {
        this.parser = new ConfigParser();
        this.printer = new ConfigPrinter();
        this.converter = new SchemaConverter(parser);
        this.codec = new SchemaCodec();
    }

    /**
     * Parses a complete configuration.
     *
     * @throws ConfigSyntaxException if the text is blank or does not match the grammar
     */
    public Config parse(String text) {
        Objects.requireNonNull(text, "text");
        if (isBlankOrComments(text)) {
            throw new ConfigSyntaxException("Configuration text is empty", text, text.length());
        }
        Config config = parser.parse(text);
        log.debug("Parsed configuration with {} section(s)", config.sections().size());
        return config;
    }

    /** Parses a fragment of configuration text as a single grammar rule. */
    public Node parse(String text, Rule rule) {
        return parser.parse(text, rule);
    }

    public String toText(Node node) {
        return printer.toText(node);
    }

    public NodeSchema toTyped(Node node) {
        return converter.toTyped(node);
    }

    public ConfigSchema toTyped(Config config) {
        return converter.toTyped(config);
    }

    public Node fromTyped(NodeSchema schema) {
        return converter.fromTyped(schema);
    }

    public Config fromTyped(ConfigSchema schema) {
        return converter.fromTyped(schema);
    }

    /** The typed form of {@code node} as plain maps, lists and scalars. */
    public Object toNeutral(Node node) {
        return codec.toNeutral(converter.toTyped(node));
    }

    /** Validates plain structural data and rebuilds the tree it describes. */
    public Node fromNeutral(Object raw) {
        return converter.fromTyped(codec.validate(raw));
    }

    /**
     * Validates plain structural data as {@code type} and rebuilds the tree it describes. Attributes
     * and hash entries have no field name of their own, so their neutral form is read back this way.
     */
    public Node fromNeutral(Object raw, Class<? extends NodeSchema> type) {
        return converter.fromTyped(codec.validate(raw, type));
    }

    public Config configFromNeutral(Object raw) {
        return converter.fromTyped(codec.validate(raw, ConfigSchema.class));
    }

    public String toJson(Node node) {
        return codec.writeJson(converter.toTyped(node));
    }

    public Node fromJson(String json) {
        return converter.fromTyped(codec.readJson(json));
    }

    public Config configFromJson(String json) {
        return converter.fromTyped(codec.readJson(json, ConfigSchema.class));
    }

    private static boolean isBlankOrComments(String text) {
        for (String line : text.split("\n", -1)) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return false;
            }
        }
        return true;
    }
}
