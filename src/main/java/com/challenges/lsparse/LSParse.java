package com.challenges.lsparse;

import com.challenges.lsparse.ast.Node.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "lsparse", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse, reformat and convert Logstash pipeline configurations")
public class LSParse implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(LSParse.class);

    @Parameters(index = "0", arity = "0..1", description = "Input file (default: stdin)")
    private File inputFile;

    @Option(names = {"-j", "--to-json"}, description = "Print the typed structural form as JSON")
    private boolean toJson = false;

    @Option(names = {"-J", "--from-json"}, description = "Read the typed structural form as JSON instead of configuration text")
    private boolean fromJson = false;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public LSParse() {
        this(System.in, System.out, System.err);
    }

    LSParse(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LSParse()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            String input = readInput();
            LogstashParser parser = new LogstashParser();

            Config config = fromJson ? parser.configFromJson(input) : parser.parse(input);

            if (toJson) {
                out.println(parser.toJson(config));
            } else {
                out.print(parser.toText(config));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.debug("lsparse failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private String readInput() throws IOException {
        if (inputFile != null) {
            return Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        }
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
