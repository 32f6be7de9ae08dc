package org.ifjc.cli.commands;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.ifjc.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the analyze command: exit codes, plain and JSON output.
 */
@Tag("unit")
public class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(AnalyzeCommandTest.class.getResource("/ast/" + name).toURI()).toString();
    }

    @Test
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKey("analyze");
    }

    @Test
    void testHelpOutput() {
        execute("analyze", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("analyze");
        assertThat(output).contains("--file");
        assertThat(output).contains("--dump-symbols");
    }

    @Test
    void testAnalyzeValidProgram() throws Exception {
        int exitCode = execute("analyze", "-f", fixture("shadowing.json"));

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("OK: shadowing.json (1 class(es), 1 global identifier(s))");
    }

    @Test
    void testDumpSymbolsGroupsByScope() throws Exception {
        int exitCode = execute("analyze", "-f", fixture("shadowing.json"), "--dump-symbols");

        assertThat(exitCode).isEqualTo(0);
        String output = out.toString();
        assertThat(output).contains("[global]", "Ifj.write", "[1.1]", "x_11", "[1.1.1]", "x_111");
        assertThat(output.indexOf("[global]")).isLessThan(output.indexOf("[1.1]"));
    }

    @Test
    void testJsonOutput() throws Exception {
        int exitCode = execute("analyze", "-f", fixture("shadowing.json"), "--json");

        assertThat(exitCode).isEqualTo(0);
        JsonObject document = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(document.get("status").getAsString()).isEqualTo("ok");
        assertThat(document.getAsJsonArray("globals").get(0).getAsString()).isEqualTo("__counter");
        assertThat(document.getAsJsonObject("globalTypes").get("__counter").getAsString()).isEqualTo("INT");
        assertThat(document.getAsJsonArray("symbols")).isNotEmpty();
    }

    @Test
    void testUndefinedFunctionExitsWithDefinitionCode() throws Exception {
        int exitCode = execute("analyze", "-f", fixture("undefined-function.json"));

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("Error: DEFINITION:").contains("helper");
    }

    @Test
    void testSemanticErrorIsLoggedAtWarn() throws Exception {
        // First run settles the logging configuration.
        execute("analyze", "-f", fixture("shadowing.json"));
        Logger logger = (Logger) LoggerFactory.getLogger(AnalyzeCommand.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            int exitCode = execute("analyze", "-f", fixture("undefined-function.json"));

            assertThat(exitCode).isEqualTo(3);
            assertThat(appender.list).anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("DEFINITION").contains("helper");
            });
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void testJsonErrorDocument() throws Exception {
        int exitCode = execute("analyze", "-f", fixture("string-minus-number.json"), "--json");

        assertThat(exitCode).isEqualTo(6);
        JsonObject document = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(document.get("status").getAsString()).isEqualTo("error");
        assertThat(document.get("kind").getAsString()).isEqualTo("EXPRESSION_TYPE");
        assertThat(document.get("code").getAsInt()).isEqualTo(6);
    }

    @Test
    void testConfigFileChangesGlobalPrefix() throws Exception {
        Path config = tempDir.resolve("ifjc.conf");
        Files.writeString(config, "ifjc.semantics.global-prefix = \"g_\"\n");

        int exitCode = execute("--config", config.toString(), "analyze", "-f", fixture("shadowing.json"));

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("__counter");
    }

    @Test
    void testMalformedAstReturnsError() throws Exception {
        Path source = tempDir.resolve("broken.json");
        Files.writeString(source, "{\"classes\": [{\"name\": \"Program\"}]}");

        int exitCode = execute("analyze", "-f", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("malformed AST").contains("$.classes[0].body");
    }

    @Test
    void testAnalyzeNonexistentFileReturnsError() {
        int exitCode = execute("analyze", "-f", "/nonexistent/program.json");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("cannot read");
    }

    @Test
    void testMissingRequiredFileOption() {
        int exitCode = execute("analyze");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--file");
    }
}
