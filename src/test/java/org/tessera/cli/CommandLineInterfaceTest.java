package org.tessera.cli;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tessera.compiler.diagnostics.CompilerLogger;
import org.tessera.junit.extensions.logging.AllowLog;
import org.tessera.junit.extensions.logging.ExpectLog;
import org.tessera.junit.extensions.logging.LogWatchExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tessera.junit.extensions.logging.LogLevel.ERROR;
import static org.tessera.junit.extensions.logging.LogLevel.WARN;

/**
 * Integration tests running the {@code tessera} command line against template files.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter stdout;

    @BeforeEach
    void setUp() {
        commandLine = new CommandLine(new CommandLineInterface());
        stdout = new StringWriter();
        commandLine.setOut(new PrintWriter(stdout));
    }

    private Path template(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void compilePrintsTheGeneratedSource() throws IOException {
        // Arrange
        Path file = template("hello.html", "<p s:if=\"ready\">Hi <%= name %></p>");

        // Act
        int exitCode = commandLine.execute("compile", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(stdout.toString())
                .startsWith("// Generated by the Tessera template compiler. Do not edit.\n")
                .contains("if (ready) {\n")
                .contains("out.write(org.tessera.runtime.Escaper.html(name));");
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "\\[WARNING\\] .*warn\\.html:\\d+:\\d+: Missing closing tag for <span>")
    void compileWritesJsonWithDiagnostics() throws IOException {
        // Arrange
        Path file = template("warn.html", "<div><span>x</div>");

        // Act
        int exitCode = commandLine.execute("compile", "--json", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        JsonObject result = JsonParser.parseString(stdout.toString()).getAsJsonObject();
        assertThat(result.get("templatePath").getAsString()).isEqualTo(file.toString());
        assertThat(result.get("source").getAsString()).contains("<span>x</span>");
        assertThat(result.getAsJsonArray("diagnostics")).hasSize(1);
        JsonObject diagnostic = result.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
        assertThat(diagnostic.get("type").getAsString()).isEqualTo("WARNING");
        assertThat(diagnostic.get("message").getAsString()).isEqualTo("Missing closing tag for <span>");
    }

    @Test
    void verbosityOptionSetsTheCompilerLogLevelOnce() throws IOException {
        // Arrange
        Path file = template("quiet.html", "<p>quiet</p>");

        try {
            // Act
            int exitCode = commandLine.execute("-v", "0", "compile", file.toString());

            // Assert
            assertThat(exitCode).isZero();
            assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);
        } finally {
            CompilerLogger.setLevel(CompilerLogger.INFO);
        }
    }

    @Test
    void compileHonoursThePrefixOption() throws IOException {
        // Arrange
        Path file = template("prefix.html", "<p x:if=\"a\">A</p><p s:if=\"b\">B</p>");

        // Act
        int exitCode = commandLine.execute("compile", "--prefix", "x", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(stdout.toString()).contains("if (a) {").contains("s:if=\\\"b\\\"");
    }

    @Test
    void compileWritesToTheOutputFile() throws IOException {
        // Arrange
        Path file = template("page.html", "<b>x</b>");
        Path target = tempDir.resolve("Page.java.txt");

        // Act
        int exitCode = commandLine.execute("compile", "-o", target.toString(), file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(stdout.toString()).isEmpty();
        assertThat(Files.readString(target)).contains("out.write(\"<b>x</b>\");");
    }

    @Test
    @ExpectLog(level = ERROR, messagePattern = "Unknown directive \"forech\"\\. Did you mean \"foreach\"\\? .*")
    @AllowLog(level = ERROR, messagePattern = "\\s+1 \\|.*")
    void invalidTemplateExitsWithCompilationError() throws IOException {
        // Arrange
        Path file = template("bad.html", "<li s:forech=\"items as item\">x</li>");

        // Act
        int exitCode = commandLine.execute("compile", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout.toString()).isEmpty();
    }

    @Test
    @ExpectLog(level = ERROR, messagePattern = "I/O error: .*nope\\.html")
    void missingTemplateExitsWithIoError() {
        // Act
        int exitCode = commandLine.execute("compile", tempDir.resolve("nope.html").toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = ERROR, messagePattern = "Failed to load or parse configuration: .*missing\\.conf")
    void missingConfigurationFileExitsWithIoError() throws IOException {
        // Arrange
        Path file = template("ok.html", "x");

        // Act
        int exitCode = commandLine.execute("-c", tempDir.resolve("missing.conf").toString(), "compile", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void configurationFileChangesTheCompiler() throws IOException {
        // Arrange
        Path conf = tempDir.resolve("custom.conf");
        Files.writeString(conf, "tessera.compiler.pass-through-comments = false");
        Path file = template("comments.html", "<!-- hidden -->v");

        // Act
        int exitCode = commandLine.execute("--config", conf.toString(), "compile", file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(stdout.toString()).doesNotContain("hidden").contains("out.write(\"v\");");
    }
}
