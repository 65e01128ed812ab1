package org.tessera.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.typesafe.config.ConfigException;
import org.tessera.cli.CommandLineInterface;
import org.tessera.compiler.TemplateCompiler;
import org.tessera.compiler.api.CompilationException;
import org.tessera.compiler.api.CompiledTemplate;
import org.tessera.compiler.config.CompilerConfig;
import org.tessera.compiler.config.CompilerConfigLoader;
import org.tessera.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a template file to a Java render body.")
public class CompileCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILATION_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", description = "The template file.")
    private File file;

    @Option(names = "--debug", description = "Add the source path and compile time to the generated code.")
    private boolean debug;

    @Option(names = "--prefix", description = "Directive prefix to use instead of the configured one, e.g. 'x' for x:if.")
    private String prefix;

    @Option(names = "--json", description = "Print the result as JSON, including diagnostics.")
    private boolean json;

    @Option(names = {"-o", "--output"}, description = "Write the generated code to this file instead of stdout.")
    private File output;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CompilerConfig config;
        try {
            config = CompilerConfigLoader.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return EXIT_IO_ERROR;
        }
        if (prefix != null && !prefix.isBlank()) {
            config = config.withDirectivePrefix(prefix);
        }
        if (debug) {
            config = config.withDebug(true);
        }

        try {
            String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            CompiledTemplate compiled = new TemplateCompiler(config).compile(source, file.getPath());
            for (Diagnostic diagnostic : compiled.diagnostics()) {
                LOG.warn("{}", diagnostic);
            }

            String rendered = json ? toJson(compiled) : compiled.source();
            if (output != null) {
                Files.writeString(output.toPath(), rendered, StandardCharsets.UTF_8);
                LOG.info("Wrote {}", output.getPath());
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.print(rendered);
                out.flush();
            }
            return EXIT_OK;
        } catch (CompilationException e) {
            LOG.error("{}", e.getMessage());
            Diagnostic diagnostic = e.getDiagnostic();
            if (diagnostic.snippet() != null) {
                LOG.error("\n{}", diagnostic.snippet());
            }
            return EXIT_COMPILATION_ERROR;
        } catch (IOException e) {
            LOG.error("I/O error: {}", e.getMessage());
            return EXIT_IO_ERROR;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while compiling {}", file, e);
            return EXIT_IO_ERROR;
        }
    }

    private static String toJson(CompiledTemplate compiled) {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        JsonObject result = new JsonObject();
        result.addProperty("templatePath", compiled.templatePath());
        result.addProperty("source", compiled.source());
        result.add("diagnostics", gson.toJsonTree(compiled.diagnostics()));
        return gson.toJson(result);
    }
}
