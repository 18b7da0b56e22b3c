package org.quillmark.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.quillmark.MarkupTransformer;
import org.quillmark.cli.CommandLineInterface;
import org.quillmark.diagnostics.Diagnostic;
import org.quillmark.diagnostics.DiagnosticsEngine;
import org.quillmark.diagnostics.InvalidElementCollector;
import org.quillmark.tree.DocumentTree;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Processes documents and reports all invalid content.")
public class CheckCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "The markup documents, processed as one tree.")
    private List<Path> files;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Map<String, String> sources = new LinkedHashMap<>();
        Config config;
        try {
            config = parent.getConfig();
            for (Path file : files) {
                sources.put(file.toString(), Files.readString(file));
            }
        } catch (ConfigException e) {
            err.println("Error loading configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        } catch (IOException e) {
            err.println("Error reading " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        }

        DocumentTree tree = new MarkupTransformer(config).transform(sources);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new InvalidElementCollector(diagnostics).collect(tree);

        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            out.println(diagnostic);
        }
        out.printf("Checked %d documents, found %d problems%n", tree.documents().size(), diagnostics.getDiagnostics().size());
        return diagnostics.hasErrors() ? CommandLineInterface.EXIT_INVALID_CONTENT : CommandLineInterface.EXIT_OK;
    }
}
