package org.quillmark.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.quillmark.MarkupTransformer;
import org.quillmark.cli.CommandLineInterface;
import org.quillmark.tree.Document;
import org.quillmark.tree.DocumentTree;
import org.quillmark.tree.TreeFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "dump", description = "Prints the resolved document tree of a markup document.")
public class DumpCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The markup document.")
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config;
        String source;
        try {
            config = parent.getConfig();
            source = Files.readString(file);
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("Error loading configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        }

        DocumentTree tree = new MarkupTransformer(config).transform(Map.of(file.toString(), source));
        for (Document document : tree.documents()) {
            spec.commandLine().getOut().print(TreeFormatter.format(document.content()));
        }
        return CommandLineInterface.EXIT_OK;
    }
}
