package org.quillmark.cli.commands;

import org.quillmark.cli.CommandLineInterface;
import org.quillmark.css.CssParsers;
import org.quillmark.css.Selector;
import org.quillmark.css.StyleDeclaration;
import org.quillmark.css.StyleDeclarationSet;
import org.quillmark.css.StylePredicate;
import org.quillmark.css.StyleSheetParseException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "styles", description = "Parses a style sheet and prints its declarations.")
public class StylesCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The style sheet.")
    private Path file;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        StyleDeclarationSet styles;
        try {
            styles = new CssParsers().parseStyleSheet(file.toString(), Files.readString(file));
        } catch (IOException e) {
            err.println("Error reading " + e.getMessage());
            return CommandLineInterface.EXIT_ERROR;
        } catch (StyleSheetParseException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_INVALID_CONTENT;
        }

        for (StyleDeclaration declaration : styles.declarations()) {
            out.println(format(declaration.selector()) + " {");
            for (Map.Entry<String, String> style : declaration.styles().entrySet()) {
                out.println("  " + style.getKey() + ": " + style.getValue() + ";");
            }
            out.println("}");
        }
        return CommandLineInterface.EXIT_OK;
    }

    static String format(Selector selector) {
        String own = selector.predicates().stream()
                .sorted(Comparator.comparingInt(StylesCommand::rank).thenComparing(StylesCommand::name))
                .map(StylesCommand::formatPredicate)
                .collect(Collectors.joining());
        if (own.isEmpty()) own = "*";
        if (selector.parent() == null) return own;
        String combinator = selector.parent().immediate() ? " > " : " ";
        return format(selector.parent().selector()) + combinator + own;
    }

    private static int rank(StylePredicate predicate) {
        if (predicate instanceof StylePredicate.ElementType) return 0;
        if (predicate instanceof StylePredicate.Id) return 1;
        return 2;
    }

    private static String name(StylePredicate predicate) {
        if (predicate instanceof StylePredicate.ElementType type) return type.name();
        if (predicate instanceof StylePredicate.Id id) return id.id();
        return ((StylePredicate.StyleName) predicate).name();
    }

    private static String formatPredicate(StylePredicate predicate) {
        if (predicate instanceof StylePredicate.Id) return "#" + name(predicate);
        if (predicate instanceof StylePredicate.StyleName) return "." + name(predicate);
        return name(predicate);
    }
}
