package com.codescore.cli;

import com.codescore.core.model.Language;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.ParserSelector;
import picocli.CommandLine.Command;

import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list supported languages and the parser tier serving each.
 *
 * <p>Resolving the tier initializes the parser, so a language whose grammar cannot load on
 * this machine shows up as {@code pattern}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codescore languages
 * }</pre>
 */
@Command(
    name = "languages",
    description = "List supported languages and the parser serving each",
    mixinStandardHelpOptions = true
)
public class LanguagesCommand implements Callable<Integer> {

    private final ParserSelector parserSelector;
    private PrintStream out = System.out;

    public LanguagesCommand() {
        this(new ParserSelector());
    }

    LanguagesCommand(ParserSelector parserSelector) {
        this.parserSelector = parserSelector;
    }

    @Override
    public Integer call() {
        out.println("Supported Languages:");
        out.println();
        for (Language language : Language.supported()) {
            ParserTier tier = parserSelector.tierFor(language);
            out.printf("  • %-12s %-8s %s%n",
                language.displayName(),
                tier.name().toLowerCase(Locale.ROOT),
                String.join(" ", language.extensions()));
        }
        return 0;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
