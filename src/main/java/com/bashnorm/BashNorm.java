package com.bashnorm;

import com.bashnorm.grammar.GrammarLookup;
import com.bashnorm.grammar.JsonGrammarLookup;
import com.bashnorm.normalize.NormalizeResult;
import com.bashnorm.normalize.Normalizer;
import com.bashnorm.normalize.NormalizerOptions;
import com.bashnorm.output.TokenCodec;
import com.bashnorm.output.TokenOptions;
import com.bashnorm.raw.ParsedCommand;
import com.bashnorm.raw.RawTreeReader;
import com.bashnorm.tree.Node;
import com.bashnorm.tree.StructuralPruner;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;

@Command(name = "bashnorm", mixinStandardHelpOptions = true, version = "1.0",
         description = "Normalize parsed shell commands into canonical token sequences")
public class BashNorm implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(BashNorm.class);

    @Parameters(index = "0", arity = "0..1", description = "Parser output, one JSON object per command (default: stdin)")
    private File inputFile;

    @Option(names = {"-g", "--grammar"}, description = "Command grammar JSON (default: bundled grammar)")
    private File grammarFile;

    @Option(names = "--keep-digits", description = "Do not replace digits in arguments")
    private boolean keepDigits = false;

    @Option(names = "--keep-long-patterns", description = "Do not replace arguments containing spaces")
    private boolean keepLongPatterns = false;

    @Option(names = "--no-quotes", description = "Drop the quotes users wrote around arguments")
    private boolean noQuotes = false;

    @Option(names = {"-l", "--loose"}, description = "Tolerate trees that break structural constraints")
    private boolean loose = false;

    @Option(names = {"-i", "--ignore-flag-order"}, description = "Sort the children of each command")
    private boolean ignoreFlagOrder = false;

    @Option(names = {"-t", "--arg-type-only"}, description = "Print argument types instead of values")
    private boolean argTypeOnly = false;

    @Option(names = "--with-arg-type", description = "Print arguments as compound symbols")
    private boolean withArgType = false;

    @Option(names = {"-p", "--prune"}, description = "Drop argument values before printing")
    private boolean prune = false;

    @Option(names = {"-s", "--symbols"}, description = "Print the prefix symbol encoding")
    private boolean symbols = false;

    private PrintStream out = System.out;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BashNorm()).execute(args);
        System.exit(exitCode);
    }

    BashNorm withOutput(PrintStream out) {
        this.out = out;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        try {
            GrammarLookup grammar = grammarFile != null
                    ? JsonGrammarLookup.load(grammarFile.toPath())
                    : JsonGrammarLookup.bundled();

            MutableList<ParsedCommand> commands;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                commands = new RawTreeReader().readAll(input);
            }

            Normalizer normalizer = new Normalizer(grammar, normalizerOptions());
            TokenCodec codec = new TokenCodec(grammar);
            TokenOptions tokenOptions = tokenOptions();

            int skipped = 0;
            for (ParsedCommand command : commands) {
                NormalizeResult result = normalizer.normalize(command);
                if (result instanceof NormalizeResult.Failed failed) {
                    logger.warn("normalize.skip kind={} reason={} command={}",
                            failed.kind(), failed.message(), failed.command());
                    out.println();
                    skipped++;
                    continue;
                }
                Node tree = prune ? StructuralPruner.prune(result.tree()) : result.tree();
                out.println(symbols
                        ? codec.encode(tree).makeString(" ")
                        : codec.toCommand(tree, tokenOptions));
            }
            logger.info("normalize.done total={} skipped={}", commands.size(), skipped);
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private NormalizerOptions normalizerOptions() {
        return NormalizerOptions.defaults()
                .withNormalizeDigits(!keepDigits)
                .withNormalizeLongPatterns(!keepLongPatterns)
                .withRecoverQuotation(!noQuotes);
    }

    private TokenOptions tokenOptions() {
        return TokenOptions.strict()
                .withLooseConstraints(loose)
                .withIgnoreFlagOrder(ignoreFlagOrder)
                .withArgTypeOnly(argTypeOnly)
                .withArgTypeSymbols(withArgType);
    }
}
