package com.jphrase;

import com.jphrase.lex.Lexer;
import com.jphrase.lex.LexerToken;
import com.jphrase.output.TreeFormatter;
import com.jphrase.parse.Parser;
import com.jphrase.parse.SyntaxTree;
import com.jphrase.reduce.PhraseReducer;
import com.jphrase.registry.PhraseDictionaryLoader;
import com.jphrase.registry.PhraseRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "jphrase", mixinStandardHelpOptions = true, version = "1.0",
         description = "Collapse registered multi-word phrases in an expression into apply nodes")
public class JPhrase implements Callable<Integer> {
    // held so the configured level is not lost to garbage collection
    private static final Logger PACKAGE_LOG = Logger.getLogger("com.jphrase");

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "The expression to reduce (default: stdin)")
    private String expression;

    @Option(names = {"-p", "--phrase"}, description = "A phrase to register, words joined with '_'; may be repeated")
    private List<String> phrases = new ArrayList<>();

    @Option(names = {"-f", "--phrase-file"}, description = "JSON array of phrases to register")
    private File phraseFile;

    @Option(names = {"-c", "--compact-output"}, description = "Print the tree as a single s-expression")
    private boolean compactOutput = false;

    @Option(names = {"-C", "--color-output"}, description = "Colorize tree output")
    private boolean colorOutput = false;

    @Option(names = {"-v", "--verbose"}, description = "Log each phrase resolution to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JPhrase()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            if (verbose) {
                enableVerboseLogging();
            }

            // Build the phrase registry
            PhraseRegistry registry = new PhraseRegistry();
            if (phraseFile != null) {
                try (InputStream input = new FileInputStream(phraseFile)) {
                    new PhraseDictionaryLoader().load(input, registry);
                }
            }
            registry.addPhrases(phrases);

            // Parse the expression
            String source = expression != null ? expression : readStdin();
            List<LexerToken> tokens = new Lexer().lex(source);
            SyntaxTree tree = new Parser().parse(tokens);

            // Reduce phrases
            SyntaxTree reduced = new PhraseReducer().reduce(tree, registry);

            // Format and output the result
            TreeFormatter formatter = new TreeFormatter(!compactOutput, colorOutput);
            spec.commandLine().getOut().println(formatter.format(reduced));
            spec.commandLine().getOut().flush();

            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }

    private static String readStdin() throws IOException {
        return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void enableVerboseLogging() {
        PACKAGE_LOG.setLevel(Level.FINE);
        if (PACKAGE_LOG.getHandlers().length > 0) {
            return;
        }
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        PACKAGE_LOG.addHandler(handler);
        PACKAGE_LOG.setUseParentHandlers(false);
    }
}
