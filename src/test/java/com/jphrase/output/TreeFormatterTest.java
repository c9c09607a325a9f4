package com.jphrase.output;

import com.jphrase.PhraseLoggingConfig;
import com.jphrase.lex.Lexer;
import com.jphrase.lex.LexerToken;
import com.jphrase.lex.TokenType;
import com.jphrase.parse.Definition;
import com.jphrase.parse.MalformedTreeException;
import com.jphrase.parse.Parser;
import com.jphrase.parse.SyntaxNode;
import com.jphrase.parse.SyntaxTree;
import com.jphrase.reduce.PhraseReducer;
import com.jphrase.registry.PhraseRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeFormatterTest extends PhraseLoggingConfig {

    private static SyntaxTree parse(String input) {
        return new Parser().parse(new Lexer().lex(input));
    }

    private static SyntaxTree reduce(String input, String... phrases) {
        PhraseRegistry registry = new PhraseRegistry();
        registry.addPhrases(List.of(phrases));
        return new PhraseReducer().reduce(parse(input), registry);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "task                 | task",
        "perform 5 task       | (LIST (LIST perform 5) task)",
        "run ()               | (LIST run ())",
        "say \"hi\"           | (LIST say \"hi\")",
        "(a b)                | (GROUP (LIST a b) _)"
    })
    public void testCompactParsed(String input, String expected) {
        assertEquals(expected, new TreeFormatter(false).format(parse(input)));
    }

    @Test
    public void testCompactReduced() {
        TreeFormatter formatter = new TreeFormatter(false);

        assertEquals("(EMPTY_APPLY task _)", formatter.format(reduce("task", "task")));
        assertEquals("(APPLY_TO 5 perform_task)", formatter.format(reduce("perform 5 task", "perform_task")));
        assertEquals("(APPLY_TO (LIST 5 10) perform_task)",
                formatter.format(reduce("perform 5 10 task", "perform_task")));
        assertEquals("(APPLY_TO (EMPTY_APPLY special _) perform_task)",
                formatter.format(reduce("perform special task", "perform_task", "special")));
        assertEquals("(APPLY_TO (GROUP (EMPTY_APPLY special _) _) perform_task)",
                formatter.format(reduce("perform (special) task", "perform_task", "special")));
    }

    @Test
    public void testPretty() {
        TreeFormatter formatter = new TreeFormatter(true);

        assertEquals("APPLY_TO\n  NUMBER 5\n  IDENTIFIER perform_task",
                formatter.format(reduce("perform 5 task", "perform_task")));
        assertEquals("EMPTY_APPLY\n  IDENTIFIER task", formatter.format(reduce("task", "task")));
        assertEquals("IDENTIFIER task", formatter.format(parse("task")));
    }

    @Test
    public void testPrettyNested() {
        String expected = String.join("\n",
                "APPLY_TO",
                "  LIST",
                "    NUMBER 5",
                "    EMPTY_APPLY",
                "      IDENTIFIER super_special",
                "  IDENTIFIER perform_task");

        assertEquals(expected, new TreeFormatter(true)
                .format(reduce("perform 5 super special task", "perform_task", "super_special")));
    }

    @Test
    public void testPrettyMarksAbsentLeft() {
        SyntaxTree tree = new SyntaxTree();
        tree.addNode(new SyntaxNode(Definition.LIST, null, null, 1, new LexerToken(" ", TokenType.WHITESPACE, 0, 0)));
        tree.addNode(new SyntaxNode(Definition.NUMBER, 0, null, null, new LexerToken("5", TokenType.NUMBER, 0, 1)));

        assertEquals("LIST\n  _\n  NUMBER 5", new TreeFormatter(true).format(tree));
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        StringBuilder source = new StringBuilder("w0");
        for (int i = 1; i < 50_000; i++) {
            source.append(" w").append(i);
        }

        String formatted = new TreeFormatter(false).format(parse(source.toString()));

        assertTrue(formatted.startsWith("(LIST (LIST (LIST "));
        assertTrue(formatted.contains("(LIST w0 w1) w2)"));
        assertTrue(formatted.endsWith(" w49999)"));
    }

    @Test
    public void testPrettyDeepChain() {
        StringBuilder source = new StringBuilder("w0");
        for (int i = 1; i < 2_000; i++) {
            source.append(" w").append(i);
        }

        String formatted = new TreeFormatter(true).format(parse(source.toString()));

        assertTrue(formatted.startsWith("LIST\n  LIST\n    LIST"));
        assertTrue(formatted.endsWith("\n  IDENTIFIER w1999"));
    }

    @Test
    public void testCycleIsReported() {
        SyntaxTree tree = new SyntaxTree();
        tree.addNode(new SyntaxNode(Definition.LIST, null, 1, null, new LexerToken(" ", TokenType.WHITESPACE, 0, 0)));
        tree.addNode(new SyntaxNode(Definition.LIST, 0, 0, null, new LexerToken(" ", TokenType.WHITESPACE, 0, 1)));

        assertThrows(MalformedTreeException.class, () -> new TreeFormatter(false).format(tree));
        assertThrows(MalformedTreeException.class, () -> new TreeFormatter(true).format(tree));
    }

    @Test
    public void testColor() {
        String formatted = new TreeFormatter(false, true).format(reduce("task", "task"));

        assertEquals("(\u001B[1;34mEMPTY_APPLY\u001B[0m \u001B[32mtask\u001B[0m _)", formatted);
    }

    @Test
    public void testColorForLiterals() {
        String formatted = new TreeFormatter(false, true).format(parse("5"));

        assertEquals("\u001B[33m5\u001B[0m", formatted);
    }

    @Test
    public void testEmptyTree() {
        assertEquals("", new TreeFormatter(true).format(new SyntaxTree()));
    }
}
