package lang;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;

public class TestLexer extends TestCase {

    private static List<TokenKind> kinds(String source) throws ParseException {
        List<TokenKind> kinds = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) {
            kinds.add(t.getKind());
        }
        return kinds;
    }

    private static List<String> texts(String source, TokenKind kind) throws ParseException {
        List<String> texts = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) {
            if (t.getKind() == kind) {
                texts.add(t.getText());
            }
        }
        return texts;
    }

    public static void testSimpleStatement() throws ParseException {
        List<Token> tokens = new Lexer("b = a + 10\n").tokenize();
        assertEquals(7, tokens.size());
        assertTrue(tokens.get(0).isName("b"));
        assertTrue(tokens.get(1).isOperator("="));
        assertTrue(tokens.get(2).isName("a"));
        assertTrue(tokens.get(3).isOperator("+"));
        assertEquals(TokenKind.NUMBER, tokens.get(4).getKind());
        assertEquals(TokenKind.NEWLINE, tokens.get(5).getKind());
        assertEquals(TokenKind.END, tokens.get(6).getKind());
    }

    public static void testMissingFinalNewline() throws ParseException {
        List<TokenKind> kinds = kinds("x = 1");
        assertEquals(TokenKind.NEWLINE, kinds.get(kinds.size() - 2));
        assertEquals(TokenKind.END, kinds.get(kinds.size() - 1));
    }

    public static void testIndentation() throws ParseException {
        List<TokenKind> kinds = kinds("if a:\n    b = 1\n\n    # note\nc = 2\n");
        int indents = 0;
        int dedents = 0;
        for (TokenKind k : kinds) {
            if (k == TokenKind.INDENT) {
                indents++;
            }
            if (k == TokenKind.DEDENT) {
                dedents++;
            }
        }
        assertEquals(1, indents);
        assertEquals(1, dedents);
        assertTrue(kinds.contains(TokenKind.NL));
        assertTrue(kinds.contains(TokenKind.COMMENT));
    }

    public static void testDedentAtEnd() throws ParseException {
        List<TokenKind> kinds = kinds("def f():\n    if a:\n        pass");
        int n = kinds.size();
        assertEquals(TokenKind.END, kinds.get(n - 1));
        assertEquals(TokenKind.DEDENT, kinds.get(n - 2));
        assertEquals(TokenKind.DEDENT, kinds.get(n - 3));
        assertEquals(TokenKind.NEWLINE, kinds.get(n - 4));
    }

    public static void testCommentsAreKept() throws ParseException {
        List<Token> tokens = new Lexer("# fp a: high.\nx = a  # trailing\n").tokenize();
        assertEquals(TokenKind.COMMENT, tokens.get(0).getKind());
        assertEquals("# fp a: high.", tokens.get(0).getText());
        assertEquals(1, tokens.get(0).getLine());
        assertEquals(texts("# fp a: high.\nx = a  # trailing\n", TokenKind.COMMENT).get(1), "# trailing");
    }

    public static void testLinesInsideBrackets() throws ParseException {
        List<Token> tokens = new Lexer("x = (a,\n     b)\ny = 1\n").tokenize();
        int newlines = 0;
        for (Token t : tokens) {
            if (t.getKind() == TokenKind.NEWLINE) {
                newlines++;
            }
            if (t.isName("y")) {
                assertEquals(3, t.getLine());
            }
        }
        assertEquals(2, newlines);
    }

    public static void testBackslashContinuation() throws ParseException {
        assertEquals(1, texts("x = a + \\\n    b\n", TokenKind.NEWLINE).size());
    }

    public static void testStrings() throws ParseException {
        List<String> strings = texts("a = 'x' + \"y\" + r'\\d' + b'z' + '''multi\nline''' + 'it\\'s'\n",
                                     TokenKind.STRING);
        assertEquals(6, strings.size());
        assertEquals("'x'", strings.get(0));
        assertEquals("r'\\d'", strings.get(2));
        assertEquals("'''multi\nline'''", strings.get(4));
        assertEquals("'it\\'s'", strings.get(5));
    }

    public static void testHashInString() throws ParseException {
        assertTrue(texts("s = '# fp a: high.'\n", TokenKind.COMMENT).isEmpty());
    }

    public static void testNumbers() throws ParseException {
        assertEquals(texts("x = 1.5e-3 + 0x1F + 10_000 + .5\n", TokenKind.NUMBER).toString(),
                     "[1.5e-3, 0x1F, 10_000, .5]");
    }

    public static void testOperators() throws ParseException {
        assertEquals(texts("a **= b // c != d -> e ...\n", TokenKind.OPERATOR).toString(),
                     "[**=, //, !=, ->, ...]");
    }

    public static void testErrors() {
        String[] bad = { "s = 'unterminated\n", "x = (1,\n", "x = 1)\n", "if a:\n        b\n    c\n", "x = $\n" };
        for (String source : bad) {
            try {
                new Lexer(source).tokenize();
                fail("Expected a lexical error for " + source);
            }
            catch (ParseException e) {
                assertTrue(e.getLine() >= 1);
            }
        }
    }
}
