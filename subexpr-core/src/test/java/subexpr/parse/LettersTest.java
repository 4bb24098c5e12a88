package subexpr.parse;

import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LettersTest {

    @Test
    public void testAsciiLetters() {
        for (char c = 'A'; c <= 'Z'; c++) {
            assertTrue(String.valueOf(c), Letters.isLetter(c));
        }
        for (char c = 'a'; c <= 'z'; c++) {
            assertTrue(String.valueOf(c), Letters.isLetter(c));
        }
    }

    @Test
    public void testPunctuationBetweenCases() {
        for (char c : new char[]{'[', '\\', ']', '^', '_', '`'}) {
            assertTrue(String.valueOf(c), Letters.isLetter(c));
        }
    }

    @Test
    public void testOutsideRange() {
        for (char c : new char[]{'@', '{', '(', ')', ',', ' ', '0', '9', '\n', 'é'}) {
            assertFalse(String.valueOf(c), Letters.isLetter(c));
        }
    }
}
