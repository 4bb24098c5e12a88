package subexpr;

import org.junit.Test;
import subexpr.exception.InvalidExpressionException;
import subexpr.expr.Application;
import subexpr.expr.Expr;
import subexpr.expr.Render;
import subexpr.expr.Variable;
import subexpr.parse.Parse;

import java.util.Random;

import static org.junit.Assert.assertEquals;

public class ExpressionRewriterTest {

    private static final String NAME_CHARS = "abcxyzFGH_[]^`\\";

    @Test
    public void testRewriteLine() throws InvalidExpressionException {
        assertEquals("a", ExpressionRewriter.rewriteLine("a"));
        assertEquals("f(a,2)", ExpressionRewriter.rewriteLine("f(a,a)"));
        assertEquals("f(a,f(2,2))", ExpressionRewriter.rewriteLine("f(a,f(a,a))"));
        assertEquals("f(f(a,b),2)", ExpressionRewriter.rewriteLine("f(f(a,b),f(a,b))"));
        assertEquals("", ExpressionRewriter.rewriteLine(""));
    }

    @Test(expected = InvalidExpressionException.class)
    public void testRewriteLineFails() throws InvalidExpressionException {
        ExpressionRewriter.rewriteLine("f(a,b");
    }

    @Test
    public void testRenderParseRoundTrip() throws InvalidExpressionException {
        Random random = new Random(4711);
        for (int i = 0; i < 500; i++) {
            Expr tree = randomTree(random, 6);
            assertEquals(tree, Parse.parseExpression(Render.render(tree)));
        }
    }

    @Test
    public void testRewriteIsStableForDistinctNames() throws InvalidExpressionException {
        // Every name unique, so no two subtrees can be equal
        Random random = new Random(17);
        for (int i = 0; i < 100; i++) {
            int[] counter = {0};
            Expr tree = uniqueTree(random, 5, counter);
            String line = Render.render(tree);
            assertEquals(line, ExpressionRewriter.rewriteLine(line));
        }
    }

    private static Expr randomTree(Random random, int depth) {
        String name = randomName(random);
        if (depth == 0 || random.nextInt(3) == 0) {
            return new Variable(name);
        }
        return new Application(name, randomTree(random, depth - 1), randomTree(random, depth - 1));
    }

    private static Expr uniqueTree(Random random, int depth, int[] counter) {
        String name = "n" + letters(counter[0]++);
        if (depth == 0 || random.nextInt(3) == 0) {
            return new Variable(name);
        }
        Expr left = uniqueTree(random, depth - 1, counter);
        Expr right = uniqueTree(random, depth - 1, counter);
        return new Application(name, left, right);
    }

    private static String randomName(Random random) {
        StringBuilder sb = new StringBuilder();
        int length = 1 + random.nextInt(3);
        for (int i = 0; i < length; i++) {
            sb.append(NAME_CHARS.charAt(random.nextInt(NAME_CHARS.length())));
        }
        return sb.toString();
    }

    // Digits are not name characters
    private static String letters(int n) {
        StringBuilder sb = new StringBuilder();
        do {
            sb.append((char) ('a' + n % 26));
            n /= 26;
        } while (n > 0);
        return sb.toString();
    }
}
