package subexpr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import subexpr.cse.Elimination;
import subexpr.exception.InvalidExpressionException;
import subexpr.expr.Expr;
import subexpr.expr.Render;
import subexpr.parse.Parse;

/**
 * Parses one line, eliminates common subexpressions and renders the result. Every call starts from an empty
 * id table, so lines never affect each other and calls may run concurrently.
 */
public class ExpressionRewriter {
    private static final Logger log = LogManager.getLogger(ExpressionRewriter.class);

    public static String rewriteLine(String line) throws InvalidExpressionException {
        Expr tree = Parse.parseExpression(line);
        String result = Render.render(Elimination.eliminate(tree));
        log.debug("{} -> {}", line, result);
        return result;
    }
}
