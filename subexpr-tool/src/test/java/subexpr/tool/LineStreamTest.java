package subexpr.tool;

import org.junit.Test;
import subexpr.exception.InvalidExpressionException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class LineStreamTest {

    private final List<String> lines = new ArrayList<>();
    private final List<Integer> lineNumbers = new ArrayList<>();

    private int feed(String input) throws IOException, InvalidExpressionException {
        return LineStream.forEachExpression(new BufferedReader(new StringReader(input)), (lineNumber, line) -> {
            lineNumbers.add(lineNumber);
            lines.add(line);
        });
    }

    @Test
    public void testCountLineDiscarded() throws Exception {
        assertEquals(3, feed("3\na\nf(a,a)\nb\n"));
        assertEquals(Arrays.asList("a", "f(a,a)", "b"), lines);
        assertEquals(Arrays.asList(2, 3, 4), lineNumbers);
    }

    @Test
    public void testCountMismatchTolerated() throws Exception {
        assertEquals(1, feed("5\na\n"));
        assertEquals(Collections.singletonList("a"), lines);

        lines.clear();
        assertEquals(3, feed("1\na\nb\nc"));
        assertEquals(Arrays.asList("a", "b", "c"), lines);
    }

    @Test
    public void testCountNotANumber() throws Exception {
        assertEquals(1, feed("lines\na\n"));
        assertEquals(Collections.singletonList("a"), lines);
    }

    @Test
    public void testBlankLines() throws Exception {
        assertEquals(3, feed("\n\n2\na\n\nb\n\n\n"));
        assertEquals(Arrays.asList("a", "", "b"), lines);
        assertEquals(Arrays.asList(4, 5, 6), lineNumbers);
    }

    @Test
    public void testLineEndings() throws Exception {
        assertEquals(3, feed("3\r\na\r\nf(a,a)\rb"));
        assertEquals(Arrays.asList("a", "f(a,a)", "b"), lines);
    }

    @Test
    public void testEmptyInput() throws Exception {
        assertEquals(0, feed(""));
        assertEquals(0, feed("\n\n"));
        assertEquals(0, feed("0\n"));
        assertEquals(Collections.emptyList(), lines);
    }

    @Test(expected = InvalidExpressionException.class)
    public void testHandlerFailurePropagates() throws Exception {
        LineStream.forEachExpression(new BufferedReader(new StringReader("1\nf(\n")), (lineNumber, line) -> {
            throw new InvalidExpressionException("bad", 0);
        });
    }
}
