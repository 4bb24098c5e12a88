package subexpr.tool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import subexpr.exception.InvalidExpressionException;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Splits input into expression lines.
 * <p>
 * Blank lines before the first and after the last non-blank line are not part of the input. The first
 * remaining line is a declared line count, which is read and otherwise ignored: every line after it is
 * handed on, however many there are. Blank lines in between are handed on as empty expressions.
 */
public class LineStream {
    private static final Logger log = LogManager.getLogger(LineStream.class);

    public interface LineHandler {
        /**
         * @param lineNumber 1-based line number in the input, for messages
         */
        void handle(int lineNumber, String line) throws InvalidExpressionException;
    }

    /**
     * Feed every expression line of {@code reader} to {@code handler}, in order.
     *
     * @return the number of expression lines handled
     */
    public static int forEachExpression(BufferedReader reader, LineHandler handler)
            throws IOException, InvalidExpressionException {
        int lineNumber = 0;
        String line;

        // Leading blank lines
        do {
            line = reader.readLine();
            lineNumber++;
        } while (line != null && line.isEmpty());

        if (line == null) {
            log.warn("Empty input, expected a line count");
            return 0;
        }
        Integer declared = parseCount(line);

        int handled = 0;
        int pendingBlank = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            // Held back until a non-blank line shows they are not trailing
            if (line.isEmpty()) {
                pendingBlank++;
                continue;
            }
            for (int i = pendingBlank; i > 0; i--) {
                handler.handle(lineNumber - i, "");
                handled++;
            }
            pendingBlank = 0;
            handler.handle(lineNumber, line);
            handled++;
        }

        if (declared != null && declared != handled) {
            log.warn("Input declared {} lines but {} were found", declared, handled);
        }
        return handled;
    }

    private static Integer parseCount(String line) {
        try {
            return Integer.valueOf(line.trim());
        } catch (NumberFormatException e) {
            log.warn("First line is not a line count, ignoring it: {}", line);
            return null;
        }
    }
}
