package subexpr.tool;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import subexpr.ExpressionRewriter;
import subexpr.exception.InvalidExpressionException;
import subexpr.exception.SubexprRuntimeException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class Main {
    private static final Logger log = LogManager.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_EXPRESSION = 1;
    static final int EXIT_USAGE = 2;

    // Abort on unhandled exceptions, including those on worker threads.
    static {
        Thread.setDefaultUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
            @Override
            public void uncaughtException(Thread thread, Throwable throwable) {
                System.err.println("fatal: PANIC ABORT, unhandled exception:\n");
                throwable.printStackTrace();
                System.exit(-1);
            }
        });
    }

    public static void main(String[] args) throws IOException {
        Parameters parameters;
        try {
            parameters = new Parameters(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid parameter: " + e.getMessage());
            System.err.println("");
            Parameters.printUsage();
            System.exit(EXIT_USAGE);
            return;
        }

        if (parameters.getHelp()) {
            Parameters.printUsage();
            return;
        }

        if (parameters.getVerbose()) {
            Configurator.setLevel("subexpr", Level.DEBUG);
        }

        System.exit(run(parameters));
    }

    /**
     * Rewrite from {@code --in} (or stdin) to {@code --out} (or stdout). Only streams opened here are closed.
     *
     * @return process exit status
     */
    static int run(Parameters parameters) throws IOException {
        try (InputStream fileIn = parameters.getInPath() == null ? null : Files.newInputStream(parameters.getInPath());
             OutputStream fileOut = parameters.getOutPath() == null ? null : Files.newOutputStream(parameters.getOutPath())) {
            return run(fileIn == null ? System.in : fileIn, fileOut == null ? System.out : fileOut, parameters);
        }
    }

    /**
     * Rewrite every expression line of {@code in} to {@code out}.
     *
     * @return process exit status
     */
    static int run(InputStream in, OutputStream out, Parameters parameters) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, parameters.getInputEncoding()));
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        try {
            int lines = parameters.getRunParallel()
                    ? runParallel(reader, writer, parameters)
                    : runSequential(reader, writer, parameters);
            log.info("Rewrote {} lines", lines);
            return EXIT_OK;
        } catch (InvalidExpressionException e) {
            log.error("Aborting: {}", e.getMessage());
            return EXIT_INVALID_EXPRESSION;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } finally {
            writer.flush();
        }
    }

    private static int runSequential(BufferedReader reader, Writer writer, Parameters parameters)
            throws IOException, InvalidExpressionException {
        return LineStream.forEachExpression(reader, (lineNumber, line) -> {
            writeLine(writer, rewrite(lineNumber, line, parameters.getKeepGoing()));
        });
    }

    private static int runParallel(BufferedReader reader, Writer writer, Parameters parameters)
            throws IOException, InvalidExpressionException {
        BlockingThreadPool pool = new BlockingThreadPool("subexpr", parameters.getThreads());
        BlockingThreadPool.OrderedQueue<String> queue = pool.getOrderedQueue(result -> writeLine(writer, result));
        try {
            int lines = LineStream.forEachExpression(reader, (lineNumber, line) ->
                    queue.submit(() -> rewrite(lineNumber, line, parameters.getKeepGoing())));
            queue.awaitAll();
            return lines;
        } catch (SubexprRuntimeException e) {
            queue.cancelAll();
            if (e.getCause() instanceof InvalidExpressionException cause) {
                throw cause;
            }
            if (e.getCause() instanceof UncheckedIOException cause) {
                throw cause.getCause();
            }
            throw e;
        } catch (UncheckedIOException e) {
            queue.cancelAll();
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private static String rewrite(int lineNumber, String line, boolean keepGoing) throws InvalidExpressionException {
        try {
            return ExpressionRewriter.rewriteLine(line);
        } catch (InvalidExpressionException e) {
            if (!keepGoing) {
                throw new InvalidExpressionException("Line " + lineNumber + ": " + e.getMessage(), e.getOffset(), e);
            }
            log.error("Line {}: {}", lineNumber, e.getMessage());
            return "";
        }
    }

    private static void writeLine(Writer writer, String line) {
        try {
            writer.write(line);
            writer.write(System.lineSeparator());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
