package subexpr.tool;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;

class Parameters {
    private Path inPath;
    private Path outPath;
    private Charset inputEncoding = Charset.forName(Configuration.getEncoding());
    private boolean parallel = false;
    private int threads = Configuration.getThreads();
    private boolean keepGoing = false;
    private boolean verbose = false;
    private boolean help = false;

    Path getInPath() { return inPath; }
    Path getOutPath() { return outPath; }
    Charset getInputEncoding() { return inputEncoding; }
    boolean getRunParallel() { return parallel; }
    int getThreads() { return threads; }
    boolean getKeepGoing() { return keepGoing; }
    boolean getVerbose() { return verbose; }
    boolean getHelp() { return help; }

    Parameters(String[] args) {
        for (String arg : args) {
            int separatorIndex = arg.indexOf('=');
            if (separatorIndex > 1 && arg.length() > 2) {
                String param = arg.substring(0, separatorIndex);
                String value = arg.substring(separatorIndex + 1);
                interpretBinaryParameter(param, value);
            } else {
                interpretUnaryParameter(arg);
            }
        }
    }

    static void printUsage() {
        System.err.println("Usage: java -jar subexpr-tool.jar [PARAMETERS] < INPUT > OUTPUT");
        System.err.println("");
        System.err.println("Reads expressions such as f(a,g(a,b)), one per line, and prints each one with every");
        System.err.println("repeated subexpression replaced by the number of its first occurrence. The first line");
        System.err.println("of the input is a line count; it is read and ignored.");
        System.err.println("");
        System.err.println("Parameters:");
        System.err.println("");
        System.err.println("--in          A file to read expressions from. If omitted, stdin is read.");
        System.err.println("");
        System.err.println("--out         A file to write results to. If omitted, results go to stdout.");
        System.err.println("");
        System.err.println("--inEncoding  The character encoding of the input. Defaults to UTF-8 (or the");
        System.err.println("              subexpr.encoding system property).");
        System.err.println("");
        System.err.println("--parallel    Rewrite lines on a pool of worker threads. Output order is unaffected.");
        System.err.println("");
        System.err.println("--threads     Number of worker threads for --parallel. Defaults to the number of");
        System.err.println("              processors (or the subexpr.threads system property).");
        System.err.println("");
        System.err.println("--keepGoing   Log lines that fail to parse and print an empty line in their place,");
        System.err.println("              instead of stopping at the first failure.");
        System.err.println("");
        System.err.println("--verbose     Log every rewritten line.");
        System.err.println("");
        System.err.println("--help        Print this text.");
    }

    private void interpretBinaryParameter(String parameter, String value) {
        switch (parameter) {
            case "--in":
                inPath = Paths.get(value);
                break;

            case "--out":
                outPath = Paths.get(value);
                break;

            case "--inEncoding":
                inputEncoding = Charset.forName(value);
                break;

            case "--threads":
                threads = Integer.parseInt(value);
                if (threads < 1)
                    throw new IllegalArgumentException(value + " is not a valid number of threads.");
                break;

            default:
                throw new IllegalArgumentException(parameter);
        }
    }

    private void interpretUnaryParameter(String parameter) {
        switch (parameter) {
            case "--parallel":
                parallel = true;
                break;

            case "--keepGoing":
                keepGoing = true;
                break;

            case "--verbose":
                verbose = true;
                break;

            case "--help":
                help = true;
                break;

            default:
                throw new IllegalArgumentException(parameter);
        }
    }
}
