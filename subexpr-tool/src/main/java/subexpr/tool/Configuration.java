package subexpr.tool;

public class Configuration {
    public static final String WORKER_THREAD_GROUP = "subexpr-workers";

    private static final String THREADS_PARAMETER = "subexpr.threads";
    private static final int DEFAULT_THREADS = Runtime.getRuntime().availableProcessors();

    private static final String QUEUE_SIZE_PARAMETER = "subexpr.queueSize";
    private static final int DEFAULT_QUEUE_SIZE = 256;

    private static final String ENCODING_PARAMETER = "subexpr.encoding";
    private static final String DEFAULT_ENCODING = "UTF-8";

    public static int getThreads() {
        return Integer.parseInt(System.getProperty(THREADS_PARAMETER, "" + DEFAULT_THREADS));
    }

    public static int getQueueSize() {
        return Integer.parseInt(System.getProperty(QUEUE_SIZE_PARAMETER, "" + DEFAULT_QUEUE_SIZE));
    }

    public static String getEncoding() {
        return System.getProperty(ENCODING_PARAMETER, DEFAULT_ENCODING);
    }
}
