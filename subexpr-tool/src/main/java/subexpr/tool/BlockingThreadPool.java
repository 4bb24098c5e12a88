package subexpr.tool;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import subexpr.exception.SubexprRuntimeException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;

/**
 * A fixed thread pool fed through ordered task queues.
 * <p>
 * The intended use is a single producer reading lines faster than they can be rewritten, where results
 * must come out in the order the lines came in. Each {@link OrderedQueue} hands its results to a sink in
 * submission order, and blocks the producer when too many results are outstanding.
 */
public class BlockingThreadPool {
    private final int queueSize;
    private final ExecutorService pool;

    public BlockingThreadPool(String name, int poolSize, int queueSize) {
        if (queueSize < 1)
            throw new IllegalArgumentException("Queue size must be positive: " + queueSize);
        this.queueSize = queueSize;
        this.pool = Executors.newFixedThreadPool(poolSize, getThreadFactory(name));
    }

    public BlockingThreadPool(String name, int poolSize) {
        this(name, poolSize, Configuration.getQueueSize());
    }

    // The returned queue is not thread safe, submit and await from one thread only
    public <T> OrderedQueue<T> getOrderedQueue(Consumer<T> sink) {
        return new OrderedQueue<>(sink);
    }

    public void shutdown() {
        pool.shutdown();
    }

    public class OrderedQueue<T> {
        private final Deque<Future<T>> outstandingTasks = new ArrayDeque<>();
        private final Consumer<T> sink;

        private OrderedQueue(Consumer<T> sink) {
            this.sink = sink;
        }

        public void submit(Callable<T> task) throws SubexprRuntimeException {
            // Wait for the oldest task rather than let finished results pile up behind a slow one
            while (outstandingTasks.size() >= queueSize) {
                deliver(outstandingTasks.poll());
            }
            outstandingTasks.add(pool.submit(task));
            deliverDone();
        }

        public void awaitAll() throws SubexprRuntimeException {
            while (!outstandingTasks.isEmpty()) {
                deliver(outstandingTasks.poll());
            }
        }

        public void cancelAll() {
            outstandingTasks.forEach(t -> t.cancel(false));
            outstandingTasks.clear();
        }

        private void deliverDone() {
            while (!outstandingTasks.isEmpty() && outstandingTasks.peek().isDone()) {
                deliver(outstandingTasks.poll());
            }
        }

        private void deliver(Future<T> task) {
            try {
                sink.accept(task.get());
            } catch (ExecutionException e) {
                throw new SubexprRuntimeException("Task threw exception: " + e.getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SubexprRuntimeException("Interrupted while waiting for task", e);
            }
        }
    }

    private static ThreadFactory getThreadFactory(String name) {
        return new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .setThreadFactory(new ThreadFactory() {
                    final ThreadGroup group = new ThreadGroup(Configuration.WORKER_THREAD_GROUP);

                    public Thread newThread(Runnable runnable) {
                        return new Thread(group, runnable);
                    }
                })
                .build();
    }
}
