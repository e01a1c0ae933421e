package com.lancluster.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.lancluster.protocol.ExecuteTaskMessage;
import com.lancluster.protocol.TaskResultMessage;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.task.TaskContext;
import com.lancluster.task.TaskHandler;
import com.lancluster.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs execute_task requests on a worker using a thread pool.
 *
 * Each request is looked up in the {@link TaskRegistry} by handler name and run
 * on a pool thread so the reader loop keeps draining frames (heartbeat replies
 * included) while a long task runs. Every request produces exactly one
 * task_result, handed to the {@link ResultSink}:
 *   - handler returned: success with its value (null becomes JSON null)
 *   - handler threw (Error included): failure with the exception message
 *   - no such handler: failure "Unknown handler: name"
 *
 * Lifecycle: created per connection by WorkerAgent, {@link #shutdown()} when
 * the connection ends.
 */
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    /**
     * Maximum time to wait for running handlers on shutdown (in seconds).
     */
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    /**
     * Receives the outcome of every task.
     */
    public interface ResultSink {
        void submit(TaskResultMessage result);
    }

    private final TaskRegistry registry;
    private final String workerId;
    private final String hostname;
    private final ResultSink sink;
    private final ExecutorService threadPool;

    // Ids of tasks queued or running
    private final Set<String> runningTasks = ConcurrentHashMap.newKeySet();

    /**
     * @param registry handlers available on this worker
     * @param workerId id reported in every TaskContext
     * @param hostname hostname reported in every TaskContext
     * @param poolSize number of handler threads
     * @param sink destination of task results
     */
    public TaskExecutor(TaskRegistry registry, String workerId, String hostname, int poolSize, ResultSink sink) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        this.registry = registry;
        this.workerId = workerId;
        this.hostname = hostname;
        this.sink = sink;
        this.threadPool = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("TaskExecutor-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.debug("TaskExecutor initialized with thread pool size: {}", poolSize);
    }

    /**
     * Queues a task for execution. Returns immediately.
     */
    public void submit(ExecuteTaskMessage message) {
        String taskId = message.getTaskId();
        WorkUnit work = message.getWork();
        log.info("Executing task {} (handler: {})", taskId, work.getHandler());

        runningTasks.add(taskId);
        try {
            threadPool.execute(() -> {
                try {
                    sink.submit(run(taskId, work));
                } finally {
                    runningTasks.remove(taskId);
                }
            });
        } catch (RejectedExecutionException e) {
            runningTasks.remove(taskId);
            log.warn("Task {} rejected, executor is shut down", taskId);
            sink.submit(TaskResultMessage.failure(taskId, "Worker is shutting down"));
        }
    }

    private TaskResultMessage run(String taskId, WorkUnit work) {
        Optional<TaskHandler> handler = registry.find(work.getHandler());
        if (handler.isEmpty()) {
            log.warn("Task {} names unknown handler '{}'", taskId, work.getHandler());
            return TaskResultMessage.failure(taskId, "Unknown handler: " + work.getHandler());
        }

        TaskContext context = new TaskContext(taskId, work.getHandler(), workerId, hostname);
        try {
            JsonNode result = handler.get().execute(work.getArguments(), context);
            log.info("Task {} completed", taskId);
            return TaskResultMessage.success(taskId, result != null ? result : NullNode.getInstance());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted", taskId);
            return TaskResultMessage.failure(taskId, "Interrupted");
        } catch (VirtualMachineError e) {
            log.error("Task {} hit {}, reporting and rethrowing", taskId, e.toString());
            sink.submit(TaskResultMessage.failure(taskId, describe(e)));
            throw e;
        } catch (Throwable e) {
            log.error("Task {} failed: {}", taskId, e.toString());
            return TaskResultMessage.failure(taskId, describe(e));
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    /**
     * @return number of tasks currently queued or running
     */
    public int getRunningCount() {
        return runningTasks.size();
    }

    /**
     * Stops accepting tasks, waits briefly for running ones and then interrupts them.
     */
    public void shutdown() {
        threadPool.shutdown();
        try {
            if (!threadPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Handlers still running after {} seconds, interrupting {} task(s)",
                        SHUTDOWN_TIMEOUT_SECONDS, runningTasks.size());
                threadPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        runningTasks.clear();
        log.debug("TaskExecutor shutdown complete");
    }

    /**
     * Interrupts running handlers without waiting.
     */
    public void shutdownNow() {
        threadPool.shutdownNow();
        runningTasks.clear();
    }
}
