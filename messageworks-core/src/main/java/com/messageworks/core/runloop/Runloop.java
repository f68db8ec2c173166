package com.messageworks.core.runloop;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import com.messageworks.core.config.MessagingConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.ManyToOneConcurrentArrayQueue;

/**
 * 执行上下文的单线程事件循环。
 * 基于 Agrona AgentRunner 实现：通道回调通过 {@link #postTask(Runnable)} 投递到本线程执行，
 * 因此同一上下文内 MessagingService 的入站处理总是串行的。
 * <p>
 * 空闲时使用 BackoffIdleStrategy（自旋 -> yield -> park），投递任务时 unpark 核心线程。
 */
@Slf4j
public class Runloop {

    private static final int DEFAULT_QUEUE_CAPACITY = 1024; // 默认容量（2 的幂）
    private static final int DEFAULT_TASK_BATCH = 64; // 每次批量处理任务上限

    @Getter
    private final String name;
    private final ManyToOneConcurrentArrayQueue<Runnable> taskQueue;
    private final RunloopAgent agent;
    private final int taskBatchSize;
    private AgentRunner agentRunner;
    private volatile boolean running = false;
    @Getter
    private volatile Thread coreThread;

    public Runloop(String name) {
        this(name, DEFAULT_QUEUE_CAPACITY, DEFAULT_TASK_BATCH);
    }

    /**
     * @param name              名称（用于线程名）
     * @param requestedCapacity 任务队列容量（会向上调整为 2 的幂）
     * @param taskBatchSize     每轮最多处理的任务数
     */
    public Runloop(String name, int requestedCapacity, int taskBatchSize) {
        this.name = Objects.requireNonNull(name, "name");

        int capacity = Math.max(1, Integer.highestOneBit(requestedCapacity));
        if (capacity < requestedCapacity) {
            capacity <<= 1;
        }
        this.taskQueue = new ManyToOneConcurrentArrayQueue<>(capacity);
        this.taskBatchSize = Math.max(1, taskBatchSize);
        this.agent = new RunloopAgent();
    }

    /**
     * 按配置中的队列容量创建 Runloop。
     */
    public static Runloop create(String name, MessagingConfig config) {
        return new Runloop(name, config.getRunloopQueueCapacity(), DEFAULT_TASK_BATCH);
    }

    public synchronized void start() {
        if (running) {
            log.warn("Runloop {} already started.", name);
            return;
        }
        running = true;

        IdleStrategy idleStrategy = new BackoffIdleStrategy(
                1, // maxSpins
                1, // maxYields
                TimeUnit.MICROSECONDS.toNanos(1), // minParkPeriodNs
                TimeUnit.MILLISECONDS.toNanos(1) // maxParkPeriodNs
        );

        agentRunner = new AgentRunner(
                idleStrategy,
                throwable -> log.error("Runloop {}: AgentRunner 发生未捕获异常", name, throwable),
                null,
                agent);

        Thread thread = new Thread(agentRunner, agent.roleName());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, ex) -> log.error("Runloop {}: 线程发生未捕获异常", name, ex));
        coreThread = thread;
        thread.start();

        log.info("Runloop {} started. Thread: {}", name, thread.getName());
    }

    /**
     * 提交任务到 Runloop 线程执行。
     *
     * @return 入队成功返回 true；未运行或队列已满返回 false
     */
    public boolean postTask(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (!running) {
            log.warn("Runloop {} is not running, task will not be executed.", name);
            return false;
        }
        if (!taskQueue.offer(task)) {
            log.warn("Runloop {}: 任务队列已满，任务被丢弃。", name);
            return false;
        }
        wakeup();
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCurrentThread() {
        return Thread.currentThread() == coreThread;
    }

    public void wakeup() {
        Thread t = coreThread;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    /**
     * 关闭 Runloop 并等待线程退出（最多 3 秒）。队列中未执行的任务被丢弃。
     */
    public synchronized void shutdown() {
        if (!running) {
            log.debug("Runloop {} is not running, no need to shut down.", name);
            return;
        }
        running = false;

        if (agentRunner != null) {
            agentRunner.close();
        }
        wakeup();

        Thread t = coreThread;
        try {
            if (t != null && t.isAlive() && t != Thread.currentThread()) {
                t.join(TimeUnit.SECONDS.toMillis(3));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Runloop {} shutdown interrupted.", name);
        }

        log.info("Runloop {} shutdown completed.", name);
    }

    private class RunloopAgent implements Agent {

        @Override
        public String roleName() {
            return "messageworks-runloop-%s".formatted(name);
        }

        @Override
        public int doWork() {
            int processed = 0;
            while (processed < taskBatchSize) {
                Runnable task = taskQueue.poll();
                if (task == null) {
                    break;
                }
                try {
                    task.run();
                } catch (Throwable e) {
                    log.error("Runloop {}: 执行任务发生异常", name, e);
                }
                processed++;
            }
            return processed;
        }

        @Override
        public void onStart() {
            log.debug("{} started.", roleName());
        }

        @Override
        public void onClose() {
            log.debug("{} closed.", roleName());
            taskQueue.clear();
        }
    }
}
