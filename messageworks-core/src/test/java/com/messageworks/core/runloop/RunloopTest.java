package com.messageworks.core.runloop;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.messageworks.core.config.MessagingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runloop 单线程任务调度测试
 */
class RunloopTest {

    private Runloop runloop;

    @AfterEach
    void tearDown() {
        if (runloop != null) {
            runloop.shutdown();
        }
    }

    @Test
    void testTasksRunInOrderOnCoreThread() throws Exception {
        runloop = new Runloop("order");
        runloop.start();
        assertTrue(runloop.isRunning());

        int count = 500;
        AtomicInteger next = new AtomicInteger();
        AtomicReference<String> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(count);
        for (int i = 0; i < count; i++) {
            int expected = i;
            assertTrue(runloop.postTask(() -> {
                if (!runloop.isCurrentThread()) {
                    failure.set("task ran off the core thread");
                }
                if (next.getAndIncrement() != expected) {
                    failure.set("task " + expected + " ran out of order");
                }
                done.countDown();
            }));
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertNull(failure.get());
        assertFalse(runloop.isCurrentThread());
    }

    @Test
    void testTaskFailureDoesNotStopLoop() throws Exception {
        runloop = new Runloop("failure");
        runloop.start();
        CountDownLatch done = new CountDownLatch(1);
        runloop.postTask(() -> {
            throw new IllegalStateException("boom");
        });
        runloop.postTask(done::countDown);
        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testPostBeforeStartAndAfterShutdown() {
        runloop = Runloop.create("idle", MessagingConfig.defaults());
        assertFalse(runloop.postTask(() -> {
        }));
        runloop.start();
        runloop.shutdown();
        assertFalse(runloop.isRunning());
        assertFalse(runloop.postTask(() -> {
        }));
        assertThrows(IllegalArgumentException.class, () -> runloop.postTask(null));
    }

    @Test
    void testQueueFullRejectsTask() throws Exception {
        runloop = new Runloop("tiny", 2, 1);
        runloop.start();
        CountDownLatch blocker = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        runloop.postTask(() -> {
            started.countDown();
            try {
                blocker.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(runloop.postTask(() -> {
        }));
        assertTrue(runloop.postTask(() -> {
        }));
        assertFalse(runloop.postTask(() -> {
        }));
        blocker.countDown();
    }
}
