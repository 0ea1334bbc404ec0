package com.gt.vocab.external;

import com.gt.vocab.conf.AsyncConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ExternalCallRunnerTests {

    private ExecutorService executor;
    private ExternalCallRunner externalCallRunner;

    @BeforeEach
    public void setup() {
        executor = Executors.newCachedThreadPool();
        externalCallRunner = new ExternalCallRunner(executor);
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    @Test
    public void testCall_Success() {
        CallOutcome<String> outcome = externalCallRunner.call("test", () -> "Haus", Duration.ofSeconds(1));

        assertEquals(CallOutcome.Status.SUCCESS, outcome.status());
        assertEquals("Haus", outcome.value());
        assertTrue(outcome.isSuccess());
    }

    @Test
    public void testCall_Timeout() {
        CallOutcome<String> outcome = externalCallRunner.call("test", () -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, Duration.ofMillis(50));

        assertEquals(CallOutcome.Status.TIMEOUT, outcome.status());
        assertNull(outcome.value());
        assertFalse(outcome.isSuccess());
    }

    @Test
    public void testCall_Error() {
        CallOutcome<String> outcome = externalCallRunner.call("test", () -> {
            throw new IllegalStateException("boom");
        }, Duration.ofSeconds(1));

        assertEquals(CallOutcome.Status.ERROR, outcome.status());
        assertInstanceOf(IllegalStateException.class, outcome.error());
        assertEquals("boom", outcome.error().getMessage());
    }

    @Test
    public void testCall_TimeoutInterruptsRunningCall() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        CallOutcome<String> outcome = externalCallRunner.call("test", () -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
            }
            return "late";
        }, Duration.ofMillis(50));

        assertEquals(CallOutcome.Status.TIMEOUT, outcome.status());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void testCall_SaturatedExecutorFailsFast() {
        ThreadPoolTaskExecutor saturatedExecutor = (ThreadPoolTaskExecutor) new AsyncConfig().externalCallExecutor(1, 1, 0);
        ExternalCallRunner saturatedRunner = new ExternalCallRunner(saturatedExecutor);
        CountDownLatch release = new CountDownLatch(1);

        try {
            // Ignores interrupts so its thread stays busy after the timeout
            CallOutcome<String> first = saturatedRunner.call("hung", () -> {
                boolean done = false;
                while (!done) {
                    try {
                        done = release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        // keep holding the thread
                    }
                }
                return "late";
            }, Duration.ofMillis(100));

            long start = System.nanoTime();
            CallOutcome<String> second = saturatedRunner.call("next", () -> "Haus", Duration.ofMillis(100));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(CallOutcome.Status.TIMEOUT, first.status());
            assertEquals(CallOutcome.Status.ERROR, second.status());
            assertInstanceOf(TaskRejectedException.class, second.error());
            assertTrue(elapsedMs < 500, "rejected call took " + elapsedMs + " ms");
        } finally {
            release.countDown();
            saturatedExecutor.shutdown();
        }
    }
}
