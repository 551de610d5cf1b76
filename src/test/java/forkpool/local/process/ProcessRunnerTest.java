package forkpool.local.process;

import forkpool.local.error.LaunchFailureException;
import forkpool.local.error.ProcessExitException;
import forkpool.local.error.TaskCancelledException;
import forkpool.local.pool.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real shell processes.
 */
class ProcessRunnerTest {

    private ProcessRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ProcessRunner("sh", Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Test
    void exitCodeZeroCompletesSuccessfully() throws Exception {
        RecordingStreams streams = new RecordingStreams();

        CompletableFuture<Void> result = runner.run("echo hello", streams, new CancellationToken());

        assertNull(result.get(10, TimeUnit.SECONDS));
        assertEquals("hello\n", streams.stdout());
        assertEquals("", streams.stderr());
    }

    @Test
    void nonZeroExitFailsWithCode() {
        CompletableFuture<Void> result = runner.run("exit 1", new RecordingStreams(), new CancellationToken());

        Throwable failure = failureOf(result);
        assertInstanceOf(ProcessExitException.class, failure);
        assertEquals(1, ((ProcessExitException) failure).exitCode());
    }

    @Test
    void exitCodeIsCarriedAsIs() {
        CompletableFuture<Void> result = runner.run("exit 42", new RecordingStreams(), new CancellationToken());

        Throwable failure = failureOf(result);
        assertEquals(42, ((ProcessExitException) failure).exitCode());
        assertTrue(failure.getMessage().contains("42"));
    }

    @Test
    void stderrIsForwardedToError() throws Exception {
        RecordingStreams streams = new RecordingStreams();

        runner.run("echo out; echo oops 1>&2", streams, new CancellationToken()).get(10, TimeUnit.SECONDS);

        assertEquals("out\n", streams.stdout());
        assertEquals("oops\n", streams.stderr());
    }

    @Test
    void outputIsForwardedBeforeProcessExits() throws Exception {
        CountDownLatch firstChunk = new CountDownLatch(1);
        RecordingStreams streams = new RecordingStreams() {
            @Override
            public void info(String text) {
                super.info(text);
                firstChunk.countDown();
            }
        };

        CompletableFuture<Void> result = runner.run("echo first; sleep 2; echo second", streams,
                new CancellationToken());

        assertTrue(firstChunk.await(5, TimeUnit.SECONDS));
        assertFalse(result.isDone());
        assertEquals("first\n", streams.stdout());

        result.get(10, TimeUnit.SECONDS);
        assertEquals("first\nsecond\n", streams.stdout());
    }

    @Test
    void cancellationKillsProcess() throws Exception {
        CancellationToken token = new CancellationToken();
        CompletableFuture<Void> result = runner.run("sleep 30", new RecordingStreams(), token);
        assertEquals(1, runner.liveProcesses());

        long start = System.nanoTime();
        token.cancel();

        assertInstanceOf(TaskCancelledException.class, failureOf(result));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 10);
        assertEquals(0, runner.liveProcesses());
    }

    @Test
    void cancellationEscalatesWhenTerminationIsIgnored() throws Exception {
        CountDownLatch ready = new CountDownLatch(1);
        RecordingStreams streams = new RecordingStreams() {
            @Override
            public void info(String text) {
                super.info(text);
                if (text.contains("ready")) {
                    ready.countDown();
                }
            }
        };
        CancellationToken token = new CancellationToken();
        CompletableFuture<Void> result = runner.run("trap '' TERM; echo ready; sleep 30; exit 0", streams, token);
        assertTrue(ready.await(5, TimeUnit.SECONDS));

        token.cancel();

        assertInstanceOf(TaskCancelledException.class, failureOf(result));
    }

    @Test
    void cancelledTokenPreventsLaunch() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        RecordingStreams streams = new RecordingStreams();

        CompletableFuture<Void> result = runner.run("echo should-not-run", streams, token);

        assertInstanceOf(TaskCancelledException.class, failureOf(result));
        assertEquals(0, runner.liveProcesses());
        assertTrue(streams.info.isEmpty());
    }

    @Test
    void unknownShellIsLaunchFailure() {
        ProcessRunner broken = new ProcessRunner("/nonexistent/shell", Duration.ofMillis(100));
        try {
            assertThrows(LaunchFailureException.class,
                    () -> broken.run("true", new RecordingStreams(), new CancellationToken()));
        } finally {
            broken.close();
        }
    }

    @Test
    void closeKillsLiveProcesses() {
        CompletableFuture<Void> result = runner.run("sleep 30", new RecordingStreams(), new CancellationToken());

        runner.close();

        assertInstanceOf(TaskCancelledException.class, failureOf(result));
    }

    private static Throwable failureOf(CompletableFuture<Void> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        return e.getCause();
    }
}
