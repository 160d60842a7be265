package org.example.voicemesh.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class SingleThreadEventLoopTest {

    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SingleThreadEventLoop("test-voice-loop");
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void shouldRunTasksOnNamedLoopThread() throws Exception {
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        loop.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).isEqualTo("test-voice-loop");
    }

    @Test
    void shouldWaitForTaskToFinish() {
        AtomicInteger counter = new AtomicInteger();

        loop.executeAndWait(counter::incrementAndGet);

        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    void shouldRunNestedWaitInline() {
        AtomicInteger counter = new AtomicInteger();

        loop.executeAndWait(() -> loop.executeAndWait(counter::incrementAndGet));

        assertThat(counter.get()).isEqualTo(1);
    }

    @Test
    void shouldKeepPeriodicTaskAliveAfterFailure() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);

        ScheduledTask task = loop.scheduleAtFixedRate(() -> {
            runs.incrementAndGet();
            threeRuns.countDown();
            throw new IllegalStateException("boom");
        }, 10);

        assertThat(threeRuns.await(2, TimeUnit.SECONDS)).isTrue();
        task.cancel();
        assertThat(task.isCancelled()).isTrue();
    }

    @Test
    void shouldNotRunCancelledTask() throws Exception {
        AtomicInteger runs = new AtomicInteger();

        ScheduledTask task = loop.schedule(runs::incrementAndGet, 50);
        task.cancel();
        Thread.sleep(150);

        assertThat(runs.get()).isZero();
    }

    @Test
    void shouldDropTasksAfterShutdown() {
        loop.shutdown();

        assertThatCode(() -> loop.execute(() -> { })).doesNotThrowAnyException();
    }
}
