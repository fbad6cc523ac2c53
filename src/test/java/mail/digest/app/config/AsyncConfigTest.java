package mail.digest.app.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncConfigTest {

    @Test
    void digestExecutor_WhenSaturated_ShouldRunOnCallerInsteadOfRejecting() throws Exception {
        // Given
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new AsyncConfig().digestExecutor();
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger onCaller = new AtomicInteger();
        Thread caller = Thread.currentThread();
        RejectedExecutionHandler handler = executor.getThreadPoolExecutor().getRejectedExecutionHandler();
        int submitted = 10 + 100 + 5;

        // When
        try {
            for (int i = 0; i < submitted; i++) {
                executor.execute(() -> {
                    if (Thread.currentThread() == caller) {
                        onCaller.incrementAndGet();
                        return;
                    }
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
        } finally {
            release.countDown();
            executor.shutdown();
        }

        // Then: five tasks overflowed the ten threads and the queue of one hundred
        assertEquals(5, onCaller.get());
        assertInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class, handler);
    }
}
