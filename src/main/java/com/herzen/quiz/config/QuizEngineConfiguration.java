package com.herzen.quiz.config;

import com.herzen.quiz.retry.RetryPolicy;
import com.herzen.quiz.session.SessionModels.SessionTiming;
import com.herzen.quiz.timer.TimerModels.TimerTiming;
import com.herzen.quiz.timer.TimerRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QuizEngineConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService timerExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("quiz-timer-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sessionExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("quiz-session-"));
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${quiz.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${quiz.retry.base-delay-ms:100}") long baseDelayMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs));
    }

    @Bean
    public TimerTiming timerTiming(@Value("${quiz.timer.tick-ms:1000}") long tickMs,
                                   @Value("${quiz.timer.poll-ms:100}") long pollMs,
                                   @Value("${quiz.timer.cancel-timeout-ms:2000}") long cancelTimeoutMs) {
        return new TimerTiming(Duration.ofMillis(tickMs), Duration.ofMillis(pollMs), Duration.ofMillis(cancelTimeoutMs));
    }

    @Bean
    public SessionTiming sessionTiming(@Value("${quiz.session.settle-delay-ms:3000}") long settleDelayMs,
                                       @Value("${quiz.session.cleanup-delay-ms:200}") long cleanupDelayMs) {
        return new SessionTiming(Duration.ofMillis(settleDelayMs), Duration.ofMillis(cleanupDelayMs),
                Duration.ofMillis(cleanupDelayMs));
    }

    @Bean
    public TimerRegistry timerRegistry(@Qualifier("timerExecutor") ExecutorService timerExecutor,
                                       RetryPolicy retryPolicy,
                                       TimerTiming timerTiming) {
        return new TimerRegistry(timerExecutor, retryPolicy, timerTiming);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
