package com.chicu.aiforecast.config;

import com.chicu.aiforecast.ai.guard.GuardProperties;
import com.chicu.aiforecast.ai.ml.training.TrainingProperties;
import com.chicu.aiforecast.ai.outcome.EvaluationProperties;
import com.chicu.aiforecast.ai.persistence.ModelProperties;
import com.chicu.aiforecast.jobs.JobsProperties;
import com.chicu.aiforecast.ledger.LedgerProperties;
import com.chicu.aiforecast.market.MarketDataProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
@EnableConfigurationProperties({
        LedgerProperties.class,
        EvaluationProperties.class,
        TrainingProperties.class,
        GuardProperties.class,
        MarketDataProperties.class,
        ModelProperties.class,
        JobsProperties.class
})
public class ForecastConfig {

    /**
     * Единственный источник "сейчас" для всех компонентов. В тестах подменяется управляемыми часами.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Пул оценщика: один символ: одна задача. Имена вида outcome-eval-1, outcome-eval-2, ...
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evaluationExecutor(EvaluationProperties props) {
        int n = Math.max(1, props.getParallelism());
        return new ThreadPoolExecutor(
                n, n,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new EvaluationThreadFactory()
        );
    }

    private static final class EvaluationThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("outcome-eval-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
