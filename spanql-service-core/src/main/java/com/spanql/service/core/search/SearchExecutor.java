package com.spanql.service.core.search;

import com.spanql.service.core.config.SearchProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/** Fixed pool that scans shards for all searches. */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchExecutor {

    private final SearchProperties properties;

    private ExecutorService executor;
    private final AtomicInteger activeJobs = new AtomicInteger();

    @PostConstruct
    void start() {
        init(properties.getExecutor().getWorkers());
    }

    void init(int workers) {
        executor = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("spanql-search-"));
        log.info("Search executor started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
            log.info("Search executor stopped");
        }
    }

    /** Runs the job on a worker; failures are logged here and rethrown through the returned future. */
    public <T> Future<T> submit(String name, Callable<T> job) {
        if (executor == null) {
            throw new IllegalStateException("Search executor not started");
        }
        return executor.submit(() -> {
            activeJobs.incrementAndGet();
            try {
                return job.call();
            } catch (Exception ex) {
                log.error("Search worker failed job={}", name, ex);
                throw ex;
            } finally {
                activeJobs.decrementAndGet();
            }
        });
    }

    public int activeJobs() {
        return activeJobs.get();
    }
}
