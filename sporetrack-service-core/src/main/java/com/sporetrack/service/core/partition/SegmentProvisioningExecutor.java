package com.sporetrack.service.core.partition;

import com.sporetrack.service.core.config.SporetrackProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounded background queue for segment DDL so that writers routed to the default segment never wait on it.
 * Submission never blocks: a full queue rejects the job and the next route or reconcile pass asks again.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SegmentProvisioningExecutor implements Executor {

    private final SporetrackProperties properties;

    private int queueCapacity;
    private BlockingQueue<Runnable> queue;
    private ExecutorService workers;
    private final AtomicInteger activeJobs = new AtomicInteger();

    @PostConstruct
    void start() {
        SporetrackProperties.Partitions partitions = properties.getPartitions();
        init(partitions.getProvisioningQueueCapacity(), partitions.getProvisioningWorkers());
    }

    void init(int capacity, int workerCount) {
        this.queueCapacity = capacity;
        queue = new ArrayBlockingQueue<>(capacity);
        workers = Executors.newFixedThreadPool(workerCount);
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::drainLoop);
        }
        log.info("Segment provisioning executor started workers={}, queueCapacity={}", workerCount, capacity);
    }

    @PreDestroy
    void stop() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    @Override
    public void execute(Runnable job) {
        if (!queue.offer(job)) {
            log.warn("Segment provisioning queue full ({}/{}), job rejected", queue.size(), queueCapacity);
            throw new RejectedExecutionException("Segment provisioning queue is full");
        }
        log.debug("Segment provisioning queue depth={}/{}", queue.size(), queueCapacity);
    }

    void drainLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            Runnable job;
            try {
                job = queue.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            activeJobs.incrementAndGet();
            try {
                job.run();
            } catch (RuntimeException ex) {
                log.error("Segment provisioning job failed", ex);
            } finally {
                activeJobs.decrementAndGet();
            }
        }
    }

    /** Blocks until the queue is empty or the thread is interrupted. Intended for tests. */
    public void waitForDrain() {
        while (!queue.isEmpty() || activeJobs.get() > 0) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
