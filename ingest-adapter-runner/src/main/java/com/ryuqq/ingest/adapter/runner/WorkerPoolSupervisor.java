package com.ryuqq.ingest.adapter.runner;

import com.ryuqq.ingest.application.runtime.FlushLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 고정 개수의 flush worker를 띄우고 감독합니다.
 *
 * <p>각 worker 스레드는 팩토리가 만든 자기 전용 {@link FlushLoop}를 실행합니다.
 * worker끼리 공유하는 것은 채널과 백엔드 클라이언트뿐입니다.</p>
 *
 * <p><strong>감독 규칙:</strong></p>
 * <ul>
 *   <li>runFlushLoop()에서 예외나 Error가 새어 나오면 비정상 종료로 간주</li>
 *   <li>{@link RestartPolicy#ALWAYS}: restartDelay 후 새 flusher로 재기동</li>
 *   <li>{@link RestartPolicy#NEVER}: 해당 worker 종료, 동시성 감소</li>
 *   <li>정상 반환(stop, interrupt)은 재기동하지 않음</li>
 * </ul>
 *
 * <p>worker가 죽어도 ack되지 않은 메시지는 브로커 재전달로 복구됩니다.</p>
 *
 * @author Ingest Team
 * @since 1.0.0
 */
public final class WorkerPoolSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolSupervisor.class);

    private final Supplier<? extends FlushLoop> flusherFactory;
    private final WorkerPoolConfig config;

    private final Map<Integer, FlushLoop> currentLoops = new ConcurrentHashMap<>();
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicInteger restartCount = new AtomicInteger();

    private volatile ExecutorService workers;
    private volatile boolean running;

    public WorkerPoolSupervisor(Supplier<? extends FlushLoop> flusherFactory, WorkerPoolConfig config) {
        if (flusherFactory == null) {
            throw new IllegalArgumentException("flusherFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.flusherFactory = flusherFactory;
        this.config = config;
    }

    /**
     * 설정된 동시성(0이면 코어 수)으로 시작합니다.
     */
    public void start() {
        start(config.effectiveConcurrency());
    }

    /**
     * @param concurrency worker 수 (양수)
     * @throws IllegalStateException 이미 시작한 경우
     */
    public synchronized void start(int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (workers != null) {
            throw new IllegalStateException("WorkerPoolSupervisor has already been started");
        }

        AtomicInteger threadIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "ingest-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        });
        running = true;
        for (int slot = 0; slot < concurrency; slot++) {
            int workerSlot = slot;
            activeWorkers.incrementAndGet();
            workers.execute(() -> supervise(workerSlot));
        }
        log.info("Started {} ingest workers (restart policy: {})", concurrency, config.restartPolicy());
    }

    private void supervise(int slot) {
        try {
            while (running) {
                try {
                    FlushLoop loop = flusherFactory.get();
                    currentLoops.put(slot, loop);
                    if (!running) {
                        loop.stop();
                    }
                    loop.runFlushLoop();
                    log.debug("Worker {} exited its flush loop", slot);
                    return;
                } catch (RuntimeException | Error e) {
                    if (!running) {
                        log.debug("Worker {} failed during shutdown", slot, e);
                        return;
                    }
                    if (config.restartPolicy() == RestartPolicy.NEVER) {
                        log.error("Worker {} died unexpectedly and will not be restarted", slot, e);
                        return;
                    }
                    log.error("Worker {} died unexpectedly, restarting in {}ms",
                        slot, config.restartDelay().toMillis(), e);
                    if (!pause(config.restartDelay())) {
                        return;
                    }
                    restartCount.incrementAndGet();
                }
            }
        } finally {
            currentLoops.remove(slot);
            activeWorkers.decrementAndGet();
        }
    }

    private boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return running;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 설정된 shutdownTimeout으로 종료합니다.
     *
     * @return 모든 worker가 시간 안에 종료했으면 true
     */
    public boolean stop() {
        return stop(config.shutdownTimeout());
    }

    /**
     * 모든 flusher에 stop을 요청하고 블로킹 중인 pull을 인터럽트한 뒤 종료를 기다립니다.
     *
     * @param timeout 최대 대기
     * @return 모든 worker가 시간 안에 종료했으면 true
     */
    public boolean stop(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        ExecutorService pool;
        synchronized (this) {
            pool = workers;
            if (pool == null || !running) {
                return pool == null || pool.isTerminated();
            }
            running = false;
        }

        currentLoops.values().forEach(FlushLoop::stop);
        pool.shutdownNow();
        try {
            boolean terminated = pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (terminated) {
                log.info("All ingest workers stopped");
            } else {
                log.warn("Ingest workers did not stop within {}ms ({} still active)",
                    timeout.toMillis(), activeWorkers.get());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int activeWorkers() {
        return activeWorkers.get();
    }

    public int restartCount() {
        return restartCount.get();
    }

    public boolean isRunning() {
        return running;
    }
}
