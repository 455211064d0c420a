package org.example.flower_shop.handler;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Раздаёт входящие обновления по рабочим потокам.
 * <p>
 * Каждый юзер всегда попадает в один и тот же поток (userId % N), поэтому
 * его события обрабатываются строго по очереди, а разные юзеры — параллельно.
 * <p>
 * Количество потоков: app.dispatch.workers (по умолчанию 4).
 */
@Slf4j
@Component
public class UpdateDispatcher {

    private final List<ExecutorService> workers = new ArrayList<>();

    public UpdateDispatcher(@Value("${app.dispatch.workers:4}") int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("app.dispatch.workers должен быть >= 1, получено: " + workerCount);
        }
        // Каждый поток однопоточный: задачи в нём идут строго друг за другом
        for (int i = 0; i < workerCount; i++) {
            String name = "update-worker-" + i;
            workers.add(Executors.newSingleThreadExecutor(r -> {
                Thread thread = new Thread(r, name);
                thread.setDaemon(true);
                return thread;
            }));
        }
        log.info("Запущено {} потоков обработки обновлений", workerCount);
    }

    /**
     * Поставить задачу в очередь потока этого юзера.
     */
    public void dispatch(Long userId, Runnable task) {
        workers.get(partition(userId)).execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // Падение одного обновления не должно убивать поток юзера
                log.error("Ошибка обработки обновления: userId={}", userId, e);
            }
        });
    }

    // floorMod, а не %: id может оказаться отрицательным (у групп в Telegram так и есть)
    int partition(Long userId) {
        return Math.floorMod(userId.hashCode(), workers.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Остановка потоков обработки обновлений...");
        for (ExecutorService worker : workers) {
            worker.shutdown();
        }
        for (ExecutorService worker : workers) {
            try {
                if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                    worker.shutdownNow();
                }
            } catch (InterruptedException e) {
                worker.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
