/*
 * Markup-Repair - Legacy Markup Tree Normalization
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.repair.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent tasks with at most {@code concurrency} of them in flight.
 *
 * <p>A task is admitted only when a permit is free, so the caller blocks while the ceiling is
 * reached. Each task's failure is captured in its own {@link TaskOutcome}; one failing task never
 * cancels the others. Outcomes come back in submission order.
 */
public class BoundedTaskExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BoundedTaskExecutor.class);

    /** A unit of work and the id its outcome is reported under. */
    public record Task<T>(String id, Callable<T> work) {}

    private final int concurrency;
    private final ExecutorService executorService;
    private final boolean ownsExecutor;

    public BoundedTaskExecutor(int concurrency) {
        this(concurrency, Executors.newCachedThreadPool(), true);
    }

    /** Uses an executor owned by the caller; {@link #close()} leaves it running. */
    public BoundedTaskExecutor(int concurrency, ExecutorService executorService) {
        this(concurrency, executorService, false);
    }

    private BoundedTaskExecutor(int concurrency, ExecutorService executorService, boolean owns) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.concurrency = concurrency;
        this.executorService = executorService;
        this.ownsExecutor = owns;
    }

    public int concurrency() {
        return concurrency;
    }

    /**
     * Runs every task and waits for all of them to settle.
     *
     * @return one outcome per task, in the order the tasks were given
     */
    public <T> List<TaskOutcome<T>> runAll(List<Task<T>> tasks) throws InterruptedException {
        Semaphore permits = new Semaphore(concurrency);
        List<Future<TaskOutcome<T>>> futures = new ArrayList<>();

        for (Task<T> task : tasks) {
            permits.acquire();
            try {
                futures.add(executorService.submit(() -> runOne(task, permits)));
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
        }

        List<TaskOutcome<T>> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String id = tasks.get(i).id();
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                // runOne catches Exception, so only Errors end up here
                logger.error("Task {} failed: {}", id, e.getCause().toString());
                outcomes.add(TaskOutcome.failure(id, e.getCause()));
            }
        }
        return outcomes;
    }

    private static <T> TaskOutcome<T> runOne(Task<T> task, Semaphore permits) {
        try {
            return TaskOutcome.success(task.id(), task.work().call());
        } catch (Exception e) {
            logger.warn("Task {} failed: {}", task.id(), e.getMessage());
            return TaskOutcome.failure(task.id(), e);
        } finally {
            permits.release();
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executorService.shutdown();
        }
    }
}
