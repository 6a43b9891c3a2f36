package com.depgraph.paths.engine;

import java.util.*;
import java.util.concurrent.*;

/**
 * Runs a batch of tasks on an executor and waits for all of them.
 *
 * Results come back in submission order. Completions are observed in the
 * order they happen, so the first task to fail cancels (and interrupts) every
 * sibling still running, and its exception is rethrown: unchecked exceptions
 * and errors unchanged, checked ones wrapped in {@link PathSearchException}.
 */
final class FanOut {

    private FanOut() {
        // Utility class
    }

    static <T> List<T> invokeAll(ExecutorService executor, List<? extends Callable<T>> tasks) {
        if (tasks.isEmpty())
            return List.of();

        CompletionService<T> completion = new ExecutorCompletionService<>(executor);
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        Map<Future<T>, Integer> positions = new IdentityHashMap<>(tasks.size() * 2);
        try {
            for (Callable<T> task : tasks) {
                Future<T> f = completion.submit(task);
                positions.put(f, futures.size());
                futures.add(f);
            }
        } catch (RejectedExecutionException e) {
            cancelAll(futures);
            throw e;
        }

        List<T> results = new ArrayList<>(Collections.nCopies(tasks.size(), null));
        try {
            for (int done = 0; done < tasks.size(); done++) {
                Future<T> f = completion.take();
                results.set(positions.get(f), f.get());
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + tasks.size() + " tasks");
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw unwrap(e.getCause());
        } catch (CancellationException e) {
            cancelAll(futures);
            throw e;
        }
        return results;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures)
            f.cancel(true);
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re)
            return re;
        if (cause instanceof Error err)
            throw err;
        return new PathSearchException("Path search task failed", cause);
    }
}
