package com.can.ringcache.cluster;

import com.can.ringcache.backend.CacheOperationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Bir işlemi replika düğümlerine eşzamanlı olarak dağıtır ve yalnızca tutarlılık
 * seviyesinin gerektirdiği kadar yanıtı bekler. Her düğüm çağrısı bağımsız bir
 * zaman aşımı taşır; zaman aşımı hata ile aynı sayılır. Geç kalan çağrılar
 * arka planda tamamlanmaya devam eder ve sonuçları yine geri çağırımlara iletilir.
 */
final class ReplicaFanout
{
    private ReplicaFanout() {}

    static <T> Outcome<T> run(List<CacheNode> targets,
                              Function<CacheNode, T> call,
                              int required,
                              boolean waitForAll,
                              Executor executor,
                              long timeoutMillis,
                              Consumer<CacheNode> onSuccess,
                              BiConsumer<CacheNode, Throwable> onFailure)
    {
        Tally<T> tally = new Tally<>(targets, required, waitForAll);
        for (CacheNode node : targets) {
            CompletableFuture<T> future;
            try {
                future = CompletableFuture.supplyAsync(() -> call.apply(node), executor);
            } catch (RejectedExecutionException e) {
                onFailure.accept(node, e);
                tally.failure(node, e);
                continue;
            }
            future.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS).whenComplete((value, error) -> {
                if (error == null) {
                    onSuccess.accept(node);
                    tally.success(node, value);
                } else {
                    Throwable cause = translate(node, unwrap(error), timeoutMillis);
                    onFailure.accept(node, cause);
                    tally.failure(node, cause);
                }
            });
        }
        return tally.await();
    }

    private static Throwable unwrap(Throwable error)
    {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static Throwable translate(CacheNode node, Throwable cause, long timeoutMillis)
    {
        if (cause instanceof TimeoutException) {
            return new CacheOperationException(CacheOperationException.Kind.TIMEOUT,
                    "Node " + node.id() + " did not answer within " + timeoutMillis + " ms", cause);
        }
        return cause;
    }

    /**
     * Result of a fan-out: answers in target order and the failures seen before the
     * aggregate completed.
     */
    record Outcome<T>(Map<CacheNode, T> successes, Map<CacheNode, Throwable> failures)
    {
        int successCount()
        {
            return successes.size();
        }

        Throwable firstFailure()
        {
            return failures.isEmpty() ? null : failures.values().iterator().next();
        }
    }

    private static final class Tally<T>
    {
        private final List<CacheNode> targets;
        private final int required;
        private final boolean waitForAll;
        private final Map<CacheNode, T> successes = new LinkedHashMap<>();
        private final Map<CacheNode, Throwable> failures = new LinkedHashMap<>();
        private final CompletableFuture<Void> done = new CompletableFuture<>();

        Tally(List<CacheNode> targets, int required, boolean waitForAll)
        {
            this.targets = targets;
            this.required = required;
            this.waitForAll = waitForAll;
            if (targets.isEmpty()) {
                done.complete(null);
            }
        }

        synchronized void success(CacheNode node, T value)
        {
            if (done.isDone()) return;
            successes.put(node, value);
            check();
        }

        synchronized void failure(CacheNode node, Throwable error)
        {
            if (done.isDone()) return;
            failures.put(node, error);
            check();
        }

        private void check()
        {
            int answered = successes.size() + failures.size();
            boolean allAnswered = answered >= targets.size();
            boolean met = successes.size() >= required;
            boolean impossible = targets.size() - failures.size() < required;
            if (allAnswered || impossible || (met && !waitForAll)) {
                done.complete(null);
            }
        }

        Outcome<T> await()
        {
            done.join();
            synchronized (this) {
                Map<CacheNode, T> ordered = new LinkedHashMap<>();
                for (CacheNode node : targets) {
                    if (successes.containsKey(node)) {
                        ordered.put(node, successes.get(node));
                    }
                }
                return new Outcome<>(Collections.unmodifiableMap(ordered),
                        Collections.unmodifiableMap(new LinkedHashMap<>(failures)));
            }
        }
    }
}
