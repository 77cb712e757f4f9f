package io.github.hide212131.langchain4j.mentor.runtime.intent;

import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tries a primary classifier under a time limit and answers with the fallback classifier whenever
 * the primary one times out, fails or returns nothing usable. Never throws for a classification.
 *
 * <p>The primary runs on its own executor; a call that runs past the limit is interrupted. Close the
 * classifier to release the executor it created.
 */
public final class FallbackIntentClassifier implements IntentClassifier, AutoCloseable {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final WorkflowLogger logger = new WorkflowLogger(FallbackIntentClassifier.class);
    private final IntentClassifier primary;
    private final IntentClassifier fallback;
    private final Duration timeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public FallbackIntentClassifier(IntentClassifier primary, IntentClassifier fallback, Duration timeout) {
        this(primary, fallback, timeout, Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "intent-classifier-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }), true);
    }

    public FallbackIntentClassifier(
            IntentClassifier primary, IntentClassifier fallback, Duration timeout, ExecutorService executor) {
        this(primary, fallback, timeout, executor, false);
    }

    private FallbackIntentClassifier(
            IntentClassifier primary,
            IntentClassifier fallback,
            Duration timeout,
            ExecutorService executor,
            boolean ownsExecutor) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public IntentResult classify(String userInput, Phase currentPhase) {
        Future<IntentResult> future;
        try {
            future = executor.submit(() -> primary.classify(userInput, currentPhase));
        } catch (RejectedExecutionException e) {
            logger.debug("Classifier executor is shut down; using rules");
            return fallback.classify(userInput, currentPhase);
        }
        try {
            IntentResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result != null && !result.requiresAgents().isEmpty()) {
                return result;
            }
            logger.debug("Primary classifier routed to no agent; using rules");
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.debug("Primary classifier timed out after {} ms; using rules", timeout.toMillis());
        } catch (ExecutionException e) {
            logger.debug("Primary classifier failed: {}", e.getCause() == null ? e : e.getCause().toString());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while classifying; using rules");
        }
        return fallback.classify(userInput, currentPhase);
    }

    /** Shuts down the executor when this classifier created it; a supplied executor is left alone. */
    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
