package com.example.equationreader.service.ocr;

import com.example.equationreader.config.EquationReaderProperties;
import com.example.equationreader.exception.ModelNotReadyException;
import com.example.equationreader.exception.RecognitionFailureException;
import com.example.equationreader.exception.RecognitionTimeoutException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the recognizer for the lifetime of the process. The model is loaded once, after the
 * application is ready; readiness and the last load error are observable and never reset.
 * Recognitions run on a fixed pool sized by {@code equation-reader.ocr.max-concurrency} and are
 * cancelled when they outlive {@code equation-reader.ocr.timeout}.
 */
@Service
public class RecognitionModelHolder {

    private static final Logger log = LoggerFactory.getLogger(RecognitionModelHolder.class);

    private final EquationRecognizer recognizer;
    private final Duration timeout;
    private final int maxConcurrency;
    private final ExecutorService executor;
    private final AtomicBoolean loadAttempted = new AtomicBoolean();

    private volatile boolean ready;
    private volatile String lastLoadError;

    public RecognitionModelHolder(EquationRecognizer recognizer, EquationReaderProperties properties) {
        this.recognizer = recognizer;
        this.timeout = properties.getOcr().getTimeout();
        this.maxConcurrency = Math.max(1, properties.getOcr().getMaxConcurrency());
        this.executor = Executors.newFixedThreadPool(maxConcurrency, workerThreads());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        load();
    }

    /**
     * Loads the recognizer. Only the first call does anything; a failed load is recorded and
     * not retried.
     */
    public void load() {
        if (!loadAttempted.compareAndSet(false, true)) {
            return;
        }
        log.info("Loading {} equation recognizer", recognizer.engineName());
        try {
            recognizer.load();
            ready = true;
            log.info("Equation recognizer {} is ready (concurrency {})", recognizer.engineName(), maxConcurrency);
        } catch (RuntimeException ex) {
            lastLoadError = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            log.error("Failed to load equation recognizer {}", recognizer.engineName(), ex);
        }
    }

    public String recognize(BufferedImage image) {
        if (!ready) {
            throw new ModelNotReadyException(lastLoadError == null
                    ? "OCR model is not loaded yet"
                    : "OCR model failed to load: " + lastLoadError);
        }
        Future<String> task = executor.submit(() -> recognizer.recognize(image));
        try {
            return task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            task.cancel(true);
            log.warn("Equation recognition exceeded {} ms and was cancelled", timeout.toMillis());
            throw new RecognitionTimeoutException("Recognition timed out after " + timeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("Equation recognition failed", cause);
            throw RecognitionFailureException.from(cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecognitionFailureException("Recognition was interrupted", ex);
        }
    }

    public boolean isReady() {
        return ready;
    }

    public String getLastLoadError() {
        return lastLoadError;
    }

    public String getEngineName() {
        return recognizer.engineName();
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "equation-ocr-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
