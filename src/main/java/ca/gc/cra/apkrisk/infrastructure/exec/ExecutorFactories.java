package ca.gc.cra.apkrisk.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the bounded worker pools used during static extraction.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool of daemon threads for extractor calls.
   *
   * <p>Threads are daemons so a hung external tool cannot keep the CLI alive after the job finished.</p>
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix; defaults to {@code apkrisk-extract}
   * @param handler uncaught exception handler installed on each worker; may be {@code null}
   * @return configured executor service
   */
  public static ExecutorService newExtractorPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "apkrisk-extract" : prefix;
    UncaughtExceptionHandler effectiveHandler =
        handler != null ? handler : Thread.getDefaultUncaughtExceptionHandler();
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          if (effectiveHandler != null) {
            thread.setUncaughtExceptionHandler(effectiveHandler);
          }
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
