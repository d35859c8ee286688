package microbatch.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates named daemon threads ({@code <prefix>1}, {@code <prefix>2}, ...) that log
 * anything escaping their task instead of dying silently.
 *
 * <p>Daemon threads keep an unclosed batcher from holding the JVM open.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER = (thread, failure) ->
      logger.log(Level.SEVERE, "Uncaught failure on " + thread.getName(), failure);

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    return thread;
  }
}
