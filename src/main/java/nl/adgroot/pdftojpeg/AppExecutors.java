package nl.adgroot.pdftojpeg;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools for one invocation. Closing shuts them down and waits a bounded time.
 */
public final class AppExecutors implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(AppExecutors.class);

  private final ExecutorService convertPool;
  private final ExecutorService rasterizerPool;

  private AppExecutors(ExecutorService convertPool, ExecutorService rasterizerPool) {
    this.convertPool = convertPool;
    this.rasterizerPool = rasterizerPool;
  }

  /**
   * @param convertThreads size of the pool that runs tasks; this is the concurrency cap
   */
  public static AppExecutors create(int convertThreads) {
    ExecutorService convertPool = Executors.newFixedThreadPool(Math.max(1, convertThreads), named("convert-worker"));

    // Separate pool so a worker can give up on a render that overruns its timeout
    ExecutorService rasterizerPool = Executors.newCachedThreadPool(named("rasterizer"));

    return new AppExecutors(convertPool, rasterizerPool);
  }

  public ExecutorService convertPool() {
    return convertPool;
  }

  public ExecutorService rasterizerPool() {
    return rasterizerPool;
  }

  @Override
  public void close() {
    // stop accepting new tasks
    convertPool.shutdown();
    rasterizerPool.shutdown();

    await(convertPool, "convertPool");
    await(rasterizerPool, "rasterizerPool");
  }

  private static ThreadFactory named(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger n = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + "-" + n.getAndIncrement());
        t.setDaemon(true);
        return t;
      }
    };
  }

  private static void await(ExecutorService es, String name) {
    try {
      if (!es.awaitTermination(1, TimeUnit.MINUTES)) {
        es.shutdownNow();
        if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
          LOG.warn("Executor did not terminate: {}", name);
        }
      }
    } catch (InterruptedException e) {
      es.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
