package nl.adgroot.pdftojpeg;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

import nl.adgroot.pdftojpeg.config.AppConfig;
import nl.adgroot.pdftojpeg.convert.ConversionResult;
import nl.adgroot.pdftojpeg.convert.FailureKind;
import nl.adgroot.pdftojpeg.input.ExtractionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tasks with a concurrency cap and collects their results as they complete.
 * A failing task yields failure results; it never cancels or affects the others.
 */
public class BoundedScheduler {

  private static final Logger LOG = LoggerFactory.getLogger(BoundedScheduler.class);

  /** What the scheduler runs per task; {@code ConversionWorker::convert} in production. */
  @FunctionalInterface
  public interface TaskRunner {
    List<ConversionResult> run(ExtractionTask task, Path workDir);
  }

  private final TaskRunner runner;
  private final int configuredMax;
  private final int hardCeiling;

  // in-flight counter, only used for diagnostics
  private final AtomicInteger inFlight = new AtomicInteger();

  public BoundedScheduler(TaskRunner runner, AppConfig.ConcurrencyConfig cfg) {
    this(runner, cfg.maxConcurrent, cfg.hardCeiling);
  }

  public BoundedScheduler(TaskRunner runner, int configuredMax, int hardCeiling) {
    this.runner = runner;
    this.hardCeiling = Math.max(1, hardCeiling);
    this.configuredMax = Math.max(1, Math.min(configuredMax, this.hardCeiling));
  }

  /**
   * Cap for one run: the caller's request (or the configured max when {@code requested <= 0}),
   * clamped to the hard ceiling and to the number of tasks.
   */
  public int effectiveCap(int requested, int taskCount) {
    return capFor(requested, configuredMax, hardCeiling, taskCount);
  }

  public static int capFor(int requested, int configuredMax, int hardCeiling, int taskCount) {
    int ceiling = Math.max(1, hardCeiling);
    int wanted = requested > 0 ? requested : configuredMax;
    return Math.max(1, Math.min(Math.min(wanted, ceiling), Math.max(1, taskCount)));
  }

  /**
   * Runs all tasks on the given pool. At most {@link #effectiveCap} tasks execute at any instant,
   * whatever the pool size.
   *
   * <p>Each task fills its own result slot as it completes. The returned list is in task order,
   * then document order within a task, with every id unique: a split id such as {@code a_1} that
   * is already another task's id gets a further suffix.</p>
   *
   * @return one result per document; at least one per task
   */
  public List<ConversionResult> run(
      List<ExtractionTask> tasks,
      int requestedCap,
      ExecutorService pool,
      Workspace workspace
  ) {
    if (tasks.isEmpty()) return List.of();

    int cap = effectiveCap(requestedCap, tasks.size());
    Semaphore permits = new Semaphore(cap, true);
    AtomicReferenceArray<List<ConversionResult>> slots = new AtomicReferenceArray<>(tasks.size());

    LOG.info("Scheduling {} task(s) with concurrency {}", tasks.size(), cap);

    List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      int slot = i;
      ExtractionTask task = tasks.get(i);
      CompletableFuture<Void> f = CompletableFuture
          .supplyAsync(() -> runGuarded(task, permits, workspace), pool)
          .exceptionally(ex -> List.of(ConversionResult.failure(task.id(), FailureKind.CONVERSION,
              "Task aborted: " + rootMessage(ex))))
          .thenAccept(results -> slots.set(slot, results));
      futures.add(f);
    }

    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    List<ConversionResult> results = withUniqueIds(tasks, slots);
    long ok = results.stream().filter(ConversionResult::isSuccess).count();
    LOG.info("Finished {} task(s): {} document(s), {} converted, {} failed",
        tasks.size(), results.size(), ok, results.size() - ok);
    return results;
  }

  static List<ConversionResult> withUniqueIds(
      List<ExtractionTask> tasks,
      AtomicReferenceArray<List<ConversionResult>> slots
  ) {
    Set<String> taskIds = new HashSet<>();
    tasks.forEach(t -> taskIds.add(t.id()));

    Set<String> used = new HashSet<>();
    List<ConversionResult> results = new ArrayList<>();
    for (int i = 0; i < tasks.size(); i++) {
      String ownId = tasks.get(i).id();
      for (ConversionResult r : slots.get(i)) {
        String id = r.id();
        boolean taken = used.contains(id) || (!id.equals(ownId) && taskIds.contains(id));
        if (taken) {
          int k = 2;
          String candidate;
          do {
            candidate = id + "_" + k++;
          } while (used.contains(candidate) || taskIds.contains(candidate));
          LOG.warn("Document id {} of task {} is already taken, using {}", id, ownId, candidate);
          r = r.withId(candidate);
        }
        used.add(r.id());
        results.add(r);
      }
    }
    return results;
  }

  private List<ConversionResult> runGuarded(ExtractionTask task, Semaphore permits, Workspace workspace) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return List.of(ConversionResult.failure(task.id(), FailureKind.CONVERSION, "Interrupted before start"));
    }

    long startNs = System.nanoTime();
    int nowInFlight = inFlight.incrementAndGet();
    LOG.debug("START task={} inflight={}", task.id(), nowInFlight);
    try {
      List<ConversionResult> results = runner.run(task, workspace.taskDir(task.id()));
      if (results == null || results.isEmpty()) {
        return List.of(ConversionResult.failure(task.id(), FailureKind.CONVERSION, "Task produced no result"));
      }
      return results;
    } catch (RuntimeException e) {
      // runners are not supposed to throw; keep the other tasks going regardless
      LOG.warn("Task {} threw {}", task.id(), e.toString());
      return List.of(ConversionResult.failure(task.id(), FailureKind.CONVERSION, rootMessage(e)));
    } finally {
      int left = inFlight.decrementAndGet();
      permits.release();
      LOG.debug("END   task={} took={}ms inflight={}", task.id(), (System.nanoTime() - startNs) / 1_000_000, left);
    }
  }

  private static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
  }
}
