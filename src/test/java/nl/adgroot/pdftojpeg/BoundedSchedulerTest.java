package nl.adgroot.pdftojpeg;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import nl.adgroot.pdftojpeg.convert.ConversionResult;
import nl.adgroot.pdftojpeg.convert.FailureKind;
import nl.adgroot.pdftojpeg.input.ExtractionTask;
import nl.adgroot.pdftojpeg.input.TaskOptions;
import nl.adgroot.pdftojpeg.input.TaskSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BoundedSchedulerTest {

  // more threads than any cap, so only the permits limit concurrency
  private final ExecutorService pool = Executors.newFixedThreadPool(16);

  @TempDir
  Path tempDir;

  private Workspace workspace;

  @BeforeEach
  void setUp() throws Exception {
    workspace = Workspace.create(tempDir.toString());
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
    workspace.close();
  }

  @Test
  void run_neverExceedsCap_andReturnsOneResultPerTask() {
    ConcurrencyProbe probe = new ConcurrencyProbe(50);
    BoundedScheduler scheduler = new BoundedScheduler(probe, 3, 5);

    List<ConversionResult> results = scheduler.run(tasks(10), 0, pool, workspace);

    assertEquals(10, results.size());
    assertTrue(probe.max.get() <= 3, "max in flight was " + probe.max.get());
    assertTrue(probe.max.get() >= 2, "tasks should overlap, max in flight was " + probe.max.get());
    assertEquals(ids(10), results.stream().map(ConversionResult::id).collect(Collectors.toSet()));
  }

  @Test
  void run_requestAboveHardCeiling_isClamped() {
    ConcurrencyProbe probe = new ConcurrencyProbe(50);
    BoundedScheduler scheduler = new BoundedScheduler(probe, 3, 5);

    List<ConversionResult> results = scheduler.run(tasks(12), 50, pool, workspace);

    assertEquals(12, results.size());
    assertTrue(probe.max.get() <= 5, "max in flight was " + probe.max.get());
  }

  @Test
  void run_failingTask_doesNotAffectOthers() {
    BoundedScheduler.TaskRunner runner = (task, dir) -> {
      if (task.id().equals("doc_3")) {
        throw new IllegalStateException("boom");
      }
      return List.of(ConversionResult.success(task.id(), List.of()));
    };
    BoundedScheduler scheduler = new BoundedScheduler(runner, 3, 5);

    List<ConversionResult> results = scheduler.run(tasks(6), 0, pool, workspace);

    assertEquals(6, results.size());
    ConversionResult failed = results.stream().filter(r -> !r.isSuccess()).findFirst().orElseThrow();
    assertEquals("doc_3", failed.id());
    assertEquals(FailureKind.CONVERSION, failed.failureKind());
    assertEquals("boom", failed.error());
    assertEquals(5, results.stream().filter(ConversionResult::isSuccess).count());
  }

  @Test
  void run_runnerReturningNothing_yieldsFailure() {
    BoundedScheduler scheduler = new BoundedScheduler((task, dir) -> List.of(), 3, 5);

    List<ConversionResult> results = scheduler.run(tasks(1), 0, pool, workspace);

    assertEquals(1, results.size());
    assertFalse(results.get(0).isSuccess());
  }

  @Test
  void run_taskWithSeveralDocuments_contributesAllOfThem() {
    BoundedScheduler.TaskRunner runner = (task, dir) -> List.of(
        ConversionResult.success(task.id() + "_1", List.of()),
        ConversionResult.success(task.id() + "_2", List.of()));
    BoundedScheduler scheduler = new BoundedScheduler(runner, 3, 5);

    List<ConversionResult> results = scheduler.run(tasks(2), 0, pool, workspace);

    assertEquals(Set.of("doc_1_1", "doc_1_2", "doc_2_1", "doc_2_2"),
        results.stream().map(ConversionResult::id).collect(Collectors.toSet()));
  }

  @Test
  void run_eachTaskGetsItsOwnDirectoryInsideTheWorkspace() {
    Set<Path> dirs = ConcurrentHashMap.newKeySet();
    BoundedScheduler scheduler = new BoundedScheduler((task, dir) -> {
      dirs.add(dir);
      return List.of(ConversionResult.success(task.id(), List.of()));
    }, 3, 5);

    scheduler.run(tasks(4), 0, pool, workspace);

    assertEquals(4, dirs.size());
    assertTrue(dirs.stream().allMatch(d -> d.startsWith(workspace.root())));
  }

  @Test
  void run_noTasks_returnsEmpty() {
    BoundedScheduler scheduler = new BoundedScheduler((task, dir) -> List.of(), 3, 5);
    assertTrue(scheduler.run(List.of(), 0, pool, workspace).isEmpty());
  }

  @Test
  void run_splitIdClashingWithAnotherTask_isRenamedWhateverFinishesFirst() {
    // task "a" splits into a_1/a_2 and finishes last; task "a_1" owns that id
    BoundedScheduler.TaskRunner runner = (task, dir) -> {
      if (task.id().equals("a")) {
        sleep(100);
        return List.of(
            ConversionResult.failure("a_1", FailureKind.CONVERSION, "first of a"),
            ConversionResult.failure("a_2", FailureKind.CONVERSION, "second of a"));
      }
      return List.of(ConversionResult.failure(task.id(), FailureKind.CONVERSION, "own " + task.id()));
    };
    BoundedScheduler scheduler = new BoundedScheduler(runner, 3, 5);
    List<ExtractionTask> tasks = List.of(
        new ExtractionTask("a", TaskSource.inline("unused"), new TaskOptions(72)),
        new ExtractionTask("a_1", TaskSource.inline("unused"), new TaskOptions(72)));

    List<ConversionResult> results = scheduler.run(tasks, 0, pool, workspace);

    assertEquals(List.of("a_1_2", "a_2", "a_1"), results.stream().map(ConversionResult::id).toList());
    assertEquals(List.of("first of a", "second of a", "own a_1"),
        results.stream().map(ConversionResult::error).toList());
  }

  @Test
  void capFor_clampsToCeilingAndTaskCount() {
    assertEquals(3, BoundedScheduler.capFor(0, 3, 5, 10));
    assertEquals(4, BoundedScheduler.capFor(4, 3, 5, 10));
    assertEquals(5, BoundedScheduler.capFor(99, 3, 5, 10));
    assertEquals(2, BoundedScheduler.capFor(0, 3, 5, 2));
    assertEquals(1, BoundedScheduler.capFor(0, 3, 5, 0));
    assertEquals(1, BoundedScheduler.capFor(-1, 0, 0, 7));
  }

  private static void sleep(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static List<ExtractionTask> tasks(int n) {
    List<ExtractionTask> tasks = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) {
      tasks.add(new ExtractionTask("doc_" + i, TaskSource.inline("unused"), new TaskOptions(72)));
    }
    return tasks;
  }

  private static Set<String> ids(int n) {
    return tasks(n).stream().map(ExtractionTask::id).collect(Collectors.toSet());
  }

  /** Records the highest number of tasks running at the same time. */
  private static final class ConcurrencyProbe implements BoundedScheduler.TaskRunner {
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();
    private final long sleepMs;

    ConcurrencyProbe(long sleepMs) {
      this.sleepMs = sleepMs;
    }

    @Override
    public List<ConversionResult> run(ExtractionTask task, Path workDir) {
      int now = current.incrementAndGet();
      max.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(sleepMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        current.decrementAndGet();
      }
      return List.of(ConversionResult.success(task.id(), List.of()));
    }
  }
}
