package org.waabox.metricat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import org.waabox.metricat.namespace.Namespace;

/**
 * Concurrency tests for {@link MetricCatalog}.
 *
 * <p>Verifies that subscription counts stay exact under contention and that
 * readers of cached queries never see a key whose entries are gone while a
 * writer keeps adding and removing it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MetricCatalogConcurrencyTest {

  /** The number of threads to run concurrently. */
  private static final int THREAD_COUNT = 8;

  /** The number of operations each thread performs. */
  private static final int OPERATIONS_PER_THREAD = 1000;

  private static final Namespace FOO = Namespace.parse("/intel/mock/foo");

  private static final Namespace BAR = Namespace.parse("/intel/mock/bar");

  private static final Namespace QUERY = Namespace.parse("/intel/mock/*");

  @Test
  void whenSubscribing_givenConcurrentCallers_shouldNeverLoseAnUpdate()
      throws Exception {
    final MetricCatalog catalog = MetricCatalog.builder().build();
    final FakePlugin plugin = FakePlugin.collector("mock", 1);
    catalog.add(MetricDefinition.of(FOO, 1), plugin);

    runConcurrently(() -> {
      for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
        catalog.subscribe(FOO, 1);
      }
    });
    assertEquals(THREAD_COUNT * OPERATIONS_PER_THREAD,
        catalog.get(FOO, 1).subscriptionCount());

    runConcurrently(() -> {
      for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
        catalog.unsubscribe(FOO, 1);
      }
    });
    assertEquals(0, catalog.get(FOO, 1).subscriptionCount());
  }

  @Test
  void whenReadingQueries_givenConcurrentWriter_shouldNeverSeeStaleKeys()
      throws Exception {
    final MetricCatalog catalog = MetricCatalog.builder().build();
    final FakePlugin plugin = FakePlugin.collector("mock", 1);
    catalog.add(MetricDefinition.of(FOO, 1), plugin);
    catalog.matchQuery(QUERY);

    final AtomicBoolean inconsistent = new AtomicBoolean(false);
    final AtomicBoolean writing = new AtomicBoolean(true);
    final ExecutorService executor = Executors.newFixedThreadPool(
        THREAD_COUNT + 1);
    try {
      final Future<?> writer = executor.submit(() -> {
        try {
          for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
            catalog.add(MetricDefinition.of(BAR, 1), plugin);
            catalog.remove(BAR);
          }
        } finally {
          writing.set(false);
        }
      });

      final List<Future<?>> readers = new ArrayList<>();
      for (int t = 0; t < THREAD_COUNT; t++) {
        readers.add(executor.submit(() -> {
          while (writing.get()) {
            final List<Namespace> matched =
                catalog.getQueriedNamespaces(QUERY);
            if (!matched.contains(FOO) || matched.size() > 2) {
              inconsistent.set(true);
            }
            for (final CatalogItem item : catalog.items()) {
              if (item.versions().isEmpty()) {
                inconsistent.set(true);
              }
            }
          }
        }));
      }

      writer.get(30, TimeUnit.SECONDS);
      for (final Future<?> reader : readers) {
        reader.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertFalse(inconsistent.get(), "A reader observed an inconsistent state");
    assertEquals(List.of(FOO), catalog.getQueriedNamespaces(QUERY));
    assertEquals(List.of("intel.mock.foo"), catalog.keys());
  }

  /**
   * Runs the task on {@link #THREAD_COUNT} threads released at once.
   *
   * @param task the task to run
   *
   * @throws Exception if any task failed or timed out
   */
  private static void runConcurrently(final Runnable task) throws Exception {
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(
        THREAD_COUNT);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREAD_COUNT; t++) {
        futures.add(executor.submit(() -> {
          start.await();
          task.run();
          return null;
        }));
      }
      start.countDown();
      for (final Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
  }
}
