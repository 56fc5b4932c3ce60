package io.github.behaviorcache.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EntryLocksTest {

  @TempDir Path tempDir;

  private ExecutorService executor;

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void acquire_releasedLocksAreNotRetained() {
    // Given
    final int before = EntryLocks.trackedPaths();

    // When
    for (int i = 0; i < 100; i++) {
      try (EntryLocks.Handle handle = EntryLocks.acquire(tempDir.resolve("entry-" + i + ".lock"))) {
        assertThat(EntryLocks.trackedPaths()).isEqualTo(before + 1);
      }
    }

    // Then
    assertThat(EntryLocks.trackedPaths()).isEqualTo(before);
  }

  @Test
  void acquire_contendedLockIsExclusiveAndThenDropped() throws Exception {
    // Given
    final int before = EntryLocks.trackedPaths();
    final Path lockFile = tempDir.resolve("shared.lock");
    final AtomicInteger inside = new AtomicInteger();
    final AtomicInteger maxInside = new AtomicInteger();
    executor = Executors.newFixedThreadPool(8);

    // When
    final List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < 32; i++) {
      futures.add(executor.submit(() -> {
        try (EntryLocks.Handle handle = EntryLocks.acquire(lockFile)) {
          maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
          Thread.sleep(2);
          inside.decrementAndGet();
        }
        return null;
      }));
    }
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }

    // Then
    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(EntryLocks.trackedPaths()).isEqualTo(before);
  }
}
