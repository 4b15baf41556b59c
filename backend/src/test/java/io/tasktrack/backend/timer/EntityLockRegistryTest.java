package io.tasktrack.backend.timer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tasktrack.backend.exception.ResourceConflictException;
import io.tasktrack.backend.timeentry.EntityKey;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EntityLockRegistryTest {

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void withLock_serializesActionsOnTheSameEntity() throws Exception {
    var registry = new EntityLockRegistry(Duration.ofSeconds(10));
    var key = EntityKey.task(UUID.randomUUID());
    var counter = new int[1];

    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < 8; t++) {
      futures.add(
          executor.submit(
              () -> {
                for (int i = 0; i < 500; i++) {
                  registry.withLock(key, () -> counter[0]++);
                }
              }));
    }
    for (var future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }

    assertThat(counter[0]).isEqualTo(4_000);
  }

  @Test
  void withLock_letsDifferentEntitiesProceedInParallel() throws Exception {
    var registry = new EntityLockRegistry(Duration.ofMillis(200));
    var busy = EntityKey.task(UUID.randomUUID());
    var other = EntityKey.project(UUID.randomUUID());
    var held = new CountDownLatch(1);
    var release = new CountDownLatch(1);

    var holder = executor.submit(() -> registry.withLock(busy, () -> awaitRelease(held, release)));
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    try {
      assertThat(registry.withLock(other, () -> "done")).isEqualTo("done");
    } finally {
      release.countDown();
    }
    holder.get(5, TimeUnit.SECONDS);
  }

  @Test
  void withLock_timesOutWithConflict() throws Exception {
    var registry = new EntityLockRegistry(Duration.ofMillis(100));
    var key = EntityKey.project(UUID.randomUUID());
    var held = new CountDownLatch(1);
    var release = new CountDownLatch(1);

    var holder = executor.submit(() -> registry.withLock(key, () -> awaitRelease(held, release)));
    assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

    try {
      assertThatThrownBy(() -> registry.withLock(key, () -> "never"))
          .isInstanceOf(ResourceConflictException.class);
    } finally {
      release.countDown();
    }
    holder.get(5, TimeUnit.SECONDS);
  }

  @Test
  void withLock_releasesLockWhenActionThrows() {
    var registry = new EntityLockRegistry(Duration.ofMillis(100));
    var key = EntityKey.task(UUID.randomUUID());

    assertThatThrownBy(
            () ->
                registry.withLock(
                    key,
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(registry.withLock(key, () -> 1)).isEqualTo(1);
  }

  private static boolean awaitRelease(CountDownLatch held, CountDownLatch release) {
    held.countDown();
    try {
      return release.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
