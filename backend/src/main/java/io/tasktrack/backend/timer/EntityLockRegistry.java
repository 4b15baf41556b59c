package io.tasktrack.backend.timer;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.tasktrack.backend.config.TimerProperties;
import io.tasktrack.backend.exception.ResourceConflictException;
import io.tasktrack.backend.timeentry.EntityKey;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * One lock per task or project, so timer transitions on the same entity run one at a time while
 * transitions on different entities run in parallel. Locks are weakly held and disappear once no
 * thread is using them.
 */
@Component
public class EntityLockRegistry {

  private static final Logger log = LoggerFactory.getLogger(EntityLockRegistry.class);

  private final Cache<EntityKey, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();
  private final Duration timeout;

  @Autowired
  public EntityLockRegistry(TimerProperties properties) {
    this(properties.lockTimeout());
  }

  EntityLockRegistry(Duration timeout) {
    this.timeout = timeout;
  }

  /**
   * Runs {@code action} while holding the lock for {@code key}.
   *
   * @throws ResourceConflictException if the lock is not acquired within the configured timeout
   */
  public <T> T withLock(EntityKey key, Supplier<T> action) {
    ReentrantLock lock = locks.get(key, k -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResourceConflictException(
          "Timer busy", "Interrupted while waiting for the timer on " + key, e);
    }
    if (!acquired) {
      log.warn("Timed out after {} waiting for timer lock on {}", timeout, key);
      throw new ResourceConflictException(
          "Timer busy", "Another timer change on " + key + " is still in progress");
    }
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
