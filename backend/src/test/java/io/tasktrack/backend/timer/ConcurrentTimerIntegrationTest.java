package io.tasktrack.backend.timer;

import static org.assertj.core.api.Assertions.assertThat;

import io.tasktrack.backend.TestcontainersConfiguration;
import io.tasktrack.backend.project.Project;
import io.tasktrack.backend.project.ProjectRepository;
import io.tasktrack.backend.task.Task;
import io.tasktrack.backend.task.TaskRepository;
import io.tasktrack.backend.timeentry.EntityKey;
import io.tasktrack.backend.timeentry.TimeEntry;
import io.tasktrack.backend.timeentry.TimeEntryStore;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ConcurrentTimerIntegrationTest {

  private static final int THREADS = 8;

  @Autowired private TimerService timerService;
  @Autowired private TimeEntryStore timeEntryStore;
  @Autowired private ProjectRepository projectRepository;
  @Autowired private TaskRepository taskRepository;

  @Test
  void concurrentStartsLeaveExactlyOneRunningTimer() throws Exception {
    var project = projectRepository.save(new Project(null, "Concurrency Project"));
    var task = taskRepository.save(new Task(project.getId(), null, "Contended Task"));
    var key = EntityKey.task(task.getId());

    var ready = new CountDownLatch(THREADS);
    var go = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(THREADS);
    try {
      List<Future<TimeEntry>> futures = new ArrayList<>();
      for (int i = 0; i < THREADS; i++) {
        futures.add(
            executor.submit(
                () -> {
                  ready.countDown();
                  go.await();
                  return timerService.start(key, null, null);
                }));
      }
      ready.await(10, TimeUnit.SECONDS);
      go.countDown();
      for (var future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(timeEntryStore.listRunning(key)).hasSize(1);
    assertThat(timeEntryStore.listByEntity(key)).hasSize(THREADS);
  }

  @Test
  void secondStartOnSameEntityClosesThePreviousTimer() {
    var project = projectRepository.save(new Project(null, "Restart Project"));
    var task = taskRepository.save(new Task(project.getId(), null, "Restarted Task"));
    var key = EntityKey.task(task.getId());

    var first = timerService.start(key, null, "first");
    var second = timerService.start(key, null, "second");

    assertThat(timeEntryStore.listRunning(key))
        .extracting(TimeEntry::getId)
        .containsExactly(second.getId());
    var closed = timeEntryStore.get(first.getId());
    assertThat(closed.isRunning()).isFalse();
    assertThat(closed.getEndTime()).isNotNull();
    assertThat(timeEntryStore.listByEntity(key)).hasSize(2);
  }

  @Test
  void startsOnDifferentEntitiesDoNotInterfere() {
    var project = projectRepository.save(new Project(null, "Parallel Project"));
    var first = taskRepository.save(new Task(project.getId(), null, "First"));
    var second = taskRepository.save(new Task(project.getId(), null, "Second"));

    timerService.start(EntityKey.task(first.getId()), null, null);
    timerService.start(EntityKey.task(second.getId()), null, null);
    timerService.start(EntityKey.project(project.getId()), null, null);

    assertThat(timeEntryStore.findRunning(EntityKey.task(first.getId()))).isPresent();
    assertThat(timeEntryStore.findRunning(EntityKey.task(second.getId()))).isPresent();
    assertThat(timeEntryStore.findRunning(EntityKey.project(project.getId()))).isPresent();
  }
}
