package io.tasklane.backend.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.tasklane.backend.TestcontainersConfiguration;
import io.tasklane.backend.security.CallerIdentity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
class TaskToggleConcurrencyIntegrationTest {

  private static final int THREADS = 8;
  private static final int TOGGLES = 20;

  @Autowired private TaskService taskService;

  @Test
  void concurrentTogglesAreNeverLost() throws Exception {
    UUID ownerId = UUID.randomUUID();
    var caller =
        new CallerIdentity(ownerId, "owner@test.com", Instant.now(), Instant.now().plusSeconds(600));
    var task = taskService.createTask(caller, ownerId, "Contended", null);

    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    var start = new CountDownLatch(1);
    var futures = new ArrayList<Future<?>>();
    try {
      for (int i = 0; i < TOGGLES; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return taskService.toggleCompletion(caller, ownerId, task.getId());
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    var reloaded = taskService.getTask(caller, ownerId, task.getId());
    // An even number of toggles lands back on the starting state
    assertThat(reloaded.isCompleted()).isFalse();
    assertThat(reloaded.getVersion()).isEqualTo(task.getVersion() + TOGGLES);
  }
}
