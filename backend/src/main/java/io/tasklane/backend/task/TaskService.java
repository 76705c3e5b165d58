package io.tasklane.backend.task;

import io.tasklane.backend.access.OwnershipGuard;
import io.tasklane.backend.exception.ResourceNotFoundException;
import io.tasklane.backend.exception.ValidationFailedException;
import io.tasklane.backend.security.CallerIdentity;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Task lifecycle. Every operation runs its checks in a fixed order: ownership, then existence, then
 * input validation, then the mutation. A request failing an earlier check never reaches a later
 * one, and a denied request never touches the repository.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);
  private static final String RESOURCE_TYPE = "Task";

  static final int TITLE_MAX_LENGTH = 200;
  static final int DESCRIPTION_MAX_LENGTH = 1000;

  private final TaskRepository taskRepository;
  private final OwnershipGuard ownershipGuard;

  public TaskService(TaskRepository taskRepository, OwnershipGuard ownershipGuard) {
    this.taskRepository = taskRepository;
    this.ownershipGuard = ownershipGuard;
  }

  /**
   * Lists the owner's tasks, newest first.
   *
   * @param completed optional completion filter
   * @param status optional alias filter, {@code pending} or {@code completed}; must agree with
   *     {@code completed} when both are given
   */
  @Transactional(readOnly = true)
  public List<Task> listTasks(
      CallerIdentity caller, UUID ownerId, Boolean completed, String status) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);

    Boolean filter = resolveCompletionFilter(completed, status);
    if (filter == null) {
      return taskRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId);
    }
    return taskRepository.findByOwnerIdAndCompletedOrderByCreatedAtDescIdDesc(ownerId, filter);
  }

  @Transactional
  public Task createTask(CallerIdentity caller, UUID ownerId, String title, String description) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);

    String normalizedTitle = normalizeTitle(title);
    String normalizedDescription = normalizeDescription(description);

    var task =
        new Task(
            ownerId,
            normalizedTitle,
            normalizedDescription == null || normalizedDescription.isEmpty()
                ? null
                : normalizedDescription);
    task = taskRepository.save(task);
    log.info("Created task {} for owner {}", task.getId(), ownerId);
    return task;
  }

  @Transactional(readOnly = true)
  public Task getTask(CallerIdentity caller, UUID ownerId, UUID taskId) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);
    return taskRepository
        .findOneByIdAndOwnerId(taskId, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE));
  }

  /**
   * Applies a partial update under a row lock, so the read-modify-write cannot interleave with
   * another update or toggle of the same task.
   */
  @Transactional
  public Task updateTask(CallerIdentity caller, UUID ownerId, UUID taskId, TaskChanges changes) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);

    var task =
        taskRepository
            .findForUpdate(taskId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE));

    String title = changes.title() != null ? normalizeTitle(changes.title()) : null;
    String description = normalizeDescription(changes.description());

    task.applyChanges(title, description, changes.completed());
    task = taskRepository.save(task);
    log.info("Updated task {} for owner {}", taskId, ownerId);
    return task;
  }

  @Transactional
  public void deleteTask(CallerIdentity caller, UUID ownerId, UUID taskId) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);

    if (taskRepository.deleteOwned(taskId, ownerId) == 0) {
      throw new ResourceNotFoundException(RESOURCE_TYPE);
    }
    log.info("Deleted task {} for owner {}", taskId, ownerId);
  }

  @Transactional
  public Task toggleCompletion(CallerIdentity caller, UUID ownerId, UUID taskId) {
    ownershipGuard.requireOwnerAccess(caller, ownerId, RESOURCE_TYPE);

    if (taskRepository.toggleCompleted(taskId, ownerId, Instant.now()) == 0) {
      throw new ResourceNotFoundException(RESOURCE_TYPE);
    }
    var task =
        taskRepository
            .findOneByIdAndOwnerId(taskId, ownerId)
            .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_TYPE));
    log.info("Toggled task {} for owner {} to completed={}", taskId, ownerId, task.isCompleted());
    return task;
  }

  // --- Validation helpers ---

  static Boolean resolveCompletionFilter(Boolean completed, String status) {
    if (status == null || status.isBlank()) {
      return completed;
    }
    Boolean fromStatus =
        switch (status.trim().toLowerCase(Locale.ROOT)) {
          case "pending" -> Boolean.FALSE;
          case "completed" -> Boolean.TRUE;
          default -> throw new ValidationFailedException(
              "status must be 'pending' or 'completed'");
        };
    if (completed != null && !completed.equals(fromStatus)) {
      throw new ValidationFailedException("status and completed filters contradict each other");
    }
    return fromStatus;
  }

  private static String normalizeTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new ValidationFailedException("title must not be empty");
    }
    String trimmed = title.strip();
    if (characterCount(trimmed) > TITLE_MAX_LENGTH) {
      throw new ValidationFailedException(
          "title must be at most " + TITLE_MAX_LENGTH + " characters");
    }
    return trimmed;
  }

  /** Returns the trimmed description, "" for a blank one, or null when not supplied. */
  private static String normalizeDescription(String description) {
    if (description == null) {
      return null;
    }
    String trimmed = description.strip();
    if (characterCount(trimmed) > DESCRIPTION_MAX_LENGTH) {
      throw new ValidationFailedException(
          "description must be at most " + DESCRIPTION_MAX_LENGTH + " characters");
    }
    return trimmed;
  }

  /** Length in Unicode code points, which is how the database column limits count. */
  private static int characterCount(String value) {
    return value.codePointCount(0, value.length());
  }
}
