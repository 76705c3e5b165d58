package io.tasklane.backend.task;

import io.tasklane.backend.api.ApiResponse;
import io.tasklane.backend.security.CallerContext;
import io.tasklane.backend.security.CallerIdentity;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Task endpoints under {@code /api/{ownerId}/tasks}. The owner id in the path is only a claim; the
 * service compares it with the verified caller before doing anything else.
 */
@RestController
@RequestMapping("/api/{ownerId}/tasks")
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping
  public ResponseEntity<ApiResponse<List<TaskResponse>>> listTasks(
      @PathVariable UUID ownerId,
      @RequestParam(required = false) Boolean completed,
      @RequestParam(required = false) String status) {
    CallerIdentity caller = CallerContext.requireCaller();

    var tasks =
        taskService.listTasks(caller, ownerId, completed, status).stream()
            .map(TaskResponse::from)
            .toList();
    return ResponseEntity.ok(ApiResponse.ok(tasks));
  }

  @PostMapping
  public ResponseEntity<ApiResponse<TaskResponse>> createTask(
      @PathVariable UUID ownerId, @RequestBody CreateTaskRequest request) {
    CallerIdentity caller = CallerContext.requireCaller();

    var task = taskService.createTask(caller, ownerId, request.title(), request.description());
    return ResponseEntity.created(URI.create("/api/" + ownerId + "/tasks/" + task.getId()))
        .body(ApiResponse.ok(TaskResponse.from(task)));
  }

  @GetMapping("/{taskId}")
  public ResponseEntity<ApiResponse<TaskResponse>> getTask(
      @PathVariable UUID ownerId, @PathVariable UUID taskId) {
    CallerIdentity caller = CallerContext.requireCaller();

    var task = taskService.getTask(caller, ownerId, taskId);
    return ResponseEntity.ok(ApiResponse.ok(TaskResponse.from(task)));
  }

  @PutMapping("/{taskId}")
  public ResponseEntity<ApiResponse<TaskResponse>> updateTask(
      @PathVariable UUID ownerId,
      @PathVariable UUID taskId,
      @RequestBody UpdateTaskRequest request) {
    CallerIdentity caller = CallerContext.requireCaller();

    var changes = new TaskChanges(request.title(), request.description(), request.completed());
    var task = taskService.updateTask(caller, ownerId, taskId, changes);
    return ResponseEntity.ok(ApiResponse.ok(TaskResponse.from(task)));
  }

  @DeleteMapping("/{taskId}")
  public ResponseEntity<Void> deleteTask(@PathVariable UUID ownerId, @PathVariable UUID taskId) {
    CallerIdentity caller = CallerContext.requireCaller();

    taskService.deleteTask(caller, ownerId, taskId);
    return ResponseEntity.noContent().build();
  }

  @PatchMapping("/{taskId}/complete")
  public ResponseEntity<ApiResponse<TaskResponse>> toggleCompletion(
      @PathVariable UUID ownerId, @PathVariable UUID taskId) {
    CallerIdentity caller = CallerContext.requireCaller();

    var task = taskService.toggleCompletion(caller, ownerId, taskId);
    return ResponseEntity.ok(ApiResponse.ok(TaskResponse.from(task)));
  }

  // Request bodies carry no bean-validation constraints: validation runs in TaskService, after the
  // ownership check, so a foreign owner id is reported as not found rather than as bad input.

  public record CreateTaskRequest(String title, String description) {}

  public record UpdateTaskRequest(String title, String description, Boolean completed) {}

  public record TaskResponse(
      UUID id,
      UUID ownerId,
      String title,
      String description,
      boolean completed,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getOwnerId(),
          task.getTitle(),
          task.getDescription(),
          task.isCompleted(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }
}
