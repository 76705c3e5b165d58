package io.tasklane.backend.task;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Task persistence. Every read and write is scoped by owner id, and no unscoped {@code
 * findById}/{@code findAll}/{@code deleteById} is exposed.
 *
 * <p>Listing order is {@code createdAt} descending with {@code id} descending as tie-break, which
 * is total and stable while no mutation is pending.
 */
public interface TaskRepository extends Repository<Task, UUID> {

  Task save(Task task);

  List<Task> findByOwnerIdOrderByCreatedAtDescIdDesc(UUID ownerId);

  List<Task> findByOwnerIdAndCompletedOrderByCreatedAtDescIdDesc(UUID ownerId, boolean completed);

  Optional<Task> findOneByIdAndOwnerId(UUID id, UUID ownerId);

  /** Loads a task with a row lock held until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Task t WHERE t.id = :id AND t.ownerId = :ownerId")
  Optional<Task> findForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

  /**
   * Flips the completion flag in a single statement, so concurrent toggles serialise on the row
   * lock and none is lost. Returns the number of rows updated (0 or 1).
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE Task t
         SET t.completed = CASE WHEN t.completed = true THEN false ELSE true END,
             t.version = t.version + 1,
             t.updatedAt = :now
       WHERE t.id = :id AND t.ownerId = :ownerId
      """)
  int toggleCompleted(
      @Param("id") UUID id, @Param("ownerId") UUID ownerId, @Param("now") Instant now);

  /** Hard delete. Returns the number of rows removed (0 or 1). */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Task t WHERE t.id = :id AND t.ownerId = :ownerId")
  int deleteOwned(@Param("id") UUID id, @Param("ownerId") UUID ownerId);
}
