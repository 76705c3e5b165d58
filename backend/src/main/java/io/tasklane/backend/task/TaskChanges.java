package io.tasklane.backend.task;

/**
 * Partial update of a task. A null component means "not supplied" and leaves the stored value
 * untouched; a blank description clears it.
 */
public record TaskChanges(String title, String description, Boolean completed) {}
