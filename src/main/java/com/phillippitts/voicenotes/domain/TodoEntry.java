package com.phillippitts.voicenotes.domain;

import java.util.Objects;

/**
 * Single action item of a TODO item.
 *
 * @param task task description (must not be null)
 * @param done completion flag; new tasks are never done
 * @param due  free-form due date as spoken, or {@code null} when none was mentioned
 */
public record TodoEntry(String task, boolean done, String due) {

    public TodoEntry {
        Objects.requireNonNull(task, "task must not be null");
    }
}
