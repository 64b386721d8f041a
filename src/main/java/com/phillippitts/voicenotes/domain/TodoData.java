package com.phillippitts.voicenotes.domain;

import java.util.List;
import java.util.Objects;

/**
 * TODO branch: ordered action items.
 *
 * @param todos action items in the order they were spoken (may be empty, never null)
 */
public record TodoData(List<TodoEntry> todos) implements IntentData {

    public TodoData {
        Objects.requireNonNull(todos, "todos must not be null");
        todos = List.copyOf(todos);
    }

    @Override
    public Intent intent() {
        return Intent.TODO;
    }
}
