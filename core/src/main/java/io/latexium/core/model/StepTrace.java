package io.latexium.core.model;

import java.util.ArrayList;
import java.util.List;

/** Mutable collector for the steps of one running operation. Not thread-safe. */
public final class StepTrace {

    private final List<StepTree> steps = new ArrayList<>();

    public StepTrace add(String line) {
        steps.add(StepTree.leaf(line));
        return this;
    }

    /** Appends {@code lines} as a nested branch; an empty list adds nothing. */
    public StepTrace nest(List<String> lines) {
        if (!lines.isEmpty()) {
            steps.add(StepTree.branch(lines));
        }
        return this;
    }

    public List<StepTree> build() {
        return List.copyOf(steps);
    }
}
