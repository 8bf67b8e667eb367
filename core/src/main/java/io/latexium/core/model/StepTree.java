package io.latexium.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Human-readable derivation trace. A leaf is one line of text; a branch groups the lines of a
 * sub-derivation, such as the steps of the integration strategy that produced a result.
 */
public sealed interface StepTree permits StepTree.Leaf, StepTree.Branch {

    record Leaf(String text) implements StepTree {

        public Leaf {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record Branch(List<StepTree> children) implements StepTree {

        public Branch {
            children = List.copyOf(children);
        }
    }

    static StepTree leaf(String text) {
        return new Leaf(text);
    }

    /** A branch of plain text lines. */
    static StepTree branch(List<String> lines) {
        return new Branch(lines.stream().map(StepTree::leaf).toList());
    }
}
