package io.latexium.core.model;

/** How an {@link AnalysisResult} value should be read. */
public enum ValueType {
    EXACT("exact"),
    APPROXIMATE("approximate"),
    SYMBOLIC("symbolic");

    private final String id;

    ValueType(String id) {
        this.id = id;
    }

    /** Lower-case name used in JSON output. */
    public String id() {
        return id;
    }
}
