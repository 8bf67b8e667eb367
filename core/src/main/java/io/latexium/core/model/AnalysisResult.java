package io.latexium.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.latexium.core.ast.AstNode;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one facade operation. Exactly one of two states:
 *
 * <ul>
 *   <li>success: {@code value}, {@code valueType} and {@code ast} are set, {@code error} is null.
 *   <li>error: {@code error} is set, {@code value} and {@code ast} are null.
 * </ul>
 *
 * Steps are kept in both states; an empty trace is valid.
 */
public final class AnalysisResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<StepTree> steps;
    private final String value;
    private final ValueType valueType;
    private final AstNode ast;
    private final String error;

    private AnalysisResult(List<StepTree> steps, String value, ValueType valueType, AstNode ast, String error) {
        this.steps = List.copyOf(steps);
        this.value = value;
        this.valueType = valueType;
        this.ast = ast;
        this.error = error;
    }

    public static AnalysisResult success(List<StepTree> steps, String value, ValueType valueType, AstNode ast) {
        Objects.requireNonNull(value, "value must not be null for a successful result");
        Objects.requireNonNull(valueType, "valueType must not be null for a successful result");
        Objects.requireNonNull(ast, "ast must not be null for a successful result");
        return new AnalysisResult(steps, value, valueType, ast, null);
    }

    public static AnalysisResult error(List<StepTree> steps, String message) {
        Objects.requireNonNull(message, "message must not be null for an error result");
        return new AnalysisResult(steps, null, null, null, message);
    }

    public List<StepTree> steps() {
        return steps;
    }

    /** Rendered value. Only set when {@link #isSuccess()}. */
    public String value() {
        return value;
    }

    public ValueType valueType() {
        return valueType;
    }

    public AstNode ast() {
        return ast;
    }

    /** Error text. Only set when {@link #isError()}. */
    public String error() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /** {@code {steps, value, valueType, ast, error}}; absent parts are JSON nulls. */
    public ObjectNode toJson() {
        ObjectNode out = MAPPER.createObjectNode();
        out.set("steps", stepsJson(steps));
        out.put("value", value);
        out.put("valueType", valueType == null ? null : valueType.id());
        out.set("ast", ast == null ? MAPPER.nullNode() : AstJson.toJson(ast));
        out.put("error", error);
        return out;
    }

    private static ArrayNode stepsJson(List<StepTree> steps) {
        ArrayNode array = MAPPER.createArrayNode();
        for (StepTree step : steps) {
            if (step instanceof StepTree.Leaf leaf) {
                array.add(leaf.text());
            } else if (step instanceof StepTree.Branch branch) {
                array.add(stepsJson(branch.children()));
            }
        }
        return array;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AnalysisResult[" + valueType.id() + ", value=" + value + "]"
                : "AnalysisResult[ERROR, " + error + "]";
    }
}
