package io.latexium.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.latexium.core.ast.AstNode;
import io.latexium.core.ast.BinaryExpression;
import io.latexium.core.ast.BinaryOperator;
import io.latexium.core.ast.Binder;
import io.latexium.core.ast.Fraction;
import io.latexium.core.ast.FunctionCall;
import io.latexium.core.ast.Identifier;
import io.latexium.core.ast.Integral;
import io.latexium.core.ast.NodeVisitor;
import io.latexium.core.ast.NumberLiteral;
import io.latexium.core.ast.Product;
import io.latexium.core.ast.ScopeResolver;
import io.latexium.core.ast.Sum;
import io.latexium.core.ast.UnaryExpression;
import io.latexium.core.ast.UnaryOperator;
import io.latexium.core.error.LatexParseException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts expression trees to and from Jackson {@link JsonNode}s.
 *
 * <p>Each node is an object with a {@code type} tag ({@code number}, {@code identifier}, {@code
 * binary}, {@code unary}, {@code function}, {@code fraction}, {@code integral}, {@code sum},
 * {@code product}). Documents are validated against {@code schema/ast.schema.json} before they are
 * read; scope annotations in the input are ignored and recomputed.
 */
public final class AstJson {

    static final String SCHEMA_RESOURCE = "/schema/ast.schema.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema SCHEMA = loadSchema();
    private static final Writer WRITER = new Writer();

    private AstJson() {
        // utility class
    }

    public static JsonNode toJson(AstNode node) {
        return node.accept(WRITER);
    }

    /**
     * Reads a tree from JSON and resolves its scopes.
     *
     * @throws LatexParseException if the document does not match the AST schema
     */
    public static AstNode fromJson(JsonNode json) {
        Set<ValidationMessage> errors = SCHEMA.validate(json);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new LatexParseException("AST document does not match schema: " + detail, -1);
        }
        try {
            return ScopeResolver.resolve(read(json));
        } catch (IllegalArgumentException e) {
            throw new LatexParseException("Invalid AST document: " + e.getMessage(), e);
        }
    }

    /** Parses {@code text} as JSON and reads the tree from it. */
    public static AstNode fromJson(String text) {
        try {
            return fromJson(MAPPER.readTree(text));
        } catch (IOException e) {
            throw new LatexParseException("AST document is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = AstJson.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }

    private static AstNode read(JsonNode json) {
        String type = json.get("type").asText();
        return switch (type) {
            case "number" -> new NumberLiteral(json.get("value").asDouble());
            case "identifier" -> Identifier.free(json.get("name").asText());
            case "binary" -> new BinaryExpression(
                    BinaryOperator.fromSymbol(json.get("operator").asText()),
                    read(json.get("left")),
                    read(json.get("right")));
            case "unary" -> new UnaryExpression(
                    UnaryOperator.fromSymbol(json.get("operator").asText()), read(json.get("operand")));
            case "function" -> {
                List<AstNode> args = new ArrayList<>();
                json.get("args").forEach(arg -> args.add(read(arg)));
                yield new FunctionCall(json.get("name").asText(), args);
            }
            case "fraction" -> new Fraction(read(json.get("numerator")), read(json.get("denominator")));
            case "integral" -> new Integral(
                    read(json.get("integrand")), variable(json), bound(json, "lowerBound"), bound(json, "upperBound"));
            case "sum" -> new Sum(
                    read(json.get("expression")), variable(json), bound(json, "lowerBound"), bound(json, "upperBound"));
            case "product" -> new Product(
                    read(json.get("expression")), variable(json), bound(json, "lowerBound"), bound(json, "upperBound"));
            default -> throw new IllegalArgumentException("Unknown node type '" + type + "'");
        };
    }

    private static Identifier variable(JsonNode json) {
        return Identifier.free(json.get("variable").asText());
    }

    private static AstNode bound(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : read(value);
    }

    private static final class Writer implements NodeVisitor<JsonNode> {

        private ObjectNode node(String type) {
            return MAPPER.createObjectNode().put("type", type);
        }

        @Override
        public JsonNode visitNumber(NumberLiteral n) {
            ObjectNode out = node("number");
            if (n.isInteger()) {
                out.put("value", (long) n.value());
            } else {
                out.put("value", n.value());
            }
            return out;
        }

        @Override
        public JsonNode visitIdentifier(Identifier id) {
            ObjectNode out = node("identifier")
                    .put("name", id.name())
                    .put("scope", id.scope().name().toLowerCase(Locale.ROOT));
            if (!id.isFree()) {
                out.put("bindingDepth", id.bindingDepth());
                out.put("bindingContext", id.bindingKind().id());
            }
            return out.put("uniqueId", id.uniqueId());
        }

        @Override
        public JsonNode visitBinary(BinaryExpression b) {
            ObjectNode out = node("binary").put("operator", b.operator().symbol());
            out.set("left", b.left().accept(this));
            out.set("right", b.right().accept(this));
            return out;
        }

        @Override
        public JsonNode visitUnary(UnaryExpression u) {
            ObjectNode out = node("unary").put("operator", u.operator().symbol());
            out.set("operand", u.operand().accept(this));
            return out;
        }

        @Override
        public JsonNode visitFunction(FunctionCall f) {
            ObjectNode out = node("function").put("name", f.name());
            ArrayNode args = out.putArray("args");
            f.args().forEach(arg -> args.add(arg.accept(this)));
            return out;
        }

        @Override
        public JsonNode visitFraction(Fraction f) {
            ObjectNode out = node("fraction");
            out.set("numerator", f.numerator().accept(this));
            out.set("denominator", f.denominator().accept(this));
            return out;
        }

        @Override
        public JsonNode visitIntegral(Integral node) {
            return binder(node, "integral", "integrand");
        }

        @Override
        public JsonNode visitSum(Sum node) {
            return binder(node, "sum", "expression");
        }

        @Override
        public JsonNode visitProduct(Product node) {
            return binder(node, "product", "expression");
        }

        private JsonNode binder(Binder binder, String type, String bodyField) {
            ObjectNode out = node(type);
            out.set(bodyField, binder.body().accept(this));
            out.put("variable", binder.variable().name());
            if (binder.hasBounds()) {
                out.set("lowerBound", binder.lower().accept(this));
                out.set("upperBound", binder.upper().accept(this));
            }
            return out;
        }
    }
}
