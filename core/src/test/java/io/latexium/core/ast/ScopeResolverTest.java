package io.latexium.core.ast;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeResolver")
class ScopeResolverTest {

    private static List<Identifier> identifiers(AstNode node) {
        List<Identifier> out = new ArrayList<>();
        collect(node, out);
        return out;
    }

    private static void collect(AstNode node, List<Identifier> out) {
        if (node instanceof Identifier id) {
            out.add(id);
        }
        Nodes.children(node).forEach(child -> collect(child, out));
    }

    @Nested
    @DisplayName("binding")
    class Binding {

        @Test
        @DisplayName("identifier under a binder of the same name is bound")
        void boundInsideIntegral() {
            AstNode tree = new Integral(Nodes.var("x"), Nodes.var("x"), null, null);

            Integral resolved = (Integral) ScopeResolver.resolve(tree);

            Identifier body = (Identifier) resolved.body();
            assertThat(body.isFree()).isFalse();
            assertThat(body.bindingDepth()).isEqualTo(1);
            assertThat(body.bindingKind()).isEqualTo(BindingKind.INTEGRAL);
            assertThat(body.uniqueId()).isEqualTo("bound_x_1_integral");
            assertThat(resolved.variable().uniqueId()).isEqualTo(body.uniqueId());
        }

        @Test
        @DisplayName("outer occurrence of the same name stays free")
        void outerOccurrenceStaysFree() {
            AstNode tree = Nodes.add(new Integral(Nodes.var("x"), Nodes.var("x"), null, null), Nodes.var("x"));

            AstNode resolved = ScopeResolver.resolve(tree);

            List<Identifier> ids = identifiers(resolved);
            assertThat(ids).extracting(Identifier::uniqueId)
                    .containsExactly("bound_x_1_integral", "free_x");
        }

        @Test
        @DisplayName("other names under a binder stay free")
        void otherNamesStayFree() {
            AstNode tree = new Integral(Nodes.mul(Nodes.var("a"), Nodes.var("x")), Nodes.var("x"), null, null);

            AstNode resolved = ScopeResolver.resolve(tree);

            assertThat(identifiers(resolved))
                    .filteredOn(id -> id.name().equals("a"))
                    .allMatch(Identifier::isFree);
        }
    }

    @Nested
    @DisplayName("shadowing")
    class Shadowing {

        @Test
        @DisplayName("innermost binder wins")
        void innermostWins() {
            AstNode inner = new Sum(Nodes.var("x"), Nodes.var("x"), Nodes.num(1), Nodes.num(3));
            AstNode tree = new Integral(inner, Nodes.var("x"), null, null);

            Integral resolved = (Integral) ScopeResolver.resolve(tree);

            Identifier occurrence = (Identifier) ((Sum) resolved.body()).body();
            assertThat(occurrence.bindingKind()).isEqualTo(BindingKind.SUM);
            assertThat(occurrence.bindingDepth()).isEqualTo(2);
        }

        @Test
        @DisplayName("bounds are resolved in the enclosing scope")
        void boundsSeeEnclosingScope() {
            AstNode tree = new Sum(Nodes.var("n"), Nodes.var("n"), Nodes.num(1), Nodes.var("n"));

            Sum resolved = (Sum) ScopeResolver.resolve(tree);

            assertThat(((Identifier) resolved.body()).isFree()).isFalse();
            assertThat(((Identifier) resolved.upper()).isFree()).isTrue();
        }
    }

    @Test
    @DisplayName("release frees the variable of the binder")
    void releaseFreesVariable() {
        Integral resolved = (Integral) ScopeResolver.resolve(
                new Integral(Nodes.pow(Nodes.var("x"), 2), Nodes.var("x"), null, null));

        AstNode body = ScopeResolver.release(resolved);

        assertThat(identifiers(body)).allMatch(Identifier::isFree);
        assertThat(Nodes.freeVariables(body)).containsExactly("x");
    }

    @Test
    @DisplayName("resolution is idempotent")
    void idempotent() {
        AstNode tree = Nodes.add(new Integral(Nodes.var("x"), Nodes.var("x"), null, null), Nodes.var("y"));

        AstNode once = ScopeResolver.resolve(tree);

        assertThat(ScopeResolver.resolve(once)).isEqualTo(once);
    }
}
