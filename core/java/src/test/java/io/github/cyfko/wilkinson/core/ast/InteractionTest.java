package io.github.cyfko.wilkinson.core.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InteractionTest {

    private static final Term A = new ColumnName("a");
    private static final Term B = new ColumnName("b");
    private static final Term C = new ColumnName("c");

    private static List<String> labels(List<Term> terms) {
        return terms.stream().map(Term::label).collect(Collectors.toList());
    }

    @Test
    @DisplayName("a*b*c expands to every main effect and interaction, by order")
    void fullExpansion() {
        Interaction chain = new Interaction(List.of(A, B, C),
            List.of(InteractionOperator.FULL, InteractionOperator.FULL));

        assertEquals(List.of("a", "b", "c", "a:b", "a:c", "b:c", "a:b:c"), labels(chain.expand()));
    }

    @Test
    @DisplayName("a:b:c expands to its full product only")
    void productOnly() {
        Interaction chain = new Interaction(List.of(A, B, C),
            List.of(InteractionOperator.ONLY, InteractionOperator.ONLY));

        assertTrue(chain.isProductOnly());
        assertEquals(List.of("a:b:c"), labels(chain.expand()));
    }

    @Test
    @DisplayName("a*b:c treats b:c as one factor")
    void mixedChain() {
        Interaction chain = new Interaction(List.of(A, B, C),
            List.of(InteractionOperator.FULL, InteractionOperator.ONLY));

        assertEquals("a*b:c", chain.label());
        assertEquals(List.of("a", "b:c", "a:b:c"), labels(chain.expand()));
    }

    @Test
    @DisplayName("combine stops at the requested order")
    void combineUpToOrder() {
        List<Term> terms = Interaction.combine(List.of(List.of(A), List.of(B), List.of(C)), 2);
        assertEquals(List.of("a", "b", "c", "a:b", "a:c", "b:c"), labels(terms));
    }

    @Test
    @DisplayName("expansionSize counts the terms combine yields without building them")
    void expansionSize() {
        assertEquals(7, Interaction.expansionSize(3, 3));
        assertEquals(6, Interaction.expansionSize(3, 2));
        assertEquals(3, Interaction.expansionSize(3, Integer.MAX_VALUE));
        assertEquals((1L << 40) - 1, Interaction.expansionSize(40, 40));
        assertEquals(Long.MAX_VALUE, Interaction.expansionSize(100, 100));
        assertEquals(3, new Interaction(List.of(A, B, C),
            List.of(InteractionOperator.FULL, InteractionOperator.FULL)).factorCount());
    }

    @Test
    @DisplayName("Products share a key regardless of operand order")
    void productKey() {
        Interaction ab = Interaction.product(List.of(A, B));
        Interaction ba = Interaction.product(List.of(B, A));

        assertEquals("b:a", ba.label());
        assertEquals(ab.key(), ba.key());
        assertEquals("a:b", ba.key());
        assertEquals("a*b", new Interaction(List.of(A, B), List.of(InteractionOperator.FULL)).key());
    }

    @Test
    @DisplayName("combine emits a product once whatever the factor order")
    void combineDeduplicatesByKey() {
        List<Term> terms = Interaction.combine(List.of(List.of(A, B), List.of(B, A)), 2);
        assertEquals(List.of("a:b"), labels(terms));
    }

    @Test
    @DisplayName("An interaction needs one operator per junction")
    void invalidShape() {
        assertThrows(IllegalArgumentException.class,
            () -> new Interaction(List.of(A), List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> new Interaction(List.of(A, B), List.of()));
    }
}
