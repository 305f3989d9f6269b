package com.fhestream.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandleDerivationTest {

    private static final String PROGRAM_ID = "FkLGYGk2bypUXgpGmcsCTmKZo6LCjHaXswbhY1LNGAKj";
    private static final Handle ONES = new Handle("11".repeat(32));
    private static final Handle TWOS = new Handle("22".repeat(32));

    @Test
    void derive_binaryAdd_matchesProgramRule() {
        Handle result = HandleDerivation.derive(BinaryOperator.ADD, List.of(ONES, TWOS), PROGRAM_ID);

        assertThat(result.hex()).isEqualTo("02300ee2b3627bd474d2390227e7d5d7dac6255c8537e6de7d2d645b483b6b3e");
    }

    @Test
    void derive_unaryNot_usesUnaryDomainTag() {
        Handle result = HandleDerivation.derive(UnaryOperator.NOT, List.of(ONES), PROGRAM_ID);

        assertThat(result.hex()).isEqualTo("6f584fe06de859ee6c4f2a17ce10081bbbe81ce83aef8df85c263c875c1ce157");
    }

    @Test
    void derive_operandOrderMatters() {
        Handle forward = HandleDerivation.derive(BinaryOperator.SUB, List.of(ONES, TWOS), PROGRAM_ID);
        Handle reversed = HandleDerivation.derive(BinaryOperator.SUB, List.of(TWOS, ONES), PROGRAM_ID);

        assertThat(forward).isNotEqualTo(reversed);
    }

    @Test
    void derive_wrongArity_isRejected() {
        assertThatThrownBy(() -> HandleDerivation.derive(TernaryOperator.MAJ3, List.of(ONES, TWOS), PROGRAM_ID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ternary");
    }

    @Test
    void matches_detectsForeignResultHandle() {
        Handle derived = HandleDerivation.derive(BinaryOperator.ADD, List.of(ONES, TWOS), PROGRAM_ID);
        BinaryOpRequested good = new BinaryOpRequested("sig", 10, null, "caller", BinaryOperator.ADD, ONES, TWOS, derived);
        BinaryOpRequested bad = new BinaryOpRequested("sig", 10, null, "caller", BinaryOperator.ADD, ONES, TWOS, ONES);

        assertThat(HandleDerivation.matches(good, PROGRAM_ID)).isTrue();
        assertThat(HandleDerivation.matches(bad, PROGRAM_ID)).isFalse();
    }
}
