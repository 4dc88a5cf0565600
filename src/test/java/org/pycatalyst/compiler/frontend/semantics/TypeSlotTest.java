package org.pycatalyst.compiler.frontend.semantics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TypeSlotTest {

    @Test
    @Tag("unit")
    void testRefinableSlotSharpensInPlace() {
        TypeSlot slot = new TypeSlot(TypeTag.AUTO);

        assertThat(slot.unify(TypeTag.INT)).isEqualTo(TypeTag.INT);
        assertThat(slot.unify(TypeTag.FLOAT)).isEqualTo(TypeTag.FLOAT);
        assertThat(slot.unify(TypeTag.INT)).isEqualTo(TypeTag.FLOAT);
        assertThat(slot.get()).isEqualTo(TypeTag.FLOAT);
        assertThat(slot.isFixed()).isFalse();
    }

    @Test
    @Tag("unit")
    void testFixedSlotNeverChanges() {
        TypeSlot slot = TypeSlot.fixed(TypeTag.CONSTRUCTOR);

        assertThat(slot.unify(TypeTag.INT)).isEqualTo(TypeTag.CONSTRUCTOR);
        assertThat(slot.get()).isEqualTo(TypeTag.CONSTRUCTOR);
        assertThat(slot.isFixed()).isTrue();
        assertThat(slot).hasToString("constructor");
    }
}
