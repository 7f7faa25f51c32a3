package com.specharvest.core.parser;

import com.specharvest.core.model.Section;
import com.specharvest.core.model.Specification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SectionStackTest {

    private TreeBuilder builder;
    private SectionStack stack;

    @BeforeEach
    void setUp() {
        builder = new TreeBuilder("doc");
        stack = new SectionStack(builder);
    }

    @Test
    void current_initially_returnsRoot() {
        assertThat(stack.current()).isSameAs(builder.root());
        assertThat(stack.depth()).isZero();
    }

    @Test
    void enter_withSameLevel_createsSiblings() {
        // Given
        stack.enter(1, "Clause A");
        stack.enter(2, "Sub A");

        // When
        stack.enter(2, "Sub B");

        // Then
        Specification spec = builder.build();
        Section clause = spec.sections().get(0);
        assertThat(clause.children())
            .extracting(node -> ((Section) node).title())
            .containsExactly("Sub A", "Sub B");
        assertThat(stack.depth()).isEqualTo(2);
    }

    @Test
    void enter_withSkippedLevel_nestsUnderNearestShallowerSection() {
        // Given
        stack.enter(1, "A");

        // When
        stack.enter(3, "A.x.y");
        stack.enter(2, "A.1");

        // Then
        Section a = builder.build().sections().get(0);
        assertThat(a.children()).hasSize(2);
        Section deep = (Section) a.children().get(0);
        Section sibling = (Section) a.children().get(1);
        assertThat(deep.level()).isEqualTo(3);
        assertThat(sibling.title()).isEqualTo("A.1");
        assertThat(sibling.level()).isEqualTo(2);
    }

    @Test
    void enter_withShallowerLevel_popsBackToRootChild() {
        stack.enter(1, "A");
        stack.enter(2, "A.1");
        stack.enter(3, "A.1.1");

        stack.enter(1, "B");

        assertThat(builder.build().sections())
            .extracting(Section::title)
            .containsExactly("A", "B");
        assertThat(stack.depth()).isEqualTo(1);
    }

    @Test
    void enter_firstHeadingAtDeepLevel_attachesToRoot() {
        stack.enter(4, "Deep");

        assertThat(builder.build().sections()).singleElement()
            .satisfies(section -> assertThat(section.level()).isEqualTo(4));
    }

    @Test
    void enter_withNonPositiveLevel_throws() {
        assertThatThrownBy(() -> stack.enter(0, "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
