package org.stepmcp.step;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepEntityCompilerTest {

    private static StepEntity point(double x, double y, double z) {
        return StepEntity.of("POINT", StepAttribute.real(x), StepAttribute.real(y), StepAttribute.real(z));
    }

    private static List<String> dataLines(EntityTable table) {
        return table.entities().stream().map(CompiledEntity::toDataLine).toList();
    }

    @Test
    void compile_sharedSubEntityIsEmittedOnce() {
        StepEntity shared = point(1.0, 2.0, 3.0);
        StepEntity a = StepEntity.of("VERTEX", StepAttribute.text("a"), StepAttribute.reference(shared));
        StepEntity b = StepEntity.of("VERTEX", StepAttribute.text("b"), StepAttribute.reference(shared));

        EntityTable table = StepEntityCompiler.compile(List.of(a, b));

        assertThat(dataLines(table)).containsExactly(
                "#1=POINT(1.,2.,3.);",
                "#2=VERTEX('a',#1);",
                "#3=VERTEX('b',#1);"
        );
        assertThat(table.rootIds()).containsExactly(2, 3);
    }

    @Test
    void compile_structurallyIdenticalInstancesCollapse() {
        StepEntity a = StepEntity.of("VERTEX", StepAttribute.text("a"), StepAttribute.reference(point(1.0, 2.0, 3.0)));
        StepEntity b = StepEntity.of("VERTEX", StepAttribute.text("b"), StepAttribute.reference(point(1.0, 2.0, 3.0)));

        EntityTable table = StepEntityCompiler.compile(List.of(a, b));

        assertThat(table.size()).isEqualTo(3);
        assertThat(table.idOf("POINT(1.,2.,3.)")).isEqualTo(1);
        assertThat(table.get(2).renderedAttributes()).isEqualTo("'a',#1");
        assertThat(table.get(3).renderedAttributes()).isEqualTo("'b',#1");
    }

    @Test
    void compile_sameEntityTwiceInOneParentResolvesToSameId() {
        StepEntity p = point(0.0, 0.0, 0.0);
        StepEntity line = StepEntity.of("LINE", StepAttribute.reference(p), StepAttribute.reference(p));

        EntityTable table = StepEntityCompiler.compile(List.of(line));

        assertThat(dataLines(table)).containsExactly("#1=POINT(0.,0.,0.);", "#2=LINE(#1,#1);");
    }

    @Test
    void compile_independentRootsGetIdsInInputOrder() {
        StepEntity a = StepEntity.of("A");
        StepEntity b = StepEntity.of("B");
        StepEntity c = StepEntity.of("C");

        EntityTable table = StepEntityCompiler.compile(List.of(a, b, c));

        assertThat(table.rootIds()).containsExactly(1, 2, 3);
        assertThat(dataLines(table)).containsExactly("#1=A();", "#2=B();", "#3=C();");
    }

    @Test
    void compile_duplicateRootsShareId() {
        EntityTable table = StepEntityCompiler.compile(List.of(point(1.0, 1.0, 1.0), point(1.0, 1.0, 1.0)));

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.rootIds()).containsExactly(1, 1);
    }

    @Test
    void compile_childrenInListsAndSelectsAreNumberedFirstInAttributeOrder() {
        StepEntity p1 = point(1.0, 0.0, 0.0);
        StepEntity p2 = point(2.0, 0.0, 0.0);
        StepEntity p3 = point(3.0, 0.0, 0.0);
        StepEntity poly = StepEntity.of("POLYLINE",
                StepAttribute.text(""),
                StepAttribute.list(StepAttribute.reference(p2), StepAttribute.reference(p1)),
                StepAttribute.typed("SELECTED", StepAttribute.reference(p3)));

        EntityTable table = StepEntityCompiler.compile(List.of(poly));

        assertThat(dataLines(table)).containsExactly(
                "#1=POINT(2.,0.,0.);",
                "#2=POINT(1.,0.,0.);",
                "#3=POINT(3.,0.,0.);",
                "#4=POLYLINE('',(#1,#2),SELECTED(#3));"
        );
    }

    @Test
    void compile_idsAreDense() {
        List<StepEntity> roots = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            StepEntity shared = point(i % 7, 0.0, 0.0);
            roots.add(StepEntity.of("VERTEX", StepAttribute.reference(shared)));
        }

        EntityTable table = StepEntityCompiler.compile(roots);

        // 7 个不同的 POINT + 7 个不同的 VERTEX
        assertThat(table.size()).isEqualTo(14);
        assertThat(table.entities().stream().map(CompiledEntity::id).toList())
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 14).boxed().toList());
    }

    @Test
    void compile_emptyInputGivesEmptyTable() {
        EntityTable table = StepEntityCompiler.compile(List.of());

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.rootIds()).isEmpty();
    }

    @Test
    void compile_rejectsSelfReference() {
        StepEntity a = StepEntity.of("A");
        a.add(StepAttribute.reference(a));

        assertThatThrownBy(() -> StepEntityCompiler.compile(List.of(a)))
                .isInstanceOf(CircularReferenceException.class)
                .satisfies(e -> assertThat(((CircularReferenceException) e).chain()).containsExactly("A", "A"));
    }

    @Test
    void compile_rejectsTwoNodeCycle() {
        StepEntity a = StepEntity.of("A");
        StepEntity b = StepEntity.of("B", StepAttribute.reference(a));
        a.add(StepAttribute.list(StepAttribute.reference(b)));

        assertThatThrownBy(() -> StepEntityCompiler.compile(List.of(a)))
                .isInstanceOf(CircularReferenceException.class)
                .hasMessageContaining("A -> B -> A")
                .satisfies(e -> assertThat(((CircularReferenceException) e).chain()).containsExactly("A", "B", "A"));
    }

    @Test
    void compile_cycleBelowTheRootReportsOnlyTheCycle() {
        StepEntity b = StepEntity.of("B");
        StepEntity c = StepEntity.of("C", StepAttribute.reference(b));
        b.add(StepAttribute.reference(c));
        StepEntity root = StepEntity.of("ROOT", StepAttribute.reference(b));

        assertThatThrownBy(() -> StepEntityCompiler.compile(List.of(root)))
                .isInstanceOf(CircularReferenceException.class)
                .satisfies(e -> assertThat(((CircularReferenceException) e).chain()).containsExactly("B", "C", "B"));
    }

    @Test
    void compile_handlesVeryDeepChains() {
        StepEntity current = StepEntity.of("NODE", StepAttribute.integer(0));
        for (int i = 1; i < 10_000; i++) {
            current = StepEntity.of("NODE", StepAttribute.integer(i), StepAttribute.reference(current));
        }

        EntityTable table = StepEntityCompiler.compile(List.of(current));

        assertThat(table.size()).isEqualTo(10_000);
        assertThat(table.get(1).toDataLine()).isEqualTo("#1=NODE(0);");
        assertThat(table.get(10_000).toDataLine()).isEqualTo("#10000=NODE(9999,#9999);");
        assertThat(table.rootIds()).containsExactly(10_000);
    }
}
