package org.stepmcp.step.json;

import org.junit.jupiter.api.Test;
import org.stepmcp.step.CircularReferenceException;
import org.stepmcp.step.CompiledEntity;
import org.stepmcp.step.EntityTable;
import org.stepmcp.step.StepAttribute;
import org.stepmcp.step.StepEntity;
import org.stepmcp.step.StepEntityCompiler;
import org.stepmcp.step.StepHeader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepJsonModelReaderTest {

    private static List<String> compile(String json) {
        EntityTable table = StepEntityCompiler.compile(StepJsonModelReader.readEntities(json, 1000));
        return table.entities().stream().map(CompiledEntity::toDataLine).toList();
    }

    @Test
    void readEntities_mapsAttributeShapes() {
        String json = """
                [{"type": "sample", "attributes": [
                  null, true, false, 3, 2.0, "O'Brien", [1, [2.5]],
                  {"derived": true}, {"integer": 7}, {"real": 2}, {"text": ""},
                  {"binary": "0F"}, {"enum": "unspecified"},
                  {"typed": "lengthMeasure", "value": 10.5}
                ]}]
                """;

        assertThat(compile(json)).containsExactly(
                "#1=SAMPLE($,.T.,.F.,3,2.,'O''Brien',(1,(2.5)),*,7,2.,'',\"0F\",.UNSPECIFIED.,LENGTH_MEASURE(10.5));"
        );
    }

    @Test
    void readEntities_acceptsWrappedDocumentAndInlineEntities() {
        String json = """
                {"entities": [
                  {"type": "VERTEX", "attributes": ["a", {"type": "POINT", "attributes": [[1.0, 2.0, 3.0]]}]},
                  {"type": "VERTEX", "attributes": ["b", {"type": "POINT", "attributes": [[1.0, 2.0, 3.0]]}]}
                ]}
                """;

        assertThat(compile(json)).containsExactly(
                "#1=POINT((1.,2.,3.));",
                "#2=VERTEX('a',#1);",
                "#3=VERTEX('b',#1);"
        );
    }

    @Test
    void readEntities_resolvesLabelsDeclaredLater() {
        String json = """
                [
                  {"type": "LINE", "attributes": [{"ref": "p"}, {"ref": "p"}]},
                  {"type": "POINT", "id": "p", "attributes": [0.5]}
                ]
                """;

        List<StepEntity> roots = StepJsonModelReader.readEntities(json, 1000);

        StepAttribute.Reference first = (StepAttribute.Reference) roots.get(0).attributes().get(0);
        assertThat(first.entity()).isSameAs(roots.get(1));
        assertThat(compile(json)).containsExactly("#1=POINT(0.5);", "#2=LINE(#1,#1);");
    }

    @Test
    void readEntities_labelledCycleIsRejectedByCompiler() {
        String json = """
                [
                  {"type": "A", "id": "a", "attributes": [{"ref": "b"}]},
                  {"type": "B", "id": "b", "attributes": [{"ref": "a"}]}
                ]
                """;

        List<StepEntity> roots = StepJsonModelReader.readEntities(json, 1000);

        assertThatThrownBy(() -> StepEntityCompiler.compile(roots))
                .isInstanceOf(CircularReferenceException.class)
                .hasMessageContaining("A -> B -> A");
    }

    @Test
    void readEntities_reportsPathOfMalformedAttribute() {
        assertThatThrownBy(() -> StepJsonModelReader.readEntities(
                "[{\"type\": \"A\"}, {\"type\": \"B\", \"attributes\": [1, {\"unknown\": 1}]}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[1].attributes[1] 格式错误");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[{\"type\": \"A\", \"attributes\": [{\"ref\": \"x\"}]}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不存在的实体标签：x");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[{\"type\": \"1A\"}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[0].type 格式错误");
    }

    @Test
    void readEntities_rejectsBadDocuments() {
        assertThatThrownBy(() -> StepJsonModelReader.readEntities(" ", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("参数错误：entities 不能为空");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[{", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities 不是合法的 JSON");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("{\"type\": \"A\"}", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities 格式错误");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[1]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[0] 格式错误");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities(
                "[{\"type\": \"A\", \"id\": \"x\"}, {\"type\": \"B\", \"id\": \"x\"}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("实体标签重复：x");
    }

    @Test
    void readEntities_rejectsLabelledEntityInIgnoredField() {
        String json = """
                [
                  {"type": "A", "attributes": [{"derived": true, "extra": {"type": "P", "id": "p", "attributes": [1, 2, 3]}}]},
                  {"type": "B", "attributes": [{"ref": "p"}]}
                ]
                """;

        assertThatThrownBy(() -> StepJsonModelReader.readEntities(json, 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[0].attributes[0].extra 格式错误")
                .hasMessageContaining("实体 p");
    }

    @Test
    void readEntities_reportsPathOfOverflowingReal() {
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[{\"type\": \"A\", \"attributes\": [1e400]}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[0].attributes[0] 格式错误")
                .hasMessageContaining("double 范围");
        assertThatThrownBy(() -> StepJsonModelReader.readEntities("[{\"type\": \"A\", \"attributes\": [{\"real\": -1e400}]}]", 1000))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("entities[0].attributes[0].real 格式错误");
    }

    @Test
    void readEntities_enforcesEntityLimitIncludingInlineEntities() {
        String json = "[{\"type\": \"A\", \"attributes\": [{\"type\": \"B\"}]}]";

        assertThat(StepJsonModelReader.readEntities(json, 2)).hasSize(1);
        assertThatThrownBy(() -> StepJsonModelReader.readEntities(json, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("实体数量过多");
    }

    @Test
    void readHeader_readsFieldsAndDefaults() {
        StepHeader header = StepJsonModelReader.readHeader("""
                {"fileDescriptions": "demo", "fileName": "a.stp", "timeStamp": "2026-01-21T00:00:00",
                 "authors": ["x", "y"], "schemas": ["AUTOMOTIVE_DESIGN"]}
                """, "fallback-system");

        assertThat(header.fileDescriptions()).containsExactly("demo");
        assertThat(header.fileName()).isEqualTo("a.stp");
        assertThat(header.timeStamp()).isEqualTo("2026-01-21T00:00:00");
        assertThat(header.authors()).containsExactly("x", "y");
        assertThat(header.organizations()).isEmpty();
        assertThat(header.implementationLevel()).isEqualTo("2;1");
        assertThat(header.originatingSystem()).isEqualTo("fallback-system");
        assertThat(header.schemas()).containsExactly("AUTOMOTIVE_DESIGN");

        assertThat(StepJsonModelReader.readHeader(null, "sys").originatingSystem()).isEqualTo("sys");
        assertThatThrownBy(() -> StepJsonModelReader.readHeader("{\"authors\": [1]}", "sys"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("header.authors[0] 格式错误");
    }
}
