package org.stepmcp.step;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StepFileAssemblerTest {

    private static StepHeader header() {
        return new StepHeader(
                List.of("demo model"),
                null,
                "demo.stp",
                "2026-01-21T00:00:00",
                List.of("O'Brien"),
                List.of("ACME"),
                "pre 1.0",
                "step-mcp-server",
                "",
                List.of("AUTOMOTIVE_DESIGN")
        );
    }

    @Test
    void render_producesCompleteDocument() {
        StepEntity origin = StepEntity.of("CARTESIAN_POINT",
                StepAttribute.text(""),
                StepAttribute.list(StepAttribute.real(0.0), StepAttribute.real(0.0), StepAttribute.real(0.0)));
        StepEntity dir = StepEntity.of("DIRECTION",
                StepAttribute.text(""),
                StepAttribute.list(StepAttribute.real(0.0), StepAttribute.real(0.0), StepAttribute.real(1.0)));
        StepEntity axis = StepEntity.of("AXIS2_PLACEMENT_3D",
                StepAttribute.text(""),
                StepAttribute.reference(origin),
                StepAttribute.reference(dir),
                StepAttribute.absent());

        StepFileAssembler.StepDocument document = StepFileAssembler.render(header(), List.of(axis));

        assertThat(document.text()).isEqualTo("""
                ISO-10303-21;
                HEADER;
                FILE_DESCRIPTION(('demo model'),'2;1');
                FILE_NAME('demo.stp','2026-01-21T00:00:00',('O''Brien'),('ACME'),'pre 1.0','step-mcp-server','');
                FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));
                ENDSEC;
                DATA;
                #1=CARTESIAN_POINT('',(0.,0.,0.));
                #2=DIRECTION('',(0.,0.,1.));
                #3=AXIS2_PLACEMENT_3D('',#1,#2,$);
                ENDSEC;
                END-ISO-10303-21;
                """);
        assertThat(document.data().rootIds()).containsExactly(3);
        assertThat(document.header().size()).isEqualTo(3);
    }

    @Test
    void render_emptyDataSectionStillHasMarkers() {
        String text = StepFileAssembler.render(header(), List.of()).text();

        assertThat(text).contains("DATA;\nENDSEC;\nEND-ISO-10303-21;\n");
        assertThat(text).startsWith("ISO-10303-21;\nHEADER;\n");
        assertThat(text).endsWith(";\n").doesNotEndWith("\n\n");
    }

    @Test
    void header_appliesDefaults() {
        StepHeader header = new StepHeader(null, null, null, null, null, null, null, null, null, null);

        assertThat(header.implementationLevel()).isEqualTo("2;1");
        assertThat(header.timeStamp()).matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z");
        assertThat(header.fileDescriptions()).isEmpty();
        assertThat(header.fileName()).isEmpty();

        List<String> lines = StepEntityCompiler.compile(header.toEntities()).entities().stream()
                .map(CompiledEntity::toHeaderLine)
                .toList();
        assertThat(lines.get(0)).isEqualTo("FILE_DESCRIPTION((),'2;1');");
        assertThat(lines.get(1)).isEqualTo("FILE_NAME('','" + header.timeStamp() + "',(),(),'','','');");
        assertThat(lines.get(2)).isEqualTo("FILE_SCHEMA(());");
    }
}
