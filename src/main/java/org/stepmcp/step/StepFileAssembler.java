package org.stepmcp.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * STEP 物理文件（ISO-10303-21）组装器。
 * <p>
 * 输出结构固定为：
 * <pre>
 * ISO-10303-21;
 * HEADER;
 * FILE_DESCRIPTION(...);
 * FILE_NAME(...);
 * FILE_SCHEMA(...);
 * ENDSEC;
 * DATA;
 * #1=...;
 * ENDSEC;
 * END-ISO-10303-21;
 * </pre>
 * HEADER 伪实体与用户实体走同一套编译/渲染流程；HEADER 行不带 {@code #id=} 前缀，DATA 行总是带。
 * 各行以 {@code \n} 连接，文档以换行结尾。
 */
public final class StepFileAssembler {

    private static final Logger log = LoggerFactory.getLogger(StepFileAssembler.class);

    public static final String FILE_START = "ISO-10303-21;";
    public static final String FILE_END = "END-ISO-10303-21;";

    private StepFileAssembler() {
    }

    /**
     * 组装结果。
     *
     * @param text   完整文档文本
     * @param header HEADER 伪实体的编译表
     * @param data   DATA 实体的编译表
     */
    public record StepDocument(String text, EntityTable header, EntityTable data) {
    }

    public static StepDocument render(StepHeader header, List<StepEntity> entities) {
        EntityTable headerTable = StepEntityCompiler.compile(header.toEntities());
        EntityTable dataTable = StepEntityCompiler.compile(entities);
        String text = assemble(headerTable, dataTable);
        log.debug("STEP 文档组装完成：输入根实体 {} 个，DATA 实体 {} 条，{} 字符",
                entities.size(), dataTable.size(), text.length());
        return new StepDocument(text, headerTable, dataTable);
    }

    public static String assemble(EntityTable header, EntityTable data) {
        List<String> lines = new ArrayList<>(header.size() + data.size() + 7);
        lines.add(FILE_START);
        lines.add("HEADER;");
        for (CompiledEntity entity : header.entities()) {
            lines.add(entity.toHeaderLine());
        }
        lines.add("ENDSEC;");
        lines.add("DATA;");
        for (CompiledEntity entity : data.entities()) {
            lines.add(entity.toDataLine());
        }
        lines.add("ENDSEC;");
        lines.add(FILE_END);
        // 末尾空串：join 后文档以换行结尾
        lines.add("");
        return String.join("\n", lines);
    }
}
