package org.stepmcp.step;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * STEP 文件 HEADER 段的描述信息，对应三个固定的伪实体：
 * <pre>
 * FILE_DESCRIPTION((description...),'implementation_level');
 * FILE_NAME('name','time_stamp',(author...),(organization...),'preprocessor_version','originating_system','authorization');
 * FILE_SCHEMA((schema...));
 * </pre>
 * null 字符串按空串、null 列表按空列表处理；{@code implementationLevel} 缺省为 {@code 2;1}；
 * {@code timeStamp} 缺省为当前 UTC 时间（精确到秒，ISO-8601）。
 */
public record StepHeader(
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        List<String> schemas
) {

    public static final String DEFAULT_IMPLEMENTATION_LEVEL = "2;1";

    public StepHeader {
        fileDescriptions = copyOrEmpty(fileDescriptions);
        implementationLevel = (implementationLevel == null || implementationLevel.isBlank())
                ? DEFAULT_IMPLEMENTATION_LEVEL
                : implementationLevel;
        fileName = nullToEmpty(fileName);
        timeStamp = (timeStamp == null || timeStamp.isBlank())
                ? Instant.now().truncatedTo(ChronoUnit.SECONDS).toString()
                : timeStamp;
        authors = copyOrEmpty(authors);
        organizations = copyOrEmpty(organizations);
        preprocessorVersion = nullToEmpty(preprocessorVersion);
        originatingSystem = nullToEmpty(originatingSystem);
        authorization = nullToEmpty(authorization);
        schemas = copyOrEmpty(schemas);
    }

    /**
     * HEADER 的三个伪实体，顺序固定为 FILE_DESCRIPTION、FILE_NAME、FILE_SCHEMA。
     */
    public List<StepEntity> toEntities() {
        StepEntity description = StepEntity.of(
                "FILE_DESCRIPTION",
                StepAttribute.textList(fileDescriptions),
                StepAttribute.text(implementationLevel)
        );
        StepEntity name = StepEntity.of(
                "FILE_NAME",
                StepAttribute.text(fileName),
                StepAttribute.text(timeStamp),
                StepAttribute.textList(authors),
                StepAttribute.textList(organizations),
                StepAttribute.text(preprocessorVersion),
                StepAttribute.text(originatingSystem),
                StepAttribute.text(authorization)
        );
        StepEntity schema = StepEntity.of(
                "FILE_SCHEMA",
                StepAttribute.textList(schemas)
        );
        return List.of(description, name, schema);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static List<String> copyOrEmpty(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().map(StepHeader::nullToEmpty).toList();
    }
}
