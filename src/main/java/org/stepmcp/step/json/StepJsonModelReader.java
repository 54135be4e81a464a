package org.stepmcp.step.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.stepmcp.step.StepAttribute;
import org.stepmcp.step.StepEntity;
import org.stepmcp.step.StepHeader;
import org.stepmcp.step.StepNames;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把工具入参中的 JSON 模型转换为 {@link StepEntity} 森林 / {@link StepHeader}。
 * <p>
 * 模型文档：实体对象数组，或 {@code {"entities": [...]}}。实体对象：
 * <pre>
 * {"type": "CARTESIAN_POINT", "attributes": ["", [1.0, 2.0, 3.0]], "id": "p1"}
 * </pre>
 * 属性写法：
 * <ul>
 *   <li>{@code null} → {@code $}；{@code true/false} → {@code .T./.F.}</li>
 *   <li>整数 → INTEGER；带小数/指数的数字 → REAL；字符串 → 字符串；数组 → 列表</li>
 *   <li>{@code {"derived": true}} → {@code *}</li>
 *   <li>{@code {"integer": 1}} / {@code {"real": 2}} / {@code {"text": "..."}}：显式标量</li>
 *   <li>{@code {"binary": "0F"}} → {@code "0F"}；{@code {"enum": "unspecified"}} → {@code .UNSPECIFIED.}</li>
 *   <li>{@code {"typed": "length_measure", "value": 10.5}} → {@code LENGTH_MEASURE(10.5)}</li>
 *   <li>{@code {"ref": "p1"}} → 引用带 {@code id} 标签的实体；内联实体对象 → 引用该实体</li>
 * </ul>
 * 标签在整个文档内唯一，同一标签只对应一个实体实例。类型名/枚举名经 {@link StepNames#normalize} 规范化。
 * <p>
 * 格式错误抛 {@link IllegalArgumentException}，消息中带 JSON 路径（例如 {@code entities[2].attributes[1]}）。
 * 实数超出 double 范围、带标签的实体放在不会被读取的字段里，也按格式错误处理。
 * 通过标签构造出的引用环不在这里检查，由编译器拒绝。
 */
public final class StepJsonModelReader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final int maxEntities;
    private final Map<String, StepEntity> labelled = new HashMap<>();
    private final Map<String, String> labelPaths = new LinkedHashMap<>();
    private final Set<String> filled = new HashSet<>();
    private int entityCount;

    private StepJsonModelReader(int maxEntities) {
        this.maxEntities = maxEntities;
    }

    public static List<StepEntity> readEntities(String json, int maxEntities) {
        return readEntities(parse(json, "entities"), maxEntities);
    }

    public static List<StepEntity> readEntities(JsonNode root, int maxEntities) {
        JsonNode entities = root;
        if (root != null && root.isObject() && root.has("entities")) {
            entities = root.get("entities");
        }
        if (entities == null || !entities.isArray()) {
            throw new IllegalArgumentException("entities 格式错误：必须是实体对象数组，或 {\"entities\": [...]}");
        }

        StepJsonModelReader reader = new StepJsonModelReader(maxEntities);
        // 第一遍：登记所有带标签的实体（先建空壳），这样引用可以出现在定义之前
        reader.scan(entities, "entities");

        List<StepEntity> roots = new ArrayList<>(entities.size());
        for (int i = 0; i < entities.size(); i++) {
            String path = "entities[" + i + "]";
            JsonNode node = entities.get(i);
            if (!isEntityNode(node)) {
                throw new IllegalArgumentException(path + " 格式错误：顶层元素必须是带 type 字段的实体对象");
            }
            roots.add(reader.readEntity(node, path));
        }
        reader.checkAllLabelsRead();
        return roots;
    }

    /**
     * 读取 HEADER 描述；json 为空时全部取默认值。
     * <p>
     * 字段与 {@link StepHeader} 同名；列表字段也可以直接给单个字符串。
     */
    public static StepHeader readHeader(String json, String defaultOriginatingSystem) {
        JsonNode node = (json == null || json.isBlank()) ? null : parse(json, "header");
        if (node != null && !node.isObject()) {
            throw new IllegalArgumentException("header 格式错误：必须是 JSON 对象");
        }
        String originatingSystem = optionalText(node, "originatingSystem");
        return new StepHeader(
                stringList(node, "fileDescriptions"),
                optionalText(node, "implementationLevel"),
                optionalText(node, "fileName"),
                optionalText(node, "timeStamp"),
                stringList(node, "authors"),
                stringList(node, "organizations"),
                optionalText(node, "preprocessorVersion"),
                originatingSystem == null ? defaultOriginatingSystem : originatingSystem,
                optionalText(node, "authorization"),
                stringList(node, "schemas")
        );
    }

    private static JsonNode parse(String json, String what) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("参数错误：" + what + " 不能为空");
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(what + " 不是合法的 JSON：" + e.getMessage(), e);
        }
    }

    private void scan(JsonNode node, String path) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                scan(node.get(i), path + "[" + i + "]");
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (isEntityNode(node)) {
            entityCount++;
            if (entityCount > maxEntities) {
                throw new IllegalArgumentException("实体数量过多：超过上限 " + maxEntities);
            }
            String label = optionalText(node, "id");
            if (label != null) {
                if (labelled.containsKey(label)) {
                    throw new IllegalArgumentException(path + " 格式错误：实体标签重复：" + label);
                }
                labelled.put(label, new StepEntity(typeName(node, path), List.of()));
                labelPaths.put(label, path);
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            scan(field.getValue(), path + "." + field.getKey());
        }
    }

    /**
     * 带标签的实体必须出现在会被读取的位置（顶层或属性位置）；
     * 否则它只剩第一遍登记的空壳，引用它会静默丢失属性。
     */
    private void checkAllLabelsRead() {
        for (Map.Entry<String, String> entry : labelPaths.entrySet()) {
            if (!filled.contains(entry.getKey())) {
                throw new IllegalArgumentException(entry.getValue() + " 格式错误：实体 " + entry.getKey()
                        + " 所在字段不会被读取（实体只能出现在 entities 顶层或属性位置）");
            }
        }
    }

    private StepEntity readEntity(JsonNode node, String path) {
        String label = optionalText(node, "id");
        StepEntity entity = (label == null) ? new StepEntity(typeName(node, path), List.of()) : labelled.get(label);
        if (label != null && !filled.add(label)) {
            return entity;
        }

        JsonNode attributes = node.get("attributes");
        if (attributes == null || attributes.isNull()) {
            return entity;
        }
        if (!attributes.isArray()) {
            throw new IllegalArgumentException(path + ".attributes 格式错误：必须是数组");
        }
        for (int i = 0; i < attributes.size(); i++) {
            entity.add(readAttribute(attributes.get(i), path + ".attributes[" + i + "]"));
        }
        return entity;
    }

    private StepAttribute readAttribute(JsonNode node, String path) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return StepAttribute.absent();
        }
        if (node.isBoolean()) {
            return StepAttribute.bool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return StepAttribute.integer(longValue(node, path));
        }
        if (node.isNumber()) {
            return StepAttribute.real(finiteDouble(node, path));
        }
        if (node.isTextual()) {
            return StepAttribute.text(node.textValue());
        }
        if (node.isArray()) {
            List<StepAttribute> items = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                items.add(readAttribute(node.get(i), path + "[" + i + "]"));
            }
            return StepAttribute.list(items);
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(path + " 格式错误：无法识别的属性值");
        }

        if (isEntityNode(node)) {
            return StepAttribute.reference(readEntity(node, path));
        }
        if (node.has("ref")) {
            String label = optionalText(node, "ref");
            StepEntity target = (label == null) ? null : labelled.get(label);
            if (target == null) {
                throw new IllegalArgumentException(path + " 格式错误：引用了不存在的实体标签：" + label);
            }
            return StepAttribute.reference(target);
        }
        if (node.has("derived")) {
            return StepAttribute.derived();
        }
        if (node.has("integer")) {
            JsonNode v = node.get("integer");
            if (!v.isIntegralNumber()) {
                throw new IllegalArgumentException(path + ".integer 格式错误：必须是整数");
            }
            return StepAttribute.integer(longValue(v, path + ".integer"));
        }
        if (node.has("real")) {
            JsonNode v = node.get("real");
            if (!v.isNumber()) {
                throw new IllegalArgumentException(path + ".real 格式错误：必须是数字");
            }
            return StepAttribute.real(finiteDouble(v, path + ".real"));
        }
        if (node.has("text")) {
            return StepAttribute.text(requiredTextAllowEmpty(node, "text", path));
        }
        if (node.has("binary")) {
            return StepAttribute.binary(requiredTextAllowEmpty(node, "binary", path));
        }
        if (node.has("enum")) {
            return StepAttribute.enumeration(normalizeName(requiredTextAllowEmpty(node, "enum", path), path + ".enum"));
        }
        if (node.has("typed")) {
            String typeName = normalizeName(requiredTextAllowEmpty(node, "typed", path), path + ".typed");
            if (!node.has("value")) {
                throw new IllegalArgumentException(path + " 格式错误：typed 缺少字段 value");
            }
            return StepAttribute.typed(typeName, readAttribute(node.get("value"), path + ".value"));
        }
        throw new IllegalArgumentException(path + " 格式错误：无法识别的属性对象（支持 type/ref/derived/integer/real/text/binary/enum/typed）");
    }

    private static boolean isEntityNode(JsonNode node) {
        return node != null && node.isObject() && node.hasNonNull("type");
    }

    private static String typeName(JsonNode node, String path) {
        return normalizeName(requiredTextAllowEmpty(node, "type", path), path + ".type");
    }

    private static String normalizeName(String name, String path) {
        try {
            return StepNames.normalize(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + " 格式错误：" + e.getMessage(), e);
        }
    }

    private static double finiteDouble(JsonNode node, String path) {
        double value = node.doubleValue();
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(path + " 格式错误：实数超出 double 范围：" + node.asText());
        }
        return value;
    }

    private static long longValue(JsonNode node, String path) {
        if (!node.canConvertToLong()) {
            throw new IllegalArgumentException(path + " 格式错误：整数超出 64 位范围");
        }
        return node.longValue();
    }

    private static String requiredTextAllowEmpty(JsonNode node, String field, String path) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException(path + "." + field + " 格式错误：必须是字符串");
        }
        return v.textValue();
    }

    private static String optionalText(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        String text = v.asText();
        return (text == null || text.isBlank()) ? null : text;
    }

    private static List<String> stringList(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isTextual()) {
            return List.of(v.textValue());
        }
        if (!v.isArray()) {
            throw new IllegalArgumentException("header." + field + " 格式错误：必须是字符串或字符串数组");
        }
        List<String> out = new ArrayList<>(v.size());
        for (int i = 0; i < v.size(); i++) {
            JsonNode item = v.get(i);
            if (!item.isTextual()) {
                throw new IllegalArgumentException("header." + field + "[" + i + "] 格式错误：必须是字符串");
            }
            out.add(item.textValue());
        }
        return out;
    }
}
