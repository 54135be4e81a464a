package org.stepmcp.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次编译的结果表（hash-cons 表）。
 * <p>
 * 不变量：
 * <ul>
 *   <li>实体体文本 {@code TYPE(attrs)} 到编号一一对应；</li>
 *   <li>编号为连续的 {@code 1..n}，没有空洞也不复用；</li>
 *   <li>{@link #entities()} 按编号升序（即首次发现顺序）排列。</li>
 * </ul>
 * 表只属于一次编译调用，不跨调用复用，也不做同步。
 */
public final class EntityTable {

    private final Map<String, Integer> idsByBody = new LinkedHashMap<>();
    private final List<CompiledEntity> entities = new ArrayList<>();
    private final List<Integer> rootIds = new ArrayList<>();

    EntityTable() {
    }

    /**
     * 查找或登记一个实体：相同实体体复用已有编号，否则分配 {@code 当前最大编号 + 1}。
     */
    int intern(String typeName, String renderedAttributes) {
        String body = CompiledEntity.body(typeName, renderedAttributes);
        Integer existing = idsByBody.get(body);
        if (existing != null) {
            return existing;
        }
        int id = entities.size() + 1;
        entities.add(new CompiledEntity(id, typeName, renderedAttributes));
        idsByBody.put(body, id);
        return id;
    }

    void addRoot(int id) {
        rootIds.add(id);
    }

    /**
     * 按编号升序的全部实体。
     */
    public List<CompiledEntity> entities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * 每个输入根实体对应的编号（与输入顺序一致；去重后可能出现重复编号）。
     */
    public List<Integer> rootIds() {
        return Collections.unmodifiableList(rootIds);
    }

    /**
     * 按实体体文本（例如 {@code POINT(1.,2.,3.)}）查找编号；不存在时返回 null。
     */
    public Integer idOf(String body) {
        return idsByBody.get(body);
    }

    public CompiledEntity get(int id) {
        if (id < 1 || id > entities.size()) {
            throw new IllegalArgumentException("实体编号不存在：#" + id);
        }
        return entities.get(id - 1);
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
