package org.stepmcp.step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 实体编译器：把按值嵌套的实体森林拍平成 DATA 段需要的编号表。
 * <p>
 * 算法（深度优先，先子后父）：
 * <ol>
 *   <li>编译一个实体前，先按属性顺序编译它引用到的所有实体（包括列表/SELECT 包装内部的引用），
 *       因为父实体的引用文本 {@code #id} 需要子实体编号；</li>
 *   <li>渲染出实体体 {@code TYPE(a1,a2,...)}，在 {@link EntityTable} 里按文本查找：
 *       已存在则复用编号，否则分配下一个编号；</li>
 *   <li>根实体按输入顺序处理，编号记入 {@link EntityTable#rootIds()}。</li>
 * </ol>
 * 因此子实体的编号通常小于首次引用它的父实体；渲染结果相同的实体（不论出现多少次、被谁引用）只占一条记录。
 * <p>
 * 引用链用显式栈遍历，不依赖 Java 调用栈深度；同一个实例被多处引用时只渲染一次。
 * 遇到正在编译中的实体（引用成环）时抛出 {@link CircularReferenceException}，本次编译整体作废。
 */
public final class StepEntityCompiler {

    private StepEntityCompiler() {
    }

    public static EntityTable compile(List<StepEntity> roots) {
        EntityTable table = new EntityTable();
        Map<StepEntity, Integer> compiled = new IdentityHashMap<>();
        for (StepEntity root : roots) {
            table.addRoot(compileEntity(root, table, compiled));
        }
        return table;
    }

    private static int compileEntity(StepEntity root, EntityTable table, Map<StepEntity, Integer> compiled) {
        Integer known = compiled.get(root);
        if (known != null) {
            return known;
        }

        StepReferenceResolver resolver = entity -> {
            Integer id = compiled.get(entity);
            if (id == null) {
                throw new IllegalStateException("被引用实体尚未编译：" + entity.typeName());
            }
            return id;
        };

        Deque<Frame> stack = new ArrayDeque<>();
        Set<StepEntity> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());
        stack.push(new Frame(root));
        inProgress.add(root);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            StepEntity child = frame.nextUncompiledChild(compiled);
            if (child != null) {
                if (inProgress.contains(child)) {
                    throw new CircularReferenceException(cycleChain(stack, child));
                }
                inProgress.add(child);
                stack.push(new Frame(child));
                continue;
            }

            // 所有子实体都有编号了，可以渲染当前实体并登记
            StepEntity entity = frame.entity;
            String rendered = StepAttributeFormatter.formatAll(entity.attributes(), resolver);
            compiled.put(entity, table.intern(entity.typeName(), rendered));
            inProgress.remove(entity);
            stack.pop();
        }
        return compiled.get(root);
    }

    private static List<String> cycleChain(Deque<Frame> stack, StepEntity repeated) {
        List<String> chain = new ArrayList<>();
        boolean inCycle = false;
        // 从栈底向栈顶：从第一次进入 repeated 的位置开始记录
        Iterator<Frame> it = stack.descendingIterator();
        while (it.hasNext()) {
            Frame frame = it.next();
            if (frame.entity == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                chain.add(frame.entity.typeName());
            }
        }
        chain.add(repeated.typeName());
        return chain;
    }

    private static void collectReferences(StepAttribute attribute, List<StepEntity> out) {
        if (attribute instanceof StepAttribute.Reference ref) {
            out.add(ref.entity());
        } else if (attribute instanceof StepAttribute.ListValue list) {
            for (StepAttribute item : list.items()) {
                collectReferences(item, out);
            }
        } else if (attribute instanceof StepAttribute.TypedValue typed) {
            collectReferences(typed.value(), out);
        }
    }

    private static final class Frame {
        final StepEntity entity;
        final List<StepEntity> children = new ArrayList<>();
        int next = 0;

        Frame(StepEntity entity) {
            this.entity = entity;
            for (StepAttribute attribute : entity.attributes()) {
                collectReferences(attribute, children);
            }
        }

        StepEntity nextUncompiledChild(Map<StepEntity, Integer> compiled) {
            while (next < children.size()) {
                StepEntity child = children.get(next++);
                if (!compiled.containsKey(child)) {
                    return child;
                }
            }
            return null;
        }
    }
}
