package org.vcad.ir.graph;

import org.vcad.ir.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 节点图拓扑排序（后序 DFS，子节点总是排在父节点之前）。
 * <p>
 * 规则：
 * <ul>
 *   <li>先从每个未被引用的节点（按 id 升序）出发遍历，再补遍历剩余未访问的节点（孤立子图/环），
 *       保证节点表中的每个节点恰好输出一次。</li>
 *   <li>使用显式栈而不是递归：机器生成的文档可能有上万层的链式引用，递归会耗尽调用栈。</li>
 *   <li>子节点已在当前路径上 → {@link GraphCycleException}；子节点不存在 → {@link DanglingReferenceException}。</li>
 * </ul>
 */
public final class TopologicalSorter {

    private TopologicalSorter() {
    }

    public static List<Long> sort(Map<Long, Node> nodes) {
        Set<Long> starts = new LinkedHashSet<>(GraphReferences.unreferenced(nodes));
        starts.addAll(nodes.keySet());

        Set<Long> visited = new HashSet<>();
        Set<Long> onPath = new HashSet<>();
        List<Long> order = new ArrayList<>(nodes.size());
        Deque<Frame> stack = new ArrayDeque<>();

        for (Long start : starts) {
            if (visited.contains(start)) {
                continue;
            }
            onPath.add(start);
            stack.push(new Frame(start, nodes.get(start).op().children()));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.children.size()) {
                    long child = frame.children.get(frame.next++);
                    if (visited.contains(child)) {
                        continue;
                    }
                    if (onPath.contains(child)) {
                        throw new GraphCycleException(child);
                    }
                    Node childNode = nodes.get(child);
                    if (childNode == null) {
                        throw new DanglingReferenceException(frame.id, child);
                    }
                    onPath.add(child);
                    stack.push(new Frame(child, childNode.op().children()));
                } else {
                    stack.pop();
                    onPath.remove(frame.id);
                    visited.add(frame.id);
                    order.add(frame.id);
                }
            }
        }
        return order;
    }

    private static final class Frame {
        private final long id;
        private final List<Long> children;
        private int next;

        private Frame(long id, List<Long> children) {
            this.id = id;
            this.children = children;
        }
    }
}
