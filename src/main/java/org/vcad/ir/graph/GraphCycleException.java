package org.vcad.ir.graph;

/**
 * 遍历时发现环：某个节点在当前路径上再次被访问。
 */
public class GraphCycleException extends GraphException {

    private final long nodeId;

    public GraphCycleException(long nodeId) {
        super("节点图存在环，节点 " + nodeId + " 间接引用了自身");
        this.nodeId = nodeId;
    }

    public long getNodeId() {
        return nodeId;
    }
}
