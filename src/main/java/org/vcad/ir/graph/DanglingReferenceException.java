package org.vcad.ir.graph;

/**
 * 子节点引用指向了节点表中不存在的 id。
 */
public class DanglingReferenceException extends GraphException {

    private final long nodeId;
    private final long missingId;

    public DanglingReferenceException(long nodeId, long missingId) {
        super("节点 " + nodeId + " 引用了不存在的节点 " + missingId);
        this.nodeId = nodeId;
        this.missingId = missingId;
    }

    public long getNodeId() {
        return nodeId;
    }

    public long getMissingId() {
        return missingId;
    }
}
