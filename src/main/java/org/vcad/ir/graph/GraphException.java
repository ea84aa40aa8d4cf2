package org.vcad.ir.graph;

/**
 * 节点图结构不合法（环、悬空引用）时抛出的异常基类。
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }
}
