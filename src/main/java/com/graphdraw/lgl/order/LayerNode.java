package com.graphdraw.lgl.order;

import com.graphdraw.lgl.core.NodeLabel;

/**
 * Node of a layer graph.
 *
 * Wraps the layout graph's own label, so orders written while sorting land on
 * the layout graph directly. Clusters additionally carry their left and right
 * border nodes on this layer. The synthetic root has no label.
 */
record LayerNode(NodeLabel label, String borderLeft, String borderRight) {

    static LayerNode of(NodeLabel label) {
        return new LayerNode(label, null, null);
    }

    static LayerNode root() {
        return new LayerNode(null, null, null);
    }

    Integer order() {
        return label == null ? null : label.getOrder();
    }

    void setOrder(int order) {
        label.setOrder(order);
    }

    boolean hasBorders() {
        return borderLeft != null;
    }
}
