package com.graphdraw.lgl.api;

/**
 * The closed set of synthetic node kinds the pipeline creates.
 *
 * None of these survive a layout run; they exist only between the stage that
 * creates them and the stage that removes them.
 */
public enum DummyKind {
    /** Segment of a normalized multi-rank edge. */
    EDGE,
    /** Segment of a normalized edge that reserves room for the edge label. */
    EDGE_LABEL,
    /** Temporary marker placing an edge label on a rank before normalization. */
    EDGE_PROXY,
    /** Top border of a cluster, created by the nesting graph. */
    BORDER_TOP,
    /** Bottom border of a cluster, created by the nesting graph. */
    BORDER_BOTTOM,
    /** Per-rank left border of a cluster. */
    BORDER_LEFT,
    /** Per-rank right border of a cluster. */
    BORDER_RIGHT,
    /** Space holder for a self-loop next to its owner. */
    SELF_EDGE,
    /** Synthetic root that connects the nesting graph. */
    NESTING_ROOT;

    public boolean isBorder() {
        return switch (this) {
            case BORDER_TOP, BORDER_BOTTOM, BORDER_LEFT, BORDER_RIGHT -> true;
            case EDGE, EDGE_LABEL, EDGE_PROXY, SELF_EDGE, NESTING_ROOT -> false;
        };
    }
}
