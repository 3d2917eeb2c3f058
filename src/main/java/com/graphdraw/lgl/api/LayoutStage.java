package com.graphdraw.lgl.api;

/** Pipeline stages, in execution order. */
public enum LayoutStage {
    MAKE_SPACE_FOR_EDGE_LABELS,
    REMOVE_SELF_EDGES,
    ACYCLIC,
    NESTING_GRAPH,
    RANK,
    INJECT_EDGE_LABEL_PROXIES,
    REMOVE_EMPTY_RANKS,
    NESTING_GRAPH_CLEANUP,
    NORMALIZE_RANKS,
    ASSIGN_RANK_MIN_MAX,
    REMOVE_EDGE_LABEL_PROXIES,
    NORMALIZE,
    PARENT_DUMMY_CHAINS,
    ADD_BORDER_SEGMENTS,
    ORDER,
    ADJUST_COORDINATE_SYSTEM,
    INSERT_SELF_EDGES,
    POSITION,
    POSITION_SELF_EDGES,
    REMOVE_BORDER_NODES,
    NORMALIZE_UNDO,
    FIXUP_EDGE_LABEL_COORDS,
    UNDO_COORDINATE_SYSTEM,
    TRANSLATE,
    ASSIGN_NODE_INTERSECTS,
    ACYCLIC_UNDO
}
