package com.graphdraw.lgl.core;

/** A self-loop parked on its owner node while ranking and ordering run. */
public record SelfEdge(EdgeKey edge, EdgeLabel label) {
}
