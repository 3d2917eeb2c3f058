package com.graphdraw.lgl.core;

/** Immutable 2D point. */
public record Point(double x, double y) {
}
