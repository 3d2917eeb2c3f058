package com.graphdraw.lgl.core;

import com.graphdraw.lgl.api.LabelPosition;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Mutable per-edge layout state: the rank constraint ({@code minlen},
 * {@code weight}), the label box, and the waypoints written by the pipeline.
 */
@Data
public class EdgeLabel {
    public static final double DEFAULT_LABEL_OFFSET = 10;

    private int minlen = 1;
    private double weight = 1;
    private double width;
    private double height;
    private LabelPosition labelpos = LabelPosition.R;
    private double labeloffset = DEFAULT_LABEL_OFFSET;

    private Double x;
    private Double y;
    private List<Point> points = new ArrayList<>();

    /** Set while the edge is stored head-to-tail by the acyclic transform. */
    private boolean reversed;
    private String forwardName;

    /** Rank that holds the label dummy once the edge is normalized. */
    private Integer labelRank;

    /** Scaffolding edge created by the nesting graph. */
    private boolean nestingEdge;

    public EdgeLabel() {
    }

    public EdgeLabel(int minlen, double weight) {
        this.minlen = minlen;
        this.weight = weight;
    }

    public static EdgeLabel of(int minlen, double weight) {
        return new EdgeLabel(minlen, weight);
    }

    public static EdgeLabel labelled(double width, double height) {
        EdgeLabel label = new EdgeLabel();
        label.setWidth(width);
        label.setHeight(height);
        return label;
    }

    public boolean hasLabelBox() {
        return width > 0 && height > 0;
    }

    /** Copy of the caller-visible attributes; pipeline state is not copied. */
    public EdgeLabel copyAttributes() {
        EdgeLabel c = new EdgeLabel(minlen, weight);
        c.setWidth(width);
        c.setHeight(height);
        c.setLabelpos(labelpos);
        c.setLabeloffset(labeloffset);
        return c;
    }
}
