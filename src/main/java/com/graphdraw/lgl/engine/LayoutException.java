package com.graphdraw.lgl.engine;

import com.graphdraw.lgl.api.LayoutStage;

/** A layout run failed inside one of its stages. */
public class LayoutException extends RuntimeException {
    private final LayoutStage stage;

    public LayoutException(LayoutStage stage, Throwable cause) {
        super("Layout failed in stage " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public LayoutStage stage() {
        return stage;
    }
}
