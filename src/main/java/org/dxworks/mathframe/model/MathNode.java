package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * Base of the typeset node tree.
 * <p>
 * The box fields are only meaningful after {@link #measure(Renderer)} ran.
 * {@code ascent} is the distance from the top of the box to the baseline,
 * {@code height - ascent} the distance from the baseline to the bottom.
 * {@link #draw(Renderer, int, int)} receives the top-left corner of the box.
 */
public abstract sealed class MathNode
        permits RowNode, TextNode, FractionNode, ScriptNode, BigOperatorNode, IntegralNode, SqrtNode, ScalingFenceNode {

    public int width;
    public int height;
    public int ascent;

    public abstract void measure(Renderer renderer);

    public abstract void draw(Renderer renderer, int x, int y);

    public int descent() {
        return height - ascent;
    }
}
