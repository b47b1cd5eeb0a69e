package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Children laid out left to right on one shared baseline.
 */
public final class RowNode extends MathNode {
    public final List<MathNode> children = new ArrayList<>();

    public void add(MathNode node) {
        children.add(node);
    }

    @Override
    public void measure(Renderer renderer) {
        int totalWidth = 0;
        int maxAscent = 0;
        int maxDescent = 0;
        for (MathNode child : children) {
            child.measure(renderer);
            totalWidth += child.width;
            maxAscent = Math.max(maxAscent, child.ascent);
            maxDescent = Math.max(maxDescent, child.descent());
        }
        // negative kerning may pull the sum below zero
        width = Math.max(0, totalWidth);
        ascent = maxAscent;
        height = maxAscent + maxDescent;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        int currentX = x;
        for (MathNode child : children) {
            child.draw(renderer, currentX, y + (ascent - child.ascent));
            currentX += child.width;
        }
    }
}
