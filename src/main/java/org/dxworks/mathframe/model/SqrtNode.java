package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * A radical: a stroked root sign over the radicand, with an optional index
 * (the degree) tucked in front of the stroke.
 */
public final class SqrtNode extends MathNode {
    private static final int CLEARANCE = 5;

    public final MathNode radicand;
    public final MathNode index;

    public SqrtNode(MathNode radicand, MathNode index) {
        this.radicand = radicand;
        this.index = index;
    }

    @Override
    public void measure(Renderer renderer) {
        radicand.measure(renderer);
        width = radicand.width + 15;
        height = radicand.height + CLEARANCE;
        ascent = radicand.ascent + CLEARANCE;
        if (index != null) {
            index.measure(renderer);
            width += Math.max(0, index.width - 5);
            ascent = Math.max(ascent, index.height + CLEARANCE);
            height = Math.max(height, ascent + radicand.descent());
        }
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        int strokeX = x;
        if (index != null) {
            index.draw(renderer, x, y);
            strokeX += Math.max(5, index.width);
        }

        int overbarY = y + (ascent - radicand.ascent - CLEARANCE);
        radicand.draw(renderer, strokeX + 10, overbarY + CLEARANCE);

        int bottomY = y + ascent + radicand.descent();
        renderer.drawLine(strokeX, bottomY - (bottomY - overbarY) / 2, strokeX + 5, bottomY);
        renderer.drawLine(strokeX + 5, bottomY, strokeX + 10, overbarY);
        renderer.drawLine(strokeX + 10, overbarY, strokeX + radicand.width + 15, overbarY);
    }
}
