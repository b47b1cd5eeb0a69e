package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

public final class FractionNode extends MathNode {
    private static final int GUTTER = 10;
    private static final int BAR_GAP = 2;

    public final MathNode numerator;
    public final MathNode denominator;
    public final int fontSize;

    public FractionNode(MathNode numerator, MathNode denominator, int fontSize) {
        this.numerator = numerator;
        this.denominator = denominator;
        this.fontSize = fontSize;
    }

    @Override
    public void measure(Renderer renderer) {
        numerator.measure(renderer);
        denominator.measure(renderer);
        width = Math.max(numerator.width, denominator.width) + GUTTER;
        height = numerator.height + denominator.height + 2 * BAR_GAP;
        ascent = numerator.height + BAR_GAP;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        int midX = x + width / 2;
        numerator.draw(renderer, midX - numerator.width / 2, y);
        int barY = y + numerator.height + BAR_GAP;
        renderer.drawLine(x, barY, x + width, barY);
        denominator.draw(renderer, midX - denominator.width / 2, barY + BAR_GAP);
    }
}
