package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * An enlarged integral sign with its bounds set beside the glyph, not above and below it.
 */
public final class IntegralNode extends MathNode {
    public static final String GLYPH = "∫";
    private static final int LIMIT_INSET = 2;

    public final int fontSize;
    public MathNode lower;
    public MathNode upper;

    public IntegralNode(int fontSize) {
        this.fontSize = fontSize;
    }

    public int glyphSize() {
        return fontSize * 3 / 2;
    }

    @Override
    public void measure(Renderer renderer) {
        selectGlyphFont(renderer);
        int glyphWidth = renderer.textWidth(GLYPH);
        int glyphHeight = renderer.textHeight();

        int limitsWidth = 0;
        int limitsHeight = 0;
        if (upper != null) {
            upper.measure(renderer);
            limitsWidth = Math.max(limitsWidth, upper.width);
            limitsHeight += upper.height;
        }
        if (lower != null) {
            lower.measure(renderer);
            limitsWidth = Math.max(limitsWidth, lower.width);
            limitsHeight += lower.height;
        }

        width = glyphWidth + limitsWidth + 4;
        height = Math.max(glyphHeight, limitsHeight);
        ascent = glyphHeight / 2;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        selectGlyphFont(renderer);
        int glyphWidth = renderer.textWidth(GLYPH);
        int glyphHeight = renderer.textHeight();

        int glyphY = y + (ascent - glyphHeight / 2);
        renderer.drawText(x, glyphY, GLYPH);

        int limitX = x + glyphWidth + LIMIT_INSET;
        if (upper != null) {
            upper.draw(renderer, limitX, glyphY + LIMIT_INSET);
        }
        if (lower != null) {
            lower.draw(renderer, limitX, glyphY + glyphHeight - lower.height - LIMIT_INSET);
        }
    }

    private void selectGlyphFont(Renderer renderer) {
        renderer.setFontSize(glyphSize());
        renderer.setFontStyle(false);
    }
}
