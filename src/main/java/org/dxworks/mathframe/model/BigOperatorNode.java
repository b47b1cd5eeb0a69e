package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * A large operator glyph with limits stacked above and below it.
 * Textual operators such as {@code lim} keep the surrounding font size.
 */
public final class BigOperatorNode extends MathNode {
    public final String symbol;
    public final int fontSize;
    public final boolean textOperator;
    public MathNode lower;
    public MathNode upper;

    public BigOperatorNode(String symbol, int fontSize, boolean textOperator) {
        this.symbol = symbol;
        this.fontSize = fontSize;
        this.textOperator = textOperator;
    }

    public int glyphSize() {
        return textOperator ? fontSize : fontSize * 3 / 2;
    }

    @Override
    public void measure(Renderer renderer) {
        selectGlyphFont(renderer);
        int glyphWidth = renderer.textWidth(symbol);
        int glyphHeight = renderer.textHeight();

        int lowerWidth = 0;
        int lowerHeight = 0;
        int upperWidth = 0;
        int upperHeight = 0;
        if (lower != null) {
            lower.measure(renderer);
            lowerWidth = lower.width;
            lowerHeight = lower.height;
        }
        if (upper != null) {
            upper.measure(renderer);
            upperWidth = upper.width;
            upperHeight = upper.height;
        }

        width = Math.max(glyphWidth, Math.max(lowerWidth, upperWidth)) + 4;
        int glyphAscent = glyphHeight * 8 / 10;
        ascent = upperHeight + glyphAscent;
        height = ascent + (glyphHeight - glyphAscent) + lowerHeight;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        int midX = x + width / 2;
        if (upper != null) {
            upper.draw(renderer, midX - upper.width / 2, y);
        }

        selectGlyphFont(renderer);
        int glyphWidth = renderer.textWidth(symbol);
        int glyphHeight = renderer.textHeight();
        int glyphY = y + (upper != null ? upper.height : 0);
        renderer.drawText(midX - glyphWidth / 2, glyphY, symbol);

        if (lower != null) {
            lower.draw(renderer, midX - lower.width / 2, glyphY + glyphHeight);
        }
    }

    private void selectGlyphFont(Renderer renderer) {
        renderer.setFontSize(glyphSize());
        renderer.setFontStyle(false);
    }
}
