package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * A literal run of text: a number, a variable, an operator or a symbol.
 * An empty text with a horizontal offset acts as a kerning space.
 */
public final class TextNode extends MathNode {
    public final String text;
    public final boolean italic;
    public final int fontSize;
    public final int horizontalOffset;

    public TextNode(String text, boolean italic, int fontSize) {
        this(text, italic, fontSize, 0);
    }

    public TextNode(String text, boolean italic, int fontSize, int horizontalOffset) {
        this.text = text;
        this.italic = italic;
        this.fontSize = fontSize;
        this.horizontalOffset = horizontalOffset;
    }

    @Override
    public void measure(Renderer renderer) {
        renderer.setFontSize(fontSize);
        renderer.setFontStyle(italic);
        width = renderer.textWidth(text) + horizontalOffset;
        height = renderer.textHeight();
        ascent = height * 8 / 10;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        renderer.setFontSize(fontSize);
        renderer.setFontStyle(italic);
        renderer.drawText(x + horizontalOffset, y, text);
    }
}
