package org.dxworks.mathframe.renderer;

/**
 * Font-free metrics: every character is half the font size wide and a line is
 * exactly one font size high. Drawing calls are ignored.
 */
public class FixedMetricsRenderer implements Renderer {
    protected int fontSize = 20;
    protected boolean italic;

    @Override
    public void setFontSize(int size) {
        fontSize = size;
    }

    @Override
    public void setFontStyle(boolean italic) {
        this.italic = italic;
    }

    @Override
    public void drawLine(int x1, int y1, int x2, int y2) {
    }

    @Override
    public void drawText(int x, int y, String text) {
    }

    @Override
    public int textWidth(String text) {
        return text.length() * fontSize / 2;
    }

    @Override
    public int textHeight() {
        return fontSize;
    }
}
