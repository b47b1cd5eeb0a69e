package org.dxworks.mathframe.renderer;

/**
 * Drawing surface consumed by the node tree.
 * Font size and style are modal: nodes set both before every metric or text call.
 */
public interface Renderer {
    void setFontSize(int size);

    void setFontStyle(boolean italic);

    void drawLine(int x1, int y1, int x2, int y2);

    /**
     * Draws text whose line box has its top-left corner at (x, y).
     */
    void drawText(int x, int y, String text);

    int textWidth(String text);

    /**
     * Line height of the current font, measured on a fixed reference string.
     */
    int textHeight();
}
