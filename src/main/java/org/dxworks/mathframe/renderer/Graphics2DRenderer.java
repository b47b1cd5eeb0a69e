package org.dxworks.mathframe.renderer;

import java.awt.BasicStroke;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Renderer over a Java2D surface. Also serves as the text-metrics source for
 * backends that cannot measure text themselves.
 */
public class Graphics2DRenderer implements Renderer {

    static final String REFERENCE_TEXT = "Tg";

    private final Graphics2D graphics;
    private final String fontFamily;
    private int fontSize;
    private boolean italic;

    public Graphics2DRenderer(Graphics2D graphics, String fontFamily, int fontSize, float strokeWidth) {
        this.graphics = graphics;
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.italic = false;
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        graphics.setStroke(new BasicStroke(strokeWidth));
        updateFont();
    }

    /**
     * A metrics-only renderer backed by a scratch image; drawing calls land on
     * the scratch image and are discarded.
     */
    public static Graphics2DRenderer forMeasurement(String fontFamily, int fontSize) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        return new Graphics2DRenderer(scratch.createGraphics(), fontFamily, fontSize, 1f);
    }

    private void updateFont() {
        graphics.setFont(new Font(fontFamily, italic ? Font.ITALIC : Font.PLAIN, fontSize));
    }

    @Override
    public void setFontSize(int size) {
        if (size == fontSize) {
            return;
        }
        fontSize = size;
        updateFont();
    }

    @Override
    public void setFontStyle(boolean italic) {
        if (italic == this.italic) {
            return;
        }
        this.italic = italic;
        updateFont();
    }

    @Override
    public void drawLine(int x1, int y1, int x2, int y2) {
        graphics.drawLine(x1, y1, x2, y2);
    }

    @Override
    public void drawText(int x, int y, String text) {
        if (text.isEmpty()) {
            return;
        }
        FontMetrics metrics = graphics.getFontMetrics();
        graphics.drawString(text, x, y + metrics.getAscent());
    }

    @Override
    public int textWidth(String text) {
        return graphics.getFontMetrics().stringWidth(text);
    }

    @Override
    public int textHeight() {
        FontMetrics metrics = graphics.getFontMetrics();
        return (int) Math.round(metrics.getStringBounds(REFERENCE_TEXT, graphics).getHeight());
    }

    public void dispose() {
        graphics.dispose();
    }
}
