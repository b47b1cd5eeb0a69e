package org.dxworks.mathframe.renderer;

/**
 * Emits SVG {@code <line>} and {@code <text>} elements into a buffer.
 * Text metrics come from a delegate renderer kept at the same font settings.
 */
public class SvgRenderer implements Renderer {

    private final Renderer metrics;
    private final String fontFamily;
    private final String strokeWidth;
    private final StringBuilder buffer = new StringBuilder();
    private int fontSize;
    private boolean italic;

    public SvgRenderer(Renderer metrics, String fontFamily, int fontSize, double strokeWidth) {
        this.metrics = metrics;
        this.fontFamily = fontFamily;
        this.fontSize = fontSize;
        this.strokeWidth = formatNumber(strokeWidth);
        metrics.setFontSize(fontSize);
        metrics.setFontStyle(false);
    }

    public String getContent() {
        return buffer.toString();
    }

    @Override
    public void setFontSize(int size) {
        fontSize = size;
        metrics.setFontSize(size);
    }

    @Override
    public void setFontStyle(boolean italic) {
        this.italic = italic;
        metrics.setFontStyle(italic);
    }

    @Override
    public void drawLine(int x1, int y1, int x2, int y2) {
        buffer.append("<line x1=\"").append(x1)
                .append("\" y1=\"").append(y1)
                .append("\" x2=\"").append(x2)
                .append("\" y2=\"").append(y2)
                .append("\" stroke=\"black\" stroke-width=\"").append(strokeWidth).append("\" />\n");
    }

    @Override
    public void drawText(int x, int y, String text) {
        if (text.isEmpty()) {
            return;
        }
        int baselineY = y + fontSize * 8 / 10;
        buffer.append("<text x=\"").append(x)
                .append("\" y=\"").append(baselineY)
                .append("\" font-family=\"").append(escape(fontFamily))
                .append("\" font-style=\"").append(italic ? "italic" : "normal")
                .append("\" font-size=\"").append(fontSize)
                .append("\">").append(escape(text)).append("</text>\n");
    }

    @Override
    public int textWidth(String text) {
        return metrics.textWidth(text);
    }

    @Override
    public int textHeight() {
        return metrics.textHeight();
    }

    public static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
