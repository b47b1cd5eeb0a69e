package org.dxworks.mathframe.renderer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SvgRendererTest {

    @Test
    void drawText_UsesBaselineAndCurrentFont() {
        SvgRenderer svg = new SvgRenderer(new FixedMetricsRenderer(), "Serif", 20, 2);
        svg.setFontSize(30);
        svg.setFontStyle(true);
        svg.drawText(4, 10, "x&y");

        assertEquals("<text x=\"4\" y=\"34\" font-family=\"Serif\" font-style=\"italic\" font-size=\"30\">x&amp;y</text>\n",
                svg.getContent());
    }

    @Test
    void drawText_SkipsEmptyText() {
        SvgRenderer svg = new SvgRenderer(new FixedMetricsRenderer(), "Serif", 20, 1.5);
        svg.drawText(0, 0, "");
        assertEquals("", svg.getContent());
    }

    @Test
    void metrics_FollowFontSettings() {
        SvgRenderer svg = new SvgRenderer(new FixedMetricsRenderer(), "Serif", 20, 1.5);
        svg.setFontSize(10);
        assertEquals(15, svg.textWidth("abc"));
        assertEquals(10, svg.textHeight());
    }

    @Test
    void formatNumber_DropsTrailingZero() {
        assertEquals("2", SvgRenderer.formatNumber(2.0));
        assertEquals("1.5", SvgRenderer.formatNumber(1.5));
    }
}
