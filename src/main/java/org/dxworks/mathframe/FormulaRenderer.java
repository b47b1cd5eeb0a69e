package org.dxworks.mathframe;

import org.dxworks.mathframe.model.RowNode;
import org.dxworks.mathframe.model.layout.LayoutBox;
import org.dxworks.mathframe.model.layout.LayoutBoxBuilder;
import org.dxworks.mathframe.parser.FormulaParser;
import org.dxworks.mathframe.renderer.Graphics2DRenderer;
import org.dxworks.mathframe.renderer.Renderer;
import org.dxworks.mathframe.renderer.SvgRenderer;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.function.Supplier;

/**
 * Runs parse, measure and draw for one formula and frames the result.
 * A fresh metrics renderer is taken from the supplier on every call.
 */
public class FormulaRenderer {

    private final MathframeConfig config;
    private final Supplier<Renderer> metricsSupplier;

    public FormulaRenderer(MathframeConfig config) {
        this(config, () -> Graphics2DRenderer.forMeasurement(config.getFontFamily(), config.getBaseFontSize()));
    }

    public FormulaRenderer(MathframeConfig config, Supplier<Renderer> metricsSupplier) {
        this.config = config;
        this.metricsSupplier = metricsSupplier;
    }

    public RowNode layout(String markup) {
        RowNode root = FormulaParser.parse(markup, config.getBaseFontSize());
        root.measure(metricsSupplier.get());
        return root;
    }

    public LayoutBox describe(String markup) {
        return LayoutBoxBuilder.build(layout(markup));
    }

    public String toSvg(String markup) {
        SvgRenderer svg = new SvgRenderer(metricsSupplier.get(), config.getFontFamily(),
                config.getBaseFontSize(), config.getStrokeWidth());
        RowNode root = FormulaParser.parse(markup, config.getBaseFontSize());
        root.measure(svg);

        int padding = config.getPadding();
        int totalWidth = root.width + padding * 2;
        int totalHeight = root.height + padding * 2;
        root.draw(svg, padding, padding);

        return "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"" + totalWidth
                + "\" height=\"" + totalHeight
                + "\" viewBox=\"0 0 " + totalWidth + " " + totalHeight + "\">\n"
                + "<rect width=\"100%\" height=\"100%\" fill=\"" + SvgRenderer.escape(config.getBackground()) + "\" />\n"
                + svg.getContent()
                + "</svg>\n";
    }

    public BufferedImage toImage(String markup) {
        // sized from the scratch metrics; the same font settings give the same boxes on the image
        RowNode root = layout(markup);

        int padding = config.getPadding();
        int totalWidth = Math.max(1, root.width + padding * 2);
        int totalHeight = Math.max(1, root.height + padding * 2);

        BufferedImage image = new BufferedImage(totalWidth, totalHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = image.createGraphics();
        Color background = parseColor(config.getBackground());
        if (background != null) {
            graphics.setColor(background);
            graphics.fillRect(0, 0, totalWidth, totalHeight);
        }
        graphics.setColor(Color.BLACK);

        Graphics2DRenderer renderer = new Graphics2DRenderer(graphics, config.getFontFamily(),
                config.getBaseFontSize(), (float) config.getStrokeWidth());
        try {
            paint(root, renderer, padding);
        } finally {
            renderer.dispose();
        }
        return image;
    }

    /**
     * Measures on the renderer that draws, so box sizes always match the
     * metrics of the surface being painted.
     */
    static void paint(RowNode root, Renderer renderer, int padding) {
        root.measure(renderer);
        root.draw(renderer, padding, padding);
    }

    /**
     * Accepts {@code #rrggbb}, {@code none}/{@code transparent} (no fill) and
     * falls back to white for named colors.
     */
    static Color parseColor(String value) {
        if (value == null || value.equalsIgnoreCase("none") || value.equalsIgnoreCase("transparent")) {
            return null;
        }
        if (value.startsWith("#")) {
            try {
                return Color.decode(value);
            } catch (NumberFormatException e) {
                System.err.println("[FormulaRenderer] Invalid background color " + value + ", using white");
            }
        }
        return Color.WHITE;
    }
}
