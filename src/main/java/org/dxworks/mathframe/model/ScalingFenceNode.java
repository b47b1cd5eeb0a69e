package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * Content between a pair of delimiters stroked to the full height of the content.
 * Delimiters other than {@code | ( ) [ ]} are accepted and draw nothing.
 */
public final class ScalingFenceNode extends MathNode {
    private static final int MARGIN = 7;

    public final MathNode content;
    public final String left;
    public final String right;

    public ScalingFenceNode(MathNode content, String left, String right) {
        this.content = content;
        this.left = left;
        this.right = right;
    }

    @Override
    public void measure(Renderer renderer) {
        content.measure(renderer);
        width = content.width + 2 * MARGIN;
        height = content.height;
        ascent = content.ascent;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        content.draw(renderer, x + MARGIN, y);
        int h = height;

        switch (left) {
            case "|" -> renderer.drawLine(x + 2, y, x + 2, y + h);
            case "(" -> {
                renderer.drawLine(x + 5, y, x + 1, y + h / 2);
                renderer.drawLine(x + 1, y + h / 2, x + 5, y + h);
            }
            case "[" -> {
                renderer.drawLine(x + 5, y, x + 5, y + h);
                renderer.drawLine(x + 5, y, x + 10, y);
                renderer.drawLine(x + 5, y + h, x + 10, y + h);
            }
            default -> {
            }
        }

        int r = x + width;
        switch (right) {
            case "|" -> renderer.drawLine(r - 2, y, r - 2, y + h);
            case ")" -> {
                renderer.drawLine(r - 5, y, r - 1, y + h / 2);
                renderer.drawLine(r - 1, y + h / 2, r - 5, y + h);
            }
            case "]" -> {
                renderer.drawLine(r - 5, y, r - 5, y + h);
                renderer.drawLine(r - 5, y, r - 10, y);
                renderer.drawLine(r - 5, y + h, r - 10, y + h);
            }
            default -> {
            }
        }
    }
}
