package org.dxworks.mathframe.model;

import org.dxworks.mathframe.renderer.Renderer;

/**
 * A base with an optional superscript and an optional subscript.
 * Either script may be null; with both missing the node lays out as its base.
 */
public final class ScriptNode extends MathNode {
    public final MathNode base;
    public MathNode superscript;
    public MathNode subscript;

    public ScriptNode(MathNode base) {
        this.base = base;
    }

    @Override
    public void measure(Renderer renderer) {
        base.measure(renderer);
        ascent = base.ascent;

        int scriptWidth = 0;
        if (superscript != null) {
            superscript.measure(renderer);
            scriptWidth = Math.max(scriptWidth, superscript.width);
            // the superscript straddles the base's half-ascent line
            ascent = Math.max(ascent, superscript.height + base.ascent / 2);
        }
        // base is pushed down by however much the superscript raised the ascent
        height = ascent + base.descent();
        if (subscript != null) {
            subscript.measure(renderer);
            scriptWidth = Math.max(scriptWidth, subscript.width);
            height = Math.max(height, subscript.height + ascent);
        }
        width = base.width + scriptWidth;
    }

    @Override
    public void draw(Renderer renderer, int x, int y) {
        int baseY = y + (ascent - base.ascent);
        base.draw(renderer, x, baseY);

        int scriptX = x + base.width;
        if (superscript != null) {
            superscript.draw(renderer, scriptX, baseY - superscript.height / 2);
        }
        if (subscript != null) {
            subscript.draw(renderer, scriptX, baseY + base.descent() + subscript.height / 10);
        }
    }
}
