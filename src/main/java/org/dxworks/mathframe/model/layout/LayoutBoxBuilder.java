package org.dxworks.mathframe.model.layout;

import org.dxworks.mathframe.model.BigOperatorNode;
import org.dxworks.mathframe.model.FractionNode;
import org.dxworks.mathframe.model.IntegralNode;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.RowNode;
import org.dxworks.mathframe.model.ScalingFenceNode;
import org.dxworks.mathframe.model.ScriptNode;
import org.dxworks.mathframe.model.SqrtNode;
import org.dxworks.mathframe.model.TextNode;

import java.util.ArrayList;

/**
 * Converts a node tree into {@link LayoutBox} snapshots. Box values are copied
 * as they are, so the tree should be measured first.
 */
public final class LayoutBoxBuilder {

    private LayoutBoxBuilder() {
    }

    public static LayoutBox build(MathNode node) {
        return build(node, null);
    }

    private static LayoutBox build(MathNode node, String role) {
        LayoutBox box = new LayoutBox();
        box.role = role;
        box.width = node.width;
        box.height = node.height;
        box.ascent = node.ascent;

        if (node instanceof RowNode row) {
            box.type = "row";
            for (MathNode child : row.children) {
                addChild(box, child, null);
            }
        } else if (node instanceof TextNode text) {
            box.type = "text";
            box.text = text.text;
            box.italic = text.italic;
            box.fontSize = text.fontSize;
            if (text.horizontalOffset != 0) {
                box.offset = text.horizontalOffset;
            }
        } else if (node instanceof FractionNode fraction) {
            box.type = "fraction";
            addChild(box, fraction.numerator, "numerator");
            addChild(box, fraction.denominator, "denominator");
        } else if (node instanceof ScriptNode script) {
            box.type = "script";
            addChild(box, script.base, "base");
            addChild(box, script.superscript, "superscript");
            addChild(box, script.subscript, "subscript");
        } else if (node instanceof BigOperatorNode operator) {
            box.type = "big_operator";
            box.text = operator.symbol;
            box.fontSize = operator.glyphSize();
            addChild(box, operator.upper, "upper");
            addChild(box, operator.lower, "lower");
        } else if (node instanceof IntegralNode integral) {
            box.type = "integral";
            box.text = IntegralNode.GLYPH;
            box.fontSize = integral.glyphSize();
            addChild(box, integral.upper, "upper");
            addChild(box, integral.lower, "lower");
        } else if (node instanceof SqrtNode sqrt) {
            box.type = "sqrt";
            addChild(box, sqrt.index, "index");
            addChild(box, sqrt.radicand, "radicand");
        } else if (node instanceof ScalingFenceNode fence) {
            box.type = "fence";
            box.left = fence.left;
            box.right = fence.right;
            addChild(box, fence.content, "content");
        }
        return box;
    }

    private static void addChild(LayoutBox parent, MathNode child, String role) {
        if (child == null) {
            return;
        }
        if (parent.children == null) {
            parent.children = new ArrayList<>();
        }
        parent.children.add(build(child, role));
    }
}
