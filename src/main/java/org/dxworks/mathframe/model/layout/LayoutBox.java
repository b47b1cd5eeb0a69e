package org.dxworks.mathframe.model.layout;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Serializable view of one measured node.
 */
@JsonPropertyOrder({"type", "role", "text", "italic", "fontSize", "offset", "left", "right",
        "width", "height", "ascent", "children"})
public class LayoutBox {
    public String type; // row, text, fraction, script, big_operator, integral, sqrt, fence
    public String role; // slot in the parent: numerator, denominator, base, superscript, subscript, upper, lower, radicand, index, content
    public String text; // text nodes and operator glyphs
    public Boolean italic; // text nodes only
    public Integer fontSize;
    public Integer offset; // kerning offset, when non-zero
    public String left; // fence delimiters
    public String right;
    public int width;
    public int height;
    public int ascent;
    public List<LayoutBox> children; // null for leaves
}
