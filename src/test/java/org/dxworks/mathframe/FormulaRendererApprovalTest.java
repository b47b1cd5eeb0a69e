package org.dxworks.mathframe;

import org.approvaltests.Approvals;
import org.dxworks.mathframe.renderer.FixedMetricsRenderer;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class FormulaRendererApprovalTest {

    private static final FormulaRenderer RENDERER = new FormulaRenderer(
            MathframeConfig.with(20, 10, "Serif", 1.5, "white"), FixedMetricsRenderer::new);

    @Test
    void describe_Superscript() throws IOException {
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(RENDERER.describe("x^2")) + "\n");
    }

    @Test
    void svg_Fraction() {
        Approvals.verify(RENDERER.toSvg("\\frac{1}{x}"));
    }

    @Test
    void svg_Sqrt() {
        Approvals.verify(RENDERER.toSvg("\\sqrt{x}"));
    }

    @Test
    void svg_Fence() {
        Approvals.verify(RENDERER.toSvg("\\left(x\\right)"));
    }
}
