package org.dxworks.mathframe;

import org.dxworks.mathframe.model.RowNode;
import org.dxworks.mathframe.parser.FormulaParser;
import org.dxworks.mathframe.renderer.FixedMetricsRenderer;
import org.dxworks.mathframe.renderer.RecordingRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path tempDir;

    @Test
    void detectFormat_ByExtension() {
        assertEquals(Optional.of(OutputFormat.SVG), OutputFormatDetector.detectFormat(Paths.get("out/Formula.SVG")));
        assertEquals(Optional.of(OutputFormat.PNG), OutputFormatDetector.detectFormat(Paths.get("formula.png")));
        assertEquals(Optional.of(OutputFormat.JSON), OutputFormatDetector.detectFormat(Paths.get("boxes.json")));
        assertTrue(OutputFormatDetector.detectFormat(Paths.get("formula.txt")).isEmpty());
    }

    @Test
    void readMarkup_LiteralFormula() throws IOException {
        assertEquals("\\frac{a}{b}", App.readMarkup("\\frac{a}{b}"));
    }

    @Test
    void readMarkup_FromFileJoinsLinesAndDropsBom() throws IOException {
        Path file = tempDir.resolve("formula.tex");
        Files.writeString(file, "\uFEFF\\frac{a}\r\n{b}\n", StandardCharsets.UTF_8);
        assertEquals("\\frac{a}{b}", App.readMarkup(file.toString()));
    }

    @Test
    void readMarkup_KeepsSpacesAtLineEdges() throws IOException {
        Path file = tempDir.resolve("spaced.tex");
        Files.writeString(file, "a \n b\n", StandardCharsets.UTF_8);
        assertEquals("a  b", App.readMarkup(file.toString()));
    }

    @Test
    void layout_UsesConfiguredBaseFontSize() {
        FormulaRenderer renderer = new FormulaRenderer(MathframeConfig.with(40, 0, null, 0, null), FixedMetricsRenderer::new);
        assertEquals(40, renderer.layout("x").height);
    }

    @Test
    void toSvg_EscapesMarkupCharacters() {
        FormulaRenderer renderer = new FormulaRenderer(MathframeConfig.with(20, 0, "Serif", 1, "white"), FixedMetricsRenderer::new);
        String svg = renderer.toSvg("a<b");
        assertTrue(svg.contains(">&lt;</text>"), svg);
        assertTrue(svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"30\" height=\"20\""), svg);
    }

    @Test
    void toSvg_KeepsSupplementaryCharactersWhole() {
        FormulaRenderer renderer = new FormulaRenderer(MathframeConfig.with(20, 0, "Serif", 1, "white"), FixedMetricsRenderer::new);
        String svg = renderer.toSvg("a+\uD835\uDC65");
        assertTrue(svg.contains(">\uD835\uDC65</text>"), svg);
        assertTrue(StandardCharsets.UTF_8.newEncoder().canEncode(svg), svg);
    }

    @Test
    void toSvg_EscapesBackground() {
        FormulaRenderer renderer = new FormulaRenderer(MathframeConfig.with(20, 0, "Serif", 1, "a\"&b"), FixedMetricsRenderer::new);
        assertTrue(renderer.toSvg("x").contains("fill=\"a&quot;&amp;b\""));
    }

    @Test
    void paint_MeasuresOnTheDrawingRenderer() {
        RowNode root = FormulaParser.parse("\\frac{1}{x}", 20);
        RecordingRenderer recording = new RecordingRenderer();
        FormulaRenderer.paint(root, recording, 0);
        assertEquals(List.of("0,22 20,22"), recording.lines);
        assertEquals(List.of("5,0 20 1", "5,24 20i x"), recording.texts);
    }

    @Test
    void parseColor_Variants() {
        assertNull(FormulaRenderer.parseColor("none"));
        assertEquals(0xfafafa, FormulaRenderer.parseColor("#fafafa").getRGB() & 0xffffff);
        assertEquals(java.awt.Color.WHITE, FormulaRenderer.parseColor("white"));
        assertEquals(java.awt.Color.WHITE, FormulaRenderer.parseColor("#zz"));
    }
}
