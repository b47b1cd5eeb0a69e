package org.dxworks.mathframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mathframe.jar <formula | formula-file> <output-file>");
            System.err.println("  <formula>:      LaTeX-like markup, e.g. \"\\frac{a}{b}\"");
            System.err.println("  <formula-file>: UTF-8 file holding the markup");
            System.err.println("  <output-file>:  Path to the output file");
            System.err.println("Supported outputs: .svg, .png, .json (layout boxes)");
            System.exit(2);
        }

        Path output = Paths.get(args[1]);
        Optional<OutputFormat> formatOpt = OutputFormatDetector.detectFormat(output);
        if (formatOpt.isEmpty()) {
            System.err.println("Error: Unsupported output extension: " + output.getFileName());
            System.exit(2);
        }
        // Create parent directories if they don't exist
        if (output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(output.toAbsolutePath().getParent());
        }

        String markup;
        try {
            markup = readMarkup(args[0]);
        } catch (IOException e) {
            System.err.println("Error: Cannot read formula file " + args[0] + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        MathframeConfig config = MathframeConfig.load();
        OutputFormat format = formatOpt.get();
        System.out.println("Rendering " + format.getName() + ": " + markup);

        try {
            render(markup, format, output, config);
        } catch (IOException e) {
            System.err.println("Error: Failed to write " + output + ": " + e.getMessage());
            System.exit(1);
        }

        System.out.println("Output written to: " + output.toAbsolutePath());
    }

    public static void render(String markup, OutputFormat format, Path output, MathframeConfig config) throws IOException {
        FormulaRenderer renderer = new FormulaRenderer(config);
        switch (format) {
            case SVG -> Files.writeString(output, renderer.toSvg(markup), StandardCharsets.UTF_8);
            case PNG -> {
                if (!ImageIO.write(renderer.toImage(markup), "png", output.toFile())) {
                    throw new IOException("No PNG writer available");
                }
            }
            case JSON -> MAPPER.writeValue(output.toFile(), renderer.describe(markup));
        }
    }

    /**
     * Treats the argument as a file when one exists at that path; lines are
     * joined without their terminators and a leading BOM is dropped.
     */
    static String readMarkup(String argument) throws IOException {
        Path candidate;
        try {
            candidate = Paths.get(argument);
        } catch (InvalidPathException e) {
            return argument;
        }
        if (!Files.isRegularFile(candidate)) {
            return argument;
        }

        List<String> lines = Files.readAllLines(candidate, StandardCharsets.UTF_8);
        String markup = String.join("", lines);
        if (markup.startsWith("\uFEFF")) {
            markup = markup.substring(1);
        }
        return markup;
    }
}
