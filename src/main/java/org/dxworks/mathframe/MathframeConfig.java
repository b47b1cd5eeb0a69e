package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MathframeConfig {

    private static final String CONFIG_FILE_NAME = "mathframe-config.yml";
    private static final int DEFAULT_BASE_FONT_SIZE = 28;
    private static final int DEFAULT_PADDING = 50;
    private static final String DEFAULT_FONT_FAMILY = "Times New Roman";
    private static final double DEFAULT_STROKE_WIDTH = 1.5;
    private static final String DEFAULT_BACKGROUND = "white";

    private final int baseFontSize;
    private final int padding;
    private final String fontFamily;
    private final double strokeWidth;
    private final String background;

    private MathframeConfig(int baseFontSize, int padding, String fontFamily, double strokeWidth, String background) {
        this.baseFontSize = baseFontSize;
        this.padding = padding;
        this.fontFamily = fontFamily;
        this.strokeWidth = strokeWidth;
        this.background = background;
    }

    public int getBaseFontSize() {
        return baseFontSize;
    }

    public int getPadding() {
        return padding;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public double getStrokeWidth() {
        return strokeWidth;
    }

    public String getBackground() {
        return background;
    }

    public static MathframeConfig defaults() {
        return new MathframeConfig(DEFAULT_BASE_FONT_SIZE, DEFAULT_PADDING, DEFAULT_FONT_FAMILY,
                DEFAULT_STROKE_WIDTH, DEFAULT_BACKGROUND);
    }

    public static MathframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MathframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.baseFontSize != null ? yamlConfig.baseFontSize : 0,
                        yamlConfig.padding != null ? yamlConfig.padding : -1,
                        yamlConfig.fontFamily,
                        yamlConfig.strokeWidth != null ? yamlConfig.strokeWidth : 0,
                        yamlConfig.background);
            }
        } catch (IOException e) {
            System.err.println("[MathframeConfig] Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static MathframeConfig with(int baseFontSize, int padding, String fontFamily,
                                       double strokeWidth, String background) {
        int effectiveBaseFontSize = baseFontSize > 0 ? baseFontSize : DEFAULT_BASE_FONT_SIZE;
        int effectivePadding = padding >= 0 ? padding : DEFAULT_PADDING;
        String effectiveFontFamily = (fontFamily != null && !fontFamily.isBlank()) ? fontFamily : DEFAULT_FONT_FAMILY;
        double effectiveStrokeWidth = strokeWidth > 0 ? strokeWidth : DEFAULT_STROKE_WIDTH;
        String effectiveBackground = (background != null && !background.isBlank()) ? background : DEFAULT_BACKGROUND;
        return new MathframeConfig(effectiveBaseFontSize, effectivePadding, effectiveFontFamily,
                effectiveStrokeWidth, effectiveBackground);
    }

    private static class YamlConfig {
        public Integer baseFontSize;
        public Integer padding;
        public String fontFamily;
        public Double strokeWidth;
        public String background;
    }
}
