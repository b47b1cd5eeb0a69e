package org.dxworks.mathframe;

public enum OutputFormat {
    SVG("svg"),
    PNG("png"),
    JSON("json");

    private final String name;

    OutputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        return fileName.endsWith("." + name);
    }
}
