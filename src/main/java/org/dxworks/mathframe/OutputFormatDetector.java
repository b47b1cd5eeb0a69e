package org.dxworks.mathframe;

import java.nio.file.Path;
import java.util.Optional;

public class OutputFormatDetector {

    public static Optional<OutputFormat> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();
        for (OutputFormat format : OutputFormat.values()) {
            if (format.matchesFileName(fileName)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
