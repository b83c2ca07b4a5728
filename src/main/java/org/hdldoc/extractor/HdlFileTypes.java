package org.hdldoc.extractor;

import com.typesafe.config.Config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Recognizes Verilog source files by their extension. Extensions are compared
 * case-insensitively and include the leading dot.
 */
public final class HdlFileTypes {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".v", ".vlog");
    private static final String EXTENSIONS_PATH = "hdldoc.extractor.extensions";

    private final List<String> extensions;

    /**
     * @param extensions The recognized extensions, for example {@code ".v"}.
     */
    public HdlFileTypes(List<String> extensions) {
        if (extensions.isEmpty()) {
            throw new IllegalArgumentException("At least one file extension is required");
        }
        this.extensions = extensions.stream()
                .map(e -> (e.startsWith(".") ? e : "." + e).toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    public static HdlFileTypes defaults() {
        return new HdlFileTypes(DEFAULT_EXTENSIONS);
    }

    /**
     * Reads the extensions from {@code hdldoc.extractor.extensions}, falling back to
     * the defaults when the path is absent.
     * @param config The application configuration.
     * @return The file type matcher.
     */
    public static HdlFileTypes fromConfig(Config config) {
        if (!config.hasPath(EXTENSIONS_PATH)) {
            return defaults();
        }
        return new HdlFileTypes(config.getStringList(EXTENSIONS_PATH));
    }

    public boolean isVerilog(Path file) {
        Path fileName = file.getFileName();
        return fileName != null && isVerilog(fileName.toString());
    }

    public boolean isVerilog(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    public List<String> extensions() {
        return extensions;
    }
}
