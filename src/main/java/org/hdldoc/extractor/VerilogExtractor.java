package org.hdldoc.extractor;

import com.typesafe.config.Config;
import org.hdldoc.parser.VerilogParser;
import org.hdldoc.parser.api.HdlObject;
import org.hdldoc.parser.api.HdlParseException;
import org.hdldoc.parser.api.IHdlParser;
import org.hdldoc.parser.api.VerilogModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Extracts documentation objects from Verilog files and caches the result per file.
 * <p>
 * The cache is keyed by the normalized absolute path of the file and holds at most
 * {@code cacheSize} files; the least recently used entry is evicted first. Failed parses
 * are never cached. Extraction from an in-memory source always bypasses the cache.
 * <p>
 * This class is thread-safe. Two threads that miss the cache for the same file at the
 * same time may both parse it; the later result wins.
 */
public class VerilogExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(VerilogExtractor.class);

    public static final int DEFAULT_CACHE_SIZE = 64;
    private static final String CACHE_SIZE_PATH = "hdldoc.extractor.cache-size";

    private final IHdlParser parser;
    private final int cacheSize;
    private final Map<Path, List<VerilogModule>> cache;

    public VerilogExtractor() {
        this(new VerilogParser(), DEFAULT_CACHE_SIZE);
    }

    /**
     * @param parser The parser used on a cache miss.
     * @param cacheSize The maximum number of cached files; 0 disables the cache.
     */
    public VerilogExtractor(IHdlParser parser, int cacheSize) {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("Cache size must not be negative: " + cacheSize);
        }
        this.parser = parser;
        this.cacheSize = cacheSize;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Path, List<VerilogModule>> eldest) {
                return size() > VerilogExtractor.this.cacheSize;
            }
        };
    }

    /**
     * Creates an extractor whose cache size is read from {@code hdldoc.extractor.cache-size}.
     * @param config The application configuration.
     * @return A new extractor backed by a {@link VerilogParser}.
     */
    public static VerilogExtractor fromConfig(Config config) {
        int size = config.hasPath(CACHE_SIZE_PATH) ? config.getInt(CACHE_SIZE_PATH) : DEFAULT_CACHE_SIZE;
        return new VerilogExtractor(new VerilogParser(), size);
    }

    /**
     * Returns all objects of a file, from the cache when possible.
     * @param file The Verilog file.
     * @return The objects of the file in source order.
     * @throws HdlParseException if the file cannot be read or parsed.
     */
    public List<HdlObject> extractObjects(Path file) throws HdlParseException {
        return List.copyOf(modulesOf(file));
    }

    /**
     * Returns the objects of a file that are instances of the given type.
     * @param file The Verilog file.
     * @param type The type to keep.
     * @param <T> The object type.
     * @return The matching objects in source order.
     * @throws HdlParseException if the file cannot be read or parsed.
     */
    public <T extends HdlObject> List<T> extractObjects(Path file, Class<T> type) throws HdlParseException {
        return filter(modulesOf(file), type);
    }

    public List<HdlObject> extractObjectsFromSource(String text) throws HdlParseException {
        return List.copyOf(parser.parse(text));
    }

    public <T extends HdlObject> List<T> extractObjectsFromSource(String text, Class<T> type)
            throws HdlParseException {
        return filter(parser.parse(text), type);
    }

    /**
     * @param dataType A port or parameter type such as {@code "wire [7:0]"}.
     * @return {@code true} if the type has a bit range.
     */
    public static boolean isArray(String dataType) {
        return dataType != null && dataType.indexOf('[') >= 0;
    }

    public void clearCache() {
        synchronized (cache) {
            cache.clear();
        }
    }

    public int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private List<VerilogModule> modulesOf(Path file) throws HdlParseException {
        Path key = file.toAbsolutePath().normalize();
        synchronized (cache) {
            List<VerilogModule> cached = cache.get(key);
            if (cached != null) {
                LOG.debug("Cache hit for {}", key);
                return cached;
            }
        }
        LOG.debug("Cache miss for {}, parsing", key);
        List<VerilogModule> modules = parser.parseFile(key);
        if (cacheSize > 0) {
            synchronized (cache) {
                cache.put(key, modules);
            }
        }
        return modules;
    }

    private static <T extends HdlObject> List<T> filter(List<? extends HdlObject> objects, Class<T> type) {
        return objects.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toUnmodifiableList());
    }
}
