package org.hdldoc.extractor;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hdldoc.parser.api.HdlObject;
import org.hdldoc.parser.api.HdlParseException;
import org.hdldoc.parser.api.IHdlParser;
import org.hdldoc.parser.api.ParseErrorCode;
import org.hdldoc.parser.api.VerilogModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link VerilogExtractor}. The cache behavior is tested against
 * a mocked parser; the end-to-end cases use the real one.
 */
@ExtendWith(MockitoExtension.class)
public class VerilogExtractorTest {

    @TempDir
    Path tempDir;

    @Mock
    private IHdlParser parser;

    private Path fileA;
    private Path fileB;

    @BeforeEach
    void setUp() throws Exception {
        fileA = Files.writeString(tempDir.resolve("a.v"), "module a; endmodule\n");
        fileB = Files.writeString(tempDir.resolve("b.v"), "module b; endmodule\n");
    }

    private static List<VerilogModule> modules(String name) {
        return List.of(new VerilogModule(name, null, null, null, null, null));
    }

    /**
     * Verifies that a second extraction of the same file, even through a different but
     * equivalent path, is served from the cache.
     */
    @Test
    @Tag("unit")
    void repeatedExtractionUsesCache() throws Exception {
        // Arrange
        when(parser.parseFile(fileA.toAbsolutePath().normalize())).thenReturn(modules("a"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 4);

        // Act
        List<HdlObject> first = extractor.extractObjects(fileA);
        List<HdlObject> second = extractor.extractObjects(tempDir.resolve("sub/../a.v"));

        // Assert
        assertThat(second).isEqualTo(first);
        assertThat(extractor.cacheSize()).isEqualTo(1);
        verify(parser, times(1)).parseFile(any(Path.class));
    }

    /**
     * Verifies that the least recently used file is evicted when the cache is full.
     */
    @Test
    @Tag("unit")
    void leastRecentlyUsedFileIsEvicted() throws Exception {
        // Arrange
        Path fileC = Files.writeString(tempDir.resolve("c.v"), "module c; endmodule\n");
        when(parser.parseFile(any(Path.class))).thenReturn(modules("x"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 2);

        // Act
        extractor.extractObjects(fileA);
        extractor.extractObjects(fileB);
        extractor.extractObjects(fileA);
        extractor.extractObjects(fileC);
        extractor.extractObjects(fileA);
        extractor.extractObjects(fileB);

        // Assert
        assertThat(extractor.cacheSize()).isEqualTo(2);
        verify(parser, times(1)).parseFile(fileA.toAbsolutePath().normalize());
        verify(parser, times(2)).parseFile(fileB.toAbsolutePath().normalize());
    }

    @Test
    @Tag("unit")
    void failuresAreNotCached() throws Exception {
        Path key = fileA.toAbsolutePath().normalize();
        when(parser.parseFile(key))
                .thenThrow(new HdlParseException(ParseErrorCode.LEXICAL_FAILURE, "bad", null))
                .thenReturn(modules("a"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 4);

        assertThatThrownBy(() -> extractor.extractObjects(fileA)).isInstanceOf(HdlParseException.class);
        assertThat(extractor.cacheSize()).isZero();
        assertThat(extractor.extractObjects(fileA)).hasSize(1);
        assertThat(extractor.cacheSize()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void clearCacheForcesReparse() throws Exception {
        when(parser.parseFile(any(Path.class))).thenReturn(modules("a"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 4);

        extractor.extractObjects(fileA);
        extractor.clearCache();
        extractor.extractObjects(fileA);

        assertThat(extractor.cacheSize()).isEqualTo(1);
        verify(parser, times(2)).parseFile(any(Path.class));
    }

    @Test
    @Tag("unit")
    void zeroCacheSizeDisablesCaching() throws Exception {
        when(parser.parseFile(any(Path.class))).thenReturn(modules("a"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 0);

        extractor.extractObjects(fileA);
        extractor.extractObjects(fileA);

        assertThat(extractor.cacheSize()).isZero();
        verify(parser, times(2)).parseFile(any(Path.class));
    }

    @Test
    @Tag("unit")
    void sourceExtractionBypassesCache() throws Exception {
        when(parser.parse("module s; endmodule")).thenReturn(modules("s"));
        VerilogExtractor extractor = new VerilogExtractor(parser, 4);

        List<VerilogModule> found = extractor.extractObjectsFromSource("module s; endmodule", VerilogModule.class);

        assertThat(found).extracting(VerilogModule::name).containsExactly("s");
        assertThat(extractor.cacheSize()).isZero();
        verify(parser, never()).parseFile(any(Path.class));
    }

    /**
     * Verifies the type filter against the real parser: modules pass, other object types do not.
     */
    @Test
    @Tag("unit")
    void typeFilterKeepsMatchingObjects() throws Exception {
        // Arrange
        VerilogExtractor extractor = new VerilogExtractor();

        // Act
        List<VerilogModule> modules = extractor.extractObjects(fileB, VerilogModule.class);
        List<OtherObject> others = extractor.extractObjects(fileB, OtherObject.class);

        // Assert
        assertThat(modules).extracting(VerilogModule::name).containsExactly("b");
        assertThat(others).isEmpty();
    }

    @Test
    @Tag("unit")
    void cacheSizeIsReadFromConfig() throws Exception {
        Config config = ConfigFactory.parseMap(Map.of("hdldoc.extractor.cache-size", 1));
        VerilogExtractor extractor = VerilogExtractor.fromConfig(config);

        extractor.extractObjects(fileA);
        extractor.extractObjects(fileB);

        assertThat(extractor.cacheSize()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void negativeCacheSizeIsRejected() {
        assertThatThrownBy(() -> new VerilogExtractor(parser, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void arrayTypesHaveARange() {
        assertThat(VerilogExtractor.isArray("wire [7:0]")).isTrue();
        assertThat(VerilogExtractor.isArray("reg signed [WIDTH-1:0]")).isTrue();
        assertThat(VerilogExtractor.isArray("wire")).isFalse();
        assertThat(VerilogExtractor.isArray(null)).isFalse();
    }

    private record OtherObject(String name, String description) implements HdlObject {
        @Override
        public String kind() {
            return "other";
        }
    }
}
