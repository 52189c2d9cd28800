package com.schemajenerator.config;

import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.schema.SchemaOutputTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaJeneratorConfigTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Should use standard tier and json files by default")
        void shouldHaveDefaults() {
            SchemaJeneratorConfig config = new SchemaJeneratorConfig();

            assertEquals(SchemaOutputTier.STANDARD, config.getDefaultTier());
            assertFalse(config.isPrettyOutput());
            assertFalse(config.isValidateSchema());
            assertNull(config.outputDirectoryPath());
            assertEquals(List.of("json"), config.getFileExtensions());
        }

        @Test
        @DisplayName("Missing file should yield defaults")
        void missingFileYieldsDefaults() throws Exception {
            SchemaJeneratorConfig config = SchemaJeneratorConfig.load(tempDir.resolve("absent.toml"));
            assertEquals(SchemaOutputTier.STANDARD, config.getDefaultTier());
        }
    }

    @Nested
    @DisplayName("Loading")
    class LoadTests {

        @Test
        @DisplayName("Should read snake_case TOML")
        void shouldReadToml() throws Exception {
            Path file = tempDir.resolve("schema-jenerator.toml");
            Files.writeString(file, String.join("\n",
                    "default_tier = \"Expert\"",
                    "pretty_output = true",
                    "output_directory = \"schemas\"",
                    "file_extensions = [\"json\", \"geojson\"]",
                    ""));

            SchemaJeneratorConfig config = SchemaJeneratorConfig.load(file);

            assertEquals(SchemaOutputTier.EXPERT, config.getDefaultTier());
            assertTrue(config.isPrettyOutput());
            assertFalse(config.isValidateSchema());
            assertEquals(Paths.get("schemas"), config.outputDirectoryPath());
            assertEquals(List.of("json", "geojson"), config.getFileExtensions());
        }

        @Test
        @DisplayName("Should read snake_case JSON and ignore unknown keys")
        void shouldReadJson() throws Exception {
            Path file = tempDir.resolve("config.json");
            Files.writeString(file, "{\"default_tier\":\"basic\",\"validate_schema\":true,\"future_option\":1}");

            SchemaJeneratorConfig config = SchemaJeneratorConfig.load(file);

            assertEquals(SchemaOutputTier.BASIC, config.getDefaultTier());
            assertTrue(config.isValidateSchema());
            assertEquals(List.of("json"), config.getFileExtensions());
        }

        @Test
        @DisplayName("Malformed JSON should be a configuration error")
        void malformedJson() throws Exception {
            Path file = tempDir.resolve("config.json");
            Files.writeString(file, "{\"default_tier\":");

            SchemaJeneratorException e = assertThrows(SchemaJeneratorException.class,
                    () -> SchemaJeneratorConfig.load(file));
            assertEquals(SchemaJeneratorError.ErrorType.CONFIGURATION, e.getErrorType());
            assertTrue(e.getMessage().startsWith("Invalid JSON config"));
        }

        @Test
        @DisplayName("Malformed TOML should be a configuration error")
        void malformedToml() throws Exception {
            Path file = tempDir.resolve("config.toml");
            Files.writeString(file, "default_tier = = \"basic\"\n");

            SchemaJeneratorException e = assertThrows(SchemaJeneratorException.class,
                    () -> SchemaJeneratorConfig.load(file));
            assertEquals(SchemaJeneratorError.ErrorCode.CONFIGURATION_ERROR.getCode(), e.getErrorCode());
            assertTrue(e.getMessage().startsWith("Invalid TOML config"));
        }

        @Test
        @DisplayName("Unknown tier should be a configuration error")
        void unknownTier() throws Exception {
            Path file = tempDir.resolve("config.json");
            Files.writeString(file, "{\"default_tier\":\"ultimate\"}");

            assertThrows(SchemaJeneratorException.class, () -> SchemaJeneratorConfig.load(file));
        }
    }

    @Nested
    @DisplayName("Saving")
    class SaveTests {

        @Test
        @DisplayName("Should round trip through TOML")
        void tomlRoundTrip() throws Exception {
            SchemaJeneratorConfig config = new SchemaJeneratorConfig();
            config.setDefaultTier(SchemaOutputTier.COMPREHENSIVE);
            config.setValidateSchema(true);
            config.setOutputDirectory("out");

            Path file = tempDir.resolve("saved.toml");
            config.save(file);
            SchemaJeneratorConfig loaded = SchemaJeneratorConfig.load(file);

            assertTrue(Files.readString(file).contains("default_tier"));
            assertEquals(SchemaOutputTier.COMPREHENSIVE, loaded.getDefaultTier());
            assertTrue(loaded.isValidateSchema());
            assertEquals("out", loaded.getOutputDirectory());
        }

        @Test
        @DisplayName("Should round trip through JSON without a null output directory")
        void jsonRoundTrip() throws Exception {
            SchemaJeneratorConfig config = new SchemaJeneratorConfig();
            config.setPrettyOutput(true);

            Path file = tempDir.resolve("saved.json");
            config.save(file);
            String content = Files.readString(file);
            SchemaJeneratorConfig loaded = SchemaJeneratorConfig.load(file);

            assertTrue(content.contains("\"default_tier\" : \"standard\""));
            assertFalse(content.contains("output_directory"));
            assertTrue(loaded.isPrettyOutput());
        }
    }

    @Nested
    @DisplayName("Merging")
    class MergeTests {

        @Test
        @DisplayName("Flags should only override when given")
        void flagsOverrideOnlyWhenGiven() {
            SchemaJeneratorConfig config = new SchemaJeneratorConfig();
            config.setDefaultTier(SchemaOutputTier.EXPERT);
            config.setPrettyOutput(true);

            config.mergeWithArgs(null, false, false);
            assertEquals(SchemaOutputTier.EXPERT, config.getDefaultTier());
            assertTrue(config.isPrettyOutput());
            assertFalse(config.isValidateSchema());

            config.mergeWithArgs(SchemaOutputTier.BASIC, false, true);
            assertEquals(SchemaOutputTier.BASIC, config.getDefaultTier());
            assertTrue(config.isValidateSchema());
        }

        @Test
        @DisplayName("Extension filter should ignore case and leading dots")
        void extensionFilter() {
            SchemaJeneratorConfig config = new SchemaJeneratorConfig();
            assertTrue(config.acceptsFile(Paths.get("dir/data.JSON")));
            assertFalse(config.acceptsFile(Paths.get("dir/data.txt")));
            assertFalse(config.acceptsFile(Paths.get("README")));

            config.setFileExtensions(List.of(".txt"));
            assertTrue(config.acceptsFile(Paths.get("notes.txt")));

            config.setFileExtensions(List.of());
            assertTrue(config.acceptsFile(Paths.get("README")));
        }
    }
}
