package com.schemajenerator.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.schema.SchemaOutputTier;
import com.schemajenerator.utils.JsonMapperHolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User defaults for the command line, read from a JSON or TOML file. Keys are
 * snake_case on disk; a file with a {@code .toml} extension is read as TOML,
 * anything else as JSON.
 *
 * <pre>
 * default_tier = "comprehensive"
 * pretty_output = true
 * validate_schema = false
 * output_directory = "schemas"
 * file_extensions = ["json"]
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "default_tier", "pretty_output", "validate_schema", "output_directory", "file_extensions" })
public class SchemaJeneratorConfig {

	private static final Logger log = LoggerFactory.getLogger(SchemaJeneratorConfig.class);

	private static final ObjectMapper JSON_READER = JsonMapperHolder.getMapper().copy()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	private static final TomlMapper TOML_MAPPER = TomlMapper.builder()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.build();

	@JsonProperty("default_tier")
	private SchemaOutputTier defaultTier = SchemaOutputTier.STANDARD;

	@JsonProperty("pretty_output")
	private boolean prettyOutput = false;

	@JsonProperty("validate_schema")
	private boolean validateSchema = false;

	@JsonProperty("output_directory")
	private String outputDirectory = null;

	@JsonProperty("file_extensions")
	private List<String> fileExtensions = new ArrayList<>(List.of("json"));

	public SchemaOutputTier getDefaultTier() {
		return defaultTier;
	}

	public void setDefaultTier(SchemaOutputTier defaultTier) {
		this.defaultTier = Objects.requireNonNull(defaultTier, "Default tier cannot be null");
	}

	public boolean isPrettyOutput() {
		return prettyOutput;
	}

	public void setPrettyOutput(boolean prettyOutput) {
		this.prettyOutput = prettyOutput;
	}

	public boolean isValidateSchema() {
		return validateSchema;
	}

	public void setValidateSchema(boolean validateSchema) {
		this.validateSchema = validateSchema;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	/** The configured output directory, or null to write next to each input. */
	public Path outputDirectoryPath() {
		return outputDirectory == null || outputDirectory.isBlank() ? null : Paths.get(outputDirectory);
	}

	public List<String> getFileExtensions() {
		return fileExtensions;
	}

	public void setFileExtensions(List<String> fileExtensions) {
		this.fileExtensions = fileExtensions != null ? new ArrayList<>(fileExtensions) : new ArrayList<>();
	}

	/**
	 * Whether batch mode should pick up a file with this name. An empty
	 * extension list accepts every file.
	 */
	public boolean acceptsFile(Path file) {
		if (fileExtensions.isEmpty()) {
			return true;
		}
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String extension = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
		return fileExtensions.stream()
				.map(e -> e.startsWith(".") ? e.substring(1) : e)
				.anyMatch(e -> e.equalsIgnoreCase(extension));
	}

	/**
	 * Applies command line flags on top of the file values. A tier only
	 * overrides when one was given; the flags can switch options on but never off.
	 */
	public void mergeWithArgs(SchemaOutputTier tier, boolean pretty, boolean validate) {
		if (tier != null) {
			this.defaultTier = tier;
		}
		if (pretty) {
			this.prettyOutput = true;
		}
		if (validate) {
			this.validateSchema = true;
		}
	}

	/**
	 * Loads a configuration file. A path that does not exist yields the defaults.
	 *
	 * @param path the JSON or TOML file
	 * @return the loaded configuration
	 * @throws SchemaJeneratorException if the file cannot be read or parsed
	 */
	public static SchemaJeneratorConfig load(Path path) throws SchemaJeneratorException {
		if (!Files.exists(path)) {
			log.debug("Config file {} not found, using defaults", path);
			return new SchemaJeneratorConfig();
		}

		String content;
		try {
			content = Files.readString(path);
		} catch (IOException e) {
			throw configError("Failed to read config file: " + path, path, e);
		}

		boolean toml = isToml(path);
		try {
			SchemaJeneratorConfig config = toml
					? TOML_MAPPER.readValue(content, SchemaJeneratorConfig.class)
					: JSON_READER.readValue(content, SchemaJeneratorConfig.class);
			log.debug("Loaded config from {}", path);
			return config;
		} catch (JsonProcessingException e) {
			String message = (toml ? "Invalid TOML config: " : "Invalid JSON config: ") + e.getOriginalMessage();
			throw configError(message, path, e);
		}
	}

	/**
	 * Writes this configuration, as TOML when the path ends in {@code .toml} and
	 * as pretty printed JSON otherwise.
	 *
	 * @param path the destination file
	 * @throws SchemaJeneratorException if serialization or the write fails
	 */
	public void save(Path path) throws SchemaJeneratorException {
		String content;
		try {
			content = isToml(path)
					? TOML_MAPPER.writeValueAsString(this)
					: JsonMapperHolder.toJson(this, true);
		} catch (JsonProcessingException e) {
			throw configError("Failed to serialize config: " + e.getOriginalMessage(), path, e);
		}

		try {
			Files.writeString(path, content);
		} catch (IOException e) {
			throw new SchemaJeneratorException(
					SchemaJeneratorError.io()
							.errorCode(SchemaJeneratorError.ErrorCode.IO_FAILED)
							.message("Failed to write config file: " + path)
							.context(new SchemaJeneratorError.ErrorContext("save config", path.toString(), null))
							.build(),
					e);
		}
	}

	private static boolean isToml(Path path) {
		return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".toml");
	}

	private static SchemaJeneratorException configError(String message, Path path, Throwable cause) {
		return new SchemaJeneratorException(
				SchemaJeneratorError.configuration()
						.errorCode(SchemaJeneratorError.ErrorCode.CONFIGURATION_ERROR)
						.message(message)
						.context(new SchemaJeneratorError.ErrorContext(
								"load config", path.toString(), Map.of("format", isToml(path) ? "toml" : "json")))
						.build(),
				cause);
	}
}
