package com.schemajenerator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.config.SchemaJeneratorConfig;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.schema.SchemaGenerator;
import com.schemajenerator.utils.JsonMapperHolder;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.validation.MetaSchemaValidator;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one JSON file, generates its schema and writes the result. Output goes to
 * the explicit output path when one is given, else to {@code <stem>.schema.json}
 * in the configured output directory or next to the input.
 */
final class SchemaFileProcessor {
    private static final Logger log = LoggerFactory.getLogger(SchemaFileProcessor.class);

    static final String SCHEMA_SUFFIX = ".schema.json";

    private final SchemaGenerator generator = new SchemaGenerator();
    private final SchemaJeneratorConfig config;
    private final Path outputOverride;
    private final MetaSchemaValidator validator;
    private final PrintStream out;

    SchemaFileProcessor(SchemaJeneratorConfig config, Path outputOverride, PrintStream out)
            throws SchemaJeneratorException {
        this.config = config;
        this.outputOverride = outputOverride;
        this.validator = config.isValidateSchema() ? new MetaSchemaValidator() : null;
        this.out = out;
    }

    /**
     * Runs the whole pipeline for one file.
     *
     * @return the path the schema was written to
     */
    Path process(Path input) throws SchemaJeneratorException {
        log.info("Processing input file: {}", input);

        if (!Files.exists(input)) {
            throw new SchemaJeneratorException(SchemaJeneratorError.resourceNotFound()
                    .errorCode(SchemaJeneratorError.ErrorCode.FILE_NOT_FOUND)
                    .message("File not found: " + input)
                    .context(new SchemaJeneratorError.ErrorContext("read input", input.toString(), null))
                    .build());
        }

        JsonNode value = parse(input, read(input));
        JsonSchema schema = generator.generate(value, config.getDefaultTier());

        if (validator != null) {
            validator.validate(schema);
            out.println("Schema validation passed");
        }

        Path outputPath = outputPathFor(input);
        write(outputPath, serialize(schema, outputPath));
        out.println("Schema generated successfully: " + outputPath);
        return outputPath;
    }

    Path outputPathFor(Path input) {
        if (outputOverride != null) {
            return outputOverride;
        }
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;

        Path directory = config.outputDirectoryPath();
        if (directory == null) {
            directory = input.getParent();
        }
        return directory == null ? Path.of(stem + SCHEMA_SUFFIX) : directory.resolve(stem + SCHEMA_SUFFIX);
    }

    private static String read(Path input) throws SchemaJeneratorException {
        try {
            return Files.readString(input);
        } catch (IOException e) {
            throw ioError("Failed to read input file: " + input, "read input", input, e);
        }
    }

    private static JsonNode parse(Path input, String content) throws SchemaJeneratorException {
        try {
            JsonNode value = JsonMapperHolder.readTree(content);
            if (value == null || value.isMissingNode()) {
                throw invalidJson("no JSON value in document", input, null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw invalidJson(e.getOriginalMessage(), input, e);
        }
    }

    private String serialize(JsonSchema schema, Path outputPath) throws SchemaJeneratorException {
        try {
            return JsonMapperHolder.toJson(schema.getNode(), config.isPrettyOutput());
        } catch (JsonProcessingException e) {
            throw new SchemaJeneratorException(SchemaJeneratorError.internal()
                    .errorCode(SchemaJeneratorError.ErrorCode.SERIALIZATION_FAILED)
                    .message("Failed to serialize schema: " + e.getOriginalMessage())
                    .context(new SchemaJeneratorError.ErrorContext("serialize schema", outputPath.toString(), null))
                    .build(), e);
        }
    }

    private static void write(Path outputPath, String json) throws SchemaJeneratorException {
        try {
            Path parent = outputPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, json);
        } catch (IOException e) {
            throw ioError("Failed to write schema to file: " + outputPath, "write schema", outputPath, e);
        }
    }

    private static SchemaJeneratorException invalidJson(String detail, Path input, Throwable cause) {
        SchemaJeneratorError error = SchemaJeneratorError.parsing()
                .errorCode(SchemaJeneratorError.ErrorCode.INVALID_JSON)
                .message("Invalid JSON: " + detail)
                .context(new SchemaJeneratorError.ErrorContext("parse input", input.toString(), null))
                .build();
        return cause == null ? new SchemaJeneratorException(error) : new SchemaJeneratorException(error, cause);
    }

    private static SchemaJeneratorException ioError(String message, String operation, Path path, IOException cause) {
        return new SchemaJeneratorException(SchemaJeneratorError.io()
                .errorCode(SchemaJeneratorError.ErrorCode.IO_FAILED)
                .message(message)
                .context(new SchemaJeneratorError.ErrorContext(operation, path.toString(),
                        Map.of("exceptionType", cause.getClass().getSimpleName())))
                .build(), cause);
    }
}
