package com.schemajenerator.cli;

import com.schemajenerator.config.SchemaJeneratorConfig;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.schema.SchemaOutputTier;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

@CommandLine.Command(
        name = "schema-jenerator",
        description = "Generate a JSON Schema (draft 2020-12) from a JSON document",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        subcommands = {CompletionCommand.class})
public class SchemaJeneratorCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SchemaJeneratorCommand.class);

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "INPUT",
            description = "Input JSON file, or a glob pattern with --batch")
    private String input;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "OUTPUT",
            description = "Output file (defaults to <input-stem>.schema.json)")
    private Path output;

    @CommandLine.Option(names = {"-t", "--tier"}, paramLabel = "TIER",
            description = "Schema tier: ${COMPLETION-CANDIDATES} (default: standard, or the config value)")
    private SchemaOutputTier tier;

    @CommandLine.Option(names = {"-p", "--pretty"}, description = "Pretty print the schema")
    private boolean pretty;

    @CommandLine.Option(names = {"-v", "--validate"}, description = "Validate the generated schema against the 2020-12 meta-schema")
    private boolean validate;

    @CommandLine.Option(names = {"-b", "--batch"}, description = "Treat INPUT as a glob pattern and process every match")
    private boolean batch;

    @CommandLine.Option(names = {"-c", "--config"}, paramLabel = "CONFIG", description = "Configuration file (JSON or TOML)")
    private Path config;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new SchemaJeneratorCommand())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        try {
            SchemaJeneratorConfig settings = config != null ? SchemaJeneratorConfig.load(config) : new SchemaJeneratorConfig();
            settings.mergeWithArgs(tier, pretty, validate);

            if (input == null) {
                throw new SchemaJeneratorException(SchemaJeneratorError.validation()
                        .errorCode(SchemaJeneratorError.ErrorCode.MISSING_INPUT)
                        .message("Input file is required for schema generation")
                        .build());
            }

            if (batch) {
                if (output != null) {
                    log.warn("--output is ignored in batch mode");
                }
                SchemaFileProcessor processor = new SchemaFileProcessor(settings, null, System.out);
                new BatchProcessor(processor, settings, System.out).process(input);
            } else {
                new SchemaFileProcessor(settings, output, System.out).process(Paths.get(input));
            }
            return 0;
        } catch (SchemaJeneratorException e) {
            return fail(e);
        } catch (RuntimeException e) {
            return fail(SchemaJeneratorException.fromException(e, "generate schema", input));
        }
    }

    private static int fail(SchemaJeneratorException e) {
        log.debug("Command failed", e);
        System.err.println("Error: " + e.getMessage());
        return 1;
    }
}
