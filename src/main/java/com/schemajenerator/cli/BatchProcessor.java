package com.schemajenerator.cli;

import com.schemajenerator.config.SchemaJeneratorConfig;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link SchemaFileProcessor} over every file matching a glob pattern.
 * Matches are collected before any schema is written, so outputs landing in the
 * scanned directory are not picked up by the same run. A failing file is reported
 * and the run continues.
 */
final class BatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    private static final String GLOBSTAR_SEGMENT = "**/";

    private final SchemaFileProcessor processor;
    private final SchemaJeneratorConfig config;
    private final PrintStream out;

    BatchProcessor(SchemaFileProcessor processor, SchemaJeneratorConfig config, PrintStream out) {
        this.processor = processor;
        this.config = config;
        this.out = out;
    }

    /** Outcome of a batch run. */
    record Result(int processed, List<String> errors) {
    }

    Result process(String pattern) throws SchemaJeneratorException {
        List<Path> files = expand(pattern).stream()
                .filter(config::acceptsFile)
                .collect(Collectors.toList());
        log.info("Batch pattern {} matched {} files", pattern, files.size());

        int processed = 0;
        List<String> errors = new ArrayList<>();
        for (Path file : files) {
            try {
                processor.process(file);
                processed++;
            } catch (SchemaJeneratorException e) {
                log.debug("Batch entry {} failed", file, e);
                errors.add(file + ": " + e.getMessage());
            }
        }

        out.println("Processed " + processed + " files successfully");
        if (!errors.isEmpty()) {
            out.println("Errors encountered:");
            errors.forEach(error -> out.println("  " + error));
        }
        return new Result(processed, List.copyOf(errors));
    }

    /**
     * Expands a glob into the regular files it matches, sorted. The leading
     * segments without wildcards name the directory to walk; the rest is matched
     * against paths relative to it. {@code **} crosses directory boundaries.
     */
    static List<Path> expand(String pattern) throws SchemaJeneratorException {
        int firstWildcard = firstWildcard(pattern);
        if (firstWildcard < 0) {
            Path literal = Paths.get(pattern);
            return Files.isRegularFile(literal) ? List.of(literal) : List.of();
        }

        int split = pattern.lastIndexOf('/', firstWildcard);
        Path base = split < 0 ? Paths.get(".") : Paths.get(split == 0 ? "/" : pattern.substring(0, split));
        String remainder = pattern.substring(split + 1);

        List<PathMatcher> matchers = new ArrayList<>();
        try {
            for (String variant : zeroDirectoryVariants(remainder)) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + variant));
            }
        } catch (IllegalArgumentException e) {
            throw new SchemaJeneratorException(SchemaJeneratorError.validation()
                    .errorCode(SchemaJeneratorError.ErrorCode.INVALID_GLOB_PATTERN)
                    .message("Invalid glob pattern: " + e.getMessage())
                    .context(new SchemaJeneratorError.ErrorContext("expand glob", pattern, null))
                    .build(), e);
        }

        if (!Files.isDirectory(base)) {
            return List.of();
        }

        int depth = remainder.contains("**") ? Integer.MAX_VALUE : remainder.split("/").length;
        try (Stream<Path> walk = Files.walk(base, depth)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matchesAny(matchers, base.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new SchemaJeneratorException(SchemaJeneratorError.io()
                    .errorCode(SchemaJeneratorError.ErrorCode.IO_FAILED)
                    .message("Failed to read glob entry: " + e.getMessage())
                    .context(new SchemaJeneratorError.ErrorContext("expand glob", pattern, null))
                    .build(), e);
        }
    }

    /**
     * The pattern plus every form with one or more {@code **}{@code /} segments
     * removed, so that {@code a/**}{@code /*.json} also matches {@code a/x.json}.
     * NIO globs require {@code **}{@code /} to match at least one directory.
     */
    static Set<String> zeroDirectoryVariants(String pattern) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(pattern);
        Deque<String> pending = new ArrayDeque<>(variants);
        while (!pending.isEmpty()) {
            String current = pending.pop();
            int from = 0;
            int at;
            while ((at = current.indexOf(GLOBSTAR_SEGMENT, from)) >= 0) {
                boolean segmentStart = at == 0 || current.charAt(at - 1) == '/';
                if (segmentStart) {
                    String collapsed = current.substring(0, at) + current.substring(at + GLOBSTAR_SEGMENT.length());
                    if (variants.add(collapsed)) {
                        pending.push(collapsed);
                    }
                }
                from = at + 1;
            }
        }
        return variants;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path relative) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    private static int firstWildcard(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            switch (pattern.charAt(i)) {
                case '*', '?', '[', '{':
                    return i;
                default:
                    break;
            }
        }
        return -1;
    }
}
