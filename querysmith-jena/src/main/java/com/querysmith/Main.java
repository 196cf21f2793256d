package com.querysmith;

import com.querysmith.iso.IsomorphismChecker;
import com.querysmith.iso.IsomorphismResult;
import com.querysmith.jena.QueryParseException;
import com.querysmith.jena.SparqlQueryParser;
import com.querysmith.model.InvalidPatternException;
import com.querysmith.model.QueryValidationException;
import com.querysmith.model.SelectQuery;
import com.querysmith.model.Variable;
import com.querysmith.tracing.TracingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Command-line tool that compares two SPARQL query files.
 * <p>
 * Usage: {@code java -jar querysmith-jena.jar left.rq right.rq}
 * <p>
 * The exit status carries the verdict:
 * <ul>
 *   <li>0 - the queries are isomorphic</li>
 *   <li>1 - the queries are not isomorphic</li>
 *   <li>2 - the search budget ran out before a verdict</li>
 *   <li>3 - usage, I/O or parse error</li>
 * </ul>
 * <p>
 * The search budget can be configured via environment variable:
 * <ul>
 *   <li>QUERYSMITH_MAX_STEPS - maximum candidate pairings (default: 0, unlimited)</li>
 * </ul>
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Exit status for isomorphic queries. */
    static final int EXIT_ISOMORPHIC = 0;

    /** Exit status for non-isomorphic queries. */
    static final int EXIT_NOT_ISOMORPHIC = 1;

    /** Exit status when the budget ran out. */
    static final int EXIT_INDETERMINATE = 2;

    /** Exit status for usage, I/O and parse errors. */
    static final int EXIT_ERROR = 3;

    /** Environment variable name for the search budget. */
    private static final String ENV_MAX_STEPS = "QUERYSMITH_MAX_STEPS";

    /** Prevent instantiation of this utility class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Entry point.
     *
     * @param args paths of the two query files
     */
    public static void main(final String[] args) {
        int status;
        try {
            status = run(args, System.getenv(ENV_MAX_STEPS));
        } finally {
            TracingUtil.shutdown();
        }
        System.exit(status);
    }

    /**
     * Run a comparison and return the exit status.
     * This method is package-private to allow testing.
     *
     * @param args paths of the two query files
     * @param maxStepsValue value of {@code QUERYSMITH_MAX_STEPS}, or null
     * @return the exit status
     */
    static int run(final String[] args, final String maxStepsValue) {
        if (args.length != 2) {
            LOGGER.error("Usage: Main <left.rq> <right.rq>");
            return EXIT_ERROR;
        }

        long maxSteps = IsomorphismChecker.UNLIMITED;
        if (maxStepsValue != null && !maxStepsValue.isEmpty()) {
            try {
                maxSteps = Long.parseLong(maxStepsValue.trim());
            } catch (NumberFormatException e) {
                LOGGER.error("{} must be a number, got '{}'", ENV_MAX_STEPS, maxStepsValue);
                return EXIT_ERROR;
            }
            if (maxSteps < 0) {
                LOGGER.error("{} cannot be negative, got {}", ENV_MAX_STEPS, maxSteps);
                return EXIT_ERROR;
            }
        }

        return compare(Paths.get(args[0]), Paths.get(args[1]), maxSteps);
    }

    /**
     * Compare two query files.
     *
     * @param leftFile the left query file
     * @param rightFile the right query file
     * @param maxSteps the search budget, or {@link IsomorphismChecker#UNLIMITED}
     * @return the exit status
     */
    static int compare(final Path leftFile, final Path rightFile, final long maxSteps) {
        SelectQuery left;
        SelectQuery right;
        try {
            left = load(leftFile);
            right = load(rightFile);
        } catch (IOException e) {
            LOGGER.error("Cannot read query file: {}", e.getMessage());
            return EXIT_ERROR;
        } catch (QueryParseException | QueryValidationException e) {
            LOGGER.error("Cannot parse query: {}", e.getMessage());
            return EXIT_ERROR;
        }

        IsomorphismChecker checker = IsomorphismChecker.builder()
            .maxSteps(maxSteps)
            .build();
        IsomorphismResult result;
        try {
            result = checker.check(left, right);
        } catch (InvalidPatternException e) {
            LOGGER.error("Malformed query: {}", e.getMessage());
            return EXIT_ERROR;
        }

        switch (result.verdict()) {
            case ISOMORPHIC -> {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info("ISOMORPHIC ({} steps)", result.steps());
                    for (Map.Entry<Variable, Variable> entry : result.mapping().entrySet()) {
                        LOGGER.info("  {} -> {}", entry.getKey(), entry.getValue());
                    }
                }
                return EXIT_ISOMORPHIC;
            }
            case NOT_ISOMORPHIC -> {
                LOGGER.info("NOT ISOMORPHIC ({} steps)", result.steps());
                return EXIT_NOT_ISOMORPHIC;
            }
            default -> {
                LOGGER.warn("INDETERMINATE: no verdict within {} steps", maxSteps);
                return EXIT_INDETERMINATE;
            }
        }
    }

    private static SelectQuery load(final Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Read {} characters from {}", text.length(), file);
        }
        return SparqlQueryParser.parse(text);
    }
}
