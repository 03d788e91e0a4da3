package mutant.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable configuration for one generation run. Handles CLI parsing, the
 * property/environment fallback for the RNG seed and default resolution.
 */
public final class GeneratorConfig {

    public static final int DEFAULT_COMPLIANCE_LEVEL = 17;
    public static final String SEED_PROPERTY = "mutant.seed";
    public static final String ENV_SEED = "MUTANT_SEED";

    private final Path inputDir;
    private final int complianceLevel;
    private final long rngSeed;
    private final String methodFilter;
    private final boolean printAst;
    private final boolean verbose;
    private final String timestamp;

    private GeneratorConfig(Builder builder) {
        this.inputDir = builder.inputDir;
        this.complianceLevel = builder.complianceLevel;
        this.rngSeed = builder.rngSeed;
        this.methodFilter = builder.methodFilter;
        this.printAst = builder.printAst;
        this.verbose = builder.verbose;
        this.timestamp = builder.timestamp;
    }

    public Path inputDir() {
        return inputDir;
    }

    public int complianceLevel() {
        return complianceLevel;
    }

    public long rngSeed() {
        return rngSeed;
    }

    public Optional<String> methodFilter() {
        return Optional.ofNullable(methodFilter);
    }

    public boolean printAst() {
        return printAst;
    }

    public boolean verbose() {
        return verbose;
    }

    public String timestamp() {
        return timestamp;
    }

    /**
     * @throws IllegalArgumentException when the input directory is missing or invalid
     */
    public static GeneratorConfig fromArgs(String[] args, String timestamp, Logger logger) {
        Builder builder = new Builder(timestamp, logger);
        builder.parseArgs(args);
        return builder.build();
    }

    public static Builder builder(String timestamp, Logger logger) {
        return new Builder(timestamp, logger);
    }

    public static String usage() {
        return """
                Usage: java -jar mutant-engine.jar --input <dir> [options]
                  --input <dir>       Root directory containing Java sources (required)
                  --compliance <n>    Java version passed to Spoon (default: 17)
                  --seed <n>          RNG seed for random mutations (default: -Dmutant.seed, $MUTANT_SEED, time)
                  --method <name>     Only enumerate methods with this simple name
                  --print-ast         Print each method's node tree before its mutants
                  --verbose           Print stack traces on failures
                  --help, -h          Show this help
                """;
    }

    public static final class Builder {
        private final Logger logger;
        private final String timestamp;
        private Path inputDir;
        private int complianceLevel = DEFAULT_COMPLIANCE_LEVEL;
        private Long rngSeed;
        private String methodFilter;
        private boolean printAst;
        private boolean verbose;

        private Builder(String timestamp, Logger logger) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.logger = Objects.requireNonNull(logger, "logger");
        }

        public Builder inputDir(Path inputDir) {
            this.inputDir = inputDir.toAbsolutePath().normalize();
            return this;
        }

        public Builder complianceLevel(int complianceLevel) {
            this.complianceLevel = complianceLevel;
            return this;
        }

        public Builder rngSeed(long rngSeed) {
            this.rngSeed = rngSeed;
            return this;
        }

        public Builder methodFilter(String methodFilter) {
            this.methodFilter = methodFilter;
            return this;
        }

        public Builder printAst(boolean printAst) {
            this.printAst = printAst;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        private void parseArgs(String[] args) {
            List<String> argList = Arrays.asList(args);

            int idx = argList.indexOf("--input");
            if (idx != -1 && idx + 1 < argList.size()) {
                inputDir(Path.of(argList.get(idx + 1)));
            }

            idx = argList.indexOf("--compliance");
            if (idx != -1 && idx + 1 < argList.size()) {
                String level = argList.get(idx + 1);
                try {
                    complianceLevel = Integer.parseInt(level);
                } catch (NumberFormatException nfe) {
                    logger.warning(String.format(Locale.ROOT,
                            "Invalid compliance level '%s'. Keeping %d.",
                            level,
                            complianceLevel));
                }
            }

            idx = argList.indexOf("--seed");
            if (idx != -1 && idx + 1 < argList.size()) {
                rngSeed = parseSeed(argList.get(idx + 1), "--seed");
            }

            idx = argList.indexOf("--method");
            if (idx != -1 && idx + 1 < argList.size()) {
                methodFilter = argList.get(idx + 1);
                logger.info(String.format("Only enumerating methods named %s", methodFilter));
            }

            if (argList.contains("--print-ast")) {
                logger.info("AST printing enabled via command line argument.");
                printAst = true;
            }

            verbose = argList.contains("--verbose");
        }

        private Long parseSeed(String raw, String source) {
            try {
                return Long.valueOf(raw.strip());
            } catch (NumberFormatException nfe) {
                logger.warning(String.format("Invalid RNG seed from %s: %s", source, raw));
                return null;
            }
        }

        public GeneratorConfig build() {
            if (inputDir == null) {
                logger.warning("No input directory specified. Use --input <directory> to provide one.");
                throw new IllegalArgumentException("Input directory is required.");
            }
            if (!Files.isDirectory(inputDir)) {
                throw new IllegalArgumentException("Input path is not a directory: " + inputDir);
            }
            resolveSeed();
            logger.info(String.format(Locale.ROOT,
                    "Input %s, compliance level %d, RNG seed %d",
                    inputDir, complianceLevel, rngSeed));
            return new GeneratorConfig(this);
        }

        private void resolveSeed() {
            if (rngSeed != null) {
                return;
            }
            String raw = System.getProperty(SEED_PROPERTY);
            String source = "-D" + SEED_PROPERTY;
            if (raw == null || raw.isBlank()) {
                raw = System.getenv(ENV_SEED);
                source = ENV_SEED;
            }
            if (raw != null && !raw.isBlank()) {
                rngSeed = parseSeed(raw, source);
            }
            if (rngSeed == null) {
                rngSeed = System.nanoTime();
                logger.info(String.format("No RNG seed configured; using %d", rngSeed));
            }
        }
    }
}
