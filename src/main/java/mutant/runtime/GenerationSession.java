package mutant.runtime;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import mutant.analysis.AstTreePrinter;
import mutant.analysis.SpoonNodeReader;
import mutant.ast.Node;
import mutant.io.MutantReportWriter;
import mutant.logging.LoggingConfig;
import mutant.mutators.MutationEngine;
import mutant.mutators.MutationException;
import mutant.mutators.MutatorRegistry;
import spoon.Launcher;
import spoon.OutputType;
import spoon.SpoonException;
import spoon.compiler.Environment;
import spoon.reflect.CtModel;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtType;
import spoon.reflect.visitor.filter.TypeFilter;

/**
 * Parses every Java file below the configured directory with Spoon and reports the
 * mutants of each method with a body. Failures are logged and counted; the session
 * moves on to the next method or file.
 */
public final class GenerationSession {

    private static final Logger LOGGER = LoggingConfig.getLogger(GenerationSession.class);

    private final GeneratorConfig config;
    private final MutationEngine engine;
    private final SpoonNodeReader reader = new SpoonNodeReader();
    private final MutantReportWriter reportWriter;
    private final AstTreePrinter treePrinter;

    private int methodCount;
    private long mutantCount;
    private int failureCount;

    public GenerationSession(GeneratorConfig config, PrintStream out) {
        this.config = Objects.requireNonNull(config, "config");
        this.engine = new MutationEngine(MutatorRegistry.standard(), new Random(config.rngSeed()));
        this.reportWriter = new MutantReportWriter(out);
        this.treePrinter = new AstTreePrinter(out);
    }

    public SessionSummary run() {
        List<Path> javaFiles;
        try (Stream<Path> stream = Files.walk(config.inputDir())) {
            javaFiles = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".java"))
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.toList());
        } catch (IOException ioe) {
            LOGGER.log(Level.WARNING, "Failed to read input directory " + config.inputDir(), ioe);
            return new SessionSummary(0, 0, 0, 1);
        }

        if (javaFiles.isEmpty()) {
            LOGGER.warning("No .java files found under " + config.inputDir());
        }

        for (Path javaFile : javaFiles) {
            for (MethodMutants result : mutateFile(javaFile)) {
                reportWriter.writeHeader(result.subject(), result.mutants().size());
                if (config.printAst()) {
                    treePrinter.print(result.method());
                }
                reportWriter.writeMutants(result.method(), result.mutants());
            }
        }

        SessionSummary summary = new SessionSummary(javaFiles.size(), methodCount, mutantCount, failureCount);
        reportWriter.writeSummary(summary.toString());
        LOGGER.info("Generation finished: " + summary);
        return summary;
    }

    /**
     * Mutants of every method with a body declared in {@code javaFile}.
     */
    List<MethodMutants> mutateFile(Path javaFile) {
        CtModel model;
        try {
            model = buildModel(javaFile);
        } catch (SpoonException ex) {
            failureCount++;
            logFailure("Failed to build model for " + javaFile, ex);
            return List.of();
        }

        List<MethodMutants> results = new ArrayList<>();
        for (CtMethod<?> method : model.getElements(new TypeFilter<CtMethod<?>>(CtMethod.class))) {
            if (method.getBody() == null || !matchesFilter(method)) {
                continue;
            }
            String subject = subjectOf(method);
            try {
                Node node = reader.readMethod(method);
                List<Node> mutants = engine.mutations(node);
                methodCount++;
                mutantCount += mutants.size();
                LOGGER.fine(() -> String.format("%s: %d mutants", subject, mutants.size()));
                results.add(new MethodMutants(subject, node, mutants));
            } catch (MutationException ex) {
                failureCount++;
                logFailure("Mutation of " + subject + " failed", ex);
            }
        }
        return results;
    }

    private CtModel buildModel(Path javaFile) {
        Launcher launcher = new Launcher();
        Environment env = launcher.getEnvironment();
        env.setComplianceLevel(config.complianceLevel());
        env.setNoClasspath(true);
        env.setIgnoreSyntaxErrors(true);
        env.setCommentEnabled(false);
        env.setAutoImports(true);
        env.setOutputType(OutputType.NO_OUTPUT);

        launcher.addInputResource(javaFile.toString());
        return launcher.buildModel();
    }

    private boolean matchesFilter(CtMethod<?> method) {
        return config.methodFilter()
                .map(name -> name.equals(method.getSimpleName()))
                .orElse(true);
    }

    private static String subjectOf(CtMethod<?> method) {
        CtType<?> declaringType = method.getDeclaringType();
        String owner = declaringType != null ? declaringType.getQualifiedName() : "?";
        return owner + "#" + method.getSimpleName();
    }

    private void logFailure(String message, Exception ex) {
        if (config.verbose()) {
            LOGGER.log(Level.WARNING, message, ex);
        } else {
            LOGGER.warning(message + ": " + ex.getMessage());
        }
    }
}
