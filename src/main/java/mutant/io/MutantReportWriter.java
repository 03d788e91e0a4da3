package mutant.io;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

import mutant.analysis.MutationLocator;
import mutant.ast.Node;

/**
 * Prints the mutants of a method: a header, then each mutant with the position of
 * the subtree it changes and the mutated method source.
 */
public final class MutantReportWriter {

    private final PrintStream out;
    private final JavaSourcePrinter printer = new JavaSourcePrinter();

    public MutantReportWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void writeHeader(String subject, int mutantCount) {
        out.println();
        out.printf("== %s (%d mutants)%n", subject, mutantCount);
    }

    public void writeMutants(Node original, List<Node> mutants) {
        for (int i = 0; i < mutants.size(); i++) {
            Node mutant = mutants.get(i);
            Node changed = MutationLocator.locate(original, mutant);
            String location = changed == null ? original.position().toString() : changed.position().toString();
            out.printf("-- mutant %d @ %s%n", i + 1, location);
            out.println(printer.print(mutant));
        }
    }

    public void writeSummary(String summary) {
        out.println();
        out.println("== " + summary);
    }
}
