package mutant.runtime;

public record SessionSummary(int files, int methods, long mutants, int failures) {

    @Override
    public String toString() {
        return String.format("%d files, %d methods, %d mutants, %d failures", files, methods, mutants, failures);
    }
}
