package mutant;

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.Arrays;
import java.util.Date;
import java.util.logging.Level;
import java.util.logging.Logger;

import mutant.logging.LoggingConfig;
import mutant.runtime.GenerationSession;
import mutant.runtime.GeneratorConfig;
import mutant.runtime.SessionSummary;

public class MutantGenerator {

    private static final Logger LOGGER = LoggingConfig.getLogger(MutantGenerator.class);

    /**
     * Runs one generation session.
     *
     * @return 0 when every method was mutated, 1 when some failed, 2 on invalid arguments
     */
    public int run(String[] args, String timestamp) {
        GeneratorConfig config;
        try {
            config = GeneratorConfig.fromArgs(args, timestamp, LOGGER);
        } catch (IllegalArgumentException iae) {
            System.err.println(iae.getMessage());
            System.err.print(GeneratorConfig.usage());
            return 2;
        }
        SessionSummary summary = new GenerationSession(config, System.out).run();
        return summary.failures() == 0 ? 0 : 1;
    }

    public static void main(String[] args) {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            System.out.print(GeneratorConfig.usage());
            return;
        }
        String timestamp = new SimpleDateFormat("yyyyMMddHHmmss").format(new Date());
        try {
            LoggingConfig.setup(timestamp, Level.INFO);
        } catch (IOException e) {
            System.err.println("Failed to set up logging configuration: " + e.getMessage());
            System.exit(1);
        }
        System.exit(new MutantGenerator().run(args, timestamp));
    }
}
