package mutant.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class LoggingConfig {

    public static final String ROOT_LOGGER = "mutant";
    public static final String LOG_DIRECTORY = "logs";

    public static void setup(String timestamp, Level level) throws IOException {
        LogManager.getLogManager().reset();

        Files.createDirectories(Path.of(LOG_DIRECTORY));
        FileHandler fileHandler = new FileHandler(LOG_DIRECTORY + "/mutant" + timestamp + ".log", true);
        fileHandler.setFormatter(new ThreadAwareFormatter());

        // Children log through the package logger; the root logger stays silent.
        Logger mutantLogger = Logger.getLogger(ROOT_LOGGER);
        mutantLogger.addHandler(fileHandler);
        mutantLogger.setLevel(level);
    }

    public static Logger getLogger(Class<?> clazz) {
        return Logger.getLogger(clazz.getName());
    }
}

class ThreadAwareFormatter extends Formatter {
    @Override
    public String format(LogRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[%s] %s %s: %s%n",
                Thread.currentThread().getName(),
                record.getLevel(),
                record.getLoggerName(),
                formatMessage(record)));

        Throwable thrown = record.getThrown();
        if (thrown != null) {
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                thrown.printStackTrace(pw);
            }
            sb.append(sw);
        }
        return sb.toString();
    }
}
