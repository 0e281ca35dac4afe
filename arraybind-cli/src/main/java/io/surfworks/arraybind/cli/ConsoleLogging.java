package io.surfworks.arraybind.cli;

import java.io.PrintStream;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

/**
 * Routes the compiler's {@code java.util.logging} output to the console at
 * the level chosen by {@code --verbosity}.
 */
final class ConsoleLogging {

    static final String ROOT_LOGGER = "io.surfworks.arraybind";

    // Held so the configured logger is not garbage collected
    private static final Logger ROOT = Logger.getLogger(ROOT_LOGGER);

    private ConsoleLogging() {
    }

    /**
     * Maps a verbosity level onto a logging level:
     * below 0 silent, 0 errors only, 1 normal, 2 verbose, 3 and up debug.
     */
    static Level levelFor(int verbosity) {
        if (verbosity < 0) {
            return Level.OFF;
        }
        return switch (verbosity) {
            case 0 -> Level.SEVERE;
            case 1 -> Level.INFO;
            case 2 -> Level.FINE;
            default -> Level.ALL;
        };
    }

    static void configure(int verbosity, PrintStream stream) {
        Level level = levelFor(verbosity);
        for (Handler handler : ROOT.getHandlers()) {
            ROOT.removeHandler(handler);
            handler.close();
        }

        StreamHandler handler = new StreamHandler(stream, new PlainFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }

            @Override
            public synchronized void close() {
                // The stream belongs to the caller
                flush();
            }
        };
        handler.setLevel(level);

        ROOT.setUseParentHandlers(false);
        ROOT.setLevel(level);
        ROOT.addHandler(handler);
    }

    private static final class PlainFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String message = formatMessage(record);
            if (record.getLevel().intValue() < Level.INFO.intValue()) {
                return "[" + record.getLevel().getName().toLowerCase(Locale.ROOT) + "] " + message + System.lineSeparator();
            }
            return message + System.lineSeparator();
        }
    }
}
