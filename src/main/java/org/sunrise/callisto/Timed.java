package org.sunrise.callisto;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long a processing step took. The elapsed time in
 * milliseconds is appended to the message arguments, so a message such as
 * {@code "Filtering %s took %dms"} expects one argument of its own.
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, callable, message, args);
    }

    public static <T> T execute(Level logLevel, Callable<T> callable, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return callable.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    /**
     * Variant for steps that produce no value.
     */
    public static void run(Step step, String message, Object... args) {
        execute(DEFAULT_LOG_LEVEL, () -> {
            step.run();
            return null;
        }, message, args);
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }

    @FunctionalInterface
    public interface Step {

        void run() throws Exception;
    }
}
