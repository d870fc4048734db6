/*
 * This file is part of the constraint solver ACE (AbsCon Essence).
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package utility;

import java.util.function.Supplier;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A few static helpers shared by all packages: the logger and some basic checks.
 */
public final class Kit {

    /**
     * The logger used everywhere. Messages are printed on a single line, prefixed by their level when it is not INFO.
     */
    public static final Logger log = Logger.getLogger("gdp");

    static {
        log.setUseParentHandlers(false);
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new Formatter() {
            @Override
            public String format(LogRecord record) {
                String message = formatMessage(record);
                if (record.getLevel() == Level.INFO)
                    return message + "\n";
                return "  " + record.getLevel().getName().toLowerCase() + ": " + message + "\n";
            }
        });
        log.addHandler(handler);
        log.setLevel(Level.WARNING);
    }

    private Kit() {
    }

    /**
     * Sets the verbosity of the logger: 0 for warnings only, 1 for run summaries (CONFIG), 2 or more for traces (FINE).
     *
     * @param verbose
     *            the verbosity level
     */
    public static void setVerbosity(int verbose) {
        log.setLevel(verbose <= 0 ? Level.WARNING : verbose == 1 ? Level.CONFIG : Level.FINE);
    }

    /**
     * Throws an IllegalStateException built from the specified message if the specified condition is not respected
     *
     * @param conditionToBeRespected
     *            the condition to check
     * @param message
     *            the message of the exception
     */
    public static void control(boolean conditionToBeRespected, Supplier<String> message) {
        if (!conditionToBeRespected)
            throw new IllegalStateException(message.get());
    }

    /**
     * Returns the string form of the specified double, without a trailing ".0" when it is integral
     */
    public static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15)
            return Long.toString((long) value);
        return Double.toString(value);
    }
}
