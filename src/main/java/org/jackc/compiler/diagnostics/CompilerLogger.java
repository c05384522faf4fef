package org.jackc.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the progress of one compilation unit.
 * <p>
 * Every message is prefixed with the unit name and goes to the SLF4J logger of the
 * phase that wrote it, so {@code logging.levels} can select single phases.
 * The verbosity of the owning {@link org.jackc.compiler.api.ICompiler} gates
 * the messages before Logback sees them: {@link #DEBUG} lets debug messages through,
 * {@link #TRACE} also trace messages.
 */
public final class CompilerLogger {

    /** Default verbosity: no compiler-internal messages. */
    public static final int INFO = 2;
    /** Verbosity that enables debug messages. */
    public static final int DEBUG = 3;
    /** Verbosity that enables debug and trace messages. */
    public static final int TRACE = 4;

    private final String unitName;
    private final int verbosity;
    private final Logger logger;

    private CompilerLogger(String unitName, int verbosity, Logger logger) {
        this.unitName = unitName;
        this.verbosity = verbosity;
        this.logger = logger;
    }

    /**
     * @param unitName The program name of the compilation unit, usually its file name.
     * @param verbosity The verbosity level, 0 to 4.
     * @return A logger for the driver phase of the unit.
     */
    public static CompilerLogger forUnit(String unitName, int verbosity) {
        return new CompilerLogger(unitName, verbosity, LoggerFactory.getLogger(CompilerLogger.class));
    }

    /**
     * @param phase The class of the phase, which names the SLF4J logger.
     * @return A logger for the same unit and verbosity that writes as {@code phase}.
     */
    public CompilerLogger forPhase(Class<?> phase) {
        return new CompilerLogger(unitName, verbosity, LoggerFactory.getLogger(phase));
    }

    /**
     * Logs a debug message.
     * @param format An SLF4J format string.
     * @param args The format arguments.
     */
    public void debug(String format, Object... args) {
        if (verbosity >= DEBUG && logger.isDebugEnabled()) {
            logger.debug(unitName + ": " + format, args);
        }
    }

    /**
     * Logs a trace message.
     * @param format An SLF4J format string.
     * @param args The format arguments.
     */
    public void trace(String format, Object... args) {
        if (verbosity >= TRACE && logger.isTraceEnabled()) {
            logger.trace(unitName + ": " + format, args);
        }
    }
}
