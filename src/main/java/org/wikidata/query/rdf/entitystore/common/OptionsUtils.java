package org.wikidata.query.rdf.entitystore.common;

import static com.google.common.io.Resources.getResource;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lexicalscope.jewel.cli.ArgumentValidationException;
import com.lexicalscope.jewel.cli.Cli;
import com.lexicalscope.jewel.cli.CliFactory;
import com.lexicalscope.jewel.cli.HelpRequestedException;
import com.lexicalscope.jewel.cli.Option;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;

/**
 * Command line parsing shared by the entity store tools.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class OptionsUtils {

    private static final Logger log = LoggerFactory.getLogger(OptionsUtils.class);
    private static final DateTimeFormatter DATABASE_DATE = DateTimeFormatter.ofPattern("ddMMyyyy");

    private OptionsUtils() {
    }

    /**
     * Options every tool accepts.
     */
    @SuppressWarnings("checkstyle:javadocmethod")
    public interface BasicOptions {
        @Option(shortName = "v", description = "Verbose mode")
        boolean verbose();

        @Option(helpRequest = true, description = "Show this message")
        boolean help();
    }

    /**
     * @return the given database name, or {@code wikidata} followed by the date as {@code ddMMyyyy} if it is null or empty
     */
    public static String databaseOrDefault(String database, LocalDate today) {
        if (database != null && !database.isEmpty()) return database;
        return "wikidata" + DATABASE_DATE.format(today);
    }

    /**
     * Parse the arguments and switch to the verbose logging configuration if asked to.
     * Exits if the arguments are invalid or help is requested.
     */
    public static <T extends BasicOptions> T handleOptions(Class<T> optionsClass, String... args) {
        T options = parseOptions(optionsClass, args);
        if (options.verbose()) {
            log.info("Verbose mode activated");
            LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            try {
                JoranConfigurator configurator = new JoranConfigurator();
                configurator.setContext(context);
                context.reset();
                configurator.doConfigure(getResource("logback-verbose.xml"));
            } catch (JoranException je) {
                // Reported by the status printer below
                log.debug("Could not load the verbose logging configuration", je);
            }
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        }
        return options;
    }

    /**
     * @throws ArgumentValidationException if the arguments don't match the options
     * @throws HelpRequestedException if help is requested
     */
    static <T> T parse(Class<T> optionsClass, String... args) throws ArgumentValidationException {
        return CliFactory.parseArguments(optionsClass, args);
    }

    @SuppressWarnings("checkstyle:regexpsinglelinejava")
    private static <T> T parseOptions(Class<T> optionsClass, String... args) {
        Cli<T> cli = CliFactory.createCli(optionsClass);
        PrintStream out = System.out;
        PrintStream err = System.err;
        try {
            return cli.parseArguments(args);
        } catch (HelpRequestedException hre) {
            out.println(cli.getHelpMessage());
            System.exit(0);
        } catch (ArgumentValidationException ave) {
            err.println("Invalid argument: " + ave.getMessage());
            err.println(cli.getHelpMessage());
            System.exit(1);
        }
        throw new IllegalStateException("Unreachable");
    }
}
