/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.console;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableMap;

import com.settree.SetsConfigurationException;
import com.settree.SetsException;
import com.settree.algebra.SetFactory;
import com.settree.algebra.SetOperations;
import com.settree.algebra.StructuredSet;
import com.settree.algebra.TreeBackedSet;
import com.settree.config.ConfigurationProfiles;
import com.settree.config.SetsConfiguration;
import com.settree.parser.ElementConverter;
import com.settree.parser.ElementConverters;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

/**
 * Parses set expressions given on the command line and prints their
 * canonical form, one per line. With {@code -o} the expressions are
 * combined from left to right and only the result is printed.
 *
 * <pre>
 * settree -w '3,1,{2},1'                 prints {1,3,{2}}
 * settree -o union '{1,2}' '{2,3}'       prints {1,2,3}
 * </pre>
 */
public class SetsConsole
{
    private static final Logger logger = Logger.getLogger(SetsConsole.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INVALID = 2;

    private static final ImmutableMap<String, ElementConverter<?>> ELEMENT_TYPES =
        ImmutableMap.<String, ElementConverter<?>>builder()
            .put("int", ElementConverters.integers())
            .put("long", ElementConverters.longs())
            .put("double", ElementConverters.doubles())
            .put("decimal", ElementConverters.bigDecimals())
            .put("string", ElementConverters.strings())
            .put("boolean", ElementConverters.booleans())
            .build();

    @SuppressWarnings("all")
    private static Option[] OPTIONS = {
        OptionBuilder.withArgName("DELIM")
                     .withDescription("Element delimiter (default ',')")
                     .hasArg()
                     .create('d'),
        OptionBuilder.withArgName("DELIM")
                     .withDescription("Field terminator of multi-field elements")
                     .hasArg()
                     .create('f'),
        OptionBuilder.withDescription("Add the outer braces when they are missing")
                     .create('w'),
        OptionBuilder.withDescription("Leave empty elements out of the sets")
                     .create('i'),
        OptionBuilder.withArgName("TYPE")
                     .withDescription("Element type (int,long,double,decimal,string,boolean)")
                     .hasArg()
                     .create('t'),
        OptionBuilder.withArgName("FILE")
                     .withDescription("Configuration profiles file")
                     .hasArg()
                     .create('c'),
        OptionBuilder.withArgName("PROFILE")
                     .withDescription("Configuration profile to use")
                     .hasArg()
                     .create('p'),
        OptionBuilder.withArgName("OP")
                     .withDescription("Combine the sets (union,intersection,difference,symmetric)")
                     .hasArg()
                     .create('o'),
        OptionBuilder.withDescription("Report the empty elements of each set")
                     .create('v'),
        OptionBuilder.withDescription("Show this help")
                     .create('h')
    };

    private final PrintStream out;
    private final PrintStream err;

    public SetsConsole(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new SetsConsole(System.out, System.err).run(args));
    }

    /**
     * Runs the command and returns the exit status.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int run(String[] args) {
        Options options = new Options();
        Stream.of(OPTIONS).forEach(options::addOption);

        CommandLine cmd;
        try {
            CommandLineParser parser = new PosixParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            err.println(ex.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        if (cmd.hasOption('h')) {
            printHelp(options);
            return EXIT_OK;
        }

        String[] expressions = cmd.getArgs();
        if (expressions.length == 0) {
            printHelp(options);
            return EXIT_USAGE;
        }

        String type = cmd.getOptionValue('t', "int");
        ElementConverter<?> converter = ELEMENT_TYPES.get(type);
        if (converter == null) {
            err.println("unknown element type: " + type);
            return EXIT_USAGE;
        }

        String operation = cmd.getOptionValue('o');
        if (operation != null && !isOperation(operation)) {
            err.println("unknown operation: " + operation);
            return EXIT_USAGE;
        }

        SetsConfiguration configuration;
        try {
            configuration = configure(cmd);
        } catch (IOException ex) {
            logger.log(Level.FINE, "Failed to load configuration profiles", ex);
            err.println("failed to load configuration profiles: " + ex.getMessage());
            return EXIT_INVALID;
        } catch (SetsConfigurationException | NoSuchElementException | IllegalArgumentException ex) {
            logger.log(Level.FINE, "Invalid configuration", ex);
            err.println(ex.getMessage());
            return EXIT_USAGE;
        }

        try {
            evaluate(configuration, (ElementConverter)converter, operation, expressions, cmd.hasOption('v'));
            return EXIT_OK;
        } catch (SetsException | IllegalArgumentException ex) {
            logger.log(Level.FINE, "Invalid set expression", ex);
            err.println(ex.getMessage());
            return EXIT_INVALID;
        }
    }

    private static SetsConfiguration configure(CommandLine cmd) throws IOException {
        SetsConfiguration.Builder builder;

        String file = cmd.getOptionValue('c');
        String profile = cmd.getOptionValue('p');
        if (file != null) {
            ConfigurationProfiles profiles;
            try (Reader reader = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
                profiles = ConfigurationProfiles.load(reader);
            }
            builder = (profile == null ? profiles.global() : profiles.get(profile)).toBuilder();
        } else if (profile != null) {
            throw new IllegalArgumentException("a profile requires a configuration file (-c FILE)");
        } else {
            builder = SetsConfiguration.builder();
        }

        if (cmd.hasOption('d'))
            builder.rowTerminator(cmd.getOptionValue('d'));
        if (cmd.hasOption('f'))
            builder.fieldTerminator(cmd.getOptionValue('f'));
        if (cmd.hasOption('w'))
            builder.autoWrapBraces(true);
        if (cmd.hasOption('i'))
            builder.ignoreEmptyFields(true);
        return builder.build();
    }

    private <T extends Comparable<? super T>> void evaluate(
            SetsConfiguration configuration, ElementConverter<T> converter,
            String operation, String[] expressions, boolean verbose) {
        SetFactory<T> factory = TreeBackedSet.factory(configuration, converter);

        StructuredSet<T> result = null;
        for (String expression : expressions) {
            StructuredSet<T> set = factory.newSet(expression);
            if (verbose) {
                err.println(expression + ": " + set.tree().info().getNullElementCount() + " empty element(s)");
            }

            if (operation == null) {
                out.println(set.render());
            } else {
                result = result == null ? set : combine(operation, result, set);
            }
        }

        if (result != null) {
            out.println(result.render());
        }
    }

    private static boolean isOperation(String name) {
        switch (name) {
        case "union":
        case "intersection":
        case "difference":
        case "symmetric":
            return true;
        default:
            return false;
        }
    }

    private static <T> StructuredSet<T> combine(String operation, StructuredSet<T> a, StructuredSet<T> b) {
        switch (operation) {
        case "union":
            return SetOperations.union(a, b);
        case "intersection":
            return SetOperations.intersection(a, b);
        case "difference":
            return SetOperations.difference(a, b);
        case "symmetric":
            return SetOperations.symmetricDifference(a, b);
        default:
            throw new IllegalArgumentException("unknown operation: " + operation);
        }
    }

    private void printHelp(Options options) {
        PrintWriter pw = new PrintWriter(err);
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(pw, HelpFormatter.DEFAULT_WIDTH, "settree [OPTION]... EXPR...", null,
                            options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        pw.flush();
    }
}
