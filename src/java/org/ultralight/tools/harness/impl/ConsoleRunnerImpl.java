// Copyright 2017 Pants project contributors (see CONTRIBUTORS.md).
// Licensed under the Apache License, Version 2.0 (see LICENSE).

package org.ultralight.tools.harness.impl;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;

import org.apache.commons.io.IOUtils;
import org.apache.commons.io.output.TeeOutputStream;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.ultralight.args4j.InvalidCmdLineArgumentException;

/**
 * Discovers every {@link org.ultralight.harness.TestSuite} on the class path, runs all of their
 * tests and prints one line per failure.
 *
 * <p>The process exits with status 0 once the tests have run, however many of them failed. Only a
 * run that could not start (bad options, broken suite providers, unwritable output file) exits
 * with status 1.
 */
public class ConsoleRunnerImpl {
  /** Should be set to false for unit testing via {@link #setCallSystemExitOnFinish} */
  private static boolean callSystemExitOnFinish = true;
  /** Intended to be used in unit testing this class */
  private static ResultCollector testCollector = null;

  private static final String LOGGER_ROOT = "org.ultralight";
  // Held so the configured level is not lost when the logger would otherwise be collected.
  private static final Logger ROOT_LOGGER = Logger.getLogger(LOGGER_ROOT);
  private static final Logger LOG = Logger.getLogger(ConsoleRunnerImpl.class.getName());

  private final boolean summary;
  private final File output;
  private final ClassLoader classLoader;
  private final PrintStream out;
  private final PrintStream err;

  ConsoleRunnerImpl(
      boolean summary,
      File output,
      ClassLoader classLoader,
      PrintStream out,
      PrintStream err) {

    Preconditions.checkNotNull(classLoader);
    Preconditions.checkNotNull(out);
    Preconditions.checkNotNull(err);

    this.summary = summary;
    this.output = output;
    this.classLoader = classLoader;
    this.out = out;
    this.err = err;
  }

  void run() {
    int status = 0;
    OutputStream outputFile = null;
    try {
      PrintStream reports = out;
      if (output != null) {
        Files.createParentDirs(output);
        outputFile = new FileOutputStream(output, true);
        reports = new PrintStream(new TeeOutputStream(out, outputFile), true);
      }
      runTests(reports);
    } catch (SuiteLoadingException e) {
      status = 1;
      err.println(e.getMessage());
    } catch (IOException e) {
      status = 1;
      err.println("Failed to open output file " + output + ": " + e.getMessage());
    } finally {
      out.flush();
      IOUtils.closeQuietly(outputFile);
    }
    exit(status);
  }

  private void runTests(PrintStream reports) throws SuiteLoadingException {
    ForwardingResultCollector collector = new ForwardingResultCollector();
    if (testCollector != null) {
      collector.addCollector(testCollector);
    }
    TallyingResultCollector tally = new TallyingResultCollector();
    collector.addCollector(tally);
    collector.addCollector(new ConsoleResultCollector(reports));

    TestRegistry registry = new TestRegistry();
    int registered = new Registrar(registry, collector).registerAll(
        new SuiteLoader(classLoader).load());
    LOG.fine(String.format("Running %d registered tests", registered));

    registry.runAll();
    reports.flush();

    if (summary) {
      out.printf("Tests run: %d, Failures: %d%n", registry.size(), tally.getFailureCount());
    }
  }

  /**
   * Launcher for the harness console runner.
   *
   * @param args options from the command line
   */
  public static void main(String[] args) {
    /**
     * Command line option bean.
     */
    class Options {
      @Option(name = "-summary",
          usage = "Print the number of tests run and failures reported after the run.")
      private boolean summary;

      @Option(name = "-output",
          usage = "Also append every failure line to this file.")
      private File output;

      private Level logLevel = Level.WARNING;

      @Option(name = "-log-level",
          usage = "java.util.logging level for harness diagnostics on stderr. (default: WARNING)")
      public void setLogLevel(String logLevel) {
        try {
          this.logLevel = Level.parse(logLevel);
        } catch (IllegalArgumentException e) {
          throw new InvalidCmdLineArgumentException("-log-level", logLevel,
              "expected a java.util.logging level name or number");
        }
      }
    }

    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
    } catch (InvalidCmdLineArgumentException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      exit(1);
    }

    configureLogging(options.logLevel);

    ConsoleRunnerImpl runner =
        new ConsoleRunnerImpl(options.summary,
            options.output,
            MoreObjects.firstNonNull(Thread.currentThread().getContextClassLoader(),
                ConsoleRunnerImpl.class.getClassLoader()),
            // NB: Buffering helps speedup output-heavy tests.
            new PrintStream(new BufferedOutputStream(System.out), true),
            new PrintStream(new BufferedOutputStream(System.err), true));
    runner.run();
  }

  @VisibleForTesting
  static void configureLogging(Level level) {
    ROOT_LOGGER.setLevel(level);
    for (Handler handler : ROOT_LOGGER.getHandlers()) {
      ROOT_LOGGER.removeHandler(handler);
    }
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(level);
    ROOT_LOGGER.addHandler(handler);
    ROOT_LOGGER.setUseParentHandlers(false);
  }

  private static void exit(int code) {
    if (callSystemExitOnFinish) {
      // We're a main - its fine to exit.
      System.exit(code);
    } else {
      if (code != 0) {
        throw new RuntimeException("ConsoleRunner exited with status " + code);
      }
    }
  }

  // ---------------------------- For testing only ---------------------------------

  public static void setCallSystemExitOnFinish(boolean exitOnFinish) {
    callSystemExitOnFinish = exitOnFinish;
  }

  public static void addTestCollector(ResultCollector collector) {
    testCollector = collector;
  }
}
