/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.*;

import java.io.IOException;
import java.util.List;
import java.util.logging.FileHandler;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiConsole;
import org.fusesource.jansi.AnsiRenderer;

import com.vegardit.wildcards.command.AbstractCommand;
import com.vegardit.wildcards.command.LoggingOptionsMixin;
import com.vegardit.wildcards.command.copy.CopyCommand;
import com.vegardit.wildcards.command.list.ListCommand;
import com.vegardit.wildcards.util.JdkLoggingUtils;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.io.StringPrintWriter;
import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.RunLast;
import picocli.CommandLine.Unmatched;
import picocli.CommandLine.UnmatchedArgumentException;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "wildcards", //
   description = "Selects files of a directory tree using gitignore-style wildcard filters.", //
   synopsisSubcommandLabel = "COMMAND", //
   subcommands = { //
      ListCommand.class, //
      CopyCommand.class //
   } //
)
public class WildcardsMain extends AbstractCommand {

   public static class LoggingOptions extends LoggingOptionsMixin {
      @Unmatched
      List<String> ignored = lazyNonNull();
   }

   private static final Logger LOG = Logger.create();

   @Nullable
   private static FileHandler configureLogging(final String[] args) throws IOException {
      final var loggingOptions = new LoggingOptions();
      CommandLine.populateCommand(loggingOptions, args);
      JdkLoggingUtils.configureConsoleHandler(new JdkLoggingUtils.AnsiFormatter());

      final var logFile = loggingOptions.logFile;
      if (logFile == null)
         return null;
      return JdkLoggingUtils.addFileHandler(logFile.toAbsolutePath().toString());
   }

   /**
    * Creates the command line handler with logger based exception handling.
    */
   static CommandLine createCommandLine() {
      final var handler = new CommandLine(new WildcardsMain());
      handler.setCaseInsensitiveEnumValuesAllowed(true);
      handler.setExecutionStrategy(new RunLast());
      handler.setHelpFactory((commandSpec, colorScheme) -> new Help(commandSpec, colorScheme) {

         @Nullable
         @Override
         public String headerHeading(final Object @Nullable... params) {
            return AnsiRenderer.render(super.headerHeading(params));
         }
      });

      /*
       * custom exception handlers that use a logger instead of directly writing to stdout/stderr
       */
      handler.setParameterExceptionHandler((ex, args) -> {
         if (args.length == 0) {
            CommandLine.usage(handler, System.err);
            System.err.println();
            LOG.error(ex.getMessage());
         } else {
            LOG.error(ex.getMessage());
            try (var sw = new StringPrintWriter()) {
               UnmatchedArgumentException.printSuggestions(ex, sw);
               final var suggestions = sw.toString();
               if (Strings.isNotBlank(suggestions)) {
                  LOG.info(Strings.trim(suggestions));
               }
            }
            LOG.info("Execute 'wildcards --help' for usage help.");
         }
         return 1;
      });
      handler.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
         if (LOG.isDebugEnabled() || ex instanceof UnsupportedOperationException || ex instanceof NullPointerException) {
            LOG.error(ex); // log with stacktrace
         } else {
            LOG.error(ex.getClass().getSimpleName() + ": " + ex.getMessage());
         }
         return 1;
      });
      return handler;
   }

   public static void main(final String[] args) throws Exception {
      Thread.currentThread().setName("main");

      // the logging options are evaluated before any other component may log or fail
      final var fileHandler = configureLogging(args);

      // enable ANSI coloring
      AnsiConsole.systemInstall();

      final int exitCode;
      try {
         exitCode = createCommandLine().execute(args);
      } finally {
         if (fileHandler != null) {
            fileHandler.close();
         }
         AnsiConsole.systemUninstall();
      }
      System.exit(exitCode);
   }

   @Override
   protected void execute() throws Exception {
      throw new ParameterException(commandSpec.commandLine(), "Missing required subcommand.");
   }
}
