/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lazyNonNull;

import java.util.concurrent.Callable;
import java.util.logging.Level;

import com.vegardit.wildcards.command.AbstractCommand.VersionProvider;

import net.sf.jstuff.core.logging.Logger;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.reflection.Types;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command( //
   headerHeading = "" //
      + "           _ _     _                   _%n" //
      + " __      _(_) | __| | ___ __ _ _ __ __| |___%n" //
      + " \\ \\ /\\ / / | |/ _` |/ __/ _` | '__/ _` / __|%n" //
      + "  \\ V  V /| | | (_| | (_| (_| | | | (_| \\__ \\%n" //
      + "   \\_/\\_/ |_|_|\\__,_|\\___\\__,_|_|  \\__,_|___/%n" //
      + "%n", //
   mixinStandardHelpOptions = true, //
   descriptionHeading = "%n", //
   commandListHeading = "%nCommands%n", //
   parameterListHeading = "%nPositional parameters:%n", //
   optionListHeading = "%nOptions:%n", //
   requiredOptionMarker = '*', //
   usageHelpAutoWidth = true, //
   separator = " ", //
   showDefaultValues = true, //
   sortOptions = true, //
   versionProvider = VersionProvider.class //
)
public abstract class AbstractCommand implements Callable<Void> {
   public static final class VersionProvider implements IVersionProvider {
      @Override
      public String[] getVersion() throws Exception {
         return new String[] {Types.getVersion(AbstractCommand.class)};
      }
   }

   private static final Logger LOG = Logger.create();

   @Spec
   protected CommandSpec commandSpec = lazyNonNull();

   /**
    * logging options are not further evaluated, since it is already done in main entry point
    */
   @Mixin
   private LoggingOptionsMixin loggingOptions = lazyNonNull();

   @Override
   public final Void call() throws Exception {
      execute();
      LOG.debug("The operation completed successfully.");
      return null;
   }

   protected abstract void execute() throws Exception;

   @Option(names = {"-q", "--quiet"}, description = "Quiet mode.")
   private void setQuiet(final boolean flag) {
      if (flag) {
         Levels.setRootLevel(Level.SEVERE);
      }
   }

   @Option(names = {"-v", "--verbose"}, description = {"Specify multiple -v options to increase verbosity.", "For example `-v -v -v` or `-vvv`."})
   private void setVerbosity(final boolean[] flags) {
      switch (flags.length) {
         case 0:
            Levels.setRootLevel(Level.INFO);
            break;
         case 1:
            Levels.setRootLevel(Level.FINE);
            break;
         case 2:
            Levels.setRootLevel(Level.FINER);
            break;
         default:
            Levels.setRootLevel(Level.FINEST);
      }
   }
}
