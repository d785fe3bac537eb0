/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.copy;

import static com.vegardit.wildcards.util.Booleans.isTrue;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import com.vegardit.wildcards.command.AbstractFilterCommand;
import com.vegardit.wildcards.util.FileUtils;
import com.vegardit.wildcards.util.JdkLoggingUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@CommandLine.Command(name = "copy", //
   description = "Copies the files matched by the given wildcard filters into another directory preserving their relative paths." //
)
public class CopyCommand extends AbstractFilterCommand<CopyCommandConfig> {

   private static final Logger LOG = Logger.create();

   private final CopyStats stats = new CopyStats();

   public CopyCommand() {
      super(CopyCommandConfig::new);
   }

   @Override
   protected void doExecute(final List<CopyCommandConfig> tasks) throws Exception {
      stats.start();
      try {
         for (final CopyCommandConfig task : tasks) {
            copyFiles(task);
         }
      } finally {
         JdkLoggingUtils.withRootLogLevel(Level.INFO, stats::logStats);
      }
   }

   private void copyFiles(final CopyCommandConfig task) throws Exception {
      LOG.info("Copying files from [%s] to [%s]%s...", task.rootAbsolute, task.targetRootAbsolute, isTrue(task.dryRun) ? " (DRY RUN)"
            : "");

      final var files = new ArrayList<>(task.resolveFiles());
      files.sort(null);
      stats.onFilesMatched(files.size());

      for (final Path sourceFile : files) {
         // filters with ".." segments can select files outside of the source directory
         if (!FileUtils.isSameOrBelow(sourceFile, task.rootAbsolute)) {
            LOG.warn("Skipping [%s] located outside of source directory [%s].", sourceFile, task.rootAbsolute);
            stats.onFileOutsideRoot();
            continue;
         }

         final var relativePath = task.rootAbsolute.relativize(sourceFile);
         final var targetFile = task.targetRootAbsolute.resolve(relativePath);

         if (Files.exists(targetFile) && !isTrue(task.overwrite)) {
            LOG.debug("Skipping existing [%s]...", targetFile);
            stats.onFileSkipped();
            continue;
         }

         LOG.info("COPY [@|magenta %s|@]...", relativePath);
         if (isTrue(task.dryRun)) {
            stats.onFilePlanned(Files.size(sourceFile));
         } else {
            stats.onFileCopied(FileUtils.copyFile(sourceFile, targetFile, isTrue(task.overwrite)));
         }
      }
   }

   CopyStats getStats() {
      return stats;
   }

   @Override
   protected String getRootParamLabel() {
      return "SOURCE";
   }

   @Override
   protected String getYamlTasksKey() {
      return "copy";
   }

   @Override
   protected void validateCLI() {
      // if SOURCE is set, TARGET must be set too
      if (cfgCLI.root != null && cfgCLI.target == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameter: 'TARGET'");
   }

   @Option(names = "--dry-run", description = "Don't copy any files, only log what would be copied.")
   private void setDryRun(final boolean dryRun) {
      cfgCLI.dryRun = dryRun;
   }

   @Option(names = "--overwrite", description = "Replace files already existing in the target directory.")
   private void setOverwrite(final boolean overwrite) {
      cfgCLI.overwrite = overwrite;
   }

   @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE", description = "Directory the filters are resolved against.")
   private void setSourceParam(final String source) {
      setRoot(source);
   }

   @Parameters(index = "1", arity = "0..1", paramLabel = "TARGET", description = "Directory to copy the matched files to.")
   private void setTargetParam(final String target) {
      try {
         cfgCLI.target = Path.of(target);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Target path: " + ex.getMessage());
      }
   }
}
