/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.list;

import static com.vegardit.wildcards.util.Booleans.isTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.vegardit.wildcards.command.AbstractFilterCommand;
import com.vegardit.wildcards.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@CommandLine.Command(name = "list", //
   description = "Prints the files below a directory that are matched by the given wildcard filters." //
)
public class ListCommand extends AbstractFilterCommand<ListCommandConfig> {

   private static final Logger LOG = Logger.create();

   public ListCommand() {
      super(ListCommandConfig::new);
   }

   @Override
   protected void doExecute(final List<ListCommandConfig> tasks) throws Exception {
      final var out = commandSpec.commandLine().getOut();

      for (final ListCommandConfig task : tasks) {
         final var files = task.resolveFiles();
         LOG.debug("%s file(s) matched in [%s].", files.size(), task.rootAbsolute);

         final var lines = new ArrayList<String>(files.size());
         for (final Path file : files) {
            lines.add(isTrue(task.relative) ? FileUtils.toRelativeUnixPath(task.rootAbsolute, file) : file.toString());
         }
         if (isTrue(task.sort)) {
            lines.sort(null);
         }

         final var terminator = isTrue(task.print0) ? "\0" : System.lineSeparator();
         for (final String line : lines) {
            out.print(line);
            out.print(terminator);
         }
      }
      out.flush();
   }

   @Override
   protected String getRootParamLabel() {
      return "ROOT";
   }

   @Override
   protected String getYamlTasksKey() {
      return "list";
   }

   @Option(names = "--print0", description = "Terminate each printed path with a NUL character instead of a line break.")
   private void setPrint0(final boolean print0) {
      cfgCLI.print0 = print0;
   }

   @Option(names = "--relative", description = "Print paths relative to the root directory using / as separator.")
   private void setRelative(final boolean relative) {
      cfgCLI.relative = relative;
   }

   @Parameters(index = "0", arity = "0..1", paramLabel = "ROOT", description = "Directory the filters are resolved against.")
   private void setRootParam(final String root) {
      setRoot(root);
   }

   @Option(names = "--sort", description = "Sort the printed paths lexicographically.")
   private void setSort(final boolean sort) {
      cfgCLI.sort = sort;
   }
}
