/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.wildcards.util.YamlUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * Base class of commands operating on the files matched by a filter list.
 * <p>
 * Settings are merged in the order: command line, task entry of the YAML config file, {@code defaults:} section of
 * the YAML config file, built-in defaults.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public abstract class AbstractFilterCommand<C extends AbstractFilterCommandConfig<C>> extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   private final Supplier<C> cfgInstanceFactory;
   protected final C cfgCLI;
   private @Nullable C cfgYamlDefaults;
   private @Nullable List<C> cfgYamlTasks;

   protected AbstractFilterCommand(final Supplier<C> cfgInstanceFactory) {
      this.cfgInstanceFactory = cfgInstanceFactory;
      cfgCLI = cfgInstanceFactory.get();
   }

   protected abstract void doExecute(List<C> tasks) throws Exception;

   /**
    * @return label of the positional root directory parameter used in error messages
    */
   protected abstract String getRootParamLabel();

   /**
    * @return name of the YAML config key holding the task list of this command
    */
   protected abstract String getYamlTasksKey();

   /**
    * Hook for subclasses to verify command specific command line parameters.
    */
   protected void validateCLI() {
   }

   @Override
   protected final void execute() throws Exception {
      final var cfgYamlTasks = this.cfgYamlTasks;

      // if no tasks are configured in YAML, the root must be set
      if (cfgCLI.root == null && cfgYamlTasks == null)
         throw new ParameterException(commandSpec.commandLine(), "Missing required parameter: '" + getRootParamLabel() + "'");

      validateCLI();

      final var taskCfgs = new ArrayList<C>();
      if (cfgYamlTasks == null) {
         cfgCLI.applyFrom(cfgYamlDefaults, false);
         cfgCLI.applyDefaults();
         cfgCLI.compute();
         taskCfgs.add(cfgCLI);
      } else {
         for (final var cfgYamlTask : cfgYamlTasks) {
            cfgYamlTask.applyFrom(cfgCLI, true);
            cfgYamlTask.applyFrom(cfgYamlDefaults, false);
            cfgYamlTask.applyDefaults();
            cfgYamlTask.compute();
            taskCfgs.add(cfgYamlTask);
         }
      }

      for (final var taskCfg : taskCfgs) {
         LOG.debug("Effective config:\n%s", YamlUtils.toYamlString(taskCfg));
      }

      doExecute(taskCfgs);
   }

   @SuppressWarnings("unchecked")
   @Option(names = "--config", paramLabel = "<path>", description = "Path to a YAML config file.")
   private void setConfig(final String configPath) throws IOException {
      LOG.info("Loading config [%s]...", configPath);
      final Map<String, Object> yamlCfg = YamlUtils.parseYaml(Path.of(configPath));

      // process defaults
      final var yamlDefaults = (Map<String, Object>) yamlCfg.remove("defaults");
      if (yamlDefaults != null) {
         final var cfgYamlDefaults = this.cfgYamlDefaults = cfgInstanceFactory.get();
         final var unusedParams = cfgYamlDefaults.applyFrom(yamlDefaults, true);
         if (!unusedParams.isEmpty()) {
            yamlCfg.put("defaults", unusedParams);
         }
      }

      // process tasks
      final var tasksKey = getYamlTasksKey();
      final var yamlTasks = (List<Map<String, Object>>) yamlCfg.remove(tasksKey);
      if (yamlTasks != null && !yamlTasks.isEmpty()) {
         final var cfgYamlTasks = this.cfgYamlTasks = new ArrayList<>();

         for (final var yamlTask : yamlTasks) {
            final var taskCfg = cfgInstanceFactory.get();
            final var unusedParams = taskCfg.applyFrom(yamlTask, true);

            if (!unusedParams.isEmpty()) {
               ((List<Map<String, Object>>) yamlCfg.computeIfAbsent(tasksKey, k -> new ArrayList<>())).add(unusedParams);
            }
            cfgYamlTasks.add(taskCfg);
         }
      }

      if (!yamlCfg.isEmpty())
         throw new IllegalArgumentException("The following settings found in the config file are unknown:\n" + YamlUtils.toYamlString(
            yamlCfg));
   }

   @Option(names = "--filter", paramLabel = "<pattern>", //
      description = {"Wildcard filter selecting the files to process. Can be specified multiple times.",
         "Supports *, ?, a leading **/ for any directory depth and a leading ! to exclude files."})
   private void setFilters(final List<String> filters) {
      cfgCLI.filters = filters;
   }

   @Option(names = "--filters-file", paramLabel = "<path>", //
      description = "File with one filter per line. Empty lines and lines starting with # are ignored. Can be specified multiple times.")
   private void setFiltersFiles(final List<String> filtersFiles) {
      final var paths = new ArrayList<Path>(filtersFiles.size());
      for (final String filtersFile : filtersFiles) {
         try {
            paths.add(Path.of(filtersFile));
         } catch (final InvalidPathException ex) {
            throw new ParameterException(commandSpec.commandLine(), "Filters file: " + ex.getMessage());
         }
      }
      cfgCLI.filtersFiles = paths;
   }

   protected void setRoot(final String root) {
      try {
         cfgCLI.root = Path.of(root);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), getRootParamLabel() + " path: " + ex.getMessage());
      }
   }
}
