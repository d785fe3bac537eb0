/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command;

import static com.vegardit.wildcards.util.MapUtils.*;
import static net.sf.jstuff.core.validation.NullAnalysisHelper.lazyNonNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.wildcards.filter.FilterLists;
import com.vegardit.wildcards.filter.FilterResolver;
import com.vegardit.wildcards.util.FileUtils;
import com.vegardit.wildcards.util.YamlUtils.ToYamlString;

import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.logging.Logger;

/**
 * Settings shared by all commands that resolve a filter list against a root directory.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public abstract class AbstractFilterCommandConfig<THIS extends AbstractFilterCommandConfig<THIS>> {

   private static final Logger LOG = Logger.create();

   public @Nullable @ToYamlString(ignore = true) Path root;
   public @ToYamlString(name = "root") Path rootAbsolute = lazyNonNull(); // computed value

   public @Nullable List<String> filters;
   public @Nullable @ToYamlString(name = "filters-file") List<Path> filtersFiles;

   /**
    * {@link #filters} followed by the filters read from {@link #filtersFiles}.
    */
   public @ToYamlString(name = "effective-filters") List<String> effectiveFilters = lazyNonNull(); // computed value

   @SuppressWarnings({"unchecked", "rawtypes"})
   protected THIS newInstance() {
      return (THIS) new AbstractFilterCommandConfig() {};
   }

   /**
    * @return the name of the YAML key holding the root directory
    */
   protected String rootConfigKey() {
      return "root";
   }

   /**
    * Applies default values to null settings
    */
   public void applyDefaults() {
      final THIS defaults = newInstance();
      defaults.filters = Collections.emptyList();
      defaults.filtersFiles = Collections.emptyList();
      applyFrom(defaults, false);
   }

   /**
    * Applies all non-null settings from the given config object to this config object
    */
   public void applyFrom(final @Nullable THIS other, final boolean override) {
      if (other == null)
         return;

      if (override && other.root != null || root == null) {
         root = other.root;
      }
      final var other_filters = other.filters;
      if (override && other_filters != null || filters == null) {
         filters = other_filters;
      }
      final var other_filtersFiles = other.filtersFiles;
      if (override && other_filtersFiles != null || filtersFiles == null) {
         filtersFiles = other_filtersFiles;
      }
   }

   /**
    * @return a map with any unused config parameters
    */
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();
      final var cfg = new HashMap<>(config);
      final THIS defaults = newInstance();
      defaults.root = getPath(cfg, rootConfigKey(), true);
      defaults.filters = getStringList(cfg, "filters", true);
      defaults.filtersFiles = getPathList(cfg, "filters-file", true);
      applyFrom(defaults, override);
      return cfg;
   }

   /**
    * Validates the settings and computes derived values.
    *
    * @throws IOException
    *            if a filters file cannot be read
    */
   public void compute() throws IOException {
      final var root = this.root;
      if (root == null)
         throw new IllegalArgumentException("Root directory is not specified!");
      rootAbsolute = FileUtils.toAbsolute(root);
      if (!Files.exists(rootAbsolute))
         throw new IllegalArgumentException("Root path [" + root + "] does not exist!");
      if (!Files.isDirectory(rootAbsolute))
         throw new IllegalArgumentException("Root path [" + root + "] is not a directory!");
      if (!Files.isReadable(rootAbsolute))
         throw new IllegalArgumentException("Root path [" + root + "] is not readable by user [" + SystemUtils.USER_NAME + "]!");

      final var effectiveFilters = new ArrayList<String>();
      final var filters = this.filters;
      if (filters != null) {
         effectiveFilters.addAll(filters);
      }
      final var filtersFiles = this.filtersFiles;
      if (filtersFiles != null) {
         for (final Path filtersFile : filtersFiles) {
            if (!Files.isRegularFile(filtersFile))
               throw new IllegalArgumentException("Filters file [" + filtersFile + "] does not exist!");
            effectiveFilters.addAll(FilterLists.read(filtersFile));
         }
      }
      this.effectiveFilters = List.copyOf(effectiveFilters);

      if (this.effectiveFilters.isEmpty()) {
         LOG.warn("No filters configured for [%s], nothing will be matched.", rootAbsolute);
      }
   }

   /**
    * Resolves {@link #effectiveFilters} against {@link #rootAbsolute}. Requires a prior call to {@link #compute()}.
    */
   public Set<Path> resolveFiles() throws IOException {
      return FilterResolver.resolve(effectiveFilters, rootAbsolute);
   }
}
