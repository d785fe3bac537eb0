/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.wildcards.util.FileUtils;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.logging.Logger;

/**
 * Resolves gitignore-style wildcard filters against a directory tree.
 * <p>
 * Supported syntax:
 * <ul>
 * <li>{@code name}, {@code dir/name} - literal path segments separated by {@code /}</li>
 * <li>{@code *}, {@code ?} - zero or more / zero or one characters within a single path segment</li>
 * <li>{@code **} as first segment - the current directory and any subdirectory depth</li>
 * <li>leading {@code !} - excludes files matched by inclusive filters of the same directory level</li>
 * <li>leading {@code /} - optional, ignored</li>
 * </ul>
 * Exclusions never prevent descending into a directory. An excluding folder filter such as {@code !logs/*.tmp} is
 * carried into the matching subdirectories and only suppresses file matches there.
 * <p>
 * Resolution is depth-first and single-threaded. Symbolic links to directories are followed without cycle detection.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FilterResolver {

   private static final Logger LOG = Logger.create();

   /**
    * @param filters
    *           the filters to resolve, an empty list yields an empty result
    * @param root
    *           the directory the filters are relative to
    * @return the absolute paths of all matched files, unmodifiable
    * @throws IllegalArgumentException
    *            if {@code filters} is null, contains null entries or {@code root} is null or blank
    * @throws DirectoryNotFoundException
    *            if {@code root} is not an existing directory
    * @throws IOException
    *            if a directory of the tree cannot be listed, aborts the whole resolution
    */
   public static Set<Path> resolve(final @Nullable List<String> filters, final @Nullable Path root) throws IOException {
      if (filters == null)
         throw new IllegalArgumentException("[filters] must not be null.");
      if (root == null || Strings.isBlank(root.toString()))
         throw new IllegalArgumentException("[root] must not be null or blank.");
      for (final String filter : filters) {
         if (filter == null)
            throw new IllegalArgumentException("[filters] must not contain null entries.");
      }

      final var rootAbsolute = FileUtils.toAbsolute(root);
      if (!Files.isDirectory(rootAbsolute))
         throw new DirectoryNotFoundException(root.toString());

      if (filters.isEmpty())
         return Collections.emptySet();

      LOG.debug("Resolving filters %s in [%s]...", filters, rootAbsolute);
      final var result = new LinkedHashSet<Path>();
      resolveInto(filters, rootAbsolute, result);

      // literal "." or ".." segments produce non-normalized paths
      final var normalized = new LinkedHashSet<Path>(result.size());
      for (final Path file : result) {
         normalized.add(file.normalize());
      }
      return Collections.unmodifiableSet(normalized);
   }

   /**
    * @see #resolve(List, Path)
    */
   public static Set<Path> resolve(final @Nullable List<String> filters, final @Nullable String root) throws IOException {
      if (filters == null)
         throw new IllegalArgumentException("[filters] must not be null.");
      if (root == null || Strings.isBlank(root))
         throw new IllegalArgumentException("[root] must not be null or blank.");
      final Path rootPath;
      try {
         rootPath = Path.of(root);
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("[root] is not a valid path: " + ex.getMessage(), ex);
      }
      return resolve(filters, rootPath);
   }

   /**
    * Resolves the filters of one directory level and adds the matches to {@code result}.
    */
   static void resolveInto(final List<String> filters, final Path dir, final Set<Path> result) throws IOException {
      final var classification = FilterClassification.of(FilterSplitter.split(filters));
      if (classification.isEmpty())
         return;

      for (final String fileFilter : classification.inclusiveFileFilters()) {
         FileMatcher.match(dir, fileFilter, classification.exclusiveFileRegexes(), result);
      }

      final var visitedDirs = new HashSet<Path>();
      for (final String selector : classification.inclusiveFolderSelectors()) {
         DirectoryWalker.walk(dir, selector, classification, visitedDirs, result);
      }
   }

   private FilterResolver() {
   }
}
