/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import net.sf.jstuff.core.logging.Logger;

/**
 * Resolves folder filters by descending into the subdirectories selected by their first segment.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
final class DirectoryWalker {

   private static final Logger LOG = Logger.create();

   /**
    * Descends into every subdirectory of {@code dir} selected by {@code selector} and resolves the rewritten filters
    * that apply to it.
    *
    * @param selector
    *           first segment of an inclusive folder filter
    * @param visitedDirs
    *           subdirectories of {@code dir} already descended into during the current resolution call
    * @throws IOException
    *            if a directory cannot be listed
    */
   static void walk(final Path dir, final String selector, final FilterClassification filters, final Set<Path> visitedDirs,
         final Set<Path> result) throws IOException {
      if (!WildcardRegex.hasWildcards(selector)) {
         final var subDir = dir.resolve(selector);
         if (Files.isDirectory(subDir)) {
            descend(subDir, selector, filters, visitedDirs, result);
         }
         return;
      }

      final var regex = WildcardRegex.compile(selector);
      try (var entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
         for (final Path subDir : entries) {
            final var dirName = subDir.getFileName().toString();
            if (regex.matcher(dirName).matches()) {
               descend(subDir, dirName, filters, visitedDirs, result);
            }
         }
      }
   }

   private static void descend(final Path subDir, final String dirName, final FilterClassification filters, final Set<Path> visitedDirs,
         final Set<Path> result) throws IOException {
      // the rewritten filters only depend on the directory name, so a second visit yields the same files
      if (!visitedDirs.add(subDir))
         return;

      final var subFilters = filters.rewrittenFiltersFor(dirName);
      if (subFilters.isEmpty())
         return;

      LOG.debug("Descending into [%s] with filters %s...", subDir, subFilters);
      FilterResolver.resolveInto(subFilters, subDir, result);
   }

   private DirectoryWalker() {
   }
}
