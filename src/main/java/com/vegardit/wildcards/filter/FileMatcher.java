/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies a single-segment filter to the files located directly in a directory.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
final class FileMatcher {

   /**
    * Adds all files of {@code dir} matching {@code fileFilter} and none of {@code exclusions} to {@code result}.
    *
    * @param fileFilter
    *           an inclusive single-segment filter, either a literal file name or a wildcard expression
    * @param exclusions
    *           compiled exclusive file filters of the same resolution call
    * @throws IOException
    *            if the directory cannot be listed
    */
   static void match(final Path dir, final String fileFilter, final List<Pattern> exclusions, final Set<Path> result)
         throws IOException {
      if (!WildcardRegex.hasWildcards(fileFilter)) {
         final var file = dir.resolve(fileFilter);
         if (Files.isRegularFile(file) && !WildcardRegex.anyMatch(exclusions, fileFilter)) {
            result.add(file);
         }
         return;
      }

      final var regex = WildcardRegex.compile(fileFilter);
      try (var entries = Files.newDirectoryStream(dir, Files::isRegularFile)) {
         for (final Path file : entries) {
            final var fileName = file.getFileName().toString();
            if (regex.matcher(fileName).matches() && !WildcardRegex.anyMatch(exclusions, fileName)) {
               result.add(file);
            }
         }
      }
   }

   private FileMatcher() {
   }
}
