/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import net.sf.jstuff.core.logging.Logger;

/**
 * Reads filter lists in {@code .gitignore} file layout: one filter per line, {@code #} starts a comment line.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FilterLists {

   private static final Logger LOG = Logger.create();

   private static final char BYTE_ORDER_MARK = '\uFEFF';

   public static List<String> parse(final BufferedReader reader) throws IOException {
      final var filters = new ArrayList<String>();
      String line;
      boolean isFirstLine = true;
      while ((line = reader.readLine()) != null) {
         if (isFirstLine) {
            isFirstLine = false;
            if (!line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
               line = line.substring(1);
            }
         }
         line = line.stripTrailing();
         if (line.isEmpty() || line.charAt(0) == '#') {
            continue;
         }
         if (line.startsWith("\\#")) {
            line = line.substring(1);
         }
         filters.add(line);
      }
      return filters;
   }

   public static List<String> read(final Path file) throws IOException {
      LOG.debug("Reading filters from [%s]...", file);
      try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
         return parse(reader);
      }
   }

   private FilterLists() {
   }
}
