/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.util.ArrayList;
import java.util.List;

import net.sf.jstuff.core.logging.Logger;

/**
 * Splits raw filter strings into {@link DecomposedFilter}s.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FilterSplitter {

   private static final Logger LOG = Logger.create();

   public static final char EXCLUDE_PREFIX = '!';
   public static final char SEPARATOR = '/';

   /**
    * Splits a single raw filter.
    * <p>
    * A filter whose first segment is {@code **} yields two results: the filter itself and a copy without the leading
    * {@code **}, so that e.g. {@code **}{@code /index.html} matches in the current directory as well as in any
    * subdirectory.
    *
    * @return the decomposed variants, empty if the filter has no path segment at all
    */
   public static List<DecomposedFilter> split(final String filter) {
      if (filter == null)
         throw new IllegalArgumentException("Filter must not be null.");

      final boolean excludes = !filter.isEmpty() && filter.charAt(0) == EXCLUDE_PREFIX;
      final var segments = splitSegments(excludes ? filter.substring(1) : filter);
      if (segments.isEmpty()) {
         LOG.debug("Ignoring filter [%s] without path segments.", filter);
         return List.of();
      }

      final var decomposed = new DecomposedFilter(segments, excludes);
      if (decomposed.isAnyDepth() && !decomposed.isFileFilter())
         return List.of(decomposed, decomposed.withoutFirstSegment());
      return List.of(decomposed);
   }

   public static List<DecomposedFilter> split(final List<String> filters) {
      final var result = new ArrayList<DecomposedFilter>(filters.size() + 2);
      for (final String filter : filters) {
         result.addAll(split(filter));
      }
      return result;
   }

   static List<String> splitSegments(final String filter) {
      final var segments = new ArrayList<String>();
      int start = 0;
      for (int i = 0; i <= filter.length(); i++) {
         if (i == filter.length() || filter.charAt(i) == SEPARATOR) {
            if (i > start) {
               segments.add(filter.substring(start, i));
            }
            start = i + 1;
         }
      }
      return segments;
   }

   private FilterSplitter() {
   }
}
