/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.util.List;

/**
 * A filter split into its non-empty path segments.
 *
 * @param segments
 *           the {@code /}-separated components of the filter, never empty
 * @param excludes
 *           true if the filter was prefixed with {@code !}
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record DecomposedFilter(List<String> segments, boolean excludes) {

   public static final String ANY_DEPTH = "**";

   public DecomposedFilter {
      if (segments.isEmpty())
         throw new IllegalArgumentException("A filter requires at least one path segment.");
      segments = List.copyOf(segments);
   }

   public String firstSegment() {
      return segments.get(0);
   }

   public boolean isAnyDepth() {
      return ANY_DEPTH.equals(firstSegment());
   }

   /**
    * @return true if this filter matches file names in the current directory only
    */
   public boolean isFileFilter() {
      return segments.size() == 1;
   }

   public DecomposedFilter withoutFirstSegment() {
      return new DecomposedFilter(segments.subList(1, segments.size()), excludes);
   }
}
