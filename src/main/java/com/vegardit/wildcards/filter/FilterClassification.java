/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Partitions the decomposed filters of one directory level into file filters and folder filters, each split into
 * inclusive and exclusive ones.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FilterClassification {

   /**
    * Pairs the regex of a folder filter's first segment with the filter to apply inside each matching subdirectory.
    */
   public record FolderRewrite(Pattern selectorRegex, String rewrittenFilter) {

      public boolean appliesTo(final String dirName) {
         return selectorRegex.matcher(dirName).matches();
      }
   }

   public static FilterClassification of(final List<DecomposedFilter> filters) {
      final var fileFilters = new LinkedHashSet<String>();
      final var inclusiveFolderSelectors = new LinkedHashSet<String>();
      final var folderRewrites = new ArrayList<FolderRewrite>();

      for (final DecomposedFilter filter : filters) {
         if (filter.isFileFilter()) {
            fileFilters.add(filter.excludes() ? FilterSplitter.EXCLUDE_PREFIX + filter.firstSegment() : filter.firstSegment());
            continue;
         }

         final var segments = filter.segments();
         // a leading ** stays part of the rewritten filter so that it keeps matching at deeper levels
         final int joinStart = filter.isAnyDepth() ? 0 : 1;
         final var rewritten = new StringBuilder();
         if (filter.excludes()) {
            rewritten.append(FilterSplitter.EXCLUDE_PREFIX);
         }
         rewritten.append(FilterSplitter.SEPARATOR);
         rewritten.append(String.join(String.valueOf(FilterSplitter.SEPARATOR), segments.subList(joinStart, segments.size())));
         folderRewrites.add(new FolderRewrite(WildcardRegex.compile(filter.firstSegment()), rewritten.toString()));

         if (!filter.excludes()) {
            inclusiveFolderSelectors.add(filter.firstSegment());
         }
      }

      final var inclusiveFileFilters = new ArrayList<String>();
      final var exclusiveFileRegexes = new ArrayList<Pattern>();
      for (final String fileFilter : fileFilters) {
         if (fileFilter.charAt(0) == FilterSplitter.EXCLUDE_PREFIX) {
            exclusiveFileRegexes.add(WildcardRegex.compile(fileFilter));
         } else {
            inclusiveFileFilters.add(fileFilter);
         }
      }

      return new FilterClassification( //
         List.copyOf(inclusiveFileFilters), //
         List.copyOf(exclusiveFileRegexes), //
         List.copyOf(inclusiveFolderSelectors), //
         List.copyOf(folderRewrites));
   }

   private final List<String> inclusiveFileFilters;
   private final List<Pattern> exclusiveFileRegexes;
   private final List<String> inclusiveFolderSelectors;
   private final List<FolderRewrite> folderRewrites;

   private FilterClassification(final List<String> inclusiveFileFilters, final List<Pattern> exclusiveFileRegexes,
         final List<String> inclusiveFolderSelectors, final List<FolderRewrite> folderRewrites) {
      this.inclusiveFileFilters = inclusiveFileFilters;
      this.exclusiveFileRegexes = exclusiveFileRegexes;
      this.inclusiveFolderSelectors = inclusiveFolderSelectors;
      this.folderRewrites = folderRewrites;
   }

   public List<Pattern> exclusiveFileRegexes() {
      return exclusiveFileRegexes;
   }

   public List<FolderRewrite> folderRewrites() {
      return folderRewrites;
   }

   public List<String> inclusiveFileFilters() {
      return inclusiveFileFilters;
   }

   public List<String> inclusiveFolderSelectors() {
      return inclusiveFolderSelectors;
   }

   public boolean isEmpty() {
      return inclusiveFileFilters.isEmpty() && inclusiveFolderSelectors.isEmpty();
   }

   /**
    * Returns the rewritten filters of all folder filters whose first segment matches the given directory name.
    *
    * @return the distinct rewritten filters in declaration order, may be empty
    */
   public List<String> rewrittenFiltersFor(final String dirName) {
      final var result = new LinkedHashSet<String>();
      for (final FolderRewrite rewrite : folderRewrites) {
         if (rewrite.appliesTo(dirName)) {
            result.add(rewrite.rewrittenFilter());
         }
      }
      return List.copyOf(result);
   }
}
