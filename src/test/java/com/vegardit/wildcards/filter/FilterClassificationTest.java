/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class FilterClassificationTest {

   private static FilterClassification classify(final String... filters) {
      return FilterClassification.of(FilterSplitter.split(List.of(filters)));
   }

   @Test
   void testFileFiltersArePartitionedAndDeduplicated() {
      final var filters = classify("*.txt", "/*.txt", "!test_0.txt", "!/test_0.txt", "readme.md");

      assertThat(filters.inclusiveFileFilters()).containsExactly("*.txt", "readme.md");
      assertThat(filters.exclusiveFileRegexes()).hasSize(1);
      assertThat(filters.exclusiveFileRegexes().get(0).matcher("test_0.txt").matches()).isTrue();
      assertThat(filters.inclusiveFolderSelectors()).isEmpty();
      assertThat(filters.folderRewrites()).isEmpty();
   }

   @Test
   void testFolderFiltersAreRewritten() {
      final var filters = classify("a/b/c", "**/b", "!a/b");

      assertThat(filters.inclusiveFolderSelectors()).containsExactly("a", "**");
      // the expanded variant of **/b is a file filter
      assertThat(filters.inclusiveFileFilters()).containsExactly("b");

      assertThat(filters.folderRewrites()) //
         .extracting(FilterClassification.FolderRewrite::rewrittenFilter) //
         .containsExactly("/b/c", "/**/b", "!/b");

      assertThat(filters.rewrittenFiltersFor("a")).containsExactly("/b/c", "/**/b", "!/b");
      assertThat(filters.rewrittenFiltersFor("x")).containsExactly("/**/b");
   }

   @Test
   void testExclusiveFolderFiltersDoNotSelectDirectories() {
      final var filters = classify("!logs/*.tmp");

      assertThat(filters.inclusiveFolderSelectors()).isEmpty();
      assertThat(filters.isEmpty()).isTrue();
      assertThat(filters.rewrittenFiltersFor("logs")).containsExactly("!/*.tmp");
   }

   @Test
   void testWildcardSelectorRegex() {
      final var filters = classify("fo?/*.cs");

      final Pattern selectorRegex = filters.folderRewrites().get(0).selectorRegex();
      assertThat(selectorRegex.matcher("foo").matches()).isTrue();
      assertThat(selectorRegex.matcher("fo").matches()).isTrue();
      assertThat(selectorRegex.matcher("fooo").matches()).isFalse();
      assertThat(filters.rewrittenFiltersFor("fob")).containsExactly("/*.cs");
      assertThat(filters.rewrittenFiltersFor("bar")).isEmpty();
   }

   @Test
   void testRewrittenFiltersAreDistinct() {
      final var filters = classify("*/x.txt", "a/x.txt", "**/y.txt");

      assertThat(filters.rewrittenFiltersFor("a")).containsExactly("/x.txt", "/**/y.txt");
   }
}
