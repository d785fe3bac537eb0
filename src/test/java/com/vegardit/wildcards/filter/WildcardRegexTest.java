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
class WildcardRegexTest {

   private static boolean matches(final String segment, final String name) {
      return WildcardRegex.compile(segment).matcher(name).matches();
   }

   @Test
   void testAsteriskMatchesWithinSegmentOnly() {
      assertThat(matches("*.txt", "a.txt")).isTrue();
      assertThat(matches("*.txt", ".txt")).isTrue();
      assertThat(matches("*.txt", "a.txt.bak")).isFalse();
      assertThat(matches("*.txt", "dir/a.txt")).isFalse();
      assertThat(matches("*", "anything")).isTrue();
      assertThat(matches("**", "anything")).isTrue();
      assertThat(matches("**", "a/b")).isFalse();
   }

   @Test
   void testQuestionMarkMatchesZeroOrOneCharacter() {
      assertThat(matches("test_?.txt", "test_0.txt")).isTrue();
      assertThat(matches("test_?.txt", "test_.txt")).isTrue();
      assertThat(matches("test_?.txt", "test_10.txt")).isFalse();
      assertThat(matches("fo?", "foo")).isTrue();
      assertThat(matches("fo?", "fo")).isTrue();
      assertThat(matches("fo?", "fo/")).isFalse();
   }

   @Test
   void testLeadingSlashIsOptional() {
      assertThat(matches("index.html", "/index.html")).isTrue();
      assertThat(matches("/index.html", "index.html")).isTrue();
      assertThat(matches("/index.html", "/index.html")).isTrue();
      assertThat(matches("index.html", "//index.html")).isFalse();
   }

   @Test
   void testExcludePrefixIsStripped() {
      assertThat(matches("!test_0.txt", "test_0.txt")).isTrue();
      assertThat(matches("!/*.log", "app.log")).isTrue();
      assertThat(matches("!test_0.txt", "!test_0.txt")).isFalse();
   }

   @Test
   void testRegexMetaCharactersAreLiterals() {
      assertThat(matches("a.b", "a.b")).isTrue();
      assertThat(matches("a.b", "axb")).isFalse();
      assertThat(matches("(x)+[y]{2}$", "(x)+[y]{2}$")).isTrue();
      assertThat(matches("a\\Eb*", "a\\Ebc")).isTrue();
      assertThat(matches("^name|other", "other")).isFalse();
   }

   @Test
   void testMatchingIsCaseSensitive() {
      assertThat(matches("*.TXT", "a.txt")).isFalse();
      assertThat(matches("Readme.md", "README.md")).isFalse();
   }

   @Test
   void testHasWildcards() {
      assertThat(WildcardRegex.hasWildcards("*.txt")).isTrue();
      assertThat(WildcardRegex.hasWildcards("fo?")).isTrue();
      assertThat(WildcardRegex.hasWildcards("**")).isTrue();
      assertThat(WildcardRegex.hasWildcards("file.cs")).isFalse();
      assertThat(WildcardRegex.hasWildcards("[abc]")).isFalse();
   }

   @Test
   void testAnyMatch() {
      final List<Pattern> patterns = List.of(WildcardRegex.compile("*.log"), WildcardRegex.compile("!tmp_?"));
      assertThat(WildcardRegex.anyMatch(patterns, "app.log")).isTrue();
      assertThat(WildcardRegex.anyMatch(patterns, "tmp_1")).isTrue();
      assertThat(WildcardRegex.anyMatch(patterns, "app.txt")).isFalse();
      assertThat(WildcardRegex.anyMatch(List.of(), "app.log")).isFalse();
   }
}
