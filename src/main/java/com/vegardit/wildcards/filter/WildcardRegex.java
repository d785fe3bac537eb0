/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Converts single path segments with {@code *} and {@code ?} wildcards into anchored regular expressions.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class WildcardRegex {

   /**
    * Matches zero or more characters of a single path component.
    */
   private static final String ANY_CHARS = "[^/]*";

   /**
    * Matches zero or one character of a single path component.
    */
   private static final String OPTIONAL_CHAR = "[^/]?";

   /**
    * Returns true if any of the given patterns matches the whole input.
    */
   public static boolean anyMatch(final Collection<Pattern> patterns, final String input) {
      for (final Pattern pattern : patterns) {
         if (pattern.matcher(input).matches())
            return true;
      }
      return false;
   }

   /**
    * Compiles the given filter segment into a pattern matching exactly one path component.
    * <p>
    * A leading {@code !} and a leading {@code /} are removed first. All other characters except the wildcards are
    * matched literally. The resulting pattern accepts the name with or without a leading {@code /}.
    *
    * @param segment
    *           a single filter segment, e.g. {@code *.txt}, {@code !test_?.log} or {@code /src}
    */
   public static Pattern compile(String segment) {
      if (segment.startsWith("!")) {
         segment = segment.substring(1);
      }
      if (segment.startsWith("/")) {
         segment = segment.substring(1);
      }

      final var regex = new StringBuilder(segment.length() + 16);
      regex.append("^/?");
      final var literal = new StringBuilder();
      for (var i = 0; i < segment.length(); i++) {
         final char ch = segment.charAt(i);
         if (ch == '*' || ch == '?') {
            appendQuoted(regex, literal);
            regex.append(ch == '*' ? ANY_CHARS : OPTIONAL_CHAR);
         } else {
            literal.append(ch);
         }
      }
      appendQuoted(regex, literal);
      regex.append('$');
      return Pattern.compile(regex.toString());
   }

   public static boolean hasWildcards(final String filter) {
      return filter.indexOf('*') > -1 || filter.indexOf('?') > -1;
   }

   private static void appendQuoted(final StringBuilder regex, final StringBuilder literal) {
      if (literal.length() == 0)
         return;
      regex.append(Pattern.quote(literal.toString()));
      literal.setLength(0);
   }

   private WildcardRegex() {
   }
}
