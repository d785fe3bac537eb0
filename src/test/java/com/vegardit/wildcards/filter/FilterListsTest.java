/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import static org.assertj.core.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class FilterListsTest {

   @Test
   void testParseSkipsCommentsAndBlankLines() throws IOException {
      final String content = """
         # build output
         **/target/*.jar

         !**/target/test-*.jar  \t
         \\#literal.txt
            # indented lines are filters
         """;

      assertThat(FilterLists.parse(new BufferedReader(new StringReader(content)))).containsExactly( //
         "**/target/*.jar", //
         "!**/target/test-*.jar", //
         "#literal.txt", //
         "   # indented lines are filters");
   }

   @Test
   void testLeadingByteOrderMarkIsIgnored(@TempDir final Path tempDir) throws IOException {
      final var file = tempDir.resolve(".filters");
      Files.writeString(file, "\uFEFF*.txt\n!a.txt\n");

      assertThat(FilterLists.read(file)).containsExactly("*.txt", "!a.txt");
      assertThat(FilterLists.parse(new BufferedReader(new StringReader("\uFEFF# comment\nb.txt")))).containsExactly("b.txt");
   }

   @Test
   void testReadFile(@TempDir final Path tempDir) throws IOException {
      final var file = tempDir.resolve(".filters");
      Files.writeString(file, "*.txt\r\n!a.txt\r\n");

      assertThat(FilterLists.read(file)).containsExactly("*.txt", "!a.txt");
      assertThatThrownBy(() -> FilterLists.read(tempDir.resolve("missing"))).isInstanceOf(NoSuchFileException.class);
   }
}
