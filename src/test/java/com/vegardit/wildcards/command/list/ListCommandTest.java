/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.list;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import picocli.CommandLine.ParameterException;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class ListCommandTest {

   private static void createFiles(final Path root, final String... relativePaths) throws IOException {
      for (final String relativePath : relativePaths) {
         final var file = root.resolve(relativePath);
         Files.createDirectories(file.getParent());
         Files.writeString(file, relativePath);
      }
   }

   private static String list(final String... args) throws Exception {
      final var out = new StringWriter();
      final var cmd = new ListCommand();
      final var cli = new CommandLine(cmd);
      cli.setOut(new PrintWriter(out));
      cli.parseArgs(args);
      cmd.call();
      return out.toString();
   }

   @Test
   void testListRelativeSorted(@TempDir final Path tempDir) throws Exception {
      createFiles(tempDir, "b.txt", "a.txt", "sub/c.txt", "sub/d.log");

      final var output = list(tempDir.toString(), "--filter", "**/*.txt", "--relative", "--sort");

      assertThat(output.lines()).containsExactly("a.txt", "b.txt", "sub/c.txt");
   }

   @Test
   void testListAbsolute(@TempDir final Path tempDir) throws Exception {
      createFiles(tempDir, "a.txt", "b.log");

      final var output = list(tempDir.toString(), "--filter", "*.txt");

      assertThat(output.lines()).containsExactly(tempDir.toAbsolutePath().normalize().resolve("a.txt").toString());
   }

   @Test
   void testPrint0(@TempDir final Path tempDir) throws Exception {
      createFiles(tempDir, "a.txt", "b.txt");

      final var output = list(tempDir.toString(), "--filter", "*.txt", "--relative", "--sort", "--print0");

      assertThat(output).isEqualTo("a.txt\0b.txt\0");
   }

   @Test
   void testFiltersFile(@TempDir final Path tempDir) throws Exception {
      final var root = Files.createDirectory(tempDir.resolve("root"));
      createFiles(root, "a.txt", "b.txt", "c.log");
      final var filtersFile = tempDir.resolve("filters.txt");
      Files.writeString(filtersFile, "# text files except b\n*.txt\n!b.txt\n");

      final var output = list(root.toString(), "--filters-file", filtersFile.toString(), "--filter", "*.log", "--relative", "--sort");

      assertThat(output.lines()).containsExactly("a.txt", "c.log");
   }

   @Test
   void testNoFiltersMatchesNothing(@TempDir final Path tempDir) throws Exception {
      createFiles(tempDir, "a.txt");

      assertThat(list(tempDir.toString())).isEmpty();
   }

   @Test
   void testMissingRootIsRejected() {
      assertThatThrownBy(() -> list("--filter", "*.txt")) //
         .isInstanceOf(ParameterException.class) //
         .hasMessageContaining("Missing required parameter: 'ROOT'");
   }

   @Test
   void testInvalidRootIsRejected(@TempDir final Path tempDir) throws Exception {
      createFiles(tempDir, "a.txt");

      assertThatThrownBy(() -> list(tempDir.resolve("missing").toString(), "--filter", "*")) //
         .isInstanceOf(IllegalArgumentException.class) //
         .hasMessageContaining("does not exist");
      assertThatThrownBy(() -> list(tempDir.resolve("a.txt").toString(), "--filter", "*")) //
         .isInstanceOf(IllegalArgumentException.class) //
         .hasMessageContaining("is not a directory");
      assertThatThrownBy(() -> list(tempDir.toString(), "--filters-file", tempDir.resolve("missing").toString())) //
         .isInstanceOf(IllegalArgumentException.class) //
         .hasMessageContaining("Filters file");
   }

   @Test
   void testYamlConfig(@TempDir final Path tempDir) throws Exception {
      final var root1 = Files.createDirectory(tempDir.resolve("root1"));
      final var root2 = Files.createDirectory(tempDir.resolve("root2"));
      createFiles(root1, "a.txt", "b.log");
      createFiles(root2, "c.txt", "d.log");

      final Path cfg = tempDir.resolve("cfg.yaml");
      Files.writeString(cfg, "" //
            + "defaults:\n" //
            + "  relative: true\n" //
            + "  filters:\n" //
            + "  - '*.txt'\n" //
            + "list:\n" //
            + "- root: '" + root1 + "'\n" //
            + "- root: '" + root2 + "'\n" //
            + "  filters: ['*.log']\n");

      assertThat(list("--config", cfg.toString()).lines()).containsExactly("a.txt", "d.log");

      // command line settings override the YAML settings of all tasks
      assertThat(list("--config", cfg.toString(), "--filter", "*").lines()).containsExactlyInAnyOrder("a.txt", "b.log", "c.txt",
         "d.log");
   }

   @Test
   void testYamlConfigWithUnknownSettingIsRejected(@TempDir final Path tempDir) throws Exception {
      final Path cfg = tempDir.resolve("cfg.yaml");
      Files.writeString(cfg, "" //
            + "list:\n" //
            + "- root: '" + tempDir + "'\n" //
            + "  recursive: true\n");

      // picocli wraps exceptions thrown by option setters
      assertThatThrownBy(() -> list("--config", cfg.toString())) //
         .isInstanceOf(CommandLine.PicocliException.class) //
         .hasStackTraceContaining("are unknown") //
         .hasStackTraceContaining("recursive");
   }
}
