/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.util;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class FileUtilsTest {

   @Test
   void testCopyFile(@TempDir final Path tempDir) throws IOException {
      final var source = Files.writeString(tempDir.resolve("source.txt"), "hello");
      final var lastModified = FileTime.from(Instant.parse("2020-01-01T10:00:00Z"));
      Files.setLastModifiedTime(source, lastModified);

      final var target = tempDir.resolve("a/b/target.txt");
      assertThat(FileUtils.copyFile(source, target, false)).isEqualTo(5);
      assertThat(target).hasContent("hello");
      assertThat(Files.getLastModifiedTime(target)).isEqualTo(lastModified);

      Files.writeString(source, "hello world");
      assertThatThrownBy(() -> FileUtils.copyFile(source, target, false)).isInstanceOf(FileAlreadyExistsException.class);
      assertThat(FileUtils.copyFile(source, target, true)).isEqualTo(11);
      assertThat(target).hasContent("hello world");
   }

   @Test
   void testIsSameOrBelow(@TempDir final Path tempDir) {
      final var parent = tempDir.resolve("parent");

      assertThat(FileUtils.isSameOrBelow(parent, parent)).isTrue();
      assertThat(FileUtils.isSameOrBelow(parent.resolve("child"), parent)).isTrue();
      assertThat(FileUtils.isSameOrBelow(parent.resolve("child/../../other"), parent)).isFalse();
      assertThat(FileUtils.isSameOrBelow(tempDir.resolve("parent2"), parent)).isFalse();
   }

   @Test
   void testToRelativeUnixPath(@TempDir final Path tempDir) {
      assertThat(FileUtils.toRelativeUnixPath(tempDir, tempDir.resolve("a").resolve("b.txt"))).isEqualTo("a/b.txt");
      assertThat(FileUtils.toRelativeUnixPath(tempDir, tempDir.resolve("c.txt"))).isEqualTo("c.txt");
   }

   @Test
   void testToAbsolute() {
      final var path = FileUtils.toAbsolute(Path.of("a/../b"));
      assertThat(path.isAbsolute()).isTrue();
      assertThat(path.getFileName()).hasToString("b");
   }
}
