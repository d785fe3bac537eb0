/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.util;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.commons.lang3.CharUtils;
import org.eclipse.jdt.annotation.NonNull;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.SystemUtils;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FileUtils {

   private static final @NonNull CopyOption[] COPY_WITH_ATTRS_OPTIONS = {StandardCopyOption.COPY_ATTRIBUTES};
   private static final @NonNull CopyOption[] COPY_WITH_ATTRS_REPLACE_OPTIONS = {StandardCopyOption.COPY_ATTRIBUTES,
      StandardCopyOption.REPLACE_EXISTING};

   /**
    * Copies the content and the basic attributes (e.g. last modified time) of the given file, creating missing parent
    * directories of the target.
    *
    * @return number of bytes copied
    * @throws java.nio.file.FileAlreadyExistsException
    *            if {@code replaceExisting} is false and the target exists
    */
   public static long copyFile(final Path source, final Path target, final boolean replaceExisting) throws IOException {
      final var targetParent = target.getParent();
      if (targetParent != null) {
         Files.createDirectories(targetParent);
      }
      Files.copy(source, target, replaceExisting ? COPY_WITH_ATTRS_REPLACE_OPTIONS : COPY_WITH_ATTRS_OPTIONS);
      return Files.size(target);
   }

   /**
    * @return true if {@code path} is located below {@code parent} or is the same path
    */
   public static boolean isSameOrBelow(final Path path, final Path parent) {
      return toAbsolute(path).startsWith(toAbsolute(parent));
   }

   public static boolean isWritable(final Path path) {
      // Files.isWritable(targetRoot) seems to always return false SMB network shares
      return path.toFile().canWrite();
   }

   public static Path toAbsolute(Path path) {
      path = path.toAbsolutePath().normalize();

      if (SystemUtils.IS_OS_WINDOWS) {
         // ensure drive letter is uppercase
         final var pathStr = path.toString();
         if (!CharUtils.isAsciiAlphaUpper(pathStr.charAt(0)))
            return Path.of(Strings.capitalize(pathStr));
      }
      return path;
   }

   /**
    * @return the path of {@code file} relative to {@code root} using {@code /} as separator on all platforms
    */
   public static String toRelativeUnixPath(final Path root, final Path file) {
      final var relative = root.relativize(file).toString();
      return SystemUtils.IS_OS_WINDOWS ? relative.replace('\\', '/') : relative;
   }

   private FileUtils() {
   }
}
