/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Typed accessors for values of parsed YAML documents.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class MapUtils {

   public static @Nullable <T> Boolean getBoolean(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null; // CHECKSTYLE:IGNORE .*
      if (value instanceof final Boolean b)
         return b;
      return Boolean.parseBoolean(value.toString());
   }

   public static @Nullable <T> Path getPath(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      try {
         return Path.of(value.toString());
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as path. " + ex.getMessage(),
            ex);
      }
   }

   /**
    * Accepts a single path or a list of paths.
    */
   public static @Nullable <T> List<Path> getPathList(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      final var result = new ArrayList<Path>();
      final List<?> values = value instanceof final List<?> list ? list : List.of(value);
      for (final Object entry : values) {
         if (entry == null)
            throw new IllegalArgumentException("Attribute [" + key + "] must not contain empty list entries.");
         try {
            result.add(Path.of(entry.toString()));
         } catch (final InvalidPathException ex) {
            throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + entry + "] as path. " + ex
               .getMessage(), ex);
         }
      }
      return result;
   }

   @SuppressWarnings("unchecked")
   public static @Nullable <T> List<String> getStringList(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = remove ? map.remove(key) : map.get(key);
      if (value == null)
         return null;
      if (value instanceof List) {
         final var list = (List<Object>) value;
         if (list.contains(null))
            throw new IllegalArgumentException("Attribute [" + key + "] must not contain empty list entries.");
         list.replaceAll(Object::toString);
         return (List<String>) value;
      }
      throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list.");
   }

   private MapUtils() {
   }
}
