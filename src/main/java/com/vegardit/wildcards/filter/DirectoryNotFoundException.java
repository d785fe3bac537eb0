/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.filter;

import java.nio.file.NoSuchFileException;

/**
 * Thrown if the root directory of a filter resolution does not exist or is not a directory.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class DirectoryNotFoundException extends NoSuchFileException {

   private static final long serialVersionUID = 1L;

   public DirectoryNotFoundException(final String path) {
      super(path, null, "The specified root is not a directory");
   }
}
