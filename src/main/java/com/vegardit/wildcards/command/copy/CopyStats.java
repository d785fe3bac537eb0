/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.copy;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class CopyStats {
   private static final Logger LOG = Logger.create();

   private long filesMatched;
   private long filesCopied;
   private long filesCopiedSize;
   private long filesPlanned;
   private long filesPlannedSize;
   private long filesSkipped;
   private long filesOutsideRoot;
   private long startAt;

   public long getFilesCopied() {
      return filesCopied;
   }

   public long getFilesOutsideRoot() {
      return filesOutsideRoot;
   }

   /**
    * @return number of files a dry-run task would have copied
    */
   public long getFilesPlanned() {
      return filesPlanned;
   }

   public long getFilesSkipped() {
      return filesSkipped;
   }

   public void logStats() {
      LOG.info("***************************************");
      LOG.info("Files matched: %s", filesMatched);
      LOG.info("Files copied: %s (%s)", filesCopied, FileUtils.byteCountToDisplaySize(filesCopiedSize));
      if (filesPlanned > 0) {
         LOG.info("Files that would be copied (DRY RUN): %s (%s)", filesPlanned, FileUtils.byteCountToDisplaySize(filesPlannedSize));
      }
      LOG.info("Files skipped (already existing): %s", filesSkipped);
      if (filesOutsideRoot > 0) {
         LOG.info("Files skipped (outside of source): %s", filesOutsideRoot);
      }
      LOG.info("Duration: %s", DurationFormatUtils.formatDurationWords(System.currentTimeMillis() - startAt, true, true));
      LOG.info("***************************************");
   }

   public void onFileCopied(final long size) {
      filesCopied++;
      filesCopiedSize += size;
   }

   public void onFileOutsideRoot() {
      filesOutsideRoot++;
   }

   public void onFilePlanned(final long size) {
      filesPlanned++;
      filesPlannedSize += size;
   }

   public void onFilesMatched(final long count) {
      filesMatched += count;
   }

   public void onFileSkipped() {
      filesSkipped++;
   }

   public void start() {
      startAt = System.currentTimeMillis();
   }
}
