/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.copy;

import static com.vegardit.wildcards.util.MapUtils.*;
import static net.sf.jstuff.core.validation.NullAnalysisHelper.lazyNonNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.wildcards.command.AbstractFilterCommandConfig;
import com.vegardit.wildcards.util.FileUtils;
import com.vegardit.wildcards.util.YamlUtils.ToYamlString;

import net.sf.jstuff.core.SystemUtils;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class CopyCommandConfig extends AbstractFilterCommandConfig<CopyCommandConfig> {

   public @Nullable @ToYamlString(ignore = true) Path target;
   public @ToYamlString(name = "target") Path targetRootAbsolute = lazyNonNull(); // computed value

   public @Nullable Boolean dryRun;
   public @Nullable Boolean overwrite;

   @Override
   protected CopyCommandConfig newInstance() {
      return new CopyCommandConfig();
   }

   @Override
   protected String rootConfigKey() {
      return "source";
   }

   @Override
   public void applyDefaults() {
      final var defaults = newInstance();
      defaults.dryRun = false;
      defaults.overwrite = false;
      applyFrom(defaults, false);
      super.applyDefaults();
   }

   @Override
   public void applyFrom(final @Nullable CopyCommandConfig other, final boolean override) {
      if (other == null)
         return;
      super.applyFrom(other, override);

      if (override && other.target != null || target == null) {
         target = other.target;
      }
      if (override && other.dryRun != null || dryRun == null) {
         dryRun = other.dryRun;
      }
      if (override && other.overwrite != null || overwrite == null) {
         overwrite = other.overwrite;
      }
   }

   @Override
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();

      final var cfg = new HashMap<>(config);
      final var defaults = newInstance();
      defaults.target = getPath(cfg, "target", true);
      defaults.dryRun = getBoolean(cfg, "dry-run", true);
      defaults.overwrite = getBoolean(cfg, "overwrite", true);
      applyFrom(defaults, override);
      return super.applyFrom(cfg, override);
   }

   @Override
   @SuppressWarnings("resource")
   public void compute() throws IOException {
      super.compute();

      final var target = this.target;
      if (target == null)
         throw new IllegalArgumentException("Target is not specified!");
      final var targetRootAbsolute = this.targetRootAbsolute = FileUtils.toAbsolute(target);
      if (FileUtils.isSameOrBelow(targetRootAbsolute, rootAbsolute))
         throw new IllegalArgumentException("Target path [" + target + "] must not be located inside the source directory [" + rootAbsolute
               + "]!");
      if (targetRootAbsolute.getFileSystem().isReadOnly())
         throw new IllegalArgumentException("Target path [" + target + "] is on a read-only filesystem!");
      if (Files.exists(targetRootAbsolute)) {
         if (!Files.isDirectory(targetRootAbsolute))
            throw new IllegalArgumentException("Target path [" + target + "] is not a directory!");
         if (!FileUtils.isWritable(targetRootAbsolute)) // Files.isWritable(targetRoot) always returns false for some reason
            throw new IllegalArgumentException("Target path [" + target + "] is not writable by user [" + SystemUtils.USER_NAME + "]!");
      } else {
         final var parent = targetRootAbsolute.getParent();
         if (parent == null || !Files.exists(parent))
            throw new IllegalArgumentException("Parent directory of target path [" + parent + "] does not exist!");
         if (!Files.isDirectory(parent))
            throw new IllegalArgumentException("Parent of target path [" + parent + "] is not a directory!");
      }
   }
}
