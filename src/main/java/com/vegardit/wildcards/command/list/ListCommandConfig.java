/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.wildcards.command.list;

import static com.vegardit.wildcards.util.MapUtils.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.wildcards.command.AbstractFilterCommandConfig;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ListCommandConfig extends AbstractFilterCommandConfig<ListCommandConfig> {

   public @Nullable Boolean print0;
   public @Nullable Boolean relative;
   public @Nullable Boolean sort;

   @Override
   protected ListCommandConfig newInstance() {
      return new ListCommandConfig();
   }

   @Override
   public void applyDefaults() {
      final var defaults = newInstance();
      defaults.print0 = false;
      defaults.relative = false;
      defaults.sort = false;
      applyFrom(defaults, false);
      super.applyDefaults();
   }

   @Override
   public void applyFrom(final @Nullable ListCommandConfig other, final boolean override) {
      if (other == null)
         return;
      super.applyFrom(other, override);

      if (override && other.print0 != null || print0 == null) {
         print0 = other.print0;
      }
      if (override && other.relative != null || relative == null) {
         relative = other.relative;
      }
      if (override && other.sort != null || sort == null) {
         sort = other.sort;
      }
   }

   @Override
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();

      final var cfg = new HashMap<>(config);
      final var defaults = newInstance();
      defaults.print0 = getBoolean(cfg, "print0", true);
      defaults.relative = getBoolean(cfg, "relative", true);
      defaults.sort = getBoolean(cfg, "sort", true);
      applyFrom(defaults, override);
      return super.applyFrom(cfg, override);
   }
}
