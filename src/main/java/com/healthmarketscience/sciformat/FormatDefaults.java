/*
Copyright (c) 2024 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.sciformat;

import java.util.concurrent.atomic.AtomicReference;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Process wide default options, used by a {@link Formatter} for any option
 * which is not explicitly given.  The defaults are only read when a
 * Formatter is created, so changing them does not affect existing
 * Formatters.
 * <p/>
 * Temporary defaults can be installed using:
 * <pre>
 *   try(FormatDefaults.Scope scope = FormatDefaults.override(
 *           new FormatOptionsBuilder().setNanInfExp(true))) {
 *     ...
 *   }
 * </pre>
 *
 * @author James Ahlborn
 */
public class FormatDefaults
{
  private static final Log LOG = LogFactory.getLog(FormatDefaults.class);

  private static final AtomicReference<FormatOptions> DEFAULTS =
    new AtomicReference<FormatOptions>(FormatOptions.DEFAULTS);

  private FormatDefaults() {}

  /**
   * @return the current default options
   */
  public static FormatOptions get() {
    return DEFAULTS.get();
  }

  /**
   * Updates the current defaults with the options set on the given builder.
   *
   * @return the previous defaults
   * @throws ConfigException if the resulting options are invalid
   */
  public static FormatOptions set(final FormatOptionsBuilder options) {
    FormatOptions newOpts = null;
    FormatOptions prevOpts = null;
    do {
      prevOpts = DEFAULTS.get();
      newOpts = options.build(prevOpts);
    } while(!DEFAULTS.compareAndSet(prevOpts, newOpts));

    if(LOG.isDebugEnabled()) {
      LOG.debug("Updated format defaults " + newOpts);
    }
    return prevOpts;
  }

  /**
   * Restores the built-in defaults, {@link FormatOptions#DEFAULTS}.
   */
  public static void reset() {
    restore(FormatOptions.DEFAULTS);
  }

  /**
   * Updates the current defaults with the options set on the given builder
   * until the returned Scope is closed, at which point the previous defaults
   * are restored.
   */
  public static Scope override(FormatOptionsBuilder options) {
    return new Scope(set(options));
  }

  private static void restore(FormatOptions opts) {
    DEFAULTS.set(opts);
    if(LOG.isDebugEnabled()) {
      LOG.debug("Restored format defaults " + opts);
    }
  }

  /**
   * Restores the defaults which were in effect before the scope was
   * created.
   */
  public static final class Scope implements AutoCloseable
  {
    private final FormatOptions _prevOpts;
    private boolean _closed;

    private Scope(FormatOptions prevOpts) {
      _prevOpts = prevOpts;
    }

    public FormatOptions getPreviousDefaults() {
      return _prevOpts;
    }

    @Override
    public void close() {
      if(!_closed) {
        _closed = true;
        restore(_prevOpts);
      }
    }
  }
}
