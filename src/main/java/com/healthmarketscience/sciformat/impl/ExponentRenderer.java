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

package com.healthmarketscience.sciformat.impl;

import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptions;

/**
 * Builds the exponent suffix for a resolved exponent.
 *
 * @author James Ahlborn
 */
public class ExponentRenderer
{
  private ExponentRenderer() {}

  /**
   * @param exp the resolved exponent value
   * @param expMode the exponent mode the exponent was resolved for
   * @param opts the options which control prefix replacement,
   *             capitalization and superscripts
   */
  public static ExpSuffix render(int exp, ExpMode expMode,
                                 FormatOptions opts) {
    switch(expMode) {
    case FIXEDPOINT:
      return ExpSuffix.NONE;
    case PERCENT:
      return ExpSuffix.PERCENT;
    default:
      // exponent suffix below
    }

    String replacement = Prefixes.getReplacement(
        opts.getExpFormat(), expMode, exp, opts);
    if(replacement != null) {
      return ExpSuffix.text(replacement.trim());
    }

    return ExpSuffix.numeric(expMode.getBase(), exp, opts.isCapitalize(),
                             opts.isSuperscript());
  }
}
