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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.sciformat.ExpFormat;
import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptions;

/**
 * The built-in exponent replacement tables (SI prefixes, IEC binary prefixes
 * and parts-per forms) and the lookup which merges in any user supplied
 * entries.
 *
 * @author James Ahlborn
 */
public class Prefixes
{
  public static final Map<Integer,String> SI_PREFIXES;
  public static final Map<Integer,String> IEC_PREFIXES;
  public static final Map<Integer,String> PARTS_PER_FORMS;

  static {
    Map<Integer,String> si = new LinkedHashMap<Integer,String>();
    si.put(-30, "q");
    si.put(-27, "r");
    si.put(-24, "y");
    si.put(-21, "z");
    si.put(-18, "a");
    si.put(-15, "f");
    si.put(-12, "p");
    si.put(-9, "n");
    si.put(-6, "\u03BC");
    si.put(-3, "m");
    si.put(0, "");
    si.put(3, "k");
    si.put(6, "M");
    si.put(9, "G");
    si.put(12, "T");
    si.put(15, "P");
    si.put(18, "E");
    si.put(21, "Z");
    si.put(24, "Y");
    si.put(27, "R");
    si.put(30, "Q");
    SI_PREFIXES = Collections.unmodifiableMap(si);

    Map<Integer,String> iec = new LinkedHashMap<Integer,String>();
    iec.put(0, "");
    iec.put(10, "Ki");
    iec.put(20, "Mi");
    iec.put(30, "Gi");
    iec.put(40, "Ti");
    iec.put(50, "Pi");
    iec.put(60, "Ei");
    iec.put(70, "Zi");
    iec.put(80, "Yi");
    IEC_PREFIXES = Collections.unmodifiableMap(iec);

    Map<Integer,String> pp = new LinkedHashMap<Integer,String>();
    pp.put(0, "");
    pp.put(-6, "ppm");
    pp.put(-9, "ppb");
    pp.put(-12, "ppt");
    pp.put(-15, "ppq");
    PARTS_PER_FORMS = Collections.unmodifiableMap(pp);
  }

  private Prefixes() {}

  /**
   * @return the replacement text for the given exponent, or {@code null} if
   *         the exponent has no replacement (or the replacement is
   *         suppressed by a {@code null} user entry)
   */
  public static String getReplacement(ExpFormat expFormat, ExpMode expMode,
                                      int exp, FormatOptions opts) {
    Map<Integer,String> builtIn = null;
    Map<Integer,String> extra = null;
    switch(expFormat) {
    case STANDARD:
      return null;
    case PREFIX:
      if(expMode.isBinary()) {
        builtIn = IEC_PREFIXES;
        extra = opts.getExtraIecPrefixes();
      } else {
        builtIn = SI_PREFIXES;
        extra = opts.getExtraSiPrefixes();
      }
      break;
    case PARTS_PER:
      builtIn = PARTS_PER_FORMS;
      extra = opts.getExtraPartsPerForms();
      break;
    default:
      throw new IllegalArgumentException("Unhandled exp format " + expFormat);
    }

    if(extra.containsKey(exp)) {
      return extra.get(exp);
    }
    return builtIn.get(exp);
  }
}
