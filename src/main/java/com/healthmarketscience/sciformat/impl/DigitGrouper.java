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

import com.healthmarketscience.sciformat.Separator;

/**
 * Inserts group separators into a rendered mantissa string.
 *
 * @author James Ahlborn
 */
public class DigitGrouper
{
  private static final int GROUP_SIZE = 3;

  private DigitGrouper() {}

  /**
   * Groups the digits before the decimal point in threes (counting leftwards
   * from the point) and the digits after the point in threes (counting
   * rightwards).  Only the run of digits (including any zero padding)
   * directly before the point is grouped, leading spaces and signs are
   * untouched.
   *
   * @param numStr rendered mantissa, using '.' as the decimal point
   */
  public static String group(String numStr, Separator upper,
                             Separator decimal, Separator lower) {
    int pointIdx = numStr.indexOf('.');
    String intPart = ((pointIdx >= 0) ? numStr.substring(0, pointIdx) :
                      numStr);

    int digitStart = intPart.length();
    while((digitStart > 0) &&
          Character.isDigit(intPart.charAt(digitStart - 1))) {
      --digitStart;
    }

    StringBuilder sb = new StringBuilder(numStr.length() + 8);
    sb.append(intPart, 0, digitStart);
    appendUpper(sb, intPart.substring(digitStart), upper.getString());

    if(pointIdx >= 0) {
      sb.append(decimal.getString());
      appendLower(sb, numStr.substring(pointIdx + 1), lower.getString());
    }

    return sb.toString();
  }

  private static void appendUpper(StringBuilder sb, String digits,
                                  String sep) {
    int len = digits.length();
    for(int i = 0; i < len; ++i) {
      if((i > 0) && (((len - i) % GROUP_SIZE) == 0)) {
        sb.append(sep);
      }
      sb.append(digits.charAt(i));
    }
  }

  private static void appendLower(StringBuilder sb, String digits,
                                  String sep) {
    for(int i = 0; i < digits.length(); ++i) {
      if((i > 0) && ((i % GROUP_SIZE) == 0)) {
        sb.append(sep);
      }
      sb.append(digits.charAt(i));
    }
  }
}
