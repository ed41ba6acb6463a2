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

/**
 * Determines how the exponent of a formatted number is chosen and which
 * base (10 or 2) it refers to.
 *
 * @author James Ahlborn
 */
public enum ExpMode
{
  /** no exponent, e.g. {@code 123.456} */
  FIXEDPOINT(10),
  /** no exponent, value multiplied by 100 and suffixed by {@code %} */
  PERCENT(10),
  /** mantissa in [1, 10), e.g. {@code 1.23456e+02} */
  SCIENTIFIC(10),
  /** exponent a multiple of 3, mantissa in [1, 1000) */
  ENGINEERING(10),
  /** exponent a multiple of 3, mantissa in [0.1, 100) */
  ENGINEERING_SHIFTED(10),
  /** base 2 exponent, mantissa in [1, 2) */
  BINARY(2),
  /** base 2 exponent a multiple of 10, mantissa in [1, 1024) */
  BINARY_IEC(2);

  private final int _base;

  private ExpMode(int base) {
    _base = base;
  }

  public int getBase() {
    return _base;
  }

  public boolean isBinary() {
    return (_base == 2);
  }

  /**
   * @return {@code true} if this mode never displays a numeric exponent
   */
  public boolean isFixed() {
    return ((this == FIXEDPOINT) || (this == PERCENT));
  }
}
