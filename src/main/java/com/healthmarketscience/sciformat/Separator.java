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
 * Characters which may be used to group digits or mark the decimal point.
 * Not every separator is valid in every position, see
 * {@link #isValidUpper}, {@link #isValidDecimal} and {@link #isValidLower}.
 *
 * @author James Ahlborn
 */
public enum Separator
{
  NONE(""),
  COMMA(","),
  POINT("."),
  SPACE(" "),
  UNDERSCORE("_");

  private final String _str;

  private Separator(String str) {
    _str = str;
  }

  public String getString() {
    return _str;
  }

  /**
   * @return {@code true} if this separator may group digits above the
   *         decimal point
   */
  public boolean isValidUpper() {
    return true;
  }

  /**
   * @return {@code true} if this separator may be used as the decimal point
   */
  public boolean isValidDecimal() {
    return ((this == POINT) || (this == COMMA));
  }

  /**
   * @return {@code true} if this separator may group digits below the
   *         decimal point
   */
  public boolean isValidLower() {
    return ((this == NONE) || (this == SPACE) || (this == UNDERSCORE));
  }
}
