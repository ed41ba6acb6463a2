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
 * Determines the sign symbol displayed for non-negative numbers.  Negative
 * numbers always display {@code -}.
 *
 * @author James Ahlborn
 */
public enum SignMode
{
  /** only negative numbers get a sign */
  NEGATIVE('-'),
  /** positive numbers get a {@code +} */
  ALWAYS('+'),
  /** positive numbers get a blank in place of the sign */
  SPACE(' ');

  private final char _specChar;

  private SignMode(char specChar) {
    _specChar = specChar;
  }

  /**
   * @return the character used for this mode in a format specification
   */
  public char getSpecChar() {
    return _specChar;
  }
}
