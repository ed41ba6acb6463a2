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

import com.healthmarketscience.sciformat.impl.ExpSuffix;
import com.healthmarketscience.sciformat.impl.OutputConverter;

/**
 * The result of formatting a number (or a value with an uncertainty).  The
 * {@link #toString} value is the primary rendering, the other renderings
 * show the same digits in LaTeX, HTML or plain ASCII.
 *
 * @author James Ahlborn
 */
public final class FormattedNumber
{
  private final String _body;
  private final ExpSuffix _suffix;

  public FormattedNumber(String body, ExpSuffix suffix) {
    _body = body;
    _suffix = suffix;
  }

  /**
   * @return the formatted digits (and uncertainty) without the exponent
   *         suffix
   */
  public String getBody() {
    return _body;
  }

  public ExpSuffix getSuffix() {
    return _suffix;
  }

  /**
   * @return a math mode LaTeX rendering, wrapped in {@code $}
   */
  public String toLatex() {
    return OutputConverter.toLatex(_body, _suffix);
  }

  public String toHtml() {
    return OutputConverter.toHtml(_body, _suffix);
  }

  /**
   * @return a rendering using only ASCII characters ("+/-" for "±", "u" for
   *         "μ" and e/b notation for exponents)
   */
  public String toAscii() {
    return OutputConverter.toAscii(_body, _suffix);
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof FormattedNumber)) {
      return false;
    }
    FormattedNumber other = (FormattedNumber)o;
    return (_body.equals(other._body) && _suffix.equals(other._suffix));
  }

  @Override
  public int hashCode() {
    return _body.hashCode() * 31 + _suffix.hashCode();
  }

  @Override
  public String toString() {
    return _body + _suffix.toPlainString();
  }
}
