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

import java.math.BigDecimal;

/**
 * A finite number split into a mantissa and an exponent for a given base,
 * such that {@code num = mantissa * base^exp}.
 *
 * @author James Ahlborn
 */
public final class MantissaExp
{
  private final BigDecimal _mantissa;
  private final int _exp;
  private final int _base;

  MantissaExp(BigDecimal mantissa, int exp, int base) {
    _mantissa = mantissa;
    _exp = exp;
    _base = base;
  }

  public BigDecimal getMantissa() {
    return _mantissa;
  }

  public int getExp() {
    return _exp;
  }

  public int getBase() {
    return _base;
  }

  @Override
  public String toString() {
    return _mantissa.toPlainString() + "*" + _base + "^" + _exp;
  }
}
