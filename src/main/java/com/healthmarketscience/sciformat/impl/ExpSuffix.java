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

/**
 * The exponent part of a formatted number, kept in structured form so that
 * the alternate renderings (LaTeX, HTML, ASCII) do not need to re-parse the
 * formatted string.
 *
 * @author James Ahlborn
 */
public final class ExpSuffix
{
  public enum Kind {
    /** no suffix (fixed point, or an empty prefix) */
    NONE,
    /** percent sign */
    PERCENT,
    /** prefix or parts-per replacement text */
    TEXT,
    /** base and exponent value */
    NUMERIC;
  }

  public static final ExpSuffix NONE =
    new ExpSuffix(Kind.NONE, null, 10, 0, false, false);
  public static final ExpSuffix PERCENT =
    new ExpSuffix(Kind.PERCENT, null, 10, 0, false, false);

  private static final char[] SUPERSCRIPT_DIGITS = {
    '\u2070', '\u00B9', '\u00B2', '\u00B3', '\u2074',
    '\u2075', '\u2076', '\u2077', '\u2078', '\u2079'};
  private static final char SUPERSCRIPT_MINUS = '\u207B';
  static final char TIMES = '\u00D7';

  private final Kind _kind;
  private final String _text;
  private final int _base;
  private final int _exp;
  private final boolean _capitalize;
  private final boolean _superscript;

  private ExpSuffix(Kind kind, String text, int base, int exp,
                    boolean capitalize, boolean superscript) {
    _kind = kind;
    _text = text;
    _base = base;
    _exp = exp;
    _capitalize = capitalize;
    _superscript = superscript;
  }

  public static ExpSuffix text(String text) {
    return (text.isEmpty() ? NONE :
            new ExpSuffix(Kind.TEXT, text, 10, 0, false, false));
  }

  public static ExpSuffix numeric(int base, int exp, boolean capitalize,
                                  boolean superscript) {
    return new ExpSuffix(Kind.NUMERIC, null, base, exp, capitalize,
                         superscript);
  }

  public Kind getKind() {
    return _kind;
  }

  /**
   * @return the replacement text for {@link Kind#TEXT} suffixes
   */
  public String getText() {
    return _text;
  }

  public int getBase() {
    return _base;
  }

  public int getExp() {
    return _exp;
  }

  public boolean isCapitalize() {
    return _capitalize;
  }

  public boolean isSuperscript() {
    return _superscript;
  }

  public boolean isEmpty() {
    return (_kind == Kind.NONE);
  }

  /**
   * @return the suffix as shown in the plain string rendering
   */
  public String toPlainString() {
    switch(_kind) {
    case NONE:
      return "";
    case PERCENT:
      return "%";
    case TEXT:
      return " " + _text;
    case NUMERIC:
      return (_superscript ? toSuperscriptString() : toStandardString());
    default:
      throw new IllegalStateException("Unhandled kind " + _kind);
    }
  }

  /**
   * @return the numeric exponent in "e+03"/"b-10" form
   */
  public String toStandardString() {
    char symbol = ((_base == 2) ? 'b' : 'e');
    if(_capitalize) {
      symbol = Character.toUpperCase(symbol);
    }
    StringBuilder sb = new StringBuilder().append(symbol)
      .append((_exp < 0) ? '-' : '+');
    int absExp = Math.abs(_exp);
    if(absExp < 10) {
      sb.append('0');
    }
    return sb.append(absExp).toString();
  }

  /**
   * @return the numeric exponent in "×10³" form
   */
  public String toSuperscriptString() {
    StringBuilder sb = new StringBuilder().append(TIMES).append(_base);
    String expStr = String.valueOf(_exp);
    for(int i = 0; i < expStr.length(); ++i) {
      char c = expStr.charAt(i);
      sb.append((c == '-') ? SUPERSCRIPT_MINUS :
                SUPERSCRIPT_DIGITS[c - '0']);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof ExpSuffix)) {
      return false;
    }
    ExpSuffix other = (ExpSuffix)o;
    return ((_kind == other._kind) &&
            ((_text == null) ? (other._text == null) :
             _text.equals(other._text)) &&
            (_base == other._base) && (_exp == other._exp) &&
            (_capitalize == other._capitalize) &&
            (_superscript == other._superscript));
  }

  @Override
  public int hashCode() {
    return ((_kind.hashCode() * 31 + _base) * 31 + _exp) * 31 +
      ((_text != null) ? _text.hashCode() : 0);
  }

  @Override
  public String toString() {
    return _kind + "[" + toPlainString() + "]";
  }
}
