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

import com.healthmarketscience.sciformat.ExpFormat;
import com.healthmarketscience.sciformat.ExpMode;
import com.healthmarketscience.sciformat.FormatOptionsBuilder;
import com.healthmarketscience.sciformat.LeftPadChar;
import com.healthmarketscience.sciformat.ParseException;
import com.healthmarketscience.sciformat.RoundMode;
import com.healthmarketscience.sciformat.Separator;
import com.healthmarketscience.sciformat.SignMode;

/**
 * Parses the compact format specification mini-language:
 * <pre>
 *   [[ 0]=][-+ ][#][digits][n,.s_][.,][ns_][[.!][+-]digits][fF%eErRbB][x[+-]digits][p][()]
 * </pre>
 * Every group is optional.  Only the options which appear in the string are
 * set on the resulting builder.
 *
 * @author James Ahlborn
 */
public class FormatSpecParser
{
  private static final int EOF = -1;

  private static final String FILL_CHARS = " 0";
  private static final String SIGN_CHARS = "-+ ";
  private static final String UPPER_SEP_CHARS = "n,.s_";
  private static final String DECIMAL_SEP_CHARS = ".,";
  private static final String LOWER_SEP_CHARS = "ns_";
  private static final String ROUND_MODE_CHARS = ".!";
  private static final String EXP_MODE_CHARS = "fF%eErRbB";

  private FormatSpecParser() {}

  public static FormatOptionsBuilder parse(String formatSpec) {
    if(formatSpec == null) {
      throw new ParseException("Invalid format specifier: null");
    }

    SpecBuf buf = new SpecBuf(formatSpec);
    FormatOptionsBuilder builder = new FormatOptionsBuilder();

    if((formatSpec.length() >= 2) && (formatSpec.charAt(1) == '=') &&
       (FILL_CHARS.indexOf(formatSpec.charAt(0)) >= 0)) {
      builder.setLeftPadChar((buf.next() == '0') ? LeftPadChar.ZERO :
                             LeftPadChar.SPACE);
      buf.next();
    }

    if(buf.peekIn(SIGN_CHARS)) {
      builder.setSignMode(parseSignMode(buf.next()));
    }

    boolean alternate = false;
    if(buf.peekNext() == '#') {
      buf.next();
      alternate = true;
    }

    String padDigits = buf.nextDigits();
    if(padDigits != null) {
      builder.setLeftPadDecPlace(parseInt(padDigits, buf))
        .setLeftPadMatching(Boolean.TRUE);
    }

    // the separator groups and the "." round mode prefix overlap, so try
    // the possible separator assignments (most separators first) until the
    // rest of the spec parses
    int sepStart = buf.curPos();
    for(int combo = 0; combo < 8; ++combo) {
      buf.reset(sepStart);
      FormatOptionsBuilder attempt = builder.copy();
      if(parseSeparators(buf, combo, attempt) &&
         parseTail(buf, alternate, attempt)) {
        return attempt;
      }
    }

    throw new ParseException("Invalid format specifier: '" + formatSpec +
                             "'");
  }

  /**
   * The bits of {@code combo} (upper, decimal, lower from high to low)
   * indicate which separator groups are absent.
   */
  private static boolean parseSeparators(SpecBuf buf, int combo,
                                         FormatOptionsBuilder builder) {
    if((combo & 0x4) == 0) {
      if(!buf.peekIn(UPPER_SEP_CHARS)) {
        return false;
      }
      builder.setUpperSeparator(parseSeparator(buf.next()));
    }
    if((combo & 0x2) == 0) {
      if(!buf.peekIn(DECIMAL_SEP_CHARS)) {
        return false;
      }
      builder.setDecimalSeparator(parseSeparator(buf.next()));
    }
    if((combo & 0x1) == 0) {
      if(!buf.peekIn(LOWER_SEP_CHARS)) {
        return false;
      }
      builder.setLowerSeparator(parseSeparator(buf.next()));
    }
    return true;
  }

  private static boolean parseTail(SpecBuf buf, boolean alternate,
                                   FormatOptionsBuilder builder) {
    if(buf.peekIn(ROUND_MODE_CHARS)) {
      char roundChar = buf.next();
      String ndigits = buf.nextSignedDigits();
      if(ndigits == null) {
        return false;
      }
      builder.setRoundMode((roundChar == '!') ? RoundMode.SIG_FIG :
                           RoundMode.DEC_PLACE)
        .setNdigits(parseInt(ndigits, buf));
    }

    if(buf.peekIn(EXP_MODE_CHARS)) {
      char expChar = buf.next();
      builder.setExpMode(parseExpMode(expChar, alternate))
        .setCapitalize(Character.isUpperCase(expChar));
    }

    if(buf.peekNext() == 'x') {
      buf.next();
      String expVal = buf.nextSignedDigits();
      if(expVal == null) {
        return false;
      }
      builder.setExpVal(parseInt(expVal, buf));
    }

    if(buf.peekNext() == 'p') {
      buf.next();
      builder.setExpFormat(ExpFormat.PREFIX);
    }

    if(buf.peekNext() == '(') {
      buf.next();
      if(buf.peekNext() != ')') {
        return false;
      }
      buf.next();
      builder.setParenUncertainty(Boolean.TRUE);
    }

    return !buf.hasNext();
  }

  private static SignMode parseSignMode(char c) {
    switch(c) {
    case '-':
      return SignMode.NEGATIVE;
    case '+':
      return SignMode.ALWAYS;
    case ' ':
      return SignMode.SPACE;
    default:
      throw new IllegalArgumentException("Unexpected sign char " + c);
    }
  }

  private static Separator parseSeparator(char c) {
    switch(c) {
    case 'n':
      return Separator.NONE;
    case 's':
      return Separator.SPACE;
    case ',':
      return Separator.COMMA;
    case '.':
      return Separator.POINT;
    case '_':
      return Separator.UNDERSCORE;
    default:
      throw new IllegalArgumentException("Unexpected separator char " + c);
    }
  }

  private static ExpMode parseExpMode(char c, boolean alternate) {
    switch(Character.toLowerCase(c)) {
    case 'f':
      return ExpMode.FIXEDPOINT;
    case '%':
      return ExpMode.PERCENT;
    case 'e':
      return ExpMode.SCIENTIFIC;
    case 'r':
      return (alternate ? ExpMode.ENGINEERING_SHIFTED : ExpMode.ENGINEERING);
    case 'b':
      return (alternate ? ExpMode.BINARY_IEC : ExpMode.BINARY);
    default:
      throw new IllegalArgumentException("Unexpected exponent mode char " + c);
    }
  }

  private static int parseInt(String str, SpecBuf buf) {
    try {
      return Integer.parseInt(str);
    } catch(NumberFormatException e) {
      throw new ParseException("Invalid number '" + str +
                               "' in format specifier " + buf);
    }
  }

  private static final class SpecBuf
  {
    private final String _str;
    private int _pos;

    private SpecBuf(String str) {
      _str = str;
    }

    public int curPos() {
      return _pos;
    }

    public boolean hasNext() {
      return _pos < _str.length();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public boolean peekIn(String chars) {
      return (hasNext() && (chars.indexOf(_str.charAt(_pos)) >= 0));
    }

    public void reset(int pos) {
      _pos = pos;
    }

    /**
     * @return the run of digits at the current position, {@code null} if
     *         there are none
     */
    public String nextDigits() {
      int start = _pos;
      while(hasNext() && isDigit(_str.charAt(_pos))) {
        ++_pos;
      }
      return ((_pos > start) ? _str.substring(start, _pos) : null);
    }

    /**
     * @return an optionally signed run of digits at the current position,
     *         {@code null} if there are no digits
     */
    public String nextSignedDigits() {
      int start = _pos;
      if(peekIn("+-")) {
        ++_pos;
      }
      if(nextDigits() == null) {
        _pos = start;
        return null;
      }
      return _str.substring(start, _pos);
    }

    private static boolean isDigit(char c) {
      return ((c >= '0') && (c <= '9'));
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }
}
