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

import com.healthmarketscience.sciformat.FormatOptions;
import com.healthmarketscience.sciformat.RoundMode;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class RoundingTest
{
  private static final int AUTO = FormatOptions.AUTO;

  @Test
  public void testRoundDigit() {
    BigDecimal num = new BigDecimal("123.456");
    assertEquals(0, Rounding.getRoundDigit(num, RoundMode.SIG_FIG, 3, false));
    assertEquals(2, Rounding.getRoundDigit(num, RoundMode.SIG_FIG, 1, false));
    assertEquals(-3, Rounding.getRoundDigit(num, RoundMode.SIG_FIG, AUTO,
                                            false));
    assertEquals(-2, Rounding.getRoundDigit(num, RoundMode.DEC_PLACE, 2,
                                            false));
    assertEquals(3, Rounding.getRoundDigit(num, RoundMode.DEC_PLACE, -3,
                                           false));
    assertEquals(-3, Rounding.getRoundDigit(num, RoundMode.DEC_PLACE, AUTO,
                                            false));

    // pdg only applies to automatic significant figures
    assertEquals(0, Rounding.getRoundDigit(num, RoundMode.SIG_FIG, 3, true));
    assertEquals(-3, Rounding.getRoundDigit(num, RoundMode.DEC_PLACE, AUTO,
                                            true));
  }

  @Test
  public void testPdgRoundDigit() {
    assertPdg(1, "354");
    assertPdg(2, "355");
    assertPdg(2, "949");
    assertPdg(2, "950");
    assertPdg(1, "100");

    assertPdg(-3, "0.0354");
    assertPdg(-3, "0.035499");
    assertPdg(-2, "0.0355");
    assertPdg(-1, "0.987");
    assertPdg(-1, "-0.987");

    BigDecimal num = new BigDecimal("950");
    BigDecimal rounded = Rounding.round(num, Rounding.getPdgRoundDigit(num));
    assertEquals(0, new BigDecimal("1000").compareTo(rounded));

    num = new BigDecimal("0.987");
    assertEquals("1.0", Rounding.round(
                     num, Rounding.getPdgRoundDigit(num)).toPlainString());
  }

  @Test
  public void testRound() {
    assertEquals("123", Rounding.round(new BigDecimal("123.456"), 0)
                 .toPlainString());
    assertEquals("120", Rounding.round(new BigDecimal("123.456"), 1)
                 .toPlainString());
    assertEquals("123.4560", Rounding.round(new BigDecimal("123.456"), -4)
                 .toPlainString());

    // ties go to the even neighbor
    assertEquals("2", Rounding.round(new BigDecimal("2.5"), 0)
                 .toPlainString());
    assertEquals("4", Rounding.round(new BigDecimal("3.5"), 0)
                 .toPlainString());
    assertEquals("-0.2", Rounding.round(new BigDecimal("-0.25"), -1)
                 .toPlainString());
  }

  @Test
  public void testSigFigIdempotent() {
    String[] nums = {"123.456", "99.99", "999.99", "0.00062607", "-9.96",
                     "5.5", "0.0995", "1000", "31415.9265", "7"};
    for(String numStr : nums) {
      BigDecimal num = new BigDecimal(numStr);
      for(int ndigits = 1; ndigits <= 6; ++ndigits) {
        BigDecimal once = roundSigFig(num, ndigits);
        BigDecimal twice = roundSigFig(once, ndigits);
        assertEquals(0, once.compareTo(twice), numStr + " " + ndigits);
      }
    }
  }

  private static BigDecimal roundSigFig(BigDecimal num, int ndigits) {
    return Rounding.round(num, Rounding.getRoundDigit(
                              num, RoundMode.SIG_FIG, ndigits, false));
  }

  private static void assertPdg(int expected, String num) {
    assertEquals(expected, Rounding.getPdgRoundDigit(new BigDecimal(num)),
                 num);
  }
}
