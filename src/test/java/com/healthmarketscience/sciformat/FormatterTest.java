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

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import com.healthmarketscience.sciformat.impl.Prefixes;
import org.apache.commons.lang3.StringUtils;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

public class FormatterTest
{
  @AfterEach
  public void resetDefaults() {
    FormatDefaults.reset();
  }

  @Test
  public void testFixedPoint() {
    assertFormat("123.456", "123.456", new FormatOptionsBuilder());
    assertFormat("120", "123.456", new FormatOptionsBuilder().setNdigits(2));
    assertFormat("123.5", "123.456", new FormatOptionsBuilder().setNdigits(4));
    assertFormat("123.46", "123.456", decPlace(2));
    assertFormat("123", "123.456", decPlace(0));
    assertFormat("120", "123.456", decPlace(-1));
    assertFormat("-0.0012", "-0.00123", new FormatOptionsBuilder()
                 .setNdigits(2));
    assertFormat("123.4560", "123.456", decPlace(4));
  }

  @Test
  public void testPercent() {
    FormatOptionsBuilder percent = new FormatOptionsBuilder()
      .setExpMode(ExpMode.PERCENT);
    assertFormat("12.345%", "0.12345", percent);
    assertFormat("12.3%", "0.12345", percent.copy()
                 .setRoundMode(RoundMode.DEC_PLACE).setNdigits(1));
    assertFormat("-150%", "-1.5", percent);
  }

  @Test
  public void testScientific() {
    FormatOptionsBuilder sci = new FormatOptionsBuilder()
      .setExpMode(ExpMode.SCIENTIFIC);
    assertFormat("1.23456e+02", "123.456", sci);
    assertFormat("1.23e+02", "123.456", sci.copy().setNdigits(3));
    assertFormat("1.2e+02", "123.456", sci.copy()
                 .setRoundMode(RoundMode.DEC_PLACE).setNdigits(1));
    assertFormat("1.23e-04", "0.000123", sci);
    assertFormat("-1.23e-04", "-0.000123", sci);
    assertFormat("1.23456E+02", "123.456", sci.copy().setCapitalize(true));
    assertFormat("1.23456×10²", "123.456", sci.copy().setSuperscript(true));
    assertFormat("6.2607×10⁻⁴", "0.00062607",
                 sci.copy().setSuperscript(true));
    assertFormat("1.5e+100", "1.5E+100", sci);
  }

  @Test
  public void testEngineering() {
    FormatOptionsBuilder eng = new FormatOptionsBuilder()
      .setExpMode(ExpMode.ENGINEERING);
    assertFormat("123.456e+03", "123456", eng);
    assertFormat("12.3456e+03", "12345.6", eng);
    assertFormat("1.23456e+03", "1234.56", eng);
    assertFormat("123.456e+00", "123.456", eng);
    assertFormat("12.3e-03", "0.0123", eng);
    assertFormat("123e-06", "0.000123", eng);

    FormatOptionsBuilder shifted = new FormatOptionsBuilder()
      .setExpMode(ExpMode.ENGINEERING_SHIFTED);
    assertFormat("0.123456e+06", "123456", shifted);
    assertFormat("12.3456e+03", "12345.6", shifted);
    assertFormat("1.23456e+03", "1234.56", shifted);
    assertFormat("0.123456e+03", "123.456", shifted);
  }

  @Test
  public void testBinary() {
    FormatOptionsBuilder bin = new FormatOptionsBuilder()
      .setExpMode(ExpMode.BINARY);
    assertFormat("1b+10", "1024", bin);
    assertFormat("1.5b+10", "1536", bin);
    assertFormat("1.5B+10", "1536", bin.copy().setCapitalize(true));
    assertFormat("1b-01", "0.5", bin);
    assertFormat("1.5×2¹⁰", "1536", bin.copy().setSuperscript(true));

    FormatOptionsBuilder iec = new FormatOptionsBuilder()
      .setExpMode(ExpMode.BINARY_IEC);
    assertFormat("2b+10", "2048", iec);
    assertFormat("1.5b+20", "1572864", iec);
    assertFormat("2 Ki", "2048", iec.copy().setExpFormat(ExpFormat.PREFIX));
    assertFormat("1.5 Mi", "1572864",
                 iec.copy().setExpFormat(ExpFormat.PREFIX));
  }

  @Test
  public void testFixedExponent() {
    assertFormat("12.3456e+01", "123.456", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC).setExpVal(1));
    assertFormat("0.123456e+03", "123.456", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.ENGINEERING).setExpVal(3));
    assertFormat("0.12e+03", "123.456", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.ENGINEERING).setExpVal(3)
                 .setRoundMode(RoundMode.DEC_PLACE).setNdigits(2));
  }

  @Test
  public void testRoundingCarry() {
    assertFormat("10", "9.99", new FormatOptionsBuilder().setNdigits(2));
    assertFormat("1.0e+01", "9.99", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC).setNdigits(2));
    assertFormat("1.00e+03", "999.96", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.ENGINEERING).setNdigits(3));
    // ties go to the even digit
    assertFormat("0.12", "0.125", new FormatOptionsBuilder().setNdigits(2));
    assertFormat("0.14", "0.135", new FormatOptionsBuilder().setNdigits(2));

    // the decimal value of the double is used, not its binary value
    Formatter fmt = Formatter.fromFormatSpec("!20");
    assertEquals("0.1" + StringUtils.repeat('0', 19),
                 fmt.format(0.1).toString());
  }

  @Test
  public void testZero() {
    assertFormat("0", "0", new FormatOptionsBuilder());
    assertFormat("0e+00", "0", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC));
    assertFormat("0.00", "0", new FormatOptionsBuilder().setNdigits(3));
    assertFormat("0.00", "0", decPlace(2));
    assertFormat("0.00", "0.0001", decPlace(2));
    // zero is never shown with a (fixed) exponent
    assertFormat("0e+00", "0", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC).setExpVal(3));
    assertFormat("1.00e-04", "0.0001", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC)
                 .setRoundMode(RoundMode.DEC_PLACE).setNdigits(2));
  }

  @Test
  public void testNonFinite() {
    FormatOptionsBuilder sci = new FormatOptionsBuilder()
      .setExpMode(ExpMode.SCIENTIFIC);
    assertFormat("nan", "nan", new FormatOptionsBuilder());
    assertFormat("inf", "inf", new FormatOptionsBuilder());
    assertFormat("-inf", "-inf", new FormatOptionsBuilder());
    assertFormat("nan", "nan", sci);
    assertFormat(" nan", "nan", new FormatOptionsBuilder()
                 .setSignMode(SignMode.ALWAYS));
    assertFormat("+inf", "inf", new FormatOptionsBuilder()
                 .setSignMode(SignMode.ALWAYS));
    assertFormat("NAN", "nan", sci.copy().setCapitalize(true));
    assertFormat("(nan)%", "nan", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.PERCENT));

    Formatter fmt = new Formatter(sci);
    assertEquals("nan", fmt.format(Double.NaN).toString());
    assertEquals("-inf", fmt.format(Double.NEGATIVE_INFINITY).toString());

    try(FormatDefaults.Scope s = FormatDefaults.override(
            new FormatOptionsBuilder().setNanInfExp(true))) {
      assertFormat("(nan)e+00", "nan", sci);
      assertFormat("(-inf)e+00", "-inf", sci);
      assertFormat("(NAN)E+00", "nan", sci.copy().setCapitalize(true));
      assertFormat("(nan)e+03", "nan", sci.copy().setExpVal(3));
      assertFormat("(inf)b+00", "inf", new FormatOptionsBuilder()
                   .setExpMode(ExpMode.BINARY));
      assertFormat("nan", "nan", new FormatOptionsBuilder());
      // the empty prefix leaves nothing to show
      assertFormat("nan", "nan", new FormatOptionsBuilder()
                   .setExpMode(ExpMode.ENGINEERING)
                   .setExpFormat(ExpFormat.PREFIX));
    }

    assertFormat("nan", "nan", sci);
  }

  @Test
  public void testSeparators() {
    assertFormat("1,234,567.123 456 7", "1234567.1234567",
                 new FormatOptionsBuilder()
                 .setUpperSeparator(Separator.COMMA)
                 .setLowerSeparator(Separator.SPACE));
    assertFormat("1.234.567,123_456_7", "1234567.1234567",
                 new FormatOptionsBuilder()
                 .setUpperSeparator(Separator.POINT)
                 .setDecimalSeparator(Separator.COMMA)
                 .setLowerSeparator(Separator.UNDERSCORE));
    assertFormat("1 234 567", "1234567", new FormatOptionsBuilder()
                 .setUpperSeparator(Separator.SPACE));
    assertFormat("-1_234.5", "-1234.5", new FormatOptionsBuilder()
                 .setUpperSeparator(Separator.UNDERSCORE));
  }

  @Test
  public void testSigns() {
    FormatOptionsBuilder always = new FormatOptionsBuilder()
      .setSignMode(SignMode.ALWAYS);
    assertFormat("+123", "123", always);
    assertFormat("-123", "-123", always);
    assertFormat(" 0", "0", always);
    assertFormat(" 123", "123", new FormatOptionsBuilder()
                 .setSignMode(SignMode.SPACE));
    assertFormat("-123", "-123", new FormatOptionsBuilder()
                 .setSignMode(SignMode.SPACE));
    assertFormat("123", "123", new FormatOptionsBuilder());
  }

  @Test
  public void testPadding() {
    FormatOptionsBuilder pad = new FormatOptionsBuilder()
      .setLeftPadDecPlace(4);
    assertFormat("   12.34", "12.34", pad);
    assertFormat("    0.5", "0.5", pad);
    assertFormat("   -12.34", "-12.34", pad);
    assertFormat("   +12.34", "12.34", pad.copy()
                 .setSignMode(SignMode.ALWAYS));
    assertFormat("12345.6", "12345.6", pad);

    FormatOptionsBuilder zero = pad.copy().setLeftPadChar(LeftPadChar.ZERO);
    assertFormat("00012.34", "12.34", zero);
    assertFormat("-00012.34", "-12.34", zero);
    assertFormat("+00012.34", "12.34", zero.copy()
                 .setSignMode(SignMode.ALWAYS));
    assertFormat("00,012.34", "12.34", zero.copy()
                 .setUpperSeparator(Separator.COMMA));
  }

  @Test
  public void testPrefixes() {
    FormatOptionsBuilder prefix = new FormatOptionsBuilder()
      .setExpMode(ExpMode.ENGINEERING)
      .setExpFormat(ExpFormat.PREFIX);
    Formatter fmt = new Formatter(prefix);

    for(int exp = -30; exp <= 30; exp += 3) {
      String suffix = ((exp != 0) ? (" " + Prefixes.SI_PREFIXES.get(exp)) :
                       "");
      assertEquals("3.1415" + suffix, fmt.format(
                       new BigDecimal("3.1415E" + exp)).toString());
      assertEquals("31.415" + suffix, fmt.format(
                       new BigDecimal("3.1415E" + (exp + 1))).toString());
      assertEquals("314.15" + suffix, fmt.format(
                       new BigDecimal("3.1415E" + (exp + 2))).toString());
    }

    assertFormat("3.1415 k", "3141.5", prefix);
    assertFormat("3.1415 μ", "0.0000031415", prefix);
    assertFormat("31.415 M", "31415000", prefix);
    // beyond the known prefixes
    assertFormat("3.1415e+33", "3.1415E+33", prefix);
  }

  @Test
  public void testExtraPrefixes() {
    FormatOptionsBuilder sciPrefix = new FormatOptionsBuilder()
      .setExpMode(ExpMode.SCIENTIFIC)
      .setExpFormat(ExpFormat.PREFIX);
    assertFormat("1.23 c", "0.0123", sciPrefix.copy().setAddCPrefix(true));
    assertFormat("1.23 da", "12.3",
                 sciPrefix.copy().setAddSmallSiPrefixes(true));
    assertFormat("1.23 d", "0.123",
                 sciPrefix.copy().setAddSmallSiPrefixes(true));
    assertFormat("1.23e+01", "12.3", sciPrefix);

    Map<Integer,String> extra = new HashMap<Integer,String>();
    extra.put(3, "K");
    assertFormat("1.23 K", "1230", sciPrefix.copy().setExtraSiPrefixes(extra));

    Map<Integer,String> suppressed = new HashMap<Integer,String>();
    suppressed.put(-3, null);
    assertFormat("3.1415e-03", "0.0031415", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.ENGINEERING)
                 .setExpFormat(ExpFormat.PREFIX)
                 .setExtraSiPrefixes(suppressed));

    Map<Integer,String> iec = new HashMap<Integer,String>();
    iec.put(10, "K");
    assertFormat("2 K", "2048", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.BINARY_IEC)
                 .setExpFormat(ExpFormat.PREFIX)
                 .setExtraIecPrefixes(iec));
  }

  @Test
  public void testExtraPrefixesWithDefaults() {
    Map<Integer,String> siDefaults = new HashMap<Integer,String>();
    siDefaults.put(3, "K");
    Map<Integer,String> ppDefaults = new HashMap<Integer,String>();
    ppDefaults.put(-6, "PPM");

    try(FormatDefaults.Scope s = FormatDefaults.override(
            new FormatOptionsBuilder()
            .setExtraSiPrefixes(siDefaults)
            .setExtraPartsPerForms(ppDefaults))) {
      FormatOptionsBuilder engPrefix = new FormatOptionsBuilder()
        .setExpMode(ExpMode.ENGINEERING)
        .setExpFormat(ExpFormat.PREFIX)
        .setAddCPrefix(true);
      // the added prefix extends the default extra prefixes
      assertFormat("1.234 K", "1234", engPrefix);
      assertFormat("1.23 c", "0.0123", engPrefix.copy()
                   .setExpMode(ExpMode.SCIENTIFIC));
      assertFormat("1.23 da", "12.3", engPrefix.copy()
                   .setExpMode(ExpMode.SCIENTIFIC)
                   .setAddSmallSiPrefixes(true));

      FormatOptionsBuilder ppth = new FormatOptionsBuilder()
        .setExpMode(ExpMode.ENGINEERING)
        .setExpFormat(ExpFormat.PARTS_PER)
        .setAddPpthForm(true);
      assertFormat("3.1415 PPM", "3.1415E-6", ppth);
      assertFormat("1.23 ppth", "0.00123", ppth.copy()
                   .setExpMode(ExpMode.SCIENTIFIC));
    }

    // explicit entries (including suppressions) are not replaced
    Map<Integer,String> suppressed = new HashMap<Integer,String>();
    suppressed.put(-2, null);
    FormatOptionsBuilder sciPrefix = new FormatOptionsBuilder()
      .setExpMode(ExpMode.SCIENTIFIC)
      .setExpFormat(ExpFormat.PREFIX)
      .setAddCPrefix(true);
    assertFormat("1.23e-02", "0.0123", sciPrefix.copy()
                 .setExtraSiPrefixes(suppressed));
    Map<Integer,String> centi = new HashMap<Integer,String>();
    centi.put(-2, "cc");
    assertFormat("1.23 cc", "0.0123", sciPrefix.copy()
                 .setExtraSiPrefixes(centi));
    assertNull(new Formatter(sciPrefix.copy().setExtraSiPrefixes(suppressed))
               .getOptions().getExtraSiPrefixes().get(-2));
  }

  @Test
  public void testPartsPer() {
    FormatOptionsBuilder partsPer = new FormatOptionsBuilder()
      .setExpMode(ExpMode.ENGINEERING)
      .setExpFormat(ExpFormat.PARTS_PER);
    assertFormat("3.1415 ppm", "3.1415E-6", partsPer);
    assertFormat("314.15 ppb", "3.1415E-7", partsPer);
    assertFormat("3.1415", "3.1415", partsPer);
    assertFormat("3.1415e-03", "0.0031415", partsPer);
    assertFormat("3.1415e+03", "3141.5", partsPer);
    assertFormat("1.23 ppth", "0.00123", new FormatOptionsBuilder()
                 .setExpMode(ExpMode.SCIENTIFIC)
                 .setExpFormat(ExpFormat.PARTS_PER)
                 .setAddPpthForm(true));
  }

  @Test
  public void testFormatSpec() {
    assertEquals("12.35e+03",
                 Formatter.fromFormatSpec("!4r").format(12345.678).toString());
    assertEquals("+1.23e+02",
                 Formatter.fromFormatSpec("+.2e").format(123.456).toString());
    assertEquals("12.3%",
                 Formatter.fromFormatSpec(".1%").format(0.123).toString());
    assertEquals("1b+11",
                 Formatter.fromFormatSpec("b").format(2048).toString());
    assertEquals("2b+10",
                 Formatter.fromFormatSpec("#b").format(2048).toString());

    assertThrows(ParseException.class,
                 () -> Formatter.fromFormatSpec("abc"));
  }

  @Test
  public void testStringInput() {
    Formatter fmt = new Formatter(new FormatOptionsBuilder());
    assertEquals("1.5", fmt.format("1.50").toString());
    assertEquals("nan", fmt.format("NaN").toString());
    assertEquals("-inf", fmt.format("-inf").toString());
    assertEquals("inf", fmt.format("Infinity").toString());
    assertEquals("123.4 ± 2.3", fmt.format("123.4", "2.3").toString());

    assertThrows(ConfigException.class, () -> fmt.format("abc"));
    assertThrows(ConfigException.class, () -> fmt.format(""));
    assertThrows(ConfigException.class, () -> fmt.format((BigDecimal)null));
  }

  @Test
  public void testInvalidOptions() {
    assertConfigError(new FormatOptionsBuilder()
                      .setUpperSeparator(Separator.COMMA)
                      .setDecimalSeparator(Separator.COMMA));
    assertConfigError(new FormatOptionsBuilder().setNdigits(0));
    assertConfigError(new FormatOptionsBuilder()
                      .setLowerSeparator(Separator.COMMA));
    assertConfigError(new FormatOptionsBuilder()
                      .setDecimalSeparator(Separator.UNDERSCORE));
    assertConfigError(new FormatOptionsBuilder().setLeftPadDecPlace(-1));
    assertConfigError(new FormatOptionsBuilder().setExpVal(2));
    assertConfigError(new FormatOptionsBuilder()
                      .setExpMode(ExpMode.ENGINEERING).setExpVal(2));
    assertConfigError(new FormatOptionsBuilder()
                      .setExpMode(ExpMode.BINARY_IEC).setExpVal(8));

    // zero digits are fine when rounding to a decimal place
    new Formatter(decPlace(0));
  }

  @Test
  public void testOptions() {
    FormatOptionsBuilder builder = new FormatOptionsBuilder().setNdigits(2);
    Formatter fmt = new Formatter(builder);

    builder.setNdigits(7);
    assertEquals(Integer.valueOf(2), fmt.getInputOptions().getNdigits());
    assertEquals(2, fmt.getOptions().getNdigits());
    assertNull(fmt.getInputOptions().getExpMode());
    assertEquals(ExpMode.FIXEDPOINT, fmt.getOptions().getExpMode());

    fmt.getInputOptions().setNdigits(5);
    assertEquals(Integer.valueOf(2), fmt.getInputOptions().getNdigits());
    assertEquals("120", fmt.format(123.456).toString());

    String optStr = fmt.getOptions().toString();
    assertTrue(optStr.startsWith("FormatOptions["));
    assertTrue(optStr.contains("ndigits: 2"));
    assertTrue(optStr.contains("expMode: FIXEDPOINT"));
    String inputStr = fmt.getInputOptions().toString();
    assertTrue(inputStr.contains("ndigits: 2"));
    assertFalse(inputStr.contains("expMode"));
    assertTrue(fmt.toString().startsWith("Formatter["));
  }

  private static FormatOptionsBuilder decPlace(int ndigits) {
    return new FormatOptionsBuilder()
      .setRoundMode(RoundMode.DEC_PLACE)
      .setNdigits(ndigits);
  }

  private static void assertFormat(String expected, String value,
                                   FormatOptionsBuilder builder) {
    assertEquals(expected, new Formatter(builder).format(value).toString());
  }

  private static void assertConfigError(FormatOptionsBuilder builder) {
    assertThrows(ConfigException.class, () -> new Formatter(builder));
  }
}
