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

import org.apache.commons.lang3.StringUtils;

/**
 * Produces the alternate (LaTeX, HTML and ASCII) renderings of a formatted
 * number from its body and exponent suffix.
 *
 * @author James Ahlborn
 */
public class OutputConverter
{
  private static final char PM = '\u00B1';
  private static final char MICRO = '\u03BC';

  private OutputConverter() {}

  /**
   * @return math mode LaTeX, e.g. {@code $\left(1.2\:\pm\:0.3\right)\times 10^{+3}$}
   */
  public static String toLatex(String body, ExpSuffix suffix) {
    StringBuilder sb = new StringBuilder(body.length() + 32).append('$');
    appendLatexBody(sb, body);

    switch(suffix.getKind()) {
    case NONE:
      break;
    case PERCENT:
      sb.append("\\%");
      break;
    case TEXT:
      sb.append("\\:\\text{");
      appendLatexText(sb, suffix.getText());
      sb.append('}');
      break;
    case NUMERIC:
      sb.append("\\times ").append(suffix.getBase()).append("^{")
        .append(getSignedExp(suffix.getExp())).append('}');
      break;
    default:
      throw new IllegalArgumentException("Unhandled kind " + suffix.getKind());
    }

    return sb.append('$').toString();
  }

  /**
   * @return the plain rendering with a numeric exponent shown using a
   *         {@code <sup>} element, e.g. {@code 1.2×10<sup>-3</sup>}
   */
  public static String toHtml(String body, ExpSuffix suffix) {
    if(suffix.getKind() != ExpSuffix.Kind.NUMERIC) {
      return body + suffix.toPlainString();
    }
    return body + ExpSuffix.TIMES + suffix.getBase() + "<sup>" +
      suffix.getExp() + "</sup>";
  }

  /**
   * @return the plain rendering restricted to ASCII characters
   */
  public static String toAscii(String body, ExpSuffix suffix) {
    String asciiBody = StringUtils.replace(body, String.valueOf(PM), "+/-");
    switch(suffix.getKind()) {
    case NONE:
    case PERCENT:
      return asciiBody + suffix.toPlainString();
    case TEXT:
      return asciiBody + " " + suffix.getText().replace(MICRO, 'u');
    case NUMERIC:
      return asciiBody + suffix.toStandardString();
    default:
      throw new IllegalArgumentException("Unhandled kind " + suffix.getKind());
    }
  }

  private static void appendLatexBody(StringBuilder sb, String body) {
    int len = body.length();
    int i = 0;
    while(i < len) {
      char c = body.charAt(i);
      if(isAsciiLetter(c)) {
        // runs of letters (nan, INF) are shown as text
        int start = i;
        while((i < len) && isAsciiLetter(body.charAt(i))) {
          ++i;
        }
        sb.append("\\text{").append(body, start, i).append('}');
        continue;
      }

      switch(c) {
      case '(':
        sb.append("\\left(");
        break;
      case ')':
        sb.append("\\right)");
        break;
      case '%':
        sb.append("\\%");
        break;
      case '_':
        sb.append("\\_");
        break;
      case ' ':
        sb.append("\\:");
        break;
      case PM:
        sb.append("\\pm");
        break;
      default:
        sb.append(c);
      }
      ++i;
    }
  }

  private static void appendLatexText(StringBuilder sb, String text) {
    for(int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      switch(c) {
      case MICRO:
        sb.append("\\textmu{}");
        break;
      case '_':
      case '%':
        sb.append('\\').append(c);
        break;
      default:
        sb.append(c);
      }
    }
  }

  private static boolean isAsciiLetter(char c) {
    return (((c >= 'a') && (c <= 'z')) || ((c >= 'A') && (c <= 'Z')));
  }

  private static String getSignedExp(int exp) {
    return ((exp < 0) ? String.valueOf(exp) : ("+" + exp));
  }
}
