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

import java.util.Iterator;
import java.util.Map;

import org.apache.commons.lang3.builder.StandardToStringStyle;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Custom ToStringStyle for use with ToStringBuilder.  Renders one field per
 * line, which keeps the (fairly long) option listings readable.
 *
 * @author James Ahlborn
 */
public class CustomToStringStyle extends StandardToStringStyle
{
  private static final long serialVersionUID = 0L;

  private static final String LINE_SEP = System.lineSeparator();
  private static final String ML_FIELD_SEP = LINE_SEP + "  ";
  private static final String IMPL_SUFFIX = "Impl";

  public static final CustomToStringStyle INSTANCE = new CustomToStringStyle() {
    private static final long serialVersionUID = 0L;
    {
      setContentStart("[");
      setFieldSeparator(ML_FIELD_SEP);
      setFieldSeparatorAtStart(true);
      setFieldNameValueSeparator(": ");
      setContentEnd(LINE_SEP + "]");
      setUseShortClassName(true);
      setUseIdentityHashCode(false);
    }
  };

  private CustomToStringStyle() {
  }

  public static ToStringBuilder builder(Object obj) {
    return new ToStringBuilder(obj, INSTANCE);
  }

  @Override
  protected String getShortClassName(Class<?> clss) {
    String shortName = super.getShortClassName(clss);
    if(shortName.endsWith(IMPL_SUFFIX)) {
      shortName = shortName.substring(
          0, shortName.length() - IMPL_SUFFIX.length());
    }
    return shortName;
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Object value) {
    if(value instanceof Enum<?>) {
      buffer.append(((Enum<?>)value).name());
    } else if(value instanceof String) {
      // quote strings so that blank separators remain visible
      buffer.append("'").append(value).append("'");
    } else {
      buffer.append(value);
    }
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Map<?,?> value) {
    buffer.append("{");
    Iterator<? extends Map.Entry<?,?>> iter = value.entrySet().iterator();
    while(iter.hasNext()) {
      Map.Entry<?,?> e = iter.next();
      buffer.append(e.getKey()).append("=");
      if(e.getValue() == null) {
        buffer.append(getNullText());
      } else {
        buffer.append("'").append(e.getValue()).append("'");
      }
      if(iter.hasNext()) {
        buffer.append(", ");
      }
    }
    buffer.append("}");
  }
}
