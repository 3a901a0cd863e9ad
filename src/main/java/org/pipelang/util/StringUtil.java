/*
 * Copyright 2025 The Pipelang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pipelang.util;

/** Static helpers for converting between string values and their quoted source form. */
public class StringUtil {

  // Static methods only
  private StringUtil() {}

  /**
   * Returns the character denoted by a backslash followed by {@code c}. {@code \n} and {@code \t}
   * are a newline and a tab; any other character (including the backslash and both quote
   * characters) stands for itself.
   */
  public static char unescape(char c) {
    return switch (c) {
      case 'n' -> '\n';
      case 't' -> '\t';
      default -> c;
    };
  }

  /**
   * Given the text between the quotes of a string literal, returns the string it denotes.
   *
   * <p>A trailing lone backslash is kept as is.
   */
  public static String unescape(String body) {
    int backslash = body.indexOf('\\');
    if (backslash < 0) {
      return body;
    }
    StringBuilder sb = new StringBuilder(body.length());
    sb.append(body, 0, backslash);
    for (int i = backslash; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\' && i + 1 < body.length()) {
        sb.append(unescape(body.charAt(++i)));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Returns a double-quoted string literal that denotes {@code s}, i.e. {@code unescape} of the
   * result with its quotes removed returns {@code s}.
   */
  public static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\n' -> sb.append("\\n");
        case '\t' -> sb.append("\\t");
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
