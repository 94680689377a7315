/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.cgen.common.util;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

public class StringUtil {

  /**
   * Split text into lines.  A terminating newline does not produce
   * an extra empty line, and a carriage return before a newline is
   * dropped.  The empty string has no lines.
   */
  public static List<String> lines(String s) {
    List<String> result = new ArrayList<String>();
    int start = 0;
    while (start < s.length()) {
      int nl = s.indexOf('\n', start);
      int end = (nl < 0) ? s.length() : nl;
      String line = s.substring(start, end);
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      result.add(line);
      if (nl < 0)
        break;
      start = nl + 1;
    }
    return result;
  }

  /**
   * Break a single line at spaces so that no piece is longer than
   * width, unless a single word is longer than width.
   * An empty or blank line yields a single empty piece.
   */
  public static List<String> wrap(String line, int width) {
    List<String> result = new ArrayList<String>();
    StringBuilder current = new StringBuilder();
    for (String word: StringUtils.split(line, ' ')) {
      if (current.length() > 0 &&
          current.length() + 1 + word.length() > width) {
        result.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }
    result.add(current.toString());
    return result;
  }
}
