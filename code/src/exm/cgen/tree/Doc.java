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

package exm.cgen.tree;

import java.util.ArrayList;
import java.util.List;

import exm.cgen.common.Settings;
import exm.cgen.common.util.StringUtil;

/**
 * Documentation comment in triple-slash style:
 * <pre>
 * /// line one
 * ///
 * /// line two
 * </pre>
 */
public class Doc extends CTree
{
  private final List<String> lines = new ArrayList<String>();

  public Doc()
  {
  }

  public Doc(String text)
  {
    addText(text);
  }

  /**
   * Add text, breaking lines longer than the configured wrap width
   */
  public Doc addText(String text)
  {
    int width = Settings.getValidatedInt(Settings.DOC_WRAP_WIDTH);
    for (String line: StringUtil.lines(text)) {
      lines.addAll(StringUtil.wrap(line, width));
    }
    return this;
  }

  /**
   * Add a line verbatim, without wrapping
   */
  public Doc addLine(String line)
  {
    lines.addAll(StringUtil.lines(line));
    if (line.isEmpty()) {
      lines.add("");
    }
    return this;
  }

  public List<String> getLines()
  {
    return lines;
  }

  public boolean isEmpty()
  {
    return lines.isEmpty();
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    for (String line: lines) {
      if (line.isEmpty()) {
        fmt.writeln("///");
      } else {
        fmt.writeln("/// " + line);
      }
    }
  }
}
