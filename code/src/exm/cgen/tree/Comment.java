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

import org.apache.commons.lang3.StringUtils;

import exm.cgen.common.Settings;
import exm.cgen.common.util.StringUtil;

/**
 * Line comment.  May appear in blocks or at file scope.
 * A heading comment is framed by rules of slashes:
 * <pre>
 * ////////////
 * // Heading
 * ////////////
 * </pre>
 */
public class Comment extends Declaration
{
  private final String text;
  private final boolean heading;

  public Comment(String text)
  {
    this(text, false);
  }

  public Comment(String text, boolean heading)
  {
    this.text = text;
    this.heading = heading;
  }

  public static Comment heading(String text)
  {
    return new Comment(text, true);
  }

  public String getText()
  {
    return text;
  }

  public boolean isHeading()
  {
    return heading;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    String rule = null;
    if (heading) {
      // Rule ends at the heading column regardless of indentation
      int width = Settings.getValidatedInt(Settings.HEADING_WIDTH);
      rule = StringUtils.repeat('/', Math.max(width - fmt.getIndent(), 2));
      fmt.writeln(rule);
    }
    for (String line: StringUtil.lines(text)) {
      if (line.isEmpty()) {
        fmt.writeln("//");
      } else {
        fmt.writeln("// " + line);
      }
    }
    if (heading) {
      fmt.writeln(rule);
    }
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt);
  }
}
