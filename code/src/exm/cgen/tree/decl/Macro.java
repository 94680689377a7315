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

package exm.cgen.tree.decl;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.cgen.common.util.StringUtil;
import exm.cgen.tree.CTree;
import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;

/**
 * Preprocessor definition, <code>#define NAME(a, b) value</code>.
 * Values spanning several lines are continued with backslashes.
 */
public class Macro extends Declaration
{
  private final String name;
  private final List<String> args = new ArrayList<String>();
  private String value = null;

  public Macro(String name)
  {
    this.name = name;
  }

  public Macro(String name, String value)
  {
    this.name = name;
    this.value = value;
  }

  public String getName()
  {
    return name;
  }

  public Macro addArg(String arg)
  {
    args.add(arg);
    return this;
  }

  public Macro setValue(String value)
  {
    this.value = value;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendDoc(fmt);
    fmt.write("#define " + name);
    if (!args.isEmpty()) {
      fmt.write("(" + StringUtils.join(args, ", ") + ")");
    }
    if (value == null || value.isEmpty()) {
      fmt.newline();
      return;
    }
    fmt.write(" ");
    final List<String> lines = StringUtil.lines(value);
    fmt.indent(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        for (int i = 0; i < lines.size(); i++) {
          if (i > 0) {
            fmt.write(" \\\n");
          }
          fmt.write(lines.get(i));
        }
        fmt.newline();
      }
    });
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt);
  }
}
