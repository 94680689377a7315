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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.cgen.common.Settings;
import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.common.util.StringUtil;

/**
 * Text sink shared by all nodes of a tree while it is rendered.
 *
 * Tracks the current indentation and prefixes each new non-empty
 * line with it.  Blocks and indented regions are only opened through
 * {@link #block(CTree)}, {@link #inlineBlock(CTree)} and
 * {@link #indent(CTree)}, which restore the previous indentation
 * when the body returns.
 *
 * Also tracks the names of the enclosing classes so that out-of-class
 * definitions can be qualified, see {@link #scopedName(String)}.
 *
 * A formatter is created per render and is not thread-safe.
 */
public class Formatter
{
  /**
   * Formatting callback that produces a value, e.g. the number of
   * items written.
   */
  public static interface Indented<R> {
    public R appendTo(Formatter fmt);
  }

  private final StringBuilder dst;

  private final int indentWidth;

  /** Current indentation in spaces, always a multiple of indentWidth */
  private int spaces = 0;

  /** Enclosing class names, innermost last */
  private final Deque<String> scopes = new ArrayDeque<String>();

  public Formatter()
  {
    this(Settings.getValidatedInt(Settings.INDENT_WIDTH));
  }

  public Formatter(int indentWidth)
  {
    if (indentWidth <= 0) {
      throw new CGenRuntimeError("Indent width must be positive but was " +
                                 indentWidth);
    }
    this.dst = new StringBuilder(2048);
    this.indentWidth = indentWidth;
  }

  public int getIndent()
  {
    return spaces;
  }

  public int getIndentWidth()
  {
    return indentWidth;
  }

  public boolean isStartOfLine()
  {
    return dst.length() == 0 || dst.charAt(dst.length() - 1) == '\n';
  }

  /**
   * Append text, indenting every non-empty line that starts a new
   * physical line.  A trailing newline in text is kept.
   */
  public Formatter write(String text)
  {
    boolean shouldIndent = isStartOfLine();
    List<String> lines = StringUtil.lines(text);
    boolean first = true;
    for (String line: lines) {
      if (!first) {
        dst.append('\n');
      }
      first = false;
      if (shouldIndent && line.length() > 0) {
        dst.append(StringUtils.repeat(' ', spaces));
      }
      // Every following line starts a new physical line
      shouldIndent = true;
      dst.append(line);
    }
    if (text.endsWith("\n")) {
      dst.append('\n');
    }
    return this;
  }

  public Formatter writeln(String text)
  {
    write(text);
    return newline();
  }

  public Formatter newline()
  {
    dst.append('\n');
    return this;
  }

  /**
   * Write a list of trees separated by the given text
   */
  public Formatter writeList(List<? extends CTree> trees, String separator)
  {
    Iterator<? extends CTree> it = trees.iterator();
    while (it.hasNext()) {
      it.next().appendTo(this);
      if (it.hasNext())
        write(separator);
    }
    return this;
  }

  /**
   * Wrap body in curly braces, indented one level:
   * <pre>{
   *     body
   * }</pre>
   * A space separates the brace from preceding text on the same line.
   */
  public void block(CTree body)
  {
    inlineBlock(body);
    newline();
  }

  /**
   * Like {@link #block(CTree)}, but leave the line open after the
   * closing brace, e.g. for <code>} else {</code> or <code>};</code>
   */
  public void inlineBlock(CTree body)
  {
    if (!isStartOfLine()) {
      write(" ");
    }
    writeln("{");
    indent(body);
    write("}");
  }

  /**
   * Format body with one more level of indentation
   */
  public void indent(CTree body)
  {
    spaces += indentWidth;
    try {
      body.appendTo(this);
    } finally {
      spaces -= indentWidth;
    }
  }

  /**
   * Run body with one more level of indentation
   * @return the result of body
   */
  public <R> R indent(Indented<R> body)
  {
    spaces += indentWidth;
    try {
      return body.appendTo(this);
    } finally {
      spaces -= indentWidth;
    }
  }

  /**
   * Write a label line one level shallower than the current code,
   * e.g. access specifiers or goto targets.
   */
  public void label(String name)
  {
    int saved = spaces;
    spaces = Math.max(0, spaces - indentWidth);
    try {
      writeln(name + ":");
    } finally {
      spaces = saved;
    }
  }

  /**
   * Format body inside the named class scope
   */
  public void scope(String name, CTree body)
  {
    scopes.addLast(name);
    try {
      body.appendTo(this);
    } finally {
      scopes.removeLast();
    }
  }

  /**
   * @return name qualified with all enclosing class scopes,
   *         e.g. <code>Outer::Inner::name</code>
   */
  public String scopedName(String name)
  {
    if (scopes.isEmpty()) {
      return name;
    }
    return StringUtils.join(scopes, "::") + "::" + name;
  }

  @Override
  public String toString()
  {
    return dst.toString();
  }
}
