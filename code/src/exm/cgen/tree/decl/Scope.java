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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.cgen.common.Logging;
import exm.cgen.tree.Comment;
import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.stmt.Variable;
import exm.cgen.tree.types.Type;

/**
 * Contents of a source or header file: a sequence of top-level
 * declarations, separated by blank lines.
 *
 * The same scope can be written as a header in declaration mode and as
 * an implementation file in definition mode.
 */
public class Scope extends Declaration
{
  private static final Logger logger = Logging.getCGenLogger();

  private final List<Declaration> items = new ArrayList<Declaration>();

  public Scope add(Declaration item)
  {
    items.add(item);
    return this;
  }

  public List<Declaration> getItems()
  {
    return items;
  }

  public Comment newComment(String text)
  {
    Comment comment = new Comment(text);
    items.add(comment);
    return comment;
  }

  public Include newInclude(String path, boolean system)
  {
    Include include = new Include(path, system);
    items.add(include);
    return include;
  }

  public Macro newMacro(String name)
  {
    Macro macro = new Macro(name);
    items.add(macro);
    return macro;
  }

  public Enumeration newEnum(String name)
  {
    Enumeration e = new Enumeration(name);
    items.add(e);
    return e;
  }

  public Struct newStruct(String name)
  {
    Struct s = new Struct(name);
    items.add(s);
    return s;
  }

  public Union newUnion(String name)
  {
    Union u = new Union(name);
    items.add(u);
    return u;
  }

  public CppClass newClass(String name)
  {
    CppClass c = new CppClass(name);
    items.add(c);
    return c;
  }

  public Function newFunction(String name, Type returnType)
  {
    Function f = new Function(name, returnType);
    items.add(f);
    return f;
  }

  public Variable newVariable(String name, Type type)
  {
    Variable var = new Variable(name, type);
    items.add(var);
    return var;
  }

  public IfDef newIfDef(String symbol)
  {
    IfDef ifdef = new IfDef(symbol);
    items.add(ifdef);
    return ifdef;
  }

  /**
   * @return true if nothing is written for this mode
   */
  public boolean isEmpty(RenderMode mode)
  {
    if (doc != null && !doc.isEmpty()) {
      return false;
    }
    for (Declaration item: items) {
      if (item.emitsInScope(mode)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendTo(fmt, RenderMode.DEFINITION);
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    boolean first = true;
    if (doc != null && !doc.isEmpty()) {
      doc.appendTo(fmt);
      first = false;
    }
    for (Declaration item: items) {
      if (!item.emitsInScope(mode)) {
        continue;
      }
      if (!first) {
        fmt.newline();
      }
      first = false;
      item.appendInScope(fmt, mode);
    }
  }

  /**
   * Render this scope and write it to a file, replacing its contents
   * @throws IOException if the file cannot be written
   */
  public void toFile(File file, RenderMode mode) throws IOException
  {
    String text = render(mode);
    logger.debug("Writing " + text.length() + " characters to " + file);
    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
  }
}
