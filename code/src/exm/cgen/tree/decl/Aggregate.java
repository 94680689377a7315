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

import exm.cgen.tree.CTree;
import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.types.Type;

/**
 * Common part of struct and union definitions.
 *
 * The declaration is a forward declaration, the definition lists the
 * fields.  Without fields only the forward declaration is written.
 */
public abstract class Aggregate extends Declaration
{
  private final String keyword;
  protected final String name;
  private final List<Field> fields = new ArrayList<Field>();
  private final List<String> attributes = new ArrayList<String>();

  protected Aggregate(String keyword, String name)
  {
    this.keyword = keyword;
    this.name = name;
  }

  public String getName()
  {
    return name;
  }

  public abstract Type toType();

  public Field newField(String name, Type type)
  {
    Field field = new Field(name, type);
    fields.add(field);
    return field;
  }

  public Aggregate addField(Field field)
  {
    fields.add(field);
    return this;
  }

  public List<Field> getFields()
  {
    return fields;
  }

  /**
   * @return field with given name, or null if none
   */
  public Field getField(String name)
  {
    for (Field field: fields) {
      if (field.getName().equals(name)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Add a GCC attribute, e.g. <code>packed</code>
   */
  public Aggregate addAttribute(String attr)
  {
    attributes.add(attr);
    return this;
  }

  /**
   * Full definition with fields
   */
  @Override
  public void appendTo(Formatter fmt)
  {
    appendDoc(fmt);
    fmt.write(keyword + " " + name);
    if (!fields.isEmpty()) {
      fmt.inlineBlock(new CTree() {
        @Override
        public void appendTo(Formatter fmt) {
          fmt.writeList(fields, "");
        }
      });
      if (!attributes.isEmpty()) {
        fmt.write(" __attribute__((" + StringUtils.join(attributes, ", ") +
                  "))");
      }
    }
    fmt.writeln(";");
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    if (mode == RenderMode.DECLARATION) {
      fmt.writeln(keyword + " " + name + ";");
    } else {
      appendTo(fmt);
    }
  }

  /**
   * Type definitions are always written in full in a scope
   */
  @Override
  public void appendInScope(Formatter fmt, RenderMode mode)
  {
    appendTo(fmt);
  }

  @Override
  public boolean emitsInScope(RenderMode mode)
  {
    return true;
  }
}
