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

import exm.cgen.tree.CTree;
import exm.cgen.tree.Doc;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.types.Type;

/**
 * Member of a struct or union: <code>T name[ : width];</code>
 */
public class Field extends CTree
{
  private final String name;
  private final Type type;
  private Integer width = null;
  private Doc doc = null;

  public Field(String name, Type type)
  {
    this.name = name;
    this.type = new Type(type);
  }

  public String getName()
  {
    return name;
  }

  public Type getType()
  {
    return new Type(type);
  }

  /**
   * @param width bitfield width in bits
   */
  public Field setBitfieldWidth(int width)
  {
    this.width = width;
    return this;
  }

  public Field pushDoc(String text)
  {
    if (doc == null) {
      doc = new Doc();
    }
    doc.addText(text);
    return this;
  }

  public Field setDoc(Doc doc)
  {
    this.doc = doc;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    if (doc != null) {
      doc.appendTo(fmt);
    }
    type.appendTo(fmt);
    fmt.write(" " + name);
    if (width != null) {
      fmt.write(" : " + width);
    }
    fmt.writeln(";");
  }
}
