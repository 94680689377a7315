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

/**
 * Enumeration constant, <code>NAME[ = value]</code>.
 * The separator is written by the enclosing {@link Enumeration}.
 */
public class Variant extends CTree
{
  private final String name;
  private Long value = null;
  private Doc doc = null;

  public Variant(String name)
  {
    this.name = name;
  }

  public Variant(String name, long value)
  {
    this.name = name;
    this.value = value;
  }

  public String getName()
  {
    return name;
  }

  /**
   * @return null if no explicit value
   */
  public Long getValue()
  {
    return value;
  }

  public Variant setValue(long value)
  {
    this.value = value;
    return this;
  }

  public Variant pushDoc(String text)
  {
    if (doc == null) {
      doc = new Doc();
    }
    doc.addText(text);
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    if (doc != null) {
      doc.appendTo(fmt);
    }
    fmt.write(name);
    if (value != null) {
      fmt.write(" = " + Long.toUnsignedString(value));
    }
  }
}
