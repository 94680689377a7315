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

import org.apache.log4j.Logger;

import exm.cgen.common.Logging;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.expr.VarRef;
import exm.cgen.tree.types.Type;
import exm.cgen.tree.types.Visibility;

/**
 * Data member of a class.
 *
 * Static attributes are declared without their value in the class body
 * and defined as <code>T Foo::name = value;</code>
 */
public class Attribute extends ClassMember
{
  private static final Logger logger = Logging.getCGenLogger();

  private final String name;
  private final Type type;
  private Integer width = null;
  private String value = null;
  private boolean isStatic = false;

  public Attribute(String name, Type type)
  {
    super(Visibility.PRIVATE);
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

  public VarRef toExpression()
  {
    return new VarRef(name, type);
  }

  /**
   * Only integer types can be bitfields, for others the width is
   * ignored
   */
  public Attribute setBitfieldWidth(int width)
  {
    if (type.isInteger()) {
      this.width = width;
    } else {
      logger.debug("Ignoring bitfield width " + width + " of attribute " +
                   name + " with non-integer type " + type);
    }
    return this;
  }

  public Integer getBitfieldWidth()
  {
    return width;
  }

  public Attribute setStatic(boolean val)
  {
    this.isStatic = val;
    return this;
  }

  public boolean isStatic()
  {
    return isStatic;
  }

  /**
   * @param value raw initializer text
   */
  public Attribute setValue(String value)
  {
    this.value = value;
    return this;
  }

  @Override
  public boolean emits(RenderMode mode)
  {
    return mode == RenderMode.DECLARATION || isStatic;
  }

  @Override
  protected boolean bodyInDeclaration()
  {
    return false;
  }

  /**
   * @param withBody include the value of static attributes
   */
  @Override
  protected void format(Formatter fmt, RenderMode mode, boolean withBody)
  {
    if (mode == RenderMode.DEFINITION) {
      type.appendTo(fmt);
      fmt.write(" " + fmt.scopedName(name));
      if (value != null) {
        fmt.write(" = " + value);
      }
      fmt.writeln(";");
      return;
    }

    appendDoc(fmt);
    if (isStatic) {
      fmt.write("static ");
    }
    type.appendTo(fmt);
    fmt.write(" " + name);
    if (width != null) {
      fmt.write(" : " + width);
    }
    if (value != null && (!isStatic || withBody)) {
      fmt.write(" = " + value);
    }
    fmt.writeln(";");
  }
}
