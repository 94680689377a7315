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

package exm.cgen.tree.stmt;

import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.expr.Token;
import exm.cgen.tree.expr.VarRef;
import exm.cgen.tree.types.Type;

/**
 * Global or local variable:
 * <code>[static |extern ]T name[ = value];</code>
 *
 * The initial value is only written in the definition, and never for
 * extern variables.
 */
public class Variable extends Declaration
{
  private final String name;
  private final Type type;
  private Expression value = null;
  private boolean isStatic = false;
  private boolean isExtern = false;

  public Variable(String name, Type type)
  {
    this.name = name;
    this.type = new Type(type);
  }

  public Variable(String name, Type type, Expression value)
  {
    this(name, type);
    this.value = value;
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
   * @return expression referring to this variable
   */
  public VarRef toExpression()
  {
    return new VarRef(name, type);
  }

  public Variable setStatic(boolean val)
  {
    this.isStatic = val;
    if (val) {
      this.isExtern = false;
    }
    return this;
  }

  public Variable setExtern(boolean val)
  {
    this.isExtern = val;
    if (val) {
      this.isStatic = false;
    }
    return this;
  }

  public boolean isStatic()
  {
    return isStatic;
  }

  public boolean isExtern()
  {
    return isExtern;
  }

  public Variable setValue(Expression value)
  {
    this.value = value;
    return this;
  }

  public Variable setValue(String raw)
  {
    return setValue(new Token(raw));
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendTo(fmt, RenderMode.DEFINITION);
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    appendDoc(fmt);
    if (isExtern) {
      fmt.write("extern ");
    } else if (isStatic) {
      fmt.write("static ");
    }
    type.appendTo(fmt);
    fmt.write(" " + name);
    if (value != null && !isExtern && mode == RenderMode.DEFINITION) {
      fmt.write(" = ");
      value.appendTo(fmt);
    }
    fmt.writeln(";");
  }
}
