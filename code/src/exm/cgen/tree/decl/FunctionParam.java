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

import java.util.List;

import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.expr.VarRef;
import exm.cgen.tree.types.Type;

/**
 * Function parameter, <code>T name</code>
 */
public class FunctionParam extends CTree
{
  private final String name;
  private final Type type;

  public FunctionParam(String name, Type type)
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

  public VarRef toExpression()
  {
    return new VarRef(name, type);
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    type.appendTo(fmt);
    fmt.write(" " + name);
  }

  /**
   * Write a parameter list, <code>(void)</code> if empty
   */
  static void appendParams(Formatter fmt, List<FunctionParam> params)
  {
    if (params.isEmpty()) {
      fmt.write("(void)");
      return;
    }
    fmt.write("(");
    fmt.writeList(params, ", ");
    fmt.write(")");
  }
}
