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

package exm.cgen.tree.expr;

import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.types.Type;

/**
 * <code>sizeof(x)</code> of an expression or a type
 */
public class SizeOf extends Expression
{
  private final CTree operand;

  public SizeOf(Expression expr)
  {
    this.operand = expr;
  }

  public SizeOf(Type type)
  {
    this.operand = new Type(type);
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("sizeof(");
    operand.appendTo(fmt);
    fmt.write(")");
  }
}
