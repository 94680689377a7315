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

import exm.cgen.tree.Formatter;

/**
 * <code>*(e)</code>
 */
public class Deref extends Expression
{
  private final Expression expr;

  public Deref(Expression expr)
  {
    this.expr = expr;
  }

  /**
   * One level less than the operand.  Dereferencing a non-pointer
   * is not checked here.
   */
  @Override
  public int pointerDepth()
  {
    return Math.max(expr.pointerDepth() - 1, 0);
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("*(");
    expr.appendTo(fmt);
    fmt.write(")");
  }
}
