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
 * <code>(lhs op rhs)</code>, always parenthesized
 */
public class BinaryOp extends Expression
{
  private final Expression lhs;
  private final String op;
  private final Expression rhs;

  public BinaryOp(Expression lhs, String op, Expression rhs)
  {
    this.lhs = lhs;
    this.op = op;
    this.rhs = rhs;
  }

  public String getOp()
  {
    return op;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("(");
    lhs.appendTo(fmt);
    fmt.write(" " + op + " ");
    rhs.appendTo(fmt);
    fmt.write(")");
  }
}
