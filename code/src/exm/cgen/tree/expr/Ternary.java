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
 * <code>(cond) ? (then) : (other)</code>
 */
public class Ternary extends Expression
{
  private final Expression cond;
  private final Expression then;
  private final Expression other;

  public Ternary(Expression cond, Expression then, Expression other)
  {
    this.cond = cond;
    this.then = then;
    this.other = other;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("(");
    cond.appendTo(fmt);
    fmt.write(") ? (");
    then.appendTo(fmt);
    fmt.write(") : (");
    other.appendTo(fmt);
    fmt.write(")");
  }
}
