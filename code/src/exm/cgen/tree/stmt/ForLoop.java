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

import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.expr.Expression;

/**
 * <code>for (init; cond; step) { body }</code>.  Each of the clauses
 * may be omitted.  An empty body is written as <code>for (...);</code>
 */
public class ForLoop extends CTree
{
  private final Expression init;
  private final Expression condition;
  private final Expression step;
  private Block body;

  /**
   * Loop without clauses: <code>for (;;)</code>
   */
  public ForLoop()
  {
    this(null, null, null);
  }

  /**
   * @param init may be null
   * @param condition may be null
   * @param step may be null
   */
  public ForLoop(Expression init, Expression condition, Expression step)
  {
    this(init, condition, step, new Block());
  }

  public ForLoop(Expression init, Expression condition, Expression step,
                 Block body)
  {
    this.init = init;
    this.condition = condition;
    this.step = step;
    this.body = body;
  }

  public Block body()
  {
    return body;
  }

  public ForLoop setBody(Block body)
  {
    this.body = body;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("for (");
    appendClause(fmt, init, "");
    appendClause(fmt, condition, ";");
    appendClause(fmt, step, ";");
    fmt.write(")");
    if (body.isEmpty()) {
      fmt.writeln(";");
    } else {
      fmt.block(body);
    }
  }

  private static void appendClause(Formatter fmt, Expression clause,
                                   String separator)
  {
    fmt.write(separator);
    if (clause != null) {
      if (separator.length() > 0) {
        fmt.write(" ");
      }
      clause.appendTo(fmt);
    }
  }
}
