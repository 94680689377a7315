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
 * <code>while (cond) { body }</code>, or <code>while (cond);</code>
 * if the body is empty
 */
public class WhileLoop extends CTree
{
  private final Expression condition;
  private Block body;

  public WhileLoop(Expression condition)
  {
    this(condition, new Block());
  }

  public WhileLoop(Expression condition, Block body)
  {
    this.condition = condition;
    this.body = body;
  }

  public Block body()
  {
    return body;
  }

  public WhileLoop setBody(Block body)
  {
    this.body = body;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("while (");
    condition.appendTo(fmt);
    fmt.write(")");
    if (body.isEmpty()) {
      fmt.writeln(";");
    } else {
      fmt.block(body);
    }
  }
}
