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
 * <pre>
 * if (cond) {
 *     then
 * } else {
 *     other
 * }
 * </pre>
 * The else branch is left out if it has no statements.
 */
public class IfElse extends CTree
{
  private final Expression condition;
  private Block thenBlock;
  private Block elseBlock;

  public IfElse(Expression condition)
  {
    this(condition, new Block(), new Block());
  }

  public IfElse(Expression condition, Block thenBlock)
  {
    this(condition, thenBlock, new Block());
  }

  public IfElse(Expression condition, Block thenBlock, Block elseBlock)
  {
    this.condition = condition;
    this.thenBlock = thenBlock;
    this.elseBlock = elseBlock;
  }

  public Block thenBlock()
  {
    return thenBlock;
  }

  public Block elseBlock()
  {
    return elseBlock;
  }

  public IfElse setThen(Block thenBlock)
  {
    this.thenBlock = thenBlock;
    return this;
  }

  public IfElse setElse(Block elseBlock)
  {
    this.elseBlock = elseBlock;
    return this;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("if (");
    condition.appendTo(fmt);
    fmt.write(")");
    fmt.inlineBlock(thenBlock);
    if (!elseBlock.isEmpty()) {
      fmt.write(" else");
      fmt.inlineBlock(elseBlock);
    }
    fmt.newline();
  }
}
