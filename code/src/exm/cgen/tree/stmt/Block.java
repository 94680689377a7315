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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.cgen.tree.CTree;
import exm.cgen.tree.Comment;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.expr.FunctionCall;
import exm.cgen.tree.expr.MethodCall;
import exm.cgen.tree.types.Type;

/**
 * Sequence of statements, rendered in the order they were added.
 * Used for function bodies and the branches of control statements.
 *
 * The <code>new*</code> methods add a statement and return it so that
 * it can be filled in afterwards.
 */
public class Block extends CTree
{
  private final List<CTree> members = new ArrayList<CTree>();

  public Block()
  {
  }

  public Block(CTree... members)
  {
    add(members);
  }

  public Block add(CTree tree)
  {
    members.add(tree);
    return this;
  }

  public Block add(CTree[] trees)
  {
    for (CTree tree : trees)
      add(tree);
    return this;
  }

  /**
   * Move all statements of other to the end of this block,
   * leaving other empty
   * @param other
   */
  public Block merge(Block other)
  {
    members.addAll(other.members);
    other.members.clear();
    return this;
  }

  public boolean isEmpty()
  {
    return members.isEmpty();
  }

  public int size()
  {
    return members.size();
  }

  public List<CTree> members()
  {
    return members;
  }

  public void clear()
  {
    members.clear();
  }

  public Block emptyLine()
  {
    return add(new EmptyLine());
  }

  public Block breakStatement()
  {
    return add(Statement.breakStatement());
  }

  public Block continueStatement()
  {
    return add(Statement.continueStatement());
  }

  /**
   * @param text statement without terminating semicolon
   */
  public Block raw(String text)
  {
    return add(Statement.raw(text));
  }

  public Block assign(Expression lhs, Expression rhs)
  {
    return add(new Assignment(lhs, rhs));
  }

  public Block label(String name)
  {
    return add(new Label(name));
  }

  public Block goTo(String label)
  {
    return add(Statement.goTo(label));
  }

  public Block comment(String text)
  {
    return add(new Comment(text));
  }

  public Block returnNone()
  {
    return add(Statement.returnStatement());
  }

  public Block returnExpr(Expression value)
  {
    return add(Statement.returnStatement(value));
  }

  public Block fnCall(String name, Expression... args)
  {
    return add(Statement.fnCall(name, args));
  }

  public Block methodCall(Expression receiver, String method,
                          Expression... args)
  {
    return add(Statement.expression(
            new MethodCall(receiver, method, Arrays.asList(args))));
  }

  /**
   * <code>printf("format", args);</code>
   */
  public Block printf(String format, Expression... args)
  {
    List<Expression> allArgs = new ArrayList<Expression>();
    allArgs.add(Expression.str(format));
    allArgs.addAll(Arrays.asList(args));
    return add(Statement.expression(new FunctionCall("printf", allArgs)));
  }

  public Variable newVariable(String name, Type type)
  {
    Variable var = new Variable(name, type);
    add(var);
    return var;
  }

  public IfElse newIfElse(Expression condition)
  {
    IfElse stmt = new IfElse(condition);
    add(stmt);
    return stmt;
  }

  public WhileLoop newWhileLoop(Expression condition)
  {
    WhileLoop loop = new WhileLoop(condition);
    add(loop);
    return loop;
  }

  public DoWhileLoop newDoWhileLoop(Expression condition)
  {
    DoWhileLoop loop = new DoWhileLoop(condition);
    add(loop);
    return loop;
  }

  /**
   * @param init may be null
   * @param condition may be null
   * @param step may be null
   */
  public ForLoop newForLoop(Expression init, Expression condition,
                            Expression step)
  {
    ForLoop loop = new ForLoop(init, condition, step);
    add(loop);
    return loop;
  }

  public Switch newSwitch(Expression condition)
  {
    Switch stmt = new Switch(condition);
    add(stmt);
    return stmt;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    for (CTree member : members) {
      member.appendTo(fmt);
    }
  }
}
