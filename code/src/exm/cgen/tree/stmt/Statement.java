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
 * Simple statement terminated with a semicolon, consisting of an
 * optional keyword and an optional expression,
 * e.g. <code>return x;</code>, <code>break;</code>, <code>f(x);</code>
 */
public class Statement extends CTree
{
  private final String keyword;
  private final Expression expr;

  /**
   * @param keyword may be empty
   * @param expr may be null
   */
  public Statement(String keyword, Expression expr)
  {
    this.keyword = keyword;
    this.expr = expr;
  }

  public static Statement returnStatement()
  {
    return new Statement("return", null);
  }

  public static Statement returnStatement(Expression value)
  {
    return new Statement("return", value);
  }

  public static Statement breakStatement()
  {
    return new Statement("break", null);
  }

  public static Statement continueStatement()
  {
    return new Statement("continue", null);
  }

  public static Statement goTo(String label)
  {
    return new Statement("goto " + label, null);
  }

  /**
   * Statement text without the terminating semicolon
   */
  public static Statement raw(String text)
  {
    return new Statement(text, null);
  }

  /**
   * Evaluate an expression for its side effects, e.g. a call
   */
  public static Statement expression(Expression expr)
  {
    return new Statement("", expr);
  }

  public static Statement fnCall(String name, Expression... args)
  {
    return expression(Expression.fnCall(name, args));
  }

  public Expression getExpression()
  {
    return expr;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write(keyword);
    if (expr != null) {
      if (keyword.length() > 0) {
        fmt.write(" ");
      }
      expr.appendTo(fmt);
    }
    fmt.writeln(";");
  }
}
