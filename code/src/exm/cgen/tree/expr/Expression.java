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

import java.util.Arrays;
import java.util.List;

import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.types.Type;

/**
 * Base class for C/C++ expressions.
 *
 * Besides rendering themselves, expressions know whether they denote a
 * pointer, which decides between <code>.</code> and <code>-&gt;</code>
 * when a member of the value is accessed.
 */
public abstract class Expression extends CTree
{
  /**
   * @return levels of pointer indirection of the value, 0 for non-pointers
   */
  public int pointerDepth()
  {
    return 0;
  }

  public boolean isPointer()
  {
    return pointerDepth() > 0;
  }

  public boolean isStruct()
  {
    return false;
  }

  public static VarRef var(String name, Type type)
  {
    return new VarRef(name, type);
  }

  public static NumLiteral num(long value)
  {
    return new NumLiteral(value);
  }

  public static StringLiteral str(String text)
  {
    return new StringLiteral(text);
  }

  public static BoolLiteral bool(boolean value)
  {
    return value ? BoolLiteral.TRUE : BoolLiteral.FALSE;
  }

  public static Token raw(String text)
  {
    return new Token(text);
  }

  public static FunctionCall fnCall(String name, Expression... args)
  {
    return new FunctionCall(name, Arrays.asList(args));
  }

  public static UnaryOp not(Expression e)
  {
    return new UnaryOp("!", e);
  }

  public static BinaryOp binop(Expression lhs, String op, Expression rhs)
  {
    return new BinaryOp(lhs, op, rhs);
  }

  /**
   * Write a parenthesized, comma separated argument list
   */
  protected static void appendArgs(Formatter fmt,
                                   List<? extends Expression> args)
  {
    fmt.write("(");
    fmt.writeList(args, ", ");
    fmt.write(")");
  }
}
