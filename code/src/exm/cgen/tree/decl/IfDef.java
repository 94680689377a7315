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

package exm.cgen.tree.decl;

import exm.cgen.tree.Declaration;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.RenderMode;

/**
 * Conditional compilation block.  As an include guard:
 * <pre>
 * #ifndef SYM
 * #define SYM 1
 *
 * ...
 *
 * #endif // SYM
 * </pre>
 */
public class IfDef extends Declaration
{
  private final String symbol;
  private final Scope thenScope = new Scope();
  private Scope elseScope = null;
  private boolean guard = false;

  public IfDef(String symbol)
  {
    this.symbol = symbol;
  }

  public static IfDef guard(String symbol)
  {
    return new IfDef(symbol).setGuard(true);
  }

  public String getSymbol()
  {
    return symbol;
  }

  public IfDef setGuard(boolean guard)
  {
    this.guard = guard;
    return this;
  }

  public Scope thenScope()
  {
    return thenScope;
  }

  /**
   * @return scope of the <code>#else</code> branch, created if needed
   */
  public Scope elseScope()
  {
    if (elseScope == null) {
      elseScope = new Scope();
    }
    return elseScope;
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    appendTo(fmt, RenderMode.DEFINITION);
  }

  @Override
  public void appendTo(Formatter fmt, RenderMode mode)
  {
    appendDoc(fmt);
    if (guard) {
      fmt.writeln("#ifndef " + symbol);
      fmt.writeln("#define " + symbol + " 1");
    } else {
      fmt.writeln("#ifdef " + symbol);
    }
    appendBranch(fmt, thenScope, mode);
    if (elseScope != null) {
      fmt.writeln("#else // !" + symbol);
      appendBranch(fmt, elseScope, mode);
    }
    fmt.writeln("#endif // " + symbol);
  }

  private static void appendBranch(Formatter fmt, Scope scope,
                                   RenderMode mode)
  {
    if (scope.isEmpty(mode)) {
      return;
    }
    fmt.newline();
    scope.appendTo(fmt, mode);
    fmt.newline();
  }
}
