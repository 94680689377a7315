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
import java.util.List;

import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.tree.CTree;
import exm.cgen.tree.Formatter;
import exm.cgen.tree.expr.Expression;

/**
 * Switch statement.  Every case body is terminated with
 * <code>break;</code>, there is no fall through.
 * <pre>
 * switch (cond) {
 *     case 1:
 *         body
 *         break;
 *     default:
 *         body
 * }
 * </pre>
 */
public class Switch extends CTree
{
  private final Expression condition;
  private final List<Expression> caseLabels;
  private final List<Block> cases;
  private Block defaultCase;

  public Switch(Expression condition)
  {
    this.condition = condition;
    this.caseLabels = new ArrayList<Expression>();
    this.cases = new ArrayList<Block>();
    this.defaultCase = null;
  }

  /**
   * @param caseLabels one per non-default case
   * @param hasDefault if true, the last block of cases is the default
   * @param cases
   */
  public Switch(Expression condition, List<Expression> caseLabels,
                boolean hasDefault, List<Block> cases)
  {
    int labelcount = caseLabels.size();
    if (hasDefault) labelcount++;
    if (cases.size() != labelcount) {
      throw new CGenRuntimeError("Number of case labels " + labelcount +
                        " does not match number of case bodies " + cases.size());
    }
    this.condition = condition;
    this.caseLabels = new ArrayList<Expression>(caseLabels);
    this.cases = new ArrayList<Block>(cases.subList(0, caseLabels.size()));
    this.defaultCase = hasDefault ? cases.get(cases.size() - 1) : null;
  }

  /**
   * Add a case
   * @return the body of the new case
   */
  public Block addCase(Expression label)
  {
    Block body = new Block();
    addCase(label, body);
    return body;
  }

  public Switch addCase(Expression label, Block body)
  {
    caseLabels.add(label);
    cases.add(body);
    return this;
  }

  public Switch setDefault(Block body)
  {
    this.defaultCase = body;
    return this;
  }

  /**
   * @return the default body, created if not already present
   */
  public Block defaultCase()
  {
    if (defaultCase == null) {
      defaultCase = new Block();
    }
    return defaultCase;
  }

  public int caseCount()
  {
    return cases.size();
  }

  @Override
  public void appendTo(Formatter fmt)
  {
    fmt.write("switch (");
    condition.appendTo(fmt);
    fmt.write(")");
    fmt.block(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        for (int i = 0; i < cases.size(); i++) {
          fmt.write("case ");
          caseLabels.get(i).appendTo(fmt);
          fmt.writeln(":");
          final Block caseBody = cases.get(i);
          fmt.indent(new CTree() {
            @Override
            public void appendTo(Formatter fmt) {
              caseBody.appendTo(fmt);
              Statement.breakStatement().appendTo(fmt);
            }
          });
        }
        if (defaultCase != null) {
          fmt.writeln("default:");
          fmt.indent(defaultCase);
        }
      }
    });
  }
}
