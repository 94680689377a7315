package exm.cgen.tree.stmt;

import static exm.cgen.tree.expr.Expression.binop;
import static exm.cgen.tree.expr.Expression.num;
import static exm.cgen.tree.expr.Expression.var;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.cgen.common.exceptions.CGenRuntimeError;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.expr.VarRef;
import exm.cgen.tree.types.Type;

public class ControlFlowTest {

  private static final VarRef C = var("c", Type.newBool());
  private static final VarRef X = var("x", Type.newInt32());

  @Test
  public void testIf() {
    assertEquals("if (c) {\n}\n", new IfElse(C).toString());

    IfElse stmt = new IfElse(C);
    stmt.thenBlock().assign(X, num(1));
    assertEquals("if (c) {\n    x = 1;\n}\n", stmt.toString());

    stmt.elseBlock().assign(X, num(2));
    assertEquals("if (c) {\n    x = 1;\n} else {\n    x = 2;\n}\n",
                 stmt.toString());
  }

  @Test
  public void testElseIf() {
    IfElse inner = new IfElse(Expression.not(C), new Block().breakStatement());
    IfElse outer = new IfElse(C, new Block().continueStatement(),
                              new Block(inner));
    assertEquals("if (c) {\n" +
                 "    continue;\n" +
                 "} else {\n" +
                 "    if (!(c)) {\n" +
                 "        break;\n" +
                 "    }\n" +
                 "}\n", outer.toString());
  }

  @Test
  public void testWhile() {
    assertEquals("while (c);\n", new WhileLoop(C).toString());
    WhileLoop loop = new WhileLoop(C);
    loop.body().fnCall("poll");
    assertEquals("while (c) {\n    poll();\n}\n", loop.toString());
  }

  @Test
  public void testDoWhile() {
    assertEquals("do {\n} while (c);\n", new DoWhileLoop(C).toString());
    DoWhileLoop loop = new DoWhileLoop(C, new Block().raw("x--"));
    assertEquals("do {\n    x--;\n} while (c);\n", loop.toString());
  }

  @Test
  public void testFor() {
    assertEquals("for (;;);\n", new ForLoop().toString());

    VarRef i = var("i", Type.newSize());
    ForLoop loop = new ForLoop(Expression.raw("size_t i = 0"),
                               binop(i, "<", num(10)), Expression.raw("i++"));
    loop.body().fnCall("f", i);
    assertEquals("for (size_t i = 0; (i < 10); i++) {\n    f(i);\n}\n",
                 loop.toString());

    assertEquals("for (; c;);\n", new ForLoop(null, C, null).toString());
  }

  @Test
  public void testSwitch() {
    Switch sw = new Switch(X);
    sw.addCase(num(1)).fnCall("f");
    sw.addCase(num(2));
    sw.defaultCase().fnCall("g");
    assertEquals("switch (x) {\n" +
                 "    case 1:\n" +
                 "        f();\n" +
                 "        break;\n" +
                 "    case 2:\n" +
                 "        break;\n" +
                 "    default:\n" +
                 "        g();\n" +
                 "}\n", sw.toString());
    assertEquals(2, sw.caseCount());
  }

  @Test
  public void testSwitchFromLists() {
    Switch sw = new Switch(X, Arrays.<Expression>asList(num(0)), true,
        Arrays.asList(new Block().returnExpr(num(1)),
                      new Block().returnExpr(num(2))));
    assertEquals("switch (x) {\n" +
                 "    case 0:\n" +
                 "        return 1;\n" +
                 "        break;\n" +
                 "    default:\n" +
                 "        return 2;\n" +
                 "}\n", sw.toString());
  }

  @Test(expected=CGenRuntimeError.class)
  public void testSwitchLabelMismatch() {
    new Switch(X, Arrays.<Expression>asList(num(0), num(1)), false,
               Arrays.asList(new Block()));
  }

  @Test
  public void testGotoLabel() {
    Block body = new Block();
    body.label("retry");
    body.newIfElse(C).thenBlock().goTo("retry");
    WhileLoop loop = new WhileLoop(Expression.bool(true), body);
    assertEquals("while (true) {\n" +
                 "retry:\n" +
                 "    if (c) {\n" +
                 "        goto retry;\n" +
                 "    }\n" +
                 "}\n", loop.toString());
  }
}
