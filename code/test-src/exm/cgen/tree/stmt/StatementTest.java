package exm.cgen.tree.stmt;

import static exm.cgen.tree.expr.Expression.num;
import static exm.cgen.tree.expr.Expression.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.types.Type;

public class StatementTest {

  @Test
  public void testSimpleStatements() {
    assertEquals("return;\n", Statement.returnStatement().toString());
    assertEquals("return 0;\n", Statement.returnStatement(num(0)).toString());
    assertEquals("break;\n", Statement.breakStatement().toString());
    assertEquals("continue;\n", Statement.continueStatement().toString());
    assertEquals("goto out;\n", Statement.goTo("out").toString());
    assertEquals("x++;\n", Statement.raw("x++").toString());
    assertEquals("f(a);\n",
        Statement.fnCall("f", var("a", Type.newInt32())).toString());
    assertEquals("x = 1;\n",
        new Assignment(var("x", Type.newInt32()), num(1)).toString());
    assertEquals("\n", new EmptyLine().toString());
  }

  @Test
  public void testVariable() {
    Variable v = new Variable("count", Type.newInt32(), num(3));
    assertEquals("int32_t count = 3;\n", v.toString());
    assertEquals("int32_t count;\n", v.declaration());
    assertEquals("int32_t count = 3;\n", v.definition());

    v.setStatic(true);
    assertEquals("static int32_t count = 3;\n", v.toString());

    v.setExtern(true);
    assertEquals("extern int32_t count;\n", v.definition());
    assertEquals("extern int32_t count;\n", v.declaration());

    v.setStatic(true);
    assertEquals("Static and extern exclude each other",
                 "static int32_t count = 3;\n", v.toString());
  }

  @Test
  public void testVariableDoc() {
    Variable v = new Variable("name", Type.newCStr());
    v.setValue("NULL");
    v.pushDoc("device name");
    assertEquals("/// device name\nchar * name = NULL;\n", v.toString());
    assertEquals("name", v.toExpression().toString());
    assertTrue(v.toExpression().isPointer());
  }

  @Test
  public void testLocalVariablesInBlock() {
    Block b = new Block();
    b.newVariable("i", Type.newSize()).setValue(num(0));
    b.newVariable("buf", Type.newChar().pointer()).setStatic(true);
    b.printf("%zu\\n", Expression.var("i", Type.newSize()));
    assertEquals("size_t i = 0;\nstatic char * buf;\n" +
                 "printf(\"%zu\\n\", i);\n", b.toString());
  }

  @Test
  public void testVariableKeepsItsType() {
    Type t = Type.newInt32();
    Variable v = new Variable("count", t, num(3));
    t.pointer();
    assertEquals("int32_t count = 3;\n", v.toString());
  }
}
