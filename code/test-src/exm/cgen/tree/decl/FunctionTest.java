package exm.cgen.tree.decl;

import static exm.cgen.tree.expr.Expression.binop;
import static exm.cgen.tree.expr.Expression.num;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.cgen.tree.RenderMode;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.types.Type;

public class FunctionTest {

  @Test
  public void testNoParams() {
    Function f = new Function("main", Type.newInt32());
    assertEquals("int32_t main(void);\n", f.toString());
    assertEquals("int32_t main(void);\n", f.declaration());
    assertFalse("No body, nothing to define", f.emits(RenderMode.DEFINITION));
    assertEquals("", f.definition());
  }

  @Test
  public void testWithBody() {
    Function f = new Function("main", Type.newInt32());
    f.newParam("argc", Type.newInt32());
    f.newParam("argv", Type.newCStr().pointer());
    f.body().returnExpr(num(0));

    String def = "int32_t main(int32_t argc, char * * argv) {\n" +
                 "    return 0;\n" +
                 "}\n";
    assertEquals(def, f.toString());
    assertEquals(def, f.definition());
    assertEquals("int32_t main(int32_t argc, char * * argv);\n",
                 f.declaration());
    assertEquals("argv", f.getParam("argv").toExpression().toString());
    assertNull(f.getParam("envp"));
  }

  @Test
  public void testStatic() {
    Function f = new Function("helper", Type.newVoid()).setStatic(true);
    f.body().raw("work()");
    assertEquals("static void helper(void);\n", f.declaration());
    assertEquals("Definitions keep file scope linkage",
                 "static void helper(void) {\n    work();\n}\n",
                 f.definition());
  }

  @Test
  public void testInline() {
    Function f = new Function("twice", Type.newInt32()).setInline(true);
    FunctionParam x = f.newParam("x", Type.newInt32());
    f.body().returnExpr(binop(x.toExpression(), "*", num(2)));
    assertEquals("inline int32_t twice(int32_t x) {\n" +
                 "    return (x * 2);\n" +
                 "}\n", f.declaration());
    assertEquals("", f.definition());
  }

  @Test
  public void testExtern() {
    Function f = new Function("external", Type.newVoid()).setExtern(true);
    assertEquals("extern void external(void);\n", f.declaration());
    assertEquals("", f.definition());

    f.setBody(new Block().raw("x()"));
    assertFalse(f.isExtern());
    assertTrue(f.emits(RenderMode.DEFINITION));
  }

  @Test
  public void testAttributes() {
    Function f = new Function("die", Type.newVoid());
    f.addAttribute("noreturn").addAttribute("cold");
    assertEquals("void die(void) __attribute__((noreturn, cold));\n",
                 f.declaration());
  }

  @Test
  public void testToDeclaration() {
    Function f = new Function("run", Type.newVoid());
    f.pushDoc("Run it");
    f.body().fnCall("step");
    Function proto = f.toDeclaration();
    assertEquals("/// Run it\nvoid run(void);\n", proto.toString());
    assertEquals("/// Run it\nvoid run(void) {\n    step();\n}\n",
                 f.toString());
  }

  @Test
  public void testKeepsParameterTypes() {
    Type t = Type.newInt32();
    Function f = new Function("abs", t);
    f.newParam("x", t);
    Method m = new Method("get", t);
    m.newParam("i", t);
    t.pointer();
    assertEquals("int32_t abs(int32_t x);\n", f.declaration());
    assertEquals("int32_t get(int32_t i);\n", m.declaration());
  }
}
