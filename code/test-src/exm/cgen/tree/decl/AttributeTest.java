package exm.cgen.tree.decl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.cgen.tree.RenderMode;
import exm.cgen.tree.types.Type;

public class AttributeTest {

  @Test
  public void testPlain() {
    Attribute a = new Attribute("count", Type.newInt32()).setValue("0");
    assertTrue(a.isPrivate());
    assertEquals("int32_t count = 0;\n", a.declaration());
    assertFalse(a.emits(RenderMode.DEFINITION));
    assertEquals("", a.definition());
  }

  @Test
  public void testStatic() {
    CppClass cls = new CppClass("Foo");
    Attribute a = cls.newAttribute("count", Type.newInt32())
                     .setStatic(true).setValue("42");
    a.pushDoc("instances");
    assertEquals("/// instances\nstatic int32_t count;\n", a.declaration());
    assertEquals("/// instances\nstatic int32_t count = 42;\n", a.toString());
    assertEquals("int32_t Foo::count = 42;\n", cls.definition());
  }

  @Test
  public void testBitfield() {
    Attribute flags = new Attribute("flags", Type.newUInt8())
                          .setBitfieldWidth(3);
    assertEquals("uint8_t flags : 3;\n", flags.declaration());

    Attribute ratio = new Attribute("ratio", Type.newDouble())
                          .setBitfieldWidth(3);
    assertNull("Only integers can be bitfields", ratio.getBitfieldWidth());
    assertEquals("double ratio;\n", ratio.declaration());
  }

  @Test
  public void testToExpression() {
    Attribute a = new Attribute("next", Type.newClass("Node").pointer());
    assertTrue(a.toExpression().isPointer());
    assertEquals("next", a.toExpression().toString());
  }

  @Test
  public void testKeepsItsType() {
    Type t = Type.newUInt8();
    Attribute a = new Attribute("flags", t);
    t.constant();
    a.getType().pointer();
    assertEquals("uint8_t flags;\n", a.declaration());
  }
}
