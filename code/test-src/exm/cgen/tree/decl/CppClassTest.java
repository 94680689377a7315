package exm.cgen.tree.decl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.cgen.tree.RenderMode;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.types.Type;
import exm.cgen.tree.types.Visibility;

public class CppClassTest {

  /**
   * Class with members in all sections, added out of order
   */
  private static CppClass example() {
    CppClass cls = new CppClass("Foo").setBase("Bar", Visibility.PUBLIC);

    Method helper = cls.newMethod("helper", Type.newVoid()).setInline(true);
    helper.setVisibility(Visibility.PROTECTED);
    helper.body().raw("count++");

    cls.newAttribute("count", Type.newInt32());
    cls.newAttribute("instances", Type.newSize())
       .setStatic(true).setValue("0");

    Method get = cls.newMethod("get", Type.newInt32()).setConst(true);
    get.setVisibility(Visibility.PUBLIC);
    get.body().returnExpr(Expression.var("count", Type.newInt32()));

    cls.newDestructor().setVirtual(true);
    cls.newConstructor().pushInitializer("count", Expression.num(0));
    return cls;
  }

  @Test
  public void testEmpty() {
    CppClass cls = new CppClass("Foo");
    assertEquals("class Foo { };\n", cls.declaration());
    assertEquals("class Foo { };\n", cls.toString());
    assertFalse(cls.emits(RenderMode.DEFINITION));
    assertEquals("", cls.definition());

    cls.setBase("Bar", Visibility.PUBLIC);
    assertEquals("class Foo : public Bar { };\n", cls.declaration());
  }

  @Test
  public void testDeclaration() {
    assertEquals("class Foo : public Bar {\n" +
                 "public:\n" +
                 "    Foo(void);\n" +
                 "    virtual ~Foo(void);\n" +
                 "    int32_t get(void) const;\n" +
                 "\n" +
                 "protected:\n" +
                 "    inline void helper(void) {\n" +
                 "        count++;\n" +
                 "    }\n" +
                 "\n" +
                 "private:\n" +
                 "    static size_t instances;\n" +
                 "    int32_t count;\n" +
                 "};\n", example().declaration());
  }

  @Test
  public void testDefinition() {
    CppClass cls = example();
    assertTrue(cls.emits(RenderMode.DEFINITION));
    assertEquals("Foo::Foo(void)\n" +
                 "    : count(0)\n" +
                 "{\n" +
                 "}\n" +
                 "\n" +
                 "Foo::~Foo(void) {\n" +
                 "}\n" +
                 "\n" +
                 "int32_t Foo::get(void) const {\n" +
                 "    return count;\n" +
                 "}\n" +
                 "\n" +
                 "size_t Foo::instances = 0;\n", cls.definition());
  }

  @Test
  public void testDeterministic() {
    assertEquals(example().declaration(), example().declaration());
    assertEquals(example().definition(), example().definition());
  }

  @Test
  public void testNewDestructorReplaces() {
    CppClass cls = new CppClass("Foo");
    cls.newDestructor().setVirtual(true);
    Destructor d = cls.newDestructor();
    assertEquals(d, cls.getDestructor());
    assertEquals("class Foo {\npublic:\n    ~Foo(void);\n};\n",
                 cls.declaration());
  }

  @Test
  public void testDefaultVisibilityIsPrivate() {
    CppClass cls = new CppClass("Foo");
    Method run = new Method("run", Type.newVoid());
    run.setVisibility(Visibility.DEFAULT);
    cls.addMethod(run);
    assertEquals("class Foo {\nprivate:\n    void run(void);\n};\n",
                 cls.declaration());
  }

  @Test
  public void testToType() {
    assertEquals("Foo *", new CppClass("Foo").toType().pointer().toString());
  }
}
