package exm.cgen.tree.expr;

import static exm.cgen.tree.expr.Expression.binop;
import static exm.cgen.tree.expr.Expression.num;
import static exm.cgen.tree.expr.Expression.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.cgen.tree.types.Type;

public class ExpressionTest {

  private static final VarRef OBJ = var("obj", Type.newStruct("foo"));
  private static final VarRef OBJ_PTR =
                        var("obj", Type.newStruct("foo").pointer());

  @Test
  public void testLiterals() {
    assertEquals("42", num(42).toString());
    assertEquals("Numbers are unsigned", "18446744073709551615",
                 num(-1).toString());
    assertEquals("\"hello\\n\"", Expression.str("hello\\n").toString());
    assertEquals("true", Expression.bool(true).toString());
    assertEquals("false", BoolLiteral.FALSE.toString());
    assertFalse(num(0).isPointer());
  }

  @Test
  public void testFieldAccess() {
    assertEquals("(obj).x", new FieldAccess(OBJ, "x").toString());
    assertEquals("(obj)->x", new FieldAccess(OBJ_PTR, "x").toString());
    assertEquals("(this)->x",
                 new FieldAccess(VarRef.thisRef(), "x").toString());

    FieldAccess next = new FieldAccess(OBJ_PTR, "next");
    assertFalse(next.isPointer());
    next.setPointer(true);
    assertTrue(next.isPointer());
    assertEquals("((obj)->next)->x", new FieldAccess(next, "x").toString());
  }

  @Test
  public void testMethodCall() {
    VarRef list = var("list", Type.newClass("List"));
    VarRef listPtr = var("list", Type.newClass("List").pointer());
    assertEquals("list.size()",
        new MethodCall(list, "size",
                       Collections.<Expression>emptyList()).toString());
    assertEquals("list->get(1, i)",
        new MethodCall(listPtr, "get",
            Arrays.<Expression>asList(num(1), var("i", Type.newSize())))
            .toString());
    MethodCall head = new MethodCall(list, "head",
                                  Collections.<Expression>emptyList());
    assertFalse(head.isPointer());
    assertTrue(head.setPointer(true).isPointer());
  }

  @Test
  public void testDereference() {
    VarRef pp = var("pp", Type.newStruct("foo").pointer().pointer());
    Deref d1 = new Deref(pp);
    Deref d2 = new Deref(d1);
    assertEquals("*(*(pp))", d2.toString());
    assertTrue(d1.isPointer());
    assertFalse(d2.isPointer());
    assertEquals("(*(pp))->x", new FieldAccess(d1, "x").toString());
    assertEquals("(*(*(pp))).x", new FieldAccess(d2, "x").toString());

    Deref bad = new Deref(new Deref(num(3)));
    assertEquals("Dereferencing a non-pointer is not an error",
                 0, bad.pointerDepth());
  }

  @Test
  public void testAddressOf() {
    VarRef x = var("x", Type.newStruct("foo"));
    assertFalse(x.isPointer());
    AddressOf addr = new AddressOf(x);
    assertEquals("&(x)", addr.toString());
    assertTrue(addr.isPointer());
    assertEquals("(&(x))->y", new FieldAccess(addr, "y").toString());
  }

  @Test
  public void testOperators() {
    VarRef a = var("a", Type.newInt32());
    VarRef b = var("b", Type.newInt32());
    assertEquals("(a + 1)", binop(a, "+", num(1)).toString());
    assertEquals("((a * b) == 4)",
                 binop(binop(a, "*", b), "==", num(4)).toString());
    assertEquals("!(a)", Expression.not(a).toString());
    assertEquals("-(b)", new UnaryOp("-", b).toString());
    assertEquals("(a) ? (b) : (0)", new Ternary(a, b, num(0)).toString());
    assertEquals("buf[(a + 1)]",
        new ArrayAccess(var("buf", Type.newChar().pointer()),
                        binop(a, "+", num(1))).toString());
  }

  @Test
  public void testCastAndSizeOf() {
    VarRef x = var("x", Type.newUIntPtr());
    Cast cast = new Cast(Type.newUInt8().pointer(), x);
    assertEquals("(uint8_t *)(x)", cast.toString());
    assertTrue(cast.isPointer());
    assertFalse(new Cast(Type.newUInt64(), x).isPointer());
    assertEquals("sizeof(struct foo)",
                 new SizeOf(Type.newStruct("foo")).toString());
    assertEquals("sizeof(x)", new SizeOf(x).toString());
  }

  @Test
  public void testCalls() {
    assertEquals("f()", Expression.fnCall("f").toString());
    assertEquals("memset(p, 0, 8)",
        Expression.fnCall("memset", var("p", Type.newVoid().pointer()),
                          num(0), num(8)).toString());
  }

  @Test
  public void testObjects() {
    NewObject obj = new NewObject("Foo", Arrays.<Expression>asList(num(1)));
    assertEquals("new Foo(1)", obj.toString());
    assertTrue(obj.isPointer());
    assertEquals("new Foo(1)->run()",
        new MethodCall(obj, "run",
                       Collections.<Expression>emptyList()).toString());
    assertEquals("delete[] p",
        new DeleteObject(var("p", Type.newClass("Foo").pointer())).toString());
  }

  @Test
  public void testRawToken() {
    Token t = Expression.raw("SOME_MACRO(x)");
    assertEquals("SOME_MACRO(x)", t.toString());
    assertTrue(t.isPointer());
    assertTrue(t.isStruct());
    assertEquals("(SOME_MACRO(x))->f", new FieldAccess(t, "f").toString());
  }

  @Test
  public void testVarRef() {
    assertTrue(OBJ.isStruct());
    assertFalse(var("n", Type.newInt32()).isStruct());
    assertTrue(var("h", Type.newTypedefPtr("handle_t")).isPointer());
    assertTrue(VarRef.thisRef().isPointer());
    assertEquals("auto *", VarRef.thisRef().getType().toString());
  }

  @Test
  public void testTypeCopiedOnConstruction() {
    Type t = Type.newClass("Foo");
    FieldAccess access = new FieldAccess(var("obj", t), "x");
    Cast cast = new Cast(t, var("p", Type.newVoid().pointer()));
    t.pointer();
    assertEquals("(obj).x", access.toString());
    assertEquals("(Foo)(p)", cast.toString());
    assertFalse(cast.isPointer());
  }

  @Test
  public void testTypeCopiedByGetter() {
    VarRef v = var("n", Type.newInt32());
    v.getType().pointer();
    assertFalse(v.isPointer());
    assertEquals("int32_t", v.getType().toString());
  }
}
