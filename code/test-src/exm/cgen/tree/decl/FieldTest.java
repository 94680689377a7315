package exm.cgen.tree.decl;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.cgen.tree.types.Type;

public class FieldTest {

  @Test
  public void testBasic() {
    Field f = new Field("my_field", Type.newUInt8());
    assertEquals("uint8_t my_field;\n", f.toString());
  }

  @Test
  public void testBitfield() {
    Field f = new Field("my_field", Type.newUInt8()).setBitfieldWidth(8);
    assertEquals("uint8_t my_field : 8;\n", f.toString());
  }

  @Test
  public void testDoc() {
    Field f = new Field("my_field", Type.newUInt8());
    f.pushDoc("my documentation");
    assertEquals("/// my documentation\nuint8_t my_field;\n", f.toString());
  }

  @Test
  public void testDocumentedBitfield() {
    Field f = new Field("count", Type.newUInt8())
                  .setBitfieldWidth(8).pushDoc("packet count");
    assertEquals("/// packet count\nuint8_t count : 8;\n", f.toString());
  }
}
