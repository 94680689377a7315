package exm.cgen.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

public class DocTest {

  @Test
  public void testLines() {
    Doc doc = new Doc("first\n\nsecond");
    assertEquals("/// first\n///\n/// second\n", doc.toString());
  }

  @Test
  public void testWrapsLongText() {
    String text = StringUtils.repeat("word", " ", 30);
    Doc doc = new Doc(text);
    assertEquals(2, doc.getLines().size());
    assertEquals(89, doc.getLines().get(0).length());
    for (String line: doc.getLines()) {
      assertTrue(line, line.length() <= 90);
    }
  }

  @Test
  public void testAddLineNotWrapped() {
    String text = StringUtils.repeat("x", 120);
    Doc doc = new Doc().addLine(text).addLine("");
    assertEquals("/// " + text + "\n///\n", doc.toString());
  }
}
