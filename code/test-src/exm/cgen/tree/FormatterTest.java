package exm.cgen.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import exm.cgen.common.Settings;
import exm.cgen.common.exceptions.CGenRuntimeError;

public class FormatterTest {

  @Test
  public void testWriteIndentsNewLines() {
    Formatter fmt = new Formatter(4);
    fmt.write("a\n");
    fmt.indent(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        fmt.write("b\n\nc\n");
      }
    });
    fmt.write("d");
    assertEquals("Empty lines must not be indented",
                 "a\n    b\n\n    c\nd", fmt.toString());
    assertFalse(fmt.isStartOfLine());
  }

  @Test
  public void testWriteContinuesLine() {
    Formatter fmt = new Formatter(4);
    fmt.indent(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        fmt.write("x");
        fmt.write("y\nz");
        fmt.writeln(";");
      }
    });
    assertEquals("    xy\n    z;\n", fmt.toString());
    assertTrue(fmt.isStartOfLine());
  }

  @Test
  public void testBlock() {
    Formatter fmt = new Formatter(4);
    fmt.write("if (c)");
    fmt.block(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        assertEquals(4, fmt.getIndent());
        fmt.writeln("x;");
      }
    });
    assertEquals(0, fmt.getIndent());
    assertEquals("if (c) {\n    x;\n}\n", fmt.toString());
  }

  @Test
  public void testInlineBlockAtStartOfLine() {
    Formatter fmt = new Formatter(2);
    fmt.inlineBlock(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        fmt.writeln("x;");
      }
    });
    fmt.writeln(";");
    assertEquals("{\n  x;\n};\n", fmt.toString());
  }

  @Test
  public void testIndentReturnsResult() {
    Formatter fmt = new Formatter(4);
    int depth = fmt.indent(new Formatter.Indented<Integer>() {
      @Override
      public Integer appendTo(Formatter fmt) {
        fmt.writeln("x");
        return fmt.getIndent();
      }
    });
    assertEquals(4, depth);
    assertEquals(0, fmt.getIndent());
  }

  @Test
  public void testIndentRestoredOnError() {
    Formatter fmt = new Formatter(4);
    try {
      fmt.indent(new CTree() {
        @Override
        public void appendTo(Formatter fmt) {
          throw new CGenRuntimeError("failed");
        }
      });
      fail("Expected error");
    } catch (CGenRuntimeError e) {
      assertEquals(0, fmt.getIndent());
    }
  }

  @Test
  public void testLabel() {
    Formatter fmt = new Formatter(4);
    fmt.label("top");
    fmt.indent(new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        fmt.indent(new CTree() {
          @Override
          public void appendTo(Formatter fmt) {
            fmt.label("inner");
            fmt.writeln("x;");
          }
        });
      }
    });
    assertEquals("Labels are outdented one level, but not below zero",
                 "top:\n    inner:\n        x;\n", fmt.toString());
  }

  @Test
  public void testScopedName() {
    final Formatter fmt = new Formatter(4);
    assertEquals("foo", fmt.scopedName("foo"));
    fmt.scope("Outer", new CTree() {
      @Override
      public void appendTo(Formatter fmt) {
        assertEquals("Outer::foo", fmt.scopedName("foo"));
        fmt.scope("Inner", new CTree() {
          @Override
          public void appendTo(Formatter fmt) {
            fmt.write(fmt.scopedName("foo"));
          }
        });
      }
    });
    assertEquals("Outer::Inner::foo", fmt.toString());
    assertEquals("foo", fmt.scopedName("foo"));
  }

  @Test(expected=CGenRuntimeError.class)
  public void testZeroIndentWidth() {
    new Formatter(0);
  }

  @Test
  public void testNegativeIndentWidthSetting() {
    Settings.set(Settings.INDENT_WIDTH, "-4");
    try {
      new Formatter();
      fail("Negative indent width accepted");
    } catch (CGenRuntimeError e) {
      // expected
    } finally {
      Settings.set(Settings.INDENT_WIDTH, "4");
    }
  }
}
