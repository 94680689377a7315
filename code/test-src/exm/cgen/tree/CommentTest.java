package exm.cgen.tree;

import static org.junit.Assert.assertEquals;

import org.apache.commons.lang3.StringUtils;
import org.junit.Test;

import exm.cgen.common.util.StringUtil;
import exm.cgen.tree.expr.Expression;
import exm.cgen.tree.stmt.Block;
import exm.cgen.tree.stmt.WhileLoop;
import exm.cgen.tree.types.Type;

public class CommentTest {

  @Test
  public void testComment() {
    assertEquals("// one\n//\n// two\n", new Comment("one\n\ntwo").toString());
  }

  @Test
  public void testHeading() {
    String rule = StringUtils.repeat('/', 100);
    assertEquals(rule + "\n// Types\n" + rule + "\n",
                 Comment.heading("Types").toString());
  }

  @Test
  public void testIndentedHeadingEndsAtSameColumn() {
    Block body = new Block().add(Comment.heading("Loop body"));
    WhileLoop loop = new WhileLoop(Expression.var("c", Type.newBool()), body);
    String ruleLine = StringUtil.lines(loop.toString()).get(1);
    assertEquals(100, ruleLine.length());
    assertEquals("    " + StringUtils.repeat('/', 96), ruleLine);
  }
}
