package exm.cgen.common.util;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class StringUtilTest {

  @Test
  public void testLines() {
    assertEquals(Arrays.asList("a", "b"), StringUtil.lines("a\nb\n"));
    assertEquals(Arrays.asList("a", "", "b"), StringUtil.lines("a\n\nb"));
    assertEquals(Arrays.asList("a", "b"), StringUtil.lines("a\r\nb"));
    assertEquals(Arrays.asList(""), StringUtil.lines("\n"));
    assertEquals(Collections.emptyList(), StringUtil.lines(""));
  }

  @Test
  public void testWrap() {
    assertEquals(Arrays.asList("aaa bbb", "ccc"),
                 StringUtil.wrap("aaa bbb ccc", 7));
    assertEquals(Arrays.asList("aaa bbb ccc"),
                 StringUtil.wrap("aaa  bbb ccc", 20));
    assertEquals("Long words are not broken",
                 Arrays.asList("abcdefghij", "xy"),
                 StringUtil.wrap("abcdefghij xy", 4));
    assertEquals(Arrays.asList(""), StringUtil.wrap("", 10));
  }
}
