package org.maplan.base.test;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.maplan.base.util.pddl.factory.PddlBlocks;
import org.maplan.base.util.pddl.factory.PddlTokenizer;
import org.maplan.base.util.pddl.factory.exceptions.PddlFormatException;

public class PddlTokenizerTests extends Assert
{
  @Test
  public void testParenthesesAreSeparateTokens()
  {
    assertEquals(Arrays.asList("(", "at", "r1", "l1", ")", "(", "not", "(", "on", "s", ")", ")"),
                 PddlTokenizer.tokenize("(at r1 l1)(not(on s))"));
  }

  @Test
  public void testCommentsAndWhitespaceAreDiscarded()
  {
    List<String> lTokens = PddlTokenizer.tokenize("; header comment\n" +
                                                  "(define\t(domain  d) ; trailing\r\n" +
                                                  "\n" +
                                                  "   )");
    assertEquals(Arrays.asList("(", "define", "(", "domain", "d", ")", ")"), lTokens);
  }

  @Test
  public void testEmptyText()
  {
    assertTrue(PddlTokenizer.tokenize("").isEmpty());
    assertTrue(PddlTokenizer.tokenize("  ; nothing but a comment").isEmpty());
  }

  @Test
  public void testSplitIntoBlocks() throws Exception
  {
    List<List<String>> lChunks = PddlBlocks.split(PddlTokenizer.tokenize("a (b (c)) d"));
    assertEquals(3, lChunks.size());
    assertEquals(Arrays.asList("a"), lChunks.get(0));
    assertEquals(Arrays.asList("(", "b", "(", "c", ")", ")"), lChunks.get(1));
    assertTrue(PddlBlocks.isBlock(lChunks.get(1)));
    assertFalse(PddlBlocks.isBlock(lChunks.get(2)));
  }

  @Test(expected = PddlFormatException.class)
  public void testUnbalancedParentheses() throws Exception
  {
    PddlBlocks.split(PddlTokenizer.tokenize("(a (b)"));
  }
}
