package org.maplan.base.util.pddl.factory;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.maplan.base.util.pddl.factory.exceptions.PddlFormatException;

/**
 * Utilities for working with balanced blocks of tokens.
 */
public final class PddlBlocks
{
  public static final String OPEN  = "(";
  public static final String CLOSE = ")";

  private PddlBlocks()
  {
  }

  /**
   * Split a token list into top-level chunks.  Each chunk is either a single atom or a complete parenthesised block
   * (including its outer parentheses).
   *
   * @param xiTokens - the tokens.
   *
   * @return the chunks, in order.
   *
   * @throws PddlFormatException if the parentheses don't balance.
   */
  public static List<List<String>> split(List<String> xiTokens) throws PddlFormatException
  {
    List<List<String>> lChunks = new ArrayList<>();
    int lDepth = 0;
    int lStart = 0;

    for (int lii = 0; lii < xiTokens.size(); lii++)
    {
      String lToken = xiTokens.get(lii);
      if (lToken.equals(OPEN))
      {
        if (lDepth == 0)
        {
          lStart = lii;
        }
        lDepth++;
      }
      else if (lToken.equals(CLOSE))
      {
        lDepth--;
        if (lDepth < 0)
        {
          throw new PddlFormatException("Unexpected ')' in " + render(xiTokens));
        }
        if (lDepth == 0)
        {
          lChunks.add(new ArrayList<>(xiTokens.subList(lStart, lii + 1)));
        }
      }
      else if (lDepth == 0)
      {
        List<String> lAtom = new ArrayList<>(1);
        lAtom.add(lToken);
        lChunks.add(lAtom);
      }
    }

    if (lDepth != 0)
    {
      throw new PddlFormatException("Missing ')' in " + render(xiTokens));
    }

    return lChunks;
  }

  /**
   * @return whether the chunk is a parenthesised block rather than an atom.
   *
   * @param xiChunk - the chunk.
   */
  public static boolean isBlock(List<String> xiChunk)
  {
    return (xiChunk.size() >= 2) && xiChunk.get(0).equals(OPEN);
  }

  /**
   * @return the content of a block without its outer parentheses.
   *
   * @param xiBlock - the block.
   *
   * @throws PddlFormatException if the chunk isn't a block.
   */
  public static List<String> inner(List<String> xiBlock) throws PddlFormatException
  {
    if (!isBlock(xiBlock) || !xiBlock.get(xiBlock.size() - 1).equals(CLOSE))
    {
      throw new PddlFormatException("Expected a parenthesised block but got " + render(xiBlock));
    }
    return xiBlock.subList(1, xiBlock.size() - 1);
  }

  /**
   * @return whether the list contains no parentheses at all.
   *
   * @param xiTokens - the tokens.
   */
  public static boolean isFlat(List<String> xiTokens)
  {
    return !xiTokens.contains(OPEN) && !xiTokens.contains(CLOSE);
  }

  /**
   * @return the tokens as a single string, for error messages.
   *
   * @param xiTokens - the tokens.
   */
  public static String render(List<String> xiTokens)
  {
    return StringUtils.join(xiTokens, ' ');
  }
}
