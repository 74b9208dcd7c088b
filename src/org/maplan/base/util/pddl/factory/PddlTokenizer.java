package org.maplan.base.util.pddl.factory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for PDDL and MA-PDDL text.
 *
 * Comments run from ';' to the end of the line and are discarded.  Parentheses always form tokens of their own,
 * whatever whitespace surrounds them.
 */
public final class PddlTokenizer
{
  private static final char COMMENT_MARKER = ';';

  private PddlTokenizer()
  {
  }

  /**
   * Split PDDL text into tokens.  Never fails - structural checks are for the parsers.
   *
   * @param xiText - the text to tokenize.
   *
   * @return the non-empty tokens, in order.
   */
  public static List<String> tokenize(String xiText)
  {
    List<String> lTokens = new ArrayList<>();

    for (String lLine : xiText.split("\r?\n|\r", -1))
    {
      int lCommentStart = lLine.indexOf(COMMENT_MARKER);
      if (lCommentStart >= 0)
      {
        lLine = lLine.substring(0, lCommentStart);
      }

      lLine = lLine.replace('\t', ' ').replace("(", " ( ").replace(")", " ) ");
      for (String lToken : lLine.trim().split(" +"))
      {
        if (!lToken.isEmpty())
        {
          lTokens.add(lToken);
        }
      }
    }

    return lTokens;
  }
}
