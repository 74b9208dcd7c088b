package org.maplan.base.util.pddl.factory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.math.NumberUtils;
import org.maplan.base.util.pddl.factory.exceptions.PddlException;
import org.maplan.base.util.pddl.factory.exceptions.PddlFormatException;
import org.maplan.base.util.pddl.factory.exceptions.UnknownTypeException;
import org.maplan.base.util.pddl.factory.exceptions.UnsupportedConstructException;
import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlNot;
import org.maplan.base.util.pddl.grammar.PddlNumericEffect;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableSet;

/**
 * Base class for the domain and problem parsers.  Holds the rules that both of them share: header matching, section
 * splitting, typed lists and literal lists.
 */
public abstract class PddlParser
{
  protected static final String TYPE_SEPARATOR = "-";
  protected static final String KEYWORD_MARKER = ":";

  private static final String AND = "and";
  private static final String NOT = "not";

  private static final Set<String> UNSUPPORTED_CONNECTIVES =
      ImmutableSet.of("or", "imply", "forall", "exists", "when", "either");

  /**
   * A top-level <code>(:keyword ...)</code> section.
   */
  protected static final class PddlSection
  {
    final String       mKeyword;
    final List<String> mBody;

    PddlSection(String xiKeyword, List<String> xiBody)
    {
      mKeyword = xiKeyword;
      mBody = xiBody;
    }
  }

  /**
   * Check that the token list starts with the expected tokens.
   *
   * @param xiTokens - the tokens.
   * @param xiOffset - where to start matching.
   * @param xiExpected - the expected tokens.
   * @param xiWhat - description for the error message.
   *
   * @throws PddlFormatException if the tokens don't match.
   */
  protected static void expect(List<String> xiTokens, int xiOffset, String[] xiExpected, String xiWhat)
      throws PddlFormatException
  {
    for (int lii = 0; lii < xiExpected.length; lii++)
    {
      if ((xiOffset + lii >= xiTokens.size()) || !xiTokens.get(xiOffset + lii).equalsIgnoreCase(xiExpected[lii]))
      {
        throw new PddlFormatException("Expected " + xiWhat);
      }
    }
  }

  /**
   * @return the name token at the specified position.
   *
   * @param xiTokens - the tokens.
   * @param xiIndex - the position.
   * @param xiWhat - description for the error message.
   *
   * @throws PddlFormatException if there's no name there.
   */
  protected static String name(List<String> xiTokens, int xiIndex, String xiWhat) throws PddlFormatException
  {
    if (xiIndex >= xiTokens.size())
    {
      throw new PddlFormatException("Missing " + xiWhat);
    }
    String lName = xiTokens.get(xiIndex);
    if (lName.equals(PddlBlocks.OPEN) || lName.equals(PddlBlocks.CLOSE) || lName.startsWith(KEYWORD_MARKER))
    {
      throw new PddlFormatException("Expected " + xiWhat + " but got '" + lName + "'");
    }
    return lName;
  }

  /**
   * Split the body of a define block into its sections.
   *
   * @param xiTokens - the tokens following the header, up to and including the final ')'.
   *
   * @return the sections, in order.
   *
   * @throws PddlFormatException if the tokens aren't a balanced sequence of (:keyword ...) blocks.
   */
  protected static List<PddlSection> splitSections(List<String> xiTokens) throws PddlFormatException
  {
    if (xiTokens.isEmpty() || !xiTokens.get(xiTokens.size() - 1).equals(PddlBlocks.CLOSE))
    {
      throw new PddlFormatException("Missing final ')' of define block");
    }

    List<PddlSection> lSections = new ArrayList<>();
    for (List<String> lChunk : PddlBlocks.split(xiTokens.subList(0, xiTokens.size() - 1)))
    {
      if (!PddlBlocks.isBlock(lChunk))
      {
        throw new PddlFormatException("Unexpected '" + lChunk.get(0) + "' outside any section");
      }
      List<String> lInner = PddlBlocks.inner(lChunk);
      if (lInner.isEmpty() || !lInner.get(0).startsWith(KEYWORD_MARKER))
      {
        throw new PddlFormatException("Expected a section keyword in " + PddlBlocks.render(lChunk));
      }
      lSections.add(new PddlSection(lInner.get(0).substring(1).toLowerCase(), lInner.subList(1, lInner.size())));
    }
    return lSections;
  }

  /**
   * Parse a typed list such as <code>?from ?to - location ?r - robot</code>.
   *
   * @param xiTokens - the tokens (no parentheses).
   * @param xiKnownTypes - the types that may be referred to.
   * @param xiRequireTypes - whether every name must be typed.  If not, trailing untyped names are of the root type.
   *
   * @return the typed names, in order.
   *
   * @throws PddlException if the list is malformed or refers to an unknown type.
   */
  protected static List<PddlTypedParameter> parseTypedList(List<String> xiTokens,
                                                           Set<String> xiKnownTypes,
                                                           boolean xiRequireTypes)
      throws PddlException
  {
    if (!PddlBlocks.isFlat(xiTokens))
    {
      throw new UnsupportedConstructException("Nested expression in typed list: " + PddlBlocks.render(xiTokens));
    }

    List<PddlTypedParameter> lResult = new ArrayList<>();
    List<String> lBuffer = new ArrayList<>();

    for (int lii = 0; lii < xiTokens.size(); lii++)
    {
      String lToken = xiTokens.get(lii);
      if (!lToken.equals(TYPE_SEPARATOR))
      {
        lBuffer.add(lToken);
        continue;
      }

      if ((lii + 1 >= xiTokens.size()) || lBuffer.isEmpty())
      {
        throw new PddlFormatException("Malformed typed list: " + PddlBlocks.render(xiTokens));
      }
      String lType = xiTokens.get(++lii);
      if (!xiKnownTypes.contains(lType))
      {
        throw new UnknownTypeException(lType, xiKnownTypes);
      }
      for (String lName : lBuffer)
      {
        lResult.add(new PddlTypedParameter(lName, lType));
      }
      lBuffer.clear();
    }

    if (!lBuffer.isEmpty())
    {
      if (xiRequireTypes)
      {
        throw new PddlFormatException("Expected " + lBuffer + " to be typed in " + PddlBlocks.render(xiTokens));
      }
      for (String lName : lBuffer)
      {
        lResult.add(new PddlTypedParameter(lName, TypeHierarchy.ROOT_TYPE));
      }
    }

    return lResult;
  }

  /**
   * Parse a literal list - a precondition, an effect or a goal.  The list is an implicit conjunction: an enclosing
   * (and ...) is removed and (not ...) wrappers become negations.
   *
   * @param xiBlock - the complete block, including its outer parentheses.
   * @param xiAllowNumericEffects - whether (increase ...) etc. are acceptable here.
   *
   * @return the literals, in order.
   *
   * @throws PddlException if the block is malformed or uses an unsupported construct.
   */
  protected static List<PddlLiteral> parseLiteralList(List<String> xiBlock, boolean xiAllowNumericEffects)
      throws PddlException
  {
    List<PddlLiteral> lLiterals = new ArrayList<>();
    addLiterals(xiBlock, xiAllowNumericEffects, lLiterals);
    return lLiterals;
  }

  private static void addLiterals(List<String> xiBlock, boolean xiAllowNumericEffects, List<PddlLiteral> xoLiterals)
      throws PddlException
  {
    List<String> lInner = PddlBlocks.inner(xiBlock);
    if (lInner.isEmpty())
    {
      return;
    }

    if (lInner.get(0).equalsIgnoreCase(AND))
    {
      for (List<String> lChunk : PddlBlocks.split(lInner.subList(1, lInner.size())))
      {
        if (!PddlBlocks.isBlock(lChunk))
        {
          throw new PddlFormatException("Expected a literal but got '" + lChunk.get(0) + "'");
        }
        addLiterals(lChunk, xiAllowNumericEffects, xoLiterals);
      }
      return;
    }

    xoLiterals.add(parseLiteral(lInner, xiAllowNumericEffects));
  }

  private static PddlLiteral parseLiteral(List<String> xiInner, boolean xiAllowNumericEffects) throws PddlException
  {
    String lHead = xiInner.get(0);

    if (lHead.equalsIgnoreCase(NOT))
    {
      List<List<String>> lChunks = PddlBlocks.split(xiInner.subList(1, xiInner.size()));
      if ((lChunks.size() != 1) || !PddlBlocks.isBlock(lChunks.get(0)))
      {
        throw new PddlFormatException("Malformed negation: (" + PddlBlocks.render(xiInner) + ")");
      }
      return new PddlNot(parseAtom(PddlBlocks.inner(lChunks.get(0))));
    }

    PddlNumericEffect.Operation lOperation = PddlNumericEffect.Operation.fromKeyword(lHead.toLowerCase());
    if ((lOperation != null) && xiAllowNumericEffects)
    {
      List<List<String>> lChunks = PddlBlocks.split(xiInner.subList(1, xiInner.size()));
      if ((lChunks.size() != 2) || !PddlBlocks.isBlock(lChunks.get(0)) || PddlBlocks.isBlock(lChunks.get(1)))
      {
        throw new UnsupportedConstructException("Only constant numeric effects are supported: (" +
                                                PddlBlocks.render(xiInner) + ")");
      }
      String lValue = lChunks.get(1).get(0);
      if (!isNumericLiteral(lValue))
      {
        throw new UnsupportedConstructException("Numeric effect value must be a literal number: (" +
                                                PddlBlocks.render(xiInner) + ")");
      }
      return new PddlNumericEffect(lOperation, parseAtom(PddlBlocks.inner(lChunks.get(0))), lValue);
    }

    if (UNSUPPORTED_CONNECTIVES.contains(lHead.toLowerCase()))
    {
      throw new UnsupportedConstructException("'" + lHead + "' is not supported: (" +
                                              PddlBlocks.render(xiInner) + ")");
    }

    return parseAtom(xiInner);
  }

  /**
   * @return whether a token is a number that the plan checker can read as a double.  Hexadecimal and type-suffixed
   *         integer forms such as <code>0x10</code> or <code>1L</code> are not.
   *
   * @param xiToken - the token.
   */
  protected static boolean isNumericLiteral(String xiToken)
  {
    if (!NumberUtils.isNumber(xiToken))
    {
      return false;
    }
    try
    {
      NumberUtils.createDouble(xiToken);
      return true;
    }
    catch (NumberFormatException lEx)
    {
      return false;
    }
  }

  /**
   * Parse the inside of a flat block, e.g. <code>at ?r ?from</code>, into an atom.
   *
   * @param xiInner - the tokens inside the parentheses.
   *
   * @return the atom.
   *
   * @throws PddlException if the block is empty or nested.
   */
  protected static PddlAtom parseAtom(List<String> xiInner) throws PddlException
  {
    if (xiInner.isEmpty())
    {
      throw new PddlFormatException("Empty literal '()'");
    }
    if (!PddlBlocks.isFlat(xiInner))
    {
      throw new UnsupportedConstructException("Nested expressions are not supported: (" +
                                              PddlBlocks.render(xiInner) + ")");
    }
    return new PddlAtom(xiInner.get(0), xiInner.subList(1, xiInner.size()));
  }
}
