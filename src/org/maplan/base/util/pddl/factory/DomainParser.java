package org.maplan.base.util.pddl.factory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.maplan.base.util.pddl.factory.exceptions.PddlException;
import org.maplan.base.util.pddl.factory.exceptions.PddlFormatException;
import org.maplan.base.util.pddl.factory.exceptions.UnsupportedConstructException;
import org.maplan.base.util.pddl.grammar.PddlFunctionSignature;
import org.maplan.base.util.pddl.grammar.PddlLiteral;
import org.maplan.base.util.pddl.grammar.PddlParameterList;
import org.maplan.base.util.pddl.grammar.PddlPredicateSignature;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.DomainBuilder;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PddlAction;
import org.maplan.base.util.pddl.model.TypeHierarchy;

import com.google.common.collect.ImmutableSet;

/**
 * Parser for PDDL and MA-PDDL domain files.
 *
 * The body of the (define (domain ...)) block is split into its sections, each of which is handed to the parser for
 * that kind of section.  All section parsers write into a single {@link DomainBuilder} owned by this invocation.
 */
public final class DomainParser extends PddlParser
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Requirement flags that are retained.  Anything else is reported and dropped.
   */
  public static final Set<String> KNOWN_REQUIREMENTS =
      ImmutableSet.of("typing", "strips", "multi-agent", "unfactored-privacy");

  private static final String PRIVATE = ":private";

  private static final String AGENT        = "agent";
  private static final String PARAMETERS   = "parameters";
  private static final String PRECONDITION = "precondition";
  private static final String EFFECT       = "effect";
  private static final String DURATION     = "duration";

  private static final Set<String> ACTION_KEYWORDS =
      ImmutableSet.of(AGENT, PARAMETERS, PRECONDITION, EFFECT, DURATION);

  private final PddlDialect mDialect;

  /**
   * Create a parser for the specified dialect.
   *
   * @param xiDialect - the dialect.
   */
  public DomainParser(PddlDialect xiDialect)
  {
    mDialect = xiDialect;
  }

  /**
   * Parse a domain.
   *
   * @param xiText - the domain text.
   *
   * @return the domain.
   *
   * @throws PddlException if the domain is malformed.  No partial domain is ever returned.
   */
  public DomainModel parse(String xiText) throws PddlException
  {
    return parse(PddlTokenizer.tokenize(xiText));
  }

  /**
   * Parse a tokenized domain.
   *
   * @param xiTokens - the tokens.
   *
   * @return the domain.
   *
   * @throws PddlException if the domain is malformed.
   */
  public DomainModel parse(List<String> xiTokens) throws PddlException
  {
    expect(xiTokens, 0, new String[] {"(", "define", "(", "domain"}, "(define (domain ... at start of domain");
    String lName = name(xiTokens, 4, "domain name");
    expect(xiTokens, 5, new String[] {")"}, "')' after domain name");

    DomainBuilder lBuilder = new DomainBuilder(lName);

    for (PddlSection lSection : splitSections(xiTokens.subList(6, xiTokens.size())))
    {
      switch (lSection.mKeyword)
      {
        case "requirements":
          parseRequirements(lSection.mBody, lBuilder);
          break;

        case "types":
          parseTypes(lSection.mBody, lBuilder);
          break;

        case "constants":
          parseConstants(lSection.mBody, lBuilder);
          break;

        case "predicates":
          parsePredicates(lSection.mBody, lBuilder);
          break;

        case "private":
          parsePrivatePredicates(lSection.mBody, lBuilder);
          break;

        case "functions":
          parseFunctions(lSection.mBody, lBuilder);
          break;

        case "action":
          lBuilder.addAction(parseAction(lSection.mBody, lBuilder));
          break;

        case "derived":
        case "durative-action":
          throw new UnsupportedConstructException("Section :" + lSection.mKeyword + " is not supported");

        default:
          LOGGER.warn("Ignoring unknown domain section :" + lSection.mKeyword);
      }
    }

    DomainModel lDomain = lBuilder.build();
    LOGGER.debug("Parsed domain " + lName + " with " + lDomain.getActions().size() + " actions");
    return lDomain;
  }

  private static void parseRequirements(List<String> xiBody, DomainBuilder xiBuilder) throws PddlFormatException
  {
    for (String lToken : xiBody)
    {
      if (!lToken.startsWith(KEYWORD_MARKER))
      {
        throw new PddlFormatException("Expected requirement to start with ':' but got '" + lToken + "'");
      }

      String lRequirement = lToken.substring(1).toLowerCase();
      if (KNOWN_REQUIREMENTS.contains(lRequirement))
      {
        xiBuilder.addRequirement(lRequirement);
      }
      else
      {
        LOGGER.warn("Unknown requirement " + lRequirement);
      }
    }
  }

  private static void parseTypes(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    if (!PddlBlocks.isFlat(xiBody))
    {
      throw new UnsupportedConstructException("(either ...) types are not supported");
    }

    TypeHierarchy.Builder lTypes = xiBuilder.types();
    List<String> lBuffer = new ArrayList<>();

    for (int lii = 0; lii < xiBody.size(); lii++)
    {
      String lToken = xiBody.get(lii);
      if (!lToken.equals(TYPE_SEPARATOR))
      {
        lBuffer.add(lToken);
        continue;
      }

      if (lii + 1 >= xiBody.size())
      {
        throw new PddlFormatException("Missing supertype at end of :types");
      }
      String lSupertype = xiBody.get(++lii);
      for (String lType : lBuffer)
      {
        lTypes.declare(lType, lSupertype);
      }
      lBuffer.clear();
    }

    for (String lType : lBuffer)
    {
      lTypes.declareTopLevel(lType);
    }
  }

  private static void parseConstants(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    for (PddlTypedParameter lConstant : parseTypedList(xiBody, xiBuilder.types().getKnownTypes(), false))
    {
      xiBuilder.addConstant(lConstant.getName(), lConstant.getType());
    }
  }

  private static void parsePredicates(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    for (List<String> lChunk : PddlBlocks.split(xiBody))
    {
      if (!PddlBlocks.isBlock(lChunk))
      {
        throw new PddlFormatException("Expected a predicate declaration but got '" + lChunk.get(0) + "'");
      }

      List<String> lInner = PddlBlocks.inner(lChunk);
      if (!lInner.isEmpty() && lInner.get(0).equalsIgnoreCase(PRIVATE))
      {
        parsePrivatePredicates(lInner.subList(1, lInner.size()), xiBuilder);
      }
      else
      {
        addPredicate(parseSignature(lInner, xiBuilder), xiBuilder);
      }
    }
  }

  /**
   * Parse the content of a (:private owner (pred ...) ...) block.  The owner declaration - everything up to the first
   * nested block - is dropped and the predicates are recorded like any other.
   */
  private static void parsePrivatePredicates(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    int lFirstBlock = xiBody.indexOf(PddlBlocks.OPEN);
    if (lFirstBlock >= 0)
    {
      parsePredicates(xiBody.subList(lFirstBlock, xiBody.size()), xiBuilder);
    }
  }

  private static PddlPredicateSignature parseSignature(List<String> xiInner, DomainBuilder xiBuilder)
      throws PddlException
  {
    String lName = name(xiInner, 0, "predicate name");
    List<PddlTypedParameter> lParams = parseTypedList(xiInner.subList(1, xiInner.size()),
                                                      xiBuilder.types().getKnownTypes(),
                                                      true);
    return new PddlPredicateSignature(lName, lParams);
  }

  private static void addPredicate(PddlPredicateSignature xiPredicate, DomainBuilder xiBuilder)
      throws PddlFormatException
  {
    PddlPredicateSignature lPrevious = xiBuilder.getPredicate(xiPredicate.getName());
    if (lPrevious == null)
    {
      xiBuilder.addPredicate(xiPredicate);
    }
    else if (lPrevious.arity() != xiPredicate.arity())
    {
      throw new PddlFormatException("Predicate " + xiPredicate.getName() + " declared with arity " +
                                    lPrevious.arity() + " and " + xiPredicate.arity());
    }
    else if (!lPrevious.equals(xiPredicate))
    {
      LOGGER.warn("Ignoring redeclaration " + xiPredicate + " of " + lPrevious);
    }
  }

  private static void parseFunctions(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    List<List<String>> lChunks = PddlBlocks.split(xiBody);
    for (int lii = 0; lii < lChunks.size(); lii++)
    {
      List<String> lChunk = lChunks.get(lii);
      if (PddlBlocks.isBlock(lChunk))
      {
        List<String> lInner = PddlBlocks.inner(lChunk);
        if (!PddlBlocks.isFlat(lInner))
        {
          throw new UnsupportedConstructException("Nested function declaration " + PddlBlocks.render(lChunk));
        }
        String lName = name(lInner, 0, "function name");
        xiBuilder.addFunction(new PddlFunctionSignature(lName, lInner.subList(1, lInner.size())));
      }
      else if (lChunk.get(0).equals(TYPE_SEPARATOR) && (lii + 1 < lChunks.size()))
      {
        // The type of the preceding function.
        String lType = lChunks.get(++lii).get(0);
        if (!lType.equals(PddlFunctionSignature.NUMBER_TYPE))
        {
          throw new UnsupportedConstructException("Only numeric functions are supported, not '" + lType + "'");
        }
      }
      else
      {
        throw new PddlFormatException("Unexpected '" + lChunk.get(0) + "' in :functions");
      }
    }
  }

  private PddlAction parseAction(List<String> xiBody, DomainBuilder xiBuilder) throws PddlException
  {
    List<String> lBody = xiBody;
    if (!lBody.isEmpty() && lBody.get(0).equals(TYPE_SEPARATOR))
    {
      lBody = lBody.subList(Math.min(2, lBody.size()), lBody.size());
    }
    String lName = name(lBody, 0, "action name");

    // Sort the remaining tokens into buckets by the keyword that precedes them.
    Map<String, List<String>> lBuckets = new LinkedHashMap<>();
    List<String> lCurrent = null;
    int lDepth = 0;
    for (String lToken : lBody.subList(1, lBody.size()))
    {
      if ((lDepth == 0) && lToken.startsWith(KEYWORD_MARKER))
      {
        String lKeyword = lToken.substring(1).toLowerCase();
        if (!ACTION_KEYWORDS.contains(lKeyword))
        {
          throw new PddlFormatException("Unknown keyword " + lToken + " in action " + lName);
        }
        lCurrent = new ArrayList<>();
        lBuckets.put(lKeyword, lCurrent);
        continue;
      }

      if (lCurrent == null)
      {
        throw new PddlFormatException("Unexpected '" + lToken + "' after action name " + lName);
      }
      if (lToken.equals(PddlBlocks.OPEN))
      {
        lDepth++;
      }
      else if (lToken.equals(PddlBlocks.CLOSE))
      {
        lDepth--;
      }
      lCurrent.add(lToken);
    }

    Set<String> lKnownTypes = xiBuilder.types().getKnownTypes();
    List<PddlTypedParameter> lParams = new ArrayList<>();
    String lAgentType = null;

    List<String> lAgent = lBuckets.get(AGENT);
    if (mDialect == PddlDialect.MULTI_AGENT)
    {
      if ((lAgent == null) || (lAgent.size() != 3) || !lAgent.get(1).equals(TYPE_SEPARATOR))
      {
        throw new PddlFormatException("Expected ':agent ?a - type' in action " + lName);
      }
      lParams.addAll(parseTypedList(lAgent, lKnownTypes, true));
      lAgentType = lAgent.get(2);
    }
    else if (lAgent != null)
    {
      throw new PddlFormatException("Unexpected :agent in classical action " + lName);
    }

    List<String> lParameters = lBuckets.get(PARAMETERS);
    if (lParameters != null)
    {
      lParams.addAll(parseTypedList(PddlBlocks.inner(lParameters), lKnownTypes, true));
    }

    Set<String> lParamNames = new HashSet<>();
    for (PddlTypedParameter lParam : lParams)
    {
      if (!lParamNames.add(lParam.getName()))
      {
        throw new PddlFormatException("Parameter " + lParam.getName() + " is declared more than once in action " +
                                      lName);
      }
    }

    List<PddlLiteral> lPrecondition = literals(lBuckets.get(PRECONDITION), false, lName);
    List<PddlLiteral> lEffect = literals(lBuckets.get(EFFECT), true, lName);

    String lDuration = PddlAction.DEFAULT_DURATION;
    List<String> lDurationTokens = lBuckets.get(DURATION);
    if ((lDurationTokens != null) && !lDurationTokens.isEmpty())
    {
      lDuration = PddlBlocks.render(lDurationTokens);
    }

    return new PddlAction(lName, new PddlParameterList(lParams), lPrecondition, lEffect, lDuration, lAgentType);
  }

  private static List<PddlLiteral> literals(List<String> xiBucket, boolean xiEffect, String xiAction)
      throws PddlException
  {
    if (xiBucket == null)
    {
      return new ArrayList<>();
    }
    if (PddlBlocks.split(xiBucket).size() != 1)
    {
      throw new PddlFormatException("Expected a single expression for " + (xiEffect ? "effect" : "precondition") +
                                    " of action " + xiAction);
    }
    return parseLiteralList(xiBucket, xiEffect);
  }
}
