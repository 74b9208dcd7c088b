package org.maplan.base.util.pddl.factory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.maplan.base.util.pddl.factory.exceptions.DomainMismatchException;
import org.maplan.base.util.pddl.factory.exceptions.PddlException;
import org.maplan.base.util.pddl.factory.exceptions.PddlFormatException;
import org.maplan.base.util.pddl.factory.exceptions.UnsupportedConstructException;
import org.maplan.base.util.pddl.grammar.PddlAtom;
import org.maplan.base.util.pddl.grammar.PddlGroundFunctionValue;
import org.maplan.base.util.pddl.grammar.PddlTypedParameter;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.ProblemBuilder;
import org.maplan.base.util.pddl.model.ProblemModel;

/**
 * Parser for PDDL and MA-PDDL problem files.  A problem is always parsed against its (already parsed) domain, which
 * supplies the known types.
 */
public final class ProblemParser extends PddlParser
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String PRIVATE         = ":private";
  private static final String ASSIGN          = "=";
  private static final String SUPPORTED_METRIC = "minimize ( total-cost )";

  private final boolean mStrictDomainName;

  /**
   * Create a parser.
   *
   * @param xiStrictDomainName - whether a problem naming the wrong domain is an error (rather than a warning).
   */
  public ProblemParser(boolean xiStrictDomainName)
  {
    mStrictDomainName = xiStrictDomainName;
  }

  /**
   * Parse a problem.
   *
   * @param xiText - the problem text.
   * @param xiDomain - the domain.
   *
   * @return the problem.
   *
   * @throws PddlException if the problem is malformed.  No partial problem is ever returned.
   */
  public ProblemModel parse(String xiText, DomainModel xiDomain) throws PddlException
  {
    return parse(PddlTokenizer.tokenize(xiText), xiDomain);
  }

  /**
   * Parse a tokenized problem.
   *
   * @param xiTokens - the tokens.
   * @param xiDomain - the domain.
   *
   * @return the problem.
   *
   * @throws PddlException if the problem is malformed.
   */
  public ProblemModel parse(List<String> xiTokens, DomainModel xiDomain) throws PddlException
  {
    expect(xiTokens, 0, new String[] {"(", "define", "(", "problem"}, "(define (problem ... at start of problem");
    String lName = name(xiTokens, 4, "problem name");
    expect(xiTokens, 5, new String[] {")", "(", ":domain"}, "(:domain ...) after (define (problem ...)");
    String lDomainName = name(xiTokens, 8, "domain name");
    expect(xiTokens, 9, new String[] {")"}, "end of domain declaration");

    if (!lDomainName.equals(xiDomain.getName()))
    {
      if (mStrictDomainName)
      {
        throw new DomainMismatchException(xiDomain.getName(), lDomainName);
      }
      LOGGER.warn("Names don't match between domain (" + xiDomain.getName() + ") and problem (" + lDomainName + ")");
    }

    ProblemBuilder lBuilder = new ProblemBuilder(lName, lDomainName, xiDomain.getTypes());
    Set<String> lKnownTypes = xiDomain.getTypes().getKnownTypes();

    for (PddlSection lSection : splitSections(xiTokens.subList(10, xiTokens.size())))
    {
      switch (lSection.mKeyword)
      {
        case "objects":
          parseObjects(lSection.mBody, lKnownTypes, lBuilder);
          break;

        case "private":
          // A top-level private block: drop the owner and treat the rest as objects.
          parseObjects(lSection.mBody.subList(Math.min(1, lSection.mBody.size()), lSection.mBody.size()),
                       lKnownTypes,
                       lBuilder);
          break;

        case "init":
          parseInit(lSection.mBody, lBuilder);
          break;

        case "goal":
          parseGoal(lSection.mBody, lBuilder);
          break;

        case "metric":
          parseMetric(lSection.mBody, lBuilder);
          break;

        default:
          throw new PddlFormatException("Unknown keyword in problem: :" + lSection.mKeyword);
      }
    }

    ProblemModel lProblem = lBuilder.build();
    LOGGER.debug("Parsed problem " + lName + " with " + lProblem.getObjects().size() + " objects");
    return lProblem;
  }

  /**
   * Parse a typed list of objects.  Nested (:private owner ...) blocks have their owner dropped and contribute their
   * objects like any other.
   */
  private static void parseObjects(List<String> xiBody, Set<String> xiKnownTypes, ProblemBuilder xiBuilder)
      throws PddlException
  {
    List<String> lSegment = new ArrayList<>();
    for (List<String> lChunk : PddlBlocks.split(xiBody))
    {
      if (!PddlBlocks.isBlock(lChunk))
      {
        lSegment.add(lChunk.get(0));
        continue;
      }

      addObjects(lSegment, xiKnownTypes, xiBuilder);
      lSegment.clear();

      List<String> lInner = PddlBlocks.inner(lChunk);
      if (lInner.isEmpty() || !lInner.get(0).equalsIgnoreCase(PRIVATE))
      {
        throw new PddlFormatException("Unexpected block in :objects: " + PddlBlocks.render(lChunk));
      }
      parseObjects(lInner.subList(Math.min(2, lInner.size()), lInner.size()), xiKnownTypes, xiBuilder);
    }
    addObjects(lSegment, xiKnownTypes, xiBuilder);
  }

  private static void addObjects(List<String> xiSegment, Set<String> xiKnownTypes, ProblemBuilder xiBuilder)
      throws PddlException
  {
    for (PddlTypedParameter lObject : parseTypedList(xiSegment, xiKnownTypes, false))
    {
      xiBuilder.addObject(lObject.getName(), lObject.getType());
    }
  }

  private static void parseInit(List<String> xiBody, ProblemBuilder xiBuilder) throws PddlException
  {
    for (List<String> lChunk : PddlBlocks.split(xiBody))
    {
      List<String> lInner = PddlBlocks.inner(lChunk);
      if (lInner.isEmpty())
      {
        throw new PddlFormatException("Empty fact '()' in :init");
      }

      if (lInner.get(0).equals(ASSIGN))
      {
        xiBuilder.addGroundFunction(parseAssignment(lInner));
      }
      else
      {
        PddlAtom lFact = parseAtom(lInner);
        if (!lFact.isGround())
        {
          throw new PddlFormatException("Initial fact " + lFact + " is not ground");
        }
        xiBuilder.addInit(lFact);
      }
    }
  }

  private static PddlGroundFunctionValue parseAssignment(List<String> xiInner) throws PddlException
  {
    List<List<String>> lChunks = PddlBlocks.split(xiInner.subList(1, xiInner.size()));
    if ((lChunks.size() != 2) || !PddlBlocks.isBlock(lChunks.get(0)) || PddlBlocks.isBlock(lChunks.get(1)))
    {
      throw new UnsupportedConstructException("Only (= (function objects...) number) is supported in :init, not (" +
                                              PddlBlocks.render(xiInner) + ")");
    }

    String lValue = lChunks.get(1).get(0);
    if (!isNumericLiteral(lValue))
    {
      throw new UnsupportedConstructException("Initial value '" + lValue + "' is not a number");
    }

    PddlAtom lFunction = parseAtom(PddlBlocks.inner(lChunks.get(0)));
    if (!lFunction.isGround())
    {
      throw new PddlFormatException("Initial function value " + lFunction + " is not ground");
    }
    return new PddlGroundFunctionValue(lFunction, lValue);
  }

  private static void parseGoal(List<String> xiBody, ProblemBuilder xiBuilder) throws PddlException
  {
    List<List<String>> lChunks = PddlBlocks.split(xiBody);
    if ((lChunks.size() != 1) || !PddlBlocks.isBlock(lChunks.get(0)))
    {
      throw new PddlFormatException("Expected a single goal expression but got " + PddlBlocks.render(xiBody));
    }
    xiBuilder.addGoal(parseLiteralList(lChunks.get(0), false));
  }

  private static void parseMetric(List<String> xiBody, ProblemBuilder xiBuilder)
  {
    String lMetric = PddlBlocks.render(xiBody);
    if (!lMetric.equalsIgnoreCase(SUPPORTED_METRIC))
    {
      LOGGER.warn("Only total-cost minimisation is supported - treating (:metric " + lMetric + ") as " +
                  "(:metric minimize (total-cost))");
    }
    xiBuilder.setMetric();
  }
}
