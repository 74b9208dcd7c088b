package org.maplan.base.util.planning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.maplan.base.util.pddl.factory.DomainParser;
import org.maplan.base.util.pddl.factory.PddlDialect;
import org.maplan.base.util.pddl.factory.ProblemParser;
import org.maplan.base.util.pddl.factory.exceptions.PddlException;
import org.maplan.base.util.pddl.model.DomainModel;
import org.maplan.base.util.pddl.model.PlanningTask;
import org.maplan.base.util.pddl.model.ProblemModel;

import com.google.common.io.MoreFiles;

/**
 * Reads classical PDDL into a {@link ClassicalProblem}.
 */
public final class ClassicalPddlReader
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final boolean mStrictDomainName;

  /**
   * @param xiStrictDomainName - whether a problem naming the wrong domain is an error.
   */
  public ClassicalPddlReader(boolean xiStrictDomainName)
  {
    mStrictDomainName = xiStrictDomainName;
  }

  /**
   * Parse a domain and problem held in files.
   *
   * @param xiDomainFile - the domain file.
   * @param xiProblemFile - the problem file.
   *
   * @return the problem.
   *
   * @throws IOException if either file can't be read.
   * @throws PddlException if either file is malformed.
   */
  public ClassicalProblem read(Path xiDomainFile, Path xiProblemFile) throws IOException, PddlException
  {
    LOGGER.debug("Reading classical domain " + xiDomainFile + " and problem " + xiProblemFile);
    return read(MoreFiles.asCharSource(xiDomainFile, StandardCharsets.UTF_8).read(),
                MoreFiles.asCharSource(xiProblemFile, StandardCharsets.UTF_8).read());
  }

  /**
   * Parse a domain and problem.
   *
   * @param xiDomain - the domain text.
   * @param xiProblem - the problem text.
   *
   * @return the problem.
   *
   * @throws PddlException if either text is malformed.
   */
  public ClassicalProblem read(String xiDomain, String xiProblem) throws PddlException
  {
    DomainModel lDomain = new DomainParser(PddlDialect.CLASSICAL).parse(xiDomain);
    ProblemModel lProblem = new ProblemParser(mStrictDomainName).parse(xiProblem, lDomain);
    return new ClassicalProblem(new PlanningTask(lDomain, lProblem));
  }
}
