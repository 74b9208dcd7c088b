package org.maplan.base.validator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

/**
 * A temporary directory belonging to a single validation request.  It and everything in it are deleted on close.
 */
public final class ScratchDirectory implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final Path mPath;

  /**
   * Create a fresh directory.
   *
   * @param xiRoot - the directory to create it in, or null for the system temporary directory.
   * @param xiName - a name to include in the directory name.
   *
   * @throws IOException if the directory can't be created.
   */
  public ScratchDirectory(String xiRoot, String xiName) throws IOException
  {
    String lPrefix = "maplan-" + xiName.replaceAll("[^A-Za-z0-9_-]", "_") + "-";
    if (xiRoot == null)
    {
      mPath = Files.createTempDirectory(lPrefix);
    }
    else
    {
      Path lRoot = Paths.get(xiRoot);
      Files.createDirectories(lRoot);
      mPath = Files.createTempDirectory(lRoot, lPrefix);
    }
    LOGGER.debug("Created scratch directory " + mPath);
  }

  public Path getPath()
  {
    return mPath;
  }

  /**
   * Write a file into the directory.
   *
   * @param xiRelativeName - the file name, possibly including subdirectories.
   * @param xiContent - the text to write.
   *
   * @return the file.
   *
   * @throws IOException if the file can't be written.
   */
  public Path write(String xiRelativeName, String xiContent) throws IOException
  {
    Path lFile = mPath.resolve(xiRelativeName);
    MoreFiles.createParentDirectories(lFile);
    MoreFiles.asCharSink(lFile, StandardCharsets.UTF_8).write(xiContent);
    return lFile;
  }

  /**
   * Read a file previously written into the directory.
   *
   * @param xiFile - the file.
   *
   * @return its content.
   *
   * @throws IOException if the file can't be read.
   */
  public String read(Path xiFile) throws IOException
  {
    return MoreFiles.asCharSource(xiFile, StandardCharsets.UTF_8).read();
  }

  /**
   * Delete the directory and everything in it.
   *
   * @throws IOException if anything can't be deleted.
   */
  @Override
  public void close() throws IOException
  {
    MoreFiles.deleteRecursively(mPath, RecursiveDeleteOption.ALLOW_INSECURE);
    LOGGER.debug("Deleted scratch directory " + mPath);
  }
}
