package exm.cgen.common;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.cgen.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testAddEmittedOnlyOnce() {
    String msg = "LoggingTest unique message";
    assertTrue(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    assertTrue("Different level is a different message",
               Logging.addEmitted(Level.INFO, msg));
  }

  @Test
  public void testNoLogFile() throws Exception {
    Logger logger = Logging.setupLogging("", true);
    assertSame(Logging.getCGenLogger(), logger);
  }

  @Test
  public void testLogFile() throws Exception {
    File logFile = new File(folder.getRoot(), "cgen.log");
    Logger logger = Logging.setupLogging(logFile.getPath(), false);
    try {
      logger.debug("writing header");
      logger.trace("not written at debug level");
      Logging.uniqueWarn("LoggingTest repeated warning");
      Logging.uniqueWarn("LoggingTest repeated warning");

      String text = FileUtils.readFileToString(logFile, StandardCharsets.UTF_8);
      assertTrue(text, text.contains("DEBUG writing header"));
      assertFalse(text, text.contains("not written"));
      assertTrue(text, text.contains("WARN  LoggingTest repeated warning"));
      assertTrue(text,
          text.contains("DEBUG Duplicate Warning: LoggingTest repeated warning"));
    } finally {
      logger.removeAllAppenders();
      logger.setLevel(Level.WARN);
    }
  }

  @Test
  public void testLogFileFromSettings() throws Exception {
    File logFile = new File(folder.getRoot(), "settings.log");
    Settings.set(Settings.LOG_FILE, logFile.getPath());
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = null;
    try {
      logger = Logging.setupLogging();
      assertSame(Logging.getCGenLogger(), logger);
      logger.trace("trace enabled");

      String text = FileUtils.readFileToString(logFile, StandardCharsets.UTF_8);
      assertTrue(text, text.contains("TRACE trace enabled"));
    } finally {
      Settings.set(Settings.LOG_FILE, "");
      Settings.set(Settings.LOG_TRACE, "false");
      if (logger != null) {
        logger.removeAllAppenders();
        logger.setLevel(Level.WARN);
      }
    }
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadTraceSetting() throws Exception {
    Settings.set(Settings.LOG_TRACE, "sometimes");
    try {
      Logging.setupLogging();
    } finally {
      Settings.set(Settings.LOG_TRACE, "false");
    }
  }
}
