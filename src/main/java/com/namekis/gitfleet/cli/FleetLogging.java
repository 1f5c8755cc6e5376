package com.namekis.gitfleet.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.LevelFilter;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.spi.FilterReply;

/**
 * Configures logback from the command line flags.
 *
 * <li>0 - progress messages only, WARN and ERROR go to stderr.
 * <li>1,2 - same levels, kept for symmetry with {@code -v}/{@code -vv}.
 * <li>3 - DEBUG, including every git and gh command that is run.
 * <li>4+ - TRACE, including raw command output.
 * <li>quiet - only ERROR.
 */
public final class FleetLogging {
  private static final int LEVEL4_TRACE = 4;
  private static final int LEVEL3_DEBUG = 3;
  private static final Logger log = LoggerFactory.getLogger(FleetLogging.class);

  static final String SIMPLE_PATTERN = "%msg %n";
  static final String SIMPLE_COLOR_PATTERN = "%highlight(%msg) %n";
  static final String DETAILED_PATTERN = "%-10r/%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%-15thread] %-40logger{36} - %msg%n";
  static final String DETAILED_COLOR_PATTERN = "%-10r/%d{yyyy-MM-dd HH:mm:ss.SSS} %highlight(%-5level) [%-15thread] %-40logger{36} - %msg%n";

  private FleetLogging() {
  }

  public static void configureByVerbosity(String categories, int verbosity, boolean quiet, boolean color, boolean debug) {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    context.reset();

    String pattern = pattern(color, debug);
    Level level = levelFor(verbosity, quiet);

    ConsoleAppender<ILoggingEvent> outAppender = appender(context, "System.out", pattern, color);
    ThresholdFilter stdOutFilter = new ThresholdFilter();
    stdOutFilter.setLevel(level.levelStr);
    stdOutFilter.start();
    outAppender.addFilter(stdOutFilter);
    outAppender.addFilter(deny(Level.WARN));
    outAppender.addFilter(deny(Level.ERROR));
    outAppender.start();

    ConsoleAppender<ILoggingEvent> errAppender = appender(context, "System.err", pattern, color);
    ThresholdFilter errFilter = new ThresholdFilter();
    errFilter.setLevel(quiet ? "ERROR" : "WARN");
    errFilter.start();
    errAppender.addFilter(errFilter);
    errAppender.start();

    categories = (categories == null || categories.isBlank()) ? Logger.ROOT_LOGGER_NAME : categories;
    for (String category : categories.split(",")) {
      category = category.trim();
      ch.qos.logback.classic.Logger logger = context.getLogger(category);
      logger.setLevel(level);
      logger.setAdditive(false);
      logger.addAppender(outAppender);
      logger.addAppender(errAppender);
      log.debug("logback configured for category {} at {} (verbosity {})", category, level, verbosity);
    }
  }

  static String pattern(boolean color, boolean debug) {
    if (debug) {
      return color ? DETAILED_COLOR_PATTERN : DETAILED_PATTERN;
    }
    return color ? SIMPLE_COLOR_PATTERN : SIMPLE_PATTERN;
  }

  static Level levelFor(int verbosity, boolean quiet) {
    if (quiet) {
      return Level.ERROR;
    }
    if (verbosity >= LEVEL4_TRACE) {
      return Level.TRACE;
    }
    if (verbosity >= LEVEL3_DEBUG) {
      return Level.DEBUG;
    }
    return Level.INFO;
  }

  private static ConsoleAppender<ILoggingEvent> appender(LoggerContext context, String target, String pattern, boolean color) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(pattern);
    encoder.start();

    ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
    appender.setContext(context);
    appender.setTarget(target);
    appender.setEncoder(encoder);
    appender.setWithJansi(color);
    return appender;
  }

  private static LevelFilter deny(Level level) {
    LevelFilter filter = new LevelFilter();
    filter.setLevel(level);
    filter.setOnMatch(FilterReply.DENY);
    filter.setOnMismatch(FilterReply.NEUTRAL);
    filter.start();
    return filter;
  }
}
