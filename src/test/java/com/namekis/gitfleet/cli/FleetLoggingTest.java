package com.namekis.gitfleet.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.joran.spi.JoranException;

class FleetLoggingTest {
  @AfterEach
  void restoreTestLogging() throws JoranException {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    context.reset();
    new ContextInitializer(context).autoConfig();
  }

  @Test
  void verbosityPicksTheLevel() {
    assertThat(FleetLogging.levelFor(0, false)).isEqualTo(Level.INFO);
    assertThat(FleetLogging.levelFor(2, false)).isEqualTo(Level.INFO);
    assertThat(FleetLogging.levelFor(3, false)).isEqualTo(Level.DEBUG);
    assertThat(FleetLogging.levelFor(7, false)).isEqualTo(Level.TRACE);
    assertThat(FleetLogging.levelFor(7, true)).isEqualTo(Level.ERROR);
  }

  @Test
  void debugAddsTimestampsAndLoggerNames() {
    assertThat(FleetLogging.pattern(false, false)).isEqualTo(FleetLogging.SIMPLE_PATTERN);
    assertThat(FleetLogging.pattern(true, false)).contains("%highlight");
    assertThat(FleetLogging.pattern(false, true)).contains("%logger", "%d{").doesNotContain("%highlight");
    assertThat(FleetLogging.pattern(true, true)).isEqualTo(FleetLogging.DETAILED_COLOR_PATTERN);
  }

  @Test
  void configuresTheRequestedCategories() {
    FleetLogging.configureByVerbosity("com.namekis.gitfleet.fix, com.namekis.gitfleet.git", 3, false, false, false);

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    for (String name : new String[] { "com.namekis.gitfleet.fix", "com.namekis.gitfleet.git" }) {
      Logger logger = context.getLogger(name);
      assertThat(logger.getLevel()).isEqualTo(Level.DEBUG);
      assertThat(logger.isAdditive()).isFalse();
      assertThat(logger.iteratorForAppenders()).toIterable().hasSize(2);
    }
  }

  @Test
  void defaultsToTheRootLogger() {
    FleetLogging.configureByVerbosity(null, 0, true, false, false);

    Logger root = ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    assertThat(root.getLevel()).isEqualTo(Level.ERROR);
  }
}
