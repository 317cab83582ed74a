package com.sqlopt.optimizer.service.optimization;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SqlDiff Tests")
class SqlDiffTest {

  @Test
  @DisplayName("Should be empty for identical text")
  void shouldBeEmptyForIdenticalText() {
    assertThat(SqlDiff.unified("SELECT 1\nFROM t", "SELECT 1\nFROM t")).isEmpty();
  }

  @Test
  @DisplayName("Should emit labelled hunks without context lines")
  void shouldEmitHunksWithoutContext() {
    String diff =
        SqlDiff.unified(
            "SELECT *\nFROM t\nWHERE ts > x", "SELECT id, ts\nFROM t\nWHERE ts > x\nAND ds > 'y'");

    assertThat(diff).startsWith("--- original.sql\n+++ optimized.sql\n");
    assertThat(diff).contains("-SELECT *", "+SELECT id, ts", "+AND ds > 'y'");
  }

  @Test
  @DisplayName("Should treat CRLF and LF line breaks alike")
  void shouldIgnoreLineBreakStyle() {
    assertThat(SqlDiff.unified("SELECT 1\r\nFROM t", "SELECT 1\nFROM t")).isEmpty();
  }
}
