package org.openreg.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void toTimestampKeepsInstantAndAcceptsNull() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30Z");

    assertThat(JdbcTimestampUtils.toTimestamp(instant).toInstant()).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
  }

  @Test
  void getInstantReturnsNullForNullColumn() throws Exception {
    final ResultSet rs = mock(ResultSet.class);
    final Instant instant = Instant.parse("2026-03-01T10:15:30Z");
    when(rs.getTimestamp("finished_at")).thenReturn(null);
    when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(instant));

    assertThat(JdbcTimestampUtils.getInstant(rs, "finished_at")).isNull();
    assertThat(JdbcTimestampUtils.getInstant(rs, "created_at")).isEqualTo(instant);
  }
}
