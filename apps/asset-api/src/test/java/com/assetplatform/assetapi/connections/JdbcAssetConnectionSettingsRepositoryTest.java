package com.assetplatform.assetapi.connections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.assetplatform.integration.connector.AssetConnectionSettings;
import java.net.URI;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

class JdbcAssetConnectionSettingsRepositoryTest {
  private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
  private final JdbcAssetConnectionSettingsRepository repository =
      new JdbcAssetConnectionSettingsRepository(jdbcTemplate);

  @Test
  void shouldMapValidRow() throws SQLException {
    ResultSet row = row("https://meters.test", null);
    answerWith(row);

    AssetConnectionSettings settings = repository.find("tenant-1", "conn-1").orElseThrow();

    assertEquals(URI.create("https://meters.test"), settings.baseUri());
    assertEquals("rest-json", settings.type());
  }

  @Test
  void shouldTreatMalformedBaseUrlAsNotConfigured() throws SQLException {
    answerWith(row("http://meters test", null));

    assertTrue(repository.find("tenant-1", "conn-1").isEmpty());
  }

  @Test
  void shouldTreatNonPositiveTimeoutAsNotConfigured() throws SQLException {
    answerWith(row("https://meters.test", 0L));

    assertTrue(repository.find("tenant-1", "conn-1").isEmpty());
  }

  @Test
  void shouldReturnEmptyWhenNoRowMatches() {
    when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("tenant-1"), eq("conn-1")))
        .thenReturn(List.of());

    assertTrue(repository.find("tenant-1", "conn-1").isEmpty());
  }

  @SuppressWarnings("unchecked")
  private void answerWith(ResultSet row) {
    when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("tenant-1"), eq("conn-1")))
        .thenAnswer(
            invocation -> {
              RowMapper<Optional<AssetConnectionSettings>> mapper = invocation.getArgument(1);
              return List.of(mapper.mapRow(row, 0));
            });
  }

  private static ResultSet row(String baseUrl, Long timeoutMs) throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getString("tenant_id")).thenReturn("tenant-1");
    when(rs.getString("connection_id")).thenReturn("conn-1");
    when(rs.getString("connector_type")).thenReturn("rest-json");
    when(rs.getString("base_url")).thenReturn(baseUrl);
    when(rs.getString("api_key")).thenReturn("key-1");
    when(rs.getObject("timeout_ms", Long.class)).thenReturn(timeoutMs);
    return rs;
  }
}
