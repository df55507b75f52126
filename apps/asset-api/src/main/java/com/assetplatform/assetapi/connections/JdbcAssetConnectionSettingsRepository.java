package com.assetplatform.assetapi.connections;

import com.assetplatform.integration.connector.AssetConnectionSettings;
import com.assetplatform.integration.connector.AssetConnectionSettingsLookup;
import java.net.URI;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads enabled connection rows. A row that cannot be turned into valid settings (bad base URL,
 * non-positive timeout) is treated as not configured.
 */
@Repository
public class JdbcAssetConnectionSettingsRepository implements AssetConnectionSettingsLookup {
  private static final Logger log =
      LoggerFactory.getLogger(JdbcAssetConnectionSettingsRepository.class);

  private final JdbcTemplate jdbcTemplate;

  public JdbcAssetConnectionSettingsRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<AssetConnectionSettings> find(String tenantId, String connectionId) {
    String sql =
        """
        SELECT tenant_id,
               connection_id,
               connector_type,
               base_url,
               api_key,
               timeout_ms
        FROM asset_connection_settings
        WHERE tenant_id = ? AND connection_id = ? AND enabled = TRUE
        """;
    List<Optional<AssetConnectionSettings>> rows =
        jdbcTemplate.query(sql, this::mapRow, tenantId, connectionId);
    return rows.isEmpty() ? Optional.empty() : rows.get(0);
  }

  private Optional<AssetConnectionSettings> mapRow(ResultSet rs, int rowNum) throws SQLException {
    String tenantId = rs.getString("tenant_id");
    String connectionId = rs.getString("connection_id");
    String baseUrl = rs.getString("base_url");
    Long timeoutMs = rs.getObject("timeout_ms", Long.class);
    try {
      return Optional.of(
          new AssetConnectionSettings(
              tenantId,
              connectionId,
              rs.getString("connector_type"),
              baseUrl == null ? null : URI.create(baseUrl),
              rs.getString("api_key"),
              timeoutMs == null ? null : Duration.ofMillis(timeoutMs)));
    } catch (IllegalArgumentException ex) {
      log.warn(
          "Ignoring invalid asset connection settings tenantId={} connectionId={}",
          tenantId,
          connectionId,
          ex);
      return Optional.empty();
    }
  }
}
