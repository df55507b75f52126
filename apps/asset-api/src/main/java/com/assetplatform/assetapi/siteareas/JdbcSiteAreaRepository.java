package com.assetplatform.assetapi.siteareas;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcSiteAreaRepository implements SiteAreaRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcSiteAreaRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<SiteArea> findById(String tenantId, String siteAreaId) {
    List<SiteArea> rows =
        jdbcTemplate.query(
            "SELECT id, name, site_id FROM site_areas WHERE tenant_id = ? AND id = ?",
            (rs, rowNum) ->
                new SiteArea(rs.getString("id"), rs.getString("name"), rs.getString("site_id")),
            tenantId,
            siteAreaId);
    return rows.stream().findFirst();
  }
}
