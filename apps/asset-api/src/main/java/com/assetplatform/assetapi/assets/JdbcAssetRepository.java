package com.assetplatform.assetapi.assets;

import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.AssetAudit;
import com.assetplatform.domain.assets.AssetInErrorType;
import com.assetplatform.domain.assets.AssetLiveState;
import com.assetplatform.domain.assets.AssetType;
import com.assetplatform.domain.assets.GeoCoordinates;
import com.assetplatform.domain.assets.LastConsumption;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAssetRepository implements AssetRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id,
             name,
             site_area_id,
             site_id,
             asset_type,
             dynamic_asset,
             connection_id,
             meter_id,
             longitude,
             latitude,
             static_value_watt,
             fluctuation_percent,
             exclude_from_smart_charging,
             last_consumption_value,
             last_consumption_at,
             current_consumption_wh,
             current_instant_amps,
             current_instant_amps_l1,
             current_instant_amps_l2,
             current_instant_amps_l3,
             current_instant_volts,
             current_instant_volts_l1,
             current_instant_volts_l2,
             current_instant_volts_l3,
             current_instant_watts,
             current_instant_watts_l1,
             current_instant_watts_l2,
             current_instant_watts_l3,
             current_state_of_charge,
             created_by,
             created_on,
             last_changed_by,
             last_changed_on,
             version
      FROM assets
      """;

  private static final Map<String, String> SORT_COLUMNS =
      Map.of(
          "name", "name",
          "id", "id",
          "createdOn", "created_on",
          "lastChangedOn", "last_changed_on");

  private final JdbcTemplate jdbcTemplate;

  public JdbcAssetRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public Optional<Asset> findById(String tenantId, String assetId) {
    List<Asset> rows =
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE tenant_id = ? AND id = ?", this::mapRow, tenantId, assetId);
    return rows.stream().findFirst();
  }

  @Override
  public void insert(String tenantId, Asset asset) {
    String sql =
        """
        INSERT INTO assets (
          tenant_id, id, name, site_area_id, site_id, asset_type, dynamic_asset, connection_id,
          meter_id, longitude, latitude, static_value_watt, fluctuation_percent,
          exclude_from_smart_charging, last_consumption_value, last_consumption_at,
          current_consumption_wh, current_instant_amps, current_instant_amps_l1,
          current_instant_amps_l2, current_instant_amps_l3, current_instant_volts,
          current_instant_volts_l1, current_instant_volts_l2, current_instant_volts_l3,
          current_instant_watts, current_instant_watts_l1, current_instant_watts_l2,
          current_instant_watts_l3, current_state_of_charge, created_by, created_on,
          last_changed_by, last_changed_on, version
        ) VALUES (
          ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,
          ?, ?, ?, ?, ?, ?, ?
        )
        """;
    List<Object> params = new ArrayList<>();
    params.add(tenantId);
    params.add(asset.id());
    params.addAll(columnValues(asset));
    params.add(asset.version());
    jdbcTemplate.update(sql, params.toArray());
  }

  @Override
  public Asset save(String tenantId, Asset asset) {
    String sql =
        """
        UPDATE assets
        SET name = ?,
            site_area_id = ?,
            site_id = ?,
            asset_type = ?,
            dynamic_asset = ?,
            connection_id = ?,
            meter_id = ?,
            longitude = ?,
            latitude = ?,
            static_value_watt = ?,
            fluctuation_percent = ?,
            exclude_from_smart_charging = ?,
            last_consumption_value = ?,
            last_consumption_at = ?,
            current_consumption_wh = ?,
            current_instant_amps = ?,
            current_instant_amps_l1 = ?,
            current_instant_amps_l2 = ?,
            current_instant_amps_l3 = ?,
            current_instant_volts = ?,
            current_instant_volts_l1 = ?,
            current_instant_volts_l2 = ?,
            current_instant_volts_l3 = ?,
            current_instant_watts = ?,
            current_instant_watts_l1 = ?,
            current_instant_watts_l2 = ?,
            current_instant_watts_l3 = ?,
            current_state_of_charge = ?,
            created_by = ?,
            created_on = ?,
            last_changed_by = ?,
            last_changed_on = ?,
            version = version + 1
        WHERE tenant_id = ? AND id = ? AND version = ?
        """;
    List<Object> params = new ArrayList<>(columnValues(asset));
    params.add(tenantId);
    params.add(asset.id());
    params.add(asset.version());
    int updated = jdbcTemplate.update(sql, params.toArray());
    if (updated == 0) {
      throw new AssetConcurrentModificationException(asset.id(), asset.version());
    }
    return asset.withVersion(asset.version() + 1);
  }

  @Override
  public boolean delete(String tenantId, String assetId) {
    return jdbcTemplate.update("DELETE FROM assets WHERE tenant_id = ? AND id = ?", tenantId, assetId)
        > 0;
  }

  @Override
  public AssetPage<Asset> findAssets(String tenantId, AssetQuery query, AssetPaging paging) {
    StringBuilder where = new StringBuilder(" WHERE tenant_id = ?");
    List<Object> params = new ArrayList<>();
    params.add(tenantId);
    appendSearch(where, params, query.search());
    appendIn(where, params, "site_area_id", query.siteAreaIds());
    appendIn(where, params, "site_id", query.siteIds());
    if (query.withNoSiteArea()) {
      where.append(" AND (site_area_id IS NULL OR site_area_id = '')");
    }
    if (query.dynamicOnly()) {
      where.append(" AND dynamic_asset = TRUE");
    }

    long count = count("SELECT COUNT(*) FROM assets" + where, params);
    if (paging.onlyRecordCount()) {
      return AssetPage.countOnly(count);
    }
    String sql = SELECT_COLUMNS + where + orderBy(paging) + " LIMIT ? OFFSET ?";
    List<Object> pageParams = new ArrayList<>(params);
    pageParams.add(paging.limit());
    pageParams.add(paging.skip());
    return new AssetPage<>(jdbcTemplate.query(sql, this::mapRow, pageParams.toArray()), count);
  }

  @Override
  public AssetPage<AssetInErrorView> findAssetsInError(
      String tenantId, AssetInErrorFilter filter, AssetPaging paging) {
    StringBuilder union = new StringBuilder();
    List<Object> params = new ArrayList<>();
    for (AssetInErrorType errorType : filter.errorTypes()) {
      if (!union.isEmpty()) {
        union.append(" UNION ALL ");
      }
      union.append(
          """
          SELECT id, name, created_on, last_changed_on, CAST(? AS VARCHAR(32)) AS error_code
          FROM assets
          WHERE tenant_id = ?
          """);
      params.add(errorType.tag());
      params.add(tenantId);
      union.append(" AND ").append(detectionCondition(errorType));
      appendSearch(union, params, filter.search());
      appendIn(union, params, "site_area_id", filter.siteAreaIds());
      appendIn(union, params, "site_id", filter.siteIds());
    }

    long count = count("SELECT COUNT(*) FROM (" + union + ") in_error", params);
    if (paging.onlyRecordCount()) {
      return AssetPage.countOnly(count);
    }
    String sql =
        "SELECT id, name, error_code FROM ("
            + union
            + ") in_error"
            + orderBy(paging)
            + ", error_code ASC LIMIT ? OFFSET ?";
    List<Object> pageParams = new ArrayList<>(params);
    pageParams.add(paging.limit());
    pageParams.add(paging.skip());
    List<AssetInErrorView> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) -> {
              AssetInErrorType errorType = AssetInErrorType.fromTag(rs.getString("error_code"));
              return new AssetInErrorView(
                  rs.getString("id"), rs.getString("name"), errorType.tag(), errorType.description());
            },
            pageParams.toArray());
    return new AssetPage<>(rows, count);
  }

  private static String detectionCondition(AssetInErrorType errorType) {
    return switch (errorType) {
      case MISSING_SITE_AREA -> "(site_area_id IS NULL OR site_area_id = '')";
      case MISSING_CONNECTION ->
          "dynamic_asset = TRUE AND (connection_id IS NULL OR connection_id = '')";
    };
  }

  private long count(String sql, List<Object> params) {
    Long count = jdbcTemplate.queryForObject(sql, Long.class, params.toArray());
    return count == null ? 0L : count;
  }

  private static void appendSearch(StringBuilder sql, List<Object> params, String search) {
    if (search == null) {
      return;
    }
    String pattern = containsPattern(search);
    sql.append(" AND (LOWER(name) LIKE ? ESCAPE '\\' OR LOWER(id) LIKE ? ESCAPE '\\')");
    params.add(pattern);
    params.add(pattern);
  }

  // User text is matched literally, so LIKE wildcards and the escape character are escaped.
  static String containsPattern(String search) {
    String escaped =
        search
            .toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    return "%" + escaped + "%";
  }

  private static void appendIn(
      StringBuilder sql, List<Object> params, String column, List<String> values) {
    if (values == null || values.isEmpty()) {
      return;
    }
    sql.append(" AND ")
        .append(column)
        .append(" IN (")
        .append(String.join(", ", Collections.nCopies(values.size(), "?")))
        .append(")");
    params.addAll(values);
  }

  private static String orderBy(AssetPaging paging) {
    if (paging.sort().isEmpty()) {
      return " ORDER BY name ASC, id ASC";
    }
    List<String> clauses = new ArrayList<>();
    for (AssetPaging.SortField field : paging.sort()) {
      String column = SORT_COLUMNS.get(field.field());
      if (column == null) {
        throw new AssetValidationException("Unsupported sort field: " + field.field());
      }
      clauses.add(column + (field.ascending() ? " ASC" : " DESC"));
    }
    return " ORDER BY " + String.join(", ", clauses);
  }

  private static List<Object> columnValues(Asset asset) {
    AssetLiveState live = asset.liveState();
    AssetAudit audit = asset.audit();
    List<Object> values = new ArrayList<>();
    values.add(asset.name());
    values.add(asset.siteAreaId());
    values.add(asset.siteId());
    values.add(asset.assetType().code());
    values.add(asset.dynamicAsset());
    values.add(asset.connectionId());
    values.add(asset.meterId());
    values.add(asset.coordinates() == null ? null : asset.coordinates().longitude());
    values.add(asset.coordinates() == null ? null : asset.coordinates().latitude());
    values.add(asset.staticValueWatt());
    values.add(asset.fluctuationPercent());
    values.add(asset.excludeFromSmartCharging());
    values.add(live.lastConsumption() == null ? null : live.lastConsumption().value());
    values.add(live.lastConsumption() == null ? null : timestamp(live.lastConsumption().timestamp()));
    values.add(live.currentConsumptionWh());
    values.add(live.currentInstantAmps());
    values.add(live.currentInstantAmpsL1());
    values.add(live.currentInstantAmpsL2());
    values.add(live.currentInstantAmpsL3());
    values.add(live.currentInstantVolts());
    values.add(live.currentInstantVoltsL1());
    values.add(live.currentInstantVoltsL2());
    values.add(live.currentInstantVoltsL3());
    values.add(live.currentInstantWatts());
    values.add(live.currentInstantWattsL1());
    values.add(live.currentInstantWattsL2());
    values.add(live.currentInstantWattsL3());
    values.add(live.currentStateOfCharge());
    values.add(audit.createdBy());
    values.add(timestamp(audit.createdOn()));
    values.add(audit.lastChangedBy());
    values.add(timestamp(audit.lastChangedOn()));
    return values;
  }

  private Asset mapRow(ResultSet rs, int rowNum) throws SQLException {
    Double longitude = rs.getObject("longitude", Double.class);
    Double latitude = rs.getObject("latitude", Double.class);
    Double lastConsumptionValue = rs.getObject("last_consumption_value", Double.class);
    Instant lastConsumptionAt = instant(rs.getTimestamp("last_consumption_at"));
    AssetLiveState liveState =
        new AssetLiveState(
            lastConsumptionValue == null || lastConsumptionAt == null
                ? null
                : new LastConsumption(lastConsumptionValue, lastConsumptionAt),
            rs.getObject("current_consumption_wh", Double.class),
            rs.getObject("current_instant_amps", Double.class),
            rs.getObject("current_instant_amps_l1", Double.class),
            rs.getObject("current_instant_amps_l2", Double.class),
            rs.getObject("current_instant_amps_l3", Double.class),
            rs.getObject("current_instant_volts", Double.class),
            rs.getObject("current_instant_volts_l1", Double.class),
            rs.getObject("current_instant_volts_l2", Double.class),
            rs.getObject("current_instant_volts_l3", Double.class),
            rs.getObject("current_instant_watts", Double.class),
            rs.getObject("current_instant_watts_l1", Double.class),
            rs.getObject("current_instant_watts_l2", Double.class),
            rs.getObject("current_instant_watts_l3", Double.class),
            rs.getObject("current_state_of_charge", Double.class));
    return new Asset(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("site_area_id"),
        rs.getString("site_id"),
        AssetType.fromCode(rs.getString("asset_type")),
        rs.getBoolean("dynamic_asset"),
        rs.getString("connection_id"),
        rs.getString("meter_id"),
        longitude == null || latitude == null ? null : new GeoCoordinates(longitude, latitude),
        rs.getObject("static_value_watt", Double.class),
        rs.getObject("fluctuation_percent", Double.class),
        rs.getBoolean("exclude_from_smart_charging"),
        liveState,
        new AssetAudit(
            rs.getString("created_by"),
            instant(rs.getTimestamp("created_on")),
            rs.getString("last_changed_by"),
            instant(rs.getTimestamp("last_changed_on"))),
        rs.getLong("version"));
  }

  private static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
