package com.assetplatform.assetapi.consumption;

import com.assetplatform.domain.assets.ConsumptionSample;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcConsumptionRepository implements ConsumptionRepository {
  private static final Logger log = LoggerFactory.getLogger(JdbcConsumptionRepository.class);

  private final JdbcTemplate jdbcTemplate;

  public JdbcConsumptionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public List<ConsumptionSample> getAssetConsumptions(String tenantId, ConsumptionQuery query) {
    String sql =
        """
        SELECT started_at,
               ended_at,
               instant_watts,
               instant_amps,
               limit_watts,
               limit_amps,
               state_of_charge
        FROM asset_consumptions
        WHERE tenant_id = ?
          AND asset_id = ?
          AND started_at >= ?
          AND started_at <= ?
        ORDER BY started_at ASC, id ASC
        """;
    return jdbcTemplate.query(
        sql,
        this::mapProjection,
        tenantId,
        query.assetId(),
        Timestamp.from(query.startDate()),
        Timestamp.from(query.endDate()));
  }

  @Override
  public void record(String tenantId, String assetId, List<ConsumptionSample> samples) {
    if (samples == null || samples.isEmpty()) {
      return;
    }
    String sql =
        """
        INSERT INTO asset_consumptions (
          tenant_id, asset_id, started_at, ended_at, consumption_wh,
          instant_watts, instant_watts_l1, instant_watts_l2, instant_watts_l3,
          instant_amps, instant_amps_l1, instant_amps_l2, instant_amps_l3,
          instant_volts, instant_volts_l1, instant_volts_l2, instant_volts_l3,
          limit_watts, limit_amps, state_of_charge, created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
        """;
    List<Object[]> batch =
        samples.stream()
            .map(
                sample ->
                    new Object[] {
                      tenantId,
                      assetId,
                      timestamp(sample.startedAt()),
                      timestamp(sample.endedAt()),
                      sample.consumptionWh(),
                      sample.instantWatts(),
                      sample.instantWattsL1(),
                      sample.instantWattsL2(),
                      sample.instantWattsL3(),
                      sample.instantAmps(),
                      sample.instantAmpsL1(),
                      sample.instantAmpsL2(),
                      sample.instantAmpsL3(),
                      sample.instantVolts(),
                      sample.instantVoltsL1(),
                      sample.instantVoltsL2(),
                      sample.instantVoltsL3(),
                      sample.limitWatts(),
                      sample.limitAmps(),
                      sample.stateOfCharge()
                    })
            .toList();
    jdbcTemplate.batchUpdate(sql, batch);
    log.debug(
        "Recorded asset consumption samples tenant={} asset={} count={}",
        tenantId,
        assetId,
        samples.size());
  }

  private ConsumptionSample mapProjection(ResultSet rs, int rowNum) throws SQLException {
    return ConsumptionSample.builder()
        .startedAt(instant(rs.getTimestamp("started_at")))
        .endedAt(instant(rs.getTimestamp("ended_at")))
        .instantWatts(rs.getObject("instant_watts", Double.class), null, null, null)
        .instantAmps(rs.getObject("instant_amps", Double.class), null, null, null)
        .limitWatts(rs.getObject("limit_watts", Double.class))
        .limitAmps(rs.getObject("limit_amps", Double.class))
        .stateOfCharge(rs.getObject("state_of_charge", Double.class))
        .build();
  }

  private static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
