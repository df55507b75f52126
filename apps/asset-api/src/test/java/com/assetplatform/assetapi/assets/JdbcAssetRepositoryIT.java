package com.assetplatform.assetapi.assets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.assetplatform.assetapi.connections.JdbcAssetConnectionSettingsRepository;
import com.assetplatform.assetapi.consumption.ConsumptionQuery;
import com.assetplatform.assetapi.consumption.JdbcConsumptionRepository;
import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.AssetAudit;
import com.assetplatform.domain.assets.AssetInErrorType;
import com.assetplatform.domain.assets.AssetLiveState;
import com.assetplatform.domain.assets.AssetType;
import com.assetplatform.domain.assets.ConsumptionSample;
import com.assetplatform.domain.assets.GeoCoordinates;
import com.assetplatform.integration.connector.AssetConnectionSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcAssetRepositoryIT {
  private static final String TENANT = "tenant-1";
  private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

  @Container
  static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("assets")
          .withUsername("assets")
          .withPassword("assets");

  private JdbcTemplate jdbcTemplate;
  private JdbcAssetRepository repository;
  private JdbcConsumptionRepository consumptionRepository;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource = new DriverManagerDataSource();
    dataSource.setDriverClassName(POSTGRES.getDriverClassName());
    dataSource.setUrl(POSTGRES.getJdbcUrl());
    dataSource.setUsername(POSTGRES.getUsername());
    dataSource.setPassword(POSTGRES.getPassword());

    Flyway flyway =
        Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .cleanDisabled(false)
            .load();
    flyway.clean();
    flyway.migrate();

    jdbcTemplate = new JdbcTemplate(dataSource);
    repository = new JdbcAssetRepository(jdbcTemplate);
    consumptionRepository = new JdbcConsumptionRepository(jdbcTemplate);
  }

  @Test
  void shouldRoundTripAssetWithLiveState() {
    Asset asset =
        asset("A1", "Battery", "area-1", true, "conn-1")
            .withLiveState(
                AssetLiveState.fromSample(
                    ConsumptionSample.builder()
                        .startedAt(CREATED)
                        .endedAt(CREATED.plusSeconds(60))
                        .consumptionWh(12.5)
                        .instantWatts(4200d, 1400d, 1400d, 1400d)
                        .stateOfCharge(73d)
                        .build()));
    repository.insert(TENANT, asset);

    Asset loaded = repository.findById(TENANT, "A1").orElseThrow();

    assertEquals(asset, loaded);
    assertTrue(repository.findById("tenant-2", "A1").isEmpty());
  }

  @Test
  void shouldIncrementVersionAndDetectLostUpdate() {
    repository.insert(TENANT, asset("A1", "Battery", "area-1", true, "conn-1"));
    Asset loaded = repository.findById(TENANT, "A1").orElseThrow();

    Asset saved = repository.save(TENANT, loaded.withLiveState(AssetLiveState.empty()));

    assertEquals(1L, saved.version());
    assertEquals(1L, repository.findById(TENANT, "A1").orElseThrow().version());
    assertThrows(AssetConcurrentModificationException.class, () -> repository.save(TENANT, loaded));
  }

  @Test
  void shouldFilterSortAndPageAssets() {
    repository.insert(TENANT, asset("A1", "Charlie", "area-1", false, null));
    repository.insert(TENANT, asset("A2", "Alpha", "area-2", true, "conn-1"));
    repository.insert(TENANT, asset("A3", "Bravo", null, true, null));
    repository.insert("tenant-2", asset("A4", "Alpha other tenant", "area-1", false, null));

    AssetPage<Asset> byArea =
        repository.findAssets(
            TENANT,
            new AssetQuery(null, List.of("area-1", "area-2"), null, false, false),
            AssetPaging.of(null, null, "-name", null));
    assertEquals(2L, byArea.count());
    assertEquals(List.of("A1", "A2"), byArea.result().stream().map(Asset::id).toList());

    AssetPage<Asset> searched =
        repository.findAssets(
            TENANT, new AssetQuery("ALP", null, null, false, false), AssetPaging.defaults());
    assertEquals(List.of("A2"), searched.result().stream().map(Asset::id).toList());

    AssetPage<Asset> countOnly =
        repository.findAssets(
            TENANT,
            new AssetQuery(null, null, null, false, true),
            AssetPaging.of(1, 0, null, true));
    assertEquals(2L, countOnly.count());
    assertTrue(countOnly.result().isEmpty());
  }

  @Test
  void shouldMatchWildcardCharactersInSearchLiterally() {
    repository.insert(TENANT, asset("P1", "Solar 100% roof", "area-1", false, null));
    repository.insert(TENANT, asset("P2", "Solar 1000 roof", "area-1", false, null));
    repository.insert(TENANT, asset("P3", "Bay_1", "area-1", false, null));
    repository.insert(TENANT, asset("P4", "Bay-1", "area-1", false, null));

    AssetPage<Asset> percent =
        repository.findAssets(
            TENANT, new AssetQuery("100%", null, null, false, false), AssetPaging.defaults());
    AssetPage<Asset> underscore =
        repository.findAssets(
            TENANT, new AssetQuery("bay_", null, null, false, false), AssetPaging.defaults());

    assertEquals(List.of("P1"), percent.result().stream().map(Asset::id).toList());
    assertEquals(List.of("P3"), underscore.result().stream().map(Asset::id).toList());
  }

  @Test
  void shouldListAssetsInErrorPerCategory() {
    repository.insert(TENANT, asset("A1", "Orphan", null, false, null));
    repository.insert(TENANT, asset("A2", "Unwired", "area-1", true, null));
    repository.insert(TENANT, asset("A3", "Healthy", "area-1", true, "conn-1"));

    AssetPage<AssetInErrorView> missingSiteArea =
        repository.findAssetsInError(
            TENANT,
            new AssetInErrorFilter(List.of(AssetInErrorType.MISSING_SITE_AREA), null, null, null),
            AssetPaging.defaults());
    assertEquals(1L, missingSiteArea.count());
    assertEquals("A1", missingSiteArea.result().get(0).id());
    assertEquals("missing_site_area", missingSiteArea.result().get(0).errorCode());

    AssetPage<AssetInErrorView> both =
        repository.findAssetsInError(
            TENANT,
            new AssetInErrorFilter(
                List.of(AssetInErrorType.MISSING_SITE_AREA, AssetInErrorType.MISSING_CONNECTION),
                null,
                null,
                null),
            AssetPaging.defaults());
    assertEquals(2L, both.count());
    assertEquals(
        List.of("A1", "A2"), both.result().stream().map(AssetInErrorView::id).toList());
  }

  @Test
  void shouldRecordAndQueryConsumptionsAndCascadeOnDelete() {
    repository.insert(TENANT, asset("A1", "Battery", "area-1", true, "conn-1"));
    consumptionRepository.record(
        TENANT,
        "A1",
        List.of(
            ConsumptionSample.builder()
                .startedAt(CREATED.plusSeconds(600))
                .endedAt(CREATED.plusSeconds(900))
                .instantWatts(200d, null, null, null)
                .build(),
            ConsumptionSample.builder()
                .startedAt(CREATED)
                .endedAt(CREATED.plusSeconds(300))
                .instantWatts(100d, null, null, null)
                .build()));

    List<ConsumptionSample> values =
        consumptionRepository.getAssetConsumptions(
            TENANT, new ConsumptionQuery("A1", CREATED, CREATED.plusSeconds(3600)));
    assertEquals(2, values.size());
    assertEquals(100d, values.get(0).instantWatts());
    assertEquals(200d, values.get(1).instantWatts());

    assertTrue(repository.delete(TENANT, "A1"));
    Integer remaining =
        jdbcTemplate.queryForObject("SELECT COUNT(*) FROM asset_consumptions", Integer.class);
    assertEquals(0, remaining);
  }

  @Test
  void shouldResolveOnlyEnabledConnectionSettings() {
    jdbcTemplate.update(
        """
        INSERT INTO asset_connection_settings
          (tenant_id, connection_id, connector_type, base_url, api_key, timeout_ms, enabled)
        VALUES (?, ?, 'rest-json', 'https://meters.test', 'key-1', 2500, ?)
        """,
        TENANT,
        "conn-1",
        true);
    jdbcTemplate.update(
        """
        INSERT INTO asset_connection_settings
          (tenant_id, connection_id, connector_type, base_url, enabled)
        VALUES (?, ?, 'rest-json', 'https://meters.test', ?)
        """,
        TENANT,
        "conn-off",
        false);
    JdbcAssetConnectionSettingsRepository settingsRepository =
        new JdbcAssetConnectionSettingsRepository(jdbcTemplate);

    AssetConnectionSettings settings = settingsRepository.find(TENANT, "conn-1").orElseThrow();

    assertEquals("rest-json", settings.type());
    assertEquals(Duration.ofMillis(2500), settings.timeout());
    assertTrue(settings.hasApiKey());
    assertTrue(settingsRepository.find(TENANT, "conn-off").isEmpty());
  }

  @Test
  void shouldTreatMalformedConnectionRowAsNotConfigured() {
    jdbcTemplate.update(
        """
        INSERT INTO asset_connection_settings
          (tenant_id, connection_id, connector_type, base_url, enabled)
        VALUES (?, ?, 'rest-json', 'http://meters test', TRUE)
        """,
        TENANT,
        "conn-bad");
    JdbcAssetConnectionSettingsRepository settingsRepository =
        new JdbcAssetConnectionSettingsRepository(jdbcTemplate);

    assertTrue(settingsRepository.find(TENANT, "conn-bad").isEmpty());
  }

  private static Asset asset(
      String id, String name, String siteAreaId, boolean dynamic, String connectionId) {
    return new Asset(
        id,
        name,
        siteAreaId,
        siteAreaId == null ? null : "site-1",
        AssetType.CONSUMPTION_AND_PRODUCTION,
        dynamic,
        connectionId,
        "meter-" + id,
        new GeoCoordinates(2.35, 48.85),
        1000d,
        10d,
        false,
        null,
        AssetAudit.createdBy("creator", CREATED),
        0L);
  }
}
