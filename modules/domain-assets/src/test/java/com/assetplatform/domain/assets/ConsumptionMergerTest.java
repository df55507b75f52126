package com.assetplatform.domain.assets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConsumptionMergerTest {
  private static final Instant CREATED_ON = Instant.parse("2026-01-10T10:00:00Z");

  @Test
  void shouldReplaceOnlyLiveStateGroup() {
    Asset before = dynamicAsset(AssetLiveState.empty());
    ConsumptionSample sample =
        ConsumptionSample.builder()
            .startedAt(Instant.parse("2026-03-01T08:00:00Z"))
            .endedAt(Instant.parse("2026-03-01T08:01:00Z"))
            .consumptionWh(70.0)
            .instantWatts(4200.0, 1400.0, 1400.0, 1400.0)
            .instantAmps(18.0, 6.0, 6.0, 6.0)
            .instantVolts(230.0, 230.0, 231.0, 229.0)
            .stateOfCharge(73.0)
            .build();

    Asset after = ConsumptionMerger.merge(before, sample);

    assertEquals(4200.0, after.liveState().currentInstantWatts());
    assertEquals(1400.0, after.liveState().currentInstantWattsL2());
    assertEquals(6.0, after.liveState().currentInstantAmpsL3());
    assertEquals(231.0, after.liveState().currentInstantVoltsL2());
    assertEquals(73.0, after.liveState().currentStateOfCharge());
    assertEquals(70.0, after.liveState().currentConsumptionWh());
    assertEquals(
        new LastConsumption(70.0, Instant.parse("2026-03-01T08:01:00Z")),
        after.liveState().lastConsumption());

    assertEquals(before.id(), after.id());
    assertEquals(before.name(), after.name());
    assertEquals(before.siteAreaId(), after.siteAreaId());
    assertEquals(before.siteId(), after.siteId());
    assertEquals(before.assetType(), after.assetType());
    assertEquals(before.connectionId(), after.connectionId());
    assertEquals(before.meterId(), after.meterId());
    assertEquals(before.coordinates(), after.coordinates());
    assertEquals(before.staticValueWatt(), after.staticValueWatt());
    assertEquals(before.fluctuationPercent(), after.fluctuationPercent());
    assertEquals(before.excludeFromSmartCharging(), after.excludeFromSmartCharging());
    assertEquals(before.audit(), after.audit());
    assertEquals(before.version(), after.version());
  }

  @Test
  void shouldNotLetStaleFieldsLingerFromPreviousSample() {
    ConsumptionSample first =
        ConsumptionSample.builder()
            .instantWatts(5000.0, 1600.0, 1700.0, 1700.0)
            .instantAmps(21.0, 7.0, 7.0, 7.0)
            .stateOfCharge(50.0)
            .build();
    ConsumptionSample second =
        ConsumptionSample.builder().instantWatts(4200.0, null, null, null).build();

    Asset merged = ConsumptionMerger.merge(ConsumptionMerger.merge(dynamicAsset(null), first), second);

    assertEquals(4200.0, merged.liveState().currentInstantWatts());
    assertNull(merged.liveState().currentInstantWattsL1());
    assertNull(merged.liveState().currentInstantAmps());
    assertNull(merged.liveState().currentStateOfCharge());
    assertNull(merged.liveState().lastConsumption());
  }

  @Test
  void shouldMergeFirstSampleOnly() {
    List<ConsumptionSample> samples =
        List.of(
            ConsumptionSample.builder().instantWatts(100.0, null, null, null).build(),
            ConsumptionSample.builder().instantWatts(200.0, null, null, null).build());

    Optional<Asset> merged = ConsumptionMerger.mergeFirst(dynamicAsset(null), samples);

    assertTrue(merged.isPresent());
    assertEquals(100.0, merged.get().liveState().currentInstantWatts());
  }

  @Test
  void shouldReturnEmptyWhenNoSampleAvailable() {
    assertTrue(ConsumptionMerger.mergeFirst(dynamicAsset(null), List.of()).isEmpty());
  }

  @Test
  void shouldRejectSampleEndingBeforeItStarts() {
    assertThrows(
        AssetDomainException.class,
        () ->
            ConsumptionSample.builder()
                .startedAt(Instant.parse("2026-03-01T08:01:00Z"))
                .endedAt(Instant.parse("2026-03-01T08:00:00Z"))
                .build());
  }

  private static Asset dynamicAsset(AssetLiveState liveState) {
    return new Asset(
        "A1",
        "Site battery",
        "area-1",
        "site-1",
        AssetType.CONSUMPTION_AND_PRODUCTION,
        true,
        "meter-7",
        "meter-id-7",
        new GeoCoordinates(4.83, 45.76),
        3000.0,
        15.0,
        true,
        liveState,
        AssetAudit.createdBy("admin", CREATED_ON),
        4);
  }
}
