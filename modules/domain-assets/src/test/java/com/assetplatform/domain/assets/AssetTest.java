package com.assetplatform.domain.assets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class AssetTest {
  private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

  @Test
  void shouldDefaultMissingLiveStateToEmptyGroup() {
    Asset asset = asset("asset-1", "Battery", null);

    assertSame(AssetLiveState.empty(), asset.liveState());
    assertFalse(asset.hasSiteArea());
  }

  @Test
  void shouldRejectBlankName() {
    assertThrows(AssetDomainException.class, () -> asset("asset-1", " ", "area-1"));
  }

  @Test
  void shouldRejectFluctuationOutsidePercentRange() {
    assertThrows(
        AssetDomainException.class,
        () ->
            new Asset(
                "asset-1",
                "Battery",
                null,
                null,
                AssetType.CONSUMPTION,
                false,
                null,
                null,
                null,
                null,
                120.0,
                false,
                null,
                AssetAudit.createdBy("admin", NOW),
                0));
  }

  @Test
  void shouldStampLastChangedWithoutTouchingCreation() {
    Asset asset = asset("asset-1", "Battery", "area-1");

    Asset changed = asset.withAudit(asset.audit().changedBy("operator", NOW.plusSeconds(60)));

    assertEquals("admin", changed.audit().createdBy());
    assertEquals(NOW, changed.audit().createdOn());
    assertEquals("operator", changed.audit().lastChangedBy());
    assertEquals(NOW.plusSeconds(60), changed.audit().lastChangedOn());
    assertTrue(changed.hasSiteArea());
  }

  @Test
  void shouldResolveAssetTypeFromCodeOrName() {
    assertEquals(AssetType.CONSUMPTION_AND_PRODUCTION, AssetType.fromCode("CO-PR"));
    assertEquals(AssetType.PRODUCTION, AssetType.fromCode("production"));
    assertThrows(AssetDomainException.class, () -> AssetType.fromCode("XX"));
  }

  private static Asset asset(String id, String name, String siteAreaId) {
    return new Asset(
        id,
        name,
        siteAreaId,
        siteAreaId == null ? null : "site-1",
        AssetType.CONSUMPTION,
        true,
        "meter-7",
        "m-1",
        new GeoCoordinates(2.35, 48.85),
        1000.0,
        10.0,
        false,
        null,
        AssetAudit.createdBy("admin", NOW),
        0);
  }
}
