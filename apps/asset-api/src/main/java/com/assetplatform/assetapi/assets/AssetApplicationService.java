package com.assetplatform.assetapi.assets;

import com.assetplatform.assetapi.siteareas.SiteArea;
import com.assetplatform.assetapi.siteareas.SiteAreaNotFoundException;
import com.assetplatform.assetapi.siteareas.SiteAreaRepository;
import com.assetplatform.domain.assets.Asset;
import com.assetplatform.domain.assets.AssetAudit;
import com.assetplatform.domain.assets.AssetDomainException;
import com.assetplatform.domain.assets.AssetLiveState;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AssetApplicationService {
  private static final Logger log = LoggerFactory.getLogger(AssetApplicationService.class);

  private final AssetRepository assetRepository;
  private final SiteAreaRepository siteAreaRepository;
  private final Clock clock;

  @Autowired
  public AssetApplicationService(
      AssetRepository assetRepository, SiteAreaRepository siteAreaRepository) {
    this(assetRepository, siteAreaRepository, Clock.systemUTC());
  }

  AssetApplicationService(
      AssetRepository assetRepository, SiteAreaRepository siteAreaRepository, Clock clock) {
    this.assetRepository = assetRepository;
    this.siteAreaRepository = siteAreaRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public Asset getAsset(String tenantId, String assetId) {
    String id = RequestFilters.requireId(assetId, "Asset ID");
    return assetRepository.findById(tenantId, id).orElseThrow(() -> new AssetNotFoundException(id));
  }

  @Transactional(readOnly = true)
  public AssetPage<Asset> listAssets(String tenantId, AssetQuery query, AssetPaging paging) {
    AssetQuery safeQuery = query == null ? new AssetQuery(null, null, null, false, false) : query;
    return assetRepository.findAssets(
        tenantId, safeQuery, paging == null ? AssetPaging.defaults() : paging);
  }

  @Transactional
  public Asset createAsset(String tenantId, AssetCommand command, String createdBy) {
    Optional<SiteArea> siteArea = resolveSiteArea(tenantId, command.siteAreaId());
    Asset asset =
        toAsset(
            UUID.randomUUID().toString(),
            command,
            siteArea,
            AssetLiveState.empty(),
            AssetAudit.createdBy(createdBy, clock.instant()),
            0L);
    assetRepository.insert(tenantId, asset);
    log.info(
        "Asset created tenant={} asset={} siteArea={} dynamic={}",
        tenantId,
        asset.id(),
        asset.siteAreaId(),
        asset.dynamicAsset());
    return asset;
  }

  @Transactional
  public Asset updateAsset(
      String tenantId, String assetId, AssetCommand command, String changedBy) {
    Asset current = getAsset(tenantId, assetId);
    Optional<SiteArea> siteArea = resolveSiteArea(tenantId, command.siteAreaId());
    Asset updated =
        toAsset(
            current.id(),
            command,
            siteArea,
            current.liveState(),
            current.audit().changedBy(changedBy, clock.instant()),
            current.version());
    Asset saved = assetRepository.save(tenantId, updated);
    log.info(
        "Asset updated tenant={} asset={} version={}", tenantId, saved.id(), saved.version());
    return saved;
  }

  @Transactional
  public void deleteAsset(String tenantId, String assetId) {
    String id = RequestFilters.requireId(assetId, "Asset ID");
    if (!assetRepository.delete(tenantId, id)) {
      throw new AssetNotFoundException(id);
    }
    log.info("Asset deleted tenant={} asset={}", tenantId, id);
  }

  private Optional<SiteArea> resolveSiteArea(String tenantId, String siteAreaId) {
    if (siteAreaId == null || siteAreaId.isBlank()) {
      return Optional.empty();
    }
    String id = siteAreaId.trim();
    return Optional.of(
        siteAreaRepository
            .findById(tenantId, id)
            .orElseThrow(() -> new SiteAreaNotFoundException(id)));
  }

  private static Asset toAsset(
      String id,
      AssetCommand command,
      Optional<SiteArea> siteArea,
      AssetLiveState liveState,
      AssetAudit audit,
      long version) {
    if (command == null) {
      throw new AssetValidationException("Asset payload must be provided");
    }
    if (command.assetType() == null) {
      throw new AssetValidationException("Asset type must be provided");
    }
    try {
      return new Asset(
          id,
          command.name(),
          siteArea.map(SiteArea::id).orElse(null),
          siteArea.map(SiteArea::siteId).orElse(null),
          command.assetType(),
          command.dynamicAsset(),
          blankToNull(command.connectionId()),
          blankToNull(command.meterId()),
          command.coordinates(),
          command.staticValueWatt(),
          command.fluctuationPercent(),
          command.excludeFromSmartCharging(),
          liveState,
          audit,
          version);
    } catch (AssetDomainException ex) {
      throw new AssetValidationException(ex.getMessage(), ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
