package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.assets.AssetInErrorView;
import com.assetplatform.assetapi.assets.AssetPage;
import com.assetplatform.assetapi.assets.AssetPaging;
import com.assetplatform.assetapi.config.RequestPrincipal;
import com.assetplatform.assetapi.consumption.AssetConsumptionQueryService;
import com.assetplatform.assetapi.diagnostics.AssetInErrorQueryService;
import com.assetplatform.assetapi.diagnostics.AssetInErrorRequest;
import com.assetplatform.assetapi.telemetry.AssetTelemetryService;
import com.assetplatform.assetapi.telemetry.RetrievalOutcome;
import com.assetplatform.integration.connector.AssetConnectionRef;
import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/assets")
public class AssetTelemetryController {
  private final AssetTelemetryService assetTelemetryService;
  private final AssetConsumptionQueryService assetConsumptionQueryService;
  private final AssetInErrorQueryService assetInErrorQueryService;

  public AssetTelemetryController(
      AssetTelemetryService assetTelemetryService,
      AssetConsumptionQueryService assetConsumptionQueryService,
      AssetInErrorQueryService assetInErrorQueryService) {
    this.assetTelemetryService = assetTelemetryService;
    this.assetConsumptionQueryService = assetConsumptionQueryService;
    this.assetInErrorQueryService = assetInErrorQueryService;
  }

  @GetMapping("/consumptions")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<AssetConsumptionResponse> consumptions(
      @RequestParam(name = "assetId", required = false) String assetId,
      @RequestParam(name = "startDate", required = false) Instant startDate,
      @RequestParam(name = "endDate", required = false) Instant endDate,
      Authentication authentication) {
    return ResponseEntity.ok(
        AssetConsumptionResponse.from(
            assetConsumptionQueryService.query(
                RequestPrincipal.tenant(authentication), assetId, startDate, endDate)));
  }

  @GetMapping("/connections/check")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ConnectionCheckResponse> checkConnection(
      @RequestParam(name = "connectionId", required = false) String connectionId,
      Authentication authentication) {
    return ResponseEntity.ok(
        ConnectionCheckResponse.from(
            assetTelemetryService.checkConnection(
                RequestPrincipal.tenant(authentication), AssetConnectionRef.of(connectionId))));
  }

  @PostMapping("/{id}/consumptions/retrieve")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<RetrieveConsumptionResponse> retrieveConsumption(
      @PathVariable("id") String id, Authentication authentication) {
    RetrievalOutcome outcome =
        assetTelemetryService.retrieveAndMerge(
            RequestPrincipal.tenant(authentication), id, RequestPrincipal.actor(authentication));
    return ResponseEntity.ok(RetrieveConsumptionResponse.of(outcome));
  }

  @GetMapping("/in-error")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<AssetsInErrorPageResponse> assetsInError(
      @RequestParam(name = "errorType", required = false) String errorType,
      @RequestParam(name = "siteAreaId", required = false) String siteAreaId,
      @RequestParam(name = "siteId", required = false) String siteId,
      @RequestParam(name = "search", required = false) String search,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "skip", required = false) Integer skip,
      @RequestParam(name = "sort", required = false) String sort,
      @RequestParam(name = "onlyRecordCount", required = false) Boolean onlyRecordCount,
      Authentication authentication) {
    AssetPage<AssetInErrorView> page =
        assetInErrorQueryService.listInError(
            RequestPrincipal.tenant(authentication),
            new AssetInErrorRequest(errorType, siteAreaId, siteId, search),
            AssetPaging.of(limit, skip, sort, onlyRecordCount));
    return ResponseEntity.ok(
        new AssetsInErrorPageResponse(
            page.count(), page.result().stream().map(AssetInErrorResponse::from).toList()));
  }
}
