package com.assetplatform.assetapi.api;

import com.assetplatform.assetapi.assets.AssetApplicationService;
import com.assetplatform.assetapi.assets.AssetPage;
import com.assetplatform.assetapi.assets.AssetPaging;
import com.assetplatform.assetapi.assets.AssetQuery;
import com.assetplatform.assetapi.assets.RequestFilters;
import com.assetplatform.assetapi.config.RequestPrincipal;
import com.assetplatform.domain.assets.Asset;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/assets")
public class AssetController {
  private final AssetApplicationService assetApplicationService;

  public AssetController(AssetApplicationService assetApplicationService) {
    this.assetApplicationService = assetApplicationService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<AssetsPageResponse> listAssets(
      @RequestParam(name = "search", required = false) String search,
      @RequestParam(name = "siteAreaId", required = false) String siteAreaId,
      @RequestParam(name = "siteId", required = false) String siteId,
      @RequestParam(name = "withNoSiteArea", defaultValue = "false") boolean withNoSiteArea,
      @RequestParam(name = "dynamicOnly", defaultValue = "false") boolean dynamicOnly,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "skip", required = false) Integer skip,
      @RequestParam(name = "sort", required = false) String sort,
      @RequestParam(name = "onlyRecordCount", required = false) Boolean onlyRecordCount,
      Authentication authentication) {
    AssetQuery query =
        new AssetQuery(
            RequestFilters.normalizeSearch(search),
            RequestFilters.splitBarDelimited(siteAreaId),
            RequestFilters.splitBarDelimited(siteId),
            withNoSiteArea,
            dynamicOnly);
    AssetPage<Asset> page =
        assetApplicationService.listAssets(
            RequestPrincipal.tenant(authentication),
            query,
            AssetPaging.of(limit, skip, sort, onlyRecordCount));
    return ResponseEntity.ok(
        new AssetsPageResponse(
            page.count(), page.result().stream().map(AssetResponse::from).toList()));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('USER', 'ADMIN')")
  public ResponseEntity<AssetResponse> getAsset(
      @PathVariable("id") String id, Authentication authentication) {
    return ResponseEntity.ok(
        AssetResponse.from(
            assetApplicationService.getAsset(RequestPrincipal.tenant(authentication), id)));
  }

  @PostMapping
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<AssetResponse> createAsset(
      @Valid @RequestBody UpsertAssetRequest request, Authentication authentication) {
    Asset created =
        assetApplicationService.createAsset(
            RequestPrincipal.tenant(authentication),
            request.toCommand(),
            RequestPrincipal.actor(authentication));
    return ResponseEntity.status(HttpStatus.CREATED).body(AssetResponse.from(created));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<AssetResponse> updateAsset(
      @PathVariable("id") String id,
      @Valid @RequestBody UpsertAssetRequest request,
      Authentication authentication) {
    Asset updated =
        assetApplicationService.updateAsset(
            RequestPrincipal.tenant(authentication),
            id,
            request.toCommand(),
            RequestPrincipal.actor(authentication));
    return ResponseEntity.ok(AssetResponse.from(updated));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<ActionResponse> deleteAsset(
      @PathVariable("id") String id, Authentication authentication) {
    assetApplicationService.deleteAsset(RequestPrincipal.tenant(authentication), id);
    return ResponseEntity.ok(ActionResponse.success());
  }
}
