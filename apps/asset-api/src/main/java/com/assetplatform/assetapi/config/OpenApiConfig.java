package com.assetplatform.assetapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
  static final String BEARER_SCHEME = "bearer-jwt";

  private static final String DEFAULT_APP_NAME = "asset-api";
  private static final String DEFAULT_VERSION = "unknown";

  // Telemetry routes live under /v1/assets next to CRUD, so the asset group excludes them.
  private static final String[] TELEMETRY_PATHS = {
    "/v1/assets/consumptions",
    "/v1/assets/connections/**",
    "/v1/assets/*/consumptions/**",
    "/v1/assets/in-error"
  };

  @Bean
  public OpenAPI assetApiOpenApi(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      @Value("${spring.application.name:" + DEFAULT_APP_NAME + "}") String applicationName) {
    BuildProperties buildProperties = buildPropertiesProvider.getIfAvailable();
    String version = buildProperties != null ? buildProperties.getVersion() : DEFAULT_VERSION;
    if (version == null || version.isBlank()) {
      version = DEFAULT_VERSION;
    }

    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version(version)
                .description(
                    "Asset management and telemetry integration API. Every /v1/assets route is"
                        + " scoped to the tenant named by the token's "
                        + RequestPrincipal.TENANT_CLAIM
                        + " claim."))
        .components(
            new Components()
                .addSecuritySchemes(
                    BEARER_SCHEME,
                    new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
        .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
  }

  @Bean
  public GroupedOpenApi assetsApiGroup() {
    return GroupedOpenApi.builder()
        .group("assets")
        .pathsToMatch("/v1/assets", "/v1/assets/*")
        .pathsToExclude(TELEMETRY_PATHS)
        .build();
  }

  @Bean
  public GroupedOpenApi telemetryApiGroup() {
    return GroupedOpenApi.builder().group("telemetry").pathsToMatch(TELEMETRY_PATHS).build();
  }

  @Bean
  public GroupedOpenApi opsApiGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch("/v1/version", "/actuator/health", "/actuator/health/**")
        .build();
  }
}
