package com.bookcatalog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Service metadata bound from the {@code catalog.*} properties. Exposed by the root
 * status endpoint and the generated OpenAPI document.
 */
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(String title, String description, String version) {}
