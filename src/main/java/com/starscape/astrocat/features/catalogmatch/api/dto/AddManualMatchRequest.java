package com.starscape.astrocat.features.catalogmatch.api.dto;

import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AddManualMatchRequest(
    @NotNull(message = "Catalog is required")
    CatalogVariant catalog,

    @NotBlank(message = "Designation is required")
    @Size(max = 50, message = "Designation must be 50 characters or less")
    String designation
) {}
