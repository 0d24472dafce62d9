package com.starscape.astrocat.features.catalog.api;

import com.starscape.astrocat.features.catalog.api.dto.ConeSearchResponse;
import com.starscape.astrocat.features.catalog.app.ConeSearchHandler;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/queries/catalogs")
public class CatalogQueryController {

    private final ConeSearchHandler coneSearchHandler;

    public CatalogQueryController(ConeSearchHandler coneSearchHandler) {
        this.coneSearchHandler = coneSearchHandler;
    }

    @GetMapping("/{catalog}/cone")
    public ResponseEntity<ConeSearchResponse> coneSearch(
            @PathVariable CatalogVariant catalog,
            @RequestParam double ra,
            @RequestParam double dec,
            @RequestParam(defaultValue = "1.0") double radius) {

        return ResponseEntity.ok(coneSearchHandler.handle(catalog, ra, dec, radius));
    }
}
