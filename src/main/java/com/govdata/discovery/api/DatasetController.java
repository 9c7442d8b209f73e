package com.govdata.discovery.api;

import com.govdata.discovery.catalog.CatalogModels.DatasetDetail;
import com.govdata.discovery.catalog.CatalogModels.DatasetPage;
import com.govdata.discovery.catalog.DatasetCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/datasets")
public class DatasetController {
    private final DatasetCatalogService catalogService;

    public DatasetController(DatasetCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public ResponseEntity<DatasetPage> list(@RequestParam(required = false) String domain,
                                            @RequestParam(required = false) String agency,
                                            @RequestParam(defaultValue = "50") int limit,
                                            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(catalogService.list(domain, agency, limit, offset));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DatasetDetail> get(@PathVariable String id) {
        return ResponseEntity.ok(catalogService.get(id));
    }
}
