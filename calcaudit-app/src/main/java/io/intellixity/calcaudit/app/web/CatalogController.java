package io.intellixity.calcaudit.app.web;

import io.intellixity.calcaudit.app.service.CatalogService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public final class CatalogController {
  private final CatalogService catalog;

  public CatalogController(CatalogService catalog) {
    this.catalog = catalog;
  }

  @GetMapping("/matrix")
  public CatalogService.MatrixView matrix() {
    return catalog.matrix();
  }

  @GetMapping("/stats")
  public CatalogService.StatsView stats() {
    return catalog.stats();
  }
}
