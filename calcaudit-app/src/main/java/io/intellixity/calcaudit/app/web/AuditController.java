package io.intellixity.calcaudit.app.web;

import io.intellixity.calcaudit.app.service.AuditService;
import io.intellixity.calcaudit.app.service.KeyDetails;
import io.intellixity.calcaudit.level.LevelTable;
import io.intellixity.calcaudit.model.LevelDelta;
import io.intellixity.calcaudit.validate.ValidationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public final class AuditController {
  private final AuditService audits;

  public AuditController(AuditService audits) {
    this.audits = audits;
  }

  public record LevelsResponse(LevelTable properLevels, List<LevelDelta> levelDeltas) {}

  @GetMapping("/funds")
  public List<String> funds() {
    return audits.fundIds();
  }

  @GetMapping("/funds/{fundId}/audit")
  public ValidationReport audit(@PathVariable("fundId") String fundId) {
    return audits.audit(fundId);
  }

  @GetMapping("/funds/{fundId}/levels")
  public LevelsResponse levels(@PathVariable("fundId") String fundId) {
    ValidationReport r = audits.audit(fundId);
    return new LevelsResponse(r.properLevels(), r.levelDeltas());
  }

  @GetMapping("/funds/{fundId}/keys")
  public ResponseEntity<KeyDetails> key(@PathVariable("fundId") String fundId,
                                        @RequestParam("fullKey") String fullKey) {
    return audits.keyDetails(fundId, fullKey)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/audit")
  public List<AuditService.FundSummary> auditAll() {
    return audits.auditAll();
  }
}
