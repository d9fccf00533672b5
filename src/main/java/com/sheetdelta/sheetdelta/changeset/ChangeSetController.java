package com.sheetdelta.sheetdelta.changeset;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Exposes change computation between two posted character sheet snapshots.
 */
@RestController
@RequestMapping("/api/changes")
public class ChangeSetController {

    private final ChangeSetService changeSetService;

    public ChangeSetController(ChangeSetService changeSetService) {
        this.changeSetService = changeSetService;
    }

    /**
     * Returns every classified and explained change, highest priority first.
     */
    @PostMapping("/compute")
    public ResponseEntity<ChangeSet> compute(@RequestBody ChangeSetModels.ComputeRequest request) {
        try {
            return ResponseEntity.ok(changeSetService.compute(request));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @PostMapping("/summary")
    public ResponseEntity<ChangeSetSummary> summary(@RequestBody ChangeSetModels.ComputeRequest request) {
        try {
            return ResponseEntity.ok(changeSetService.summarize(request));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping("/ruleset")
    public ResponseEntity<ChangeSetModels.RulesetResponse> ruleset() {
        return ResponseEntity.ok(changeSetService.describeRuleset());
    }
}
