package com.ednataxa.api.controller;

import com.ednataxa.api.model.MatchRequest;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.OccurrenceRow;
import com.ednataxa.api.model.ResolveRequest;
import com.ednataxa.api.model.ResolveResponse;
import com.ednataxa.api.resolution.ResolutionRun;
import com.ednataxa.api.resolution.TaxonomicResolutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/taxonomy")
@Tag(name = "Taxonomy", description = "Resolve eDNA lineages against WoRMS or the GBIF backbone")
public class TaxonomyController {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyController.class);

    @Autowired
    private TaxonomicResolutionService service;

    @PostMapping("/resolve")
    @Operation(summary = "Resolve the lineages of a batch of occurrence rows and merge the results onto them")
    public ResolveResponse resolve(@RequestBody ResolveRequest req) {
        if (req == null || req.getRows() == null) {
            throw new BadRequest("Missing rows");
        }
        List<OccurrenceRow> rows = req.getRows();
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i) == null) {
                throw new BadRequest("Row " + i + " is null");
            }
        }
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("resolve start: requestId={}, rows={}", requestId, rows.size());
        ResolutionRun run = service.resolve(rows);
        log.info("resolve done: requestId={}, keys={}, unresolved={}",
                requestId, run.summary().distinctKeys(), run.summary().unresolved());
        return new ResolveResponse(run.summary(), run.matches(), run.rows());
    }

    @PostMapping("/match")
    @Operation(summary = "Resolve a single lineage for an assay")
    public MatchResult match(@RequestBody MatchRequest req) {
        if (req == null || req.getLineage() == null) {
            throw new BadRequest("Missing lineage");
        }
        return service.match(req.getAssayName(), req.getLineage());
    }

    @ResponseStatus(HttpStatus.BAD_REQUEST)
    private static class BadRequest extends RuntimeException { BadRequest(String m) { super(m); } }
}
