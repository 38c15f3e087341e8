package com.ednataxa.api.resolution;

import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.OccurrenceRow;
import com.ednataxa.api.model.ResolutionSummary;

import java.util.List;
import java.util.Map;

public record ResolutionRun(ResolutionSummary summary, Map<String, MatchResult> matches, List<OccurrenceRow> rows) {
}
