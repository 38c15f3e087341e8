package com.ednataxa.api.resolution;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.MatchResult;

public record KeyOutcome(LineageQuery query, MatchResult result, ResolutionPath path) {
}
