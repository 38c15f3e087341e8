package com.ednataxa.api.model;

import java.util.List;
import java.util.Map;

public class ResolveResponse {
    private ResolutionSummary summary;
    private Map<String, MatchResult> matches;
    private List<OccurrenceRow> rows;

    public ResolveResponse() {}

    public ResolveResponse(ResolutionSummary summary, Map<String, MatchResult> matches, List<OccurrenceRow> rows) {
        this.summary = summary;
        this.matches = matches;
        this.rows = rows;
    }

    public ResolutionSummary getSummary() { return summary; }
    public void setSummary(ResolutionSummary summary) { this.summary = summary; }

    public Map<String, MatchResult> getMatches() { return matches; }
    public void setMatches(Map<String, MatchResult> matches) { this.matches = matches; }

    public List<OccurrenceRow> getRows() { return rows; }
    public void setRows(List<OccurrenceRow> rows) { this.rows = rows; }
}
