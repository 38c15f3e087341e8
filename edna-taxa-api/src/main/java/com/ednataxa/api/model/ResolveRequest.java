package com.ednataxa.api.model;

import java.util.List;

public class ResolveRequest {
    private List<OccurrenceRow> rows;

    public List<OccurrenceRow> getRows() { return rows; }
    public void setRows(List<OccurrenceRow> rows) { this.rows = rows; }
}
