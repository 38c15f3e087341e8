package com.ednataxa.api.model;

public class MatchRequest {
    private String assayName;   // owning assay, decides the rank layout and species policy
    private String lineage;     // semicolon separated, coarsest first

    public String getAssayName() { return assayName; }
    public void setAssayName(String assayName) { this.assayName = assayName; }

    public String getLineage() { return lineage; }
    public void setLineage(String lineage) { this.lineage = lineage; }
}
