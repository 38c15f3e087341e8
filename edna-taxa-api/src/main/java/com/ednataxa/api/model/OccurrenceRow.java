package com.ednataxa.api.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Occurrence row handed over by the ingestion stage. Only the merge step writes the taxon
 * fields; columns this service does not know about are carried through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OccurrenceRow {

    private String asvId;
    private String sampleId;
    private String assayName;
    private String verbatimIdentification;

    private String scientificName;
    private String scientificNameID;
    private String taxonRank;
    private String nameAccordingTo;
    private String identificationRemarks;
    private String cleanedTaxonomy;
    private String kingdom;
    private String phylum;
    @JsonProperty("class")
    private String clazz;
    private String order;
    private String family;
    private String genus;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    public OccurrenceRow() {
    }

    public OccurrenceRow(String asvId, String sampleId, String assayName, String verbatimIdentification) {
        this.asvId = asvId;
        this.sampleId = sampleId;
        this.assayName = assayName;
        this.verbatimIdentification = verbatimIdentification;
    }

    public String getAsvId() { return asvId; }
    public void setAsvId(String asvId) { this.asvId = asvId; }

    public String getSampleId() { return sampleId; }
    public void setSampleId(String sampleId) { this.sampleId = sampleId; }

    public String getAssayName() { return assayName; }
    public void setAssayName(String assayName) { this.assayName = assayName; }

    public String getVerbatimIdentification() { return verbatimIdentification; }
    public void setVerbatimIdentification(String verbatimIdentification) { this.verbatimIdentification = verbatimIdentification; }

    public String getScientificName() { return scientificName; }
    public void setScientificName(String scientificName) { this.scientificName = scientificName; }

    public String getScientificNameID() { return scientificNameID; }
    public void setScientificNameID(String scientificNameID) { this.scientificNameID = scientificNameID; }

    public String getTaxonRank() { return taxonRank; }
    public void setTaxonRank(String taxonRank) { this.taxonRank = taxonRank; }

    public String getNameAccordingTo() { return nameAccordingTo; }
    public void setNameAccordingTo(String nameAccordingTo) { this.nameAccordingTo = nameAccordingTo; }

    public String getIdentificationRemarks() { return identificationRemarks; }
    public void setIdentificationRemarks(String identificationRemarks) { this.identificationRemarks = identificationRemarks; }

    public String getCleanedTaxonomy() { return cleanedTaxonomy; }
    public void setCleanedTaxonomy(String cleanedTaxonomy) { this.cleanedTaxonomy = cleanedTaxonomy; }

    public String getKingdom() { return kingdom; }
    public void setKingdom(String kingdom) { this.kingdom = kingdom; }

    public String getPhylum() { return phylum; }
    public void setPhylum(String phylum) { this.phylum = phylum; }

    public String getClazz() { return clazz; }
    public void setClazz(String clazz) { this.clazz = clazz; }

    public String getOrder() { return order; }
    public void setOrder(String order) { this.order = order; }

    public String getFamily() { return family; }
    public void setFamily(String family) { this.family = family; }

    public String getGenus() { return genus; }
    public void setGenus(String genus) { this.genus = genus; }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String column, Object value) {
        extra.put(column, value);
    }
}
