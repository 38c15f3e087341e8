package com.ednataxa.api.controller;

import com.ednataxa.api.http.HttpTransport;
import com.ednataxa.api.http.TransportResponse;
import com.ednataxa.api.model.MatchRequest;
import com.ednataxa.api.model.OccurrenceRow;
import com.ednataxa.api.model.ResolveRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TaxonomyControllerTest {

    private static final String HADDOCK = "[[{\"AphiaID\":126437,\"lsid\":\"urn:lsid:marinespecies.org:taxname:126437\","
            + "\"scientificname\":\"Melanogrammus aeglefinus\",\"status\":\"accepted\",\"rank\":\"Species\","
            + "\"valid_AphiaID\":126437,\"valid_name\":\"Melanogrammus aeglefinus\",\"kingdom\":\"Animalia\","
            + "\"family\":\"Gadidae\",\"genus\":\"Melanogrammus\",\"match_type\":\"exact\"}]]";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @MockBean
    private HttpTransport transport;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    @Test
    void matchUsesTheBundledLocalReference() throws Exception {
        MatchRequest body = new MatchRequest();
        body.setAssayName("COI");
        body.setLineage("Animalia;Arthropoda;Copepoda;Calanoida;Calanidae;Calanus;Calanus_finmarchicus");

        ResponseEntity<JsonNode> resp = rest.postForEntity(url("/api/v1/taxonomy/match"), body, JsonNode.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().path("matchType").asText()).isEqualTo("exact");
        assertThat(resp.getBody().path("source").asText()).isEqualTo("local");
        assertThat(resp.getBody().path("identifier").asText()).isEqualTo("urn:lsid:marinespecies.org:taxname:104464");
        verify(transport, never()).get(any(URI.class), any(Duration.class));
    }

    @Test
    void incertaeSedisLineageNeedsNoLookup() throws Exception {
        MatchRequest body = new MatchRequest();
        body.setAssayName("18S_V9_PR2");
        body.setLineage("Eukaryota;unassigned;unassigned");

        ResponseEntity<JsonNode> resp = rest.postForEntity(url("/api/v1/taxonomy/match"), body, JsonNode.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().path("matchType").asText()).isEqualTo("no-match");
        assertThat(resp.getBody().path("failureCause").asText()).isEqualTo("INCERTAE_SEDIS");
        verify(transport, never()).get(any(URI.class), any(Duration.class));
    }

    @Test
    void resolveMergesRemoteAndLocalMatchesOntoRows() throws Exception {
        when(transport.get(any(URI.class), any(Duration.class))).thenReturn(TransportResponse.of(200, HADDOCK));
        String haddock = "Animalia;Chordata;Teleostei;Gadiformes;Gadidae;Melanogrammus;Melanogrammus_aeglefinus";
        ResolveRequest body = new ResolveRequest();
        body.setRows(List.of(
                new OccurrenceRow("asv1", "s1", "COI", haddock),
                new OccurrenceRow("asv2", "s2", "COI", haddock),
                new OccurrenceRow("asv3", "s1", "COI", "Animalia;Arthropoda;Copepoda;Calanoida;Calanidae;Calanus;Calanus_finmarchicus"),
                new OccurrenceRow("asv4", "s2", "COI", "unassigned")));

        ResponseEntity<JsonNode> resp = rest.postForEntity(url("/api/v1/taxonomy/resolve"), body, JsonNode.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode summary = resp.getBody().path("summary");
        assertThat(summary.path("provider").asText()).isEqualTo("WoRMS");
        assertThat(summary.path("distinctKeys").asInt()).isEqualTo(3);
        assertThat(summary.path("localHits").asInt()).isEqualTo(1);
        assertThat(summary.path("remoteQueries").asInt()).isEqualTo(1);
        assertThat(summary.path("rowsUnresolved").asInt()).isEqualTo(1);

        JsonNode rows = resp.getBody().path("rows");
        assertThat(rows).hasSize(4);
        assertThat(rows.get(0).path("scientificNameID").asText()).isEqualTo("urn:lsid:marinespecies.org:taxname:126437");
        assertThat(rows.get(1).path("scientificName").asText()).isEqualTo("Melanogrammus aeglefinus");
        assertThat(rows.get(1).path("family").asText()).isEqualTo("Gadidae");
        assertThat(rows.get(2).path("class").asText()).isEqualTo("Copepoda");
        assertThat(rows.get(3).path("scientificName").asText()).isEqualTo("incertae sedis");
        assertThat(rows.get(3).path("nameAccordingTo").asText()).isEqualTo("WoRMS");
        verify(transport, times(1)).get(any(URI.class), any(Duration.class));
    }

    @Test
    void resolveWithoutRowsIsBadRequest() {
        ResponseEntity<String> resp = rest.postForEntity(url("/api/v1/taxonomy/resolve"), new ResolveRequest(), String.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void healthReportsTheLocalReference() {
        ResponseEntity<JsonNode> resp = rest.getForEntity(url("/actuator/health"), JsonNode.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode details = resp.getBody().path("components").path("localReference").path("details");
        assertThat(details.path("enabled").asBoolean()).isTrue();
        assertThat(details.path("entries").asInt()).isEqualTo(5);
    }
}
