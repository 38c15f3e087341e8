package com.ednataxa.api.resolution;

import com.ednataxa.api.model.LineageQuery;
import com.ednataxa.api.model.RankedName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LineageParserTest {

    private static final List<String> DEFAULT_RANKS =
            List.of("kingdom", "phylum", "class", "order", "family", "genus", "species");

    private final LineageParser parser = new LineageParser(DEFAULT_RANKS, Map.of(
            "18S_V9_PR2", List.of("domain", "supergroup", "division", "subdivision", "class", "order", "family",
                    "genus", "species")));

    @Test
    void assignsRanksByPosition() {
        LineageQuery query = parser.parse("COI", "Animalia;Chordata;;unassigned;Gadidae;Gadus;Gadus_morhua");

        assertThat(query.entries()).containsExactly(
                new RankedName("kingdom", "Animalia"),
                new RankedName("phylum", "Chordata"),
                new RankedName("family", "Gadidae"),
                new RankedName("genus", "Gadus"),
                new RankedName("species", "Gadus morhua"));
        assertThat(query.canonicalKey())
                .isEqualTo("kingdom=animalia;phylum=chordata;family=gadidae;genus=gadus;species=gadus morhua");
        assertThat(query.cleanedTaxonomy()).isEqualTo("Animalia;Chordata;Gadidae;Gadus;Gadus morhua");
    }

    @Test
    void shortLineageHasNoSpecies() {
        LineageQuery query = parser.parse("COI", "Animalia;Arthropoda;Copepoda");

        assertThat(query.entries()).extracting(RankedName::rank).containsExactly("kingdom", "phylum", "class");
        assertThat(query.finest()).contains(new RankedName("class", "Copepoda"));
    }

    @Test
    void openNomenclatureAndDigitsAreCleaned() {
        LineageQuery query = parser.parse("COI", "Animalia;Arthropoda;Copepoda;Calanoida;Calanidae;Calanus sp.;Calanus_sp._2");

        assertThat(query.finest()).contains(new RankedName("species", "Calanus"));
        assertThat(query.entries().get(5)).isEqualTo(new RankedName("genus", "Calanus"));
    }

    @Test
    void usesAssaySpecificLayout() {
        LineageQuery query = parser.parse("18S_V9_PR2",
                "Eukaryota;Haptista;Haptophyta;Prymnesiophyceae;Prymnesiophyceae_X;Isochrysidales;Noelaerhabdaceae;Emiliania;Emiliania_huxleyi");

        assertThat(query.entries()).hasSize(9);
        assertThat(query.entries().get(0)).isEqualTo(new RankedName("domain", "Eukaryota"));
        assertThat(query.finest()).contains(new RankedName("species", "Emiliania huxleyi"));
    }

    @Test
    void segmentsBeyondTheLayoutAreUnranked() {
        LineageQuery query = parser.parse("COI", "A1a;Bb;Cc;Dd;Ee;Ff;Gg hh;Ii");

        assertThat(query.finest()).contains(new RankedName(LineageParser.UNRANKED, "Ii"));
    }

    @Test
    void blankLineageIsEmpty() {
        assertThat(parser.parse("COI", "  ").isEmpty()).isTrue();
        assertThat(parser.parse("COI", null).isEmpty()).isTrue();
        assertThat(parser.parse("COI", "unassigned;NaN;;x").isEmpty()).isTrue();
    }

    @Test
    void unknownAssayUsesDefaultRanks() {
        assertThat(parser.ranksFor("unknown")).isEqualTo(DEFAULT_RANKS);
        assertThat(parser.ranksFor(null)).isEqualTo(DEFAULT_RANKS);
    }
}
