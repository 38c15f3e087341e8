package com.ednataxa.api.reference;

import com.ednataxa.api.config.DatasetFormat;
import com.ednataxa.api.config.TaxonomyProperties;
import com.ednataxa.api.model.MatchResult;
import com.ednataxa.api.model.MatchSource;
import com.ednataxa.api.model.MatchType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalReferenceLoaderTest {

    private static final String TSV = "scientificName\tscientificNameID\tacceptedName\tacceptedNameID\ttaxonRank\tkingdom\tgenus\n"
            + "Calanus finmarchicus\turn:lsid:marinespecies.org:taxname:104464\t\t\tSpecies\tAnimalia\tCalanus\n"
            + "Emiliania huxleyi\turn:lsid:marinespecies.org:taxname:1000\tGephyrocapsa huxleyi"
            + "\turn:lsid:marinespecies.org:taxname:2000\tSpecies\tChromista\tGephyrocapsa\n";

    @TempDir
    Path tempDir;

    private final LocalReferenceLoader loader = new LocalReferenceLoader(new DefaultResourceLoader(), new ObjectMapper());

    private static TaxonomyProperties.LocalReferenceProperties config(String path, DatasetFormat format) {
        TaxonomyProperties.LocalReferenceProperties cfg = new TaxonomyProperties.LocalReferenceProperties();
        cfg.setEnabled(true);
        cfg.setPath(path);
        cfg.setFormat(format);
        return cfg;
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void loadsTsvAndMatchesCaseInsensitively() throws IOException {
        Path file = write("reference.tsv", TSV);

        LocalReferenceIndex index = loader.load(config(file.toString(), DatasetFormat.TSV));

        assertThat(index.isEnabled()).isTrue();
        assertThat(index.size()).isEqualTo(2);
        MatchResult calanus = index.match("CALANUS_finmarchicus", "key").orElseThrow();
        assertThat(calanus.matchType()).isEqualTo(MatchType.EXACT);
        assertThat(calanus.source()).isEqualTo(MatchSource.LOCAL);
        assertThat(calanus.matchedRank()).isEqualTo("species");
        assertThat(calanus.classification()).containsEntry("genus", "Calanus");
        assertThat(index.lookup("Calanus")).isEmpty();
    }

    @Test
    void acceptedNameMakesASynonymMatch() throws IOException {
        Path file = write("reference.tsv", TSV);

        LocalReferenceIndex index = loader.load(config("file:" + file, DatasetFormat.TSV));

        MatchResult emiliania = index.match("Emiliania huxleyi", "key").orElseThrow();
        assertThat(emiliania.matchType()).isEqualTo(MatchType.ACCEPTED_SYNONYM);
        assertThat(emiliania.matchedName()).isEqualTo("Gephyrocapsa huxleyi");
        assertThat(emiliania.identifier()).isEqualTo("urn:lsid:marinespecies.org:taxname:2000");
    }

    @Test
    void synonymWithoutAcceptedIdTakesTheAcceptedRowIdentifier() throws IOException {
        Path file = write("reference.tsv", "scientificName\tscientificNameID\tacceptedName\ttaxonRank\tgenus\n"
                + "Gephyrocapsa huxleyi\turn:lsid:marinespecies.org:taxname:2000\t\tSpecies\tGephyrocapsa\n"
                + "Emiliania huxleyi\turn:lsid:marinespecies.org:taxname:1000\tGephyrocapsa huxleyi\tSpecies\tEmiliania\n");

        LocalReferenceIndex index = loader.load(config(file.toString(), DatasetFormat.TSV));

        MatchResult emiliania = index.match("Emiliania huxleyi", "key").orElseThrow();
        assertThat(emiliania.matchType()).isEqualTo(MatchType.ACCEPTED_SYNONYM);
        assertThat(emiliania.matchedName()).isEqualTo("Gephyrocapsa huxleyi");
        assertThat(emiliania.identifier()).isEqualTo("urn:lsid:marinespecies.org:taxname:2000");
        assertThat(emiliania.classification()).containsEntry("genus", "Gephyrocapsa");
    }

    @Test
    void synonymWithUnknownAcceptedIdStaysOnItsOwnName() throws IOException {
        Path file = write("reference.tsv", "scientificName\tscientificNameID\tacceptedName\ttaxonRank\n"
                + "Emiliania huxleyi\turn:lsid:marinespecies.org:taxname:1000\tGephyrocapsa huxleyi\tSpecies\n");

        LocalReferenceIndex index = loader.load(config(file.toString(), DatasetFormat.TSV));

        MatchResult emiliania = index.match("Emiliania huxleyi", "key").orElseThrow();
        assertThat(emiliania.matchType()).isEqualTo(MatchType.EXACT);
        assertThat(emiliania.matchedName()).isEqualTo("Emiliania huxleyi");
        assertThat(emiliania.identifier()).isEqualTo("urn:lsid:marinespecies.org:taxname:1000");
    }

    @Test
    void bundledDatasetPairsEveryNameWithItsOwnIdentifier() {
        LocalReferenceIndex index = loader.load(
                config("classpath:reference-data/worms-local-reference.tsv", DatasetFormat.TSV));

        MatchResult emiliania = index.match("Emiliania huxleyi", "key").orElseThrow();
        assertThat(emiliania.matchedName()).isEqualTo("Emiliania huxleyi");
        assertThat(emiliania.identifier()).isEqualTo("urn:lsid:marinespecies.org:taxname:180141");
    }

    @Test
    void readsPr2StyleColumnsFromClasspath() {
        LocalReferenceIndex index = loader.load(config("classpath:reference-data/pr2-reference.tsv", DatasetFormat.TSV));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.lookup("Gadus morhua"))
                .map(LocalReferenceEntry::scientificNameID)
                .contains("urn:lsid:marinespecies.org:taxname:126436");
        assertThat(index.lookup("Calanus finmarchicus").orElseThrow().scientificName()).isEqualTo("Calanus finmarchicus");
    }

    @Test
    void readsJson() throws IOException {
        Path file = write("reference.json", "[{\"scientificName\":\"Gadus morhua\","
                + "\"scientificNameID\":\"urn:lsid:marinespecies.org:taxname:126436\",\"taxonRank\":\"Species\"}]");

        LocalReferenceIndex index = loader.load(config(file.toString(), DatasetFormat.JSON));

        assertThat(index.lookup("gadus morhua")).isPresent();
    }

    @Test
    void acceptsMatchingChecksum() throws Exception {
        Path file = write("reference.tsv", TSV);
        TaxonomyProperties.LocalReferenceProperties cfg = config(file.toString(), DatasetFormat.TSV);
        cfg.setChecksum(sha256(TSV));

        assertThat(loader.load(cfg).size()).isEqualTo(2);
    }

    @Test
    void checksumMismatchIsFatal() throws IOException {
        Path file = write("reference.tsv", TSV);
        TaxonomyProperties.LocalReferenceProperties cfg = config(file.toString(), DatasetFormat.TSV);
        cfg.setChecksum("0000");

        assertThatThrownBy(() -> loader.load(cfg))
                .isInstanceOf(LocalReferenceException.class)
                .hasMessageContaining("Checksum mismatch");
    }

    @Test
    void missingDatasetIsFatal() {
        assertThatThrownBy(() -> loader.load(config(tempDir.resolve("absent.tsv").toString(), DatasetFormat.TSV)))
                .isInstanceOf(LocalReferenceException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> loader.load(config(null, DatasetFormat.TSV)))
                .isInstanceOf(LocalReferenceException.class);
    }

    private static String sha256(String content) throws NoSuchAlgorithmException {
        byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }
}
