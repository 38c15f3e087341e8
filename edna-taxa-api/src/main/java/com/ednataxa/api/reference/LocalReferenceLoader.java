package com.ednataxa.api.reference;

import com.ednataxa.api.config.DatasetFormat;
import com.ednataxa.api.config.TaxonomyProperties;
import com.ednataxa.api.util.ScientificNames;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the {@link LocalReferenceIndex} from a pre-resolved taxonomy export. Columns are
 * matched case-insensitively; PR2 style {@code species}/{@code worms_id} headers are accepted.
 */
public class LocalReferenceLoader {

    private static final Logger log = LoggerFactory.getLogger(LocalReferenceLoader.class);

    private static final List<String> NAME_COLUMNS = List.of("scientificname", "species", "name");
    private static final List<String> ID_COLUMNS = List.of("scientificnameid", "lsid");
    private static final List<String> APHIA_COLUMNS = List.of("aphiaid", "worms_id");
    private static final List<String> ACCEPTED_ID_COLUMNS = List.of("acceptednameid", "acceptednameusageid");
    private static final List<String> CLASSIFICATION = List.of("kingdom", "phylum", "class", "order", "family", "genus");

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public LocalReferenceLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public LocalReferenceIndex load(TaxonomyProperties.LocalReferenceProperties cfg) {
        String location = cfg.getPath();
        if (location == null || location.isBlank()) {
            throw new LocalReferenceException("taxonomy.local-reference.enabled is true but no path is configured");
        }
        Resource resource = resolve(location);
        if (!resource.exists() || !resource.isReadable()) {
            throw new LocalReferenceException("Local reference dataset " + location + " not found or unreadable");
        }
        if (cfg.getChecksum() != null && !cfg.getChecksum().isBlank()) {
            String actual = computeChecksum(resource, location);
            if (!cfg.getChecksum().equalsIgnoreCase(actual)) {
                throw new LocalReferenceException("Checksum mismatch for local reference dataset " + location
                        + ": expected " + cfg.getChecksum() + " but found " + actual);
            }
        }
        List<Map<String, String>> rows;
        try (InputStream in = resource.getInputStream()) {
            rows = readRows(in, cfg.getFormat());
        } catch (IOException e) {
            throw new LocalReferenceException("Failed to read local reference dataset " + location, e);
        }

        Map<String, LocalReferenceEntry> byName = new LinkedHashMap<>();
        int skipped = 0;
        for (Map<String, String> raw : rows) {
            Map<String, String> row = lowerCaseKeys(raw);
            LocalReferenceEntry entry = toEntry(row);
            String key = entry == null ? null : ScientificNames.normalize(entry.scientificName());
            if (key == null) {
                skipped++;
                continue;
            }
            byName.putIfAbsent(key, entry);
        }
        if (skipped > 0) {
            log.warn("Skipped {} local reference row(s) without a usable name or identifier", skipped);
        }
        log.info("Loaded {} local reference taxa from {}", byName.size(), location);
        return LocalReferenceIndex.of(byName, location);
    }

    private Resource resolve(String location) {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return resourceLoader.getResource(location);
        }
        return new FileSystemResource(location);
    }

    private List<Map<String, String>> readRows(InputStream in, DatasetFormat format) throws IOException {
        if (format == DatasetFormat.JSON) {
            return objectMapper.readValue(in, new TypeReference<List<Map<String, String>>>() {});
        }
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(format == DatasetFormat.TSV ? '\t' : ',');
        if (format == DatasetFormat.TSV) {
            schema = schema.withoutQuoteChar();
        }
        CsvMapper csvMapper = new CsvMapper();
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerForMapOf(String.class).with(schema).readValues(in)) {
            while (it.hasNext()) {
                rows.add(it.next());
            }
        }
        return rows;
    }

    private LocalReferenceEntry toEntry(Map<String, String> row) {
        String name = first(row, NAME_COLUMNS);
        String id = first(row, ID_COLUMNS);
        if (id == null) {
            String aphiaId = first(row, APHIA_COLUMNS);
            if (aphiaId != null && aphiaId.matches("\\d+")) {
                id = "urn:lsid:marinespecies.org:taxname:" + aphiaId;
            }
        }
        if (name == null || id == null) {
            return null;
        }
        Map<String, String> classification = new LinkedHashMap<>();
        for (String rank : CLASSIFICATION) {
            String value = blankToNull(row.get(rank));
            if (value != null) {
                classification.put(rank, value);
            }
        }
        // only the index key is normalized
        return new LocalReferenceEntry(name.replace('_', ' '), id,
                blankToNull(row.get("acceptedname")),
                first(row, ACCEPTED_ID_COLUMNS),
                blankToNull(row.getOrDefault("taxonrank", row.get("rank"))),
                classification);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> row) {
        Map<String, String> out = new LinkedHashMap<>();
        row.forEach((k, v) -> {
            if (k != null) {
                out.put(k.trim().toLowerCase(Locale.ROOT), v);
            }
        });
        return out;
    }

    private static String first(Map<String, String> row, List<String> columns) {
        for (String column : columns) {
            String value = blankToNull(row.get(column));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String computeChecksum(Resource resource, String location) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 digest not available", e);
        }
        try (InputStream in = resource.getInputStream()) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new LocalReferenceException("Failed to checksum local reference dataset " + location, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
