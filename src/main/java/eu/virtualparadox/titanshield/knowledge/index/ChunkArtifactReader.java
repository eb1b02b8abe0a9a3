package eu.virtualparadox.titanshield.knowledge.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSONL chunk artifact produced by the offline enrichment step, one chunk per line.
 * <p>
 * Metadata may sit on the record itself or under a nested {@code metadata} object. Both the enrichment names
 * ({@code valid_from}, {@code expire_at}, {@code province}) and the camel-case ones ({@code validFrom},
 * {@code validUntil}, {@code region}) are accepted. Missing metadata takes the {@link Chunk} defaults.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChunkArtifactReader {

    private final ObjectMapper objectMapper;

    public List<Chunk> read(final Path artifact) throws IOException {
        try (final BufferedReader reader = Files.newBufferedReader(artifact, StandardCharsets.UTF_8)) {
            return read(reader, artifact.getFileName().toString());
        }
    }

    /**
     * @param origin used as default source label and in error messages
     * @throws IOException if a line is not valid JSON or lacks {@code id}/{@code text}
     */
    public List<Chunk> read(final Reader input, final String origin) throws IOException {
        final BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);
        final List<Chunk> chunks = new ArrayList<>();

        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }

            final JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (final IOException e) {
                throw new IOException(origin + ":" + lineNo + " is not valid JSON", e);
            }

            final String id = text(node, "id");
            final String body = text(node, "text");
            if (id == null || body == null) {
                throw new IOException(origin + ":" + lineNo + " lacks 'id' or 'text'");
            }
            if (body.isBlank()) {
                log.warn("Skipping chunk {} with blank text", id);
                continue;
            }

            final JsonNode meta = node.has("metadata") ? node.get("metadata") : node;
            final String source = firstText(meta, node, "source");
            chunks.add(new Chunk(
                    id,
                    body,
                    source == null ? origin : source,
                    DocumentType.fromLabel(firstText(meta, node, "type")),
                    year(meta, Chunk.EARLIEST_YEAR, "validFrom", "valid_from"),
                    year(meta, Chunk.NO_EXPIRY, "validUntil", "expire_at", "valid_until"),
                    firstText(meta, node, "region", "province")));
        }
        return chunks;
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String firstText(final JsonNode meta, final JsonNode root, final String... fields) {
        for (final String field : fields) {
            final String value = text(meta, field);
            if (value != null) {
                return value;
            }
            final String rootValue = text(root, field);
            if (rootValue != null) {
                return rootValue;
            }
        }
        return null;
    }

    private static int year(final JsonNode meta, final int fallback, final String... fields) {
        for (final String field : fields) {
            final JsonNode value = meta.get(field);
            if (value != null && value.canConvertToInt()) {
                return value.asInt();
            }
        }
        return fallback;
    }
}
