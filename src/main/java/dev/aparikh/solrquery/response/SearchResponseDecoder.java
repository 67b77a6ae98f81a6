package dev.aparikh.solrquery.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.solrquery.client.TransportResponse;
import dev.aparikh.solrquery.exception.SolrQueryException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes Solr's JSON response ({@code wt=json}) into a {@link SearchResult}.
 *
 * <p>Documents are bound with Jackson into the caller's {@link SearchDocument} subtype. Blocks
 * Solr did not return ({@code facet_counts}, {@code highlighting}, {@code grouped},
 * {@code moreLikeThis}) decode to null.</p>
 *
 * <p>Thread-safe once constructed.</p>
 */
public class SearchResponseDecoder {

    private static final Logger log = LoggerFactory.getLogger(SearchResponseDecoder.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SearchResponseDecoder() {
        this(new ObjectMapper());
    }

    public SearchResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T extends SearchDocument> SearchResult<T> decode(TransportResponse response, Class<T> type) {
        return decode(response.status(), response.body(), type);
    }

    /**
     * Decodes one response.
     *
     * @param status HTTP status code
     * @param body   response payload
     * @param type   document type to bind each document to
     * @return the decoded result
     * @throws SolrQueryException if the status is not 2xx, the body is not a JSON object, or a
     *                            document cannot be bound to {@code type}
     */
    public <T extends SearchDocument> SearchResult<T> decode(int status, @Nullable String body, Class<T> type) {
        if (status < 200 || status >= 300) {
            throw remoteError(status, body);
        }
        if (body == null || body.isBlank()) {
            throw new SolrQueryException("Solr returned an empty response body", status, body, null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SolrQueryException("Solr response is not valid JSON: " + e.getOriginalMessage(),
                    status, body, null, e);
        }
        if (root == null || !root.isObject()) {
            throw new SolrQueryException("Solr response is not a JSON object", status, body, null);
        }
        Map<String, Object> raw = objectMapper.convertValue(root, MAP_TYPE);
        Decoding<T> decoding = new Decoding<>(type, status, body, raw);

        JsonNode header = root.path("responseHeader");
        int solrStatus = header.isObject() ? header.path("status").asInt(0) : root.path("status").asInt(0);
        int queryTime = header.path("QTime").asInt(0);

        Map<String, GroupedField<T>> grouped = decodeGrouped(root.get("grouped"), decoding);

        DocumentList<T> response;
        JsonNode responseNode = root.get("response");
        if (responseNode != null && responseNode.isObject()) {
            response = decodeDocumentList(responseNode, decoding);
        } else if (grouped != null) {
            response = flatten(grouped);
        } else {
            response = new DocumentList<>(0, 0, null, List.of());
        }

        SearchResult<T> result = new SearchResult<>(
                solrStatus,
                queryTime,
                response.numFound(),
                response.start(),
                response.numFoundExact(),
                response.docs(),
                decodeFacetCounts(root.get("facet_counts")),
                decodeHighlighting(root.get("highlighting")),
                grouped,
                decodeMoreLikeThis(root.get("moreLikeThis"), decoding),
                raw);

        log.debug("Decoded {} of {} documents in {} ms (facets={}, highlighting={}, grouped={})",
                result.docs().size(), result.numFound(), queryTime,
                result.hasFacets(), result.hasHighlighting(), result.isGrouped());
        return result;
    }

    private SolrQueryException remoteError(int status, @Nullable String body) {
        Map<String, Object> parsed = null;
        String detail = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node != null && node.isObject()) {
                    parsed = objectMapper.convertValue(node, MAP_TYPE);
                    JsonNode msg = node.path("error").path("msg");
                    if (msg.isTextual()) {
                        detail = msg.asText();
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("Error payload for HTTP {} is not JSON", status);
            }
            if (detail == null && parsed == null) {
                detail = body;
            }
        }
        log.warn("Solr request failed with HTTP {}: {}", status, detail);
        String message = "Solr request failed with HTTP " + status + (detail != null ? ": " + detail : "");
        return new SolrQueryException(message, status, body, parsed);
    }

    private <T extends SearchDocument> DocumentList<T> decodeDocumentList(JsonNode node, Decoding<T> decoding) {
        JsonNode exact = node.get("numFoundExact");
        List<T> docs = new ArrayList<>();
        for (JsonNode doc : node.path("docs")) {
            docs.add(bind(doc, decoding));
        }
        return new DocumentList<>(
                node.path("numFound").asLong(0),
                node.path("start").asLong(0),
                exact != null && exact.isBoolean() ? exact.booleanValue() : null,
                docs);
    }

    private <T extends SearchDocument> T bind(JsonNode doc, Decoding<T> decoding) {
        try {
            return objectMapper.treeToValue(doc, decoding.type());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String reason = e instanceof JsonProcessingException
                    ? ((JsonProcessingException) e).getOriginalMessage()
                    : e.getMessage();
            throw new SolrQueryException("Cannot bind document to " + decoding.type().getSimpleName() + ": " + reason,
                    decoding.status(), decoding.body(), decoding.raw(), e);
        }
    }

    private <T extends SearchDocument> DocumentList<T> flatten(Map<String, GroupedField<T>> grouped) {
        long numFound = 0;
        List<T> docs = new ArrayList<>();
        for (GroupedField<T> field : grouped.values()) {
            for (Group<T> group : field.groups()) {
                numFound += group.doclist().numFound();
                docs.addAll(group.doclist().docs());
            }
            if (field.doclist() != null) {
                numFound += field.doclist().numFound();
                docs.addAll(field.doclist().docs());
            }
        }
        return new DocumentList<>(numFound, 0, null, docs);
    }

    private <T extends SearchDocument> @Nullable Map<String, GroupedField<T>> decodeGrouped(
            @Nullable JsonNode node, Decoding<T> decoding) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, GroupedField<T>> grouped = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode command = entry.getValue();
            List<Group<T>> groups = new ArrayList<>();
            for (JsonNode group : command.path("groups")) {
                JsonNode value = group.get("groupValue");
                groups.add(new Group<>(
                        value == null || value.isNull() ? null : value.asText(),
                        decodeDocumentList(group.path("doclist"), decoding)));
            }
            JsonNode doclist = command.get("doclist");
            JsonNode ngroups = command.get("ngroups");
            grouped.put(entry.getKey(), new GroupedField<>(
                    command.path("matches").asLong(0),
                    ngroups != null && ngroups.isNumber() ? ngroups.asLong() : null,
                    groups,
                    doclist != null && doclist.isObject() ? decodeDocumentList(doclist, decoding) : null));
        }
        return grouped;
    }

    private <T extends SearchDocument> @Nullable Map<String, DocumentList<T>> decodeMoreLikeThis(
            @Nullable JsonNode node, Decoding<T> decoding) {
        if (node == null || node.isNull()) {
            return null;
        }
        Map<String, DocumentList<T>> similar = new LinkedHashMap<>();
        if (node.isArray()) {
            // json.nl=flat: [id, doclist, id, doclist]
            for (int i = 0; i + 1 < node.size(); i += 2) {
                similar.put(node.get(i).asText(), decodeDocumentList(node.get(i + 1), decoding));
            }
        } else {
            node.fields().forEachRemaining(e -> similar.put(e.getKey(), decodeDocumentList(e.getValue(), decoding)));
        }
        return similar;
    }

    private @Nullable Map<String, Map<String, List<String>>> decodeHighlighting(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, Map<String, List<String>>> highlighting = new LinkedHashMap<>();
        node.fields().forEachRemaining(doc -> {
            Map<String, List<String>> byField = new LinkedHashMap<>();
            doc.getValue().fields().forEachRemaining(field -> {
                List<String> fragments = new ArrayList<>();
                if (field.getValue().isArray()) {
                    field.getValue().forEach(f -> fragments.add(f.asText()));
                } else if (!field.getValue().isNull()) {
                    fragments.add(field.getValue().asText());
                }
                byField.put(field.getKey(), List.copyOf(fragments));
            });
            highlighting.put(doc.getKey(), byField);
        });
        return highlighting;
    }

    private @Nullable FacetCounts decodeFacetCounts(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Map<String, Long> queries = new LinkedHashMap<>();
        node.path("facet_queries").fields()
                .forEachRemaining(e -> queries.put(e.getKey(), e.getValue().asLong()));

        Map<String, List<FacetCount>> fields = new LinkedHashMap<>();
        node.path("facet_fields").fields()
                .forEachRemaining(e -> fields.put(e.getKey(), buckets(e.getValue())));

        Map<String, RangeFacet> ranges = new LinkedHashMap<>();
        node.path("facet_ranges").fields().forEachRemaining(e -> {
            JsonNode range = e.getValue();
            ranges.put(e.getKey(), new RangeFacet(
                    buckets(range.path("counts")),
                    text(range.get("gap")),
                    text(range.get("start")),
                    text(range.get("end")),
                    count(range.get("before")),
                    count(range.get("after")),
                    count(range.get("between"))));
        });

        return new FacetCounts(
                queries,
                fields,
                ranges,
                rawMap(node.get("facet_pivot")),
                rawMap(node.get("facet_intervals")),
                objectMapper.convertValue(node, MAP_TYPE));
    }

    /**
     * Reads buckets from Solr's flat {@code [value, count, value, count]} list, or from a
     * {@code {value: count}} object when {@code json.nl=map}.
     */
    private static List<FacetCount> buckets(JsonNode node) {
        List<FacetCount> buckets = new ArrayList<>();
        if (node.isArray()) {
            for (int i = 0; i + 1 < node.size(); i += 2) {
                buckets.add(new FacetCount(text(node.get(i)), node.get(i + 1).asLong()));
            }
        } else if (node.isObject()) {
            node.fields().forEachRemaining(e -> buckets.add(new FacetCount(e.getKey(), e.getValue().asLong())));
        }
        return List.copyOf(buckets);
    }

    private static @Nullable String text(@Nullable JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static @Nullable Long count(@Nullable JsonNode node) {
        return node != null && node.isNumber() ? node.asLong() : null;
    }

    private Map<String, Object> rawMap(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private record Decoding<T>(Class<T> type, int status, String body, Map<String, Object> raw) {
    }
}
