package com.medassist.source;

import com.medassist.config.ReasoningProperties;
import com.medassist.exception.SourceUnavailableException;
import com.medassist.model.EvidenceHit;
import com.medassist.model.EvidenceKind;
import com.medassist.model.EvidenceRef;
import com.medassist.service.TermNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Client for the document retrieval service (chunked guideline PDFs and spreadsheets).
 *
 * The query is rewritten to canonical terms before it leaves the process.
 * A blank {@code medassist.retrieval.url} disables the client.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvidenceCorpusClient {

    public static final String NAME = "evidence-corpus";

    private final WebClient.Builder webClientBuilder;
    private final TermNormalizer termNormalizer;
    private final ReasoningProperties properties;

    public boolean isEnabled() {
        String url = properties.getRetrieval().getUrl();
        return url != null && !url.isBlank();
    }

    /**
     * Ranked hits for a query, best first.
     *
     * @param filters passed through to the retrieval service ({@code source_types}, {@code update_date_after})
     * @throws SourceUnavailableException the service failed or did not answer in time
     */
    public List<EvidenceHit> fetchEvidenceCorpusHits(String query, Map<String, Object> filters) {
        if (!isEnabled() || query == null || query.isBlank()) {
            return List.of();
        }
        String expanded = termNormalizer.expandQuery(query);
        log.debug("Evidence query '{}' expanded to '{}'", query, expanded);

        WebClient client = webClientBuilder.baseUrl(properties.getRetrieval().getUrl()).build();

        Map<String, Object> request = Map.of(
            "query", expanded,
            "topK", properties.getRetrieval().getTopK(),
            "filters", filters != null ? filters : Map.of()
        );

        Map<String, Object> response;
        try {
            response = client.post()
                .uri("/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(Map.class)
                .map(body -> (Map<String, Object>) body)
                .block(timeout());
        } catch (RuntimeException e) {
            log.error("Evidence corpus search failed: {}", e.getMessage());
            throw new SourceUnavailableException(NAME, e.getMessage(), e);
        }

        List<EvidenceHit> hits = toHits(response);
        log.info("Evidence corpus returned {} hits", hits.size());
        return hits;
    }

    static List<EvidenceHit> toHits(Map<String, Object> response) {
        List<EvidenceHit> hits = new ArrayList<>();
        if (response == null || !(response.get("hits") instanceof List<?> rawHits)) {
            return hits;
        }
        for (Object raw : rawHits) {
            if (!(raw instanceof Map<?, ?> hit)) {
                continue;
            }
            Object content = hit.get("content");
            if (content == null) {
                continue;
            }
            double score = hit.get("score") instanceof Number n ? n.doubleValue() : 0.0;
            Map<?, ?> source = hit.get("source") instanceof Map<?, ?> s ? s : Map.of();
            hits.add(new EvidenceHit(content.toString(), new EvidenceRef(EvidenceKind.CORPUS_DOCUMENT, locator(source), null), score));
        }
        hits.sort(Comparator.comparingDouble(EvidenceHit::score).reversed());
        return hits;
    }

    // document#page, or table for structured hits
    private static String locator(Map<?, ?> source) {
        Object file = source.get("file");
        if (file != null) {
            Object page = source.get("page");
            return page != null ? file + "#" + page : file.toString();
        }
        Object table = source.get("table");
        return table != null ? table.toString() : "unknown";
    }

    private Duration timeout() {
        return properties.getSources().getTimeout();
    }
}
