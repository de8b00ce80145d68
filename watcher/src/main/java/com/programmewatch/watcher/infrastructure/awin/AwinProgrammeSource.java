package com.programmewatch.watcher.infrastructure.awin;

import com.programmewatch.watcher.application.config.AwinProperties;
import com.programmewatch.watcher.domain.exceptions.UpstreamException;
import com.programmewatch.watcher.domain.programme.ProgrammeId;
import com.programmewatch.watcher.domain.programme.ProgrammeSnapshot;
import com.programmewatch.watcher.domain.programme.ProgrammeSource;
import java.time.Clock;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Joined programmes of the publisher per country, from the AWIN publisher API.
 * The payload is decoded against {@link AwinProgramme}; anything else fails fast
 * as a permanent upstream error.
 */
@Slf4j
@RequiredArgsConstructor
public class AwinProgrammeSource implements ProgrammeSource {

    private static final String PROGRAMMES_PATH =
            "/publishers/{publisherId}/programmes?relationship={relationship}&countryCode={countryCode}";
    private static final TypeReference<List<AwinProgramme>> PROGRAMME_LIST = new TypeReference<>() {};

    private final RestClient restClient;
    private final AwinProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ProgrammeSnapshot fetchActive(String marketKey) {
        var programmes = decode(marketKey, download(marketKey));

        var ids = new TreeSet<ProgrammeId>();
        var names = new TreeMap<ProgrammeId, String>();
        for (var programme : programmes) {
            if (programme == null || programme.id() == null || programme.id().isBlank()) {
                throw UpstreamException.schemaMismatch(marketKey, "programme entry without id", null);
            }
            if (!programme.isActive()) {
                continue;
            }
            var id = ProgrammeId.of(programme.id());
            ids.add(id);
            if (programme.name() != null) {
                names.put(id, programme.name());
            }
        }

        log.info("awin.programmes.fetched: market={}, received={}, active={}", marketKey, programmes.size(), ids.size());
        return new ProgrammeSnapshot(marketKey, clock.instant(), ids, names);
    }

    private String download(String marketKey) {
        try {
            return restClient.get()
                    .uri(PROGRAMMES_PATH, properties.publisherId(), properties.relationship(), marketKey)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token())
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw classify(marketKey, e);
        } catch (ResourceAccessException e) {
            throw UpstreamException.transientFailure(
                    marketKey, "AWIN unreachable for market " + marketKey + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw UpstreamException.transientFailure(
                    marketKey, "AWIN request failed for market " + marketKey + ": " + e.getMessage(), e);
        }
    }

    private UpstreamException classify(String marketKey, RestClientResponseException e) {
        var status = e.getStatusCode();
        var message = "AWIN responded " + status.value() + " for market " + marketKey;
        if (status.value() == HttpStatus.UNAUTHORIZED.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
            return UpstreamException.permanentFailure(marketKey, message + " (credentials rejected)", e);
        }
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return UpstreamException.transientFailure(marketKey, message, e);
        }
        return UpstreamException.permanentFailure(marketKey, message, e);
    }

    private List<AwinProgramme> decode(String marketKey, String body) {
        if (body == null || body.isBlank()) {
            throw UpstreamException.schemaMismatch(marketKey, "empty response body", null);
        }
        List<AwinProgramme> programmes;
        try {
            programmes = objectMapper.readValue(body, PROGRAMME_LIST);
        } catch (JacksonException e) {
            throw UpstreamException.schemaMismatch(marketKey, e.getOriginalMessage(), e);
        }
        if (programmes == null) {
            throw UpstreamException.schemaMismatch(marketKey, "null payload", null);
        }
        return programmes;
    }
}
