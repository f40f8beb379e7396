package com.baykanat.musicstream.domain.mapper;

import com.baykanat.musicstream.api.dto.PlayEventRequest;
import com.baykanat.musicstream.domain.model.PlayEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.util.Locale;

/** PlayEventRequest → PlayEvent ve Kafka record value → PlayEventRequest dönüşümleri. MapStruct + Jackson. */
@Mapper(componentModel = "spring")
public interface PlayEventMapper {

    String UNKNOWN = "unknown";

    ObjectMapper JSON_MAPPER = new ObjectMapper();

    /** Doğrulanmış isteği kanonik event'e çevirir; eventId ve late normalizer'dan gelir. */
    @Mapping(target = "eventId", source = "eventId")
    @Mapping(target = "late", source = "late")
    @Mapping(target = "userId", source = "request.userId", qualifiedByName = "trim")
    @Mapping(target = "trackId", source = "request.trackId", qualifiedByName = "trim")
    @Mapping(target = "artistId", source = "request.artistId", qualifiedByName = "artistOrUnknown")
    @Mapping(target = "genre", source = "request.genre", qualifiedByName = "normalizeGenre")
    @Mapping(target = "timestamp", source = "request.timestamp", qualifiedByName = "epochToInstant")
    @Mapping(target = "durationPlayedMs", source = "request.durationPlayedMs", defaultValue = "0L")
    @Mapping(target = "device", source = "request.device")
    @Mapping(target = "context", source = "request.context")
    PlayEvent toPlayEvent(PlayEventRequest request, String eventId, boolean late);

    /** Kafka value PlayEventRequest ise döner, değilse Map vb. üzerinden çevirir. */
    default PlayEventRequest fromRecordValue(Object value) {
        if (value instanceof PlayEventRequest request) {
            return request;
        }
        return JSON_MAPPER.convertValue(value, PlayEventRequest.class);
    }

    @Named("trim")
    default String trim(String value) {
        return value == null ? null : value.trim();
    }

    @Named("artistOrUnknown")
    default String artistOrUnknown(String artistId) {
        return artistId == null || artistId.isBlank() ? UNKNOWN : artistId.trim();
    }

    /** Genre küçük harfe çevrilir; boşsa "unknown". */
    @Named("normalizeGenre")
    default String normalizeGenre(String genre) {
        return genre == null || genre.isBlank() ? UNKNOWN : genre.trim().toLowerCase(Locale.ROOT);
    }

    @Named("epochToInstant")
    default Instant epochToInstant(Long epochSeconds) {
        return epochSeconds == null ? null : Instant.ofEpochSecond(epochSeconds);
    }
}
