package com.mythosmud.socket.http;

import com.google.common.base.Strings;
import io.netty.handler.codec.http.QueryStringDecoder;
import reactor.netty.http.server.HttpServerRequest;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the player id the session layer attached to a request: the {@code X-Player-Id}
 * header, or the {@code playerId} query parameter.
 */
public final class PlayerIdentity {
    public static final String HEADER = "X-Player-Id";
    public static final String QUERY_PARAM = "playerId";

    private PlayerIdentity() {
    }

    public static Optional<String> resolve(HttpServerRequest req) {
        return resolve(req.requestHeaders().get(HEADER), req.uri());
    }

    static Optional<String> resolve(String headerValue, String uri) {
        String header = Strings.emptyToNull(headerValue);
        if (header != null && !header.isBlank()) {
            return Optional.of(header.trim());
        }
        QueryStringDecoder decoder = new QueryStringDecoder(Strings.nullToEmpty(uri));
        return Stream.ofNullable(decoder.parameters().get(QUERY_PARAM))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .map(String::trim)
            .findFirst();
    }
}
