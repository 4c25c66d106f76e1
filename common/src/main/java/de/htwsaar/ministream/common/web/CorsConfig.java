package de.htwsaar.ministream.common.web;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * CORS für Browser-Player, die Streams und Untertitel von einer anderen Origin laden.
 *
 * <p>Preflight-Requests beantwortet Springs {@link CorsFilter} selbst, alle anderen
 * Requests laufen weiter in die Filterkette.</p>
 */
@Configuration
public class CorsConfig {

    /** Eigene Header, die der Player aus Stream-Antworten lesen darf */
    public static final List<String> EXPOSED_HEADERS =
            List.of("X-Filename", "X-Filesize", "X-Content-Type", "Content-Range", "Accept-Ranges");

    @Value("${streamer.cors.allowed-methods:GET, POST, OPTIONS}")
    private String allowedMethods;

    @Bean
    public CorsFilter corsFilter() {
        return corsFilter(allowedMethods);
    }

    /**
     * Baut den Filter für alle Pfade.
     *
     * @param allowedMethods kommagetrennte HTTP-Methoden
     * @return konfigurierter {@link CorsFilter}
     */
    static CorsFilter corsFilter(String allowedMethods) {
        Objects.requireNonNull(allowedMethods, "allowedMethods must not be null");

        CorsConfiguration config = new CorsConfiguration();
        config.addAllowedOrigin(CorsConfiguration.ALL);
        config.setAllowedMethods(Arrays.stream(allowedMethods.split(","))
                .map(String::trim)
                .filter(m -> !m.isEmpty())
                .toList());
        config.setAllowedHeaders(List.of("Content-Type", "Range"));
        config.setExposedHeaders(EXPOSED_HEADERS);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }
}
