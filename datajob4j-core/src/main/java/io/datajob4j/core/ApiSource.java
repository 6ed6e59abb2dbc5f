package io.datajob4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.util.Objects;

/**
 * HTTP GET source returning JSON.
 */
public record ApiSource(@JsonProperty("location") String url) implements DataSource {

    public ApiSource {
        Objects.requireNonNull(url, "url must not be null");
        url = url.trim();
        if (url.isEmpty()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("url is not a valid URI: " + url, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("url must use http or https: " + url);
        }
    }

    @Override
    public String location() {
        return url;
    }
}
