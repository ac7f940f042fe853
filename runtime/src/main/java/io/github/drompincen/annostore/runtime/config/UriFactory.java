package io.github.drompincen.annostore.runtime.config;

import io.github.drompincen.annostore.protocol.api.IndexType;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the externally resolvable URLs handed out for containers, annotations, searches and indexes.
 */
@Component
public class UriFactory {

    private final String baseUrl;

    public UriFactory(StoreSettings settings) {
        String base = settings.externalBaseUrl() != null ? settings.externalBaseUrl() : "";
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    public String containerUrl(String containerName) {
        return baseUrl + "/w3c/" + encode(containerName) + "/";
    }

    public String annotationUrl(String containerName, String annotationName) {
        return baseUrl + "/w3c/" + encode(containerName) + "/" + encode(annotationName);
    }

    public String searchUrl(String containerName, String searchId) {
        return baseUrl + "/services/" + encode(containerName) + "/search/" + searchId;
    }

    public String searchInfoUrl(String containerName, String searchId) {
        return searchUrl(containerName, searchId) + "/info";
    }

    public String indexUrl(String containerName, String field, IndexType type) {
        return baseUrl + "/services/" + encode(containerName) + "/indexes/" + encode(field) + "/" + type.label();
    }

    public String indexStatusUrl(String containerName, String field, IndexType type) {
        return indexUrl(containerName, field, type) + "/status";
    }

    public String globalSearchUrl(String searchId) {
        return baseUrl + "/global/search/" + searchId;
    }

    public String globalSearchStatusUrl(String searchId) {
        return globalSearchUrl(searchId) + "/status";
    }

    public static String pageUrl(String searchUrl, int page) {
        return searchUrl + "?page=" + page;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
