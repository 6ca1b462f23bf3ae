package com.chatstore.util;

import com.chatstore.exception.DatabaseConfigurationException;

/**
 * Utility class for normalizing database connection URLs.
 */
public class DatabaseUrlUtil {

    private static final String R2DBC_PREFIX = "r2dbc:";
    private static final String LIBPQ_SSL_MODE = "sslmode=";
    private static final String DRIVER_SSL_MODE = "sslMode=";

    private DatabaseUrlUtil() {
    }

    /**
     * Convert a connection URL into the R2DBC form.
     *
     * Accepts either an R2DBC URL (r2dbc:postgresql://...) or the libpq form
     * (postgres://... or postgresql://...) handed out by hosted Postgres providers.
     *
     * @param url The configured URL
     * @return URL understood by ConnectionFactories
     */
    public static String toR2dbcUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new DatabaseConfigurationException("DATABASE_URL environment variable is not set");
        }
        String trimmed = url.trim();
        if (trimmed.startsWith(R2DBC_PREFIX)) {
            return trimmed;
        }
        if (trimmed.startsWith("postgres://")) {
            trimmed = "postgresql://" + trimmed.substring("postgres://".length());
        }
        if (!trimmed.startsWith("postgresql://")) {
            int schemeEnd = trimmed.indexOf(':');
            String scheme = schemeEnd > 0 ? trimmed.substring(0, schemeEnd) : trimmed;
            throw new DatabaseConfigurationException("Unsupported database URL scheme: " + scheme);
        }
        return R2DBC_PREFIX + renameSslMode(trimmed);
    }

    // Only the query string is touched; credentials and path may contain the same text
    private static String renameSslMode(String url) {
        int query = url.indexOf('?', url.lastIndexOf('@') + 1);
        if (query < 0) {
            return url;
        }
        String[] params = url.substring(query + 1).split("&", -1);
        for (int i = 0; i < params.length; i++) {
            if (params[i].startsWith(LIBPQ_SSL_MODE)) {
                params[i] = DRIVER_SSL_MODE + params[i].substring(LIBPQ_SSL_MODE.length());
            }
        }
        return url.substring(0, query + 1) + String.join("&", params);
    }

    /**
     * Host part of the URL without credentials, for log output.
     *
     * @param url Any supported URL
     * @return Text after the last '@', or "localhost" when the URL has no credentials
     */
    public static String describe(String url) {
        if (url == null) {
            return "";
        }
        int at = url.lastIndexOf('@');
        return at >= 0 ? url.substring(at + 1) : "localhost";
    }
}
