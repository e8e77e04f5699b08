package com.herzen.rec.ingest;

/**
 * The catalog backend could not be read (I/O failure, non-2xx status or an unreadable body).
 */
public class CatalogUnavailableException extends RuntimeException {
    private final String endpoint;

    public CatalogUnavailableException(String endpoint, String message, Throwable cause) {
        super("Catalog endpoint " + endpoint + " unavailable: " + message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
