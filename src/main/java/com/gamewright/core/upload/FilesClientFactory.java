package com.gamewright.core.upload;

/**
 * Creates a files client bound to one API key, for one request.
 */
@FunctionalInterface
public interface FilesClientFactory {

    FileBackedProviderClient create(String apiKey);
}
