package com.gamewright.core.model;

/**
 * File metadata as returned by the remote storage API.
 */
public record RemoteFile(String name, String uri, String mimeType, FileState state) {}
