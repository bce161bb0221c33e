package com.example.dyncms.access;

/**
 * Lookup into the media library. Uploads and storage of the binaries are handled elsewhere.
 */
public interface MediaAccess {

    boolean exists(String mediaId);
}
