package com.coparent.service.storage;

public interface ObjectStorage {

    /**
     * @return a URL the object can be fetched from
     */
    String store(byte[] content, String folder, String filename, String contentType);

    void delete(String url);

    static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) {
            return "upload";
        }
        return filename.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
