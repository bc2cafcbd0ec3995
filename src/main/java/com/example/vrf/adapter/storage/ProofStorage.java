package com.example.vrf.adapter.storage;

import java.util.Map;

/**
 * Append-only storage for published proof documents.
 */
public interface ProofStorage {

  /**
   * Uploads one document and returns its transaction id.
   *
   * @param document the serialized proof document
   * @param tags     indexing tags stored alongside the document
   * @throws com.example.vrf.exception.StorageException when the upload did not complete
   */
  String upload(byte[] document, Map<String, String> tags);

  /**
   * Public URL under which an uploaded document can be read back.
   */
  String readUrl(String transactionId);

  boolean isConfigured();
}
