package com.scholary.audio.pipeline.document;

import java.util.Map;

/**
 * Access to the per-job status documents.
 *
 * <p>Updates are partial: only the given fields change. Keys may address nested fields with a
 * dot, e.g. {@code status.audioStatus}.
 */
public interface DocumentStore {

  /**
   * Read a document.
   *
   * @throws DocumentStoreException if the store cannot be reached
   */
  DocumentSnapshot get(String id);

  /**
   * Merge fields into a document. A null value removes the field.
   *
   * @throws DocumentStoreException if the write fails
   */
  void update(String id, Map<String, Object> fields);
}
