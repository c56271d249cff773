package com.scholary.audio.pipeline.objectstore;

import java.nio.file.Path;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the pipeline from a specific storage implementation. The pipeline needs four
 * things: copy an object to a local file, stream a new object of unknown length, check existence
 * and delete.
 */
public interface ObjectStoreClient {

  /**
   * Download an object into a local file, replacing the file if it exists.
   *
   * @throws ObjectStoreException if the object doesn't exist or the download fails
   */
  void download(String bucket, String key, Path target);

  /**
   * Start a streamed upload.
   *
   * @param contentType MIME type of the object
   * @param metadata content disposition and user metadata for the object
   * @return the open upload; the caller must either close its stream or abort it
   */
  ObjectUpload openUpload(String bucket, String key, String contentType, OutputMetadata metadata);

  boolean exists(String bucket, String key);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void delete(String bucket, String key);
}
