package com.scholary.video2mp3.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction over the bucket that holds converted audio.
 *
 * <p>Jobs only ever store the object key. Readable URLs are minted on demand by {@link
 * #presignRead}, so a link handed to a client always carries a fresh expiry.
 */
public interface ObjectStoreClient {

  /**
   * Upload a local file.
   *
   * @param key the object key
   * @param file the file to upload
   * @param contentType the MIME type stored with the object
   * @return the key the object was stored under
   * @throws ObjectStoreException if the upload fails
   */
  String put(String key, Path file, String contentType);

  /**
   * Generate a presigned GET URL.
   *
   * <p>When {@code filenameHint} is given, the URL also asks the store to answer with an attachment
   * disposition under that name and an {@code audio/mpeg} content type, so browsers save the file
   * instead of playing it.
   *
   * @param key the object key
   * @param ttl how long the URL stays valid
   * @param filenameHint download filename, or {@code null} for a plain read URL
   * @throws ObjectStoreException if signing fails
   */
  URL presignRead(String key, Duration ttl, String filenameHint);

  /**
   * Delete an object. Deleting a key that does not exist is not an error.
   *
   * @throws ObjectStoreException if the store rejects the request
   */
  void delete(String key);
}
