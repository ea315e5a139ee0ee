package com.heritagesync.core.publish;

/**
 * Interface for publishers that deliver the validated dataset to its serving locations.
 *
 * <p>A publish is all-or-nothing: either every target of the request holds the new dataset
 * afterwards, or every target holds exactly what it held before and a
 * {@link com.heritagesync.core.exception.PublishException} is thrown.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemPublisher implements DatasetPublisher {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public PublishReport publish(PublishRequest request) {
 *         byte[] content = serializer.serialize(request.sites());
 *         // write temp files, then swap them in
 *     }
 * }
 * }</pre>
 *
 * @see PublishRequest
 * @see PublishReport
 */
public interface DatasetPublisher {

    /**
     * Returns unique identifier for this publisher.
     *
     * <p>Should be lowercase (e.g., "filesystem").
     *
     * @return unique publisher identifier
     */
    String getId();

    /**
     * Publishes the dataset to every target of the request.
     *
     * @param request sites and targets
     * @return written targets with their sizes
     * @throws com.heritagesync.core.exception.PublishException if any target cannot be written;
     *         no target is left modified
     */
    PublishReport publish(PublishRequest request);
}
