package tally.core.model.counter;

import java.util.stream.LongStream;

/**
 * Inclusive range of bucket ids that together cover one window.
 *
 * @param firstBucketId the oldest bucket id in the window
 * @param lastBucketId the bucket id containing "now"
 * @param bucketSizeSeconds the width of each bucket
 */
public record BucketRange(long firstBucketId, long lastBucketId, long bucketSizeSeconds) {

    public BucketRange {
        if (lastBucketId < firstBucketId) {
            throw new IllegalArgumentException(
                    "lastBucketId " + lastBucketId + " precedes firstBucketId " + firstBucketId);
        }
        if (bucketSizeSeconds <= 0) {
            throw new IllegalArgumentException("bucketSizeSeconds must be positive");
        }
    }

    /**
     * Number of buckets read to answer one window query.
     */
    public int size() {
        return Math.toIntExact(lastBucketId - firstBucketId + 1);
    }

    /**
     * Bucket ids in ascending order.
     */
    public LongStream bucketIds() {
        return LongStream.rangeClosed(firstBucketId, lastBucketId);
    }
}
