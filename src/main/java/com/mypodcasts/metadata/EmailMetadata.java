package com.mypodcasts.metadata;

/**
 * Filing metadata of one message.
 *
 * @param date        Calendar date as YYYY-MM-DD or {@link MetadataExtractor#UNKNOWN_DATE}.
 * @param subjectSlug Filesystem safe subject.
 * @param subjectRaw  Decoded, trimmed subject.
 */
public record EmailMetadata(String date, String subjectSlug, String subjectRaw) {
}
