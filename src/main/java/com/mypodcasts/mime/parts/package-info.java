/**
 * MIME part tree.
 *
 * <p>The parser produces one of these per message entity:
 * <ul>
 *   <li>{@link com.mypodcasts.mime.parts.TextMimePart} - text leaves (plain, HTML)</li>
 *   <li>{@link com.mypodcasts.mime.parts.FileMimePart} - non-text leaves</li>
 *   <li>{@link com.mypodcasts.mime.parts.MultipartMimePart} - multipart containers</li>
 *   <li>{@link com.mypodcasts.mime.parts.MessageMimePart} - embedded rfc822 messages</li>
 * </ul>
 */
package com.mypodcasts.mime.parts;
