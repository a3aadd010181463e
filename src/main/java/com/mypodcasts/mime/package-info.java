/**
 * Everything required for parsing raw newsletter messages.
 *
 * <p>The {@link com.mypodcasts.mime.EmailParser} turns raw bytes into an immutable
 * {@link com.mypodcasts.mime.EmailMessage} part tree.
 * <br>Features include:
 * <ul>
 *     <li>Multi-line header folding</li>
 *     <li>Multipart messages (mixed, related, alternative, digest)</li>
 *     <li>Embedded message/rfc822 parts</li>
 *     <li>Content encodings (Base64, Quoted-Printable)</li>
 * </ul>
 *
 * @see com.mypodcasts.mime.EmailParser
 * @see com.mypodcasts.mime.headers.MimeHeaders
 * @see com.mypodcasts.mime.parts.MimePart
 */
package com.mypodcasts.mime;
