/**
 * Deals with the headers of a MIME message.
 *
 * <ul>
 *   <li>{@link com.mypodcasts.mime.headers.MimeHeader} - Container for individual MIME headers</li>
 *   <li>{@link com.mypodcasts.mime.headers.MimeHeaders} - Container for multiple MIME headers</li>
 * </ul>
 */
package com.mypodcasts.mime.headers;
