/**
 * Turns the HTML part of a newsletter into text fit for speech synthesis.
 *
 * <p>Stages, applied in order:
 * <ul>
 *     <li>{@link com.mypodcasts.speech.ContentSelector} - first HTML part, decoded</li>
 *     <li>{@link com.mypodcasts.speech.StructuralCleaner} - prune, annotate and flatten markup</li>
 *     <li>{@link com.mypodcasts.speech.WhitespaceNormalizer} - canonical spacing</li>
 *     <li>{@link com.mypodcasts.speech.FootnoteInliner} - footnotes read where referenced</li>
 * </ul>
 * <p>All stages are stateless and safe to share between threads.
 */
package com.mypodcasts.speech;
