/**
 * Entry point of the email to speech engine.
 *
 * <p>{@link com.mypodcasts.processor.EmailProcessor} ties parsing, speech cleaning and metadata together
 * into a {@link com.mypodcasts.processor.ProcessedEmail}.
 */
package com.mypodcasts.processor;
