/**
 * Newsletter presets and per source adapters.
 *
 * <p>Turns a {@link com.mypodcasts.processor.ProcessedEmail} into an {@link com.mypodcasts.pipeline.EpisodeDraft}:
 * the preset picks feed and voice, the adapter formats the title, adjusts the body and finds the issue address.
 * <p>Link resolution is the only network access and goes through {@link com.mypodcasts.pipeline.RedirectResolver}.
 */
package com.mypodcasts.pipeline;
