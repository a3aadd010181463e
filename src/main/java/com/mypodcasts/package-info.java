/**
 * Newsletter email to speech-ready text processor.
 *
 * <p>The engine lives in {@link com.mypodcasts.processor.EmailProcessor}.
 * <br>{@link com.mypodcasts.Main} wraps it as a command line tool.
 */
package com.mypodcasts;
