/**
 * Checked exceptions raised by the email to speech pipeline.
 */
package com.mypodcasts.exceptions;
