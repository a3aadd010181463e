/**
 * Filing metadata: calendar date and subject slug.
 */
package com.mypodcasts.metadata;
