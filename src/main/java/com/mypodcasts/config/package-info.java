/**
 * JSON5 backed configuration.
 */
package com.mypodcasts.config;
