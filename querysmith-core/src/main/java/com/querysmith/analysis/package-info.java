/**
 * Structural statistics over queries and shape classification of basic
 * graph patterns.
 */
package com.querysmith.analysis;
