/**
 * Text output for queries: SPARQL serialization and a structure outline.
 */
package com.querysmith.render;
