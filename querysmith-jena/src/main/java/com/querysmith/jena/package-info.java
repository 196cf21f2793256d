/**
 * SPARQL text parsing built on the Apache Jena ARQ syntax tree.
 *
 * @see com.querysmith.jena.SparqlQueryParser
 */
package com.querysmith.jena;
