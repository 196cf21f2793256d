/**
 * Structural isomorphism of query patterns.
 *
 * <p>{@link com.querysmith.iso.IsomorphismChecker} compares two pattern trees
 * under variable renaming. Results carry a
 * {@link com.querysmith.iso.Verdict} and, for isomorphic inputs, the witness
 * mapping.</p>
 */
package com.querysmith.iso;
