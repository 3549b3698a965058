/**
 * Typed definition bodies and their canonical JSON encoding.
 *
 * <p>{@link com.ryuqq.semreg.core.definition.Definition} is sealed, with one record per
 * {@link com.ryuqq.semreg.core.model.ObjectType}.
 * {@link com.ryuqq.semreg.core.definition.DefinitionCodec} converts bodies to JSON trees and
 * computes their content hash.</p>
 *
 * @since 1.0.0
 * @author Semantic Registry Team
 */
package com.ryuqq.semreg.core.definition;
