/**
 * Immutable data model shared by the labeling components.
 *
 * <p>All types are Java records or enums, validated in their constructors:
 * <ul>
 *   <li>{@link com.structura.labeling.domain.Paragraph} - upstream paragraph with its
 *       deterministic label</li>
 *   <li>{@link com.structura.labeling.domain.FinalLabelSet} - one label per paragraph plus
 *       diagnostics, the only output of the core</li>
 *   <li>{@link com.structura.labeling.domain.TriggerReport} - why (or why not) the remote
 *       classifier was consulted</li>
 *   <li>{@link com.structura.labeling.domain.FailureClassification} - typed cause of a failed
 *       remote attempt</li>
 * </ul>
 */
package com.structura.labeling.domain;
